package me.golemcore.pagepilot.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.time.Duration;
import java.util.List;

/**
 * Request to run one script against the given backends. A {@code null}
 * deadline means the configured per-attempt timeouts are the only bound.
 */
public record ExecutionRequest(
        String script,
        String url,
        List<BrowserBackend> backends,
        int maxAttemptsPerBackend,
        Duration deadline) {

    public ExecutionRequest {
        if (script == null || script.isBlank()) {
            throw new IllegalArgumentException("script is required");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        if (backends == null || backends.isEmpty()) {
            throw new IllegalArgumentException("at least one backend is required");
        }
        if (maxAttemptsPerBackend < 1) {
            throw new IllegalArgumentException("maxAttemptsPerBackend must be >= 1");
        }
        backends = List.copyOf(backends);
    }
}
