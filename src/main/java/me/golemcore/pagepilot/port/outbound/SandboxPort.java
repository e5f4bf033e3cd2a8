package me.golemcore.pagepilot.port.outbound;

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

import me.golemcore.pagepilot.domain.model.ExecutionAttempt;

import java.time.Duration;

/**
 * Port for running one execution attempt in an isolated child process.
 */
public interface SandboxPort {

    /**
     * Run a pending attempt to a terminal state. The child process is confirmed
     * terminated before this method returns.
     *
     * @throws SandboxUnavailableException
     *             when no child process can be spawned at all
     */
    ExecutionAttempt run(ExecutionAttempt pending, String url, Duration timeout);

    /**
     * Remove per-attempt working files and prune retained screenshots.
     */
    void cleanup();
}
