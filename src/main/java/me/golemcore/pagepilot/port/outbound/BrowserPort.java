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

import me.golemcore.pagepilot.domain.model.BrowserBackend;

import java.time.Duration;

/**
 * Port for launching browser automation sessions. Each session owns exactly
 * one browser instance and must be closed by its caller.
 */
public interface BrowserPort {

    /**
     * Launch a browser for the given backend.
     *
     * @param backend
     *            engine or branded channel to launch
     * @param defaultTimeout
     *            default timeout applied to navigation and element operations
     * @return a live session
     * @throws BrowserUnavailableException
     *             when the backend cannot be started on this host
     */
    BrowserSession open(BrowserBackend backend, Duration defaultTimeout);
}
