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

import java.io.IOException;
import java.time.Duration;

/**
 * Port for plain HTTP GET requests used by the static acquisition strategies.
 */
public interface HttpFetchPort {

    /**
     * Fetch a URL, following redirects.
     *
     * @throws IOException
     *             on network errors or when the call timeout elapses
     */
    HttpFetchResponse get(String url, Duration timeout) throws IOException;

    /**
     * A fetcher that keeps cookies across requests and redirects until it is
     * discarded. Every call returns an independent cookie jar.
     */
    HttpFetchPort newSession();
}
