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

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Browser backends the automation layer can launch. {@code CHROME} and
 * {@code MSEDGE} are branded Chromium channels and need the vendor browser
 * installed on the host.
 */
public enum BrowserBackend {

    CHROMIUM("chromium", Engine.CHROMIUM, null),
    CHROME("chrome", Engine.CHROMIUM, "chrome"),
    MSEDGE("msedge", Engine.CHROMIUM, "msedge"),
    FIREFOX("firefox", Engine.FIREFOX, null),
    WEBKIT("webkit", Engine.WEBKIT, null);

    public enum Engine {
        CHROMIUM, FIREFOX, WEBKIT
    }

    private final String id;
    private final Engine engine;
    private final String channel;

    BrowserBackend(String id, Engine engine, String channel) {
        this.id = id;
        this.engine = engine;
        this.channel = channel;
    }

    public String getId() {
        return id;
    }

    public Engine getEngine() {
        return engine;
    }

    /**
     * Playwright channel name, or {@code null} for the bundled engine build.
     */
    public String getChannel() {
        return channel;
    }

    public static BrowserBackend fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Browser backend is required");
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (BrowserBackend backend : values()) {
            if (backend.id.equals(normalized)) {
                return backend;
            }
        }
        if ("edge".equals(normalized)) {
            return MSEDGE;
        }
        String supported = Arrays.stream(values()).map(BrowserBackend::getId).collect(Collectors.joining(", "));
        throw new IllegalArgumentException("Unknown browser backend '" + id + "', supported: " + supported);
    }
}
