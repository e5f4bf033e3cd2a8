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

import java.util.Locale;
import java.util.Map;

/**
 * Structural snapshot of one element: tag name, visible text and the
 * whitelisted attributes kept by the parser.
 */
public record ElementSnapshot(String tag, String text, Map<String, String> attributes) {

    public ElementSnapshot {
        tag = tag == null ? "" : tag.toLowerCase(Locale.ROOT);
        text = text == null ? "" : text;
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * Attribute value, or an empty string when the attribute is absent.
     */
    public String attribute(String name) {
        return attributes.getOrDefault(name, "");
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }
}
