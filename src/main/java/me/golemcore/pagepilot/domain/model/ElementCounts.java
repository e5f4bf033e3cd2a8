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

/**
 * Uncapped per-category element counts of a page, taken before extraction caps
 * are applied.
 */
public record ElementCounts(
        int inputs,
        int buttons,
        int forms,
        int selects,
        int textareas,
        int links,
        int images,
        int tables,
        int clickableByAttribute,
        int headings,
        int paragraphs,
        int divs,
        int spans) {

    public static ElementCounts empty() {
        return new ElementCounts(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    public int interactive() {
        return inputs + buttons + selects + textareas + links + clickableByAttribute;
    }
}
