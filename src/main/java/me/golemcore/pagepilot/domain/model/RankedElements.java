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

import java.util.ArrayList;
import java.util.List;

/**
 * Element candidates grouped by tier, each group in document order, plus the
 * composite automation score.
 */
public record RankedElements(
        List<ElementCandidate> high,
        List<ElementCandidate> medium,
        List<ElementCandidate> low,
        double automationScore) {

    public RankedElements {
        high = high == null ? List.of() : List.copyOf(high);
        medium = medium == null ? List.of() : List.copyOf(medium);
        low = low == null ? List.of() : List.copyOf(low);
    }

    public static RankedElements empty() {
        return new RankedElements(List.of(), List.of(), List.of(), 0.0);
    }

    public List<ElementCandidate> all() {
        List<ElementCandidate> all = new ArrayList<>(high.size() + medium.size() + low.size());
        all.addAll(high);
        all.addAll(medium);
        all.addAll(low);
        return all;
    }
}
