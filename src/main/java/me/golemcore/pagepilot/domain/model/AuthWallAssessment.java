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

import java.util.List;

/**
 * Heuristic verdict on whether a page sits behind a login wall.
 */
public record AuthWallAssessment(boolean detected, int score, double confidence, List<String> indicators) {

    public AuthWallAssessment {
        indicators = indicators == null ? List.of() : List.copyOf(indicators);
    }

    public static AuthWallAssessment none() {
        return new AuthWallAssessment(false, 0, 0.0, List.of());
    }
}
