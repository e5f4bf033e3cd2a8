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
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Result of one acquisition call: the winning outcome, if any, plus every
 * outcome in the order the strategies were considered.
 */
public record AcquisitionResult(StrategyOutcome winner, List<StrategyOutcome> outcomes, Duration elapsed) {

    public AcquisitionResult {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public boolean isSuccess() {
        return winner != null;
    }

    public Optional<PageModel> pageModel() {
        return Optional.ofNullable(winner).map(StrategyOutcome::getPageModel);
    }

    /**
     * One line per strategy, {@code name: reason}. Empty when a strategy won.
     */
    public String failureSummary() {
        if (isSuccess()) {
            return "";
        }
        if (outcomes.isEmpty()) {
            return "No acquisition strategy is enabled";
        }
        return outcomes.stream()
                .map(outcome -> outcome.getStrategyName() + ": " + outcome.getReason())
                .collect(Collectors.joining("; "));
    }
}
