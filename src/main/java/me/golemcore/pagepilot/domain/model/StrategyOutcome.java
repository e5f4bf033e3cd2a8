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

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Tagged result of one acquisition strategy. Created once per considered
 * strategy and never mutated.
 */
@Value
@Builder
public class StrategyOutcome {

    String strategyName;
    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    boolean success;
    FailureKind failureKind;
    PageModel pageModel;
    String error;
    String reason;
    Duration elapsed;

    public static StrategyOutcome success(String strategyName, PageModel pageModel, Duration elapsed) {
        return StrategyOutcome.builder()
                .strategyName(strategyName)
                .success(true)
                .pageModel(pageModel)
                .elapsed(elapsed)
                .build();
    }

    public static StrategyOutcome failure(String strategyName, FailureKind kind, String error, String reason,
            Duration elapsed) {
        return StrategyOutcome.builder()
                .strategyName(strategyName)
                .success(false)
                .failureKind(kind)
                .error(error)
                .reason(reason)
                .elapsed(elapsed)
                .build();
    }

    public static StrategyOutcome notAttempted(String strategyName, Duration remaining) {
        String message = "Not attempted: " + remaining.toMillis() + "ms left in the acquisition budget";
        return StrategyOutcome.builder()
                .strategyName(strategyName)
                .success(false)
                .failureKind(FailureKind.NOT_ATTEMPTED)
                .error(message)
                .reason("not attempted - budget exhausted")
                .elapsed(Duration.ZERO)
                .build();
    }

    public boolean isAttempted() {
        return failureKind != FailureKind.NOT_ATTEMPTED;
    }
}
