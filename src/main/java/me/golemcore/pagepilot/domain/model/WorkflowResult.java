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
import java.time.Instant;
import java.util.List;

/**
 * Aggregate result of one workflow invocation. When {@code fatalError} is set
 * the workflow could not run at all and no attempt matrix is present.
 */
@Value
@Builder(toBuilder = true)
public class WorkflowResult {

    String workflowId;
    String task;
    String url;
    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    boolean success;
    String winningStrategy;
    StrategyOutcome winningOutcome;
    @Builder.Default
    List<StrategyOutcome> acquisitionOutcomes = List.of();
    String script;
    @Builder.Default
    List<ExecutionAttempt> attempts = List.of();
    Instant startedAt;
    Duration totalElapsed;
    String error;
    String fatalError;

    public boolean isFatal() {
        return fatalError != null;
    }
}
