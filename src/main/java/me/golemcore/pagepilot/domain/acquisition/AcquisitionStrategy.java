package me.golemcore.pagepilot.domain.acquisition;

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

import me.golemcore.pagepilot.domain.model.StrategyOutcome;

import java.time.Duration;

/**
 * One method of acquiring a page model. Implementations never throw from
 * {@link #acquire(String, AcquisitionContext)}; every failure comes back as a
 * failed {@link StrategyOutcome}.
 */
public interface AcquisitionStrategy {

    String getName();

    boolean isEnabled();

    /**
     * Fixed cost below which starting the strategy is pointless.
     */
    Duration getMinimumBudget();

    /**
     * Whether the strategy can hang past its own timeouts and must run on a
     * bounded worker thread.
     */
    boolean requiresIsolatedWorker();

    /**
     * Sub-deadline for this strategy given the remaining acquisition budget.
     * Never exceeds {@code remaining}.
     */
    Duration allocateBudget(Duration remaining);

    StrategyOutcome acquire(String url, AcquisitionContext context);
}
