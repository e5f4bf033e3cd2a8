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
 * Stable failure categories reported on strategy outcomes and execution
 * attempts.
 */
public enum FailureKind {

    /**
     * The overall budget was exhausted before the strategy could start.
     */
    NOT_ATTEMPTED,

    /**
     * The strategy ran but produced no usable page model (network error, non-2xx
     * status, parse failure).
     */
    STRATEGY_FAILURE,

    /**
     * The strategy worker did not report within its sub-deadline.
     */
    STRATEGY_TIMEOUT,

    /**
     * The generated script ran and raised an error.
     */
    EXECUTION_FAILURE,

    /**
     * The sandbox child exceeded its wall-clock budget and was killed.
     */
    EXECUTION_TIMEOUT,

    /**
     * The isolated process or its browser backend could not be started.
     */
    SANDBOX_FAILURE
}
