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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Absolute point in time derived from a budget. Every wait in the acquisition
 * and execution phases is bounded by the remaining time of some deadline.
 */
public final class Deadline {

    private final Clock clock;
    private final Instant expiresAt;

    private Deadline(Clock clock, Instant expiresAt) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public static Deadline after(Duration budget, Clock clock) {
        Duration safeBudget = budget.isNegative() ? Duration.ZERO : budget;
        return new Deadline(clock, clock.instant().plus(safeBudget));
    }

    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    /**
     * Returns a child deadline that never outlives this one.
     */
    public Deadline within(Duration budget) {
        Duration left = remaining();
        Duration effective = budget.compareTo(left) < 0 ? budget : left;
        return after(effective, clock);
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public Clock getClock() {
        return clock;
    }

    @Override
    public String toString() {
        return "Deadline{expiresAt=" + expiresAt + ", remaining=" + remaining().toMillis() + "ms}";
    }
}
