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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.pagepilot.domain.model.AcquisitionRequest;
import me.golemcore.pagepilot.domain.model.AcquisitionResult;
import me.golemcore.pagepilot.domain.model.Deadline;
import me.golemcore.pagepilot.domain.model.FailureKind;
import me.golemcore.pagepilot.domain.model.StrategyOutcome;
import me.golemcore.pagepilot.domain.service.FailureReasonNormalizer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tries acquisition strategies in priority order and returns the first
 * success.
 *
 * <p>
 * Strategies run one at a time. A strategy that can hang runs on a bounded
 * worker thread and is waited on for its sub-deadline only; on timeout its
 * cancellation signal is raised, the worker is interrupted and abandoned, and
 * the next strategy starts immediately. A strategy whose minimum budget no
 * longer fits in the remaining time is recorded as not attempted.
 *
 * <p>
 * Instances are created per workflow invocation through
 * {@link StrategyOrchestratorFactory} and must be closed.
 */
@Slf4j
public class StrategyOrchestrator implements AutoCloseable {

    private static final AtomicInteger WORKER_SEQUENCE = new AtomicInteger();

    private final List<AcquisitionStrategy> strategies;
    private final FailureReasonNormalizer normalizer;
    private final Clock clock;
    private final ExecutorService workers;

    public StrategyOrchestrator(List<AcquisitionStrategy> strategies, FailureReasonNormalizer normalizer,
            Clock clock) {
        this.strategies = List.copyOf(strategies);
        this.normalizer = normalizer;
        this.clock = clock;
        this.workers = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "pagepilot-acquire-" + WORKER_SEQUENCE.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public List<String> getStrategyNames() {
        return strategies.stream().map(AcquisitionStrategy::getName).toList();
    }

    public AcquisitionResult acquire(AcquisitionRequest request) {
        String url = PageUrls.requireHttpUrl(request.url());
        return acquire(url, Deadline.after(request.overallDeadline(), clock));
    }

    public AcquisitionResult acquire(String url, Deadline deadline) {
        Instant start = clock.instant();
        List<StrategyOutcome> outcomes = new ArrayList<>();
        log.info("[Acquire] Acquiring {} with {} ({}ms budget)", url, getStrategyNames(),
                deadline.remaining().toMillis());

        for (AcquisitionStrategy strategy : strategies) {
            Duration remaining = deadline.remaining();
            if (deadline.isExpired() || remaining.compareTo(strategy.getMinimumBudget()) < 0) {
                log.info("[Acquire] Skipping {}: {}ms left, needs {}ms", strategy.getName(), remaining.toMillis(),
                        strategy.getMinimumBudget().toMillis());
                outcomes.add(StrategyOutcome.notAttempted(strategy.getName(), remaining));
                continue;
            }
            Duration budget = strategy.allocateBudget(remaining);
            StrategyOutcome outcome = strategy.requiresIsolatedWorker()
                    ? runOnWorker(strategy, url, deadline, budget)
                    : runInline(strategy, url, deadline, budget);
            outcomes.add(outcome);
            if (outcome.isSuccess()) {
                Duration elapsed = Duration.between(start, clock.instant());
                log.info("[Acquire] {} won for {} after {}ms", strategy.getName(), url, elapsed.toMillis());
                return new AcquisitionResult(outcome, outcomes, elapsed);
            }
        }

        Duration elapsed = Duration.between(start, clock.instant());
        AcquisitionResult result = new AcquisitionResult(null, outcomes, elapsed);
        log.warn("[Acquire] All strategies failed for {} after {}ms: {}", url, elapsed.toMillis(),
                result.failureSummary());
        return result;
    }

    private StrategyOutcome runInline(AcquisitionStrategy strategy, String url, Deadline deadline,
            Duration budget) {
        AcquisitionContext context = new AcquisitionContext(deadline.within(budget), new CancellationSignal());
        Instant start = clock.instant();
        try {
            return strategy.acquire(url, context);
        } catch (RuntimeException e) {
            return failure(strategy, FailureKind.STRATEGY_FAILURE, FailureReasonNormalizer.describe(e), start);
        }
    }

    private StrategyOutcome runOnWorker(AcquisitionStrategy strategy, String url, Deadline deadline,
            Duration budget) {
        CancellationSignal cancellation = new CancellationSignal();
        AcquisitionContext context = new AcquisitionContext(deadline.within(budget), cancellation);
        Instant start = clock.instant();
        Future<StrategyOutcome> future = workers.submit(() -> strategy.acquire(url, context));
        try {
            return future.get(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(future, cancellation);
            log.warn("[Acquire] {} did not report within {}ms, moving on", strategy.getName(), budget.toMillis());
            return failure(strategy, FailureKind.STRATEGY_TIMEOUT,
                    "Strategy timed out after " + budget.toMillis() + "ms", start);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return failure(strategy, FailureKind.STRATEGY_FAILURE, FailureReasonNormalizer.describe(cause), start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(future, cancellation);
            return failure(strategy, FailureKind.STRATEGY_FAILURE, "Interrupted while waiting for strategy", start);
        }
    }

    private void abandon(Future<StrategyOutcome> future, CancellationSignal cancellation) {
        cancellation.cancel();
        future.cancel(true);
    }

    private StrategyOutcome failure(AcquisitionStrategy strategy, FailureKind kind, String error, Instant start) {
        return StrategyOutcome.failure(strategy.getName(), kind, error, normalizer.normalize(error),
                Duration.between(start, clock.instant()));
    }

    /**
     * Stops accepting work and interrupts abandoned workers. Does not wait for
     * them.
     */
    @Override
    public void close() {
        List<Runnable> pending = workers.shutdownNow();
        if (!pending.isEmpty()) {
            log.debug("[Acquire] Dropped {} queued acquisition tasks", pending.size());
        }
    }
}
