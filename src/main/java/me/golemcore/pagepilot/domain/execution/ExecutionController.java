package me.golemcore.pagepilot.domain.execution;

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
import me.golemcore.pagepilot.domain.acquisition.PageUrls;
import me.golemcore.pagepilot.domain.model.BrowserBackend;
import me.golemcore.pagepilot.domain.model.Deadline;
import me.golemcore.pagepilot.domain.model.ExecutionAttempt;
import me.golemcore.pagepilot.domain.model.ExecutionReport;
import me.golemcore.pagepilot.domain.model.ExecutionRequest;
import me.golemcore.pagepilot.domain.model.FailureKind;
import me.golemcore.pagepilot.domain.service.FailureReasonNormalizer;
import me.golemcore.pagepilot.port.outbound.SandboxPort;
import me.golemcore.pagepilot.port.outbound.SandboxUnavailableException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a script across the backend x attempt matrix in the sandbox.
 *
 * <p>
 * Backends are tried in order, each up to {@code maxAttemptsPerBackend} times.
 * The controller stops at the first successful attempt. A failed attempt never
 * aborts the loop. {@link SandboxUnavailableException} propagates only when it
 * is raised by the first attempt; later spawn failures are recorded as
 * {@code SANDBOX_FAILURE} attempts.
 */
@Slf4j
public class ExecutionController {

    private final SandboxPort sandbox;
    private final BackendScriptAdapter scriptAdapter;
    private final FailureReasonNormalizer normalizer;
    private final Clock clock;
    private final Duration attemptTimeout;

    public ExecutionController(SandboxPort sandbox, BackendScriptAdapter scriptAdapter,
            FailureReasonNormalizer normalizer, Clock clock, Duration attemptTimeout) {
        this.sandbox = sandbox;
        this.scriptAdapter = scriptAdapter;
        this.normalizer = normalizer;
        this.clock = clock;
        this.attemptTimeout = attemptTimeout;
    }

    public ExecutionReport execute(ExecutionRequest request) {
        String url = PageUrls.requireHttpUrl(request.url());
        Deadline deadline = request.deadline() != null ? Deadline.after(request.deadline(), clock) : null;
        Instant start = clock.instant();
        List<ExecutionAttempt> attempts = new ArrayList<>();
        int sequence = 0;

        for (BrowserBackend backend : request.backends()) {
            String script = scriptAdapter.adapt(request.script(), backend);
            for (int index = 1; index <= request.maxAttemptsPerBackend(); index++) {
                if (deadline != null && deadline.isExpired()) {
                    log.warn("[Sandbox] Execution budget exhausted after {} attempts", attempts.size());
                    return new ExecutionReport(attempts, Duration.between(start, clock.instant()));
                }
                ExecutionAttempt pending = ExecutionAttempt.pending(++sequence, backend, index, script);
                ExecutionAttempt finished = runAttempt(pending, url, timeoutFor(deadline), attempts.isEmpty());
                attempts.add(finished);
                if (finished.isSuccess()) {
                    log.info("[Sandbox] Attempt {} ({} #{}) succeeded", finished.getSequence(), backend.getId(),
                            index);
                    return new ExecutionReport(attempts, Duration.between(start, clock.instant()));
                }
                log.warn("[Sandbox] Attempt {} ({} #{}) ended {}: {}", finished.getSequence(), backend.getId(), index,
                        finished.getOutcome(), finished.getReason());
            }
        }
        log.warn("[Sandbox] All {} attempts failed", attempts.size());
        return new ExecutionReport(attempts, Duration.between(start, clock.instant()));
    }

    private ExecutionAttempt runAttempt(ExecutionAttempt pending, String url, Duration timeout, boolean first) {
        ExecutionAttempt finished;
        try {
            finished = sandbox.run(pending, url, timeout);
        } catch (SandboxUnavailableException e) {
            if (first) {
                throw e;
            }
            log.error("[Sandbox] Attempt {} could not spawn: {}", pending.getSequence(), e.getMessage());
            finished = pending.fail(FailureKind.SANDBOX_FAILURE, FailureReasonNormalizer.describe(e), List.of(),
                    List.of(), null, Duration.ZERO);
        } catch (RuntimeException e) {
            log.error("[Sandbox] Attempt {} could not run: {}", pending.getSequence(), e.getMessage(), e);
            finished = pending.fail(FailureKind.SANDBOX_FAILURE, FailureReasonNormalizer.describe(e), List.of(),
                    List.of(), null, Duration.ZERO);
        }
        if (!finished.getOutcome().isTerminal()) {
            finished = finished.fail(FailureKind.SANDBOX_FAILURE, "Sandbox returned a non-terminal attempt",
                    finished.getLogs(), finished.getScreenshots(), finished.getExitCode(), finished.getElapsed());
        }
        if (finished.isSuccess()) {
            return finished;
        }
        return finished.withReason(normalizer.normalize(finished.getError()));
    }

    private Duration timeoutFor(Deadline deadline) {
        if (deadline == null) {
            return attemptTimeout;
        }
        Duration remaining = deadline.remaining();
        return remaining.compareTo(attemptTimeout) < 0 ? remaining : attemptTimeout;
    }
}
