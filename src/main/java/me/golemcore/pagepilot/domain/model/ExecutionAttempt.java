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
 * One execution of a script against one backend. Transitions return new
 * instances; a terminal attempt cannot transition again.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionAttempt {

    int sequence;
    BrowserBackend backend;
    int attemptIndex;
    String script;
    AttemptOutcome outcome;
    FailureKind failureKind;
    String error;
    String reason;
    @Builder.Default
    List<String> logs = List.of();
    @Builder.Default
    List<String> screenshots = List.of();
    Integer exitCode;
    Long pid;
    Instant startedAt;
    Duration elapsed;

    public static ExecutionAttempt pending(int sequence, BrowserBackend backend, int attemptIndex, String script) {
        return ExecutionAttempt.builder()
                .sequence(sequence)
                .backend(backend)
                .attemptIndex(attemptIndex)
                .script(script)
                .outcome(AttemptOutcome.PENDING)
                .build();
    }

    public ExecutionAttempt start(Instant at, long processId) {
        if (outcome != AttemptOutcome.PENDING) {
            throw new IllegalStateException("Attempt " + sequence + " cannot start from " + outcome);
        }
        return toBuilder().outcome(AttemptOutcome.RUNNING).startedAt(at).pid(processId).build();
    }

    public ExecutionAttempt succeed(List<String> logs, List<String> screenshots, Integer exitCode, Duration elapsed) {
        return terminal(AttemptOutcome.SUCCESS, null, null, logs, screenshots, exitCode, elapsed);
    }

    public ExecutionAttempt fail(FailureKind kind, String error, List<String> logs, List<String> screenshots,
            Integer exitCode, Duration elapsed) {
        return terminal(AttemptOutcome.FAILURE, kind, error, logs, screenshots, exitCode, elapsed);
    }

    public ExecutionAttempt timeout(String error, List<String> logs, List<String> screenshots, Duration elapsed) {
        return terminal(AttemptOutcome.TIMEOUT, FailureKind.EXECUTION_TIMEOUT, error, logs, screenshots, null,
                elapsed);
    }

    /**
     * Attaches the normalized failure reason. Only allowed on terminal attempts.
     */
    public ExecutionAttempt withReason(String normalizedReason) {
        if (!outcome.isTerminal()) {
            throw new IllegalStateException("Reason can only be attached to a terminal attempt");
        }
        return toBuilder().reason(normalizedReason).build();
    }

    public boolean isSuccess() {
        return outcome == AttemptOutcome.SUCCESS;
    }

    private ExecutionAttempt terminal(AttemptOutcome terminalOutcome, FailureKind kind, String errorText,
            List<String> logLines, List<String> screenshotPaths, Integer code, Duration took) {
        if (outcome.isTerminal()) {
            throw new IllegalStateException("Attempt " + sequence + " is already " + outcome);
        }
        return toBuilder()
                .outcome(terminalOutcome)
                .failureKind(kind)
                .error(errorText)
                .logs(logLines == null ? List.of() : List.copyOf(logLines))
                .screenshots(screenshotPaths == null ? List.of() : List.copyOf(screenshotPaths))
                .exitCode(code)
                .elapsed(took)
                .build();
    }
}
