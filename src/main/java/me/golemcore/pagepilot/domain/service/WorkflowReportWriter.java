package me.golemcore.pagepilot.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.pagepilot.domain.model.ExecutionAttempt;
import me.golemcore.pagepilot.domain.model.StrategyOutcome;
import me.golemcore.pagepilot.domain.model.WorkflowResult;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Serializes a {@link WorkflowResult} into its stable JSON report shape. Page
 * models and scripts are left out; durations are milliseconds.
 */
@Component
@RequiredArgsConstructor
public class WorkflowReportWriter {

    private final ObjectMapper objectMapper;

    public record Report(
            String workflowId,
            String task,
            String url,
            boolean success,
            String winningStrategy,
            long totalElapsedMs,
            Instant startedAt,
            String error,
            String fatalError,
            List<AcquisitionEntry> acquisition,
            List<AttemptEntry> attempts) {
    }

    public record AcquisitionEntry(String strategy, boolean success, String failureKind, String reason,
            long elapsedMs) {
    }

    public record AttemptEntry(
            int sequence,
            String backend,
            int attemptIndex,
            String outcome,
            String failureKind,
            String reason,
            String error,
            Integer exitCode,
            long elapsedMs,
            List<String> logs,
            List<String> screenshots) {
    }

    public String toJson(WorkflowResult result) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toReport(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize workflow report", e);
        }
    }

    public Path write(WorkflowResult result, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, toJson(result), StandardCharsets.UTF_8);
        return target;
    }

    Report toReport(WorkflowResult result) {
        List<AcquisitionEntry> acquisition = result.getAcquisitionOutcomes().stream()
                .map(WorkflowReportWriter::toEntry)
                .toList();
        List<AttemptEntry> attempts = result.getAttempts().stream()
                .map(WorkflowReportWriter::toEntry)
                .toList();
        return new Report(result.getWorkflowId(), result.getTask(), result.getUrl(), result.isSuccess(),
                result.getWinningStrategy(), millis(result.getTotalElapsed()), result.getStartedAt(),
                result.getError(), result.getFatalError(), acquisition, attempts);
    }

    private static AcquisitionEntry toEntry(StrategyOutcome outcome) {
        return new AcquisitionEntry(outcome.getStrategyName(), outcome.isSuccess(),
                outcome.getFailureKind() != null ? outcome.getFailureKind().name() : null, outcome.getReason(),
                millis(outcome.getElapsed()));
    }

    private static AttemptEntry toEntry(ExecutionAttempt attempt) {
        return new AttemptEntry(attempt.getSequence(), attempt.getBackend().getId(), attempt.getAttemptIndex(),
                attempt.getOutcome().name(),
                attempt.getFailureKind() != null ? attempt.getFailureKind().name() : null,
                attempt.getReason(), attempt.getError(), attempt.getExitCode(), millis(attempt.getElapsed()),
                attempt.getLogs(), attempt.getScreenshots());
    }

    private static long millis(Duration duration) {
        return duration != null ? duration.toMillis() : 0;
    }
}
