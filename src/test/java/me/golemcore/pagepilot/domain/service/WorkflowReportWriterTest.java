package me.golemcore.pagepilot.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.pagepilot.domain.model.BrowserBackend;
import me.golemcore.pagepilot.domain.model.ExecutionAttempt;
import me.golemcore.pagepilot.domain.model.FailureKind;
import me.golemcore.pagepilot.domain.model.StrategyOutcome;
import me.golemcore.pagepilot.domain.model.WorkflowResult;
import me.golemcore.pagepilot.infrastructure.config.PagePilotConfiguration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowReportWriterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = PagePilotConfiguration.objectMapper();
    private final WorkflowReportWriter writer = new WorkflowReportWriter(objectMapper);

    @Test
    void shouldSerializeAttemptMatrix() throws IOException {
        JsonNode report = objectMapper.readTree(writer.toJson(sampleResult()));

        assertFalse(report.get("success").asBoolean());
        assertEquals("2026-01-01T00:00:00Z", report.get("startedAt").asText());
        assertEquals(1500, report.get("totalElapsedMs").asLong());
        assertEquals("NOT_ATTEMPTED", report.get("acquisition").get(1).get("failureKind").asText());
        JsonNode attempt = report.get("attempts").get(0);
        assertEquals("firefox", attempt.get("backend").asText());
        assertEquals("TIMEOUT", attempt.get("outcome").asText());
        assertEquals("Operation timed out", attempt.get("reason").asText());
        assertFalse(report.has("script"));
    }

    @Test
    void shouldWriteReportFile() throws IOException {
        Path target = writer.write(sampleResult(), tempDir.resolve("reports/run.json"));

        assertEquals("wf-1", objectMapper.readTree(target.toFile()).get("workflowId").asText());
    }

    private static WorkflowResult sampleResult() {
        ExecutionAttempt attempt = ExecutionAttempt.pending(1, BrowserBackend.FIREFOX, 1, "script")
                .start(Instant.parse("2026-01-01T00:00:01Z"), 7L)
                .timeout("Execution timed out after 1000ms", List.of("navigate"), List.of(), Duration.ofSeconds(1))
                .withReason("Operation timed out");
        return WorkflowResult.builder()
                .workflowId("wf-1")
                .task("survey")
                .url("https://example.test")
                .success(false)
                .winningStrategy("browser")
                .acquisitionOutcomes(List.of(
                        StrategyOutcome.success("browser", null, Duration.ofMillis(400)),
                        StrategyOutcome.notAttempted("http-basic", Duration.ZERO)))
                .script("script")
                .attempts(List.of(attempt))
                .startedAt(Instant.parse("2026-01-01T00:00:00Z"))
                .totalElapsed(Duration.ofMillis(1500))
                .error("All execution attempts failed")
                .build();
    }
}
