package me.golemcore.pagepilot.domain.execution;

import me.golemcore.pagepilot.domain.model.AttemptOutcome;
import me.golemcore.pagepilot.domain.model.BrowserBackend;
import me.golemcore.pagepilot.domain.model.ExecutionAttempt;
import me.golemcore.pagepilot.domain.model.ExecutionReport;
import me.golemcore.pagepilot.domain.model.ExecutionRequest;
import me.golemcore.pagepilot.domain.model.FailureKind;
import me.golemcore.pagepilot.domain.service.FailureReasonNormalizer;
import me.golemcore.pagepilot.port.outbound.SandboxPort;
import me.golemcore.pagepilot.port.outbound.SandboxUnavailableException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionControllerTest {

    private static final String URL = "https://example.test/";
    private static final List<BrowserBackend> BACKENDS = List.of(BrowserBackend.CHROMIUM, BrowserBackend.FIREFOX);

    private final Clock clock = Clock.systemUTC();

    @Test
    void shouldRecordEveryAttemptWhenAllFail() {
        RecordingSandbox sandbox = new RecordingSandbox(pending -> running(pending)
                .fail(FailureKind.EXECUTION_FAILURE, "AssertionError: title mismatch", List.of("log"), List.of(), 1,
                        Duration.ofMillis(5)));

        ExecutionReport report = controller(sandbox).execute(new ExecutionRequest("println 'hi'", URL, BACKENDS, 2,
                null));

        assertFalse(report.isSuccess());
        assertEquals(4, report.attempts().size());
        assertTrue(report.attempts().stream().allMatch(a -> a.getOutcome() == AttemptOutcome.FAILURE));
        assertEquals(List.of(BrowserBackend.CHROMIUM, BrowserBackend.CHROMIUM, BrowserBackend.FIREFOX,
                BrowserBackend.FIREFOX), report.attempts().stream().map(ExecutionAttempt::getBackend).toList());
        assertEquals(List.of(1, 2, 3, 4), report.attempts().stream().map(ExecutionAttempt::getSequence).toList());
        assertEquals("AssertionError: title mismatch", report.attempts().get(0).getReason());
    }

    @Test
    void shouldStopAtFirstSuccess() {
        RecordingSandbox sandbox = new RecordingSandbox(pending -> pending.getSequence() < 3
                ? running(pending).timeout("Execution timed out after 10ms", List.of(), List.of(), Duration.ZERO)
                : running(pending).succeed(List.of("done"), List.of(), 0, Duration.ofMillis(5)));

        ExecutionReport report = controller(sandbox).execute(new ExecutionRequest("println 'hi'", URL, BACKENDS, 2,
                Duration.ofMinutes(1)));

        assertTrue(report.isSuccess());
        assertEquals(3, report.attempts().size());
        assertEquals(AttemptOutcome.TIMEOUT, report.attempts().get(0).getOutcome());
        assertEquals("Operation timed out", report.attempts().get(0).getReason());
        ExecutionAttempt winner = report.attempts().get(2);
        assertEquals(BrowserBackend.FIREFOX, winner.getBackend());
        assertEquals(1, winner.getAttemptIndex());
        assertNull(winner.getReason());
    }

    @Test
    void shouldAdaptScriptForEachBackend() {
        RecordingSandbox sandbox = new RecordingSandbox(pending -> running(pending)
                .fail(FailureKind.EXECUTION_FAILURE, "boom", List.of(), List.of(), 1, Duration.ZERO));

        controller(sandbox).execute(new ExecutionRequest("```groovy\nprintln 'x'\n```", URL, BACKENDS, 1, null));

        assertTrue(sandbox.scripts.get(0).startsWith(BackendScriptAdapter.HEADER_PREFIX + "chromium"));
        assertTrue(sandbox.scripts.get(1).startsWith(BackendScriptAdapter.HEADER_PREFIX + "firefox"));
        assertFalse(sandbox.scripts.get(1).contains("```"));
    }

    @Test
    void shouldPropagateSandboxUnavailable() {
        RecordingSandbox sandbox = new RecordingSandbox(pending -> {
            throw new SandboxUnavailableException("Cannot start child JVM", new IOException("No such file"));
        });
        ExecutionController controller = controller(sandbox);
        ExecutionRequest request = new ExecutionRequest("println 'hi'", URL, BACKENDS, 2, null);

        assertThrows(SandboxUnavailableException.class, () -> controller.execute(request));
        assertEquals(1, sandbox.scripts.size());
    }

    @Test
    void shouldKeepEarlierAttemptsWhenLaterSpawnFails() {
        RecordingSandbox sandbox = new RecordingSandbox(pending -> {
            if (pending.getSequence() == 2) {
                throw new SandboxUnavailableException("Cannot spawn sandbox process",
                        new IOException("error=11, Resource temporarily unavailable"));
            }
            return running(pending).fail(FailureKind.EXECUTION_FAILURE, "boom", List.of("first log"), List.of(), 1,
                    Duration.ofMillis(5));
        });

        ExecutionReport report = controller(sandbox).execute(new ExecutionRequest("println 'hi'", URL, BACKENDS, 2,
                null));

        assertEquals(4, report.attempts().size());
        assertEquals(List.of("first log"), report.attempts().get(0).getLogs());
        ExecutionAttempt unspawned = report.attempts().get(1);
        assertEquals(AttemptOutcome.FAILURE, unspawned.getOutcome());
        assertEquals(FailureKind.SANDBOX_FAILURE, unspawned.getFailureKind());
        assertTrue(unspawned.getError().startsWith("SandboxUnavailableException: Cannot spawn sandbox process"),
                unspawned.getError());
        assertEquals(FailureKind.EXECUTION_FAILURE, report.attempts().get(2).getFailureKind());
    }

    @Test
    void shouldRecordUnexpectedSandboxErrorsAsFailedAttempts() {
        RecordingSandbox sandbox = new RecordingSandbox(pending -> {
            throw new IllegalStateException("disk full");
        });

        ExecutionReport report = controller(sandbox).execute(new ExecutionRequest("println 'hi'", URL,
                List.of(BrowserBackend.WEBKIT), 2, null));

        assertEquals(2, report.attempts().size());
        assertEquals(FailureKind.SANDBOX_FAILURE, report.attempts().get(0).getFailureKind());
        assertEquals("IllegalStateException: disk full", report.attempts().get(0).getReason());
    }

    @Test
    void shouldFailNonTerminalResults() {
        RecordingSandbox sandbox = new RecordingSandbox(ExecutionControllerTest::running);

        ExecutionReport report = controller(sandbox).execute(new ExecutionRequest("println 'hi'", URL,
                List.of(BrowserBackend.CHROMIUM), 1, null));

        assertEquals(AttemptOutcome.FAILURE, report.attempts().get(0).getOutcome());
        assertEquals(FailureKind.SANDBOX_FAILURE, report.attempts().get(0).getFailureKind());
    }

    @Test
    void shouldNotStartAttemptsOnceDeadlineExpired() {
        RecordingSandbox sandbox = new RecordingSandbox(pending -> running(pending)
                .fail(FailureKind.EXECUTION_FAILURE, "boom", List.of(), List.of(), 1, Duration.ZERO));

        ExecutionReport report = controller(sandbox).execute(new ExecutionRequest("println 'hi'", URL, BACKENDS, 2,
                Duration.ZERO));

        assertTrue(report.attempts().isEmpty());
        assertFalse(report.isSuccess());
    }

    @Test
    void shouldBoundAttemptTimeoutByDeadline() {
        RecordingSandbox sandbox = new RecordingSandbox(pending -> running(pending)
                .succeed(List.of(), List.of(), 0, Duration.ZERO));

        controller(sandbox).execute(new ExecutionRequest("println 'hi'", URL, BACKENDS, 1, Duration.ofSeconds(2)));

        assertTrue(sandbox.timeouts.get(0).compareTo(Duration.ofSeconds(2)) <= 0);
    }

    private ExecutionController controller(SandboxPort sandbox) {
        return new ExecutionController(sandbox, new BackendScriptAdapter(), new FailureReasonNormalizer(), clock,
                Duration.ofSeconds(30));
    }

    private static ExecutionAttempt running(ExecutionAttempt pending) {
        return pending.start(Instant.now(), 100L + pending.getSequence());
    }

    private static final class RecordingSandbox implements SandboxPort {

        private final Function<ExecutionAttempt, ExecutionAttempt> behavior;
        private final List<String> scripts = new ArrayList<>();
        private final List<Duration> timeouts = new ArrayList<>();

        RecordingSandbox(Function<ExecutionAttempt, ExecutionAttempt> behavior) {
            this.behavior = behavior;
        }

        @Override
        public ExecutionAttempt run(ExecutionAttempt pending, String url, Duration timeout) {
            scripts.add(pending.getScript());
            timeouts.add(timeout);
            return behavior.apply(pending);
        }

        @Override
        public void cleanup() {
            // nothing retained between runs
        }
    }
}
