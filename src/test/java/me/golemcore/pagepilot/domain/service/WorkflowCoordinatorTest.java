package me.golemcore.pagepilot.domain.service;

import me.golemcore.pagepilot.domain.acquisition.AcquisitionStrategy;
import me.golemcore.pagepilot.domain.acquisition.StrategyOrchestratorFactory;
import me.golemcore.pagepilot.domain.execution.BackendScriptAdapter;
import me.golemcore.pagepilot.domain.model.AcquisitionRequest;
import me.golemcore.pagepilot.domain.model.AcquisitionResult;
import me.golemcore.pagepilot.domain.model.BrowserBackend;
import me.golemcore.pagepilot.domain.model.ExecutionAttempt;
import me.golemcore.pagepilot.domain.model.ExecutionRequest;
import me.golemcore.pagepilot.domain.model.FailureKind;
import me.golemcore.pagepilot.domain.model.PageModel;
import me.golemcore.pagepilot.domain.model.StrategyOutcome;
import me.golemcore.pagepilot.domain.model.WorkflowRequest;
import me.golemcore.pagepilot.domain.model.WorkflowResult;
import me.golemcore.pagepilot.infrastructure.config.PagePilotProperties;
import me.golemcore.pagepilot.port.outbound.SandboxPort;
import me.golemcore.pagepilot.port.outbound.SandboxUnavailableException;
import me.golemcore.pagepilot.port.outbound.ScriptGeneratorPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WorkflowCoordinatorTest {

    private static final String URL = "https://example.test/login";
    private static final String SCRIPT = "browser.navigate(url)";

    private final Clock clock = Clock.systemUTC();
    private final FailureReasonNormalizer normalizer = new FailureReasonNormalizer();
    private PagePilotProperties properties;
    private ScriptGeneratorPort scriptGenerator;
    private SandboxPort sandbox;
    private AcquisitionStrategy browser;
    private AcquisitionStrategy basic;

    @BeforeEach
    void setUp() {
        properties = new PagePilotProperties();
        properties.getAcquisition().setStrategies(List.of("browser", "http-basic"));
        properties.getExecution().setBackends(List.of("chromium", "firefox"));
        properties.getExecution().setMaxAttemptsPerBackend(2);
        scriptGenerator = mock(ScriptGeneratorPort.class);
        when(scriptGenerator.generate(anyString(), any(PageModel.class))).thenReturn(SCRIPT);
        sandbox = mock(SandboxPort.class);
        browser = strategy("browser");
        basic = strategy("http-basic");
    }

    @Test
    void shouldRunFullWorkflow() {
        givenOutcome(browser, failure("browser"));
        givenOutcome(basic, success("http-basic"));
        when(sandbox.run(any(ExecutionAttempt.class), eq(URL), any(Duration.class)))
                .thenAnswer(invocation -> succeed(invocation.getArgument(0)));

        WorkflowResult result = coordinator().run(request(Duration.ofSeconds(60)));

        assertTrue(result.isSuccess());
        assertFalse(result.isFatal());
        assertEquals("http-basic", result.getWinningStrategy());
        assertEquals(2, result.getAcquisitionOutcomes().size());
        assertEquals(SCRIPT, result.getScript());
        assertEquals(1, result.getAttempts().size());
        assertTrue(result.getAttempts().get(0).getScript().contains(SCRIPT));
        assertNull(result.getError());
        verify(sandbox, times(1)).cleanup();
    }

    @Test
    void shouldReportEveryFailedAttempt() {
        givenOutcome(browser, success("browser"));
        when(sandbox.run(any(ExecutionAttempt.class), eq(URL), any(Duration.class)))
                .thenAnswer(invocation -> fail(invocation.getArgument(0)));

        WorkflowResult result = coordinator().run(request(Duration.ofSeconds(60)));

        assertFalse(result.isSuccess());
        assertFalse(result.isFatal());
        assertEquals(4, result.getAttempts().size());
        assertTrue(result.getError().startsWith("All execution attempts failed: chromium#1 FAILURE"));
        verify(sandbox, times(1)).cleanup();
    }

    @Test
    void shouldStopWhenAcquisitionFails() {
        givenOutcome(browser, failure("browser"));
        givenOutcome(basic, failure("http-basic"));

        WorkflowResult result = coordinator().run(request(Duration.ofSeconds(60)));

        assertFalse(result.isSuccess());
        assertFalse(result.isFatal());
        assertEquals("Page acquisition failed: browser: Connection refused by server; "
                + "http-basic: Connection refused by server", result.getError());
        verify(scriptGenerator, never()).generate(anyString(), any());
        verify(sandbox, never()).run(any(), any(), any());
        verify(sandbox, times(1)).cleanup();
    }

    @Test
    void shouldFailFatallyOnExhaustedDeadline() {
        WorkflowResult result = coordinator().run(request(Duration.ZERO));

        assertTrue(result.isFatal());
        assertEquals("Overall deadline already exceeded", result.getFatalError());
        assertTrue(result.getAttempts().isEmpty());
        verify(browser, never()).acquire(anyString(), any());
        verify(sandbox, times(1)).cleanup();
    }

    @Test
    void shouldFailFatallyWhenSandboxCannotSpawn() {
        givenOutcome(browser, success("browser"));
        when(sandbox.run(any(ExecutionAttempt.class), eq(URL), any(Duration.class)))
                .thenThrow(new SandboxUnavailableException("Cannot spawn sandbox process",
                        new IOException("error=2, No such file or directory")));

        WorkflowResult result = coordinator().run(request(Duration.ofSeconds(60)));

        assertTrue(result.isFatal());
        assertEquals("Sandbox unavailable: Required file not found", result.getFatalError());
        assertTrue(result.getAttempts().isEmpty());
        assertEquals("browser", result.getWinningStrategy());
        verify(sandbox, times(1)).cleanup();
    }

    @Test
    void shouldReportScriptGenerationFailure() {
        givenOutcome(browser, success("browser"));
        when(scriptGenerator.generate(anyString(), any(PageModel.class)))
                .thenThrow(new IllegalStateException("template broken"));

        WorkflowResult result = coordinator().run(request(Duration.ofSeconds(60)));

        assertFalse(result.isSuccess());
        assertEquals("Script generation failed: IllegalStateException: template broken", result.getError());
        verify(sandbox, times(1)).cleanup();
    }

    @Test
    void shouldSurviveCleanupFailure() {
        givenOutcome(browser, success("browser"));
        when(sandbox.run(any(ExecutionAttempt.class), eq(URL), any(Duration.class)))
                .thenAnswer(invocation -> succeed(invocation.getArgument(0)));
        doThrow(new IllegalStateException("disk gone")).when(sandbox).cleanup();

        WorkflowResult result = coordinator().run(request(Duration.ofSeconds(60)));

        assertTrue(result.isSuccess());
    }

    @Test
    void shouldGiveAcquisitionOnlyItsShareOfDeadline() {
        properties.getWorkflow().setAcquisitionShare(0.25);
        givenOutcome(browser, failure("browser"));
        givenOutcome(basic, failure("http-basic"));

        coordinator().run(request(Duration.ofSeconds(40)));

        verify(browser).allocateBudget(argThat(
                remaining -> remaining.compareTo(Duration.ofSeconds(10)) <= 0));
    }

    @Test
    void shouldUseRequestedBackendsAndAttempts() {
        givenOutcome(browser, success("browser"));
        when(sandbox.run(any(ExecutionAttempt.class), eq(URL), any(Duration.class)))
                .thenAnswer(invocation -> fail(invocation.getArgument(0)));

        WorkflowResult result = coordinator().run(WorkflowRequest.builder()
                .task("test")
                .url(URL)
                .overallDeadline(Duration.ofSeconds(60))
                .backends(List.of(BrowserBackend.WEBKIT))
                .maxAttemptsPerBackend(3)
                .build());

        assertEquals(3, result.getAttempts().size());
        assertTrue(result.getAttempts().stream().allMatch(a -> a.getBackend() == BrowserBackend.WEBKIT));
    }

    @Test
    void shouldRejectInvalidUrl() {
        WorkflowCoordinator coordinator = coordinator();
        WorkflowRequest request = WorkflowRequest.builder().task("t").url("javascript:alert(1)").build();

        assertThrows(IllegalArgumentException.class, () -> coordinator.run(request));
    }

    @Test
    void shouldExecuteScriptDirectly() {
        when(sandbox.run(any(ExecutionAttempt.class), eq(URL), any(Duration.class)))
                .thenAnswer(invocation -> succeed(invocation.getArgument(0)));

        WorkflowResult result = coordinator().execute(new ExecutionRequest(SCRIPT, URL,
                List.of(BrowserBackend.CHROMIUM), 1, Duration.ofSeconds(30)));

        assertTrue(result.isSuccess());
        assertEquals(1, result.getAttempts().size());
        verify(sandbox, times(1)).cleanup();
    }

    @Test
    void shouldAcquireWithoutExecuting() {
        givenOutcome(browser, success("browser"));

        AcquisitionResult result = coordinator().acquire(new AcquisitionRequest(URL, Duration.ofSeconds(10)));

        assertTrue(result.isSuccess());
        verify(sandbox, never()).cleanup();
    }

    private WorkflowCoordinator coordinator() {
        StrategyOrchestratorFactory factory = new StrategyOrchestratorFactory(List.of(browser, basic), properties,
                normalizer, clock);
        return new WorkflowCoordinator(factory, scriptGenerator, sandbox, new BackendScriptAdapter(), normalizer,
                properties, clock);
    }

    private static WorkflowRequest request(Duration deadline) {
        return WorkflowRequest.builder().task("Test the login form").url(URL).overallDeadline(deadline).build();
    }

    private static AcquisitionStrategy strategy(String name) {
        AcquisitionStrategy strategy = mock(AcquisitionStrategy.class);
        when(strategy.getName()).thenReturn(name);
        when(strategy.isEnabled()).thenReturn(true);
        when(strategy.getMinimumBudget()).thenReturn(Duration.ZERO);
        when(strategy.requiresIsolatedWorker()).thenReturn(false);
        when(strategy.allocateBudget(any(Duration.class))).thenAnswer(invocation -> invocation.getArgument(0));
        return strategy;
    }

    private static void givenOutcome(AcquisitionStrategy strategy, StrategyOutcome outcome) {
        when(strategy.acquire(anyString(), any())).thenReturn(outcome);
    }

    private static StrategyOutcome success(String name) {
        return StrategyOutcome.success(name, PageModel.builder().title("Login").url(URL).build(), Duration.ZERO);
    }

    private static StrategyOutcome failure(String name) {
        return StrategyOutcome.failure(name, FailureKind.STRATEGY_FAILURE, "ERR_CONNECTION_REFUSED",
                "Connection refused by server", Duration.ZERO);
    }

    private static ExecutionAttempt succeed(ExecutionAttempt pending) {
        return pending.start(Instant.now(), 1L).succeed(List.of("ok"), List.of(), 0, Duration.ofMillis(10));
    }

    private static ExecutionAttempt fail(ExecutionAttempt pending) {
        return pending.start(Instant.now(), 1L).fail(FailureKind.EXECUTION_FAILURE, "AssertionError: nope",
                List.of(), List.of(), 1, Duration.ofMillis(10));
    }
}
