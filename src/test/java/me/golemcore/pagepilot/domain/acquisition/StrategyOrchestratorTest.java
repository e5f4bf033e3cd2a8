package me.golemcore.pagepilot.domain.acquisition;

import me.golemcore.pagepilot.domain.model.AcquisitionRequest;
import me.golemcore.pagepilot.domain.model.AcquisitionResult;
import me.golemcore.pagepilot.domain.model.Deadline;
import me.golemcore.pagepilot.domain.model.FailureKind;
import me.golemcore.pagepilot.domain.model.PageModel;
import me.golemcore.pagepilot.domain.model.StrategyOutcome;
import me.golemcore.pagepilot.domain.service.FailureReasonNormalizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

import static org.junit.jupiter.api.Assertions.*;

class StrategyOrchestratorTest {

    private static final String URL = "https://example.test/";

    private final Clock clock = Clock.systemUTC();
    private final FailureReasonNormalizer normalizer = new FailureReasonNormalizer();
    private StrategyOrchestrator orchestrator;

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.close();
        }
    }

    @Test
    void shouldFallBackToNextStrategyAndStopAtFirstSuccess() {
        FakeStrategy browser = FakeStrategy.failing("browser", true);
        FakeStrategy session = FakeStrategy.succeeding("http-session");
        FakeStrategy basic = FakeStrategy.succeeding("http-basic");
        orchestrator = new StrategyOrchestrator(List.of(browser, session, basic), normalizer, clock);

        AcquisitionResult result = orchestrator.acquire(new AcquisitionRequest(URL, Duration.ofSeconds(10)));

        assertTrue(result.isSuccess());
        assertEquals("http-session", result.winner().getStrategyName());
        assertEquals(2, result.outcomes().size());
        assertEquals(FailureKind.STRATEGY_FAILURE, result.outcomes().get(0).getFailureKind());
        assertEquals(0, basic.calls.get());
        assertEquals("Fake", result.pageModel().orElseThrow().getTitle());
    }

    @Test
    void shouldMarkStrategiesNotAttemptedWhenBudgetIsTooSmall() {
        FakeStrategy browser = FakeStrategy.succeeding("browser").withMinimumBudget(Duration.ofSeconds(3));
        FakeStrategy basic = FakeStrategy.failing("http-basic", false);
        orchestrator = new StrategyOrchestrator(List.of(browser, basic), normalizer, clock);

        AcquisitionResult result = orchestrator.acquire(URL, Deadline.after(Duration.ofMillis(1000), clock));

        assertFalse(result.isSuccess());
        StrategyOutcome skipped = result.outcomes().get(0);
        assertEquals(FailureKind.NOT_ATTEMPTED, skipped.getFailureKind());
        assertFalse(skipped.isAttempted());
        assertEquals(0, browser.calls.get());
        assertEquals(1, basic.calls.get());
    }

    @Test
    void shouldSkipEveryStrategyWhenDeadlineIsBelowAllMinimums() {
        FakeStrategy browser = FakeStrategy.succeeding("browser").withMinimumBudget(Duration.ofSeconds(3));
        FakeStrategy session = FakeStrategy.succeeding("http-session").withMinimumBudget(Duration.ofMillis(800));
        FakeStrategy basic = FakeStrategy.succeeding("http-basic").withMinimumBudget(Duration.ofMillis(500));
        orchestrator = new StrategyOrchestrator(List.of(browser, session, basic), normalizer, clock);

        long startNanos = System.nanoTime();
        AcquisitionResult result = orchestrator.acquire(URL, Deadline.after(Duration.ofMillis(200), clock));
        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        assertFalse(result.isSuccess());
        assertEquals(3, result.outcomes().size());
        for (StrategyOutcome outcome : result.outcomes()) {
            assertEquals(FailureKind.NOT_ATTEMPTED, outcome.getFailureKind(), outcome.getStrategyName());
            assertFalse(outcome.isAttempted());
        }
        assertEquals(0, browser.calls.get());
        assertEquals(0, session.calls.get());
        assertEquals(0, basic.calls.get());
        assertTrue(tookMs < 200 + 500, "orchestrator took " + tookMs + "ms");
    }

    @Test
    void shouldNotRunZeroMinimumStrategyOnceDeadlineHasExpired() {
        FakeStrategy basic = FakeStrategy.succeeding("http-basic");
        orchestrator = new StrategyOrchestrator(List.of(basic), normalizer, clock);

        AcquisitionResult result = orchestrator.acquire(URL, Deadline.after(Duration.ZERO, clock));

        assertFalse(result.isSuccess());
        assertEquals(FailureKind.NOT_ATTEMPTED, result.outcomes().get(0).getFailureKind());
        assertEquals(0, basic.calls.get());
    }

    @Test
    void shouldAbandonHangingWorkerAndMoveOn() throws InterruptedException {
        CountDownLatch released = new CountDownLatch(1);
        FakeStrategy hanging = new FakeStrategy("browser", true, (url, context) -> {
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                released.countDown();
            }
            return StrategyOutcome.failure("browser", FailureKind.STRATEGY_FAILURE, "late", "late", Duration.ZERO);
        }).withBudget(Duration.ofMillis(300));
        FakeStrategy basic = FakeStrategy.succeeding("http-basic");
        orchestrator = new StrategyOrchestrator(List.of(hanging, basic), normalizer, clock);

        long startNanos = System.nanoTime();
        AcquisitionResult result = orchestrator.acquire(URL, Deadline.after(Duration.ofSeconds(10), clock));
        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        assertTrue(result.isSuccess());
        assertEquals(FailureKind.STRATEGY_TIMEOUT, result.outcomes().get(0).getFailureKind());
        assertEquals("Operation timed out", result.outcomes().get(0).getReason());
        assertTrue(tookMs < 5000, "orchestrator waited " + tookMs + "ms");
        assertTrue(hanging.lastContext.cancellation().isCancelled());
        assertTrue(released.await(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldAggregateFailuresWhenEverythingFails() {
        orchestrator = new StrategyOrchestrator(List.of(
                FakeStrategy.failing("browser", true),
                FakeStrategy.failing("http-session", false),
                FakeStrategy.failing("http-basic", false)), normalizer, clock);

        AcquisitionResult result = orchestrator.acquire(URL, Deadline.after(Duration.ofSeconds(5), clock));

        assertFalse(result.isSuccess());
        assertTrue(result.pageModel().isEmpty());
        assertEquals(3, result.outcomes().size());
        assertEquals("browser: Connection refused by server; http-session: Connection refused by server; "
                + "http-basic: Connection refused by server", result.failureSummary());
    }

    @Test
    void shouldTurnThrownExceptionsIntoFailures() {
        FakeStrategy throwing = new FakeStrategy("http-basic", false, (url, context) -> {
            throw new IllegalStateException("driver exploded");
        });
        FakeStrategy isolated = new FakeStrategy("browser", true, (url, context) -> {
            throw new IllegalStateException("worker exploded");
        });
        orchestrator = new StrategyOrchestrator(List.of(isolated, throwing), normalizer, clock);

        AcquisitionResult result = orchestrator.acquire(URL, Deadline.after(Duration.ofSeconds(5), clock));

        assertEquals("IllegalStateException: worker exploded", result.outcomes().get(0).getError());
        assertEquals("IllegalStateException: driver exploded", result.outcomes().get(1).getError());
    }

    @Test
    void shouldReportEmptyStrategyList() {
        orchestrator = new StrategyOrchestrator(List.of(), normalizer, clock);

        AcquisitionResult result = orchestrator.acquire(URL, Deadline.after(Duration.ofSeconds(5), clock));

        assertFalse(result.isSuccess());
        assertEquals("No acquisition strategy is enabled", result.failureSummary());
    }

    @Test
    void shouldRejectInvalidUrls() {
        orchestrator = new StrategyOrchestrator(List.of(FakeStrategy.succeeding("http-basic")), normalizer, clock);

        assertThrows(IllegalArgumentException.class,
                () -> orchestrator.acquire(new AcquisitionRequest("ftp://example.test", Duration.ofSeconds(5))));
        assertThrows(IllegalArgumentException.class,
                () -> orchestrator.acquire(new AcquisitionRequest("not a url", Duration.ofSeconds(5))));
    }

    static final class FakeStrategy implements AcquisitionStrategy {

        private final String name;
        private final boolean isolated;
        private final BiFunction<String, AcquisitionContext, StrategyOutcome> behavior;
        private Duration minimumBudget = Duration.ZERO;
        private Duration budget;
        final AtomicInteger calls = new AtomicInteger();
        volatile AcquisitionContext lastContext;

        FakeStrategy(String name, boolean isolated, BiFunction<String, AcquisitionContext, StrategyOutcome> behavior) {
            this.name = name;
            this.isolated = isolated;
            this.behavior = behavior;
        }

        static FakeStrategy succeeding(String name) {
            PageModel model = PageModel.builder().title("Fake").url(URL).build();
            return new FakeStrategy(name, false, (url, context) -> StrategyOutcome.success(name, model, Duration.ZERO));
        }

        static FakeStrategy failing(String name, boolean isolated) {
            return new FakeStrategy(name, isolated, (url, context) -> StrategyOutcome.failure(name,
                    FailureKind.STRATEGY_FAILURE, "ERR_CONNECTION_REFUSED", "Connection refused by server",
                    Duration.ZERO));
        }

        FakeStrategy withMinimumBudget(Duration minimum) {
            this.minimumBudget = minimum;
            return this;
        }

        FakeStrategy withBudget(Duration fixed) {
            this.budget = fixed;
            return this;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public boolean isEnabled() {
            return true;
        }

        @Override
        public Duration getMinimumBudget() {
            return minimumBudget;
        }

        @Override
        public boolean requiresIsolatedWorker() {
            return isolated;
        }

        @Override
        public Duration allocateBudget(Duration remaining) {
            return budget != null && budget.compareTo(remaining) < 0 ? budget : remaining;
        }

        @Override
        public StrategyOutcome acquire(String url, AcquisitionContext context) {
            calls.incrementAndGet();
            lastContext = context;
            return behavior.apply(url, context);
        }
    }
}
