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
import me.golemcore.pagepilot.domain.model.BrowserBackend;
import me.golemcore.pagepilot.domain.model.SourceKind;
import me.golemcore.pagepilot.domain.page.HtmlPageParser;
import me.golemcore.pagepilot.domain.ranking.ElementPrioritizer;
import me.golemcore.pagepilot.domain.service.FailureReasonNormalizer;
import me.golemcore.pagepilot.infrastructure.config.PagePilotProperties;
import me.golemcore.pagepilot.port.outbound.BrowserPort;
import me.golemcore.pagepilot.port.outbound.BrowserSession;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Acquires a rendered DOM snapshot through a real browser.
 *
 * <p>
 * The configured backends are tried one after another inside the strategy's
 * sub-deadline; each backend gets an equal share of what is left. Only one
 * browser is alive at a time, and it is closed on the worker thread before
 * the next backend starts or the strategy returns.
 */
@Component
@Slf4j
public class BrowserAcquisitionStrategy extends AbstractAcquisitionStrategy {

    public static final String NAME = "browser";

    private final BrowserPort browserPort;
    private final PagePilotProperties.BrowserStrategyProperties config;
    private final List<BrowserBackend> backends;

    public BrowserAcquisitionStrategy(BrowserPort browserPort, PagePilotProperties properties, HtmlPageParser parser,
            ElementPrioritizer prioritizer, FailureReasonNormalizer normalizer, Clock clock) {
        super(parser, prioritizer, normalizer, clock);
        this.browserPort = browserPort;
        this.config = properties.getAcquisition().getBrowser();
        this.backends = config.getBackends().stream().map(BrowserBackend::fromId).toList();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public Duration getMinimumBudget() {
        return Duration.ofMillis(config.getMinimumBudgetMs());
    }

    @Override
    public boolean requiresIsolatedWorker() {
        return true;
    }

    @Override
    public Duration allocateBudget(Duration remaining) {
        long proportional = (long) (remaining.toMillis() * config.getBudgetRatio());
        long budget = Math.max(config.getMinimumBudgetMs(), proportional);
        return Duration.ofMillis(Math.min(budget, remaining.toMillis()));
    }

    @Override
    protected RawPage fetch(String url, AcquisitionContext context) {
        if (backends.isEmpty()) {
            throw new AcquisitionException("No browser backends configured");
        }
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < backends.size(); i++) {
            BrowserBackend backend = backends.get(i);
            context.cancellation().throwIfCancelled("launching " + backend.getId());
            if (context.deadline().isExpired()) {
                errors.add(backend.getId() + ": no time left");
                break;
            }
            Duration slice = context.deadline().remaining().dividedBy(backends.size() - (long) i);
            Duration timeout = slice.compareTo(pageLoadTimeout()) < 0 ? slice : pageLoadTimeout();
            log.debug("[Acquire] Browser backend {} with {}ms", backend.getId(), timeout.toMillis());
            try (BrowserSession session = browserPort.open(backend, timeout)) {
                session.navigate(url);
                context.cancellation().throwIfCancelled("reading the DOM");
                return new RawPage(session.pageSource(), session.currentUrl(), SourceKind.DOM_SNAPSHOT);
            } catch (AcquisitionException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("[Acquire] Browser backend {} failed: {}", backend.getId(), e.getMessage());
                errors.add(backend.getId() + ": " + FailureReasonNormalizer.describe(e));
            }
        }
        throw new AcquisitionException("All browser backends failed: " + String.join("; ", errors));
    }

    private Duration pageLoadTimeout() {
        return Duration.ofMillis(config.getPageLoadTimeoutMs());
    }
}
