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
import me.golemcore.pagepilot.domain.model.FailureKind;
import me.golemcore.pagepilot.domain.model.PageModel;
import me.golemcore.pagepilot.domain.model.StrategyOutcome;
import me.golemcore.pagepilot.domain.page.HtmlPageParser;
import me.golemcore.pagepilot.domain.ranking.ElementPrioritizer;
import me.golemcore.pagepilot.domain.service.FailureReasonNormalizer;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Fetch, parse and rank template shared by all strategies. Subclasses only
 * provide {@link #fetch(String, AcquisitionContext)}.
 */
@Slf4j
public abstract class AbstractAcquisitionStrategy implements AcquisitionStrategy {

    private final HtmlPageParser parser;
    private final ElementPrioritizer prioritizer;
    private final FailureReasonNormalizer normalizer;
    protected final Clock clock;

    protected AbstractAcquisitionStrategy(HtmlPageParser parser, ElementPrioritizer prioritizer,
            FailureReasonNormalizer normalizer, Clock clock) {
        this.parser = parser;
        this.prioritizer = prioritizer;
        this.normalizer = normalizer;
        this.clock = clock;
    }

    protected abstract RawPage fetch(String url, AcquisitionContext context) throws IOException;

    @Override
    public final StrategyOutcome acquire(String url, AcquisitionContext context) {
        Instant start = clock.instant();
        try {
            RawPage raw = fetch(url, context);
            context.cancellation().throwIfCancelled("parsing");
            PageModel model = parser.parse(raw.content(), raw.finalUrl(), raw.sourceKind());
            PageModel ranked = prioritizer.rank(model);
            Duration elapsed = Duration.between(start, clock.instant());
            log.info("[Acquire] {} succeeded for {} in {}ms (title: '{}', score: {})",
                    getName(), url, elapsed.toMillis(), ranked.getTitle(), ranked.getAutomationScore());
            return StrategyOutcome.success(getName(), ranked, elapsed);
        } catch (IOException | RuntimeException e) {
            Duration elapsed = Duration.between(start, clock.instant());
            String error = FailureReasonNormalizer.describe(e);
            String reason = normalizer.normalize(error);
            log.warn("[Acquire] {} failed for {} after {}ms: {}", getName(), url, elapsed.toMillis(), reason);
            log.debug("[Acquire] {} failure detail: {}", getName(), error);
            return StrategyOutcome.failure(getName(), FailureKind.STRATEGY_FAILURE, error, reason, elapsed);
        }
    }
}
