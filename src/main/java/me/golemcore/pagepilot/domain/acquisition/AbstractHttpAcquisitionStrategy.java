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

import me.golemcore.pagepilot.domain.model.SourceKind;
import me.golemcore.pagepilot.domain.page.HtmlPageParser;
import me.golemcore.pagepilot.domain.ranking.ElementPrioritizer;
import me.golemcore.pagepilot.domain.service.FailureReasonNormalizer;
import me.golemcore.pagepilot.infrastructure.config.PagePilotProperties;
import me.golemcore.pagepilot.port.outbound.HttpFetchPort;
import me.golemcore.pagepilot.port.outbound.HttpFetchResponse;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

/**
 * Static HTML acquisition over HTTP. Runs on the caller's thread, bounded by
 * the request timeout. Non-2xx responses and network errors are ordinary
 * failures.
 */
public abstract class AbstractHttpAcquisitionStrategy extends AbstractAcquisitionStrategy {

    private final PagePilotProperties.HttpStrategyProperties config;

    protected AbstractHttpAcquisitionStrategy(PagePilotProperties.HttpStrategyProperties config,
            HtmlPageParser parser, ElementPrioritizer prioritizer, FailureReasonNormalizer normalizer, Clock clock) {
        super(parser, prioritizer, normalizer, clock);
        this.config = config;
    }

    /**
     * Fetcher for one acquisition.
     */
    protected abstract HttpFetchPort fetcher();

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
        return false;
    }

    @Override
    public Duration allocateBudget(Duration remaining) {
        return Duration.ofMillis(Math.min(config.getRequestTimeoutMs(), remaining.toMillis()));
    }

    @Override
    protected RawPage fetch(String url, AcquisitionContext context) throws IOException {
        Duration timeout = context.deadline().remaining();
        if (timeout.isZero()) {
            throw new AcquisitionException("No time left for the HTTP request");
        }
        HttpFetchResponse response = fetcher().get(url, timeout);
        if (!response.isSuccessful()) {
            throw new AcquisitionException("HTTP " + response.status() + " from " + response.finalUrl());
        }
        if (response.body() == null || response.body().isBlank()) {
            throw new AcquisitionException("Empty response body from " + response.finalUrl());
        }
        return new RawPage(response.body(), response.finalUrl(), SourceKind.STATIC_HTML);
    }
}
