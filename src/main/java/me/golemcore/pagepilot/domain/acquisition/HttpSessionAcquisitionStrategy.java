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

import me.golemcore.pagepilot.domain.page.HtmlPageParser;
import me.golemcore.pagepilot.domain.ranking.ElementPrioritizer;
import me.golemcore.pagepilot.domain.service.FailureReasonNormalizer;
import me.golemcore.pagepilot.infrastructure.config.PagePilotProperties;
import me.golemcore.pagepilot.port.outbound.HttpFetchPort;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * HTTP acquisition with a fresh cookie jar per acquisition, so cookies set
 * during redirects (consent or session cookies) are sent back.
 */
@Component
public class HttpSessionAcquisitionStrategy extends AbstractHttpAcquisitionStrategy {

    public static final String NAME = "http-session";

    private final HttpFetchPort httpFetchPort;

    public HttpSessionAcquisitionStrategy(HttpFetchPort httpFetchPort, PagePilotProperties properties,
            HtmlPageParser parser, ElementPrioritizer prioritizer, FailureReasonNormalizer normalizer, Clock clock) {
        super(properties.getAcquisition().getHttpSession(), parser, prioritizer, normalizer, clock);
        this.httpFetchPort = httpFetchPort;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected HttpFetchPort fetcher() {
        return httpFetchPort.newSession();
    }
}
