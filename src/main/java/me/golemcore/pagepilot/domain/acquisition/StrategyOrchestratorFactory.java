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

import me.golemcore.pagepilot.domain.service.FailureReasonNormalizer;
import me.golemcore.pagepilot.infrastructure.config.PagePilotProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates one {@link StrategyOrchestrator} per invocation, with the enabled
 * strategies in the configured order.
 */
@Component
public class StrategyOrchestratorFactory {

    private final Map<String, AcquisitionStrategy> strategiesByName = new LinkedHashMap<>();
    private final List<String> order;
    private final FailureReasonNormalizer normalizer;
    private final Clock clock;

    public StrategyOrchestratorFactory(List<AcquisitionStrategy> strategies, PagePilotProperties properties,
            FailureReasonNormalizer normalizer, Clock clock) {
        for (AcquisitionStrategy strategy : strategies) {
            strategiesByName.put(strategy.getName(), strategy);
        }
        this.order = List.copyOf(properties.getAcquisition().getStrategies());
        for (String name : order) {
            if (!strategiesByName.containsKey(name)) {
                throw new IllegalArgumentException("Unknown acquisition strategy '" + name + "', available: "
                        + strategiesByName.keySet());
            }
        }
        this.normalizer = normalizer;
        this.clock = clock;
    }

    public StrategyOrchestrator create() {
        List<AcquisitionStrategy> ordered = new ArrayList<>();
        for (String name : order) {
            AcquisitionStrategy strategy = strategiesByName.get(name);
            if (strategy.isEnabled()) {
                ordered.add(strategy);
            }
        }
        return new StrategyOrchestrator(ordered, normalizer, clock);
    }
}
