package me.golemcore.pagepilot.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pagepilot.adapter.outbound.browser.BrowserLaunchSettings;
import me.golemcore.pagepilot.adapter.outbound.browser.PlaywrightBrowserAdapter;
import me.golemcore.pagepilot.adapter.outbound.sandbox.JvmSandboxCommandFactory;
import me.golemcore.pagepilot.adapter.outbound.sandbox.ProcessSandboxAdapter;
import me.golemcore.pagepilot.adapter.outbound.sandbox.SandboxCommandFactory;
import me.golemcore.pagepilot.adapter.outbound.sandbox.SandboxWorkspace;
import me.golemcore.pagepilot.port.outbound.BrowserPort;
import me.golemcore.pagepilot.port.outbound.SandboxPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Shared infrastructure beans: clock, JSON mapper, browser and sandbox
 * adapters.
 *
 * <p>
 * {@link #objectMapper()} is static so the sandbox child, which runs without a
 * Spring context, reads and writes job files with the same mapper settings.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class PagePilotConfiguration {

    private final PagePilotProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public BrowserPort browserPort() {
        PagePilotProperties.BrowserStrategyProperties browser = properties.getAcquisition().getBrowser();
        return new PlaywrightBrowserAdapter(
                new BrowserLaunchSettings(browser.isHeadless(), properties.getAcquisition().getUserAgent()));
    }

    @Bean
    public SandboxWorkspace sandboxWorkspace() {
        PagePilotProperties.ExecutionProperties execution = properties.getExecution();
        SandboxWorkspace workspace = new SandboxWorkspace(Path.of(execution.getWorkspace()),
                execution.getRetainedScreenshots());
        log.info("[Sandbox] Workspace: {}", workspace.getRoot());
        return workspace;
    }

    @Bean
    public SandboxCommandFactory sandboxCommandFactory() {
        return new JvmSandboxCommandFactory(properties.getExecution().getJvmOptions());
    }

    @Bean
    public SandboxPort sandboxPort(SandboxWorkspace sandboxWorkspace, SandboxCommandFactory sandboxCommandFactory,
            ObjectMapper objectMapper, Clock clock) {
        return new ProcessSandboxAdapter(sandboxWorkspace, sandboxCommandFactory, objectMapper, properties, clock);
    }
}
