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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code pagepilot.*} prefix:
 * <ul>
 * <li>{@link AcquisitionProperties} - strategy order, budgets and extraction
 * caps</li>
 * <li>{@link ExecutionProperties} - sandbox backends, attempts and timeouts</li>
 * <li>{@link WorkflowProperties} - overall deadline and its phase split</li>
 * <li>{@link HttpProperties} - shared OkHttp client settings</li>
 * </ul>
 *
 * <p>
 * Every timeout is a tunable. None of the values below is assumed anywhere in
 * the domain logic.
 */
@Component
@ConfigurationProperties(prefix = "pagepilot")
@Data
public class PagePilotProperties {

    private AcquisitionProperties acquisition = new AcquisitionProperties();
    private ExecutionProperties execution = new ExecutionProperties();
    private WorkflowProperties workflow = new WorkflowProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class AcquisitionProperties {
        private List<String> strategies = new ArrayList<>(List.of("browser", "http-session", "http-basic"));
        private BrowserStrategyProperties browser = new BrowserStrategyProperties();
        private HttpStrategyProperties httpSession = new HttpStrategyProperties();
        private HttpStrategyProperties httpBasic = new HttpStrategyProperties();
        private ExtractionProperties extraction = new ExtractionProperties();
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/124.0 Safari/537.36";
    }

    @Data
    public static class BrowserStrategyProperties {
        private boolean enabled = true;
        private boolean headless = true;
        private List<String> backends = new ArrayList<>(List.of("chromium", "firefox"));
        private double budgetRatio = 2.0 / 3.0;
        private long minimumBudgetMs = 3000;
        private long pageLoadTimeoutMs = 15000;
    }

    @Data
    public static class HttpStrategyProperties {
        private boolean enabled = true;
        private long minimumBudgetMs = 500;
        private long requestTimeoutMs = 30000;
    }

    @Data
    public static class ExtractionProperties {
        private int maxBodyTextLength = 3000;
        private int maxHeadings = 50;
        private int maxParagraphs = 10;
        private int minParagraphLength = 10;
        private int maxLists = 5;
        private int maxListItems = 10;
        private int maxInputs = 15;
        private int maxButtons = 10;
        private int maxLinks = 15;
        private int maxAttributeClickables = 10;
        private int maxContextElements = 20;
        private int maxForms = 5;
        private int maxElementTextLength = 100;
        private long maxResponseBytes = 5L * 1024L * 1024L;
    }

    @Data
    public static class ExecutionProperties {
        private List<String> backends = new ArrayList<>(List.of("chromium", "firefox"));
        private int maxAttemptsPerBackend = 2;
        private long attemptTimeoutMs = 180000;
        private long navigationTimeoutMs = 30000;
        private long killGracePeriodMs = 5000;
        private boolean headless = true;
        private String workspace = System.getProperty("java.io.tmpdir") + "/pagepilot-sandbox";
        private List<String> jvmOptions = new ArrayList<>(List.of("-Xmx512m"));
        private String allowedEnvVars = "";
        private int maxLogLines = 200;
        private int retainedScreenshots = 10;
        private boolean retainAttemptDirectories = false;
    }

    @Data
    public static class WorkflowProperties {
        private long overallDeadlineMs = 300000;
        private double acquisitionShare = 0.3;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
