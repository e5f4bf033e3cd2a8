package me.golemcore.pagepilot.sandbox;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pagepilot.adapter.outbound.browser.BrowserLaunchSettings;
import me.golemcore.pagepilot.adapter.outbound.browser.PlaywrightBrowserAdapter;
import me.golemcore.pagepilot.domain.service.FailureReasonNormalizer;
import me.golemcore.pagepilot.infrastructure.config.PagePilotConfiguration;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry point of the sandbox child JVM: {@code SandboxMain <job.json>}.
 *
 * <p>
 * Reads the job, runs the script against its own browser, writes
 * {@code result.json} and exits with the status code (0 success, 1 script
 * failure, 3 backend or job failure). Runs without a Spring context.
 */
@Slf4j
public final class SandboxMain {

    private SandboxMain() {
    }

    public static void main(String[] args) {
        if (args.length != 1) {
            System.err.println("Usage: SandboxMain <job.json>");
            System.exit(SandboxStatus.SANDBOX_FAILURE.getExitCode());
        }
        System.exit(run(Path.of(args[0])).getExitCode());
    }

    static SandboxStatus run(Path jobFile) {
        ObjectMapper objectMapper = PagePilotConfiguration.objectMapper();
        SandboxJob job;
        String script;
        try {
            job = objectMapper.readValue(jobFile.toFile(), SandboxJob.class);
            script = Files.readString(Path.of(job.scriptPath()), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("[Sandbox] Cannot read job {}: {}", jobFile, e.getMessage());
            return SandboxStatus.SANDBOX_FAILURE;
        }

        log.info("[Sandbox] Child pid {} running {} against {}", ProcessHandle.current().pid(), job.backend(),
                job.url());
        ScriptRunner runner = new ScriptRunner(
                new PlaywrightBrowserAdapter(new BrowserLaunchSettings(job.headless(), job.userAgent())));
        SandboxReport report;
        try {
            report = runner.run(job, script);
        } catch (RuntimeException e) {
            report = new SandboxReport(SandboxStatus.SANDBOX_FAILURE, List.of(), List.of(),
                    FailureReasonNormalizer.describe(e));
        }

        try {
            objectMapper.writeValue(Path.of(job.resultPath()).toFile(), report);
        } catch (IOException e) {
            log.error("[Sandbox] Cannot write result {}: {}", job.resultPath(), e.getMessage());
            return SandboxStatus.SANDBOX_FAILURE;
        }
        log.info("[Sandbox] Child finished with {}", report.status());
        return report.status();
    }
}
