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

import groovy.lang.Binding;
import groovy.lang.GroovyShell;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pagepilot.domain.model.BrowserBackend;
import me.golemcore.pagepilot.domain.service.FailureReasonNormalizer;
import me.golemcore.pagepilot.port.outbound.BrowserPort;
import me.golemcore.pagepilot.port.outbound.BrowserSession;

import java.io.PrintWriter;
import java.io.Writer;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs one generated Groovy script against a freshly launched browser.
 *
 * <p>
 * The script sees {@code browser} ({@link AutomationHandle}), {@code url} and
 * {@code backend}; {@code println} output goes to the attempt log. The browser
 * is always closed before the report is returned.
 */
@Slf4j
public class ScriptRunner {

    private static final String SCRIPT_NAME = "GeneratedScript.groovy";

    private final BrowserPort browserPort;

    public ScriptRunner(BrowserPort browserPort) {
        this.browserPort = browserPort;
    }

    public SandboxReport run(SandboxJob job, String script) {
        BrowserBackend backend;
        BrowserSession session;
        try {
            backend = BrowserBackend.fromId(job.backend());
            session = browserPort.open(backend, Duration.ofMillis(job.navigationTimeoutMs()));
        } catch (RuntimeException e) {
            log.error("[Sandbox] Backend {} could not be started: {}", job.backend(), e.getMessage());
            return new SandboxReport(SandboxStatus.SANDBOX_FAILURE, List.of("backend start failed"), List.of(),
                    FailureReasonNormalizer.describe(e));
        }

        AutomationHandle handle = new AutomationHandle(session, Path.of(job.screenshotDirectory()),
                screenshotPrefix(job), job.maxLogLines());
        try (session) {
            Binding binding = new Binding();
            binding.setVariable("browser", handle);
            binding.setVariable("url", job.url());
            binding.setVariable("backend", backend.getId());
            binding.setVariable("out", new PrintWriter(new LogWriter(handle), true));

            handle.log("running script on " + backend.getId());
            new GroovyShell(binding).evaluate(script, SCRIPT_NAME);
            handle.log("script completed");
            return new SandboxReport(SandboxStatus.SUCCESS, handle.getLogs(), handle.getScreenshots(), null);
        } catch (Exception | AssertionError e) {
            String error = FailureReasonNormalizer.describe(e);
            handle.log("script failed: " + error);
            log.warn("[Sandbox] Script failed on {}: {}", backend.getId(), error);
            return new SandboxReport(SandboxStatus.FAILURE, handle.getLogs(), handle.getScreenshots(), error);
        }
    }

    private static String screenshotPrefix(SandboxJob job) {
        Path resultPath = Path.of(job.resultPath());
        Path attemptDirectory = resultPath.getParent();
        return attemptDirectory != null ? attemptDirectory.getFileName().toString() : job.backend();
    }

    /**
     * Forwards complete lines written by the script to the handle's log.
     */
    private static final class LogWriter extends Writer {

        private final AutomationHandle handle;
        private final StringBuilder buffer = new StringBuilder();

        LogWriter(AutomationHandle handle) {
            this.handle = handle;
        }

        @Override
        public void write(char[] chars, int offset, int length) {
            buffer.append(chars, offset, length);
            int newline = buffer.indexOf("\n");
            while (newline >= 0) {
                handle.log(buffer.substring(0, newline).stripTrailing());
                buffer.delete(0, newline + 1);
                newline = buffer.indexOf("\n");
            }
        }

        @Override
        public void flush() {
            // lines are forwarded as soon as they are complete
        }

        @Override
        public void close() {
            if (!buffer.isEmpty()) {
                handle.log(buffer.toString());
                buffer.setLength(0);
            }
        }
    }
}
