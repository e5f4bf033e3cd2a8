package me.golemcore.pagepilot.adapter.inbound.cli;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pagepilot.domain.model.BrowserBackend;
import me.golemcore.pagepilot.domain.model.WorkflowRequest;
import me.golemcore.pagepilot.domain.model.WorkflowResult;
import me.golemcore.pagepilot.domain.service.WorkflowCoordinator;
import me.golemcore.pagepilot.domain.service.WorkflowReportWriter;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Runs one workflow from command-line options and prints its JSON report.
 *
 * <p>
 * Options:
 * <ul>
 * <li>{@code --url} - page to automate (required to run anything)</li>
 * <li>{@code --task} - task description for the script generator</li>
 * <li>{@code --deadline-ms} - overall deadline</li>
 * <li>{@code --backends} - comma-separated backend ids</li>
 * <li>{@code --attempts} - attempts per backend</li>
 * <li>{@code --report} - also write the report to this file</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WorkflowCommandLineRunner implements ApplicationRunner {

    private final WorkflowCoordinator coordinator;
    private final WorkflowReportWriter reportWriter;
    private final PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);

    private WorkflowResult lastResult;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        String url = option(args, "url");
        if (url == null) {
            log.info("[Workflow] No --url option given, nothing to run");
            return;
        }
        WorkflowRequest.WorkflowRequestBuilder request = WorkflowRequest.builder()
                .url(url)
                .task(option(args, "task"));
        String deadline = option(args, "deadline-ms");
        if (deadline != null) {
            request.overallDeadline(Duration.ofMillis(Long.parseLong(deadline)));
        }
        String backends = option(args, "backends");
        if (backends != null) {
            request.backends(parseBackends(backends));
        }
        String attempts = option(args, "attempts");
        if (attempts != null) {
            request.maxAttemptsPerBackend(Integer.parseInt(attempts));
        }

        WorkflowResult result = coordinator.run(request.build());
        lastResult = result;
        out.println(reportWriter.toJson(result));
        String report = option(args, "report");
        if (report != null) {
            Path written = reportWriter.write(result, Path.of(report));
            log.info("[Workflow] Report written to {}", written);
        }
    }

    WorkflowResult getLastResult() {
        return lastResult;
    }

    static List<BrowserBackend> parseBackends(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(BrowserBackend::fromId)
                .toList();
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }
}
