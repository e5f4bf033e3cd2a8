package me.golemcore.pagepilot.domain.service;

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
import me.golemcore.pagepilot.domain.acquisition.PageUrls;
import me.golemcore.pagepilot.domain.acquisition.StrategyOrchestrator;
import me.golemcore.pagepilot.domain.acquisition.StrategyOrchestratorFactory;
import me.golemcore.pagepilot.domain.execution.BackendScriptAdapter;
import me.golemcore.pagepilot.domain.execution.ExecutionController;
import me.golemcore.pagepilot.domain.model.AcquisitionRequest;
import me.golemcore.pagepilot.domain.model.AcquisitionResult;
import me.golemcore.pagepilot.domain.model.BrowserBackend;
import me.golemcore.pagepilot.domain.model.Deadline;
import me.golemcore.pagepilot.domain.model.ExecutionAttempt;
import me.golemcore.pagepilot.domain.model.ExecutionReport;
import me.golemcore.pagepilot.domain.model.ExecutionRequest;
import me.golemcore.pagepilot.domain.model.WorkflowRequest;
import me.golemcore.pagepilot.domain.model.WorkflowResult;
import me.golemcore.pagepilot.infrastructure.config.PagePilotProperties;
import me.golemcore.pagepilot.port.outbound.SandboxPort;
import me.golemcore.pagepilot.port.outbound.SandboxUnavailableException;
import me.golemcore.pagepilot.port.outbound.ScriptGeneratorPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Composes acquisition, script generation and sandboxed execution into one
 * workflow.
 *
 * <p>
 * The overall deadline is split between the phases: acquisition gets
 * {@code pagepilot.workflow.acquisition-share} of it, execution whatever is
 * left. A fresh orchestrator and controller are created for every invocation.
 * Sandbox cleanup runs exactly once per invocation, on every path.
 *
 * <p>
 * Only two conditions are fatal: a deadline that is already exhausted at call
 * time and a host that cannot spawn sandbox processes. Both yield a result with
 * {@code fatalError} set and no attempt matrix.
 */
@Service
@Slf4j
public class WorkflowCoordinator {

    private final StrategyOrchestratorFactory orchestratorFactory;
    private final ScriptGeneratorPort scriptGenerator;
    private final SandboxPort sandbox;
    private final BackendScriptAdapter scriptAdapter;
    private final FailureReasonNormalizer normalizer;
    private final PagePilotProperties properties;
    private final Clock clock;

    public WorkflowCoordinator(StrategyOrchestratorFactory orchestratorFactory, ScriptGeneratorPort scriptGenerator,
            SandboxPort sandbox, BackendScriptAdapter scriptAdapter, FailureReasonNormalizer normalizer,
            PagePilotProperties properties, Clock clock) {
        this.orchestratorFactory = orchestratorFactory;
        this.scriptGenerator = scriptGenerator;
        this.sandbox = sandbox;
        this.scriptAdapter = scriptAdapter;
        this.normalizer = normalizer;
        this.properties = properties;
        this.clock = clock;
    }

    public AcquisitionResult acquire(AcquisitionRequest request) {
        try (StrategyOrchestrator orchestrator = orchestratorFactory.create()) {
            return orchestrator.acquire(request);
        }
    }

    public WorkflowResult execute(ExecutionRequest request) {
        PageUrls.requireHttpUrl(request.url());
        Instant start = clock.instant();
        WorkflowResult.WorkflowResultBuilder result = WorkflowResult.builder()
                .workflowId(newWorkflowId())
                .url(request.url())
                .script(request.script())
                .startedAt(start);
        try {
            if (request.deadline() != null && !isPositive(request.deadline())) {
                return fatal(result, start, "Overall deadline already exceeded");
            }
            ExecutionReport report = newController().execute(request);
            return withExecution(result, report, start).build();
        } catch (SandboxUnavailableException e) {
            log.error("[Workflow] Sandbox unavailable: {}", e.getMessage());
            return fatal(result, start, "Sandbox unavailable: " + normalizer.normalize(e));
        } finally {
            cleanup();
        }
    }

    public WorkflowResult run(WorkflowRequest request) {
        String url = PageUrls.requireHttpUrl(request.getUrl());
        String task = request.getTask() == null ? "" : request.getTask();
        Duration overall = request.getOverallDeadline() != null
                ? request.getOverallDeadline()
                : Duration.ofMillis(properties.getWorkflow().getOverallDeadlineMs());
        Instant start = clock.instant();
        WorkflowResult.WorkflowResultBuilder result = WorkflowResult.builder()
                .workflowId(newWorkflowId())
                .task(task)
                .url(url)
                .startedAt(start);
        log.info("[Workflow] Starting '{}' on {} ({}ms budget)", task, url, overall.toMillis());

        try {
            if (!isPositive(overall)) {
                return fatal(result, start, "Overall deadline already exceeded");
            }
            Deadline deadline = Deadline.after(overall, clock);
            long acquisitionMs = (long) (overall.toMillis() * properties.getWorkflow().getAcquisitionShare());

            AcquisitionResult acquisition;
            try (StrategyOrchestrator orchestrator = orchestratorFactory.create()) {
                acquisition = orchestrator.acquire(url, deadline.within(Duration.ofMillis(acquisitionMs)));
            }
            result.acquisitionOutcomes(acquisition.outcomes());
            if (!acquisition.isSuccess()) {
                return finish(result, start, false, "Page acquisition failed: " + acquisition.failureSummary());
            }
            result.winningOutcome(acquisition.winner())
                    .winningStrategy(acquisition.winner().getStrategyName());

            String script;
            try {
                script = scriptGenerator.generate(task, acquisition.winner().getPageModel());
            } catch (RuntimeException e) {
                log.warn("[Workflow] Script generation failed: {}", e.getMessage());
                return finish(result, start, false, "Script generation failed: " + normalizer.normalize(e));
            }
            result.script(script);

            if (deadline.isExpired()) {
                return finish(result, start, false, "No time left for execution");
            }
            ExecutionRequest execution = new ExecutionRequest(script, url, resolveBackends(request),
                    resolveAttempts(request), deadline.remaining());
            ExecutionReport report = newController().execute(execution);
            return withExecution(result, report, start).build();
        } catch (SandboxUnavailableException e) {
            log.error("[Workflow] Sandbox unavailable: {}", e.getMessage());
            return fatal(result, start, "Sandbox unavailable: " + normalizer.normalize(e));
        } finally {
            cleanup();
        }
    }

    private ExecutionController newController() {
        return new ExecutionController(sandbox, scriptAdapter, normalizer, clock,
                Duration.ofMillis(properties.getExecution().getAttemptTimeoutMs()));
    }

    private WorkflowResult.WorkflowResultBuilder withExecution(WorkflowResult.WorkflowResultBuilder result,
            ExecutionReport report, Instant start) {
        boolean success = report.isSuccess();
        String error = success ? null : executionError(report.attempts());
        log.info("[Workflow] Finished with success={} after {} attempts", success, report.attempts().size());
        return result.attempts(report.attempts())
                .success(success)
                .error(error)
                .totalElapsed(Duration.between(start, clock.instant()));
    }

    private String executionError(List<ExecutionAttempt> attempts) {
        if (attempts.isEmpty()) {
            return "No execution attempt could be started";
        }
        return "All execution attempts failed: " + attempts.stream()
                .map(a -> a.getBackend().getId() + "#" + a.getAttemptIndex() + " " + a.getOutcome() + " ("
                        + a.getReason() + ")")
                .collect(Collectors.joining("; "));
    }

    private WorkflowResult finish(WorkflowResult.WorkflowResultBuilder result, Instant start, boolean success,
            String error) {
        log.warn("[Workflow] {}", error);
        return result.success(success)
                .error(error)
                .totalElapsed(Duration.between(start, clock.instant()))
                .build();
    }

    private WorkflowResult fatal(WorkflowResult.WorkflowResultBuilder result, Instant start, String fatalError) {
        log.error("[Workflow] Fatal: {}", fatalError);
        return result.success(false)
                .fatalError(fatalError)
                .error(fatalError)
                .attempts(List.of())
                .totalElapsed(Duration.between(start, clock.instant()))
                .build();
    }

    private void cleanup() {
        try {
            sandbox.cleanup();
        } catch (RuntimeException e) {
            log.warn("[Workflow] Sandbox cleanup failed: {}", e.getMessage());
        }
    }

    private List<BrowserBackend> resolveBackends(WorkflowRequest request) {
        if (request.getBackends() != null && !request.getBackends().isEmpty()) {
            return request.getBackends();
        }
        return properties.getExecution().getBackends().stream().map(BrowserBackend::fromId).toList();
    }

    private int resolveAttempts(WorkflowRequest request) {
        return request.getMaxAttemptsPerBackend() != null
                ? request.getMaxAttemptsPerBackend()
                : properties.getExecution().getMaxAttemptsPerBackend();
    }

    private static boolean isPositive(Duration duration) {
        return !duration.isZero() && !duration.isNegative();
    }

    private static String newWorkflowId() {
        return UUID.randomUUID().toString();
    }
}
