package me.golemcore.pagepilot.adapter.outbound.sandbox;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pagepilot.domain.model.ExecutionAttempt;
import me.golemcore.pagepilot.domain.model.FailureKind;
import me.golemcore.pagepilot.infrastructure.config.PagePilotProperties;
import me.golemcore.pagepilot.port.outbound.SandboxPort;
import me.golemcore.pagepilot.port.outbound.SandboxUnavailableException;
import me.golemcore.pagepilot.sandbox.SandboxJob;
import me.golemcore.pagepilot.sandbox.SandboxReport;
import me.golemcore.pagepilot.sandbox.SandboxStatus;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs each execution attempt in a separate OS process.
 *
 * <p>
 * Per attempt the adapter writes {@code job.json} and {@code script.groovy}
 * into a fresh directory, starts the child with stdout and stderr redirected
 * to {@code child.log}, and waits up to the attempt timeout while tracking the
 * child's descendants. On timeout the whole tracked tree is force-killed and
 * reaped before the attempt is marked {@code TIMEOUT}. After any exit the
 * child's {@code result.json} is read; a missing or corrupt result is a
 * failure, never an exception.
 *
 * <p>
 * The child runs with a sanitized environment: only allowlisted variables are
 * passed through.
 */
@Slf4j
public class ProcessSandboxAdapter implements SandboxPort {

    static final String JOB_FILE = "job.json";
    static final String SCRIPT_FILE = "script.groovy";
    static final String RESULT_FILE = "result.json";
    static final String LOG_FILE = "child.log";

    private static final long POLL_INTERVAL_MS = 100;

    private static final Set<String> DEFAULT_ALLOWED_ENV_VARS = Set.of(
            "PATH", "LANG", "LC_ALL", "LC_CTYPE", "TERM", "TMPDIR",
            "TZ", "SHELL", "USER", "LOGNAME", "HOME", "JAVA_HOME",
            "PLAYWRIGHT_BROWSERS_PATH", "PLAYWRIGHT_SKIP_BROWSER_DOWNLOAD",
            "DISPLAY", "XAUTHORITY", "WAYLAND_DISPLAY", "XDG_RUNTIME_DIR",
            "SYSTEMROOT", "TEMP", "TMP", "LOCALAPPDATA", "USERPROFILE");

    private final SandboxWorkspace workspace;
    private final SandboxCommandFactory commandFactory;
    private final ObjectMapper objectMapper;
    private final PagePilotProperties.ExecutionProperties config;
    private final String userAgent;
    private final Clock clock;
    private final Set<String> allowedEnvVars;

    public ProcessSandboxAdapter(SandboxWorkspace workspace, SandboxCommandFactory commandFactory,
            ObjectMapper objectMapper, PagePilotProperties properties, Clock clock) {
        this.workspace = workspace;
        this.commandFactory = commandFactory;
        this.objectMapper = objectMapper;
        this.config = properties.getExecution();
        this.userAgent = properties.getAcquisition().getUserAgent();
        this.clock = clock;
        this.allowedEnvVars = buildAllowedEnvVars(config.getAllowedEnvVars());
    }

    @Override
    public ExecutionAttempt run(ExecutionAttempt pending, String url, Duration timeout) {
        String name = String.format("attempt-%02d-%s-%s", pending.getSequence(), pending.getBackend().getId(),
                UUID.randomUUID().toString().substring(0, 8));
        Path directory = workspace.createAttemptDirectory(name);
        try {
            return runInDirectory(pending, url, timeout, directory);
        } finally {
            if (!config.isRetainAttemptDirectories()) {
                workspace.deleteAttemptDirectory(directory);
            }
        }
    }

    @Override
    public void cleanup() {
        workspace.pruneScreenshots();
    }

    private ExecutionAttempt runInDirectory(ExecutionAttempt pending, String url, Duration timeout,
            Path directory) {
        Path jobFile = writeJob(pending, url, directory);
        ProcessBuilder pb = new ProcessBuilder(commandFactory.command(jobFile));
        pb.directory(directory.toFile());
        pb.redirectErrorStream(true);
        pb.redirectOutput(directory.resolve(LOG_FILE).toFile());

        // Sanitize environment: only keep safe vars, block LD_PRELOAD etc.
        Map<String, String> env = pb.environment();
        env.keySet().retainAll(allowedEnvVars);

        Instant start = clock.instant();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new SandboxUnavailableException("Cannot spawn sandbox process: " + e.getMessage(), e);
        }
        ExecutionAttempt running = pending.start(start, process.pid());
        log.info("[Sandbox] Attempt {} started on {} (pid {}, timeout {}ms)", running.getSequence(),
                running.getBackend().getId(), process.pid(), timeout.toMillis());

        Set<ProcessHandle> tree = new LinkedHashSet<>();
        boolean exited = waitForExit(process, timeout, tree);
        if (!exited) {
            terminateTree(process, tree);
            Duration elapsed = Duration.between(start, clock.instant());
            Optional<SandboxReport> partial = readReport(directory);
            log.warn("[Sandbox] Attempt {} timed out after {}ms, process tree killed", running.getSequence(),
                    elapsed.toMillis());
            return running.timeout("Execution timed out after " + timeout.toMillis() + "ms",
                    partial.map(SandboxReport::logs).orElseGet(() -> tailLog(directory)),
                    partial.map(SandboxReport::screenshots).orElse(List.of()), elapsed);
        }

        // Orphaned browser processes outlive the child JVM if it crashed
        terminateTree(process, tree);
        Duration elapsed = Duration.between(start, clock.instant());
        int exitCode = process.exitValue();
        return complete(running, directory, exitCode, elapsed);
    }

    private ExecutionAttempt complete(ExecutionAttempt running, Path directory, int exitCode, Duration elapsed) {
        Optional<SandboxReport> report;
        String readError = null;
        try {
            report = readReportStrict(directory);
        } catch (IOException e) {
            report = Optional.empty();
            readError = "Corrupt result file: " + e.getMessage();
        }

        if (report.isEmpty()) {
            String reason = readError != null ? readError : "Result file missing";
            FailureKind kind = exitCode == SandboxStatus.SANDBOX_FAILURE.getExitCode()
                    ? FailureKind.SANDBOX_FAILURE
                    : FailureKind.EXECUTION_FAILURE;
            List<String> output = tailLog(directory);
            String lastLine = output.isEmpty() ? "" : "; last output: " + output.get(output.size() - 1);
            log.warn("[Sandbox] Attempt {} exited {} without a usable result", running.getSequence(), exitCode);
            return running.fail(kind, reason + " (exit code " + exitCode + ")" + lastLine, output, List.of(),
                    exitCode, elapsed);
        }

        SandboxReport result = report.get();
        SandboxStatus status = result.status() != null ? result.status() : SandboxStatus.FAILURE;
        return switch (status) {
        case SUCCESS -> exitCode == 0
                ? running.succeed(result.logs(), result.screenshots(), exitCode, elapsed)
                : running.fail(FailureKind.EXECUTION_FAILURE,
                        "Child reported success but exited with code " + exitCode, result.logs(),
                        result.screenshots(), exitCode, elapsed);
        case SANDBOX_FAILURE -> running.fail(FailureKind.SANDBOX_FAILURE, errorOf(result), result.logs(),
                result.screenshots(), exitCode, elapsed);
        case FAILURE -> running.fail(FailureKind.EXECUTION_FAILURE, errorOf(result), result.logs(),
                result.screenshots(), exitCode, elapsed);
        };
    }

    private Path writeJob(ExecutionAttempt pending, String url, Path directory) {
        Path scriptFile = directory.resolve(SCRIPT_FILE);
        Path jobFile = directory.resolve(JOB_FILE);
        SandboxJob job = new SandboxJob(
                url,
                pending.getBackend().getId(),
                scriptFile.toString(),
                directory.resolve(RESULT_FILE).toString(),
                workspace.getScreenshotsDirectory().toString(),
                config.getNavigationTimeoutMs(),
                config.isHeadless(),
                userAgent,
                config.getMaxLogLines());
        try {
            Files.writeString(scriptFile, pending.getScript(), StandardCharsets.UTF_8);
            objectMapper.writeValue(jobFile.toFile(), job);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to prepare attempt directory " + directory, e);
        }
        return jobFile;
    }

    /**
     * Waits for the child while recording its descendants, so the tree can still
     * be killed if the child dies and leaves orphans behind.
     */
    private boolean waitForExit(Process process, Duration timeout, Set<ProcessHandle> tree) {
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (true) {
                process.descendants().forEach(tree::add);
                long leftMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (leftMs <= 0) {
                    return !process.isAlive();
                }
                if (process.waitFor(Math.min(POLL_INTERVAL_MS, leftMs), TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Sandbox] Interrupted while waiting for pid {}", process.pid());
            return false;
        }
    }

    /**
     * Force-kills the child and every known descendant, then waits for them to
     * be reaped.
     */
    private void terminateTree(Process process, Set<ProcessHandle> tracked) {
        Set<ProcessHandle> tree = new LinkedHashSet<>(tracked);
        process.descendants().forEach(tree::add);
        for (ProcessHandle handle : tree) {
            if (handle.isAlive()) {
                handle.destroyForcibly();
            }
        }
        if (process.isAlive()) {
            process.destroyForcibly();
        }

        long graceMs = config.getKillGracePeriodMs();
        try {
            if (!process.waitFor(graceMs, TimeUnit.MILLISECONDS)) {
                log.error("[Sandbox] Child pid {} survived forced kill", process.pid());
            }
            for (ProcessHandle handle : tree) {
                awaitExit(handle, graceMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Sandbox] Interrupted while reaping pid {}", process.pid());
        }
    }

    private void awaitExit(ProcessHandle handle, long graceMs) throws InterruptedException {
        if (!handle.isAlive()) {
            return;
        }
        try {
            handle.onExit().get(graceMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            log.error("[Sandbox] Descendant pid {} survived forced kill", handle.pid());
        }
    }

    private Optional<SandboxReport> readReport(Path directory) {
        try {
            return readReportStrict(directory);
        } catch (IOException e) {
            log.debug("[Sandbox] Unreadable partial result in {}: {}", directory, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<SandboxReport> readReportStrict(Path directory) throws IOException {
        Path resultFile = directory.resolve(RESULT_FILE);
        if (!Files.isRegularFile(resultFile)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(resultFile.toFile(), SandboxReport.class));
        } catch (JsonProcessingException e) {
            throw new IOException(e.getOriginalMessage(), e);
        }
    }

    private List<String> tailLog(Path directory) {
        Path logFile = directory.resolve(LOG_FILE);
        if (!Files.isRegularFile(logFile)) {
            return List.of();
        }
        try {
            List<String> lines = Files.readAllLines(logFile, StandardCharsets.UTF_8);
            int from = Math.max(0, lines.size() - config.getMaxLogLines());
            return List.copyOf(lines.subList(from, lines.size()));
        } catch (IOException e) {
            return List.of("[child log unreadable: " + e.getMessage() + "]");
        }
    }

    private static String errorOf(SandboxReport report) {
        return report.error() != null && !report.error().isBlank() ? report.error() : "Script failed without an error";
    }

    private static Set<String> buildAllowedEnvVars(String configValue) {
        if (configValue == null || configValue.isBlank()) {
            return DEFAULT_ALLOWED_ENV_VARS;
        }
        Set<String> merged = new HashSet<>(DEFAULT_ALLOWED_ENV_VARS);
        Set<String> custom = Arrays.stream(configValue.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
        merged.addAll(custom);
        return Collections.unmodifiableSet(merged);
    }
}
