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

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Directory layout of the sandbox: one {@code attempts/<name>} directory per
 * attempt and a shared {@code screenshots} directory whose newest files are
 * retained.
 */
@Slf4j
public class SandboxWorkspace {

    private final Path root;
    private final Path attemptsDirectory;
    private final Path screenshotsDirectory;
    private final int retainedScreenshots;

    public SandboxWorkspace(Path root, int retainedScreenshots) {
        this.root = root.toAbsolutePath().normalize();
        this.attemptsDirectory = this.root.resolve("attempts");
        this.screenshotsDirectory = this.root.resolve("screenshots");
        this.retainedScreenshots = Math.max(0, retainedScreenshots);
    }

    public Path getRoot() {
        return root;
    }

    public Path getScreenshotsDirectory() {
        return screenshotsDirectory;
    }

    public Path createAttemptDirectory(String name) {
        Path directory = attemptsDirectory.resolve(name).normalize();
        if (!directory.startsWith(attemptsDirectory)) {
            throw new IllegalArgumentException("Attempt directory escapes the workspace: " + name);
        }
        try {
            Files.createDirectories(directory);
            Files.createDirectories(screenshotsDirectory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create attempt directory " + directory, e);
        }
        return directory;
    }

    /**
     * Recursively deletes an attempt directory. Failures are logged, never
     * thrown.
     */
    public void deleteAttemptDirectory(Path directory) {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            List<Path> ordered = paths.sorted(Comparator.reverseOrder()).toList();
            for (Path path : ordered) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("[Sandbox] Failed to delete attempt directory {}: {}", directory, e.getMessage());
        }
    }

    /**
     * Deletes all but the newest {@code retainedScreenshots} files of the
     * screenshots directory.
     *
     * @return the deleted files
     */
    public List<Path> pruneScreenshots() {
        if (!Files.isDirectory(screenshotsDirectory)) {
            return List.of();
        }
        List<Path> screenshots;
        try (Stream<Path> files = Files.list(screenshotsDirectory)) {
            screenshots = files.filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(SandboxWorkspace::lastModified).reversed()
                            .thenComparing(Comparator.reverseOrder()))
                    .toList();
        } catch (IOException e) {
            log.warn("[Sandbox] Failed to list screenshots in {}: {}", screenshotsDirectory, e.getMessage());
            return List.of();
        }
        List<Path> deleted = new ArrayList<>();
        for (Path screenshot : screenshots.subList(Math.min(retainedScreenshots, screenshots.size()),
                screenshots.size())) {
            try {
                Files.deleteIfExists(screenshot);
                deleted.add(screenshot);
            } catch (IOException e) {
                log.warn("[Sandbox] Failed to delete screenshot {}: {}", screenshot, e.getMessage());
            }
        }
        if (!deleted.isEmpty()) {
            log.debug("[Sandbox] Pruned {} old screenshots", deleted.size());
        }
        return deleted;
    }

    private static FileTime lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }
}
