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

import me.golemcore.pagepilot.port.outbound.BrowserElement;
import me.golemcore.pagepilot.port.outbound.BrowserSession;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Automation API bound as {@code browser} in generated scripts. Wraps one
 * browser session and records log lines and screenshot paths for the result
 * file.
 */
public class AutomationHandle {

    private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^A-Za-z0-9._-]");

    private final BrowserSession session;
    private final Path screenshotDirectory;
    private final String screenshotPrefix;
    private final int maxLogLines;
    private final List<String> logs = new ArrayList<>();
    private final List<String> screenshots = new ArrayList<>();
    private int droppedLogLines;

    public AutomationHandle(BrowserSession session, Path screenshotDirectory, String screenshotPrefix,
            int maxLogLines) {
        this.session = session;
        this.screenshotDirectory = screenshotDirectory;
        this.screenshotPrefix = screenshotPrefix;
        this.maxLogLines = maxLogLines;
    }

    public void navigate(String url) {
        log("navigate " + url);
        session.navigate(url);
    }

    public List<BrowserElement> findAll(String selector) {
        return session.findElements(selector);
    }

    /**
     * First element matching the selector.
     *
     * @throws IllegalStateException
     *             when nothing matches
     */
    public BrowserElement find(String selector) {
        List<BrowserElement> elements = session.findElements(selector);
        if (elements.isEmpty()) {
            throw new IllegalStateException("No element matches selector: " + selector);
        }
        return elements.get(0);
    }

    public boolean exists(String selector) {
        return !session.findElements(selector).isEmpty();
    }

    public void click(String selector) {
        log("click " + selector);
        session.click(find(selector));
    }

    public void type(String selector, String text) {
        log("type into " + selector);
        session.typeText(find(selector), text);
    }

    public String attribute(String selector, String name) {
        return session.elementAttribute(find(selector), name);
    }

    public String text(String selector) {
        return find(selector).text();
    }

    public String title() {
        return session.title();
    }

    public String currentUrl() {
        return session.currentUrl();
    }

    public String pageSource() {
        return session.pageSource();
    }

    /**
     * Saves a PNG screenshot and returns its absolute path.
     */
    public String screenshot(String name) {
        String safeName = UNSAFE_FILE_CHARS.matcher(name == null || name.isBlank() ? "screenshot" : name)
                .replaceAll("_");
        Path target = screenshotDirectory
                .resolve(screenshotPrefix + "-" + (screenshots.size() + 1) + "-" + safeName + ".png");
        try {
            Files.createDirectories(screenshotDirectory);
            Files.write(target, session.screenshot());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save screenshot " + target, e);
        }
        String path = target.toAbsolutePath().toString();
        screenshots.add(path);
        log("screenshot " + path);
        return path;
    }

    public synchronized void log(String message) {
        if (logs.size() < maxLogLines) {
            logs.add(message);
        } else {
            droppedLogLines++;
        }
    }

    public synchronized List<String> getLogs() {
        if (droppedLogLines == 0) {
            return List.copyOf(logs);
        }
        List<String> capped = new ArrayList<>(logs);
        capped.add("[" + droppedLogLines + " more log lines dropped]");
        return capped;
    }

    public List<String> getScreenshots() {
        return List.copyOf(screenshots);
    }
}
