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

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Maps raw error text from drivers, HTTP clients and child processes to a
 * short, stable, human-readable reason.
 *
 * <p>
 * Rules are checked in order and the first matching one wins. When nothing
 * matches, the first line of the raw text is used, truncated to 100
 * characters.
 */
@Component
public class FailureReasonNormalizer {

    static final String UNKNOWN_ERROR = "Unknown error";
    private static final int MAX_FALLBACK_LENGTH = 100;

    private record Rule(String needle, boolean caseSensitive, String reason) {

        boolean matches(String raw, String lower) {
            return caseSensitive ? raw.contains(needle) : lower.contains(needle);
        }
    }

    private static final List<Rule> RULES = List.of(
            new Rule("ERR_NAME_NOT_RESOLVED", true, "DNS resolution failed - invalid domain"),
            new Rule("UnknownHostException", true, "DNS resolution failed - invalid domain"),
            new Rule("ERR_INTERNET_DISCONNECTED", true, "Internet connection lost"),
            new Rule("ERR_CONNECTION_REFUSED", true, "Connection refused by server"),
            new Rule("connection refused", false, "Connection refused by server"),
            new Rule("ERR_CONNECTION_TIMED_OUT", true, "Connection timed out"),
            new Rule("connect timed out", false, "Connection timed out"),
            new Rule("chrome not reachable", false, "Browser not responding"),
            new Rule("browser has been closed", false, "Browser not responding"),
            new Rule("browser has disconnected", false, "Browser not responding"),
            new Rule("target page, context or browser has been closed", false, "Browser not responding"),
            new Rule("executable doesn't exist", false, "Browser executable not found"),
            new Rule("chromedriver executable", false, "Browser executable not found"),
            new Rule("session not created", false, "Browser session creation failed"),
            new Rule("page load timeout", false, "Page load timeout"),
            new Rule("timeout", false, "Operation timed out"),
            new Rule("timed out", false, "Operation timed out"),
            new Rule("permission denied", false, "Permission denied"),
            new Rule("access denied", false, "Access denied"),
            new Rule("No such file or directory", true, "Required file not found"),
            new Rule("NoSuchFileException", true, "Required file not found"),
            new Rule("WinError 193", true, "Invalid executable format"),
            new Rule("Exec format error", true, "Invalid executable format"));

    public String normalize(String rawError) {
        if (rawError == null || rawError.isBlank()) {
            return UNKNOWN_ERROR;
        }
        String lower = rawError.toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            if (rule.matches(rawError, lower)) {
                return rule.reason();
            }
        }
        String firstLine = rawError.strip().lines().findFirst().orElse("").strip();
        if (firstLine.isEmpty()) {
            return UNKNOWN_ERROR;
        }
        if (firstLine.length() > MAX_FALLBACK_LENGTH) {
            return firstLine.substring(0, MAX_FALLBACK_LENGTH - 3) + "...";
        }
        return firstLine;
    }

    public String normalize(Throwable error) {
        if (error == null) {
            return UNKNOWN_ERROR;
        }
        return normalize(describe(error));
    }

    /**
     * Exception class name and message, with causes appended, suitable as the
     * raw error of an outcome.
     */
    public static String describe(Throwable error) {
        StringBuilder description = new StringBuilder();
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 5) {
            if (depth > 0) {
                description.append(" <- ");
            }
            description.append(current.getClass().getSimpleName());
            if (current.getMessage() != null) {
                description.append(": ").append(current.getMessage());
            }
            current = current.getCause() == current ? null : current.getCause();
            depth++;
        }
        return description.toString();
    }
}
