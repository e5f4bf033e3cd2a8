package me.golemcore.pagepilot.domain.execution;

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

import me.golemcore.pagepilot.domain.model.BrowserBackend;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prepares a generated script for one backend: strips markdown code fences and
 * replaces any previous backend header with one for the target backend.
 */
@Component
public class BackendScriptAdapter {

    static final String HEADER_PREFIX = "// pagepilot-backend: ";

    private static final Pattern FENCED = Pattern.compile("(?s)^\\s*```[\\w-]*\\s*\\R(.*?)\\R?\\s*```\\s*$");

    public String adapt(String script, BrowserBackend backend) {
        String body = stripHeader(stripFences(script));
        return HEADER_PREFIX + backend.getId() + " (" + backend.getEngine().name().toLowerCase(Locale.ROOT)
                + ")\n" + body;
    }

    String stripFences(String script) {
        if (script == null) {
            return "";
        }
        Matcher matcher = FENCED.matcher(script);
        if (matcher.matches()) {
            return matcher.group(1).strip() + "\n";
        }
        return script.strip() + "\n";
    }

    private String stripHeader(String script) {
        if (script.startsWith(HEADER_PREFIX)) {
            int newline = script.indexOf('\n');
            return newline < 0 ? "" : script.substring(newline + 1);
        }
        return script;
    }
}
