package me.golemcore.pagepilot.domain.ranking;

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

import me.golemcore.pagepilot.domain.model.ElementSnapshot;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds a CSS selector hint for an element, preferring the most stable
 * attribute available: {@code id}, then {@code name}, then the class list (only
 * when it has at most three classes), then {@code tag[placeholder]} or
 * {@code tag[type]}, then the bare tag.
 */
@Component
public class SelectorHintGenerator {

    private static final Pattern CSS_IDENTIFIER = Pattern.compile("-?[_a-zA-Z][_a-zA-Z0-9-]*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MAX_CLASSES = 3;

    public String hint(ElementSnapshot element) {
        String id = element.attribute("id").trim();
        if (!id.isEmpty()) {
            return CSS_IDENTIFIER.matcher(id).matches() ? "#" + id : "[id=" + quote(id) + "]";
        }
        String name = element.attribute("name").trim();
        if (!name.isEmpty()) {
            return "[name=" + quote(name) + "]";
        }
        String classAttribute = element.attribute("class").trim();
        if (!classAttribute.isEmpty()) {
            List<String> classes = Arrays.stream(WHITESPACE.split(classAttribute))
                    .filter(c -> !c.isEmpty())
                    .collect(Collectors.toList());
            boolean usable = classes.size() <= MAX_CLASSES
                    && classes.stream().allMatch(c -> CSS_IDENTIFIER.matcher(c).matches());
            if (usable) {
                return classes.stream().map(c -> "." + c).collect(Collectors.joining());
            }
        }
        String tag = element.tag().isEmpty() ? "*" : element.tag();
        String placeholder = element.attribute("placeholder").trim();
        if (!placeholder.isEmpty()) {
            return tag + "[placeholder=" + quote(placeholder) + "]";
        }
        String type = element.attribute("type").trim();
        if (!type.isEmpty()) {
            return tag + "[type=" + quote(type) + "]";
        }
        return tag;
    }

    private static String quote(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
