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

import me.golemcore.pagepilot.domain.model.ElementCandidate;
import me.golemcore.pagepilot.domain.model.ElementKind;
import me.golemcore.pagepilot.domain.model.ElementSnapshot;
import me.golemcore.pagepilot.domain.model.Heading;
import me.golemcore.pagepilot.domain.model.PageModel;
import me.golemcore.pagepilot.domain.model.PriorityTier;
import me.golemcore.pagepilot.domain.model.RankedElements;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Rule-based classification of page elements into automation priority tiers.
 *
 * <p>
 * Rules:
 * <ul>
 * <li><b>High</b>: credential inputs (type email, password, tel or url, or a
 * credential keyword in name, id or placeholder), submit buttons, and buttons
 * or links whose text contains a submit keyword</li>
 * <li><b>Medium</b>: text, search, number and date inputs, navigation links,
 * and any element with {@code onclick} or {@code role=button}</li>
 * <li><b>Low</b>: everything else, kept as context</li>
 * </ul>
 *
 * <p>
 * Classification depends only on the page model, so classifying the same model
 * twice yields equal results. Within a tier, candidates keep extraction order:
 * inputs, clickables, headings, then context elements.
 */
@Component
public class ElementPrioritizer {

    static final Set<String> CREDENTIAL_INPUT_TYPES = Set.of("email", "password", "tel", "url");
    static final Set<String> CREDENTIAL_KEYWORDS = Set.of("username", "email", "password", "login", "signin");
    static final Set<String> TEXT_INPUT_TYPES = Set.of(
            "text", "search", "number", "date", "datetime-local", "month", "week", "time");
    static final List<String> SUBMIT_KEYWORDS = List.of("submit", "login", "signin", "sign in", "send", "search");
    static final List<String> NAVIGATION_KEYWORDS = List.of("home", "about", "contact", "services", "products");

    private static final double SCORE_DIVISOR = 10.0;

    private final SelectorHintGenerator selectorHintGenerator;

    public ElementPrioritizer(SelectorHintGenerator selectorHintGenerator) {
        this.selectorHintGenerator = selectorHintGenerator;
    }

    public RankedElements classify(PageModel model) {
        List<ElementCandidate> high = new ArrayList<>();
        List<ElementCandidate> medium = new ArrayList<>();
        List<ElementCandidate> low = new ArrayList<>();

        for (ElementSnapshot input : model.getInputs()) {
            add(candidate(ElementKind.INPUT, input, classifyInput(input)), high, medium, low);
        }
        for (ElementSnapshot clickable : model.getClickables()) {
            ElementKind kind = clickableKind(clickable);
            add(candidate(kind, clickable, classifyClickable(kind, clickable)), high, medium, low);
        }
        for (Heading heading : model.getHeadings()) {
            String tag = "h" + heading.level();
            add(new ElementCandidate(ElementKind.HEADING, tag, heading.text(), tag, Map.of(), PriorityTier.LOW),
                    high, medium, low);
        }
        for (ElementSnapshot context : model.getContextElements()) {
            PriorityTier tier = isAttributeClickable(context) ? PriorityTier.MEDIUM : PriorityTier.LOW;
            add(candidate(ElementKind.GENERIC, context, tier), high, medium, low);
        }

        double score = Math.min((high.size() + medium.size()) / SCORE_DIVISOR, 1.0);
        return new RankedElements(high, medium, low, score);
    }

    /**
     * Returns a copy of the model with ranked elements and automation score
     * attached.
     */
    public PageModel rank(PageModel model) {
        return model.withRanking(classify(model));
    }

    private PriorityTier classifyInput(ElementSnapshot input) {
        String type = inputType(input);
        if (CREDENTIAL_INPUT_TYPES.contains(type)) {
            return PriorityTier.HIGH;
        }
        for (String attribute : List.of("name", "id", "placeholder")) {
            String value = compact(input.attribute(attribute));
            if (CREDENTIAL_KEYWORDS.stream().anyMatch(value::contains)) {
                return PriorityTier.HIGH;
            }
        }
        if (TEXT_INPUT_TYPES.contains(type) || "textarea".equals(input.tag())) {
            return PriorityTier.MEDIUM;
        }
        return isAttributeClickable(input) ? PriorityTier.MEDIUM : PriorityTier.LOW;
    }

    private PriorityTier classifyClickable(ElementKind kind, ElementSnapshot element) {
        String text = element.text().toLowerCase(Locale.ROOT);
        if (kind == ElementKind.BUTTON) {
            boolean submitType = "submit".equals(element.attribute("type").toLowerCase(Locale.ROOT));
            if (submitType || containsAny(text, SUBMIT_KEYWORDS)) {
                return PriorityTier.HIGH;
            }
        } else if (kind == ElementKind.LINK) {
            if (containsAny(text, SUBMIT_KEYWORDS)) {
                return PriorityTier.HIGH;
            }
            if (containsAny(text, NAVIGATION_KEYWORDS)) {
                return PriorityTier.MEDIUM;
            }
        }
        return isAttributeClickable(element) ? PriorityTier.MEDIUM : PriorityTier.LOW;
    }

    private ElementKind clickableKind(ElementSnapshot element) {
        return switch (element.tag()) {
        case "button", "input" -> ElementKind.BUTTON;
        case "a" -> element.hasAttribute("href") ? ElementKind.LINK : ElementKind.GENERIC;
        default -> ElementKind.GENERIC;
        };
    }

    private ElementCandidate candidate(ElementKind kind, ElementSnapshot element, PriorityTier tier) {
        return new ElementCandidate(kind, element.tag(), element.text(), selectorHintGenerator.hint(element),
                element.attributes(), tier);
    }

    private static void add(ElementCandidate candidate, List<ElementCandidate> high, List<ElementCandidate> medium,
            List<ElementCandidate> low) {
        switch (candidate.priorityTier()) {
        case HIGH -> high.add(candidate);
        case MEDIUM -> medium.add(candidate);
        default -> low.add(candidate);
        }
    }

    private static String inputType(ElementSnapshot input) {
        String type = input.attribute("type").trim().toLowerCase(Locale.ROOT);
        if (type.isEmpty() && "input".equals(input.tag())) {
            return "text";
        }
        return type;
    }

    private static boolean isAttributeClickable(ElementSnapshot element) {
        return element.hasAttribute("onclick") || "button".equalsIgnoreCase(element.attribute("role"));
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }

    private static String compact(String value) {
        return value.toLowerCase(Locale.ROOT).replace("-", "").replace("_", "").replace(" ", "");
    }
}
