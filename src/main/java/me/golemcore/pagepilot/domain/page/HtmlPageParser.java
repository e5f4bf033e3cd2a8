package me.golemcore.pagepilot.domain.page;

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
import me.golemcore.pagepilot.domain.model.ContentList;
import me.golemcore.pagepilot.domain.model.ElementCounts;
import me.golemcore.pagepilot.domain.model.ElementSnapshot;
import me.golemcore.pagepilot.domain.model.FormSnapshot;
import me.golemcore.pagepilot.domain.model.Heading;
import me.golemcore.pagepilot.domain.model.PageModel;
import me.golemcore.pagepilot.domain.model.SourceKind;
import me.golemcore.pagepilot.infrastructure.config.PagePilotProperties;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.select.Elements;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw markup into a {@link PageModel}.
 *
 * <p>
 * Non-content nodes (scripts, styles, embeds, comments) are removed before any
 * text is extracted, so body text and element text never contain script
 * bodies. Every extracted category is capped by
 * {@link PagePilotProperties.ExtractionProperties}; the element counts are
 * taken from the whole cleaned document.
 *
 * <p>
 * The same parser handles a rendered DOM snapshot and static HTML. Static HTML
 * only shows what the server sent, so script-injected elements are absent.
 */
@Component
@Slf4j
public class HtmlPageParser {

    private static final String NON_CONTENT_SELECTOR = "script, style, noscript, iframe, embed, object, template, svg";
    private static final String HEADING_SELECTOR = "h1, h2, h3, h4, h5, h6";
    private static final String INTERACTIVE_SELECTOR =
            "input, textarea, select, button, a[href], [onclick], [role=button]";
    private static final String ATTRIBUTE_CLICKABLE_SELECTOR = "[onclick], [role=button]";
    private static final String BUTTON_SELECTOR = "button, input[type=submit], input[type=button]";

    private static final Set<String> BUTTON_INPUT_TYPES = Set.of("submit", "button", "reset", "image");
    private static final Set<String> KEPT_ATTRIBUTES = Set.of(
            "id", "name", "class", "type", "placeholder", "value", "href", "role", "onclick",
            "aria-label", "title", "action", "method", "required", "for", "data-testid");
    private static final int MAX_ATTRIBUTE_LENGTH = 200;

    private final AuthWallDetector authWallDetector;
    private final PagePilotProperties.ExtractionProperties limits;

    public HtmlPageParser(PagePilotProperties properties, AuthWallDetector authWallDetector) {
        this.limits = properties.getAcquisition().getExtraction();
        this.authWallDetector = authWallDetector;
    }

    public PageModel parse(String html, String url, SourceKind sourceKind) {
        Document document = Jsoup.parse(html == null ? "" : html, url == null ? "" : url);
        removeNonContent(document);

        Element body = document.body();
        String bodyText = truncate(normalize(body.text()), limits.getMaxBodyTextLength());

        PageModel model = PageModel.builder()
                .title(resolveTitle(document))
                .url(url)
                .sourceKind(sourceKind)
                .bodyText(bodyText)
                .headings(extractHeadings(body))
                .paragraphs(extractParagraphs(body))
                .lists(extractLists(body))
                .elementCounts(countElements(document))
                .inputs(extractInputs(body))
                .clickables(extractClickables(body))
                .contextElements(extractContextElements(body))
                .forms(extractForms(body))
                .authWall(authWallDetector.assess(document))
                .build();
        log.debug("[Acquire] Parsed {} ({}): {} inputs, {} clickables, {} headings",
                url, sourceKind, model.getInputs().size(), model.getClickables().size(), model.getHeadings().size());
        return model;
    }

    private void removeNonContent(Document document) {
        document.select(NON_CONTENT_SELECTOR).remove();
        List<Node> comments = new ArrayList<>();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof Comment) {
                    comments.add(node);
                }
            }

            @Override
            public void tail(Node node, int depth) {
                // collection happens on head
            }
        }, document);
        comments.forEach(Node::remove);
    }

    private String resolveTitle(Document document) {
        String title = normalize(document.title());
        if (!title.isEmpty()) {
            return title;
        }
        Element h1 = document.selectFirst("h1");
        return h1 != null ? normalize(h1.text()) : "";
    }

    private List<Heading> extractHeadings(Element body) {
        List<Heading> headings = new ArrayList<>();
        for (Element element : body.select(HEADING_SELECTOR)) {
            if (headings.size() >= limits.getMaxHeadings()) {
                break;
            }
            String text = normalize(element.text());
            if (!text.isEmpty()) {
                int level = element.tagName().charAt(1) - '0';
                headings.add(new Heading(level, truncate(text, limits.getMaxElementTextLength())));
            }
        }
        return List.copyOf(headings);
    }

    private List<String> extractParagraphs(Element body) {
        List<String> paragraphs = new ArrayList<>();
        Elements elements = body.select("p");
        for (int i = 0; i < elements.size() && i < limits.getMaxParagraphs(); i++) {
            String text = normalize(elements.get(i).text());
            if (text.length() > limits.getMinParagraphLength()) {
                paragraphs.add(text);
            }
        }
        return List.copyOf(paragraphs);
    }

    private List<ContentList> extractLists(Element body) {
        List<ContentList> lists = new ArrayList<>();
        Elements elements = body.select("ul, ol");
        for (int i = 0; i < elements.size() && i < limits.getMaxLists(); i++) {
            Element list = elements.get(i);
            List<String> items = new ArrayList<>();
            Elements listItems = list.select("li");
            for (int j = 0; j < listItems.size() && j < limits.getMaxListItems(); j++) {
                String text = normalize(listItems.get(j).text());
                if (!text.isEmpty()) {
                    items.add(text);
                }
            }
            if (!items.isEmpty()) {
                lists.add(new ContentList("ol".equals(list.tagName()), items));
            }
        }
        return List.copyOf(lists);
    }

    private List<ElementSnapshot> extractInputs(Element body) {
        List<ElementSnapshot> inputs = new ArrayList<>();
        for (Element element : body.select("input, textarea, select")) {
            if (inputs.size() >= limits.getMaxInputs()) {
                break;
            }
            String type = element.attr("type").toLowerCase(Locale.ROOT);
            if ("input".equals(element.tagName()) && (BUTTON_INPUT_TYPES.contains(type) || "hidden".equals(type))) {
                continue;
            }
            inputs.add(snapshot(element));
        }
        return List.copyOf(inputs);
    }

    /**
     * Buttons, links and attribute-clickable elements in document order, each
     * category capped on its own.
     */
    private List<ElementSnapshot> extractClickables(Element body) {
        List<ElementSnapshot> clickables = new ArrayList<>();
        int buttons = 0;
        int links = 0;
        int byAttribute = 0;
        for (Element element : body.select(INTERACTIVE_SELECTOR)) {
            String tag = element.tagName();
            if (isButton(element)) {
                if (buttons < limits.getMaxButtons()) {
                    clickables.add(snapshot(element));
                }
                buttons++;
            } else if ("a".equals(tag) && element.hasAttr("href")) {
                if (links < limits.getMaxLinks() && !normalize(element.text()).isEmpty()) {
                    clickables.add(snapshot(element));
                    links++;
                }
            } else if (!isFormControl(element) && isAttributeClickable(element)
                    && byAttribute < limits.getMaxAttributeClickables()) {
                clickables.add(snapshot(element));
                byAttribute++;
            }
        }
        return List.copyOf(clickables);
    }

    /**
     * Divs and spans carrying their own text, plus empty leaf blocks. Wrappers
     * whose content lives in child elements are skipped.
     */
    private List<ElementSnapshot> extractContextElements(Element body) {
        List<ElementSnapshot> context = new ArrayList<>();
        for (Element element : body.select("div, span")) {
            if (context.size() >= limits.getMaxContextElements()) {
                break;
            }
            if (isAttributeClickable(element)) {
                continue;
            }
            if (!normalize(element.ownText()).isEmpty() || element.childrenSize() == 0) {
                context.add(snapshot(element));
            }
        }
        return List.copyOf(context);
    }

    private List<FormSnapshot> extractForms(Element body) {
        List<FormSnapshot> forms = new ArrayList<>();
        Elements elements = body.select("form");
        for (int i = 0; i < elements.size() && i < limits.getMaxForms(); i++) {
            Element form = elements.get(i);
            String method = form.attr("method").isBlank() ? "get" : form.attr("method").toLowerCase(Locale.ROOT);
            forms.add(new FormSnapshot(
                    form.id(),
                    form.attr("action"),
                    method,
                    form.select("input").size(),
                    form.select(BUTTON_SELECTOR).size()));
        }
        return List.copyOf(forms);
    }

    private ElementCounts countElements(Document document) {
        return new ElementCounts(
                document.select("input").size(),
                document.select("button").size(),
                document.select("form").size(),
                document.select("select").size(),
                document.select("textarea").size(),
                document.select("a").size(),
                document.select("img").size(),
                document.select("table").size(),
                document.select(ATTRIBUTE_CLICKABLE_SELECTOR).size(),
                document.select(HEADING_SELECTOR).size(),
                document.select("p").size(),
                document.select("div").size(),
                document.select("span").size());
    }

    private ElementSnapshot snapshot(Element element) {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (Attribute attribute : element.attributes()) {
            String key = attribute.getKey().toLowerCase(Locale.ROOT);
            if (KEPT_ATTRIBUTES.contains(key)) {
                attributes.put(key, truncate(attribute.getValue(), MAX_ATTRIBUTE_LENGTH));
            }
        }
        String text = normalize(element.text());
        if (text.isEmpty()) {
            text = normalize(element.attr("value"));
        }
        return new ElementSnapshot(element.tagName(), truncate(text, limits.getMaxElementTextLength()), attributes);
    }

    private static boolean isButton(Element element) {
        String tag = element.tagName();
        if ("button".equals(tag)) {
            return true;
        }
        return "input".equals(tag) && BUTTON_INPUT_TYPES.contains(element.attr("type").toLowerCase(Locale.ROOT));
    }

    private static boolean isFormControl(Element element) {
        String tag = element.tagName();
        return "input".equals(tag) || "textarea".equals(tag) || "select".equals(tag);
    }

    private static boolean isAttributeClickable(Element element) {
        return element.hasAttr("onclick") || "button".equalsIgnoreCase(element.attr("role"));
    }

    private static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
    }

    private static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
