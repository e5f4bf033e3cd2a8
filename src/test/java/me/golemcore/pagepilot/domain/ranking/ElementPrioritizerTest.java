package me.golemcore.pagepilot.domain.ranking;

import me.golemcore.pagepilot.domain.model.ElementCandidate;
import me.golemcore.pagepilot.domain.model.ElementKind;
import me.golemcore.pagepilot.domain.model.ElementSnapshot;
import me.golemcore.pagepilot.domain.model.Heading;
import me.golemcore.pagepilot.domain.model.PageModel;
import me.golemcore.pagepilot.domain.model.PriorityTier;
import me.golemcore.pagepilot.domain.model.RankedElements;
import me.golemcore.pagepilot.domain.model.SourceKind;
import me.golemcore.pagepilot.domain.page.AuthWallDetector;
import me.golemcore.pagepilot.domain.page.HtmlPageParser;
import me.golemcore.pagepilot.infrastructure.config.PagePilotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ElementPrioritizerTest {

    private ElementPrioritizer prioritizer;

    @BeforeEach
    void setUp() {
        prioritizer = new ElementPrioritizer(new SelectorHintGenerator());
    }

    @Test
    void shouldRankLoginFormElementsHigh() {
        HtmlPageParser parser = new HtmlPageParser(new PagePilotProperties(), new AuthWallDetector());
        PageModel model = parser.parse("""
                <form action="/login">
                  <input type="password" id="pw">
                  <button type="submit">Go</button>
                </form>
                """, "https://example.test/login", SourceKind.STATIC_HTML);

        RankedElements ranked = prioritizer.classify(model);

        assertEquals(List.of("#pw", "button[type='submit']"),
                ranked.high().stream().map(ElementCandidate::selectorHint).toList());
        assertTrue(ranked.medium().isEmpty());
    }

    @Test
    void shouldRankPlainDivsLow() {
        PageModel model = PageModel.builder()
                .url("https://example.test")
                .contextElements(List.of(div("one"), div("two"), div("three")))
                .build();

        RankedElements ranked = prioritizer.classify(model);

        assertTrue(ranked.high().isEmpty());
        assertTrue(ranked.medium().isEmpty());
        assertEquals(3, ranked.low().size());
        assertTrue(ranked.automationScore() <= 0.3);
        assertTrue(ranked.low().stream().allMatch(c -> c.kind() == ElementKind.GENERIC));
    }

    @Test
    void shouldRankParsedPageWithOnlyThreeDivsLow() {
        HtmlPageParser parser = new HtmlPageParser(new PagePilotProperties(), new AuthWallDetector());
        PageModel model = parser.parse("<div></div><div class=\"card\"></div><div>Note</div>",
                "https://example.test/login", SourceKind.STATIC_HTML);

        RankedElements ranked = prioritizer.classify(model);

        assertTrue(ranked.high().isEmpty());
        assertTrue(ranked.medium().isEmpty());
        assertEquals(3, ranked.low().size());
        assertTrue(ranked.automationScore() <= 0.3);
    }

    @Test
    void shouldDetectCredentialKeywordsInAttributes() {
        PageModel model = PageModel.builder()
                .inputs(List.of(
                        input(Map.of("type", "text", "name", "user_name")),
                        input(Map.of("type", "text", "placeholder", "Sign-In code")),
                        input(Map.of("type", "search", "name", "q")),
                        input(Map.of("type", "checkbox", "name", "remember"))))
                .build();

        RankedElements ranked = prioritizer.classify(model);

        assertEquals(2, ranked.high().size());
        assertEquals("[name='q']", ranked.medium().get(0).selectorHint());
        assertEquals("[name='remember']", ranked.low().get(0).selectorHint());
    }

    @Test
    void shouldClassifyButtonsAndLinksByText() {
        PageModel model = PageModel.builder()
                .clickables(List.of(
                        new ElementSnapshot("button", "Send message", Map.of()),
                        new ElementSnapshot("button", "Cancel", Map.of()),
                        new ElementSnapshot("a", "About us", Map.of("href", "/about")),
                        new ElementSnapshot("a", "Login here", Map.of("href", "/login")),
                        new ElementSnapshot("a", "Blog", Map.of("href", "/blog")),
                        new ElementSnapshot("div", "Menu", Map.of("onclick", "open()"))))
                .build();

        RankedElements ranked = prioritizer.classify(model);

        assertEquals(List.of("Send message", "Login here"), texts(ranked.high()));
        assertEquals(List.of("About us", "Menu"), texts(ranked.medium()));
        assertEquals(List.of("Cancel", "Blog"), texts(ranked.low()));
        assertEquals(0.4, ranked.automationScore(), 1e-9);
    }

    @Test
    void shouldAddHeadingsAsLowContext() {
        PageModel model = PageModel.builder().headings(List.of(new Heading(2, "Section"))).build();

        ElementCandidate heading = prioritizer.classify(model).low().get(0);

        assertEquals(ElementKind.HEADING, heading.kind());
        assertEquals("h2", heading.selectorHint());
        assertEquals(PriorityTier.LOW, heading.priorityTier());
    }

    @Test
    void shouldCapAutomationScoreAtOne() {
        List<ElementSnapshot> inputs = new java.util.ArrayList<>();
        for (int i = 0; i < 12; i++) {
            inputs.add(input(Map.of("type", "email", "id", "e" + i)));
        }

        double score = prioritizer.classify(PageModel.builder().inputs(inputs).build()).automationScore();

        assertEquals(1.0, score, 1e-9);
    }

    @Test
    void shouldBeIdempotent() {
        PageModel model = PageModel.builder()
                .inputs(List.of(input(Map.of("type", "password", "name", "pw"))))
                .clickables(List.of(new ElementSnapshot("a", "Home", Map.of("href", "/"))))
                .build();

        PageModel once = prioritizer.rank(model);
        PageModel twice = prioritizer.rank(once);

        assertEquals(once.getRankedElements(), twice.getRankedElements());
        assertEquals(once.getAutomationScore(), twice.getAutomationScore());
        assertEquals(0.2, once.getAutomationScore(), 1e-9);
    }

    private static ElementSnapshot div(String text) {
        return new ElementSnapshot("div", text, Map.of());
    }

    private static ElementSnapshot input(Map<String, String> attributes) {
        return new ElementSnapshot("input", "", attributes);
    }

    private static List<String> texts(List<ElementCandidate> candidates) {
        return candidates.stream().map(ElementCandidate::text).toList();
    }
}
