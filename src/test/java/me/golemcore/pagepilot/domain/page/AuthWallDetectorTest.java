package me.golemcore.pagepilot.domain.page;

import me.golemcore.pagepilot.domain.model.AuthWallAssessment;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AuthWallDetectorTest {

    private final AuthWallDetector detector = new AuthWallDetector();

    @Test
    void shouldNotFlagPageWithSingleKeyword() {
        AuthWallAssessment assessment = detector.assess(Jsoup.parse("<p>Sign in to comment</p>"));

        assertFalse(assessment.detected());
        assertEquals(1, assessment.score());
        assertEquals(0.1, assessment.confidence(), 1e-9);
    }

    @Test
    void shouldCapConfidenceAtOne() {
        StringBuilder html = new StringBuilder();
        for (int i = 0; i < 4; i++) {
            html.append("<form id='login-").append(i).append("'><input type='password'></form>");
        }

        AuthWallAssessment assessment = detector.assess(Jsoup.parse(html.toString()));

        assertTrue(assessment.detected());
        assertEquals(1.0, assessment.confidence(), 1e-9);
        assertTrue(assessment.indicators().contains("login forms: 4"));
    }
}
