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

import me.golemcore.pagepilot.domain.model.AuthWallAssessment;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scores a cleaned document for signs of a login wall.
 *
 * <p>
 * Score = login forms x3 + password fields x2 + one point for each of the
 * phrases "login", "sign in" and "authenticate" found in the markup. A page is
 * considered walled when the score exceeds 2.
 */
@Component
public class AuthWallDetector {

    private static final String LOGIN_FORM_SELECTOR = "form[action*=login], form[id*=login]";
    private static final String PASSWORD_SELECTOR = "input[type=password]";
    private static final List<String> AUTH_PHRASES = List.of("login", "sign in", "authenticate");
    private static final int DETECTION_THRESHOLD = 2;

    public AuthWallAssessment assess(Document document) {
        int loginForms = document.select(LOGIN_FORM_SELECTOR).size();
        int passwordFields = document.select(PASSWORD_SELECTOR).size();
        String markup = document.outerHtml().toLowerCase(Locale.ROOT);

        List<String> indicators = new ArrayList<>();
        int score = loginForms * 3 + passwordFields * 2;
        if (loginForms > 0) {
            indicators.add("login forms: " + loginForms);
        }
        if (passwordFields > 0) {
            indicators.add("password fields: " + passwordFields);
        }
        for (String phrase : AUTH_PHRASES) {
            if (markup.contains(phrase)) {
                score++;
                indicators.add("text: " + phrase);
            }
        }
        double confidence = Math.min(score / 10.0, 1.0);
        return new AuthWallAssessment(score > DETECTION_THRESHOLD, score, confidence, indicators);
    }
}
