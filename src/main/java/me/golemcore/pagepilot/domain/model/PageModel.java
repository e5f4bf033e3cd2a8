package me.golemcore.pagepilot.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Normalized, filtered snapshot of one fetched page.
 *
 * <p>
 * A model is built entirely from the data source of a single strategy. The
 * ranked elements and automation score are attached by the prioritizer through
 * {@link #withRanking(RankedElements)}, which returns a copy.
 */
@Value
@Builder(toBuilder = true)
public class PageModel {

    String title;
    String url;
    SourceKind sourceKind;
    String bodyText;
    @Builder.Default
    List<Heading> headings = List.of();
    @Builder.Default
    List<String> paragraphs = List.of();
    @Builder.Default
    List<ContentList> lists = List.of();
    @Builder.Default
    ElementCounts elementCounts = ElementCounts.empty();
    @Builder.Default
    List<ElementSnapshot> inputs = List.of();
    @Builder.Default
    List<ElementSnapshot> clickables = List.of();
    @Builder.Default
    List<ElementSnapshot> contextElements = List.of();
    @Builder.Default
    List<FormSnapshot> forms = List.of();
    @Builder.Default
    AuthWallAssessment authWall = AuthWallAssessment.none();
    @Builder.Default
    RankedElements rankedElements = RankedElements.empty();

    public double getAutomationScore() {
        return rankedElements.automationScore();
    }

    public PageModel withRanking(RankedElements ranking) {
        return toBuilder().rankedElements(ranking).build();
    }
}
