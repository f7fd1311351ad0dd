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

package me.golemcore.virality.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Rule-based rewrite of a post, optionally enriched with completion-based
 * versions, alternative approaches and hashtag groups.
 */
@Value
@Builder
public class ImprovementSuggestion {

    String original;
    String improved;

    @Singular
    List<String> changes;

    int expectedScoreIncrease;

    @Singular
    List<ImprovedVersion> improvedVersions;

    @Singular
    List<String> alternativeApproaches;

    HashtagSuggestions hashtagSuggestions;
}
