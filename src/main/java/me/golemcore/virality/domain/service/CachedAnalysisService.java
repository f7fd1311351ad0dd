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

package me.golemcore.virality.domain.service;

import me.golemcore.virality.cache.CacheKeys;
import me.golemcore.virality.cache.CachePurpose;
import me.golemcore.virality.cache.ResilientCache;
import me.golemcore.virality.domain.model.AnalysisReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Caching facade over {@link FallbackOrchestrator}. Identical text within the
 * analysis TTL returns the cached report without rescoring.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CachedAnalysisService {

    private final FallbackOrchestrator orchestrator;
    private final ResilientCache cache;

    public AnalysisReport analyze(String text) {
        return analyze(text, null);
    }

    /**
     * @param contextHash
     *            optional fragment distinguishing analyses of the same text
     *            under different context; {@code null} for none
     */
    public AnalysisReport analyze(String text, String contextHash) {
        FallbackOrchestrator.validate(text);
        String key = CacheKeys.tweetAnalysis(text, contextHash);
        return cache.getOrCompute(CachePurpose.ANALYSIS, key, AnalysisReport.class, () -> {
            log.debug("[Cache] Miss for {}, scoring", key);
            return orchestrator.analyze(text);
        });
    }
}
