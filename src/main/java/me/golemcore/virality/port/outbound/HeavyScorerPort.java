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

package me.golemcore.virality.port.outbound;

import me.golemcore.virality.domain.model.AnalysisReport;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the external heavy-scoring backend (the primary path).
 *
 * <p>
 * The returned future runs on the adapter's own execution context and
 * completes exceptionally with
 * {@link me.golemcore.virality.domain.exception.ExternalProcessException} or
 * {@link me.golemcore.virality.domain.exception.MalformedResponseException} on
 * failure. Implementations enforce their own time bound and release any
 * process they started, on every path.
 */
public interface HeavyScorerPort {

    /**
     * Scores the post text. The result is tagged
     * {@link me.golemcore.virality.domain.model.ScoringStrategy#PRIMARY}.
     */
    CompletableFuture<AnalysisReport> score(String text);

    /**
     * Time bound the adapter applies to one invocation, in milliseconds.
     */
    long getTimeoutMs();

    /**
     * Checks if the backend is configured. An unavailable backend still fails
     * fast through {@link #score(String)}.
     */
    boolean isAvailable();
}
