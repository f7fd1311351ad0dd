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

import java.util.concurrent.CompletableFuture;

/**
 * Port for a third-party text-completion API: given a prompt, return a text
 * completion or fail.
 *
 * <p>
 * Failures complete the future exceptionally with
 * {@link me.golemcore.virality.domain.exception.LlmCompletionException}.
 */
public interface CompletionPort {

    CompletableFuture<String> complete(CompletionRequest request);

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();

    /**
     * @param temperature
     *            sampling temperature
     * @param maxTokens
     *            upper bound on completion length
     */
    record CompletionRequest(String systemPrompt, String userPrompt, double temperature, int maxTokens) {
    }
}
