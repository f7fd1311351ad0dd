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

package me.golemcore.virality.adapter.outbound.llm;

import me.golemcore.virality.domain.exception.LlmCompletionException;
import me.golemcore.virality.infrastructure.config.ViralityProperties;
import me.golemcore.virality.port.outbound.CompletionPort;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Completion adapter over an OpenAI-compatible chat endpoint (OpenRouter by
 * default) using langchain4j.
 *
 * <p>
 * The model is created lazily on first use. Without
 * {@code virality.llm.api-key} the adapter reports itself unavailable and
 * every call fails with {@link LlmCompletionException}.
 */
@Component
@Slf4j
public class Langchain4jCompletionAdapter implements CompletionPort {

    private final ViralityProperties.LlmProperties config;
    private volatile ChatModel chatModel;

    public Langchain4jCompletionAdapter(ViralityProperties properties) {
        this.config = properties.getLlm();
    }

    Langchain4jCompletionAdapter(ViralityProperties properties, ChatModel chatModel) {
        this.config = properties.getLlm();
        this.chatModel = chatModel;
    }

    @Override
    public boolean isAvailable() {
        return chatModel != null || (config.getApiKey() != null && !config.getApiKey().isBlank());
    }

    @Override
    public CompletableFuture<String> complete(CompletionRequest request) {
        if (!isAvailable()) {
            return CompletableFuture.failedFuture(new LlmCompletionException("Completion API key not configured"));
        }
        return CompletableFuture.supplyAsync(() -> {
            ChatRequest chatRequest = ChatRequest.builder()
                    .messages(SystemMessage.from(request.systemPrompt()), UserMessage.from(request.userPrompt()))
                    .temperature(request.temperature())
                    .maxOutputTokens(request.maxTokens())
                    .build();
            try {
                ChatResponse response = getChatModel().chat(chatRequest);
                AiMessage message = response != null ? response.aiMessage() : null;
                if (message == null || message.text() == null || message.text().isBlank()) {
                    throw new LlmCompletionException("No content in completion response");
                }
                return message.text();
            } catch (LlmCompletionException e) {
                throw e;
            } catch (RuntimeException e) {
                log.debug("[Insight] Completion call failed", e);
                throw new LlmCompletionException("Completion call failed: " + e.getMessage(), e);
            }
        });
    }

    private ChatModel getChatModel() {
        ChatModel model = chatModel;
        if (model == null) {
            synchronized (this) {
                if (chatModel == null) {
                    chatModel = createModel();
                    log.info("[Insight] Initialized completion model {}", config.getModel());
                }
                model = chatModel;
            }
        }
        return model;
    }

    private ChatModel createModel() {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0)
                .timeout(Duration.ofMillis(config.getTimeoutMs()));
        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }
}
