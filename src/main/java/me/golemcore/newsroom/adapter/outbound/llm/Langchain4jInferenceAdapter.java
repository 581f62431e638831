package me.golemcore.newsroom.adapter.outbound.llm;

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

import me.golemcore.newsroom.infrastructure.config.NewsroomProperties;
import me.golemcore.newsroom.port.outbound.InferencePort;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Text completion adapter using langchain4j.
 *
 * <p>
 * Supports OpenAI (and OpenAI-compatible endpoints via
 * {@code newsroom.llm.base-url}) and Anthropic, selected with
 * {@code newsroom.llm.provider}. The model is created lazily on first use.
 *
 * <p>
 * The adapter never retries: failures surface to the calling node, which
 * reports them as retryable and lets the workflow engine back off.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jInferenceAdapter implements InferencePort {

    private final NewsroomProperties properties;

    private volatile ChatModel chatModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized) {
            return;
        }

        NewsroomProperties.LlmProperties llm = properties.getLlm();
        if (llm.getApiKey() == null || llm.getApiKey().isBlank()) {
            log.warn("[LLM] API key not configured, inference unavailable");
            initialized = true;
            return;
        }

        try {
            chatModel = "anthropic".equalsIgnoreCase(llm.getProvider())
                    ? createAnthropicModel(llm)
                    : createOpenAiModel(llm);
            log.info("[LLM] Chat model initialized: {} ({})", llm.getChatModel(), llm.getProvider());
        } catch (RuntimeException e) {
            log.error("[LLM] Failed to initialize chat model", e);
        }

        initialized = true;
    }

    private ChatModel createOpenAiModel(NewsroomProperties.LlmProperties llm) {
        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getChatModel())
                .temperature(llm.getTemperature())
                .maxRetries(0) // Retry handled by the workflow engine
                .timeout(Duration.ofSeconds(llm.getTimeoutSeconds()));

        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createAnthropicModel(NewsroomProperties.LlmProperties llm) {
        var builder = AnthropicChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getChatModel())
                .temperature(llm.getTemperature())
                .maxRetries(0) // Retry handled by the workflow engine
                .timeout(Duration.ofSeconds(llm.getTimeoutSeconds()));

        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }

    @Override
    public CompletableFuture<String> complete(String systemPrompt, String context) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            if (chatModel == null) {
                throw new IllegalStateException("Chat model not available");
            }

            List<ChatMessage> messages = List.of(
                    SystemMessage.from(systemPrompt),
                    UserMessage.from(context));
            log.trace("[LLM] Completing with {} chars of context", context.length());
            ChatResponse response = chatModel.chat(messages);
            String text = response.aiMessage() != null ? response.aiMessage().text() : null;
            return text != null ? text.trim() : "";
        });
    }

    @Override
    public String getModel() {
        return properties.getLlm().getChatModel();
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return chatModel != null;
    }
}
