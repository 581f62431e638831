package me.golemcore.newsroom.adapter.outbound.embedding;

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
import me.golemcore.newsroom.port.outbound.EmbeddingPort;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Embedding adapter using langchain4j and OpenAI.
 *
 * <p>
 * Default model: text-embedding-3-small (1536 dimensions)
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code newsroom.llm.embedding-api-key} - OpenAI API key, falls back to
 * {@code newsroom.llm.api-key}
 * <li>{@code newsroom.llm.embedding-model} - Embedding model name
 * </ul>
 *
 * @see me.golemcore.newsroom.domain.node.QualityNode
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private static final String DEFAULT_MODEL = "text-embedding-3-small";

    private final NewsroomProperties properties;

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized) {
            return;
        }

        NewsroomProperties.LlmProperties llm = properties.getLlm();
        String apiKey = llm.getEmbeddingApiKey() != null && !llm.getEmbeddingApiKey().isBlank()
                ? llm.getEmbeddingApiKey()
                : llm.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("OpenAI API key not configured, embedding service unavailable");
            initialized = true;
            return;
        }

        try {
            var builder = OpenAiEmbeddingModel.builder()
                    .apiKey(apiKey)
                    .modelName(getModel())
                    .maxRetries(0) // Retry handled by the workflow engine
                    .timeout(Duration.ofSeconds(llm.getTimeoutSeconds()));
            if ("openai".equals(llm.getProvider()) && llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
                builder.baseUrl(llm.getBaseUrl());
            }
            embeddingModel = builder.build();
            log.info("Embedding model initialized: {}", getModel());
        } catch (RuntimeException e) {
            log.error("Failed to initialize embedding model", e);
        }

        initialized = true;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();

            if (embeddingModel == null) {
                throw new IllegalStateException("Embedding model not available");
            }

            Response<Embedding> response = embeddingModel.embed(text);
            return response.content().vector();
        });
    }

    @Override
    public String getModel() {
        String model = properties.getLlm().getEmbeddingModel();
        return model != null && !model.isBlank() ? model : DEFAULT_MODEL;
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return embeddingModel != null;
    }
}
