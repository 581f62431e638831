package me.golemcore.newsroom.infrastructure.config;

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

import me.golemcore.newsroom.port.outbound.EmbeddingPort;
import me.golemcore.newsroom.port.outbound.InferencePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans and startup diagnostics.
 *
 * <p>
 * Provides the {@link Clock}, the Jackson {@link ObjectMapper} used for
 * checkpoints, JSON-RPC frames and REST payloads, and the bounded executor
 * that runs tool calls in parallel.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class NewsroomConfiguration {

    private final NewsroomProperties properties;
    private final InferencePort inferencePort;
    private final EmbeddingPort embeddingPort;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(name = "toolDispatchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService toolDispatchExecutor() {
        int threads = Math.max(1, properties.getTools().getMaxConcurrency());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "tool-dispatch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Newsroom starting...");
        log.info("Topic: {}", properties.getResearch().getTopic());
        log.info("LLM Provider: {} ({}, available: {})", properties.getLlm().getProvider(),
                inferencePort.getModel(), inferencePort.isAvailable());
        log.info("Embedding Model: {} (available: {})", embeddingPort.getModel(), embeddingPort.isAvailable());
        log.info("Store: {} at {}", properties.getStore().getType(), properties.getStore().getBasePath());
        log.info("Capability providers: {}", properties.getProviders().keySet());
    }
}
