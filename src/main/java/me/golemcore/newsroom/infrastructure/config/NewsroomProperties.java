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

import lombok.Data;
import me.golemcore.newsroom.domain.model.TransportType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the newsroom, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code newsroom.*} prefix:
 * <ul>
 * <li>{@link WorkflowProperties} - step budget, retries, run timeout</li>
 * <li>{@link SupervisorProperties} - redraft limits and the optional advisor</li>
 * <li>{@link ResearchProperties}, {@link QualityProperties},
 * {@link PublisherProperties} - per-node settings</li>
 * <li>{@link ToolsProperties} - dispatch concurrency and per-call timeout</li>
 * <li>{@link ProviderProperties} - capability providers keyed by name</li>
 * <li>{@link LlmProperties}, {@link StoreProperties},
 * {@link HttpProperties}</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "newsroom")
@Data
public class NewsroomProperties {

    private boolean runOnStartup = false;
    private String request = "Publish a linkedin article";

    private WorkflowProperties workflow = new WorkflowProperties();
    private SupervisorProperties supervisor = new SupervisorProperties();
    private ResearchProperties research = new ResearchProperties();
    private QualityProperties quality = new QualityProperties();
    private PublisherProperties publisher = new PublisherProperties();
    private ToolsProperties tools = new ToolsProperties();
    private Map<String, ProviderProperties> providers = new LinkedHashMap<>();
    private LlmProperties llm = new LlmProperties();
    private StoreProperties store = new StoreProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class WorkflowProperties {
        private int maxSteps = 40;
        private int maxRetries = 2;
        private long retryInitialBackoffMs = 500;
        private long retryMaxBackoffMs = 8000;
        private long runTimeoutSeconds = 900;
    }

    @Data
    public static class SupervisorProperties {
        private int maxRedrafts = 3;
        private int maxResearchRounds = 2;
        private boolean advisorEnabled = false;
    }

    @Data
    public static class ResearchProperties {
        private String topic = "quantitative finance";
        private String searchTool = "search_and_content";
        private int lookbackDays = 30;
        private int maxSnippetChars = 400;
    }

    @Data
    public static class QualityProperties {
        private double duplicateThreshold = 0.8;
        private int neighbors = 3;
    }

    @Data
    public static class PublisherProperties {
        private String tool = "LINKEDIN_CREATE_LINKED_IN_POST";
        private String author;
        private String visibility = "PUBLIC";
        private String lifecycleState = "PUBLISHED";
    }

    @Data
    public static class ToolsProperties {
        private int maxConcurrency = 4;
        private long callTimeoutSeconds = 60;
    }

    @Data
    public static class ProviderProperties {
        private boolean enabled = true;
        private TransportType transport = TransportType.STDIO;
        private String command;
        private List<String> args = new ArrayList<>();
        private Map<String, String> env = new LinkedHashMap<>();
        private String url;
        private String apiKey;
        private Map<String, String> headers = new LinkedHashMap<>();
        private int startupTimeoutSeconds = 30;
        private int requestTimeoutSeconds = 60;
    }

    @Data
    public static class LlmProperties {
        private String provider = "openai";
        private String apiKey;
        private String embeddingApiKey;
        private String baseUrl;
        private String chatModel = "gpt-4o";
        private String embeddingModel = "text-embedding-3-small";
        private double temperature = 0.7;
        private long timeoutSeconds = 60;
    }

    @Data
    public static class StoreProperties {
        private String type = "local";
        private String basePath = "${user.home}/.golemcore/newsroom";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
