package me.golemcore.newsroom.adapter.outbound.capability;

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

import me.golemcore.newsroom.domain.model.ProviderConfig;
import me.golemcore.newsroom.domain.model.TransportType;
import me.golemcore.newsroom.infrastructure.config.NewsroomProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

/**
 * Builds the MCP client variant matching a provider's configured transport.
 */
@Component
@RequiredArgsConstructor
public class CapabilityClientFactory {

    private final ObjectMapper objectMapper;
    private final OkHttpClient okHttpClient;

    public AbstractMcpClient create(String name, NewsroomProperties.ProviderProperties provider) {
        ProviderConfig config = toConfig(name, provider);
        return switch (config.getTransport()) {
        case STDIO -> new StdioCapabilityClient(config, objectMapper);
        case HTTP -> new StreamableHttpCapabilityClient(config, objectMapper, okHttpClient);
        };
    }

    ProviderConfig toConfig(String name, NewsroomProperties.ProviderProperties provider) {
        TransportType transport = provider.getTransport() != null ? provider.getTransport() : TransportType.STDIO;
        return ProviderConfig.builder()
                .name(name)
                .transport(transport)
                .command(provider.getCommand())
                .args(provider.getArgs())
                .env(provider.getEnv())
                .url(provider.getUrl())
                .apiKey(provider.getApiKey())
                .headers(provider.getHeaders())
                .startupTimeoutSeconds(provider.getStartupTimeoutSeconds() > 0
                        ? provider.getStartupTimeoutSeconds()
                        : 30)
                .requestTimeoutSeconds(provider.getRequestTimeoutSeconds() > 0
                        ? provider.getRequestTimeoutSeconds()
                        : 60)
                .build();
    }
}
