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
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * MCP client for a remote capability provider reached over HTTP.
 *
 * <p>
 * Every JSON-RPC frame is POSTed to the provider URL. The reply is either a
 * plain {@code application/json} body or a {@code text/event-stream} whose
 * {@code data:} events carry JSON-RPC messages. The {@code Mcp-Session-Id}
 * header returned by the initialize call is echoed on every later request.
 *
 * <p>
 * Not a Spring bean. Created per provider by {@link CapabilityClientFactory}.
 */
public class StreamableHttpCapabilityClient extends AbstractMcpClient {

    private static final Logger log = LoggerFactory.getLogger(StreamableHttpCapabilityClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    static final String SESSION_HEADER = "Mcp-Session-Id";
    private static final String EVENT_STREAM = "text/event-stream";

    private final OkHttpClient httpClient;

    private volatile String sessionId;
    private volatile boolean running;

    public StreamableHttpCapabilityClient(ProviderConfig config, ObjectMapper objectMapper,
            OkHttpClient baseHttpClient) {
        super(config, objectMapper);
        int timeoutSeconds = config.getRequestTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Override
    protected void openTransport() throws IOException {
        if (config.getUrl() == null || config.getUrl().isBlank()) {
            throw new IOException("No URL configured for provider " + getProviderName());
        }
        log.info("[MCP:{}] Connecting to {}", getProviderName(), config.getUrl());
        running = true;
    }

    @Override
    protected void transmit(Integer requestId, String json) throws IOException {
        if (!running) {
            throw new IOException("MCP client not connected");
        }
        if (requestId == null) {
            // Notifications are sent inline to keep them ordered before the next request
            post(null, json);
            return;
        }
        CompletableFuture.runAsync(() -> {
            try {
                post(requestId, json);
            } catch (IOException | RuntimeException e) {
                log.warn("[MCP:{}] Request {} failed: {}", getProviderName(), requestId, e.getMessage());
                failRequest(requestId, e);
            }
        });
    }

    private void post(Integer requestId, String json) throws IOException {
        Request.Builder requestBuilder = new Request.Builder()
                .url(config.getUrl())
                .header("Accept", "application/json, " + EVENT_STREAM)
                .post(RequestBody.create(json, JSON));
        addHeaders(requestBuilder);

        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            String session = response.header(SESSION_HEADER);
            if (session != null && !session.isBlank()) {
                sessionId = session;
            }

            if (!response.isSuccessful()) {
                String message = "HTTP " + response.code() + " from provider";
                if (requestId == null) {
                    log.warn("[MCP:{}] Notification rejected: {}", getProviderName(), message);
                    return;
                }
                failRequest(requestId, new McpException(response.code(), message));
                return;
            }

            ResponseBody body = response.body();
            if (requestId == null || body == null || response.code() == 202) {
                return;
            }

            String contentType = response.header("Content-Type", "");
            if (contentType.contains(EVENT_STREAM)) {
                readEventStream(body.source());
            } else {
                String payload = body.string();
                log.debug("[MCP:{}] ← {}", getProviderName(), payload);
                if (!payload.isBlank()) {
                    handleMessage(objectMapper.readTree(payload));
                }
            }
        }
    }

    private void readEventStream(BufferedSource source) throws IOException {
        StringBuilder data = new StringBuilder();
        while (!source.exhausted()) {
            String line = source.readUtf8Line();
            if (line == null) {
                break;
            }
            if (line.isEmpty()) {
                dispatchEvent(data);
            } else if (line.startsWith("data:")) {
                if (!data.isEmpty()) {
                    data.append('\n');
                }
                data.append(line.substring(5).trim());
            }
        }
        dispatchEvent(data);
    }

    private void dispatchEvent(StringBuilder data) throws IOException {
        if (data.isEmpty()) {
            return;
        }
        String payload = data.toString();
        data.setLength(0);
        log.debug("[MCP:{}] ← (event) {}", getProviderName(), payload);
        handleMessage(objectMapper.readTree(payload));
    }

    private void addHeaders(Request.Builder requestBuilder) {
        String apiKey = config.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }
        if (config.getHeaders() != null) {
            for (Map.Entry<String, String> header : config.getHeaders().entrySet()) {
                requestBuilder.header(header.getKey(), header.getValue());
            }
        }
        String session = sessionId;
        if (session != null) {
            requestBuilder.header(SESSION_HEADER, session);
        }
    }

    String getSessionId() {
        return sessionId;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    protected void closeTransport() {
        boolean wasRunning = running;
        running = false;
        String session = sessionId;
        if (!wasRunning || session == null) {
            return;
        }

        Request.Builder requestBuilder = new Request.Builder()
                .url(config.getUrl())
                .delete();
        addHeaders(requestBuilder);
        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            log.debug("[MCP:{}] Session {} closed: HTTP {}", getProviderName(), session, response.code());
        } catch (IOException e) {
            log.debug("[MCP:{}] Failed to close session {}: {}", getProviderName(), session, e.getMessage());
        }
        sessionId = null;
    }
}
