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
import me.golemcore.newsroom.domain.model.ToolDefinition;
import me.golemcore.newsroom.domain.model.ToolFailureKind;
import me.golemcore.newsroom.domain.model.ToolResult;
import me.golemcore.newsroom.port.outbound.CapabilityPort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-RPC 2.0 client for a single MCP (Model Context Protocol) capability
 * provider, independent of the transport carrying the frames.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Open the transport ({@link #openTransport()})
 * <li>Send initialize request (JSON-RPC handshake)
 * <li>Fetch available tools (tools/list)
 * <li>Call tools (tools/call)
 * <li>Close the transport
 * </ol>
 *
 * <p>
 * Subclasses only move frames: {@link #transmit(Integer, String)} sends one
 * frame and every frame received from the provider is fed to
 * {@link #handleMessage(JsonNode)}, which matches responses to pending requests
 * by JSON-RPC id.
 *
 * <p>
 * MCP protocol version: 2024-11-05
 *
 * @see StdioCapabilityClient
 * @see StreamableHttpCapabilityClient
 * @see CapabilityRouter
 */
public abstract class AbstractMcpClient implements CapabilityPort, Closeable {

    private static final Logger log = LoggerFactory.getLogger(AbstractMcpClient.class);
    private static final String JSONRPC_VERSION = "2.0";
    protected static final String MCP_PROTOCOL_VERSION = "2024-11-05";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    protected final ProviderConfig config;
    protected final ObjectMapper objectMapper;

    private final AtomicInteger nextId = new AtomicInteger(1);
    private final Map<Integer, CompletableFuture<JsonNode>> pendingRequests = new ConcurrentHashMap<>();

    private volatile List<ToolDefinition> cachedTools;

    protected AbstractMcpClient(ProviderConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
    }

    /**
     * Open the transport, run the handshake and fetch available tools.
     */
    public List<ToolDefinition> start() throws Exception {
        openTransport();
        return initialize();
    }

    /**
     * Runs the initialize handshake over an already opened transport.
     */
    List<ToolDefinition> initialize() throws Exception {
        String name = getProviderName();
        try {
            int timeoutSeconds = config.getStartupTimeoutSeconds();

            JsonNode initResult = sendRequest("initialize", Map.of(
                    "protocolVersion", MCP_PROTOCOL_VERSION,
                    "capabilities", Map.of(),
                    "clientInfo", Map.of(
                            "name", "golemcore-newsroom",
                            "version", "1.0.0")))
                    .get(timeoutSeconds, TimeUnit.SECONDS);

            log.info("[MCP:{}] Initialized: {}", name, initResult);

            sendNotification("notifications/initialized", Map.of());

            JsonNode toolsResult = sendRequest("tools/list", Map.of())
                    .get(timeoutSeconds, TimeUnit.SECONDS);

            cachedTools = parseToolDefinitions(toolsResult);
            log.info("[MCP:{}] Available tools: {}", name,
                    cachedTools.stream().map(ToolDefinition::getName).toList());

            return cachedTools;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[MCP:{}] Initialization failed, cleaning up: {}", name, e.getMessage());
            close();
            throw e;
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.error("[MCP:{}] Initialization failed, cleaning up: {}", name, e.getMessage());
            close();
            throw e;
        }
    }

    @Override
    public CompletableFuture<ToolResult> invoke(String toolName, Map<String, Object> arguments) {
        return sendRequest("tools/call", Map.of(
                "name", toolName,
                "arguments", arguments != null ? arguments : Map.of()))
                .thenApply(result -> parseToolCallResult(toolName, result))
                .exceptionally(ex -> ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                        "MCP tool call failed: " + rootMessage(ex)));
    }

    @Override
    public List<ToolDefinition> listTools() {
        List<ToolDefinition> tools = cachedTools;
        return tools != null ? tools : List.of();
    }

    /**
     * Send a JSON-RPC request and return a future for the result.
     */
    CompletableFuture<JsonNode> sendRequest(String method, Map<String, Object> params) {
        int id = nextId.getAndIncrement();
        CompletableFuture<JsonNode> future = new CompletableFuture<JsonNode>()
                .orTimeout(config.getRequestTimeoutSeconds(), TimeUnit.SECONDS)
                .whenComplete((result, ex) -> pendingRequests.remove(id));
        pendingRequests.put(id, future);

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.put("params", params);

        try {
            String json = objectMapper.writeValueAsString(request);
            log.debug("[MCP:{}] → {}", getProviderName(), json);
            transmit(id, json);
        } catch (IOException e) {
            pendingRequests.remove(id);
            future.completeExceptionally(e);
        }

        return future;
    }

    /**
     * Send a JSON-RPC notification (no id, no response expected).
     */
    void sendNotification(String method, Map<String, Object> params) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);
        if (params != null && !params.isEmpty()) {
            notification.put("params", params);
        }

        try {
            String json = objectMapper.writeValueAsString(notification);
            log.debug("[MCP:{}] → (notification) {}", getProviderName(), json);
            transmit(null, json);
        } catch (IOException e) {
            log.warn("[MCP:{}] Failed to send notification: {}", getProviderName(), e.getMessage());
        }
    }

    /**
     * Dispatches one frame received from the provider. Batches are unpacked,
     * responses complete their pending request and server notifications are
     * logged.
     */
    protected void handleMessage(JsonNode message) {
        if (message == null) {
            return;
        }
        if (message.isArray()) {
            for (JsonNode item : message) {
                handleMessage(item);
            }
            return;
        }

        JsonNode idNode = message.get("id");
        if (idNode != null && idNode.isInt()) {
            int id = idNode.asInt();
            CompletableFuture<JsonNode> pending = pendingRequests.remove(id);
            if (pending == null) {
                log.warn("[MCP:{}] Received response for unknown id: {}", getProviderName(), id);
                return;
            }
            JsonNode error = message.get("error");
            if (error != null && !error.isNull()) {
                pending.completeExceptionally(new McpException(
                        error.has("code") ? error.get("code").asInt() : -1,
                        error.has("message") ? error.get("message").asText() : "Unknown MCP error"));
            } else {
                pending.complete(message.get("result"));
            }
        } else {
            String method = message.has("method") ? message.get("method").asText() : "unknown";
            log.debug("[MCP:{}] Server notification: {}", getProviderName(), method);
        }
    }

    /**
     * Completes the pending request with the given id exceptionally.
     */
    protected void failRequest(Integer id, Throwable error) {
        if (id == null) {
            return;
        }
        CompletableFuture<JsonNode> pending = pendingRequests.remove(id);
        if (pending != null) {
            pending.completeExceptionally(error);
        }
    }

    /**
     * Completes every pending request exceptionally.
     */
    protected void failAllPending(String reason) {
        for (CompletableFuture<JsonNode> future : pendingRequests.values()) {
            future.completeExceptionally(new IOException(reason));
        }
        pendingRequests.clear();
    }

    List<ToolDefinition> parseToolDefinitions(JsonNode result) {
        if (result == null) {
            return List.of();
        }

        JsonNode toolsNode = result.get("tools");
        if (toolsNode == null || !toolsNode.isArray()) {
            return List.of();
        }

        List<ToolDefinition> tools = new ArrayList<>();
        for (JsonNode toolNode : toolsNode) {
            String name = toolNode.has("name") ? toolNode.get("name").asText() : null;
            String description = toolNode.has("description") ? toolNode.get("description").asText() : "";

            if (name == null) {
                continue;
            }

            Map<String, Object> inputSchema = Map.of("type", "object", "properties", Map.of());
            if (toolNode.has("inputSchema")) {
                try {
                    inputSchema = objectMapper.convertValue(toolNode.get("inputSchema"), MAP_TYPE_REF);
                } catch (IllegalArgumentException e) {
                    log.warn("[MCP:{}] Failed to parse inputSchema for tool '{}': {}", getProviderName(), name,
                            e.getMessage());
                }
            }

            tools.add(ToolDefinition.builder()
                    .name(name)
                    .description(description)
                    .inputSchema(inputSchema)
                    .build());
        }
        return tools;
    }

    ToolResult parseToolCallResult(String toolName, JsonNode result) {
        if (result == null) {
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "No result from MCP tool: " + toolName);
        }

        boolean isError = result.has("isError") && result.get("isError").asBoolean(false);

        StringBuilder output = new StringBuilder();
        JsonNode contentNode = result.get("content");
        if (contentNode != null && contentNode.isArray()) {
            for (JsonNode item : contentNode) {
                String type = item.has("type") ? item.get("type").asText() : "text";
                if ("text".equals(type) && item.has("text")) {
                    if (!output.isEmpty()) {
                        output.append("\n");
                    }
                    output.append(item.get("text").asText());
                }
            }
        }

        if (isError) {
            return ToolResult.failure(ToolFailureKind.PROVIDER_ERROR,
                    output.isEmpty() ? "MCP tool error" : output.toString());
        }
        return ToolResult.success(output.isEmpty() ? "(no output)" : output.toString());
    }

    private static String rootMessage(Throwable ex) {
        Throwable cause = ex;
        while (cause.getCause() != null && cause != cause.getCause()) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    public String getProviderName() {
        return config.getName();
    }

    /**
     * Opens the underlying channel. Called once before the handshake.
     */
    protected abstract void openTransport() throws IOException;

    /**
     * Sends one JSON-RPC frame. {@code requestId} is {@code null} for
     * notifications.
     */
    protected abstract void transmit(Integer requestId, String json) throws IOException;

    /**
     * Releases the underlying channel.
     */
    protected abstract void closeTransport();

    public abstract boolean isRunning();

    @Override
    public void close() {
        log.info("[MCP:{}] Closing client", getProviderName());
        failAllPending("MCP client closing");
        closeTransport();
    }
}
