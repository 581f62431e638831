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

import me.golemcore.newsroom.domain.model.ToolDefinition;
import me.golemcore.newsroom.domain.model.ToolFailureKind;
import me.golemcore.newsroom.domain.model.ToolResult;
import me.golemcore.newsroom.infrastructure.config.NewsroomProperties;
import me.golemcore.newsroom.port.outbound.CapabilityPort;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes tool invocations to the capability provider that advertises the tool.
 *
 * <p>
 * This router provides:
 * <ul>
 * <li>Lazy startup: providers are started on the first invocation or listing
 * <li>Tool index: maps each advertised tool name to its provider
 * <li>Restart of providers whose process or session went away
 * <li>@PreDestroy shutdown: closes all clients on application shutdown
 * </ul>
 *
 * <p>
 * Providers are declared under {@code newsroom.providers.<name>.*}. A provider
 * that fails to start is logged and started again on the next invocation of a
 * tool the index does not know. While any enabled provider stays down, unknown
 * tools are reported as {@link ToolFailureKind#PROVIDER_UNAVAILABLE} rather than
 * {@link ToolFailureKind#UNKNOWN_TOOL}, since the missing provider may expose
 * them.
 *
 * @see AbstractMcpClient
 * @see CapabilityClientFactory
 */
@Component
@Slf4j
public class CapabilityRouter implements CapabilityPort {

    private final NewsroomProperties properties;
    private final CapabilityClientFactory clientFactory;

    private final Map<String, AbstractMcpClient> clients = new ConcurrentHashMap<>();
    private final Map<String, String> toolIndex = new ConcurrentHashMap<>();
    private volatile boolean started;

    public CapabilityRouter(NewsroomProperties properties, CapabilityClientFactory clientFactory) {
        this.properties = properties;
        this.clientFactory = clientFactory;
    }

    @Override
    @SuppressWarnings("PMD.CloseResource")
    public CompletableFuture<ToolResult> invoke(String toolName, Map<String, Object> arguments) {
        ensureStarted();

        String providerName = toolIndex.get(toolName);
        if (providerName == null) {
            List<String> down = startMissingProviders();
            providerName = toolIndex.get(toolName);
            if (providerName == null && !down.isEmpty()) {
                log.warn("[Capabilities] Tool '{}' unavailable, providers not running: {}", toolName, down);
                return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.PROVIDER_UNAVAILABLE,
                        "Tool " + toolName + " unavailable, capability providers not running: " + down));
            }
        }
        if (providerName == null) {
            log.warn("[Capabilities] No provider exposes tool '{}'", toolName);
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL,
                    "No capability provider exposes tool: " + toolName));
        }

        AbstractMcpClient client = getOrRestartClient(providerName);
        if (client == null) {
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.PROVIDER_UNAVAILABLE,
                    "Capability provider '" + providerName + "' is not running"));
        }

        log.debug("[Capabilities] Invoking '{}' on provider '{}'", toolName, providerName);
        return client.invoke(toolName, arguments);
    }

    @Override
    public List<ToolDefinition> listTools() {
        ensureStarted();
        List<ToolDefinition> tools = new ArrayList<>();
        for (AbstractMcpClient client : clients.values()) {
            tools.addAll(client.listTools());
        }
        return tools;
    }

    void ensureStarted() {
        if (started) {
            return;
        }
        synchronized (this) {
            // Double-check after lock
            if (started) {
                return;
            }
            for (Map.Entry<String, NewsroomProperties.ProviderProperties> entry : properties.getProviders()
                    .entrySet()) {
                if (!entry.getValue().isEnabled()) {
                    log.info("[Capabilities] Provider '{}' disabled, skipping", entry.getKey());
                    continue;
                }
                startClient(entry.getKey(), entry.getValue());
            }
            started = true;
        }
    }

    /**
     * Starts the enabled providers that have no client yet.
     *
     * @return names of the enabled providers still not running
     */
    synchronized List<String> startMissingProviders() {
        List<String> down = new ArrayList<>();
        for (Map.Entry<String, NewsroomProperties.ProviderProperties> entry : properties.getProviders()
                .entrySet()) {
            if (!entry.getValue().isEnabled() || clients.containsKey(entry.getKey())) {
                continue;
            }
            log.info("[Capabilities] Retrying start of provider '{}'", entry.getKey());
            if (!startClient(entry.getKey(), entry.getValue())) {
                down.add(entry.getKey());
            }
        }
        return down;
    }

    @SuppressWarnings("PMD.CloseResource")
    private AbstractMcpClient getOrRestartClient(String providerName) {
        AbstractMcpClient existing = clients.get(providerName);
        if (existing != null && existing.isRunning()) {
            return existing;
        }

        synchronized (this) {
            existing = clients.get(providerName);
            if (existing != null && existing.isRunning()) {
                return existing;
            }

            // Close stale client if it exists but isn't running
            if (existing != null) {
                existing.close();
                clients.remove(providerName);
            }

            NewsroomProperties.ProviderProperties provider = properties.getProviders().get(providerName);
            if (provider == null) {
                return null;
            }
            log.info("[Capabilities] Restarting provider '{}'", providerName);
            return startClient(providerName, provider) ? clients.get(providerName) : null;
        }
    }

    @SuppressWarnings("PMD.CloseResource")
    private boolean startClient(String providerName, NewsroomProperties.ProviderProperties provider) {
        AbstractMcpClient client = clientFactory.create(providerName, provider);
        try {
            List<ToolDefinition> tools = client.start();
            clients.put(providerName, client);
            for (ToolDefinition tool : tools) {
                String previous = toolIndex.putIfAbsent(tool.getName(), providerName);
                if (previous != null && !previous.equals(providerName)) {
                    log.warn("[Capabilities] Tool '{}' exposed by both '{}' and '{}', keeping '{}'",
                            tool.getName(), previous, providerName, previous);
                }
            }
            log.info("[Capabilities] Started provider '{}' ({}), {} tools", providerName,
                    provider.getTransport(), tools.size());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[Capabilities] Interrupted while starting provider '{}'", providerName);
            client.close();
            return false;
        } catch (Exception e) {
            log.error("[Capabilities] Failed to start provider '{}': {}", providerName, e.getMessage(), e);
            client.close();
            return false;
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("[Capabilities] Shutting down all capability clients");
        for (Map.Entry<String, AbstractMcpClient> entry : clients.entrySet()) {
            try {
                entry.getValue().close();
            } catch (RuntimeException e) {
                log.warn("[Capabilities] Error closing client '{}': {}", entry.getKey(), e.getMessage());
            }
        }
        clients.clear();
        toolIndex.clear();
        started = false;
    }
}
