package me.golemcore.newsroom.port.outbound;

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
import me.golemcore.newsroom.domain.model.ToolResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for invoking named tools exposed by external capability providers.
 * Abstracts the transport (local process or remote endpoint) from the domain
 * layer.
 */
public interface CapabilityPort {

    /**
     * Invokes a tool by name. The returned future completes with a failed
     * {@link ToolResult} rather than exceptionally when the provider reports an
     * error.
     */
    CompletableFuture<ToolResult> invoke(String toolName, Map<String, Object> arguments);

    /**
     * Lists the tools currently advertised by the provider(s).
     */
    List<ToolDefinition> listTools();
}
