package me.golemcore.newsroom.domain.node;

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

import me.golemcore.newsroom.domain.exception.RetryableToolException;
import me.golemcore.newsroom.domain.model.Message;
import me.golemcore.newsroom.domain.model.NextHint;
import me.golemcore.newsroom.domain.model.NodeName;
import me.golemcore.newsroom.domain.model.NodeOutcome;
import me.golemcore.newsroom.domain.model.RunState;
import me.golemcore.newsroom.domain.model.ToolCall;
import me.golemcore.newsroom.domain.model.ToolFailureKind;
import me.golemcore.newsroom.domain.model.ToolResult;
import me.golemcore.newsroom.domain.workflow.RunCancellationRegistry;
import me.golemcore.newsroom.domain.workflow.WorkflowNode;
import me.golemcore.newsroom.infrastructure.config.NewsroomProperties;
import me.golemcore.newsroom.port.outbound.CapabilityPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes the pending tool calls of a run concurrently on the shared dispatch
 * executor.
 *
 * <p>
 * Every call gets exactly one result keyed by its id. Failures are recorded
 * per call so one broken call does not discard the results of the others.
 * Results and tool messages keep the order in which the calls were requested.
 * The exception is a provider that cannot be started: no call reached it, so
 * the node fails with a {@link RetryableToolException} before touching the
 * state and the whole batch is dispatched again.
 */
@Component
@Slf4j
public class ToolDispatchNode implements WorkflowNode {

    private final CapabilityPort capabilityPort;
    private final ExecutorService executor;
    private final RunCancellationRegistry cancellationRegistry;
    private final NewsroomProperties properties;
    private final Clock clock;

    public ToolDispatchNode(CapabilityPort capabilityPort,
            @Qualifier("toolDispatchExecutor") ExecutorService executor,
            RunCancellationRegistry cancellationRegistry,
            NewsroomProperties properties,
            Clock clock) {
        this.capabilityPort = capabilityPort;
        this.executor = executor;
        this.cancellationRegistry = cancellationRegistry;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public NodeName getName() {
        return NodeName.TOOL_DISPATCH;
    }

    @Override
    public NodeOutcome execute(RunState state) {
        List<ToolCall> calls = new ArrayList<>(state.getPendingToolCalls());
        if (calls.isEmpty()) {
            log.warn("[Dispatch] No pending tool calls for run {}", state.getRunId());
            return NodeOutcome.of(state, NextHint.TOOLS_DONE);
        }

        log.info("[Dispatch] Executing {} tool call(s) for {}", calls.size(), state.getToolRequester());
        Map<String, Future<ToolResult>> futures = new LinkedHashMap<>();
        for (ToolCall call : calls) {
            futures.put(call.getId(), submit(state.getRunId(), call));
        }

        Map<String, ToolResult> results = new LinkedHashMap<>();
        for (ToolCall call : calls) {
            results.put(call.getId(), awaitResult(state.getRunId(), call, futures.get(call.getId())));
        }
        requireProvidersAvailable(state.getRunId(), results);

        for (ToolCall call : calls) {
            ToolResult result = results.get(call.getId());
            state.getToolResults().put(call.getId(), result);
            String content = result.isSuccess() ? result.getOutput() : "Error: " + result.getError();
            state.getHistory().add(Message.tool(call, content, clock.instant()));
        }
        state.getPendingToolCalls().clear();

        long failed = results.values().stream().filter(r -> !r.isSuccess()).count();
        log.info("[Dispatch] Done: {} succeeded, {} failed", results.size() - failed, failed);
        return NodeOutcome.of(state, NextHint.TOOLS_DONE);
    }

    private Future<ToolResult> submit(String runId, ToolCall call) {
        try {
            return executor.submit(() -> invoke(runId, call));
        } catch (RejectedExecutionException e) {
            log.warn("[Dispatch] Executor rejected call {}: {}", call.getId(), e.getMessage());
            return CompletableFuture.completedFuture(
                    ToolResult.failure(ToolFailureKind.NOT_STARTED, "Dispatch executor is shut down"));
        }
    }

    private ToolResult invoke(String runId, ToolCall call) {
        if (cancellationRegistry.isCancelled(runId)) {
            return ToolResult.failure(ToolFailureKind.NOT_STARTED, "Run canceled before the call started");
        }
        long timeoutSeconds = properties.getTools().getCallTimeoutSeconds();
        try {
            ToolResult result = capabilityPort.invoke(call.getName(), call.getArguments())
                    .get(timeoutSeconds, TimeUnit.SECONDS);
            if (result == null) {
                return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool returned no result");
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(ToolFailureKind.CANCELED, "Tool call interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Dispatch] Tool {} failed: {}", call.getName(), cause.getMessage());
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + cause.getMessage());
        } catch (TimeoutException e) {
            return timedOut(runId, call, timeoutSeconds);
        } catch (RuntimeException e) {
            log.warn("[Dispatch] Tool {} failed: {}", call.getName(), e.getMessage());
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool execution failed: " + e.getMessage());
        }
    }

    private ToolResult awaitResult(String runId, ToolCall call, Future<ToolResult> future) {
        // Queued calls wait for a worker first, so the outer wait is not bounded by the call timeout.
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ToolResult.failure(ToolFailureKind.CANCELED, "Dispatch interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + cause.getMessage());
        } catch (CancellationException e) {
            return cancellationRegistry.isCancelled(runId)
                    ? ToolResult.failure(ToolFailureKind.CANCELED, "Run canceled")
                    : ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool call " + call.getId() + " was cancelled");
        }
    }

    private void requireProvidersAvailable(String runId, Map<String, ToolResult> results) {
        if (cancellationRegistry.isCancelled(runId)) {
            return;
        }
        results.values().stream()
                .filter(result -> result.getFailureKind() == ToolFailureKind.PROVIDER_UNAVAILABLE)
                .findFirst()
                .ifPresent(result -> {
                    throw new RetryableToolException(result.getError());
                });
    }

    private ToolResult timedOut(String runId, ToolCall call, long timeoutSeconds) {
        if (cancellationRegistry.isCancelled(runId)) {
            log.info("[Dispatch] Call {} abandoned after cancel", call.getId());
            return ToolResult.failure(ToolFailureKind.CANCELED, "Run canceled while the call was in flight");
        }
        log.warn("[Dispatch] Tool {} timed out after {}s", call.getName(), timeoutSeconds);
        return ToolResult.failure(ToolFailureKind.TIMEOUT,
                "Tool " + call.getName() + " timed out after " + timeoutSeconds + "s");
    }
}
