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

import me.golemcore.newsroom.domain.exception.WorkflowException;
import me.golemcore.newsroom.domain.model.FailureKind;
import me.golemcore.newsroom.domain.model.Message;
import me.golemcore.newsroom.domain.model.NextHint;
import me.golemcore.newsroom.domain.model.NodeName;
import me.golemcore.newsroom.domain.model.NodeOutcome;
import me.golemcore.newsroom.domain.model.PublicationReceipt;
import me.golemcore.newsroom.domain.model.QualityVerdict;
import me.golemcore.newsroom.domain.model.RunState;
import me.golemcore.newsroom.domain.model.ToolCall;
import me.golemcore.newsroom.domain.model.ToolFailureKind;
import me.golemcore.newsroom.domain.model.ToolResult;
import me.golemcore.newsroom.domain.workflow.WorkflowNode;
import me.golemcore.newsroom.infrastructure.config.NewsroomProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes the approved draft through the publishing capability.
 *
 * <p>
 * The publisher refuses to run unless the current draft was checked and found
 * unique. It requests the publish call once per run: when invoked again it
 * only reads the result of that call. A failed or missing result is fatal,
 * because the outcome on the remote side is unknown. The only exception is a
 * call that was provably never sent, which is requested again under a new id.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PublisherNode implements WorkflowNode {

    private final NewsroomProperties properties;
    private final Clock clock;

    @Override
    public NodeName getName() {
        return NodeName.PUBLISHER;
    }

    @Override
    public NodeOutcome execute(RunState state) {
        if (!state.hasDraft() || state.getQualityVerdict() != QualityVerdict.UNIQUE) {
            throw new WorkflowException(FailureKind.PUBLISH_PRECONDITION_FAILED,
                    "Publishing requires a draft checked as unique, verdict is " + state.getQualityVerdict());
        }
        if (state.hasPublication()) {
            throw new WorkflowException(FailureKind.PRECONDITION_VIOLATION, "Run already published");
        }

        if (state.getPublishCallId() != null) {
            return collect(state);
        }
        return requestPublish(state);
    }

    private NodeOutcome requestPublish(RunState state) {
        NewsroomProperties.PublisherProperties config = properties.getPublisher();

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("author", config.getAuthor());
        params.put("commentary", state.getDraft());
        params.put("visibility", config.getVisibility());
        params.put("lifecycleState", config.getLifecycleState());
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("params", params);

        ToolCall call = state.requestTool(NodeName.PUBLISHER, config.getTool(), arguments);
        state.setPublishCallId(call.getId());
        state.getHistory().add(Message.assistant(NodeName.PUBLISHER,
                "Publishing approved draft via " + config.getTool(), clock.instant()));
        log.info("[Publisher] Requesting {} (call {})", config.getTool(), call.getId());
        return NodeOutcome.of(state, NextHint.NEEDS_TOOLS);
    }

    private NodeOutcome collect(RunState state) {
        String callId = state.getPublishCallId();
        ToolResult result = state.getToolResults().get(callId);
        if (result == null) {
            throw new WorkflowException(FailureKind.PRECONDITION_VIOLATION,
                    "Outcome of publish call " + callId + " is unknown, refusing to publish again");
        }
        state.clearToolResults();

        if (!result.isSuccess() && result.getFailureKind() != null && result.getFailureKind().isNeverSent()) {
            log.warn("[Publisher] Publish call {} was never sent ({}), requesting it again", callId,
                    result.getFailureKind());
            state.setPublishCallId(null);
            return requestPublish(state);
        }
        if (!result.isSuccess()) {
            FailureKind kind = result.getFailureKind() == ToolFailureKind.UNKNOWN_TOOL
                    ? FailureKind.CONFIGURATION_ERROR
                    : FailureKind.PUBLISH_FAILED;
            throw new WorkflowException(kind, "Publish call " + callId + " failed: " + result.getError());
        }

        state.setPublication(PublicationReceipt.builder()
                .toolCallId(callId)
                .articleText(state.getDraft())
                .providerResponse(result.getOutput())
                .publishedAt(clock.instant())
                .build());
        state.getHistory().add(Message.assistant(NodeName.PUBLISHER, "Published: " + result.getOutput(),
                clock.instant()));
        log.info("[Publisher] Article published (call {})", callId);
        return NodeOutcome.of(state, NextHint.PUBLISHED);
    }
}
