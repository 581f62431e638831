package me.golemcore.newsroom.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The single accumulated state of one workflow run.
 *
 * <p>
 * Nodes receive a working copy, mutate it and hand it back. The engine
 * snapshots it into a {@link Checkpoint} after every step, so every field must
 * survive a JSON round trip.
 *
 * <p>
 * Invariants maintained by the nodes:
 * <ul>
 * <li>{@code draft} is replaced wholesale, never appended to</li>
 * <li>a draft exists only when research findings exist</li>
 * <li>{@code publication} is set at most once per run</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunState {

    private String runId;
    private String request;

    @Builder.Default
    private List<Message> history = new ArrayList<>();

    @Builder.Default
    private List<ResearchFinding> researchFindings = new ArrayList<>();

    @Builder.Default
    private List<String> researchQueries = new ArrayList<>();

    private int researchRounds;
    private int researchAttempts;

    private String draft;
    private float[] draftEmbedding;

    @Builder.Default
    private QualityVerdict qualityVerdict = QualityVerdict.UNCHECKED;
    private Double qualityScore;
    private String nearestRunId;
    private int duplicateVerdicts;

    @Builder.Default
    private List<String> rejectedDrafts = new ArrayList<>();

    @Builder.Default
    private List<ToolCall> pendingToolCalls = new ArrayList<>();

    @Builder.Default
    private Map<String, ToolResult> toolResults = new LinkedHashMap<>();

    private NodeName toolRequester;
    private int toolCallSequence;
    private String publishCallId;

    private PublicationReceipt publication;

    @Builder.Default
    private RunStatus status = RunStatus.RUNNING;
    private FailureKind failureKind;
    private String failureMessage;

    /**
     * Creates the initial state for a new run seeded with the user's request.
     */
    public static RunState start(String runId, String request, Instant now) {
        RunState state = RunState.builder()
                .runId(runId)
                .request(request)
                .build();
        state.getHistory().add(Message.user(request, now));
        return state;
    }

    public boolean hasResearch() {
        return researchFindings != null && !researchFindings.isEmpty();
    }

    public boolean hasDraft() {
        return draft != null && !draft.isBlank();
    }

    public boolean hasPublication() {
        return publication != null;
    }

    /**
     * Checks whether tool results are waiting to be consumed by the given node.
     */
    public boolean hasResultsFor(NodeName node) {
        return toolRequester == node && toolResults != null && !toolResults.isEmpty();
    }

    /**
     * Replaces the draft and invalidates everything derived from the previous
     * one.
     */
    public void replaceDraft(String text) {
        this.draft = text;
        this.draftEmbedding = null;
        this.qualityVerdict = QualityVerdict.UNCHECKED;
        this.qualityScore = null;
        this.nearestRunId = null;
    }

    /**
     * Moves the current draft to the rejected list so that fresh research can be
     * gathered without violating the draft/research ordering.
     */
    public void discardDraft() {
        if (hasDraft()) {
            rejectedDrafts.add(draft);
        }
        replaceDraft(null);
    }

    /**
     * Registers a tool call on behalf of {@code requester} and returns it.
     */
    public ToolCall requestTool(NodeName requester, String toolName, Map<String, Object> arguments) {
        toolCallSequence++;
        ToolCall call = ToolCall.builder()
                .id(requester.name().toLowerCase(Locale.ROOT) + "-" + toolCallSequence)
                .name(toolName)
                .arguments(new LinkedHashMap<>(arguments))
                .build();
        pendingToolCalls.add(call);
        toolRequester = requester;
        return call;
    }

    /**
     * Drops consumed tool results and forgets who requested them.
     */
    public void clearToolResults() {
        toolResults.clear();
        toolRequester = null;
    }

    public void markFailed(FailureKind kind, String message) {
        this.status = kind == FailureKind.CANCELED ? RunStatus.CANCELED : RunStatus.FAILED;
        this.failureKind = kind;
        this.failureMessage = message;
    }

    public void clearFailure() {
        this.status = RunStatus.RUNNING;
        this.failureKind = null;
        this.failureMessage = null;
    }
}
