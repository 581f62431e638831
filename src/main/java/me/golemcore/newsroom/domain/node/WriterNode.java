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
import me.golemcore.newsroom.domain.exception.WorkflowException;
import me.golemcore.newsroom.domain.model.FailureKind;
import me.golemcore.newsroom.domain.model.Message;
import me.golemcore.newsroom.domain.model.NextHint;
import me.golemcore.newsroom.domain.model.NodeName;
import me.golemcore.newsroom.domain.model.NodeOutcome;
import me.golemcore.newsroom.domain.model.QualityVerdict;
import me.golemcore.newsroom.domain.model.ResearchFinding;
import me.golemcore.newsroom.domain.model.RunState;
import me.golemcore.newsroom.domain.workflow.WorkflowNode;
import me.golemcore.newsroom.infrastructure.config.NewsroomProperties;
import me.golemcore.newsroom.port.outbound.InferencePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * Writes a short post from the latest research and replaces the current draft
 * with it. Rejected drafts and the last quality verdict are passed to the model
 * so a redraft moves to a different story.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WriterNode implements WorkflowNode {

    private static final String SYSTEM_PROMPT = """
            You are an expert writer tasked with crafting a two-sentence, engaging LinkedIn post about %s. \
            You receive research findings and craft a concise, engaging post based on them, weaving in data \
            and numbers while keeping it captivating, followed by two line breaks and two relevant hashtags. \
            Do not include image URLs.
            Incorporate any feedback from the quality checker. If it says the content is not unique, \
            write about a different news story than the rejected drafts.
            """;

    private final InferencePort inferencePort;
    private final NewsroomProperties properties;
    private final Clock clock;

    @Override
    public NodeName getName() {
        return NodeName.WRITER;
    }

    @Override
    public NodeOutcome execute(RunState state) {
        if (!state.hasResearch()) {
            throw new WorkflowException(FailureKind.PRECONDITION_VIOLATION,
                    "Writer invoked without research findings");
        }

        Double duplicateScore = null;
        if (state.getQualityVerdict() == QualityVerdict.DUPLICATE) {
            duplicateScore = state.getQualityScore();
            state.discardDraft();
        }

        String systemPrompt = String.format(SYSTEM_PROMPT, properties.getResearch().getTopic());
        String context = buildContext(state, duplicateScore);
        String draft = NodeSupport.await(inferencePort.complete(systemPrompt, context),
                properties.getLlm().getTimeoutSeconds(), "Draft generation");
        if (draft == null || draft.isBlank()) {
            throw new RetryableToolException("Writer produced an empty draft");
        }

        state.replaceDraft(draft.strip());
        state.getHistory().add(Message.assistant(NodeName.WRITER, state.getDraft(), clock.instant()));
        log.info("[Writer] Draft ready ({} chars)", state.getDraft().length());
        return NodeOutcome.of(state, NextHint.DRAFT_READY);
    }

    private String buildContext(RunState state, Double duplicateScore) {
        StringBuilder context = new StringBuilder("User request: ").append(state.getRequest()).append("\n\n");
        context.append("Research findings:\n");
        for (ResearchFinding finding : latestFindings(state)) {
            context.append("- ");
            if (finding.getTitle() != null) {
                context.append(finding.getTitle()).append(": ");
            }
            if (finding.getSnippet() != null) {
                context.append(finding.getSnippet());
            }
            if (finding.getSource() != null) {
                context.append(" (").append(finding.getSource()).append(')');
            }
            context.append('\n');
        }

        if (!state.getRejectedDrafts().isEmpty()) {
            context.append("\nQuality feedback: previous drafts repeated already published news");
            if (duplicateScore != null) {
                context.append(String.format(Locale.ROOT, " (similarity %.2f)", duplicateScore));
            }
            context.append(". Rejected drafts:\n");
            state.getRejectedDrafts().forEach(d -> context.append("- ").append(d).append('\n'));
        }
        return context.toString();
    }

    /**
     * Findings of the most recent search, or all findings when none match it.
     */
    private List<ResearchFinding> latestFindings(RunState state) {
        List<String> queries = state.getResearchQueries();
        if (queries.isEmpty()) {
            return state.getResearchFindings();
        }
        String lastQuery = queries.get(queries.size() - 1);
        List<ResearchFinding> latest = state.getResearchFindings().stream()
                .filter(f -> lastQuery.equals(f.getQuery()))
                .toList();
        return latest.isEmpty() ? state.getResearchFindings() : latest;
    }
}
