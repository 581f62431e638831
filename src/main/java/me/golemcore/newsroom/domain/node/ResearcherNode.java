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
import me.golemcore.newsroom.domain.model.ResearchFinding;
import me.golemcore.newsroom.domain.model.RunState;
import me.golemcore.newsroom.domain.model.ToolFailureKind;
import me.golemcore.newsroom.domain.model.ToolResult;
import me.golemcore.newsroom.domain.workflow.WorkflowNode;
import me.golemcore.newsroom.infrastructure.config.NewsroomProperties;
import me.golemcore.newsroom.port.outbound.InferencePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Gathers recent news for the configured topic.
 *
 * <p>
 * The researcher works in two passes. On the first pass it asks the model for a
 * search query (distinct from earlier queries and rejected drafts), requests the
 * search tool and hands over to tool dispatch. When the supervisor routes the
 * results back, it parses them into findings. An empty result triggers one
 * broadened search over a doubled time window; a second empty result fails the
 * run with {@link FailureKind#NO_RESEARCH_FOUND}.
 *
 * <p>
 * A draft still present when new research starts is moved to the rejected
 * drafts, so a draft never outlives the research it was written from.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResearcherNode implements WorkflowNode {

    private static final String SYSTEM_PROMPT = """
            You are an expert researcher tasked with finding the latest news in %s from the last %d days, \
            noting that today is %s, tailored for advanced undergraduates seeking to apply for quant roles.
            Select a topic and reply with a single web search query for it, nothing else.
            If previous queries or rejected drafts are listed, pick a query as distinct as possible from them.
            """;
    private static final DateTimeFormatter PUBLISHED_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'");
    private static final int MAX_SEARCH_ATTEMPTS = 2;

    private final InferencePort inferencePort;
    private final ResearchResultParser resultParser;
    private final NewsroomProperties properties;
    private final Clock clock;

    @Override
    public NodeName getName() {
        return NodeName.RESEARCHER;
    }

    @Override
    public NodeOutcome execute(RunState state) {
        if (state.hasResultsFor(NodeName.RESEARCHER)) {
            return collect(state);
        }
        return requestSearch(state, false);
    }

    private NodeOutcome requestSearch(RunState state, boolean broadened) {
        if (state.hasDraft()) {
            log.info("[Researcher] Discarding current draft before new research");
            state.discardDraft();
        }

        NewsroomProperties.ResearchProperties config = properties.getResearch();
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
        int lookbackDays = broadened ? config.getLookbackDays() * 2 : config.getLookbackDays();
        String query = broadened ? config.getTopic() + " news" : proposeQuery(state, today);

        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("query", query);
        arguments.put("start_published_date", today.minusDays(lookbackDays).atStartOfDay().format(PUBLISHED_DATE));
        arguments.put("end_published_date", today.atTime(23, 59, 59).format(PUBLISHED_DATE));

        if (broadened) {
            state.setResearchAttempts(state.getResearchAttempts() + 1);
        } else {
            state.setResearchRounds(state.getResearchRounds() + 1);
            state.setResearchAttempts(1);
        }
        state.getResearchQueries().add(query);
        state.requestTool(NodeName.RESEARCHER, config.getSearchTool(), arguments);
        state.getHistory().add(Message.assistant(NodeName.RESEARCHER,
                (broadened ? "Broadened search: " : "Searching: ") + query, clock.instant()));

        log.info("[Researcher] Requesting {} (round {}, attempt {}): {}", config.getSearchTool(),
                state.getResearchRounds(), state.getResearchAttempts(), query);
        return NodeOutcome.of(state, NextHint.NEEDS_TOOLS);
    }

    private String proposeQuery(RunState state, LocalDate today) {
        NewsroomProperties.ResearchProperties config = properties.getResearch();
        String systemPrompt = String.format(SYSTEM_PROMPT, config.getTopic(), config.getLookbackDays(), today);

        StringBuilder context = new StringBuilder("User request: ").append(state.getRequest());
        if (!state.getResearchQueries().isEmpty()) {
            context.append("\n\nPrevious queries:\n");
            state.getResearchQueries().forEach(q -> context.append("- ").append(q).append('\n'));
        }
        if (!state.getRejectedDrafts().isEmpty()) {
            context.append("\n\nRejected drafts (already covered, pick something else):\n");
            state.getRejectedDrafts().forEach(d -> context.append("- ").append(d).append('\n'));
        }

        String query = NodeSupport.await(inferencePort.complete(systemPrompt, context.toString()),
                properties.getLlm().getTimeoutSeconds(), "Query generation");
        query = query != null ? query.strip().replaceAll("^[\"']+|[\"']+$", "") : "";
        if (query.isBlank()) {
            log.warn("[Researcher] Model returned no query, falling back to topic");
            return config.getTopic() + " latest news";
        }
        return query;
    }

    private NodeOutcome collect(RunState state) {
        Map<String, ToolResult> results = new LinkedHashMap<>(state.getToolResults());
        state.clearToolResults();

        for (ToolResult result : results.values()) {
            if (result.getFailureKind() == ToolFailureKind.UNKNOWN_TOOL) {
                throw new WorkflowException(FailureKind.CONFIGURATION_ERROR,
                        "Search capability unavailable: " + result.getError());
            }
        }

        List<String> queries = state.getResearchQueries();
        String query = queries.isEmpty() ? properties.getResearch().getTopic() : queries.get(queries.size() - 1);
        List<ResearchFinding> findings = resultParser.parse(query, results);

        if (findings.isEmpty()) {
            String errors = results.values().stream()
                    .filter(r -> !r.isSuccess())
                    .map(ToolResult::getError)
                    .collect(Collectors.joining("; "));
            if (state.getResearchAttempts() < MAX_SEARCH_ATTEMPTS) {
                log.warn("[Researcher] No usable results for '{}'{}, broadening search", query,
                        errors.isEmpty() ? "" : " (" + errors + ")");
                return requestSearch(state, true);
            }
            throw new WorkflowException(FailureKind.NO_RESEARCH_FOUND,
                    "No research found after " + state.getResearchAttempts() + " searches"
                            + (errors.isEmpty() ? "" : ": " + errors));
        }

        state.getResearchFindings().addAll(findings);
        state.setResearchAttempts(0);
        String titles = findings.stream()
                .map(f -> f.getTitle() != null ? f.getTitle() : f.getSource())
                .collect(Collectors.joining("; "));
        state.getHistory().add(Message.assistant(NodeName.RESEARCHER,
                "Found " + findings.size() + " result(s): " + titles, clock.instant()));
        log.info("[Researcher] {} finding(s) for '{}'", findings.size(), query);
        return NodeOutcome.of(state, NextHint.RESEARCH_READY);
    }
}
