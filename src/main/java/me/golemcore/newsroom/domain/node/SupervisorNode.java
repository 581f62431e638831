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
import me.golemcore.newsroom.domain.model.NextHint;
import me.golemcore.newsroom.domain.model.NodeName;
import me.golemcore.newsroom.domain.model.NodeOutcome;
import me.golemcore.newsroom.domain.model.RunState;
import me.golemcore.newsroom.domain.workflow.WorkflowNode;
import me.golemcore.newsroom.infrastructure.config.NewsroomProperties;
import me.golemcore.newsroom.port.outbound.InferencePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decides which worker acts next.
 *
 * <p>
 * Routing is a fixed decision table over the run state:
 * <ol>
 * <li>publication present → FINISH
 * <li>tool results waiting for a requester → back to that requester
 * <li>no research → RESEARCH
 * <li>research but no draft → WRITE
 * <li>unchecked draft → CHECK_QUALITY
 * <li>unique draft → PUBLISH
 * <li>duplicate draft → WRITE, or reject the run once
 * {@code newsroom.supervisor.max-redrafts} duplicates were seen in a row
 * </ol>
 *
 * <p>
 * When {@code newsroom.supervisor.advisor-enabled} is set, rules 4 and 7 ask
 * the model whether to write or to research again. Only those two answers are
 * accepted; anything else, or an advisor failure, falls back to the table.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SupervisorNode implements WorkflowNode {

    private static final String ADVISOR_PROMPT = """
            You are a supervisor managing a newsroom with the following workers: researcher and writer.
            Given the state of the current article, respond with the worker to act next.
            Listen to the recommendations of the quality checker: if the draft repeats a past article,
            a different story from the researcher is usually better than a rewrite of the same story.
            Respond with exactly one word: RESEARCH or WRITE.
            """;

    private final InferencePort inferencePort;
    private final NewsroomProperties properties;

    @Override
    public NodeName getName() {
        return NodeName.SUPERVISOR;
    }

    @Override
    public NodeOutcome execute(RunState state) {
        NextHint hint = decide(state);
        log.info("[Supervisor] Next: {}", hint);
        return NodeOutcome.of(state, hint);
    }

    NextHint decide(RunState state) {
        if (state.hasPublication()) {
            return NextHint.FINISH;
        }

        NodeName requester = state.getToolRequester();
        if (requester != null && state.hasResultsFor(requester)) {
            return resumeRequester(requester);
        }

        if (!state.hasResearch()) {
            return NextHint.RESEARCH;
        }
        if (!state.hasDraft()) {
            return adviseOrDefault(state, "Research is available but there is no draft yet.");
        }

        return switch (state.getQualityVerdict()) {
        case UNCHECKED -> NextHint.CHECK_QUALITY;
        case UNIQUE -> NextHint.PUBLISH;
        case DUPLICATE -> {
            int maxRedrafts = properties.getSupervisor().getMaxRedrafts();
            if (state.getDuplicateVerdicts() >= maxRedrafts) {
                throw new WorkflowException(FailureKind.DUPLICATE_CONTENT_REJECTED,
                        "Draft judged duplicate " + state.getDuplicateVerdicts() + " time(s) in a row");
            }
            yield adviseOrDefault(state, String.format(Locale.ROOT,
                    "The quality checker rejected the draft as a duplicate (similarity %.2f).",
                    state.getQualityScore() != null ? state.getQualityScore() : 0.0));
        }
        };
    }

    private NextHint resumeRequester(NodeName requester) {
        return switch (requester) {
        case RESEARCHER -> NextHint.RESEARCH;
        case PUBLISHER -> NextHint.PUBLISH;
        case WRITER -> NextHint.WRITE;
        default -> throw new WorkflowException(FailureKind.CONFIGURATION_ERROR,
                "Tool results requested by " + requester + " cannot be routed back");
        };
    }

    private NextHint adviseOrDefault(RunState state, String situation) {
        NewsroomProperties.SupervisorProperties config = properties.getSupervisor();
        if (!config.isAdvisorEnabled() || state.getResearchRounds() >= config.getMaxResearchRounds()) {
            return NextHint.WRITE;
        }

        String context = "User request: " + state.getRequest() + "\n"
                + situation + "\n"
                + "Research rounds so far: " + state.getResearchRounds() + "\n"
                + "Rejected drafts: " + state.getRejectedDrafts().size();
        long timeoutSeconds = properties.getLlm().getTimeoutSeconds();
        try {
            String answer = inferencePort.complete(ADVISOR_PROMPT, context).get(timeoutSeconds, TimeUnit.SECONDS);
            NextHint proposed = parseProposal(answer);
            if (proposed != null) {
                log.info("[Supervisor] Advisor proposed {}", proposed);
                return proposed;
            }
            log.warn("[Supervisor] Ignoring invalid advisor proposal '{}', defaulting to WRITE", answer);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Supervisor] Advisor interrupted, defaulting to WRITE");
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Supervisor] Advisor unavailable ({}), defaulting to WRITE", e.getMessage());
        }
        return NextHint.WRITE;
    }

    static NextHint parseProposal(String answer) {
        if (answer == null) {
            return null;
        }
        String normalized = answer.trim().toUpperCase(Locale.ROOT).replaceAll("[^A-Z_]", "");
        return switch (normalized) {
        case "RESEARCH", "RESEARCHER", "RESEARCHERNODE", "RESEARCHER_NODE" -> NextHint.RESEARCH;
        case "WRITE", "WRITER", "WRITERNODE", "WRITER_NODE" -> NextHint.WRITE;
        default -> null;
        };
    }
}
