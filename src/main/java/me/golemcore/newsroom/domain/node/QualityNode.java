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
import me.golemcore.newsroom.domain.model.NeighborMatch;
import me.golemcore.newsroom.domain.model.NextHint;
import me.golemcore.newsroom.domain.model.NodeName;
import me.golemcore.newsroom.domain.model.NodeOutcome;
import me.golemcore.newsroom.domain.model.QualityVerdict;
import me.golemcore.newsroom.domain.model.RunState;
import me.golemcore.newsroom.domain.workflow.WorkflowNode;
import me.golemcore.newsroom.infrastructure.config.NewsroomProperties;
import me.golemcore.newsroom.port.outbound.EmbeddingPort;
import me.golemcore.newsroom.port.outbound.SimilarityIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Locale;

/**
 * Rejects drafts that repeat already published articles.
 *
 * <p>
 * The draft is embedded and compared with the nearest published articles. It
 * is a duplicate when the best cosine similarity is strictly greater than
 * {@code newsroom.quality.duplicate-threshold}. The embedding is kept on the
 * state and reused for the episodic record once the draft is published.
 * Stored embeddings of another dimension fail the run with
 * {@link FailureKind#CONFIGURATION_ERROR}: comparing only the compatible ones
 * would approve repeats of the others.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QualityNode implements WorkflowNode {

    private final EmbeddingPort embeddingPort;
    private final SimilarityIndex similarityIndex;
    private final NewsroomProperties properties;
    private final Clock clock;

    @Override
    public NodeName getName() {
        return NodeName.QUALITY;
    }

    @Override
    public NodeOutcome execute(RunState state) {
        if (!state.hasDraft()) {
            throw new WorkflowException(FailureKind.PRECONDITION_VIOLATION, "Quality check invoked without a draft");
        }

        float[] vector = NodeSupport.await(embeddingPort.embed(state.getDraft()),
                properties.getLlm().getTimeoutSeconds(), "Draft embedding");
        if (vector == null || vector.length == 0) {
            throw new RetryableToolException("Embedding service returned an empty vector");
        }

        NewsroomProperties.QualityProperties config = properties.getQuality();
        List<NeighborMatch> neighbors;
        try {
            neighbors = similarityIndex.nearestNeighbor(vector, Math.max(1, config.getNeighbors()));
        } catch (WorkflowException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RetryableToolException("Similarity lookup failed: " + e.getMessage(), e);
        }

        NeighborMatch nearest = neighbors.isEmpty() ? null : neighbors.get(0);
        double score = nearest != null ? nearest.score() : 0.0;
        boolean duplicate = nearest != null && score > config.getDuplicateThreshold();

        state.setDraftEmbedding(vector);
        state.setQualityScore(score);
        state.setNearestRunId(nearest != null ? nearest.record().runId() : null);

        String feedback;
        if (duplicate) {
            state.setQualityVerdict(QualityVerdict.DUPLICATE);
            state.setDuplicateVerdicts(state.getDuplicateVerdicts() + 1);
            feedback = String.format(Locale.ROOT,
                    "Rejected: the draft reports the same news as the article of run %s (similarity %.2f). "
                            + "Research a different story.",
                    nearest.record().runId(), score);
        } else {
            state.setQualityVerdict(QualityVerdict.UNIQUE);
            state.setDuplicateVerdicts(0);
            feedback = nearest == null
                    ? "Approved: no past articles to compare with."
                    : String.format(Locale.ROOT, "Approved: closest past article similarity %.2f.", score);
        }
        state.getHistory().add(Message.assistant(NodeName.QUALITY, feedback, clock.instant()));

        log.info("[Quality] {} (top similarity {}, threshold {})", state.getQualityVerdict(),
                String.format(Locale.ROOT, "%.3f", score), config.getDuplicateThreshold());
        return NodeOutcome.of(state, NextHint.QUALITY_CHECKED);
    }
}
