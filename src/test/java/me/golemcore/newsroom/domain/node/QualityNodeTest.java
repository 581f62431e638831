package me.golemcore.newsroom.domain.node;

import me.golemcore.newsroom.adapter.outbound.store.InMemoryEpisodicStore;
import me.golemcore.newsroom.domain.exception.RetryableToolException;
import me.golemcore.newsroom.domain.exception.WorkflowException;
import me.golemcore.newsroom.domain.model.EpisodicRecord;
import me.golemcore.newsroom.domain.model.FailureKind;
import me.golemcore.newsroom.domain.model.NeighborMatch;
import me.golemcore.newsroom.domain.model.NextHint;
import me.golemcore.newsroom.domain.model.NodeOutcome;
import me.golemcore.newsroom.domain.model.QualityVerdict;
import me.golemcore.newsroom.domain.model.ResearchFinding;
import me.golemcore.newsroom.domain.model.RunState;
import me.golemcore.newsroom.infrastructure.config.NewsroomConfiguration;
import me.golemcore.newsroom.infrastructure.config.NewsroomProperties;
import me.golemcore.newsroom.port.outbound.EmbeddingPort;
import me.golemcore.newsroom.port.outbound.SimilarityIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class QualityNodeTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:30:00Z");
    private static final float[] VECTOR = { 0.6f, 0.8f, 0.0f };

    private EmbeddingPort embeddingPort;
    private SimilarityIndex similarityIndex;
    private QualityNode node;

    @BeforeEach
    void setUp() {
        embeddingPort = mock(EmbeddingPort.class);
        similarityIndex = mock(SimilarityIndex.class);
        node = new QualityNode(embeddingPort, similarityIndex, new NewsroomProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
        when(embeddingPort.embed(anyString())).thenReturn(CompletableFuture.completedFuture(VECTOR));
    }

    @Test
    void shouldRefuseToCheckWithoutDraft() {
        RunState state = RunState.start("run-1", "Publish a linkedin article", NOW);

        WorkflowException error = assertThrows(WorkflowException.class, () -> node.execute(state));

        assertEquals(FailureKind.PRECONDITION_VIOLATION, error.getKind());
    }

    @Test
    void shouldApproveWhenNothingWasPublished() {
        when(similarityIndex.nearestNeighbor(any(), anyInt())).thenReturn(List.of());
        RunState state = drafted();

        NodeOutcome outcome = node.execute(state);

        assertEquals(NextHint.QUALITY_CHECKED, outcome.hint());
        assertEquals(QualityVerdict.UNIQUE, state.getQualityVerdict());
        assertEquals(0.0, state.getQualityScore());
        assertNull(state.getNearestRunId());
        assertArrayEquals(VECTOR, state.getDraftEmbedding());
        assertEquals("Approved: no past articles to compare with.", lastHistory(state));
    }

    @Test
    void shouldTreatScoreAtThresholdAsUnique() {
        when(similarityIndex.nearestNeighbor(any(), anyInt())).thenReturn(List.of(match("past", 0.8)));
        RunState state = drafted();
        state.setDuplicateVerdicts(2);

        node.execute(state);

        assertEquals(QualityVerdict.UNIQUE, state.getQualityVerdict());
        assertEquals(0, state.getDuplicateVerdicts());
        assertEquals("past", state.getNearestRunId());
        assertEquals("Approved: closest past article similarity 0.80.", lastHistory(state));
    }

    @Test
    void shouldRejectScoreAboveThreshold() {
        when(similarityIndex.nearestNeighbor(any(), anyInt()))
                .thenReturn(List.of(match("past", 0.81), match("older", 0.4)));
        RunState state = drafted();

        node.execute(state);

        assertEquals(QualityVerdict.DUPLICATE, state.getQualityVerdict());
        assertEquals(1, state.getDuplicateVerdicts());
        assertEquals(0.81, state.getQualityScore());
        assertTrue(lastHistory(state).startsWith("Rejected:"));
        assertTrue(lastHistory(state).contains("run past (similarity 0.81)"));
    }

    @Test
    void shouldRetryOnEmbeddingOrIndexFailure() {
        RunState state = drafted();

        when(embeddingPort.embed(anyString())).thenReturn(CompletableFuture.completedFuture(new float[0]));
        assertThrows(RetryableToolException.class, () -> node.execute(state));

        when(embeddingPort.embed(anyString())).thenReturn(CompletableFuture.completedFuture(VECTOR));
        when(similarityIndex.nearestNeighbor(any(), anyInt())).thenThrow(new IllegalStateException("index offline"));
        RetryableToolException error = assertThrows(RetryableToolException.class, () -> node.execute(state));
        assertTrue(error.getMessage().contains("index offline"));
        assertEquals(QualityVerdict.UNCHECKED, state.getQualityVerdict());
    }

    @Test
    void shouldFailWhenPublishedArticlesUseAnotherEmbeddingDimension() {
        InMemoryEpisodicStore store = new InMemoryEpisodicStore(NewsroomConfiguration.objectMapper());
        store.recordArticle(new EpisodicRecord("past", "Funds adopt LLMs.", new float[] { 1f, 0f, 0f }, NOW));
        when(embeddingPort.embed(anyString()))
                .thenReturn(CompletableFuture.completedFuture(new float[] { 1f, 0f }));
        QualityNode withStore = new QualityNode(embeddingPort, store, new NewsroomProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
        RunState state = drafted();

        WorkflowException error = assertThrows(WorkflowException.class, () -> withStore.execute(state));

        assertFalse(error instanceof RetryableToolException);
        assertEquals(FailureKind.CONFIGURATION_ERROR, error.getKind());
        assertTrue(error.getMessage().contains("run past"));
        assertEquals(QualityVerdict.UNCHECKED, state.getQualityVerdict());
    }

    private static NeighborMatch match(String runId, double score) {
        return new NeighborMatch(new EpisodicRecord(runId, "article " + runId, VECTOR, NOW), score);
    }

    private static RunState drafted() {
        RunState state = RunState.start("run-1", "Publish a linkedin article", NOW);
        state.getResearchFindings().add(ResearchFinding.builder().query("q").snippet("s").source("u").build());
        state.replaceDraft("Funds adopt LLMs.");
        return state;
    }

    private static String lastHistory(RunState state) {
        return state.getHistory().get(state.getHistory().size() - 1).getContent();
    }
}
