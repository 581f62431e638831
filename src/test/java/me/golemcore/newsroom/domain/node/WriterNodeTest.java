package me.golemcore.newsroom.domain.node;

import me.golemcore.newsroom.domain.exception.RetryableToolException;
import me.golemcore.newsroom.domain.exception.WorkflowException;
import me.golemcore.newsroom.domain.model.FailureKind;
import me.golemcore.newsroom.domain.model.NextHint;
import me.golemcore.newsroom.domain.model.NodeOutcome;
import me.golemcore.newsroom.domain.model.QualityVerdict;
import me.golemcore.newsroom.domain.model.ResearchFinding;
import me.golemcore.newsroom.domain.model.RunState;
import me.golemcore.newsroom.infrastructure.config.NewsroomProperties;
import me.golemcore.newsroom.port.outbound.InferencePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WriterNodeTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:30:00Z");

    private InferencePort inferencePort;
    private WriterNode node;

    @BeforeEach
    void setUp() {
        inferencePort = mock(InferencePort.class);
        node = new WriterNode(inferencePort, new NewsroomProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldRefuseToWriteWithoutResearch() {
        RunState state = RunState.start("run-1", "Publish a linkedin article", NOW);

        WorkflowException error = assertThrows(WorkflowException.class, () -> node.execute(state));

        assertEquals(FailureKind.PRECONDITION_VIOLATION, error.getKind());
    }

    @Test
    void shouldWriteDraftFromLatestFindings() {
        when(inferencePort.complete(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture("  Funds adopt LLMs. Here is why it matters.  "));
        RunState state = researched();

        NodeOutcome outcome = node.execute(state);

        assertEquals(NextHint.DRAFT_READY, outcome.hint());
        assertEquals("Funds adopt LLMs. Here is why it matters.", state.getDraft());
        assertEquals(QualityVerdict.UNCHECKED, state.getQualityVerdict());
        assertEquals("writer", state.getHistory().get(state.getHistory().size() - 1).getAuthor());

        ArgumentCaptor<String> context = ArgumentCaptor.forClass(String.class);
        verify(inferencePort).complete(anyString(), context.capture());
        assertTrue(context.getValue().contains("Funds adopt LLMs: Survey of 40 funds (https://a.test)"));
        assertFalse(context.getValue().contains("Older story"));
    }

    @Test
    void shouldPassRejectedDuplicateToModel() {
        when(inferencePort.complete(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture("A fresh take."));
        RunState state = researched();
        state.replaceDraft("Same old story.");
        state.setQualityVerdict(QualityVerdict.DUPLICATE);
        state.setQualityScore(0.93);

        node.execute(state);

        assertEquals(List.of("Same old story."), state.getRejectedDrafts());
        assertEquals("A fresh take.", state.getDraft());
        ArgumentCaptor<String> context = ArgumentCaptor.forClass(String.class);
        verify(inferencePort).complete(anyString(), context.capture());
        assertTrue(context.getValue().contains("(similarity 0.93)"));
        assertTrue(context.getValue().contains("- Same old story."));
    }

    @Test
    void shouldTreatBlankOrFailedDraftAsRetryable() {
        RunState state = researched();

        when(inferencePort.complete(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(" "));
        assertThrows(RetryableToolException.class, () -> node.execute(state));

        when(inferencePort.complete(anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IOException("rate limited")));
        RetryableToolException error = assertThrows(RetryableToolException.class, () -> node.execute(state));
        assertTrue(error.getMessage().contains("rate limited"));
    }

    private static RunState researched() {
        RunState state = RunState.start("run-1", "Publish a linkedin article", NOW);
        state.getResearchQueries().add("old query");
        state.getResearchQueries().add("llm funds");
        state.getResearchFindings().add(ResearchFinding.builder()
                .query("old query").title("Older story").snippet("Stale").source("https://b.test").build());
        state.getResearchFindings().add(ResearchFinding.builder()
                .query("llm funds").title("Funds adopt LLMs").snippet("Survey of 40 funds").source("https://a.test")
                .build());
        return state;
    }
}
