package me.golemcore.newsroom.domain.node;

import me.golemcore.newsroom.domain.exception.WorkflowException;
import me.golemcore.newsroom.domain.model.FailureKind;
import me.golemcore.newsroom.domain.model.NextHint;
import me.golemcore.newsroom.domain.model.NodeName;
import me.golemcore.newsroom.domain.model.PublicationReceipt;
import me.golemcore.newsroom.domain.model.QualityVerdict;
import me.golemcore.newsroom.domain.model.ResearchFinding;
import me.golemcore.newsroom.domain.model.RunState;
import me.golemcore.newsroom.domain.model.ToolResult;
import me.golemcore.newsroom.infrastructure.config.NewsroomProperties;
import me.golemcore.newsroom.port.outbound.InferencePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SupervisorNodeTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:30:00Z");

    private InferencePort inferencePort;
    private NewsroomProperties properties;
    private SupervisorNode node;

    @BeforeEach
    void setUp() {
        inferencePort = mock(InferencePort.class);
        properties = new NewsroomProperties();
        node = new SupervisorNode(inferencePort, properties);
    }

    // ===== decision table =====

    @Test
    void shouldResearchFirst() {
        assertEquals(NextHint.RESEARCH, node.decide(fresh()));
    }

    @Test
    void shouldWriteOnceResearchExists() {
        assertEquals(NextHint.WRITE, node.decide(withResearch()));
        verify(inferencePort, never()).complete(anyString(), anyString());
    }

    @Test
    void shouldCheckUncheckedDraft() {
        RunState state = withResearch();
        state.replaceDraft("draft");

        assertEquals(NextHint.CHECK_QUALITY, node.decide(state));
    }

    @Test
    void shouldPublishUniqueDraft() {
        RunState state = withResearch();
        state.replaceDraft("draft");
        state.setQualityVerdict(QualityVerdict.UNIQUE);

        assertEquals(NextHint.PUBLISH, node.decide(state));
    }

    @Test
    void shouldFinishAfterPublication() {
        RunState state = withResearch();
        state.setPublication(PublicationReceipt.builder().articleText("draft").publishedAt(NOW).build());

        assertEquals(NextHint.FINISH, node.decide(state));
    }

    @Test
    void shouldRouteToolResultsBackToRequester() {
        RunState state = fresh();
        state.requestTool(NodeName.RESEARCHER, "search_and_content", Map.of());
        state.getPendingToolCalls().clear();
        state.getToolResults().put("researcher-1", ToolResult.success("results"));

        assertEquals(NextHint.RESEARCH, node.decide(state));

        RunState publishing = withResearch();
        publishing.replaceDraft("draft");
        publishing.setQualityVerdict(QualityVerdict.UNIQUE);
        publishing.requestTool(NodeName.PUBLISHER, "post", Map.of());
        publishing.getToolResults().put("publisher-1", ToolResult.success("ok"));

        assertEquals(NextHint.PUBLISH, node.decide(publishing));
    }

    // ===== duplicates =====

    @Test
    void shouldRedraftDuplicateUntilLimit() {
        RunState state = withResearch();
        state.replaceDraft("draft");
        state.setQualityVerdict(QualityVerdict.DUPLICATE);
        state.setDuplicateVerdicts(2);

        assertEquals(NextHint.WRITE, node.decide(state));

        state.setDuplicateVerdicts(3);
        WorkflowException error = assertThrows(WorkflowException.class, () -> node.decide(state));
        assertEquals(FailureKind.DUPLICATE_CONTENT_REJECTED, error.getKind());
    }

    // ===== advisor =====

    @Test
    void shouldFollowValidAdvisorProposal() {
        properties.getSupervisor().setAdvisorEnabled(true);
        when(inferencePort.complete(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture("  research. "));

        RunState state = withResearch();
        state.setResearchRounds(1);

        assertEquals(NextHint.RESEARCH, node.decide(state));
    }

    @Test
    void shouldIgnoreInvalidOrFailingAdvisor() {
        properties.getSupervisor().setAdvisorEnabled(true);
        RunState state = withResearch();
        state.setResearchRounds(1);

        when(inferencePort.complete(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture("PUBLISH"));
        assertEquals(NextHint.WRITE, node.decide(state));

        when(inferencePort.complete(anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IOException("down")));
        assertEquals(NextHint.WRITE, node.decide(state));
    }

    @Test
    void shouldSkipAdvisorOnceResearchRoundsAreUsedUp() {
        properties.getSupervisor().setAdvisorEnabled(true);
        RunState state = withResearch();
        state.setResearchRounds(2);

        assertEquals(NextHint.WRITE, node.decide(state));
        verify(inferencePort, never()).complete(anyString(), anyString());
    }

    @Test
    void shouldParseOnlyKnownProposals() {
        assertEquals(NextHint.RESEARCH, SupervisorNode.parseProposal("researcher_node"));
        assertEquals(NextHint.WRITE, SupervisorNode.parseProposal("Writer"));
        assertNull(SupervisorNode.parseProposal("quality_node"));
        assertNull(SupervisorNode.parseProposal(null));
    }

    private static RunState fresh() {
        return RunState.start("run-1", "Publish a linkedin article", NOW);
    }

    private static RunState withResearch() {
        RunState state = fresh();
        state.setResearchRounds(1);
        state.getResearchFindings().add(ResearchFinding.builder()
                .query("q").title("t").snippet("s").source("u").build());
        return state;
    }
}
