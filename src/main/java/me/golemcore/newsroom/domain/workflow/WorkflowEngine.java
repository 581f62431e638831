package me.golemcore.newsroom.domain.workflow;

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
import me.golemcore.newsroom.domain.exception.RunAbortedException;
import me.golemcore.newsroom.domain.exception.WorkflowException;
import me.golemcore.newsroom.domain.model.Checkpoint;
import me.golemcore.newsroom.domain.model.EpisodicRecord;
import me.golemcore.newsroom.domain.model.FailureKind;
import me.golemcore.newsroom.domain.model.NextHint;
import me.golemcore.newsroom.domain.model.NodeName;
import me.golemcore.newsroom.domain.model.NodeOutcome;
import me.golemcore.newsroom.domain.model.PublicationReceipt;
import me.golemcore.newsroom.domain.model.RunState;
import me.golemcore.newsroom.domain.model.RunStatus;
import me.golemcore.newsroom.infrastructure.config.NewsroomProperties;
import me.golemcore.newsroom.port.outbound.CheckpointLog;
import me.golemcore.newsroom.port.outbound.PublicationJournal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Drives a run through the newsroom graph one node at a time.
 *
 * <p>
 * For every step the engine:
 * <ol>
 * <li>checks cancellation, the step budget and the run timeout
 * <li>invokes the node on a deep copy of the current state, retrying
 * {@link RetryableToolException}s with exponential backoff from the same
 * pre-attempt state
 * <li>writes a {@link Checkpoint} of the node's output
 * <li>resolves the next node through the {@link TransitionTable}
 * </ol>
 *
 * <p>
 * Any other failure stops the run: a failure checkpoint naming the pending node
 * is appended and a {@link RunAbortedException} is thrown. The step that
 * produces a publication is persisted through
 * {@link PublicationJournal#commit(Checkpoint, EpisodicRecord)} so the article
 * and the final checkpoint land together.
 *
 * <p>
 * {@link #resume(String)} continues a run from its latest checkpoint. A run
 * that already holds a publication receipt is never sent back to the
 * publisher; only its record is committed.
 */
@Service
@Slf4j
public class WorkflowEngine {

    private final Map<NodeName, WorkflowNode> nodes = new EnumMap<>(NodeName.class);
    private final TransitionTable transitions;
    private final CheckpointLog checkpointLog;
    private final PublicationJournal publicationJournal;
    private final StateSnapshots snapshots;
    private final RunCancellationRegistry cancellations;
    private final NewsroomProperties properties;
    private final Clock clock;

    public WorkflowEngine(List<WorkflowNode> nodes, TransitionTable transitions, CheckpointLog checkpointLog,
            PublicationJournal publicationJournal, StateSnapshots snapshots, RunCancellationRegistry cancellations,
            NewsroomProperties properties, Clock clock) {
        for (WorkflowNode node : nodes) {
            WorkflowNode previous = this.nodes.put(node.getName(), node);
            if (previous != null) {
                throw new IllegalStateException("Duplicate workflow node: " + node.getName());
            }
        }
        this.transitions = transitions;
        this.checkpointLog = checkpointLog;
        this.publicationJournal = publicationJournal;
        this.snapshots = snapshots;
        this.cancellations = cancellations;
        this.properties = properties;
        this.clock = clock;
        log.info("[Workflow] Registered nodes: {}", this.nodes.keySet());
    }

    /**
     * Starts a new run for the given request and drives it to completion.
     */
    public RunState start(String request) {
        String runId = UUID.randomUUID().toString();
        return run(RunState.start(runId, request, clock.instant()));
    }

    /**
     * Drives a fresh run seeded with {@code initial} to completion.
     *
     * @return the final state ({@link RunStatus#COMPLETED} or
     *         {@link RunStatus#CANCELED})
     * @throws RunAbortedException
     *             when the run stops on an error
     */
    public RunState run(RunState initial) {
        String runId = initial.getRunId();
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("Run id is required");
        }
        if (!cancellations.activate(runId)) {
            throw new IllegalStateException("Run is already active: " + runId);
        }
        try {
            if (checkpointLog.loadLatest(runId).isPresent()) {
                throw new IllegalStateException("Run already exists: " + runId);
            }

            RunState state = snapshots.copy(initial);
            state.clearFailure();
            log.info("=== RUN {} STARTED ===", runId);
            log.debug("Request: {}", state.getRequest());

            Checkpoint startCheckpoint = checkpoint(state, 0, NodeName.START, NextHint.START, null);
            try {
                checkpointLog.append(startCheckpoint);
            } catch (RuntimeException e) {
                throw new RunAbortedException(FailureKind.STORE_FAILURE,
                        "Failed to write start checkpoint: " + e.getMessage(), e, null);
            }

            return drive(state, 0, transitions.resolve(NodeName.START, NextHint.START), clock.instant());
        } finally {
            cancellations.deactivate(runId);
        }
    }

    /**
     * Continues a run from its latest checkpoint.
     *
     * @throws IllegalArgumentException
     *             if the run is unknown
     * @throws IllegalStateException
     *             if the run is active, completed, or failed in a way that cannot
     *             be resumed
     */
    public RunState resume(String runId) {
        if (!cancellations.activate(runId)) {
            throw new IllegalStateException("Run is already active: " + runId);
        }
        try {
            Checkpoint latest = checkpointLog.loadLatest(runId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown run: " + runId));
            RunState state = latest.state();

            if (state.getStatus() == RunStatus.COMPLETED) {
                throw new IllegalStateException("Run already completed: " + runId);
            }
            FailureKind failure = latest.failureKind();
            if (failure != null && !failure.isResumable()) {
                throw new IllegalStateException("Run " + runId + " failed with " + failure
                        + " and cannot be resumed");
            }

            state.clearFailure();
            log.info("=== RUN {} RESUMED from step {} ===", runId, latest.step());

            if (state.hasPublication()) {
                return finishPublication(state, latest);
            }

            NodeName next = failure != null
                    ? latest.nodeName()
                    : transitions.resolve(latest.nodeName(), latest.hint());
            return drive(state, latest.step(), next, clock.instant());
        } finally {
            cancellations.deactivate(runId);
        }
    }

    /**
     * Requests cancellation of an active run. The run stops before its next
     * step.
     */
    public boolean cancel(String runId) {
        return cancellations.cancel(runId);
    }

    public List<Checkpoint> checkpoints(String runId) {
        return checkpointLog.list(runId);
    }

    private RunState drive(RunState initial, long lastStep, NodeName firstNode, Instant startedAt) {
        RunState state = initial;
        long step = lastStep;
        NodeName next = firstNode;
        String runId = state.getRunId();
        NewsroomProperties.WorkflowProperties config = properties.getWorkflow();
        Duration runTimeout = Duration.ofSeconds(config.getRunTimeoutSeconds());

        while (next != NodeName.END) {
            if (cancellations.isCancelled(runId)) {
                return cancelRun(state, step, next);
            }
            if (step >= config.getMaxSteps()) {
                throw abort(state, step, next, FailureKind.STEP_BUDGET_EXCEEDED,
                        "Step budget of " + config.getMaxSteps() + " exhausted", null);
            }
            if (!runTimeout.isZero() && Duration.between(startedAt, clock.instant()).compareTo(runTimeout) > 0) {
                throw abort(state, step, next, FailureKind.RUN_TIMEOUT,
                        "Run exceeded " + runTimeout.toSeconds() + "s", null);
            }

            log.info("--- Step {}/{}: {} ---", step + 1, config.getMaxSteps(), next);
            NodeOutcome outcome;
            try {
                outcome = invokeWithRetry(next, state);
            } catch (WorkflowException e) {
                throw abort(state, step, next, e.getKind(), e.getMessage(), e);
            } catch (RuntimeException e) {
                throw abort(state, step, next, FailureKind.NODE_FAILURE,
                        "Node " + next + " failed: " + e.getMessage(), e);
            }

            RunState updated = outcome.state();
            NextHint hint = outcome.hint();
            long currentStep = step + 1;

            NodeName following = null;
            WorkflowException routingError = null;
            try {
                following = transitions.resolve(next, hint);
            } catch (WorkflowException e) {
                routingError = e;
            }
            if (following == NodeName.END) {
                updated.setStatus(RunStatus.COMPLETED);
            }

            if (hint == NextHint.PUBLISHED) {
                commitPublication(updated, currentStep, next, hint);
            } else {
                try {
                    checkpointLog.append(checkpoint(updated, currentStep, next, hint, null));
                } catch (RuntimeException e) {
                    NodeName pending = following != null ? following : next;
                    throw abort(updated, step, pending, FailureKind.STORE_FAILURE,
                            "Failed to write checkpoint " + currentStep + ": " + e.getMessage(), e);
                }
            }
            log.debug("[Workflow] {} -> {} (hint {})", next, following, hint);

            if (routingError != null) {
                throw abort(updated, currentStep, next, routingError.getKind(), routingError.getMessage(),
                        routingError);
            }

            state = updated;
            step = currentStep;
            next = following;
        }

        log.info("=== RUN {} COMPLETED after {} step(s) ===", runId, step);
        return state;
    }

    private NodeOutcome invokeWithRetry(NodeName name, RunState state) {
        WorkflowNode node = nodes.get(name);
        if (node == null) {
            throw new WorkflowException(FailureKind.CONFIGURATION_ERROR, "No node registered for " + name);
        }

        int maxRetries = Math.max(0, properties.getWorkflow().getMaxRetries());
        for (int attempt = 0;; attempt++) {
            RunState working = snapshots.copy(state);
            long startMs = clock.millis();
            try {
                NodeOutcome outcome = node.execute(working);
                if (outcome == null || outcome.hint() == null || outcome.state() == null) {
                    throw new WorkflowException(FailureKind.CONFIGURATION_ERROR,
                            "Node " + name + " returned no outcome");
                }
                log.debug("[Workflow] {} completed in {}ms with {}", name, clock.millis() - startMs,
                        outcome.hint());
                return outcome;
            } catch (RetryableToolException e) {
                if (attempt >= maxRetries) {
                    log.error("[Workflow] {} failed after {} attempt(s): {}", name, attempt + 1, e.getMessage());
                    throw e;
                }
                long backoffMs = backoffFor(attempt);
                log.warn("[Workflow] {} failed (attempt {}/{}), retrying in {}ms: {}", name, attempt + 1,
                        maxRetries + 1, backoffMs, e.getMessage());
                sleep(backoffMs);
            }
        }
    }

    long backoffFor(int attempt) {
        NewsroomProperties.WorkflowProperties config = properties.getWorkflow();
        long initial = config.getRetryInitialBackoffMs();
        if (initial <= 0) {
            return 0;
        }
        long backoff = (long) (initial * Math.pow(2, attempt));
        return Math.min(backoff, Math.max(initial, config.getRetryMaxBackoffMs()));
    }

    private void sleep(long backoffMs) {
        if (backoffMs <= 0) {
            return;
        }
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkflowException(FailureKind.CANCELED, "Interrupted during retry backoff", e);
        }
    }

    private void commitPublication(RunState state, long step, NodeName node, NextHint hint) {
        PublicationReceipt receipt = state.getPublication();
        if (receipt == null || state.getDraftEmbedding() == null) {
            throw abort(state, step - 1, node, FailureKind.PRECONDITION_VIOLATION,
                    "Publication reported without receipt or draft embedding", null);
        }
        EpisodicRecord record = new EpisodicRecord(state.getRunId(), receipt.getArticleText(),
                state.getDraftEmbedding(), receipt.getPublishedAt());
        try {
            publicationJournal.commit(checkpoint(state, step, node, hint, null), record);
        } catch (RuntimeException e) {
            throw abort(state, step - 1, NodeName.PUBLISHER, FailureKind.STORE_FAILURE,
                    "Failed to record publication: " + e.getMessage(), e);
        }
        log.info("[Workflow] Publication of run {} recorded", state.getRunId());
    }

    private RunState finishPublication(RunState state, Checkpoint latest) {
        long step = latest.step() + 1;
        state.setStatus(RunStatus.COMPLETED);
        if (publicationJournal.hasRecord(state.getRunId())) {
            log.info("[Workflow] Run {} already recorded, writing completion checkpoint", state.getRunId());
            try {
                checkpointLog.append(checkpoint(state, step, NodeName.PUBLISHER, NextHint.PUBLISHED, null));
            } catch (RuntimeException e) {
                throw abort(state, latest.step(), NodeName.PUBLISHER, FailureKind.STORE_FAILURE,
                        "Failed to write completion checkpoint: " + e.getMessage(), e);
            }
        } else {
            log.info("[Workflow] Re-committing publication of run {} without republishing", state.getRunId());
            commitPublication(state, step, NodeName.PUBLISHER, NextHint.PUBLISHED);
        }
        log.info("=== RUN {} COMPLETED ===", state.getRunId());
        return state;
    }

    private RunState cancelRun(RunState state, long lastStep, NodeName pending) {
        state.markFailed(FailureKind.CANCELED, "Run canceled before " + pending);
        try {
            checkpointLog.append(checkpoint(state, lastStep + 1, pending, null, FailureKind.CANCELED));
        } catch (RuntimeException e) {
            throw abort(state, lastStep, pending, FailureKind.STORE_FAILURE,
                    "Failed to write cancellation checkpoint: " + e.getMessage(), e);
        }
        log.info("=== RUN {} CANCELED before {} ===", state.getRunId(), pending);
        return state;
    }

    private RunAbortedException abort(RunState state, long lastStep, NodeName pending, FailureKind kind,
            String message, Throwable cause) {
        state.markFailed(kind, message);
        Checkpoint failure = checkpoint(state, lastStep + 1, pending, null, kind);
        try {
            checkpointLog.append(failure);
        } catch (RuntimeException e) {
            log.error("[Workflow] Failed to persist failure checkpoint for run {}: {}", state.getRunId(),
                    e.getMessage());
        }
        log.error("[Workflow] Run {} aborted at {} (step {}): {} - {}", state.getRunId(), pending, lastStep + 1,
                kind, message);
        return new RunAbortedException(kind, message, cause, failure);
    }

    private Checkpoint checkpoint(RunState state, long step, NodeName node, NextHint hint, FailureKind failure) {
        return new Checkpoint(state.getRunId(), step, node, hint, state, clock.instant(), failure);
    }
}
