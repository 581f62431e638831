package me.golemcore.newsroom.adapter.inbound.web.controller;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.newsroom.adapter.inbound.web.dto.RunSummaryDto;
import me.golemcore.newsroom.domain.exception.RunAbortedException;
import me.golemcore.newsroom.domain.model.Checkpoint;
import me.golemcore.newsroom.domain.model.RunState;
import me.golemcore.newsroom.domain.model.ToolDefinition;
import me.golemcore.newsroom.domain.workflow.WorkflowEngine;
import me.golemcore.newsroom.infrastructure.config.NewsroomProperties;
import me.golemcore.newsroom.port.outbound.CapabilityPort;
import me.golemcore.newsroom.port.outbound.CheckpointLog;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * REST endpoints to start, resume, cancel and inspect newsroom runs.
 *
 * <p>
 * Runs take minutes, so start and resume return {@code 202 Accepted} with the
 * run id and the run continues in the background. Progress is read from the
 * checkpoint log.
 */
@RestController
@RequestMapping("/api")
@Slf4j
public class RunsController {

    private final WorkflowEngine workflowEngine;
    private final CheckpointLog checkpointLog;
    private final CapabilityPort capabilityPort;
    private final NewsroomProperties properties;
    private final Clock clock;
    private final Scheduler runScheduler;

    @Autowired
    public RunsController(WorkflowEngine workflowEngine, CheckpointLog checkpointLog, CapabilityPort capabilityPort,
            NewsroomProperties properties, Clock clock) {
        this(workflowEngine, checkpointLog, capabilityPort, properties, clock, Schedulers.boundedElastic());
    }

    RunsController(WorkflowEngine workflowEngine, CheckpointLog checkpointLog, CapabilityPort capabilityPort,
            NewsroomProperties properties, Clock clock, Scheduler runScheduler) {
        this.workflowEngine = workflowEngine;
        this.checkpointLog = checkpointLog;
        this.capabilityPort = capabilityPort;
        this.properties = properties;
        this.clock = clock;
        this.runScheduler = runScheduler;
    }

    @PostMapping("/runs")
    public Mono<ResponseEntity<RunAcceptedResponse>> startRun(@RequestBody(required = false) StartRunRequest body) {
        String request = body != null && body.request() != null && !body.request().isBlank()
                ? body.request()
                : properties.getRequest();
        String runId = UUID.randomUUID().toString();
        RunState initial = RunState.start(runId, request, clock.instant());
        launch(runId, () -> workflowEngine.run(initial));
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).body(new RunAcceptedResponse(runId, "started")));
    }

    @PostMapping("/runs/{runId}/resume")
    public Mono<ResponseEntity<RunAcceptedResponse>> resumeRun(@PathVariable String runId) {
        requireLatest(runId);
        launch(runId, () -> workflowEngine.resume(runId));
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).body(new RunAcceptedResponse(runId, "resumed")));
    }

    @PostMapping("/runs/{runId}/cancel")
    public Mono<ResponseEntity<RunAcceptedResponse>> cancelRun(@PathVariable String runId) {
        requireLatest(runId);
        if (!workflowEngine.cancel(runId)) {
            throw new IllegalStateException("Run is not active: " + runId);
        }
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new RunAcceptedResponse(runId, "cancel requested")));
    }

    @GetMapping("/runs/{runId}")
    public Mono<ResponseEntity<RunSummaryDto>> getRun(@PathVariable String runId) {
        return Mono.fromCallable(() -> ResponseEntity.ok(toSummary(requireLatest(runId))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/runs/{runId}/checkpoints")
    public Mono<ResponseEntity<List<RunSummaryDto>>> getCheckpoints(@PathVariable String runId) {
        return Mono.fromCallable(() -> {
            List<Checkpoint> checkpoints = workflowEngine.checkpoints(runId);
            if (checkpoints.isEmpty()) {
                throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown run: " + runId);
            }
            return ResponseEntity.ok(checkpoints.stream().map(RunsController::toSummary).toList());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/tools")
    public Mono<ResponseEntity<List<ToolDto>>> getTools() {
        return Mono.fromCallable(() -> ResponseEntity.ok(capabilityPort.listTools().stream()
                .map(RunsController::toDto)
                .toList()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Checkpoint requireLatest(String runId) {
        return checkpointLog.loadLatest(runId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown run: " + runId));
    }

    private void launch(String runId, Callable<RunState> work) {
        Mono.fromCallable(work)
                .subscribeOn(runScheduler)
                .subscribe(
                        state -> log.info("[API] Run {} finished with status {}", runId, state.getStatus()),
                        error -> logFailure(runId, error));
    }

    private static void logFailure(String runId, Throwable error) {
        if (error instanceof RunAbortedException aborted) {
            log.error("[API] Run {} aborted: {} {}", runId, aborted.getKind(), aborted.getMessage());
        } else {
            log.error("[API] Run {} failed", runId, error);
        }
    }

    private static RunSummaryDto toSummary(Checkpoint checkpoint) {
        RunState state = checkpoint.state();
        return RunSummaryDto.builder()
                .runId(checkpoint.runId())
                .status(state.getStatus().name())
                .step(checkpoint.step())
                .node(checkpoint.nodeName().name())
                .hint(checkpoint.hint() != null ? checkpoint.hint().name() : null)
                .failureKind(checkpoint.failureKind() != null ? checkpoint.failureKind().name() : null)
                .failureMessage(state.getFailureMessage())
                .draft(state.getDraft())
                .qualityVerdict(state.getQualityVerdict().name())
                .qualityScore(state.getQualityScore())
                .published(state.hasPublication())
                .updatedAt(checkpoint.timestamp())
                .build();
    }

    private static ToolDto toDto(ToolDefinition definition) {
        return new ToolDto(definition.getName(), definition.getDescription());
    }

    record StartRunRequest(String request) {
    }

    record RunAcceptedResponse(String runId, String state) {
    }

    record ToolDto(String name, String description) {
    }
}
