/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.qrtx.runtime.pipeline;

import dev.mars.qrtx.core.CauseCode;
import dev.mars.qrtx.core.FailureClassifier;
import dev.mars.qrtx.core.JobPriority;
import dev.mars.qrtx.core.JobState;
import dev.mars.qrtx.core.RetryPolicy;
import dev.mars.qrtx.core.StageDefinition;
import dev.mars.qrtx.core.StageKind;
import dev.mars.qrtx.core.StageState;
import dev.mars.qrtx.core.exceptions.BackendExecutionException;
import dev.mars.qrtx.core.exceptions.CollaboratorUnavailableException;
import dev.mars.qrtx.core.exceptions.ExecutionFailureCause;
import dev.mars.qrtx.core.exceptions.InvalidTransitionException;
import dev.mars.qrtx.core.exceptions.NoCandidateException;
import dev.mars.qrtx.resource.ResourceDescriptor;
import dev.mars.qrtx.runtime.checkpoint.CheckpointCoordinator;
import dev.mars.qrtx.runtime.events.JobEventFeed;
import dev.mars.qrtx.runtime.events.JobEventType;
import dev.mars.qrtx.runtime.lifecycle.JobStateMachine;
import dev.mars.qrtx.runtime.lifecycle.StateTransition;
import dev.mars.qrtx.runtime.observability.OrchestratorMetrics;
import dev.mars.qrtx.scheduler.ResourceAllocation;
import dev.mars.qrtx.scheduler.SchedulingEngine;
import dev.mars.qrtx.storage.ArtifactKind;
import dev.mars.qrtx.storage.ArtifactRef;
import dev.mars.qrtx.storage.StorageNames;
import dev.mars.qrtx.workflow.ReadinessTracker;
import dev.mars.qrtx.workflow.WorkflowGraph;
import io.vertx.core.AsyncResult;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Control loop that advances jobs through their stages.
 *
 * <p>All job state lives on one Vert.x context: public methods hop onto it and every
 * collaborator reply is handed back to it before it touches a job. Per-job transitions are
 * therefore totally ordered without locks. The only points where a stage yields are the
 * collaborator calls (compile, execute, evaluate, persist, checkpoint) and timers (retry
 * backoff, resource requeue, progress checkpoints, job watchdog, lease sweep).</p>
 *
 * <p>Job lifecycle: {@code COMPILING} on admission, {@code QUEUED} once a non-compile stage is
 * ready, {@code RUNNING} once one is dispatched, and {@code DONE} when every stage completed.
 * Cancellation, the watchdog and a permanent stage failure all stop dispatching first and
 * enter {@code CANCELLED}, {@code TIMEOUT} or {@code ERROR} once no stage is in flight.
 * Every attempt is bounded by the stage timeout, and a stopping job abandons stages still in
 * flight after the stop grace period, so no job waits on a collaborator forever.</p>
 *
 * <p>Terminal jobs stay in memory for the retention period and are then evicted; their
 * records remain in storage.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class PipelineDriver {
    private static final Logger logger = LoggerFactory.getLogger(PipelineDriver.class);

    private final Vertx vertx;
    private final Context context;
    private final PipelineSettings settings;
    private final Collaborators collaborators;
    private final StageDispatcher dispatcher;
    private final SchedulingEngine engine;
    private final CheckpointCoordinator checkpoints;
    private final JobRepository repository;
    private final JobEventFeed events;
    private final OrchestratorMetrics metrics;
    private final Clock clock;

    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final Map<String, Job> jobsByAllocation = new HashMap<>();
    private final ReadyQueue readyQueue = new ReadyQueue();
    private long admissions;
    private int inflightTotal;
    private boolean accepting = true;
    private long leaseSweepTimerId;

    public PipelineDriver(Vertx vertx, PipelineSettings settings, Collaborators collaborators, SchedulingEngine engine,
                          CheckpointCoordinator checkpoints, JobRepository repository, JobEventFeed events,
                          OrchestratorMetrics metrics, Clock clock) {
        this.vertx = vertx;
        this.context = vertx.getOrCreateContext();
        this.settings = settings;
        this.collaborators = collaborators;
        this.dispatcher = new StageDispatcher(collaborators);
        this.engine = engine;
        this.checkpoints = checkpoints;
        this.repository = repository;
        this.events = events;
        this.metrics = metrics;
        this.clock = clock;
        this.leaseSweepTimerId = vertx.setPeriodic(settings.requeueIntervalMs(), id -> onLoop(this::sweepLeases));
        engine.getRegistry().addStatusListener(resource -> {
            if (resource.getStatus().isAvailable()) {
                onLoop(this::wakeAwaitingStages);
            }
        });
    }

    // ---------------------------------------------------------------------------------------
    // Public API, callable from any thread
    // ---------------------------------------------------------------------------------------

    /**
     * Admit a validated graph as a new job.
     *
     * @param deadline watchdog deadline, null for the configured default
     * @return the job id
     */
    public Future<String> submit(String name, WorkflowGraph graph, JobPriority priority, Duration deadline) {
        if (name == null || name.isBlank()) {
            return Future.failedFuture(new IllegalArgumentException("Job name is required"));
        }
        String jobId = UUID.randomUUID().toString();
        long deadlineMs = deadline != null ? deadline.toMillis() : settings.defaultDeadlineMs();
        return call(() -> {
            if (!accepting) {
                return Future.failedFuture(new IllegalStateException("Orchestrator is shutting down"));
            }
            Job job = new Job(jobId, name, priority, graph, new JobStateMachine(jobId, clock),
                    new ReadinessTracker(graph), admissions++, clock.instant(), deadlineMs);
            jobs.put(jobId, job);
            metrics.recordJobSubmitted(name);
            logger.info("Admitted job {} '{}' ({} stages, priority {})", jobId, name, graph.size(), priority);
            events.publish(jobId, JobEventType.SUBMITTED, JobState.PENDING, null, name);
            return repository.saveWorkflow(jobId, graph.toIr())
                    .<Void>mapEmpty()
                    .recover(err -> {
                        logger.warn("Workflow of job {} not persisted, it cannot be recovered: {}", jobId, err.getMessage());
                        return Future.succeededFuture();
                    })
                    .map(v -> {
                        guarded(job, () -> start(job));
                        return jobId;
                    });
        });
    }

    /**
     * Re-admit a job from a previous process, continuing from its verified checkpoints.
     */
    public Future<String> resume(RecoveredJob recovered) {
        JobRecord record = recovered.record();
        return call(() -> {
            if (!accepting) {
                return Future.failedFuture(new IllegalStateException("Orchestrator is shutting down"));
            }
            if (jobs.containsKey(record.jobId())) {
                return Future.failedFuture(new IllegalStateException("Job " + record.jobId() + " is already active"));
            }
            if (record.state().isTerminal()) {
                return Future.failedFuture(new IllegalStateException(
                        "Job " + record.jobId() + " already finished in state " + record.state()));
            }
            WorkflowGraph graph = recovered.graph();
            var resumePoint = recovered.resumePoint();
            Job job = new Job(record.jobId(), record.name(), record.priority(), graph,
                    new JobStateMachine(record.jobId(), clock, record.history()),
                    new ReadinessTracker(graph, resumePoint.completedStages()), admissions++, record.createdAt(),
                    record.deadlineMs());
            for (String stageId : resumePoint.completedStages()) {
                job.putStageOutputs(stageId, resumePoint.stageOutputs().get(stageId));
                var checkpointRef = resumePoint.checkpoints().get(stageId);
                job.run(stageId).restoreCompleted(resumePoint.attempts().getOrDefault(stageId, 1),
                        new ArtifactRef(record.jobId(), stageId, outputKind(graph.getStage(stageId).getKind())).toUri(),
                        checkpointRef != null ? checkpointRef.toUri() : null);
            }
            jobs.put(job.jobId(), job);
            events.restore(job.jobId(), record.lastEventSequence());
            metrics.recordJobResumed();
            logger.info("Recovered job {} '{}' in state {} with {} of {} stages complete", job.jobId(), job.name(),
                    job.state(), resumePoint.completedStages().size(), graph.size());
            events.publish(job.jobId(), JobEventType.RECOVERED, job.state(), resumePoint.latestStageId(),
                    resumePoint.completedStages().size() + " stage(s) restored");
            guarded(job, () -> start(job));
            return Future.succeededFuture(job.jobId());
        });
    }

    /**
     * Request cooperative cancellation.
     *
     * @return false if the job is unknown, already terminal or already stopping
     */
    public Future<Boolean> cancel(String jobId) {
        return call(() -> {
            Job job = jobs.get(jobId);
            if (job == null || job.isTerminal() || job.isStopping()) {
                return Future.succeededFuture(false);
            }
            logger.info("Cancellation requested for job {}", jobId);
            events.publish(jobId, JobEventType.CANCEL_REQUESTED, job.state(), null, null);
            guarded(job, () -> requestStop(job, new Job.StopRequest(JobState.CANCELLED, null,
                    "Cancelled on request", null, null)));
            return Future.succeededFuture(true);
        });
    }

    public Future<Optional<JobStatus>> status(String jobId) {
        return call(() -> Future.succeededFuture(Optional.ofNullable(jobs.get(jobId)).map(Job::status)));
    }

    /**
     * Outputs of a job that reached {@code DONE}; empty for any other state.
     */
    public Future<Optional<JobResults>> results(String jobId) {
        return call(() -> {
            Job job = jobs.get(jobId);
            if (job == null || job.state() != JobState.DONE) {
                return Future.succeededFuture(Optional.empty());
            }
            Map<String, Map<String, Long>> counts = new LinkedHashMap<>();
            for (StageRun run : job.runs()) {
                if (run.definition().getKind() == StageKind.QUANTUM && !run.definition().getOutputs().isEmpty()) {
                    JsonObject bundle = job.stageOutputs(run.id()).orElseGet(JsonObject::new);
                    JsonObject first = bundle.getJsonObject(run.definition().getOutputs().get(0));
                    Map<String, Long> stageCounts = new LinkedHashMap<>();
                    if (first != null && first.getJsonObject("counts") != null) {
                        first.getJsonObject("counts").forEach(e -> stageCounts.put(e.getKey(), ((Number) e.getValue()).longValue()));
                    }
                    counts.put(run.id(), stageCounts);
                }
            }
            return Future.succeededFuture(Optional.of(new JobResults(job.jobId(), job.name(), job.completedAt(),
                    job.allOutputs(), counts)));
        });
    }

    /**
     * Stop admitting jobs. Jobs already admitted keep running.
     */
    public Future<Void> stopAccepting() {
        return call(() -> {
            accepting = false;
            logger.info("Pipeline no longer accepting jobs ({} active)", activeJobCount());
            return Future.succeededFuture();
        });
    }

    /**
     * Completes when no admitted job is still non-terminal.
     */
    public Future<Void> awaitIdle() {
        return call(() -> Future.succeededFuture(activeJobCount())).compose(active -> {
            if (active == 0) {
                return Future.succeededFuture();
            }
            return vertx.timer(100).compose(v -> awaitIdle());
        });
    }

    /**
     * Cancel periodic timers. Jobs still active stay in their current state.
     */
    public Future<Void> stop() {
        return call(() -> {
            accepting = false;
            vertx.cancelTimer(leaseSweepTimerId);
            for (Job job : jobs.values()) {
                cancelTimer(job.watchdogTimerId());
                for (StageRun run : job.runs()) {
                    stopAttemptTimers(run);
                }
            }
            logger.info("Pipeline timers stopped");
            return Future.succeededFuture();
        });
    }

    /**
     * Completes when all job record writes queued so far are applied.
     */
    public Future<Void> flush() {
        return repository.flush();
    }

    // ---------------------------------------------------------------------------------------
    // Loop
    // ---------------------------------------------------------------------------------------

    private void start(Job job) {
        if (job.state() == JobState.PENDING) {
            transition(job, JobState.COMPILING, null);
        }
        if (job.deadlineMs() > 0) {
            job.setWatchdogTimerId(vertx.setTimer(job.deadlineMs(), id -> onLoop(job, () -> onDeadline(job))));
        }
        for (String stageId : job.tracker().readyStages()) {
            enqueue(job, job.run(stageId));
        }
        maybeFinish(job);
        pump();
    }

    private void enqueue(Job job, StageRun run) {
        run.setState(StageState.READY);
        readyQueue.add(job, run);
        if (run.definition().getKind() != StageKind.COMPILE && job.state() == JobState.COMPILING) {
            transition(job, JobState.QUEUED, null);
        }
    }

    private void pump() {
        while (inflightTotal < settings.maxInflightStages() && !readyQueue.isEmpty()) {
            ReadyQueue.Entry entry = readyQueue.poll();
            Job job = jobs.get(entry.jobId());
            if (job == null || job.isTerminal() || job.isStopping()) {
                continue;
            }
            StageRun run = job.run(entry.stageId());
            if (run.state() != StageState.READY) {
                continue;
            }
            guarded(job, () -> dispatch(job, run));
        }
    }

    private void dispatch(Job job, StageRun run) {
        StageDefinition stage = run.definition();
        ResourceAllocation allocation = null;
        ResourceDescriptor resource = null;
        if (stage.getKind().requiresResource()) {
            try {
                allocation = allocate(job, stage);
            } catch (NoCandidateException e) {
                if (e.isRetryable()) {
                    awaitResource(job, run, e);
                } else {
                    logger.warn("Stage {}/{} cannot be placed: {}", job.jobId(), stage.getId(), e.getMessage());
                    failStage(job, run, CauseCode.NO_CANDIDATE, e.getMessage(), e);
                }
                return;
            }
            resource = engine.getRegistry().get(allocation.getResourceId()).orElseThrow(() ->
                    new IllegalStateException("Allocated resource vanished from the registry"));
            jobsByAllocation.put(allocation.getAllocationId(), job);
        }

        String executionId = job.jobId() + ":" + stage.getId() + ":" + (run.attempts() + 1);
        job.tracker().markDispatched(stage.getId());
        long token = run.beginAttempt(allocation != null ? allocation.getAllocationId() : null,
                resource != null ? resource.getId() : null, executionId);
        job.incrementInflight();
        inflightTotal++;

        if (stage.getKind() != StageKind.COMPILE) {
            advanceToRunning(job);
        }
        metrics.recordStageDispatched(stage.getKind());
        events.publish(job.jobId(), JobEventType.STAGE_DISPATCHED, job.state(), stage.getId(),
                "attempt " + run.attempts() + (resource != null ? " on " + resource.getId() : ""));
        logger.debug("Dispatching {}/{} attempt {}{}", job.jobId(), stage.getId(), run.attempts(),
                resource != null ? " on " + resource.getId() : "");
        startProgressCheckpoints(job, run, token);
        startAttemptTimeout(job, run, token);

        JsonObject inputs = new JsonObject();
        for (String input : stage.getInputs()) {
            inputs.put(input, job.outputValue(input));
        }
        Future<JsonObject> result;
        try {
            result = dispatcher.dispatch(stage, inputs, allocation, resource, executionId);
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }
        result.onComplete(ar -> onLoop(job, () -> onStageResult(job, run, token, ar)));
    }

    private ResourceAllocation allocate(Job job, StageDefinition stage) throws NoCandidateException {
        ResourceAllocation reserved = engine.selectResource(job.jobId(), stage);
        Optional<ResourceAllocation> active = engine.activate(reserved.getAllocationId());
        if (active.isPresent()) {
            return active.get();
        }
        ResourceAllocation moved = engine.reselect(reserved.getAllocationId(), stage);
        active = engine.activate(moved.getAllocationId());
        if (active.isPresent()) {
            return active.get();
        }
        engine.release(moved.getAllocationId());
        throw new NoCandidateException(stage.getId(), NoCandidateException.Reason.NONE_FREE,
                "Reserved resources went offline before dispatch");
    }

    private void awaitResource(Job job, StageRun run, NoCandidateException cause) {
        run.setState(StageState.AWAITING_RESOURCE);
        if (run.startWaitingForResource()) {
            logger.info("Stage {}/{} waiting for a free resource: {}", job.jobId(), run.id(), cause.getMessage());
            events.publish(job.jobId(), JobEventType.STAGE_AWAITING_RESOURCE, job.state(), run.id(), cause.getMessage());
        }
        vertx.setTimer(settings.requeueIntervalMs(), id -> onLoop(job, () -> {
            if (run.state() == StageState.AWAITING_RESOURCE && !job.isStopping() && !job.isTerminal()) {
                readyQueue.add(job, run);
                run.setState(StageState.READY);
                pump();
            }
        }));
    }

    private void wakeAwaitingStages() {
        boolean woke = false;
        for (Job job : jobs.values()) {
            if (job.isTerminal() || job.isStopping()) {
                continue;
            }
            for (StageRun run : job.runs()) {
                if (run.state() == StageState.AWAITING_RESOURCE) {
                    run.setState(StageState.READY);
                    readyQueue.add(job, run);
                    woke = true;
                }
            }
        }
        if (woke) {
            pump();
        }
    }

    private void onStageResult(Job job, StageRun run, long token, AsyncResult<JsonObject> ar) {
        if (run.token() != token || run.state() != StageState.RUNNING) {
            logger.debug("Ignoring stale result for {}/{}", job.jobId(), run.id());
            return;
        }
        stopAttemptTimers(run);
        releaseAllocation(run, ar.succeeded());
        if (ar.succeeded()) {
            completeStage(job, run, ar.result());
        } else {
            handleFailure(job, run, ar.cause());
        }
    }

    private void completeStage(Job job, StageRun run, JsonObject bundle) {
        run.abandonAttempt();
        StageDefinition stage = run.definition();
        byte[] bytes = bundle.toBuffer().getBytes();
        Future<ArtifactRef> persisted = collaborators.store()
                .persist(job.jobId(), stage.getId(), outputKind(stage.getKind()), bytes);
        persisted
                .compose(ref -> {
                    run.setOutputRef(ref.toUri());
                    if (!stage.shouldCheckpoint()) {
                        return Future.succeededFuture();
                    }
                    return checkpoints.checkpoint(job.jobId(), stage, run.attempts(), ref, bytes)
                            .onSuccess(checkpointRef -> onLoop(job, () -> {
                                run.setCheckpointRef(checkpointRef.toUri());
                                metrics.recordCheckpointWritten();
                                events.publish(job.jobId(), JobEventType.CHECKPOINT_WRITTEN, job.state(),
                                        stage.getId(), checkpointRef.toUri());
                            }))
                            .onFailure(err -> metrics.recordCheckpointFailed())
                            .<Void>mapEmpty();
                })
                .onComplete(ar -> onLoop(job, () -> {
                    if (persisted.failed()) {
                        logger.warn("Output of {}/{} not persisted, stage cannot be resumed from: {}",
                                job.jobId(), stage.getId(), persisted.cause().getMessage());
                    }
                    finishStage(job, run, bundle);
                }));
    }

    private void finishStage(Job job, StageRun run, JsonObject bundle) {
        if (run.state() != StageState.RUNNING) {
            return;
        }
        run.setState(StageState.COMPLETED);
        job.putStageOutputs(run.id(), bundle);
        List<String> newlyReady = job.tracker().markCompleted(run.id());
        settle(job);
        logger.info("Stage {}/{} completed after {} attempt(s)", job.jobId(), run.id(), run.attempts());
        events.publish(job.jobId(), JobEventType.STAGE_COMPLETED, job.state(), run.id(), run.outputRef());
        if (!job.isStopping()) {
            for (String stageId : newlyReady) {
                enqueue(job, job.run(stageId));
            }
        }
        saveRecord(job);
        maybeFinish(job);
        pump();
    }

    private void handleFailure(Job job, StageRun run, Throwable failure) {
        run.abandonAttempt();
        StageDefinition stage = run.definition();
        FailureClassifier.Classification classification = FailureClassifier.classify(failure);
        run.setLastError(classification.summary());
        settle(job);

        if (job.isStopping()) {
            run.setState(StageState.FAILED);
            events.publish(job.jobId(), JobEventType.STAGE_FAILED, job.state(), run.id(), classification.summary());
            maybeFinish(job);
            pump();
            return;
        }

        RetryPolicy retry = stage.effectiveRetry(settings.defaultRetry());
        if (classification.isRetryable() && retry.hasAttemptsRemaining(run.attempts())) {
            long delay = retry.delayForAttempt(run.attempts());
            job.tracker().requeue(run.id());
            run.setState(StageState.RETRY_WAIT);
            metrics.recordStageRetry(stage.getKind());
            logger.warn("Stage {}/{} attempt {} failed ({}), retrying in {} ms", job.jobId(), run.id(),
                    run.attempts(), classification.summary(), delay);
            events.publish(job.jobId(), JobEventType.STAGE_RETRY_SCHEDULED, job.state(), run.id(),
                    "attempt " + run.attempts() + " failed: " + classification.summary() + "; retry in " + delay + " ms");
            vertx.setTimer(Math.max(1, delay), id -> onLoop(job, () -> {
                if (run.state() == StageState.RETRY_WAIT && !job.isStopping() && !job.isTerminal()) {
                    enqueue(job, run);
                    pump();
                }
            }));
            saveRecord(job);
            pump();
            return;
        }

        CauseCode cause = classification.isRetryable() ? CauseCode.RETRIES_EXHAUSTED : classification.causeCode();
        if (cause == CauseCode.INTERNAL_ERROR) {
            logger.error("Internal error while running {}/{}", job.jobId(), run.id(), failure);
        } else {
            logger.warn("Stage {}/{} failed permanently after {} attempt(s): {}", job.jobId(), run.id(),
                    run.attempts(), classification.summary());
        }
        String summary = cause == CauseCode.RETRIES_EXHAUSTED
                ? "Stage '" + run.id() + "' failed after " + run.attempts() + " attempt(s): " + classification.summary()
                : "Stage '" + run.id() + "': " + classification.summary();
        failStage(job, run, cause, summary, failure);
        pump();
    }

    private void failStage(Job job, StageRun run, CauseCode cause, String summary, Throwable failure) {
        run.setState(StageState.FAILED);
        if (run.lastError() == null) {
            run.setLastError(summary);
        }
        metrics.recordStageFailed(run.definition().getKind(), cause);
        events.publish(job.jobId(), JobEventType.STAGE_FAILED, job.state(), run.id(), summary);
        requestStop(job, new Job.StopRequest(JobState.ERROR, cause, summary, run.id(), failure));
    }

    private void onDeadline(Job job) {
        if (job.isTerminal() || job.isStopping()) {
            return;
        }
        logger.warn("Job {} exceeded its deadline of {} ms", job.jobId(), job.deadlineMs());
        requestStop(job, new Job.StopRequest(JobState.TIMEOUT, CauseCode.DEADLINE_EXCEEDED,
                "Job exceeded its deadline of " + job.deadlineMs() + " ms", null, null));
    }

    private void requestStop(Job job, Job.StopRequest request) {
        if (job.isTerminal() || job.isStopping()) {
            return;
        }
        job.setStopRequest(request);
        if (request.target() != JobState.TIMEOUT) {
            cancelTimer(job.watchdogTimerId());
        }
        for (StageRun run : job.runs()) {
            if (run.state() == StageState.RUNNING) {
                forwardCancel(run);
            }
        }
        logger.info("Stopping job {} towards {} with {} stage(s) in flight", job.jobId(), request.target(), job.inflight());
        if (job.inflight() > 0) {
            vertx.setTimer(settings.stopGraceMs(), id -> onLoop(job, () -> {
                if (job.isTerminal() || job.isFinishing() || job.inflight() == 0) {
                    return;
                }
                logger.warn("Job {} still has {} stage(s) in flight {} ms after stopping, abandoning them",
                        job.jobId(), job.inflight(), settings.stopGraceMs());
                abandonInflight(job, "Abandoned " + settings.stopGraceMs() + " ms after the job stopped");
                maybeFinish(job);
            }));
        }
        maybeFinish(job);
    }

    /**
     * Detach every running attempt of a job: its result will be ignored, the backend is asked
     * to stop and its allocation is returned to the engine.
     */
    private void abandonInflight(Job job, String reason) {
        for (StageRun run : job.runs()) {
            if (run.state() != StageState.RUNNING) {
                continue;
            }
            run.abandonAttempt();
            stopAttemptTimers(run);
            forwardCancel(run);
            releaseAllocation(run, false);
            run.setState(StageState.FAILED);
            run.setLastError(reason);
            settle(job);
            events.publish(job.jobId(), JobEventType.STAGE_FAILED, job.state(), run.id(), reason);
        }
    }

    private void maybeFinish(Job job) {
        if (job.isTerminal() || job.isFinishing() || job.inflight() > 0) {
            return;
        }
        if (job.isStopping()) {
            finish(job, job.stopRequest());
        } else if (job.tracker().allCompleted()) {
            finish(job, null);
        }
    }

    private void finish(Job job, Job.StopRequest stop) {
        job.setFinishing();
        cancelTimer(job.watchdogTimerId());
        for (StageRun run : job.runs()) {
            if (!run.state().isSettled()) {
                run.setState(StageState.SKIPPED);
            }
        }
        if (stop == null) {
            advanceToRunning(job);
            terminate(job, JobState.DONE, null);
            return;
        }
        if (!stop.target().requiresCause()) {
            terminate(job, stop.target(), null);
            return;
        }
        repository.saveErrorDetails(job.jobId(), stop.stageId(), errorDetails(job, stop))
                .onComplete(ar -> onLoop(() -> {
                    if (ar.succeeded()) {
                        job.setErrorDetailsRef(ar.result().toUri());
                    } else {
                        logger.warn("Error details of job {} not persisted: {}", job.jobId(), ar.cause().getMessage());
                    }
                    try {
                        terminate(job, stop.target(), job.errorDetailsRef());
                    } catch (RuntimeException e) {
                        logger.error("Job {} could not be terminated", job.jobId(), e);
                    }
                }));
    }

    private void terminate(Job job, JobState target, String detailsRef) {
        CauseCode cause = job.isStopping() ? job.stopRequest().causeCode() : null;
        transition(job, target, cause, detailsRef);
        job.setCompletedAt(clock.instant());
        double seconds = Duration.between(job.createdAt(), job.completedAt()).toMillis() / 1000.0;
        switch (target) {
            case DONE -> metrics.recordJobDone(job.name(), seconds);
            case ERROR -> metrics.recordJobFailed(job.name(), cause, seconds);
            case CANCELLED -> metrics.recordJobCancelled(job.name(), seconds);
            case TIMEOUT -> metrics.recordJobTimedOut(job.name(), seconds);
            default -> throw new IllegalStateException("Not a terminal state: " + target);
        }
        scheduleEviction(job);
    }

    private void scheduleEviction(Job job) {
        long delay = Math.max(1, settings.retentionMs());
        vertx.setTimer(delay, id -> repository.flush(job.jobId()).onComplete(ar -> onLoop(() -> {
            if (jobs.remove(job.jobId(), job)) {
                events.forget(job.jobId());
                logger.debug("Evicted job {} {} ms after it finished", job.jobId(), delay);
            }
        })));
    }

    private void advanceToRunning(Job job) {
        try {
            for (StateTransition applied : job.stateMachine().advanceTo(JobState.RUNNING)) {
                published(job, applied);
            }
        } catch (InvalidTransitionException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    private void transition(Job job, JobState target, CauseCode cause) {
        transition(job, target, cause, null);
    }

    private void transition(Job job, JobState target, CauseCode cause, String detailsRef) {
        try {
            published(job, job.stateMachine().transitionTo(target, cause, detailsRef));
        } catch (InvalidTransitionException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    private void published(Job job, StateTransition transition) {
        events.publish(job.jobId(), JobEventType.STATE_CHANGED, transition.to(), null,
                transition.from() + " → " + transition.to());
        saveRecord(job);
    }

    private void settle(Job job) {
        job.decrementInflight();
        inflightTotal--;
    }

    private void releaseAllocation(StageRun run, boolean success) {
        String allocationId = run.allocationId();
        if (allocationId == null) {
            return;
        }
        jobsByAllocation.remove(allocationId);
        if (engine.release(allocationId).isPresent()) {
            engine.recordOutcome(run.resourceId(), success);
            onLoop(this::wakeAwaitingStages);
        }
    }

    private void sweepLeases() {
        for (ResourceAllocation expired : engine.expireLeases()) {
            Job job = jobsByAllocation.remove(expired.getAllocationId());
            if (job == null) {
                continue;
            }
            StageRun run = job.run(expired.getStageId());
            if (run.state() != StageState.RUNNING || !expired.getAllocationId().equals(run.allocationId())) {
                continue;
            }
            forwardCancel(run);
            stopAttemptTimers(run);
            engine.recordOutcome(expired.getResourceId(), false);
            guarded(job, () -> handleFailure(job, run, new BackendExecutionException(
                    ExecutionFailureCause.DEADLINE_EXCEEDED, expired.getResourceId(),
                    "Lease on " + expired.getResourceId() + " expired at " + expired.getHardDeadline())));
        }
        wakeAwaitingStages();
    }

    private void startProgressCheckpoints(Job job, StageRun run, long token) {
        if (settings.checkpointIntervalMs() <= 0 || !run.definition().shouldCheckpoint()) {
            return;
        }
        run.setProgressTimerId(vertx.setPeriodic(settings.checkpointIntervalMs(), id -> onLoop(job, () -> {
            if (run.token() != token || run.state() != StageState.RUNNING) {
                vertx.cancelTimer(id);
                return;
            }
            checkpoints.progress(job.jobId(), run.id(), run.attempts())
                    .onSuccess(ref -> metrics.recordCheckpointWritten())
                    .onFailure(err -> metrics.recordCheckpointFailed());
        })));
    }

    private void startAttemptTimeout(Job job, StageRun run, long token) {
        if (settings.stageTimeoutMs() <= 0) {
            return;
        }
        run.setTimeoutTimerId(vertx.setTimer(settings.stageTimeoutMs(), id -> onLoop(job, () -> {
            if (run.token() != token || run.state() != StageState.RUNNING) {
                return;
            }
            logger.warn("Stage {}/{} attempt {} got no answer within {} ms", job.jobId(), run.id(), run.attempts(),
                    settings.stageTimeoutMs());
            forwardCancel(run);
            stopAttemptTimers(run);
            releaseAllocation(run, false);
            handleFailure(job, run, attemptTimedOut(run));
        })));
    }

    private Exception attemptTimedOut(StageRun run) {
        String message = "Stage '" + run.id() + "' got no answer within " + settings.stageTimeoutMs() + " ms";
        return switch (run.definition().getKind()) {
            case COMPILE -> new CollaboratorUnavailableException("compiler", message);
            case QUANTUM -> new BackendExecutionException(ExecutionFailureCause.DEADLINE_EXCEEDED, run.resourceId(), message);
            case CLASSICAL -> new CollaboratorUnavailableException("evaluator", message);
        };
    }

    private void forwardCancel(StageRun run) {
        if (run.definition().getKind() == StageKind.QUANTUM && run.executionId() != null) {
            dispatcher.cancel(run.executionId());
        }
    }

    private void stopAttemptTimers(StageRun run) {
        cancelTimer(run.progressTimerId());
        cancelTimer(run.timeoutTimerId());
    }

    private void saveRecord(Job job) {
        JobStatus status = job.status();
        List<StageRecord> stages = new ArrayList<>();
        for (StageRun run : job.runs()) {
            stages.add(new StageRecord(run.id(), run.state(), run.attempts(), run.resourceId(), run.allocationId(),
                    run.outputRef(), run.checkpointRef(), run.lastError()));
        }
        repository.saveRecord(new JobRecord(job.jobId(), job.name(), job.priority(), job.state(),
                new ArtifactRef(job.jobId(), StorageNames.JOB_SCOPE, ArtifactKind.WORKFLOW_GRAPH).toUri(),
                job.createdAt(), clock.instant(), job.deadlineMs(), status.history(), stages, status.causeCode(),
                status.errorSummary(), job.errorDetailsRef(), status.failedStageId(), events.lastSequence(job.jobId())));
    }

    private JsonObject errorDetails(Job job, Job.StopRequest stop) {
        JsonObject details = new JsonObject()
                .put("jobId", job.jobId())
                .put("jobName", job.name())
                .put("causeCode", stop.causeCode().name())
                .put("summary", stop.summary())
                .put("state", job.state().name())
                .put("recordedAt", clock.instant().toString());
        if (stop.stageId() != null) {
            StageRun run = job.run(stop.stageId());
            details.put("stageId", stop.stageId())
                    .put("attempts", run.attempts())
                    .put("resourceId", run.resourceId());
        }
        if (stop.failure() != null) {
            details.put("exception", stop.failure().getClass().getName())
                    .put("message", stop.failure().getMessage());
        }
        return details;
    }

    static ArtifactKind outputKind(StageKind kind) {
        return switch (kind) {
            case COMPILE -> ArtifactKind.COMPILED_PAYLOAD;
            case QUANTUM, CLASSICAL -> ArtifactKind.STAGE_OUTPUT;
        };
    }

    private long activeJobCount() {
        return jobs.values().stream().filter(j -> !j.isTerminal()).count();
    }

    private void cancelTimer(long timerId) {
        if (timerId >= 0) {
            vertx.cancelTimer(timerId);
        }
    }

    // ---------------------------------------------------------------------------------------
    // Context plumbing
    // ---------------------------------------------------------------------------------------

    private <T> Future<T> call(Supplier<Future<T>> action) {
        Promise<T> promise = Promise.promise();
        context.runOnContext(v -> {
            try {
                action.get().onComplete(promise);
            } catch (RuntimeException e) {
                logger.error("Pipeline operation failed", e);
                promise.fail(e);
            }
        });
        return promise.future();
    }

    private void onLoop(Runnable action) {
        context.runOnContext(v -> {
            try {
                action.run();
            } catch (RuntimeException e) {
                logger.error("Pipeline loop task failed", e);
            }
        });
    }

    private void onLoop(Job job, Runnable action) {
        context.runOnContext(v -> guarded(job, action));
    }

    /**
     * Run a job mutation; an unexpected exception is an orchestrator defect and fails the job
     * with {@link CauseCode#INTERNAL_ERROR}.
     */
    private void guarded(Job job, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            logger.error("Internal error in job {}", job.jobId(), e);
            if (job.isTerminal() || job.isFinishing()) {
                return;
            }
            try {
                if (!job.isStopping()) {
                    job.setStopRequest(new Job.StopRequest(JobState.ERROR, CauseCode.INTERNAL_ERROR,
                            "Internal error: " + e.getClass().getSimpleName(), null, e));
                }
                abandonInflight(job, "Internal error: " + e.getClass().getSimpleName());
                maybeFinish(job);
            } catch (RuntimeException nested) {
                logger.error("Job {} left in state {} after internal error", job.jobId(), job.state(), nested);
            }
        }
    }
}
