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
import dev.mars.qrtx.core.JobPriority;
import dev.mars.qrtx.core.JobState;
import dev.mars.qrtx.core.StageDefinition;
import dev.mars.qrtx.runtime.lifecycle.JobStateMachine;
import dev.mars.qrtx.workflow.ReadinessTracker;
import dev.mars.qrtx.workflow.WorkflowGraph;
import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregate binding one workflow graph to its lifecycle, stage runs and outputs.
 *
 * <p>Mutated only from the pipeline driver's context, which makes every transition of
 * a job totally ordered.</p>
 */
final class Job {

    /**
     * Why and how a job is being stopped before all stages completed.
     */
    record StopRequest(JobState target, CauseCode causeCode, String summary, String stageId, Throwable failure) {
    }

    private final String jobId;
    private final String name;
    private final JobPriority priority;
    private final WorkflowGraph graph;
    private final JobStateMachine stateMachine;
    private final ReadinessTracker tracker;
    private final long admissionOrder;
    private final Instant createdAt;
    private final long deadlineMs;
    private final Map<String, StageRun> runs = new LinkedHashMap<>();
    private final Map<String, JsonObject> stageOutputs = new LinkedHashMap<>();

    private int inflight;
    private StopRequest stopRequest;
    private boolean finishing;
    private boolean cancelRequested;
    private String errorDetailsRef;
    private Instant completedAt;
    private long watchdogTimerId = -1;

    Job(String jobId, String name, JobPriority priority, WorkflowGraph graph, JobStateMachine stateMachine,
        ReadinessTracker tracker, long admissionOrder, Instant createdAt, long deadlineMs) {
        this.jobId = jobId;
        this.name = name;
        this.priority = priority;
        this.graph = graph;
        this.stateMachine = stateMachine;
        this.tracker = tracker;
        this.admissionOrder = admissionOrder;
        this.createdAt = createdAt;
        this.deadlineMs = deadlineMs;
        int index = 0;
        for (StageDefinition stage : graph.getStages()) {
            runs.put(stage.getId(), new StageRun(stage, index++));
        }
    }

    String jobId() {
        return jobId;
    }

    String name() {
        return name;
    }

    JobPriority priority() {
        return priority;
    }

    WorkflowGraph graph() {
        return graph;
    }

    JobStateMachine stateMachine() {
        return stateMachine;
    }

    JobState state() {
        return stateMachine.getCurrentState();
    }

    boolean isTerminal() {
        return stateMachine.isTerminal();
    }

    ReadinessTracker tracker() {
        return tracker;
    }

    long admissionOrder() {
        return admissionOrder;
    }

    Instant createdAt() {
        return createdAt;
    }

    long deadlineMs() {
        return deadlineMs;
    }

    StageRun run(String stageId) {
        StageRun run = runs.get(stageId);
        if (run == null) {
            throw new IllegalArgumentException("Unknown stage '" + stageId + "' in job " + jobId);
        }
        return run;
    }

    Collection<StageRun> runs() {
        return runs.values();
    }

    void putStageOutputs(String stageId, JsonObject bundle) {
        stageOutputs.put(stageId, bundle);
    }

    Optional<JsonObject> stageOutputs(String stageId) {
        return Optional.ofNullable(stageOutputs.get(stageId));
    }

    /**
     * Value of a named output, looked up through the stage that produces it.
     */
    Object outputValue(String outputName) {
        return graph.producerOf(outputName)
                .map(stageOutputs::get)
                .map(bundle -> bundle.getValue(outputName))
                .orElse(null);
    }

    JsonObject allOutputs() {
        JsonObject outputs = new JsonObject();
        for (String stageId : graph.topologicalOrder()) {
            JsonObject bundle = stageOutputs.get(stageId);
            if (bundle != null) {
                bundle.forEach(entry -> outputs.put(entry.getKey(), entry.getValue()));
            }
        }
        return outputs;
    }

    int inflight() {
        return inflight;
    }

    void incrementInflight() {
        inflight++;
    }

    void decrementInflight() {
        if (inflight == 0) {
            throw new IllegalStateException("Job " + jobId + " has no stage in flight");
        }
        inflight--;
    }

    boolean isStopping() {
        return stopRequest != null;
    }

    StopRequest stopRequest() {
        return stopRequest;
    }

    void setStopRequest(StopRequest stopRequest) {
        this.stopRequest = stopRequest;
        if (stopRequest.target() == JobState.CANCELLED) {
            cancelRequested = true;
        }
    }

    boolean isCancelRequested() {
        return cancelRequested;
    }

    boolean isFinishing() {
        return finishing;
    }

    void setFinishing() {
        this.finishing = true;
    }

    String errorDetailsRef() {
        return errorDetailsRef;
    }

    void setErrorDetailsRef(String errorDetailsRef) {
        this.errorDetailsRef = errorDetailsRef;
    }

    Instant completedAt() {
        return completedAt;
    }

    void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    long watchdogTimerId() {
        return watchdogTimerId;
    }

    void setWatchdogTimerId(long watchdogTimerId) {
        this.watchdogTimerId = watchdogTimerId;
    }

    JobStatus status() {
        List<StageSummary> stages = new ArrayList<>(runs.size());
        for (StageRun run : runs.values()) {
            stages.add(run.summary());
        }
        CauseCode cause = null;
        String summary = null;
        String failedStage = null;
        if (stopRequest != null && stopRequest.target().requiresCause()) {
            cause = stopRequest.causeCode();
            summary = stopRequest.summary();
            failedStage = stopRequest.stageId();
        }
        JobState state = stateMachine.getCurrentState();
        return new JobStatus(jobId, name, priority, state, state.getProgress(), cancelRequested,
                List.copyOf(stages), List.copyOf(stateMachine.getHistory()),
                cause, summary, errorDetailsRef, failedStage, createdAt, completedAt);
    }
}
