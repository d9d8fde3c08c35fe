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

package dev.mars.qrtx.runtime.observability;

import dev.mars.qrtx.core.CauseCode;
import dev.mars.qrtx.core.StageKind;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the orchestration kernel.
 *
 * <ul>
 *   <li>qrtx.jobs.submitted (counter)</li>
 *   <li>qrtx.jobs.done / error / cancelled / timeout (counters)</li>
 *   <li>qrtx.jobs.active (gauge)</li>
 *   <li>qrtx.jobs.duration.seconds (histogram)</li>
 *   <li>qrtx.stages.dispatched, qrtx.stages.retries, qrtx.stages.failed (counters)</li>
 *   <li>qrtx.checkpoints.written, qrtx.checkpoints.failed (counters)</li>
 * </ul>
 *
 * <p>One instance per orchestrator, bound to the meter it is given.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class OrchestratorMetrics {

    private static final Logger logger = LoggerFactory.getLogger(OrchestratorMetrics.class);
    public static final String METER_NAME = "qrtx-runtime";

    private final LongCounter jobsSubmitted;
    private final LongCounter jobsDone;
    private final LongCounter jobsError;
    private final LongCounter jobsCancelled;
    private final LongCounter jobsTimeout;
    private final LongCounter stagesDispatched;
    private final LongCounter stageRetries;
    private final LongCounter stagesFailed;
    private final LongCounter checkpointsWritten;
    private final LongCounter checkpointsFailed;

    private final DoubleHistogram jobDuration;

    private final AtomicLong activeJobs = new AtomicLong(0);

    private static final AttributeKey<String> WORKFLOW_NAME_KEY = AttributeKey.stringKey("workflow.name");
    private static final AttributeKey<String> STAGE_KIND_KEY = AttributeKey.stringKey("stage.kind");
    private static final AttributeKey<String> CAUSE_CODE_KEY = AttributeKey.stringKey("cause.code");
    private static final AttributeKey<String> JOB_STATE_KEY = AttributeKey.stringKey("job.state");

    public OrchestratorMetrics() {
        this(GlobalOpenTelemetry.getMeter(METER_NAME));
    }

    public OrchestratorMetrics(Meter meter) {
        jobsSubmitted = meter.counterBuilder("qrtx.jobs.submitted")
                .setDescription("Jobs admitted")
                .setUnit("1")
                .build();

        jobsDone = meter.counterBuilder("qrtx.jobs.done")
                .setDescription("Jobs that reached DONE")
                .setUnit("1")
                .build();

        jobsError = meter.counterBuilder("qrtx.jobs.error")
                .setDescription("Jobs that reached ERROR")
                .setUnit("1")
                .build();

        jobsCancelled = meter.counterBuilder("qrtx.jobs.cancelled")
                .setDescription("Jobs that reached CANCELLED")
                .setUnit("1")
                .build();

        jobsTimeout = meter.counterBuilder("qrtx.jobs.timeout")
                .setDescription("Jobs that reached TIMEOUT")
                .setUnit("1")
                .build();

        stagesDispatched = meter.counterBuilder("qrtx.stages.dispatched")
                .setDescription("Stage attempts handed to a collaborator")
                .setUnit("1")
                .build();

        stageRetries = meter.counterBuilder("qrtx.stages.retries")
                .setDescription("Stage retries scheduled after a transient failure")
                .setUnit("1")
                .build();

        stagesFailed = meter.counterBuilder("qrtx.stages.failed")
                .setDescription("Stages that failed permanently")
                .setUnit("1")
                .build();

        checkpointsWritten = meter.counterBuilder("qrtx.checkpoints.written")
                .setDescription("Checkpoint records persisted")
                .setUnit("1")
                .build();

        checkpointsFailed = meter.counterBuilder("qrtx.checkpoints.failed")
                .setDescription("Checkpoint records that could not be persisted")
                .setUnit("1")
                .build();

        jobDuration = meter.histogramBuilder("qrtx.jobs.duration.seconds")
                .setDescription("Time from admission to terminal state")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("qrtx.jobs.active")
                .setDescription("Jobs admitted and not yet terminal")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeJobs.get()));

        logger.debug("OrchestratorMetrics initialized");
    }

    public void recordJobSubmitted(String workflowName) {
        jobsSubmitted.add(1, Attributes.of(WORKFLOW_NAME_KEY, workflowName));
        activeJobs.incrementAndGet();
    }

    /**
     * Record a recovered job becoming active again in this process.
     */
    public void recordJobResumed() {
        activeJobs.incrementAndGet();
    }

    public void recordJobDone(String workflowName, double durationSeconds) {
        activeJobs.decrementAndGet();
        Attributes attrs = Attributes.of(WORKFLOW_NAME_KEY, workflowName);
        jobsDone.add(1, attrs);
        jobDuration.record(durationSeconds, Attributes.of(WORKFLOW_NAME_KEY, workflowName, JOB_STATE_KEY, "DONE"));
    }

    public void recordJobFailed(String workflowName, CauseCode causeCode, double durationSeconds) {
        activeJobs.decrementAndGet();
        jobsError.add(1, Attributes.of(WORKFLOW_NAME_KEY, workflowName,
                CAUSE_CODE_KEY, causeCode != null ? causeCode.name() : "unknown"));
        jobDuration.record(durationSeconds, Attributes.of(WORKFLOW_NAME_KEY, workflowName, JOB_STATE_KEY, "ERROR"));
    }

    public void recordJobCancelled(String workflowName, double durationSeconds) {
        activeJobs.decrementAndGet();
        jobsCancelled.add(1, Attributes.of(WORKFLOW_NAME_KEY, workflowName));
        jobDuration.record(durationSeconds, Attributes.of(WORKFLOW_NAME_KEY, workflowName, JOB_STATE_KEY, "CANCELLED"));
    }

    public void recordJobTimedOut(String workflowName, double durationSeconds) {
        activeJobs.decrementAndGet();
        jobsTimeout.add(1, Attributes.of(WORKFLOW_NAME_KEY, workflowName));
        jobDuration.record(durationSeconds, Attributes.of(WORKFLOW_NAME_KEY, workflowName, JOB_STATE_KEY, "TIMEOUT"));
    }

    public void recordStageDispatched(StageKind kind) {
        stagesDispatched.add(1, Attributes.of(STAGE_KIND_KEY, kind.name()));
    }

    public void recordStageRetry(StageKind kind) {
        stageRetries.add(1, Attributes.of(STAGE_KIND_KEY, kind.name()));
    }

    public void recordStageFailed(StageKind kind, CauseCode causeCode) {
        stagesFailed.add(1, Attributes.of(STAGE_KIND_KEY, kind.name(), CAUSE_CODE_KEY, causeCode.name()));
    }

    public void recordCheckpointWritten() {
        checkpointsWritten.add(1);
    }

    public void recordCheckpointFailed() {
        checkpointsFailed.add(1);
    }

    public long getActiveJobs() {
        return activeJobs.get();
    }
}
