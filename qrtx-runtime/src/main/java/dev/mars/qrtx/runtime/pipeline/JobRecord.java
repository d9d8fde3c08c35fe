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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import dev.mars.qrtx.core.CauseCode;
import dev.mars.qrtx.core.JobPriority;
import dev.mars.qrtx.core.JobState;
import dev.mars.qrtx.runtime.lifecycle.StateTransition;

import java.time.Instant;
import java.util.List;

/**
 * Durable record of a job: enough to audit every scheduling decision and to recover the job
 * after a restart together with its persisted workflow and checkpoints.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobRecord(String jobId, String name, JobPriority priority, JobState state, String graphRef,
                        Instant createdAt, Instant updatedAt, long deadlineMs, List<StateTransition> history,
                        List<StageRecord> stages, CauseCode causeCode, String errorSummary, String errorDetailsRef,
                        String failedStageId, long lastEventSequence) {

    public JobRecord {
        history = history != null ? List.copyOf(history) : List.of();
        stages = stages != null ? List.copyOf(stages) : List.of();
    }
}
