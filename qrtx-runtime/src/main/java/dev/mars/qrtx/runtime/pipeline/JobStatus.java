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
import dev.mars.qrtx.runtime.lifecycle.StateTransition;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Snapshot returned by a status query. Failures are reported through a stable cause code,
 * a one-line summary and a reference to the stored diagnostics; never as raw exceptions.
 */
public record JobStatus(String jobId, String name, JobPriority priority, JobState state, double progress,
                        boolean cancelRequested, List<StageSummary> stages, List<StateTransition> history,
                        CauseCode causeCode, String errorSummary, String errorDetailsRef, String failedStageId,
                        Instant createdAt, Instant completedAt) {

    public boolean isTerminal() {
        return state.isTerminal();
    }

    public Optional<StageSummary> stage(String stageId) {
        return stages.stream().filter(s -> s.stageId().equals(stageId)).findFirst();
    }
}
