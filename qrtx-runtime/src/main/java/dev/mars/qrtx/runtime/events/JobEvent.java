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

package dev.mars.qrtx.runtime.events;

import dev.mars.qrtx.core.JobState;

import java.time.Instant;

/**
 * One entry of a job's ordered event feed.
 *
 * @param jobId     owning job
 * @param sequence  per-job, starting at 1, without gaps
 * @param type      event kind
 * @param timestamp when the event was published
 * @param state     job state after the event
 * @param stageId   stage concerned, null for job-level events
 * @param detail    short human-readable detail, may be null
 */
public record JobEvent(String jobId, long sequence, JobEventType type, Instant timestamp,
                       JobState state, String stageId, String detail) {

    /**
     * The state change that ended the job. Each job's feed holds exactly one.
     */
    public boolean isTerminal() {
        return type == JobEventType.STATE_CHANGED && state.isTerminal();
    }
}
