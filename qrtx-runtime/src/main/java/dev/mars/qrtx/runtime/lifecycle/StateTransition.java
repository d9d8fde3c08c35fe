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

package dev.mars.qrtx.runtime.lifecycle;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.mars.qrtx.core.CauseCode;
import dev.mars.qrtx.core.JobState;

import java.time.Instant;
import java.util.Objects;

/**
 * One recorded lifecycle transition.
 *
 * @param from       previous state
 * @param to         new state
 * @param timestamp  when the transition was applied
 * @param causeCode  set for {@code ERROR} and {@code TIMEOUT}, null otherwise
 * @param detailsRef reference to diagnostics held by the storage collaborator, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StateTransition(JobState from, JobState to, Instant timestamp, CauseCode causeCode, String detailsRef) {

    public StateTransition {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
