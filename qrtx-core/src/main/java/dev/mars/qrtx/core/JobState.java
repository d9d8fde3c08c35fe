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

package dev.mars.qrtx.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle states of an orchestrated job.
 *
 * <h3>State Transition Flow:</h3>
 * <pre>
 * PENDING → COMPILING → QUEUED → RUNNING → DONE
 *    │          │          │         │
 *    └──────────┴──────────┴─────────┴──→ ERROR | CANCELLED | TIMEOUT
 * </pre>
 *
 * <p>{@code DONE}, {@code ERROR}, {@code CANCELLED} and {@code TIMEOUT} are terminal:
 * each is entered at most once per job and has no outgoing transitions.
 * {@code TIMEOUT} is kept apart from {@code ERROR} so that callers can apply
 * different retry semantics to a job that ran out of wall-clock time.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public enum JobState {

    /** Admitted, not yet started by the pipeline driver. */
    PENDING(0.0),

    /** Compile stages are being processed. */
    COMPILING(0.25),

    /** Compilation is over and execution stages are waiting for a resource. */
    QUEUED(0.5),

    /** At least one execution stage has been dispatched. */
    RUNNING(0.75),

    /** Every stage completed. */
    DONE(1.0),

    /** A stage failed permanently, or the orchestrator hit an internal defect. */
    ERROR(1.0),

    /** Cancelled by request once in-flight stages settled. */
    CANCELLED(1.0),

    /** The job deadline elapsed before a terminal state was reached. */
    TIMEOUT(1.0);

    // ── Transition table (single source of truth) ──────────────────────

    private static final Map<JobState, Set<JobState>> TRANSITIONS;

    static {
        var map = new EnumMap<JobState, Set<JobState>>(JobState.class);
        map.put(PENDING, EnumSet.of(COMPILING, ERROR, CANCELLED, TIMEOUT));
        map.put(COMPILING, EnumSet.of(QUEUED, ERROR, CANCELLED, TIMEOUT));
        map.put(QUEUED, EnumSet.of(RUNNING, ERROR, CANCELLED, TIMEOUT));
        map.put(RUNNING, EnumSet.of(DONE, ERROR, CANCELLED, TIMEOUT));
        map.put(DONE, EnumSet.noneOf(JobState.class));
        map.put(ERROR, EnumSet.noneOf(JobState.class));
        map.put(CANCELLED, EnumSet.noneOf(JobState.class));
        map.put(TIMEOUT, EnumSet.noneOf(JobState.class));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    private final double progress;

    JobState(double progress) {
        this.progress = progress;
    }

    /**
     * Coarse progress fraction reported alongside the state.
     *
     * @return a value in {@code [0.0, 1.0]}
     */
    public double getProgress() {
        return progress;
    }

    public boolean isTerminal() {
        return this == DONE || this == ERROR || this == CANCELLED || this == TIMEOUT;
    }

    /**
     * Terminal states that record a cause code and a diagnostics reference.
     */
    public boolean requiresCause() {
        return this == ERROR || this == TIMEOUT;
    }

    public boolean canTransitionTo(JobState target) {
        return TRANSITIONS.getOrDefault(this, EnumSet.noneOf(JobState.class)).contains(target);
    }

    /**
     * Returns all valid target states from this state.
     *
     * @return unmodifiable set, empty for terminal states
     */
    public Set<JobState> getValidTransitions() {
        return TRANSITIONS.getOrDefault(this, Collections.emptySet());
    }

    /**
     * The non-terminal states that lie strictly between this state and {@link #RUNNING},
     * in the order they must be entered. Used when a job has to be walked forward
     * through the happy path (for example a graph without compile stages).
     *
     * @return ordered list, empty if this state is already {@code RUNNING} or terminal
     */
    public List<JobState> pathToRunning() {
        return switch (this) {
            case PENDING -> List.of(COMPILING, QUEUED, RUNNING);
            case COMPILING -> List.of(QUEUED, RUNNING);
            case QUEUED -> List.of(RUNNING);
            case RUNNING, DONE, ERROR, CANCELLED, TIMEOUT -> List.of();
        };
    }
}
