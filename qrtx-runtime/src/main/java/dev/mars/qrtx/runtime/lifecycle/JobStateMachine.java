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

import dev.mars.qrtx.core.CauseCode;
import dev.mars.qrtx.core.JobState;
import dev.mars.qrtx.core.exceptions.InvalidTransitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Lifecycle of one job. Every accepted transition is appended to the history; a rejected one
 * throws and leaves the machine unchanged.
 *
 * <p>Not thread-safe. The pipeline driver applies all transitions of a job from its single
 * event-loop context.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class JobStateMachine {
    private static final Logger logger = LoggerFactory.getLogger(JobStateMachine.class);

    private final String jobId;
    private final Clock clock;
    private final List<StateTransition> history;
    private JobState current;

    public JobStateMachine(String jobId, Clock clock) {
        this(jobId, clock, List.of());
    }

    /**
     * Rebuild a machine from a persisted history, e.g. when a job is recovered.
     *
     * @throws IllegalArgumentException if the history is not a valid path from {@code PENDING}
     */
    public JobStateMachine(String jobId, Clock clock, List<StateTransition> restoredHistory) {
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.history = new ArrayList<>();
        this.current = JobState.PENDING;
        for (StateTransition transition : restoredHistory) {
            if (transition.from() != current || !current.canTransitionTo(transition.to())) {
                throw new IllegalArgumentException("Job " + jobId + ": history is not a valid path at "
                        + transition.from() + " → " + transition.to());
            }
            history.add(transition);
            current = transition.to();
        }
    }

    public String getJobId() {
        return jobId;
    }

    public JobState getCurrentState() {
        return current;
    }

    public boolean isTerminal() {
        return current.isTerminal();
    }

    public List<StateTransition> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public StateTransition lastTransition() {
        return history.isEmpty() ? null : history.get(history.size() - 1);
    }

    public StateTransition transitionTo(JobState target) throws InvalidTransitionException {
        return transitionTo(target, null, null);
    }

    /**
     * @param causeCode  required when entering {@code ERROR} or {@code TIMEOUT}
     * @param detailsRef diagnostics reference, stored as given
     */
    public StateTransition transitionTo(JobState target, CauseCode causeCode, String detailsRef)
            throws InvalidTransitionException {
        if (!current.canTransitionTo(target)) {
            throw new InvalidTransitionException(jobId, current, target,
                    current.getValidTransitions().toArray(new JobState[0]));
        }
        if (target.requiresCause() && causeCode == null) {
            throw new IllegalArgumentException("Transition to " + target + " requires a cause code");
        }
        StateTransition transition = new StateTransition(current, target, clock.instant(),
                target.requiresCause() ? causeCode : null, detailsRef);
        history.add(transition);
        current = target;
        if (target.isTerminal()) {
            logger.info("Job {} reached {}{}", jobId, target, causeCode != null ? " (" + causeCode + ")" : "");
        } else {
            logger.debug("Job {}: {} → {}", jobId, transition.from(), target);
        }
        return transition;
    }

    /**
     * Walk forward along the main path until {@code target} is reached. Only forward, non-terminal
     * targets are accepted; the states passed through are recorded one by one.
     *
     * @return the transitions applied, empty if already there
     */
    public List<StateTransition> advanceTo(JobState target) throws InvalidTransitionException {
        List<JobState> path = current.pathToRunning();
        int index = path.indexOf(target);
        if (target == current) {
            return List.of();
        }
        if (target.isTerminal() || index < 0) {
            throw new InvalidTransitionException(jobId, current, target,
                    current.getValidTransitions().toArray(new JobState[0]));
        }
        List<StateTransition> applied = new ArrayList<>();
        for (JobState step : path.subList(0, index + 1)) {
            applied.add(transitionTo(step));
        }
        return applied;
    }
}
