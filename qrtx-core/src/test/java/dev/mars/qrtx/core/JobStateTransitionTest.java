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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parameterized tests for JobState transition validation.
 * Covers every (source, target) pair.
 */
class JobStateTransitionTest {

    private static EnumSet<JobState> validTargets(JobState from) {
        return switch (from) {
            case PENDING -> EnumSet.of(JobState.COMPILING, JobState.ERROR, JobState.CANCELLED, JobState.TIMEOUT);
            case COMPILING -> EnumSet.of(JobState.QUEUED, JobState.ERROR, JobState.CANCELLED, JobState.TIMEOUT);
            case QUEUED -> EnumSet.of(JobState.RUNNING, JobState.ERROR, JobState.CANCELLED, JobState.TIMEOUT);
            case RUNNING -> EnumSet.of(JobState.DONE, JobState.ERROR, JobState.CANCELLED, JobState.TIMEOUT);
            case DONE, ERROR, CANCELLED, TIMEOUT -> EnumSet.noneOf(JobState.class);
        };
    }

    static Stream<Arguments> allJobStatePairs() {
        List<Arguments> pairs = new ArrayList<>();
        for (JobState from : JobState.values()) {
            Set<JobState> valid = validTargets(from);
            for (JobState to : JobState.values()) {
                pairs.add(Arguments.of(from, to, valid.contains(to)));
            }
        }
        return pairs.stream();
    }

    @ParameterizedTest(name = "{0} → {1} should be {2}")
    @MethodSource("allJobStatePairs")
    void canTransitionTo_coversAllPairs(JobState from, JobState to, boolean expected) {
        assertEquals(expected, from.canTransitionTo(to),
                () -> String.format("%s → %s should be %s", from, to, expected ? "valid" : "invalid"));
    }

    @ParameterizedTest(name = "getValidTransitions consistent for {0}")
    @EnumSource(JobState.class)
    void getValidTransitions_matchesCanTransitionTo(JobState from) {
        Set<JobState> fromCanTransition = EnumSet.noneOf(JobState.class);
        for (JobState to : JobState.values()) {
            if (from.canTransitionTo(to)) {
                fromCanTransition.add(to);
            }
        }
        assertEquals(fromCanTransition, from.getValidTransitions());
    }

    @ParameterizedTest(name = "{0} is terminal and has no way out")
    @EnumSource(value = JobState.class, names = {"DONE", "ERROR", "CANCELLED", "TIMEOUT"})
    void terminalStatesHaveNoTransitions(JobState terminal) {
        assertTrue(terminal.isTerminal());
        assertTrue(terminal.getValidTransitions().isEmpty());
        assertEquals(1.0, terminal.getProgress());
    }

    @ParameterizedTest(name = "{0} can always be cancelled or timed out")
    @EnumSource(value = JobState.class, names = {"PENDING", "COMPILING", "QUEUED", "RUNNING"})
    void nonTerminalStatesAcceptCancelAndTimeout(JobState state) {
        assertFalse(state.isTerminal());
        assertTrue(state.canTransitionTo(JobState.CANCELLED));
        assertTrue(state.canTransitionTo(JobState.TIMEOUT));
        assertTrue(state.canTransitionTo(JobState.ERROR));
    }

    @Test
    void progressIncreasesAlongHappyPath() {
        assertEquals(0.0, JobState.PENDING.getProgress());
        assertEquals(0.25, JobState.COMPILING.getProgress());
        assertEquals(0.5, JobState.QUEUED.getProgress());
        assertEquals(0.75, JobState.RUNNING.getProgress());
        assertEquals(1.0, JobState.DONE.getProgress());
    }

    @Test
    void pathToRunningWalksEveryIntermediateState() {
        assertEquals(List.of(JobState.COMPILING, JobState.QUEUED, JobState.RUNNING), JobState.PENDING.pathToRunning());
        assertEquals(List.of(JobState.RUNNING), JobState.QUEUED.pathToRunning());
        assertTrue(JobState.RUNNING.pathToRunning().isEmpty());
        assertTrue(JobState.DONE.pathToRunning().isEmpty());
    }

    @Test
    void onlyErrorAndTimeoutRequireCause() {
        assertTrue(JobState.ERROR.requiresCause());
        assertTrue(JobState.TIMEOUT.requiresCause());
        assertFalse(JobState.CANCELLED.requiresCause());
        assertFalse(JobState.DONE.requiresCause());
    }
}
