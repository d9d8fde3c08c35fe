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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("JobStateMachine")
class JobStateMachineTest {

    private static final Instant NOW = Instant.parse("2026-10-19T10:00:00Z");

    private JobStateMachine machine;

    @BeforeEach
    void setUp() {
        machine = new JobStateMachine("job-1", Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Starts in PENDING with empty history")
    void startsPending() {
        assertEquals(JobState.PENDING, machine.getCurrentState());
        assertThat(machine.getHistory()).isEmpty();
        assertNull(machine.lastTransition());
    }

    @Test
    @DisplayName("Happy path records every transition with timestamp")
    void happyPath() throws Exception {
        machine.transitionTo(JobState.COMPILING);
        machine.transitionTo(JobState.QUEUED);
        machine.transitionTo(JobState.RUNNING);
        StateTransition done = machine.transitionTo(JobState.DONE);

        assertTrue(machine.isTerminal());
        assertThat(machine.getHistory()).extracting(StateTransition::to)
                .containsExactly(JobState.COMPILING, JobState.QUEUED, JobState.RUNNING, JobState.DONE);
        assertEquals(JobState.RUNNING, done.from());
        assertEquals(NOW, done.timestamp());
        assertNull(done.causeCode());
    }

    @Test
    @DisplayName("Skipping a state is rejected and leaves the machine unchanged")
    void skipRejected() {
        InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
                () -> machine.transitionTo(JobState.RUNNING));
        assertEquals(JobState.PENDING, e.getCurrentState());
        assertEquals(JobState.RUNNING, e.getRequestedState());
        assertThat(machine.getHistory()).isEmpty();
    }

    @Nested
    @DisplayName("Terminal states")
    class TerminalStates {

        @ParameterizedTest
        @EnumSource(value = JobState.class, names = {"PENDING", "COMPILING", "QUEUED", "RUNNING"})
        @DisplayName("CANCELLED is reachable from every non-terminal state")
        void cancelFromAnywhere(JobState from) throws Exception {
            machine.advanceTo(from);
            machine.transitionTo(JobState.CANCELLED);
            assertEquals(JobState.CANCELLED, machine.getCurrentState());
        }

        @ParameterizedTest
        @EnumSource(value = JobState.class, names = {"DONE", "CANCELLED", "ERROR", "TIMEOUT"})
        @DisplayName("No transition leaves a terminal state")
        void terminalIsFinal(JobState terminal) throws Exception {
            machine.advanceTo(JobState.RUNNING);
            machine.transitionTo(terminal, CauseCode.INTERNAL_ERROR, null);

            for (JobState target : JobState.values()) {
                assertThrows(InvalidTransitionException.class, () -> machine.transitionTo(target, CauseCode.INTERNAL_ERROR, null));
            }
            assertThat(machine.getHistory()).filteredOn(t -> t.to().isTerminal()).hasSize(1);
        }

        @Test
        @DisplayName("ERROR records cause code and details reference")
        void errorCarriesCause() throws Exception {
            machine.transitionTo(JobState.ERROR, CauseCode.NO_CANDIDATE, "artifact://job-1/s1/ERROR_DETAILS");

            StateTransition last = machine.lastTransition();
            assertEquals(CauseCode.NO_CANDIDATE, last.causeCode());
            assertEquals("artifact://job-1/s1/ERROR_DETAILS", last.detailsRef());
        }

        @Test
        @DisplayName("TIMEOUT without a cause code is refused")
        void timeoutNeedsCause() {
            assertThrows(IllegalArgumentException.class, () -> machine.transitionTo(JobState.TIMEOUT));
            assertEquals(JobState.PENDING, machine.getCurrentState());
        }

        @Test
        @DisplayName("Cause code is dropped for states that do not carry one")
        void causeIgnoredForCancel() throws Exception {
            StateTransition t = machine.transitionTo(JobState.CANCELLED, CauseCode.INTERNAL_ERROR, null);
            assertNull(t.causeCode());
        }
    }

    @Nested
    @DisplayName("advanceTo")
    class AdvanceTo {

        @Test
        @DisplayName("Walks through intermediate states one by one")
        void walksForward() throws Exception {
            List<StateTransition> applied = machine.advanceTo(JobState.RUNNING);

            assertThat(applied).extracting(StateTransition::to)
                    .containsExactly(JobState.COMPILING, JobState.QUEUED, JobState.RUNNING);
        }

        @Test
        @DisplayName("Is a no-op when already there")
        void noOpWhenThere() throws Exception {
            machine.advanceTo(JobState.QUEUED);
            assertThat(machine.advanceTo(JobState.QUEUED)).isEmpty();
        }

        @Test
        @DisplayName("Refuses terminal and backward targets")
        void refusesTerminalAndBackward() throws Exception {
            assertThrows(InvalidTransitionException.class, () -> machine.advanceTo(JobState.DONE));
            machine.advanceTo(JobState.RUNNING);
            assertThrows(InvalidTransitionException.class, () -> machine.advanceTo(JobState.COMPILING));
        }
    }

    @Nested
    @DisplayName("Restored history")
    class Restored {

        @Test
        @DisplayName("Continues from the last restored state")
        void continuesFromHistory() throws Exception {
            machine.advanceTo(JobState.RUNNING);
            JobStateMachine restored = new JobStateMachine("job-1", Clock.systemUTC(), machine.getHistory());

            assertEquals(JobState.RUNNING, restored.getCurrentState());
            restored.transitionTo(JobState.DONE);
            assertThat(restored.getHistory()).hasSize(4);
        }

        @Test
        @DisplayName("Rejects a history that is not a valid path")
        void rejectsBrokenHistory() {
            List<StateTransition> broken = List.of(
                    new StateTransition(JobState.PENDING, JobState.COMPILING, NOW, null, null),
                    new StateTransition(JobState.QUEUED, JobState.RUNNING, NOW, null, null));

            assertThrows(IllegalArgumentException.class, () -> new JobStateMachine("job-1", Clock.systemUTC(), broken));
        }
    }
}
