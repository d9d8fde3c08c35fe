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

package dev.mars.qrtx.runtime;

import dev.mars.qrtx.core.JobState;
import dev.mars.qrtx.runtime.events.JobEvent;
import dev.mars.qrtx.runtime.events.JobEventType;
import dev.mars.qrtx.runtime.pipeline.JobResults;
import dev.mars.qrtx.runtime.pipeline.JobStatus;
import dev.mars.qrtx.runtime.simulator.SimulatedBackend;
import dev.mars.qrtx.runtime.simulator.SimulatedCompiler;
import dev.mars.qrtx.storage.ArtifactKind;
import dev.mars.qrtx.storage.ArtifactRef;
import dev.mars.qrtx.storage.InMemoryArtifactStore;
import io.opentelemetry.api.OpenTelemetry;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static dev.mars.qrtx.runtime.RuntimeFixtures.awaitTerminal;
import static dev.mars.qrtx.runtime.RuntimeFixtures.device;
import static dev.mars.qrtx.runtime.RuntimeFixtures.join;
import static dev.mars.qrtx.runtime.RuntimeFixtures.linearGraph;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * A job started by one orchestrator is continued by another that shares its artifact store.
 */
@ExtendWith(VertxExtension.class)
@DisplayName("Orchestrator recovery")
class OrchestratorRecoveryTest {

    private Vertx vertx;
    private InMemoryArtifactStore store;

    @BeforeEach
    void setUp(Vertx vertx) {
        this.vertx = vertx;
        this.store = new InMemoryArtifactStore();
    }

    private Orchestrator orchestrator(Vertx on, SimulatedCompiler compiler, SimulatedBackend backend) {
        return Orchestrator.builder(on)
                .configuration(RuntimeFixtures.fastConfiguration())
                .compiler(compiler)
                .backend(backend)
                .evaluator(RuntimeFixtures.evaluator(on))
                .store(store)
                .registry(RuntimeFixtures.registry(device("qpu-a", 5)))
                .meter(OpenTelemetry.noop().getMeter("qrtx-runtime"))
                .build();
    }

    /**
     * Run a job on a separate Vert.x instance until the quantum stage is in flight, then close
     * that instance as if the process died.
     */
    private String crashWhileExecuting() throws Exception {
        Vertx doomed = Vertx.vertx();
        SimulatedBackend backend = new SimulatedBackend(doomed);
        backend.holdExecutions();
        Orchestrator first = orchestrator(doomed, new SimulatedCompiler(), backend);

        String jobId = join(first.submit("bell", linearGraph(2)));
        await().atMost(Duration.ofSeconds(5)).until(() -> backend.heldCount() == 1);
        join(doomed.close());
        return jobId;
    }

    @Test
    @DisplayName("Resumes after the last verified checkpoint and matches an uninterrupted run")
    void resumesDeterministically() throws Exception {
        String crashed = crashWhileExecuting();

        SimulatedCompiler compiler = new SimulatedCompiler();
        SimulatedBackend backend = new SimulatedBackend(vertx);
        Orchestrator second = orchestrator(vertx, compiler, backend);
        join(second.recover(crashed));
        JobStatus recovered = awaitTerminal(second, crashed);

        assertEquals(JobState.DONE, recovered.state());
        assertEquals(0, compiler.getCallCount());
        assertEquals(1, backend.getRequests().size());

        String reference = join(second.submit("bell", linearGraph(2)));
        awaitTerminal(second, reference);
        JobResults expected = join(second.results(reference)).orElseThrow();
        JobResults actual = join(second.results(crashed)).orElseThrow();

        assertEquals(expected.outputs().encode(), actual.outputs().encode());
        assertEquals(expected.counts(), actual.counts());
    }

    @Test
    @DisplayName("The event feed continues after the persisted sequence")
    void eventFeedContinues() throws Exception {
        String crashed = crashWhileExecuting();
        Orchestrator second = orchestrator(vertx, new SimulatedCompiler(), new SimulatedBackend(vertx));

        join(second.recover(crashed));
        awaitTerminal(second, crashed);

        List<JobEvent> events = second.events(crashed, 0);
        assertEquals(JobEventType.RECOVERED, events.get(0).type());
        assertThat(events.get(0).sequence()).isGreaterThan(1);
        assertThat(events).filteredOn(JobEvent::isTerminal).hasSize(1);
    }

    @Test
    @DisplayName("A corrupted checkpointed output is recomputed")
    void corruptedCheckpointRecomputed() throws Exception {
        String crashed = crashWhileExecuting();
        store.corrupt(new ArtifactRef(crashed, "compile", ArtifactKind.COMPILED_PAYLOAD), "{}".getBytes());

        SimulatedCompiler compiler = new SimulatedCompiler();
        Orchestrator second = orchestrator(vertx, compiler, new SimulatedBackend(vertx));
        join(second.recover(crashed));

        assertEquals(JobState.DONE, awaitTerminal(second, crashed).state());
        assertEquals(1, compiler.getCallCount());
    }

    @Test
    @DisplayName("Finished jobs are not run again")
    void terminalJobNotRerun() throws Exception {
        Orchestrator first = orchestrator(vertx, new SimulatedCompiler(), new SimulatedBackend(vertx));
        String jobId = join(first.submit("bell", linearGraph(2)));
        awaitTerminal(first, jobId);

        SimulatedCompiler compiler = new SimulatedCompiler();
        Orchestrator second = orchestrator(vertx, compiler, new SimulatedBackend(vertx));
        ExecutionException e = assertThrows(ExecutionException.class, () -> join(second.recover(jobId)));

        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals(0, compiler.getCallCount());
    }

    @Test
    @DisplayName("Recovering an unknown job fails")
    void unknownJob() throws Exception {
        Orchestrator orchestrator = orchestrator(vertx, new SimulatedCompiler(), new SimulatedBackend(vertx));

        assertThrows(ExecutionException.class, () -> join(orchestrator.recover("no-such-job")));
        assertTrue(join(orchestrator.status("no-such-job")).isEmpty());
    }
}
