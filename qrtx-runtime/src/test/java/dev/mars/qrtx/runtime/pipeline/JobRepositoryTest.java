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

import dev.mars.qrtx.core.JobPriority;
import dev.mars.qrtx.core.JobState;
import dev.mars.qrtx.core.JsonMappers;
import dev.mars.qrtx.storage.ArtifactKind;
import dev.mars.qrtx.storage.ArtifactRef;
import dev.mars.qrtx.storage.ArtifactStore;
import dev.mars.qrtx.storage.CheckpointRef;
import dev.mars.qrtx.storage.InMemoryArtifactStore;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("JobRepository")
class JobRepositoryTest {

    private static JobRecord record(String jobId, JobState state) {
        Instant now = Instant.now();
        return new JobRecord(jobId, "bell", JobPriority.NORMAL, state, null, now, now, 0, List.of(), List.of(),
                null, null, null, null, 1);
    }

    @Test
    @DisplayName("A saved record loads back unchanged")
    void saveAndLoad() throws Exception {
        JobRepository repository = new JobRepository(new InMemoryArtifactStore(), JsonMappers.create());

        repository.saveRecord(record("job-1", JobState.RUNNING));
        JobRecord loaded = repository.loadRecord("job-1").toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);

        assertEquals("job-1", loaded.jobId());
        assertEquals(JobState.RUNNING, loaded.state());
        assertEquals(0, repository.pendingJobCount());
    }

    @Test
    @DisplayName("Writes of one job are applied in order and forgotten once applied")
    void writesQueuedThenDropped() {
        GatedStore store = new GatedStore();
        JobRepository repository = new JobRepository(store, JsonMappers.create());

        repository.saveRecord(record("job-1", JobState.QUEUED));
        repository.saveRecord(record("job-1", JobState.RUNNING));
        Future<Void> flushed = repository.flush("job-1");

        assertEquals(1, repository.pendingJobCount());
        assertEquals(1, store.gates.size());
        assertFalse(flushed.isComplete());

        store.gates.get(0).complete(new ArtifactRef("job-1", "_job", ArtifactKind.JOB_RECORD));
        assertEquals(2, store.gates.size());
        assertFalse(flushed.isComplete());

        store.gates.get(1).complete(new ArtifactRef("job-1", "_job", ArtifactKind.JOB_RECORD));
        assertTrue(flushed.succeeded());
        assertEquals(0, repository.pendingJobCount());
        assertTrue(repository.flush("job-1").succeeded());
    }

    @Test
    @DisplayName("A failed write is logged, does not block later writes and is still forgotten")
    void failedWriteForgotten() {
        GatedStore store = new GatedStore();
        JobRepository repository = new JobRepository(store, JsonMappers.create());

        Future<Void> first = repository.saveRecord(record("job-1", JobState.RUNNING));
        store.gates.get(0).fail(new IllegalStateException("disk full"));

        assertTrue(first.succeeded());
        assertEquals(0, repository.pendingJobCount());
    }

    /**
     * Store whose persist calls stay open until the test completes them.
     */
    private static final class GatedStore implements ArtifactStore {
        private final List<Promise<ArtifactRef>> gates = new CopyOnWriteArrayList<>();

        @Override
        public Future<ArtifactRef> persist(String jobId, String stageId, ArtifactKind kind, byte[] bytes) {
            Promise<ArtifactRef> gate = Promise.promise();
            gates.add(gate);
            return gate.future();
        }

        @Override
        public Future<byte[]> retrieve(ArtifactRef ref) {
            return Future.failedFuture(new UnsupportedOperationException());
        }

        @Override
        public Future<CheckpointRef> checkpointWrite(String jobId, String stageId, long sequence, byte[] bytes) {
            return Future.failedFuture(new UnsupportedOperationException());
        }

        @Override
        public Future<byte[]> checkpointRead(CheckpointRef ref) {
            return Future.failedFuture(new UnsupportedOperationException());
        }

        @Override
        public Future<List<CheckpointRef>> listCheckpoints(String jobId) {
            return Future.succeededFuture(List.of());
        }

        @Override
        public Future<List<String>> listJobs() {
            return Future.succeededFuture(List.of());
        }
    }
}
