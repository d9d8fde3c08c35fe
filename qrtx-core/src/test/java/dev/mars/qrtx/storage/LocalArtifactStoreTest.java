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

package dev.mars.qrtx.storage;

import dev.mars.qrtx.core.exceptions.ArtifactStoreException;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
@DisplayName("Local artifact store")
class LocalArtifactStoreTest {

    @TempDir
    Path tempDir;

    private LocalArtifactStore store;

    @BeforeEach
    void setUp(Vertx vertx) {
        store = new LocalArtifactStore(vertx, tempDir);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Artifacts")
    class ArtifactTests {

        @Test
        @DisplayName("persisted bytes are written under the per-job layout and read back")
        void persistAndRetrieve(VertxTestContext testContext) {
            store.persist("job-1", "compile", ArtifactKind.COMPILED_PAYLOAD, bytes("OPENQASM 3;"))
                    .compose(ref -> {
                        testContext.verify(() -> {
                            assertEquals("qfs://job-1/compile/compiled", ref.toUri());
                            assertTrue(Files.exists(tempDir.resolve("job-1/artifacts/compile/compiled.bin")));
                        });
                        return store.retrieve(ref);
                    })
                    .onComplete(testContext.succeeding(data -> testContext.verify(() -> {
                        assertEquals("OPENQASM 3;", new String(data, StandardCharsets.UTF_8));
                        testContext.completeNow();
                    })));
        }

        @Test
        @DisplayName("persisting the same artifact twice replaces it and leaves no temporary files")
        void overwriteIsAtomic(VertxTestContext testContext) {
            store.persist("job-1", "s", ArtifactKind.STAGE_OUTPUT, bytes("v1"))
                    .compose(ref -> store.persist("job-1", "s", ArtifactKind.STAGE_OUTPUT, bytes("v2")))
                    .compose(store::retrieve)
                    .onComplete(testContext.succeeding(data -> testContext.verify(() -> {
                        assertEquals("v2", new String(data, StandardCharsets.UTF_8));
                        try (Stream<Path> files = Files.list(tempDir.resolve("job-1/artifacts/s"))) {
                            assertEquals(List.of("output.bin"),
                                    files.map(p -> p.getFileName().toString()).toList());
                        }
                        testContext.completeNow();
                    })));
        }

        @Test
        @DisplayName("retrieving a missing artifact fails with ArtifactStoreException")
        void missingArtifact(VertxTestContext testContext) {
            store.retrieve(new ArtifactRef("job-9", "s", ArtifactKind.STAGE_OUTPUT))
                    .onComplete(testContext.failing(error -> testContext.verify(() -> {
                        assertInstanceOf(ArtifactStoreException.class, error);
                        testContext.completeNow();
                    })));
        }

        @Test
        @DisplayName("path traversal in job ids is rejected")
        void pathTraversalRejected(VertxTestContext testContext) {
            store.persist("../escape", "s", ArtifactKind.STAGE_OUTPUT, bytes("x"))
                    .onComplete(testContext.failing(error -> testContext.verify(() -> {
                        assertInstanceOf(ArtifactStoreException.class, error);
                        assertFalse(Files.exists(tempDir.getParent().resolve("escape")));
                        testContext.completeNow();
                    })));
        }
    }

    @Nested
    @DisplayName("Checkpoints")
    class CheckpointTests {

        @Test
        @DisplayName("checkpoints are listed in sequence order")
        void listInSequenceOrder(VertxTestContext testContext) {
            store.checkpointWrite("job-2", "execute", 11, bytes("{}"))
                    .compose(r -> store.checkpointWrite("job-2", "compile", 2, bytes("{}")))
                    .compose(r -> store.checkpointWrite("job-2", "reduce", 30, bytes("{\"x\":1}")))
                    .compose(r -> store.listCheckpoints("job-2"))
                    .onComplete(testContext.succeeding(refs -> testContext.verify(() -> {
                        assertEquals(List.of(2L, 11L, 30L), refs.stream().map(CheckpointRef::sequence).toList());
                        assertEquals("compile", refs.get(0).stageId());
                        testContext.completeNow();
                    })));
        }

        @Test
        @DisplayName("reading a checkpoint returns the written bytes")
        void readBack(VertxTestContext testContext) {
            store.checkpointWrite("job-3", "execute", 1, bytes("{\"seq\":1}"))
                    .compose(store::checkpointRead)
                    .onComplete(testContext.succeeding(data -> testContext.verify(() -> {
                        assertEquals("{\"seq\":1}", new String(data, StandardCharsets.UTF_8));
                        testContext.completeNow();
                    })));
        }

        @Test
        @DisplayName("a job without checkpoints lists nothing")
        void emptyJob(VertxTestContext testContext) {
            store.listCheckpoints("job-none")
                    .onComplete(testContext.succeeding(refs -> testContext.verify(() -> {
                        assertTrue(refs.isEmpty());
                        testContext.completeNow();
                    })));
        }

        @Test
        @DisplayName("listJobs reports every job directory")
        void listJobs(VertxTestContext testContext) {
            store.checkpointWrite("job-a", "s", 1, bytes("{}"))
                    .compose(r -> store.persist("job-b", "s", ArtifactKind.JOB_RECORD, bytes("{}")))
                    .compose(r -> store.listJobs())
                    .onComplete(testContext.succeeding(jobs -> testContext.verify(() -> {
                        assertEquals(List.of("job-a", "job-b"), jobs);
                        testContext.completeNow();
                    })));
        }
    }
}
