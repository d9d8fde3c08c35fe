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

import io.vertx.core.Future;

import java.util.List;

/**
 * Storage collaborator. All artifacts and checkpoint records are scoped under a
 * per-job namespace; the orchestrator only ever holds references.
 *
 * <p>Failed futures carry an {@link dev.mars.qrtx.core.exceptions.ArtifactStoreException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public interface ArtifactStore {

    /**
     * Persist bytes, replacing any previous artifact with the same job, stage and kind.
     */
    Future<ArtifactRef> persist(String jobId, String stageId, ArtifactKind kind, byte[] bytes);

    Future<byte[]> retrieve(ArtifactRef ref);

    Future<CheckpointRef> checkpointWrite(String jobId, String stageId, long sequence, byte[] bytes);

    Future<byte[]> checkpointRead(CheckpointRef ref);

    /**
     * All checkpoint references of a job, ordered by ascending sequence.
     */
    Future<List<CheckpointRef>> listCheckpoints(String jobId);

    /**
     * Jobs that have at least one artifact or checkpoint.
     */
    Future<List<String>> listJobs();
}
