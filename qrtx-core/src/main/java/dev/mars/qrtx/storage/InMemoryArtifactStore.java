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
import io.vertx.core.Future;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Process-local artifact store. Contents are lost when the instance is discarded,
 * but a single instance can be shared between orchestrators to exercise recovery.
 */
public class InMemoryArtifactStore implements ArtifactStore {

    private final Map<ArtifactRef, byte[]> artifacts = new ConcurrentHashMap<>();
    private final Map<String, ConcurrentSkipListMap<Long, Map.Entry<CheckpointRef, byte[]>>> checkpoints =
            new ConcurrentHashMap<>();

    @Override
    public Future<ArtifactRef> persist(String jobId, String stageId, ArtifactKind kind, byte[] bytes) {
        try {
            ArtifactRef ref = new ArtifactRef(jobId, stageId, kind);
            artifacts.put(ref, bytes.clone());
            return Future.succeededFuture(ref);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(new ArtifactStoreException(e.getMessage(), e));
        }
    }

    @Override
    public Future<byte[]> retrieve(ArtifactRef ref) {
        byte[] bytes = artifacts.get(ref);
        if (bytes == null) {
            return Future.failedFuture(new ArtifactStoreException("Artifact not found: " + ref));
        }
        return Future.succeededFuture(bytes.clone());
    }

    @Override
    public Future<CheckpointRef> checkpointWrite(String jobId, String stageId, long sequence, byte[] bytes) {
        try {
            CheckpointRef ref = new CheckpointRef(jobId, stageId, sequence);
            checkpoints.computeIfAbsent(jobId, k -> new ConcurrentSkipListMap<>())
                    .put(sequence, Map.entry(ref, bytes.clone()));
            return Future.succeededFuture(ref);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(new ArtifactStoreException(e.getMessage(), e));
        }
    }

    @Override
    public Future<byte[]> checkpointRead(CheckpointRef ref) {
        var perJob = checkpoints.get(ref.jobId());
        var entry = perJob != null ? perJob.get(ref.sequence()) : null;
        if (entry == null || !entry.getKey().equals(ref)) {
            return Future.failedFuture(new ArtifactStoreException("Checkpoint not found: " + ref));
        }
        return Future.succeededFuture(entry.getValue().clone());
    }

    @Override
    public Future<List<CheckpointRef>> listCheckpoints(String jobId) {
        var perJob = checkpoints.get(jobId);
        List<CheckpointRef> refs = new ArrayList<>();
        if (perJob != null) {
            perJob.values().forEach(e -> refs.add(e.getKey()));
        }
        return Future.succeededFuture(refs);
    }

    @Override
    public Future<List<String>> listJobs() {
        TreeSet<String> jobs = new TreeSet<>(checkpoints.keySet());
        artifacts.keySet().forEach(ref -> jobs.add(ref.jobId()));
        return Future.succeededFuture(new ArrayList<>(jobs));
    }

    /**
     * Overwrite stored bytes without going through {@link #persist}, for corruption tests.
     */
    public void corrupt(ArtifactRef ref, byte[] bytes) {
        artifacts.put(ref, bytes.clone());
    }

    public boolean contains(ArtifactRef ref) {
        return artifacts.containsKey(ref);
    }

    public int artifactCount() {
        return artifacts.size();
    }
}
