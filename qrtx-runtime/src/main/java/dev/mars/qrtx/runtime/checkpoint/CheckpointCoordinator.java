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

package dev.mars.qrtx.runtime.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.qrtx.core.StageDefinition;
import dev.mars.qrtx.core.exceptions.ArtifactStoreException;
import dev.mars.qrtx.core.exceptions.ChecksumMismatchException;
import dev.mars.qrtx.storage.ArtifactRef;
import dev.mars.qrtx.storage.ArtifactStore;
import dev.mars.qrtx.storage.CheckpointRef;
import dev.mars.qrtx.storage.ChecksumCalculator;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes checkpoint records through the storage collaborator and computes resume points from them.
 *
 * <p>A stage checkpoint stores a reference to the stage's output artifact together with a
 * checksum of its bytes and the list of declared outputs. On resume a checkpoint counts only if
 * the artifact can be read, its checksum matches and every declared output is present in it.</p>
 *
 * <p>Checkpointing is best-effort: write failures are logged here and returned as failed futures,
 * which callers must not treat as stage failures.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class CheckpointCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(CheckpointCoordinator.class);

    private final ArtifactStore store;
    private final ChecksumCalculator checksums;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();

    public CheckpointCoordinator(ArtifactStore store, ChecksumCalculator checksums, ObjectMapper mapper, Clock clock) {
        this.store = store;
        this.checksums = checksums;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * Record that a stage completed with the given persisted output.
     *
     * @param outputRef   artifact holding the stage's output bundle
     * @param outputBytes exact bytes written to {@code outputRef}
     */
    public Future<CheckpointRef> checkpoint(String jobId, StageDefinition stage, int attempt,
                                            ArtifactRef outputRef, byte[] outputBytes) {
        long sequence = nextSequence(jobId);
        CheckpointRecord record = new CheckpointRecord(jobId, stage.getId(), attempt, sequence, CheckpointKind.STAGE,
                clock.instant(), outputRef.toUri(), checksums.checksum(outputBytes), checksums.getAlgorithm(),
                stage.getOutputs());
        return write(record);
    }

    /**
     * Periodic marker for a stage still in flight.
     */
    public Future<CheckpointRef> progress(String jobId, String stageId, int attempt) {
        long sequence = nextSequence(jobId);
        CheckpointRecord record = new CheckpointRecord(jobId, stageId, attempt, sequence, CheckpointKind.PROGRESS,
                clock.instant(), null, null, null, List.of());
        return write(record);
    }

    /**
     * Read every checkpoint of a job and keep those that verify. Unreadable or inconsistent
     * checkpoints are reported in {@link ResumePoint#rejected()} and otherwise ignored; the stage
     * they describe runs again.
     */
    public Future<ResumePoint> resume(String jobId) {
        return store.listCheckpoints(jobId).compose(refs -> {
            ResumeAccumulator acc = new ResumeAccumulator(jobId);
            Future<Void> chain = Future.succeededFuture();
            for (CheckpointRef ref : refs) {
                chain = chain.compose(v -> verify(ref)
                        .map(verified -> {
                            acc.accept(ref, verified);
                            return (Void) null;
                        })
                        .recover(err -> {
                            logger.warn("Checkpoint {} rejected: {}", ref, err.getMessage());
                            acc.reject(ref);
                            return Future.succeededFuture();
                        }));
            }
            return chain.map(v -> {
                sequences.compute(jobId, (id, current) -> {
                    long next = acc.lastSequence + 1;
                    return current == null || current.get() < next ? new AtomicLong(next) : current;
                });
                ResumePoint point = acc.build();
                logger.info("Resume point for job {}: {} verified stage(s), {} rejected, latest {}",
                        jobId, point.completedStages().size(), point.rejected().size(), point.latestStageId());
                return point;
            });
        });
    }

    /**
     * Sequence the next checkpoint of a job will get.
     */
    public long peekSequence(String jobId) {
        AtomicLong counter = sequences.get(jobId);
        return counter == null ? 0 : counter.get();
    }

    private long nextSequence(String jobId) {
        return sequences.computeIfAbsent(jobId, id -> new AtomicLong()).getAndIncrement();
    }

    private Future<CheckpointRef> write(CheckpointRecord record) {
        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            logger.warn("Failed to serialize checkpoint for {}/{}: {}", record.jobId(), record.stageId(), e.getMessage());
            return Future.failedFuture(new ArtifactStoreException("Checkpoint serialization failed", e));
        }
        return store.checkpointWrite(record.jobId(), record.stageId(), record.sequence(), bytes)
                .onSuccess(ref -> logger.debug("Checkpoint {} written ({})", ref, record.kind()))
                .onFailure(err -> logger.warn("Checkpoint {}/{} #{} not written: {}", record.jobId(),
                        record.stageId(), record.sequence(), err.getMessage()));
    }

    private Future<VerifiedCheckpoint> verify(CheckpointRef ref) {
        return store.checkpointRead(ref).compose(bytes -> {
            CheckpointRecord record;
            try {
                record = mapper.readValue(bytes, CheckpointRecord.class);
            } catch (IOException e) {
                return Future.failedFuture(new ArtifactStoreException("Unreadable checkpoint record " + ref, e));
            }
            if (record.kind() != CheckpointKind.STAGE) {
                return Future.succeededFuture(new VerifiedCheckpoint(record, null));
            }
            ArtifactRef outputRef;
            try {
                outputRef = ArtifactRef.parse(record.outputRef());
            } catch (IllegalArgumentException e) {
                return Future.failedFuture(new ArtifactStoreException("Bad output reference in " + ref, e));
            }
            return store.retrieve(outputRef).compose(output -> {
                if (!checksums.verify(output, record.checksum())) {
                    return Future.failedFuture(new ChecksumMismatchException(outputRef.toUri(), record.checksum(),
                            checksums.checksum(output)));
                }
                JsonObject bundle;
                try {
                    bundle = Buffer.buffer(output).toJsonObject();
                } catch (DecodeException e) {
                    return Future.failedFuture(new ArtifactStoreException("Output bundle of " + ref + " is not JSON", e));
                }
                for (String declared : record.declaredOutputs()) {
                    if (!bundle.containsKey(declared)) {
                        return Future.failedFuture(new ArtifactStoreException(
                                "Output '" + declared + "' missing from " + outputRef.toUri()));
                    }
                }
                return Future.succeededFuture(new VerifiedCheckpoint(record, bundle));
            });
        });
    }

    private record VerifiedCheckpoint(CheckpointRecord record, JsonObject outputs) {
    }

    private static final class ResumeAccumulator {
        private final String jobId;
        private final Set<String> completed = new LinkedHashSet<>();
        private final Map<String, JsonObject> outputs = new LinkedHashMap<>();
        private final Map<String, Integer> attempts = new LinkedHashMap<>();
        private final Map<String, CheckpointRef> checkpoints = new LinkedHashMap<>();
        private final List<CheckpointRef> rejected = new ArrayList<>();
        private String latestStageId;
        private long lastSequence = -1;

        ResumeAccumulator(String jobId) {
            this.jobId = jobId;
        }

        void accept(CheckpointRef ref, VerifiedCheckpoint verified) {
            lastSequence = Math.max(lastSequence, ref.sequence());
            if (verified.outputs() == null) {
                return;
            }
            String stageId = verified.record().stageId();
            completed.remove(stageId);
            completed.add(stageId);
            outputs.put(stageId, verified.outputs());
            attempts.put(stageId, verified.record().attempt());
            checkpoints.put(stageId, ref);
            latestStageId = stageId;
        }

        void reject(CheckpointRef ref) {
            lastSequence = Math.max(lastSequence, ref.sequence());
            rejected.add(ref);
        }

        ResumePoint build() {
            return new ResumePoint(jobId, Collections.unmodifiableSet(completed), Collections.unmodifiableMap(outputs),
                    Collections.unmodifiableMap(attempts), Collections.unmodifiableMap(checkpoints), latestStageId,
                    lastSequence, List.copyOf(rejected));
        }
    }
}
