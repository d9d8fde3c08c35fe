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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.qrtx.core.exceptions.ArtifactStoreException;
import dev.mars.qrtx.storage.ArtifactKind;
import dev.mars.qrtx.storage.ArtifactRef;
import dev.mars.qrtx.storage.ArtifactStore;
import dev.mars.qrtx.storage.StorageNames;
import dev.mars.qrtx.workflow.WorkflowIr;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Job-scoped artifacts: the workflow snapshot, the job record and error details.
 *
 * <p>Job record writes of one job are applied in submission order, so the stored record is
 * always the latest one handed in. A job's entry in the write queue is dropped once its last
 * queued write completes.</p>
 */
public class JobRepository {
    private static final Logger logger = LoggerFactory.getLogger(JobRepository.class);

    private final ArtifactStore store;
    private final ObjectMapper mapper;
    private final Map<String, Future<Void>> pendingWrites = new ConcurrentHashMap<>();

    public JobRepository(ArtifactStore store, ObjectMapper mapper) {
        this.store = store;
        this.mapper = mapper;
    }

    public Future<ArtifactRef> saveWorkflow(String jobId, WorkflowIr ir) {
        return write(jobId, StorageNames.JOB_SCOPE, ArtifactKind.WORKFLOW_GRAPH, WorkflowSnapshot.of(ir));
    }

    public Future<WorkflowIr> loadWorkflow(String jobId) {
        return read(new ArtifactRef(jobId, StorageNames.JOB_SCOPE, ArtifactKind.WORKFLOW_GRAPH), WorkflowSnapshot.class)
                .map(WorkflowSnapshot::toIr);
    }

    /**
     * Queue a record write behind any earlier write for the same job. Failures are logged and
     * do not fail the returned future.
     */
    public Future<Void> saveRecord(JobRecord record) {
        String jobId = record.jobId();
        Future<Void> queued = pendingWrites.compute(jobId, (id, previous) -> {
            Future<Void> base = previous != null ? previous : Future.succeededFuture();
            return base.transform(ignored -> write(id, StorageNames.JOB_SCOPE, ArtifactKind.JOB_RECORD, record)
                    .<Void>mapEmpty()
                    .recover(err -> {
                        logger.warn("Job record for {} not persisted: {}", id, err.getMessage());
                        return Future.succeededFuture();
                    }));
        });
        queued.onComplete(ar -> pendingWrites.remove(jobId, queued));
        return queued;
    }

    public Future<JobRecord> loadRecord(String jobId) {
        return read(new ArtifactRef(jobId, StorageNames.JOB_SCOPE, ArtifactKind.JOB_RECORD), JobRecord.class);
    }

    public Future<ArtifactRef> saveErrorDetails(String jobId, String stageId, JsonObject details) {
        String scope = stageId != null ? stageId : StorageNames.JOB_SCOPE;
        return store.persist(jobId, scope, ArtifactKind.ERROR_DETAILS, details.toBuffer().getBytes());
    }

    public Future<JsonObject> loadErrorDetails(ArtifactRef ref) {
        return store.retrieve(ref).map(bytes -> new JsonObject(new String(bytes, StandardCharsets.UTF_8)));
    }

    /**
     * Completes once every record write of {@code jobId} queued so far has been applied.
     */
    public Future<Void> flush(String jobId) {
        Future<Void> pending = pendingWrites.get(jobId);
        return pending != null ? pending : Future.succeededFuture();
    }

    int pendingJobCount() {
        return pendingWrites.size();
    }

    /**
     * Completes once every record write queued so far has been applied.
     */
    public Future<Void> flush() {
        List<Future<Void>> writes = new ArrayList<>(pendingWrites.values());
        return Future.all(writes).mapEmpty();
    }

    private Future<ArtifactRef> write(String jobId, String scope, ArtifactKind kind, Object value) {
        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            return Future.failedFuture(new ArtifactStoreException("Cannot serialize " + kind + " of job " + jobId, e));
        }
        return store.persist(jobId, scope, kind, bytes);
    }

    private <T> Future<T> read(ArtifactRef ref, Class<T> type) {
        return store.retrieve(ref).compose(bytes -> {
            try {
                return Future.succeededFuture(mapper.readValue(bytes, type));
            } catch (IOException e) {
                return Future.failedFuture(new ArtifactStoreException("Unreadable artifact " + ref, e));
            }
        });
    }
}
