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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Durable content of one checkpoint, serialized as JSON by the storage collaborator.
 *
 * @param jobId           owning job
 * @param stageId         stage the checkpoint belongs to
 * @param attempt         attempt number of the stage run that produced it
 * @param sequence        per-job monotonic sequence
 * @param kind            stage completion or periodic progress
 * @param createdAt       write time
 * @param outputRef       artifact holding the stage output bundle, null for progress records
 * @param checksum        hex digest of the output artifact bytes, null for progress records
 * @param algorithm       digest algorithm
 * @param declaredOutputs outputs the stage declares; all must be present in the bundle on resume
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CheckpointRecord(String jobId, String stageId, int attempt, long sequence, CheckpointKind kind,
                               Instant createdAt, String outputRef, String checksum, String algorithm,
                               List<String> declaredOutputs) {

    public CheckpointRecord {
        declaredOutputs = declaredOutputs != null ? List.copyOf(declaredOutputs) : List.of();
    }
}
