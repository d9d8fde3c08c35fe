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

/**
 * Opaque reference to a stored artifact. Writing the same (job, stage, kind) again
 * replaces the previous content.
 */
public record ArtifactRef(String jobId, String stageId, ArtifactKind kind) {

    private static final String SCHEME = "qfs://";

    public ArtifactRef {
        StorageNames.requireValidSegment(jobId, "job id");
        StorageNames.requireValidSegment(stageId, "stage id");
        if (kind == null) {
            throw new IllegalArgumentException("Artifact kind cannot be null");
        }
    }

    public String toUri() {
        return SCHEME + jobId + "/" + stageId + "/" + kind.getFileStem();
    }

    public static ArtifactRef parse(String uri) {
        if (uri == null || !uri.startsWith(SCHEME)) {
            throw new IllegalArgumentException("Not an artifact reference: " + uri);
        }
        String[] parts = uri.substring(SCHEME.length()).split("/");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Malformed artifact reference: " + uri);
        }
        return new ArtifactRef(parts[0], parts[1], ArtifactKind.fromFileStem(parts[2]));
    }

    @Override
    public String toString() {
        return toUri();
    }
}
