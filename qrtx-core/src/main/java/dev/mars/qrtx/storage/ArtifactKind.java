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
 * Kinds of artifacts the orchestrator persists through the storage collaborator.
 */
public enum ArtifactKind {

    COMPILED_PAYLOAD("compiled"),
    STAGE_OUTPUT("output"),
    ERROR_DETAILS("error"),
    JOB_RECORD("record"),
    WORKFLOW_GRAPH("graph");

    private final String fileStem;

    ArtifactKind(String fileStem) {
        this.fileStem = fileStem;
    }

    public String getFileStem() {
        return fileStem;
    }

    public static ArtifactKind fromFileStem(String stem) {
        for (ArtifactKind kind : values()) {
            if (kind.fileStem.equals(stem)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown artifact kind: " + stem);
    }
}
