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

package dev.mars.qrtx.core;

/**
 * Closed set of stage kinds a workflow graph may contain.
 *
 * <p>Dispatch to an executor is an exhaustive {@code switch} over this enum, so adding
 * a kind is a change the compiler checks at the dispatch site.</p>
 */
public enum StageKind {

    /** Turns circuit source into a backend payload through the compiler collaborator. */
    COMPILE(false, true),

    /** Runs a compiled circuit on an allocated quantum resource. */
    QUANTUM(true, true),

    /** Pure in-process computation over prior stage outputs. */
    CLASSICAL(false, false);

    private final boolean requiresResource;
    private final boolean checkpointableByDefault;

    StageKind(boolean requiresResource, boolean checkpointableByDefault) {
        this.requiresResource = requiresResource;
        this.checkpointableByDefault = checkpointableByDefault;
    }

    /**
     * Whether stages of this kind take a resource allocation before dispatch.
     */
    public boolean requiresResource() {
        return requiresResource;
    }

    public boolean isCheckpointableByDefault() {
        return checkpointableByDefault;
    }

    /**
     * Case-insensitive lookup used by the IR parsers.
     *
     * @throws IllegalArgumentException if the value names no kind
     */
    public static StageKind fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Stage kind cannot be null");
        }
        for (StageKind kind : values()) {
            if (kind.name().equalsIgnoreCase(value.trim())) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported stage kind: " + value);
    }
}
