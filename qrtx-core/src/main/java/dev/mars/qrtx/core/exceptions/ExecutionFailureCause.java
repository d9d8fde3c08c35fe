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

package dev.mars.qrtx.core.exceptions;

/**
 * Canonical causes reported by the backend-execution collaborator.
 */
public enum ExecutionFailureCause {

    UNSUPPORTED_FORMAT(false),
    RESOURCE_UNAVAILABLE(true),
    RESOURCE_BUSY(true),
    DEADLINE_EXCEEDED(true);

    private final boolean transientFailure;

    ExecutionFailureCause(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /**
     * Whether a retry of the same request can succeed.
     */
    public boolean isTransient() {
        return transientFailure;
    }
}
