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

package dev.mars.qrtx.backend;

import io.vertx.core.Future;

/**
 * Backend-execution collaborator: runs a compiled circuit on a specific resource.
 *
 * <p>Failures are reported as {@link dev.mars.qrtx.core.exceptions.BackendExecutionException}
 * carrying one of the canonical {@link dev.mars.qrtx.core.exceptions.ExecutionFailureCause}s.</p>
 */
public interface BackendExecutor {

    Future<ExecutionResult> execute(ExecutionRequest request);

    /**
     * Best-effort request to stop an execution. The returned future of the matching
     * {@link #execute} call still completes, either normally or with a failure.
     */
    default void cancel(String executionId) {
    }
}
