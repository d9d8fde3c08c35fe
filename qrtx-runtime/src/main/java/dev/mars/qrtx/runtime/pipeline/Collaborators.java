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

import dev.mars.qrtx.backend.BackendExecutor;
import dev.mars.qrtx.backend.CircuitCompiler;
import dev.mars.qrtx.backend.ClassicalEvaluator;
import dev.mars.qrtx.storage.ArtifactStore;

import java.util.Objects;

/**
 * External collaborators the pipeline dispatches to.
 */
public record Collaborators(CircuitCompiler compiler, BackendExecutor backend, ClassicalEvaluator evaluator,
                            ArtifactStore store) {

    public Collaborators {
        Objects.requireNonNull(compiler, "compiler");
        Objects.requireNonNull(backend, "backend");
        Objects.requireNonNull(evaluator, "evaluator");
        Objects.requireNonNull(store, "store");
    }
}
