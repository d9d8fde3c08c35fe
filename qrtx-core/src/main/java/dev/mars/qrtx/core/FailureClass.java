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
 * How the pipeline driver treats a stage dispatch failure.
 */
public enum FailureClass {

    /** Retried per the stage retry policy. */
    TRANSIENT,

    /** Malformed payload, unsupported target, rejected source: fails the stage immediately. */
    PERMANENT,

    /** No resource can ever satisfy the stage: fails the stage immediately. */
    UNSATISFIABLE,

    /** Orchestrator defect. The job is failed with {@link CauseCode#INTERNAL_ERROR}. */
    INTERNAL
}
