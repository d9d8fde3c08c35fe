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

import dev.mars.qrtx.resource.ResourceDescriptor;

import java.util.Map;

/**
 * One circuit execution handed to the backend-execution collaborator.
 *
 * @param executionId  unique per dispatch attempt, used for cancellation
 * @param payload      compiled circuit
 * @param format       payload format, may be null
 * @param resource     allocated resource
 * @param shots        number of shots
 * @param options      backend options from the stage definition
 * @param qubitMapping logical qubit index to physical qubit index
 */
public record ExecutionRequest(String executionId, String payload, String format, ResourceDescriptor resource,
                               int shots, Map<String, Object> options, Map<Integer, Integer> qubitMapping) {

    public ExecutionRequest {
        options = options != null ? options : Map.of();
        qubitMapping = qubitMapping != null ? Map.copyOf(qubitMapping) : Map.of();
    }
}
