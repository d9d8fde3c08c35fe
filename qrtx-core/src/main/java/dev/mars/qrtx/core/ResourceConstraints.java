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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Hard placement constraints and the duration estimate of a quantum stage.
 *
 * @param qubitCount          logical qubits the circuit uses
 * @param connectivity        logical couplings that must map onto physical couplings, may be empty
 * @param minFidelity         lowest acceptable device fidelity, 0 for no bound
 * @param payloadFormat       format the target must accept, null for any
 * @param estimatedDurationMs expected execution time, used for the lease window
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResourceConstraints(int qubitCount, List<QubitPair> connectivity, double minFidelity,
                                  String payloadFormat, long estimatedDurationMs) {

    public static final ResourceConstraints NONE = new ResourceConstraints(0, List.of(), 0.0, null, 0);

    public ResourceConstraints {
        if (qubitCount < 0) {
            throw new IllegalArgumentException("qubitCount must be >= 0 (current: " + qubitCount + ")");
        }
        if (minFidelity < 0.0 || minFidelity > 1.0) {
            throw new IllegalArgumentException("minFidelity must be between 0.0 and 1.0 (current: " + minFidelity + ")");
        }
        if (estimatedDurationMs < 0) {
            throw new IllegalArgumentException("estimatedDurationMs must be >= 0");
        }
        connectivity = connectivity == null ? List.of() : List.copyOf(connectivity);
        for (QubitPair pair : connectivity) {
            if (pair.a() >= qubitCount || pair.b() >= qubitCount) {
                throw new IllegalArgumentException("Coupling " + pair + " references a qubit outside 0.." + (qubitCount - 1));
            }
        }
    }
}
