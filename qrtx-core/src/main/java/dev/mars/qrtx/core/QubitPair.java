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
 * An undirected coupling between two qubits, either logical (required by a circuit)
 * or physical (offered by a device coupling map).
 */
public record QubitPair(int a, int b) {

    public QubitPair {
        if (a < 0 || b < 0) {
            throw new IllegalArgumentException("Qubit indices must be non-negative: " + a + "-" + b);
        }
        if (a == b) {
            throw new IllegalArgumentException("A qubit cannot be coupled to itself: " + a);
        }
    }

    public boolean connects(int x, int y) {
        return (a == x && b == y) || (a == y && b == x);
    }

    @Override
    public String toString() {
        return a + "-" + b;
    }
}
