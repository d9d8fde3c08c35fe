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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Work description of a {@link StageKind#QUANTUM} stage. Exactly one of
 * {@code circuitInput} (the name of an upstream output holding a compiled payload)
 * or {@code payload} (an inline compiled payload) is set.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QuantumSpec(String circuitInput, String payload, int shots, Map<String, Object> options) {

    public QuantumSpec {
        if (shots <= 0) {
            throw new IllegalArgumentException("shots must be positive (current: " + shots + ")");
        }
        options = options == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public boolean hasInlinePayload() {
        return payload != null;
    }
}
