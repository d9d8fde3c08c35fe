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

import io.vertx.core.json.JsonObject;

import java.util.Objects;

/**
 * Output of the compiler collaborator.
 *
 * @param payload  compiled circuit, opaque to the orchestrator
 * @param format   payload format, matched against resource format support
 * @param metadata compiler metadata (gate counts, depth, target), may be empty
 */
public record CompilationResult(String payload, String format, JsonObject metadata) {

    public CompilationResult {
        Objects.requireNonNull(payload, "payload");
        metadata = metadata != null ? metadata : new JsonObject();
    }

    public JsonObject toJson() {
        return new JsonObject()
                .put("payload", payload)
                .put("format", format)
                .put("metadata", metadata.copy());
    }
}
