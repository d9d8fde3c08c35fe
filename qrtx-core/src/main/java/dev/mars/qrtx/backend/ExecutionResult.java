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

import java.util.Map;
import java.util.TreeMap;

/**
 * Measurement counts and backend metadata returned for one execution.
 */
public record ExecutionResult(Map<String, Long> counts, JsonObject metadata) {

    public ExecutionResult {
        counts = counts != null ? new TreeMap<>(counts) : new TreeMap<>();
        metadata = metadata != null ? metadata : new JsonObject();
    }

    public long totalShots() {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }

    public JsonObject countsAsJson() {
        JsonObject json = new JsonObject();
        counts.forEach(json::put);
        return json;
    }
}
