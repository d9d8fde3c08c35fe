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

import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.Map;

/**
 * Final outputs of a {@code DONE} job.
 *
 * @param jobId       job
 * @param name        job name
 * @param completedAt when the job reached {@code DONE}
 * @param outputs     every named stage output
 * @param counts      measurement counts of each quantum stage, keyed by stage id
 */
public record JobResults(String jobId, String name, Instant completedAt, JsonObject outputs,
                         Map<String, Map<String, Long>> counts) {
}
