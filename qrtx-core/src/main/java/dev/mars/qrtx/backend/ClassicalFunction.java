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

/**
 * Pure function run in-process by a classical stage.
 */
@FunctionalInterface
public interface ClassicalFunction {

    /**
     * @param inputs     stage inputs keyed by input name
     * @param parameters static parameters from the stage definition
     * @return outputs keyed by output name
     */
    JsonObject apply(JsonObject inputs, Map<String, Object> parameters) throws Exception;
}
