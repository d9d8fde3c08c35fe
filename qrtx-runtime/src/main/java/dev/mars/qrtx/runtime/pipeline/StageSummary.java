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

import dev.mars.qrtx.core.StageKind;
import dev.mars.qrtx.core.StageState;

/**
 * Externally visible view of one stage.
 *
 * @param stageId       stage id
 * @param kind          stage kind
 * @param state         current stage state
 * @param attempts      dispatches made so far
 * @param resourceId    resource of the latest quantum attempt, null otherwise
 * @param outputRef     persisted output bundle, null until completed
 * @param checkpointRef latest stage checkpoint, null when none was written
 * @param lastError     summary of the latest failure, null when none
 */
public record StageSummary(String stageId, StageKind kind, StageState state, int attempts, String resourceId,
                           String outputRef, String checkpointRef, String lastError) {
}
