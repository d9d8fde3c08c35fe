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

package dev.mars.qrtx.runtime.checkpoint;

import dev.mars.qrtx.storage.CheckpointRef;
import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Verified state from which a job can continue.
 *
 * @param jobId           job
 * @param completedStages stages with a verified checkpoint, in checkpoint order
 * @param stageOutputs    output bundle of each completed stage
 * @param attempts        attempt number recorded for each completed stage
 * @param checkpoints     latest verified checkpoint of each completed stage
 * @param latestStageId   stage of the most recent verified checkpoint, null when none verified
 * @param lastSequence    highest checkpoint sequence seen, verified or not; -1 when there are none
 * @param rejected        checkpoints that failed verification
 */
public record ResumePoint(String jobId, Set<String> completedStages, Map<String, JsonObject> stageOutputs,
                          Map<String, Integer> attempts, Map<String, CheckpointRef> checkpoints,
                          String latestStageId, long lastSequence, List<CheckpointRef> rejected) {

    public boolean isEmpty() {
        return completedStages.isEmpty();
    }

    public Optional<String> latestStage() {
        return Optional.ofNullable(latestStageId);
    }
}
