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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.mars.qrtx.core.StageDefinition;
import dev.mars.qrtx.workflow.WorkflowIr;

import java.util.List;
import java.util.Map;

/**
 * Stored form of the validated workflow a job was admitted with.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record WorkflowSnapshot(String name, String version, Map<String, String> labels, List<StageDefinition> stages) {

    static WorkflowSnapshot of(WorkflowIr ir) {
        return new WorkflowSnapshot(ir.name(), ir.version(), ir.labels(), ir.stages());
    }

    WorkflowIr toIr() {
        return new WorkflowIr(name, version, labels, stages);
    }
}
