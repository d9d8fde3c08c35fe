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

package dev.mars.qrtx.workflow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.mars.qrtx.core.StageDefinition;

import java.util.List;
import java.util.Map;

/**
 * Portable intermediate representation of a hybrid program, as handed over by the
 * language front-end or read from a workflow document. Not validated: the graph
 * builder turns it into a {@link WorkflowGraph} or rejects it.
 *
 * @param name    workflow name
 * @param version document version, informational
 * @param labels  free-form labels
 * @param stages  stage definitions in declaration order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowIr(String name, String version, Map<String, String> labels, List<StageDefinition> stages) {

    public WorkflowIr {
        labels = labels != null ? Map.copyOf(labels) : Map.of();
        stages = stages != null ? List.copyOf(stages) : List.of();
    }

    public WorkflowIr(String name, List<StageDefinition> stages) {
        this(name, "1.0", Map.of(), stages);
    }

    public WorkflowIr withStages(List<StageDefinition> newStages) {
        return new WorkflowIr(name, version, labels, newStages);
    }
}
