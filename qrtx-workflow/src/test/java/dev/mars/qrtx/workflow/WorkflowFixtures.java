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

import dev.mars.qrtx.core.ClassicalSpec;
import dev.mars.qrtx.core.CompileSpec;
import dev.mars.qrtx.core.QuantumSpec;
import dev.mars.qrtx.core.ResourceConstraints;
import dev.mars.qrtx.core.StageDefinition;
import dev.mars.qrtx.core.StageKind;

import java.util.List;
import java.util.Map;

/**
 * Stage definitions shared by the workflow tests.
 */
final class WorkflowFixtures {

    private WorkflowFixtures() {
    }

    static StageDefinition compile(String id, String output) {
        return StageDefinition.builder(id, StageKind.COMPILE)
                .outputs(List.of(output))
                .compile(new CompileSpec("OPENQASM 3; qubit[2] q;", "openqasm3", "generic", Map.of()))
                .build();
    }

    static StageDefinition quantum(String id, List<String> dependsOn, String circuitInput, String output) {
        return StageDefinition.builder(id, StageKind.QUANTUM)
                .dependsOn(dependsOn)
                .inputs(List.of(circuitInput))
                .outputs(List.of(output))
                .constraints(new ResourceConstraints(2, List.of(), 0.0, null, 100))
                .quantum(new QuantumSpec(circuitInput, null, 100, Map.of()))
                .build();
    }

    static StageDefinition classical(String id, List<String> dependsOn, List<String> inputs, List<String> outputs) {
        return StageDefinition.builder(id, StageKind.CLASSICAL)
                .dependsOn(dependsOn)
                .inputs(inputs)
                .outputs(outputs)
                .classical(new ClassicalSpec("fn", Map.of()))
                .build();
    }

    static StageDefinition node(String id, String... dependsOn) {
        return classical(id, List.of(dependsOn), List.of(), List.of(id + "-out"));
    }

    static WorkflowIr linear() {
        return new WorkflowIr("linear", List.of(
                compile("compile", "circuit"),
                quantum("execute", List.of("compile"), "circuit", "counts"),
                classical("reduce", List.of("execute"), List.of("counts"), List.of("energy"))));
    }
}
