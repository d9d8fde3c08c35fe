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

import dev.mars.qrtx.core.StageDefinition;
import dev.mars.qrtx.core.StageKind;
import dev.mars.qrtx.storage.StorageNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.UUID;

/**
 * Validates a {@link WorkflowIr} and builds the immutable {@link WorkflowGraph}.
 *
 * <p>Rejects duplicate, reserved or malformed stage ids, dangling and self dependencies, cycles,
 * duplicate output names, inputs not produced by an ancestor, and stage kinds whose
 * work block is missing or belongs to another kind. All issues of a document are
 * collected before rejecting it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public final class WorkflowGraphBuilder {
    private static final Logger logger = LoggerFactory.getLogger(WorkflowGraphBuilder.class);

    private WorkflowGraphBuilder() {
    }

    public static WorkflowGraph build(WorkflowIr ir) throws WorkflowValidationException {
        return build(ir, null);
    }

    static WorkflowGraph build(WorkflowIr ir, String derivedFrom) throws WorkflowValidationException {
        ValidationResult result = new ValidationResult();
        Map<String, StageDefinition> stages = new LinkedHashMap<>();
        Map<String, String> producers = new HashMap<>();

        if (ir.name() == null || ir.name().isBlank()) {
            result.addError("metadata.name", "Workflow name is required");
        }
        if (ir.stages().isEmpty()) {
            result.addError("stages", "At least one stage is required");
        }

        for (StageDefinition stage : ir.stages()) {
            String path = "stages." + stage.getId();
            try {
                StorageNames.requireValidSegment(stage.getId(), "stage id");
            } catch (IllegalArgumentException e) {
                result.addError(path + ".id", e.getMessage());
            }
            if (StorageNames.JOB_SCOPE.equals(stage.getId())) {
                result.addError(path + ".id", "Stage id '" + StorageNames.JOB_SCOPE + "' is reserved for job-level artifacts");
            }
            if (stages.putIfAbsent(stage.getId(), stage) != null) {
                result.addError(path, "Duplicate stage id '" + stage.getId() + "'");
                continue;
            }
            for (String output : stage.getOutputs()) {
                String previous = producers.putIfAbsent(output, stage.getId());
                if (previous != null) {
                    result.addError(path + ".outputs", "Output '" + output + "' is already produced by stage '"
                            + previous + "'");
                }
            }
            validateWork(stage, path, result);
        }

        int edgeCount = 0;
        Map<String, List<String>> dependents = new HashMap<>();
        for (StageDefinition stage : stages.values()) {
            String path = "stages." + stage.getId() + ".dependsOn";
            Set<String> seen = new HashSet<>();
            for (String dependency : stage.getDependsOn()) {
                if (!seen.add(dependency)) {
                    result.addWarning(path, "Dependency '" + dependency + "' listed more than once");
                    continue;
                }
                if (dependency.equals(stage.getId())) {
                    result.addError(path, "Stage cannot depend on itself");
                } else if (!stages.containsKey(dependency)) {
                    result.addError(path, "Dependency '" + dependency + "' not found");
                } else {
                    dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(stage.getId());
                    edgeCount++;
                }
            }
        }

        List<String> order = result.isValid() ? topologicalSort(stages, dependents) : List.of();
        if (result.isValid() && order.size() != stages.size()) {
            List<String> remaining = new ArrayList<>(stages.keySet());
            remaining.removeAll(order);
            result.addError("stages", "Circular dependency detected among stages: " + remaining);
        }

        if (result.isValid()) {
            validateInputs(stages, order, producers, result);
        }

        if (!result.isValid()) {
            logger.debug("Workflow '{}' rejected with {} error(s)", ir.name(), result.getErrorCount());
            throw new WorkflowValidationException(ir.name(), result);
        }
        for (ValidationResult.ValidationIssue warning : result.getWarnings()) {
            logger.warn("Workflow '{}': {}", ir.name(), warning);
        }

        Map<String, Integer> ranks = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            ranks.put(order.get(i), i);
        }
        Map<String, List<String>> frozenDependents = new HashMap<>();
        dependents.forEach((k, v) -> frozenDependents.put(k, List.copyOf(v)));

        return new WorkflowGraph(UUID.randomUUID().toString(), derivedFrom, ir, stages, order, ranks,
                frozenDependents, producers, edgeCount);
    }

    /**
     * Collects every issue without building a graph.
     */
    public static ValidationResult validate(WorkflowIr ir) {
        try {
            build(ir);
            return new ValidationResult();
        } catch (WorkflowValidationException e) {
            return e.getValidationResult();
        }
    }

    private static void validateWork(StageDefinition stage, String path, ValidationResult result) {
        StageKind kind = stage.getKind();
        boolean compile = stage.getCompile() != null;
        boolean quantum = stage.getQuantum() != null;
        boolean classical = stage.getClassical() != null;

        switch (kind) {
            case COMPILE -> {
                if (!compile) {
                    result.addError(path + ".compile", "Compile stage requires a 'compile' block");
                } else {
                    if (isBlank(stage.getCompile().source())) {
                        result.addError(path + ".compile.source", "Circuit source is required");
                    }
                    if (isBlank(stage.getCompile().target())) {
                        result.addError(path + ".compile.target", "Compilation target is required");
                    }
                }
                if (stage.getOutputs().isEmpty()) {
                    result.addError(path + ".outputs", "Compile stage must declare the output holding the circuit");
                }
            }
            case QUANTUM -> {
                if (!quantum) {
                    result.addError(path + ".quantum", "Quantum stage requires a 'quantum' block");
                } else {
                    String circuitInput = stage.getQuantum().circuitInput();
                    boolean inline = stage.getQuantum().hasInlinePayload();
                    if (circuitInput == null && !inline) {
                        result.addError(path + ".quantum", "Either 'circuitInput' or 'payload' is required");
                    } else if (circuitInput != null && inline) {
                        result.addError(path + ".quantum", "'circuitInput' and 'payload' are mutually exclusive");
                    } else if (circuitInput != null && !stage.getInputs().contains(circuitInput)) {
                        result.addError(path + ".quantum.circuitInput",
                                "Circuit input '" + circuitInput + "' is not a declared input");
                    }
                }
                if (stage.getConstraints().qubitCount() <= 0) {
                    result.addError(path + ".constraints.qubits", "Quantum stage must declare its qubit count");
                }
            }
            case CLASSICAL -> {
                if (!classical || isBlank(stage.getClassical().function())) {
                    result.addError(path + ".classical.function", "Classical stage requires a function name");
                }
            }
        }
        if ((compile && kind != StageKind.COMPILE) || (quantum && kind != StageKind.QUANTUM)
                || (classical && kind != StageKind.CLASSICAL)) {
            result.addError(path + ".kind", "Stage of kind " + kind + " carries a work block of another kind");
        }
    }

    /**
     * Kahn's algorithm. Ties are broken by declaration order so the result is deterministic.
     */
    private static List<String> topologicalSort(Map<String, StageDefinition> stages,
                                                Map<String, List<String>> dependents) {
        Map<String, Integer> inDegree = new HashMap<>();
        for (StageDefinition stage : stages.values()) {
            inDegree.put(stage.getId(), (int) stage.getDependsOn().stream().distinct().count());
        }
        Queue<String> queue = new ArrayDeque<>();
        for (String id : stages.keySet()) {
            if (inDegree.get(id) == 0) {
                queue.offer(id);
            }
        }
        List<String> order = new ArrayList<>();
        while (!queue.isEmpty()) {
            String current = queue.poll();
            order.add(current);
            for (String dependent : dependents.getOrDefault(current, List.of())) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    queue.offer(dependent);
                }
            }
        }
        return order;
    }

    /**
     * Every declared input must be produced by a transitive dependency. Ancestor sets are
     * accumulated along the topological order.
     */
    private static void validateInputs(Map<String, StageDefinition> stages, List<String> order,
                                       Map<String, String> producers, ValidationResult result) {
        Map<String, Set<String>> ancestors = new HashMap<>();
        for (String id : order) {
            StageDefinition stage = stages.get(id);
            Set<String> own = new HashSet<>();
            for (String dependency : stage.getDependsOn()) {
                own.add(dependency);
                own.addAll(ancestors.get(dependency));
            }
            ancestors.put(id, own);

            for (String input : stage.getInputs()) {
                String producer = producers.get(input);
                if (producer == null) {
                    result.addError("stages." + id + ".inputs", "Input '" + input + "' is not produced by any stage");
                } else if (!own.contains(producer)) {
                    result.addError("stages." + id + ".inputs", "Input '" + input + "' is produced by stage '"
                            + producer + "', which is not an ancestor");
                }
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
