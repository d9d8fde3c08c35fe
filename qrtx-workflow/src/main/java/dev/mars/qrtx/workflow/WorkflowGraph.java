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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Validated, immutable DAG of stages. Instances are only created by
 * {@link WorkflowGraphBuilder}, so holding a {@code WorkflowGraph} means the graph is
 * acyclic, every dependency exists, ids are unique and every declared input is produced
 * by an ancestor.
 *
 * <p>Re-planning never mutates a graph: {@link #derive(UnaryOperator)} validates and returns
 * a new graph that records the id of the one it was derived from.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public final class WorkflowGraph {

    private final String graphId;
    private final String derivedFrom;
    private final WorkflowIr ir;
    private final Map<String, StageDefinition> stages;
    private final List<String> topologicalOrder;
    private final Map<String, Integer> ranks;
    private final Map<String, List<String>> dependents;
    private final Map<String, String> producers;
    private final int edgeCount;

    WorkflowGraph(String graphId, String derivedFrom, WorkflowIr ir,
                  Map<String, StageDefinition> stages, List<String> topologicalOrder,
                  Map<String, Integer> ranks, Map<String, List<String>> dependents,
                  Map<String, String> producers, int edgeCount) {
        this.graphId = graphId;
        this.derivedFrom = derivedFrom;
        this.ir = ir;
        this.stages = Collections.unmodifiableMap(stages);
        this.topologicalOrder = List.copyOf(topologicalOrder);
        this.ranks = Map.copyOf(ranks);
        this.dependents = Collections.unmodifiableMap(dependents);
        this.producers = Map.copyOf(producers);
        this.edgeCount = edgeCount;
    }

    public String getGraphId() {
        return graphId;
    }

    /**
     * @return id of the graph this one was derived from, empty for graphs built from an IR
     */
    public Optional<String> getDerivedFrom() {
        return Optional.ofNullable(derivedFrom);
    }

    public String getName() {
        return ir.name();
    }

    /**
     * The IR this graph was validated from, for persistence and recovery.
     */
    public WorkflowIr toIr() {
        return ir;
    }

    public int size() {
        return stages.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public boolean contains(String stageId) {
        return stages.containsKey(stageId);
    }

    public StageDefinition getStage(String stageId) {
        StageDefinition stage = stages.get(stageId);
        if (stage == null) {
            throw new IllegalArgumentException("Unknown stage: " + stageId);
        }
        return stage;
    }

    /**
     * Stages in declaration order.
     */
    public Collection<StageDefinition> getStages() {
        return stages.values();
    }

    public List<String> getStageIds() {
        return List.copyOf(stages.keySet());
    }

    public List<String> topologicalOrder() {
        return topologicalOrder;
    }

    /**
     * Position of the stage in the topological order. Lower ranks run earlier.
     */
    public int rankOf(String stageId) {
        Integer rank = ranks.get(stageId);
        if (rank == null) {
            throw new IllegalArgumentException("Unknown stage: " + stageId);
        }
        return rank;
    }

    public List<String> dependenciesOf(String stageId) {
        return getStage(stageId).getDependsOn();
    }

    public List<String> dependentsOf(String stageId) {
        getStage(stageId);
        return dependents.getOrDefault(stageId, List.of());
    }

    /**
     * Stage that declares the given output name.
     */
    public Optional<String> producerOf(String outputName) {
        return Optional.ofNullable(producers.get(outputName));
    }

    /**
     * Stages whose dependencies are all in {@code completed} and which are neither completed
     * nor in {@code dispatched}. Runs in O(stages + edges); the pipeline driver uses
     * {@link ReadinessTracker} to maintain the same answer incrementally.
     */
    public Set<String> readyStages(Set<String> completed, Set<String> dispatched) {
        Set<String> ready = new HashSet<>();
        for (StageDefinition stage : stages.values()) {
            String id = stage.getId();
            if (completed.contains(id) || dispatched.contains(id)) {
                continue;
            }
            if (completed.containsAll(stage.getDependsOn())) {
                ready.add(id);
            }
        }
        return ready;
    }

    /**
     * Validate an edited copy of this graph's stages as a new graph.
     *
     * @param edit receives a mutable copy of the stage list, returns the new list
     * @return the derived graph, with {@link #getDerivedFrom()} set to this graph's id
     * @throws WorkflowValidationException if the edited stages do not form a valid graph
     */
    public WorkflowGraph derive(UnaryOperator<List<StageDefinition>> edit) throws WorkflowValidationException {
        List<StageDefinition> edited = edit.apply(new ArrayList<>(stages.values()));
        return WorkflowGraphBuilder.build(ir.withStages(edited), graphId);
    }

    @Override
    public String toString() {
        return "WorkflowGraph{" +
                "graphId='" + graphId + '\'' +
                ", name='" + getName() + '\'' +
                ", stages=" + stages.keySet() +
                '}';
    }
}
