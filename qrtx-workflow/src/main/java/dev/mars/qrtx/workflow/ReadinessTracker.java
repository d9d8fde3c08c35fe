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
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Incremental readiness for one job's graph: a counter of unresolved dependencies per
 * stage, decremented as completions arrive. Each completion costs O(out-degree), so a wide
 * fan-out never degenerates into repeated full-graph scans.
 *
 * <p>A stage moves {@code waiting → ready → dispatched → completed}; a transient failure
 * returns it from dispatched to ready through {@link #requeue(String)}. Any other move is a
 * defect in the caller and raises {@link IllegalStateException}.</p>
 *
 * <p>Not thread-safe: owned by the single writer that advances the job.</p>
 */
public final class ReadinessTracker {

    private final WorkflowGraph graph;
    private final Map<String, Integer> unresolved = new HashMap<>();
    private final Set<String> ready = new LinkedHashSet<>();
    private final Set<String> dispatched = new HashSet<>();
    private final Set<String> completed = new HashSet<>();

    public ReadinessTracker(WorkflowGraph graph) {
        this(graph, Set.of());
    }

    /**
     * @param alreadyCompleted stages restored from a verified resume point
     */
    public ReadinessTracker(WorkflowGraph graph, Set<String> alreadyCompleted) {
        this.graph = graph;
        for (String id : alreadyCompleted) {
            if (!graph.contains(id)) {
                throw new IllegalArgumentException("Completed stage not in graph: " + id);
            }
            completed.add(id);
        }
        for (String id : graph.topologicalOrder()) {
            if (completed.contains(id)) {
                continue;
            }
            StageDefinition stage = graph.getStage(id);
            int count = 0;
            for (String dependency : new HashSet<>(stage.getDependsOn())) {
                if (!completed.contains(dependency)) {
                    count++;
                }
            }
            unresolved.put(id, count);
            if (count == 0) {
                ready.add(id);
            }
        }
    }

    public WorkflowGraph getGraph() {
        return graph;
    }

    /**
     * Stages that may be dispatched now, in topological order of discovery.
     */
    public Set<String> readyStages() {
        return Collections.unmodifiableSet(ready);
    }

    public boolean isReady(String stageId) {
        return ready.contains(stageId);
    }

    public boolean isDispatched(String stageId) {
        return dispatched.contains(stageId);
    }

    public boolean isCompleted(String stageId) {
        return completed.contains(stageId);
    }

    public Set<String> completedStages() {
        return Collections.unmodifiableSet(completed);
    }

    public Set<String> dispatchedStages() {
        return Collections.unmodifiableSet(dispatched);
    }

    public boolean allCompleted() {
        return completed.size() == graph.size();
    }

    public void markDispatched(String stageId) {
        if (!ready.remove(stageId)) {
            throw new IllegalStateException("Stage '" + stageId + "' is not ready"
                    + (dispatched.contains(stageId) ? " (already dispatched)" : "")
                    + (completed.contains(stageId) ? " (already completed)" : ""));
        }
        dispatched.add(stageId);
    }

    /**
     * Return a dispatched stage to the ready set for another attempt.
     */
    public void requeue(String stageId) {
        if (!dispatched.remove(stageId)) {
            throw new IllegalStateException("Stage '" + stageId + "' is not dispatched");
        }
        ready.add(stageId);
    }

    /**
     * Record a completion and return the stages it made ready.
     */
    public List<String> markCompleted(String stageId) {
        if (!dispatched.remove(stageId)) {
            throw new IllegalStateException("Stage '" + stageId + "' completed without being dispatched"
                    + (completed.contains(stageId) ? " (already completed)" : ""));
        }
        completed.add(stageId);
        unresolved.remove(stageId);

        List<String> newlyReady = new ArrayList<>();
        for (String dependent : graph.dependentsOf(stageId)) {
            Integer remaining = unresolved.get(dependent);
            if (remaining == null) {
                continue;
            }
            int next = remaining - 1;
            unresolved.put(dependent, next);
            if (next == 0) {
                ready.add(dependent);
                newlyReady.add(dependent);
            }
        }
        return newlyReady;
    }

    @Override
    public String toString() {
        return "ReadinessTracker{" +
                "ready=" + ready +
                ", dispatched=" + dispatched +
                ", completed=" + completed.size() + "/" + graph.size() +
                '}';
    }
}
