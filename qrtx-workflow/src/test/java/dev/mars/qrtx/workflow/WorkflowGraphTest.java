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
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static dev.mars.qrtx.workflow.WorkflowFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class WorkflowGraphTest {

    @Test
    void testDeriveReturnsNewValidatedGraph() throws Exception {
        WorkflowGraph original = WorkflowGraphBuilder.build(linear());

        WorkflowGraph derived = original.derive(stages -> {
            stages.add(classical("report", List.of("reduce"), List.of("energy"), List.of("report")));
            return stages;
        });

        assertEquals(3, original.size());
        assertEquals(4, derived.size());
        assertEquals(original.getGraphId(), derived.getDerivedFrom().orElseThrow());
        assertNotEquals(original.getGraphId(), derived.getGraphId());
        assertFalse(original.contains("report"));
    }

    @Test
    void testDeriveRejectsInvalidEdit() throws Exception {
        WorkflowGraph original = WorkflowGraphBuilder.build(linear());

        assertThrows(WorkflowValidationException.class, () -> original.derive(stages -> {
            stages.removeIf(s -> s.getId().equals("execute"));
            return stages;
        }));
        assertTrue(original.contains("execute"));
    }

    @Test
    void testStagesAreUnmodifiable() throws Exception {
        WorkflowGraph graph = WorkflowGraphBuilder.build(linear());

        assertThrows(UnsupportedOperationException.class,
                () -> graph.getStages().add(node("x")));
        assertThrows(UnsupportedOperationException.class,
                () -> graph.topologicalOrder().add("x"));
    }

    @Test
    void testReadyStagesFullScan() throws Exception {
        WorkflowGraph graph = WorkflowGraphBuilder.build(linear());

        assertEquals(Set.of("compile"), graph.readyStages(Set.of(), Set.of()));
        assertEquals(Set.of(), graph.readyStages(Set.of(), Set.of("compile")));
        assertEquals(Set.of("execute"), graph.readyStages(Set.of("compile"), Set.of()));
    }

    @Test
    void testIrIsRetainedForPersistence() throws Exception {
        WorkflowIr ir = linear();
        WorkflowGraph graph = WorkflowGraphBuilder.build(ir);

        assertSame(ir, graph.toIr());
        StageDefinition execute = graph.getStage("execute");
        assertEquals(List.of("compile"), execute.getDependsOn());
        assertThrows(IllegalArgumentException.class, () -> graph.getStage("missing"));
    }
}
