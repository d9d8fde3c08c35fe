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

import dev.mars.qrtx.core.ClassicalSpec;
import dev.mars.qrtx.core.JobPriority;
import dev.mars.qrtx.core.StageDefinition;
import dev.mars.qrtx.core.StageKind;
import dev.mars.qrtx.runtime.lifecycle.JobStateMachine;
import dev.mars.qrtx.workflow.ReadinessTracker;
import dev.mars.qrtx.workflow.WorkflowGraph;
import dev.mars.qrtx.workflow.WorkflowGraphBuilder;
import dev.mars.qrtx.workflow.WorkflowIr;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ReadyQueue")
class ReadyQueueTest {

    private static StageDefinition stage(String id, String... dependsOn) {
        return StageDefinition.builder(id, StageKind.CLASSICAL)
                .dependsOn(List.of(dependsOn))
                .classical(new ClassicalSpec("noop", null))
                .build();
    }

    private static Job job(String id, JobPriority priority, long admission) throws Exception {
        WorkflowGraph graph = WorkflowGraphBuilder.build(new WorkflowIr("wf",
                List.of(stage("root"), stage("left", "root"), stage("right", "root"))));
        return new Job(id, id, priority, graph, new JobStateMachine(id, Clock.systemUTC()),
                new ReadinessTracker(graph), admission, Instant.now(), 0);
    }

    private static List<String> drain(ReadyQueue queue) {
        List<String> order = new ArrayList<>();
        while (!queue.isEmpty()) {
            ReadyQueue.Entry entry = queue.poll();
            order.add(entry.jobId() + "/" + entry.stageId());
        }
        return order;
    }

    @Test
    @DisplayName("Orders by job priority, then rank, then admission, then declaration")
    void ordering() throws Exception {
        Job early = job("early", JobPriority.NORMAL, 0);
        Job late = job("late", JobPriority.NORMAL, 1);
        Job urgent = job("urgent", JobPriority.CRITICAL, 2);
        ReadyQueue queue = new ReadyQueue();

        queue.add(late, late.run("right"));
        queue.add(early, early.run("right"));
        queue.add(early, early.run("left"));
        queue.add(late, late.run("root"));
        queue.add(urgent, urgent.run("left"));

        assertThat(queue.size()).isEqualTo(5);
        assertThat(drain(queue)).containsExactly(
                "urgent/left", "late/root", "early/left", "early/right", "late/right");
    }
}
