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

import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * Ready stages of all jobs, highest job priority first, then lowest topological rank, then
 * job admission order, then stage declaration order.
 */
final class ReadyQueue {

    record Entry(String jobId, String stageId, int priority, int rank, long admissionOrder, int declarationIndex) {
    }

    private static final Comparator<Entry> ORDER = Comparator
            .comparingInt(Entry::priority).reversed()
            .thenComparingInt(Entry::rank)
            .thenComparingLong(Entry::admissionOrder)
            .thenComparingInt(Entry::declarationIndex);

    private final PriorityQueue<Entry> queue = new PriorityQueue<>(ORDER);

    void add(Job job, StageRun run) {
        queue.add(new Entry(job.jobId(), run.id(), job.priority().getValue(), job.graph().rankOf(run.id()),
                job.admissionOrder(), run.declarationIndex()));
    }

    Entry poll() {
        return queue.poll();
    }

    boolean isEmpty() {
        return queue.isEmpty();
    }

    int size() {
        return queue.size();
    }
}
