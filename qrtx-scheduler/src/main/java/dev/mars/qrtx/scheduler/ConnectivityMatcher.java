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

package dev.mars.qrtx.scheduler;

import dev.mars.qrtx.core.QubitPair;
import dev.mars.qrtx.core.ResourceConstraints;
import dev.mars.qrtx.resource.ResourceDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Finds an injective placement of a circuit's logical qubits onto a resource's physical
 * qubits such that every required logical coupling lands on a physical coupling.
 *
 * <p>Backtracking search. Logical qubits are visited breadth-first from the most connected
 * one, so each new qubit after the first is constrained by a placed neighbour. The search
 * gives up after {@value #DEFAULT_STEP_LIMIT} steps and reports no placement.</p>
 */
public class ConnectivityMatcher {
    private static final Logger logger = LoggerFactory.getLogger(ConnectivityMatcher.class);

    static final int DEFAULT_STEP_LIMIT = 200_000;

    private final int stepLimit;

    public ConnectivityMatcher() {
        this(DEFAULT_STEP_LIMIT);
    }

    ConnectivityMatcher(int stepLimit) {
        this.stepLimit = stepLimit;
    }

    /**
     * @return logical to physical qubit mapping, or empty when the resource cannot host the circuit
     */
    public Optional<Map<Integer, Integer>> findMapping(ResourceConstraints constraints, ResourceDescriptor resource) {
        int logicalCount = constraints.qubitCount();
        if (logicalCount > resource.getQubitCount()) {
            return Optional.empty();
        }
        if (constraints.connectivity().isEmpty() || resource.isFullyConnected()) {
            Map<Integer, Integer> identity = new LinkedHashMap<>();
            for (int q = 0; q < logicalCount; q++) {
                identity.put(q, q);
            }
            return Optional.of(identity);
        }

        List<TreeSet<Integer>> logical = adjacency(logicalCount, constraints.connectivity());
        List<TreeSet<Integer>> physical = adjacency(resource.getQubitCount(), resource.getCouplingMap());
        Search search = new Search(logical, physical, visitOrder(logical));
        if (search.place(0)) {
            Map<Integer, Integer> mapping = new LinkedHashMap<>();
            for (int q = 0; q < logicalCount; q++) {
                mapping.put(q, search.assignment[q]);
            }
            return Optional.of(mapping);
        }
        if (search.steps >= stepLimit) {
            logger.debug("Connectivity search on {} stopped after {} steps", resource.getId(), search.steps);
        }
        return Optional.empty();
    }

    private static List<TreeSet<Integer>> adjacency(int size, List<QubitPair> couplings) {
        List<TreeSet<Integer>> adjacency = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            adjacency.add(new TreeSet<>());
        }
        for (QubitPair pair : couplings) {
            if (pair.a() < size && pair.b() < size) {
                adjacency.get(pair.a()).add(pair.b());
                adjacency.get(pair.b()).add(pair.a());
            }
        }
        return adjacency;
    }

    private static int[] visitOrder(List<TreeSet<Integer>> logical) {
        int n = logical.size();
        boolean[] seen = new boolean[n];
        int[] order = new int[n];
        int index = 0;
        while (index < n) {
            int start = -1;
            for (int q = 0; q < n; q++) {
                if (!seen[q] && (start < 0 || logical.get(q).size() > logical.get(start).size())) {
                    start = q;
                }
            }
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(start);
            seen[start] = true;
            while (!queue.isEmpty()) {
                int q = queue.poll();
                order[index++] = q;
                for (int neighbour : logical.get(q)) {
                    if (!seen[neighbour]) {
                        seen[neighbour] = true;
                        queue.add(neighbour);
                    }
                }
            }
        }
        return order;
    }

    private final class Search {
        private final List<TreeSet<Integer>> logical;
        private final List<TreeSet<Integer>> physical;
        private final int[] order;
        private final int[] assignment;
        private final Map<Integer, Integer> used = new HashMap<>();
        private int steps;

        Search(List<TreeSet<Integer>> logical, List<TreeSet<Integer>> physical, int[] order) {
            this.logical = logical;
            this.physical = physical;
            this.order = order;
            this.assignment = new int[logical.size()];
            Arrays.fill(assignment, -1);
        }

        boolean place(int depth) {
            if (depth == order.length) {
                return true;
            }
            int q = order[depth];
            for (int p : candidatesFor(q)) {
                if (++steps > stepLimit) {
                    return false;
                }
                if (used.containsKey(p) || !consistent(q, p)) {
                    continue;
                }
                assignment[q] = p;
                used.put(p, q);
                if (place(depth + 1)) {
                    return true;
                }
                assignment[q] = -1;
                used.remove(p);
            }
            return false;
        }

        private Iterable<Integer> candidatesFor(int q) {
            for (int neighbour : logical.get(q)) {
                if (assignment[neighbour] >= 0) {
                    return physical.get(assignment[neighbour]);
                }
            }
            List<Integer> all = new ArrayList<>(physical.size());
            for (int p = 0; p < physical.size(); p++) {
                if (physical.get(p).size() >= logical.get(q).size()) {
                    all.add(p);
                }
            }
            return all;
        }

        private boolean consistent(int q, int p) {
            if (physical.get(p).size() < logical.get(q).size()) {
                return false;
            }
            for (int neighbour : logical.get(q)) {
                int placed = assignment[neighbour];
                if (placed >= 0 && !physical.get(p).contains(placed)) {
                    return false;
                }
            }
            return true;
        }
    }
}
