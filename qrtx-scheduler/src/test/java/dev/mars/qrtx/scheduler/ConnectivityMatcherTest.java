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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static dev.mars.qrtx.scheduler.SchedulerFixtures.device;
import static dev.mars.qrtx.scheduler.SchedulerFixtures.linearDevice;
import static org.junit.jupiter.api.Assertions.*;

class ConnectivityMatcherTest {

    private final ConnectivityMatcher matcher = new ConnectivityMatcher();

    private static ResourceConstraints needs(int qubits, QubitPair... couplings) {
        return new ResourceConstraints(qubits, List.of(couplings), 0.0, null, 0);
    }

    private static void assertValidMapping(ResourceConstraints constraints, ResourceDescriptor resource,
                                           Map<Integer, Integer> mapping) {
        assertEquals(constraints.qubitCount(), mapping.size());
        assertEquals(mapping.size(), new HashSet<>(mapping.values()).size(), "mapping must be injective");
        for (QubitPair pair : constraints.connectivity()) {
            assertTrue(resource.isCoupled(mapping.get(pair.a()), mapping.get(pair.b())),
                    "coupling " + pair + " not preserved by " + mapping);
        }
    }

    @Test
    @DisplayName("no required couplings maps qubits onto themselves")
    void identityWithoutCouplings() {
        Optional<Map<Integer, Integer>> mapping = matcher.findMapping(needs(3), linearDevice("line", 5));

        assertTrue(mapping.isPresent());
        assertEquals(Map.of(0, 0, 1, 1, 2, 2), mapping.get());
    }

    @Test
    @DisplayName("all-to-all resources accept any coupling pattern")
    void fullyConnectedResource() {
        ResourceConstraints triangle = needs(3, new QubitPair(0, 1), new QubitPair(1, 2), new QubitPair(0, 2));

        assertTrue(matcher.findMapping(triangle, device("sim", 3)).isPresent());
    }

    @Test
    @DisplayName("a chain embeds in a line")
    void chainInLine() {
        ResourceConstraints chain = needs(3, new QubitPair(0, 2), new QubitPair(2, 1));
        ResourceDescriptor line = linearDevice("line", 5);

        Map<Integer, Integer> mapping = matcher.findMapping(chain, line).orElseThrow();
        assertValidMapping(chain, line, mapping);
    }

    @Test
    @DisplayName("a triangle does not embed in a line")
    void triangleNotInLine() {
        ResourceConstraints triangle = needs(3, new QubitPair(0, 1), new QubitPair(1, 2), new QubitPair(0, 2));

        assertTrue(matcher.findMapping(triangle, linearDevice("line", 7)).isEmpty());
    }

    @Test
    @DisplayName("a star needs a physical qubit of matching degree")
    void starNeedsHub() {
        ResourceConstraints star = needs(4, new QubitPair(0, 1), new QubitPair(0, 2), new QubitPair(0, 3));
        ResourceDescriptor tShape = ResourceDescriptor.builder("t").qubitCount(5)
                .couplingMap(List.of(new QubitPair(0, 1), new QubitPair(1, 2), new QubitPair(1, 3), new QubitPair(3, 4)))
                .build();

        Map<Integer, Integer> mapping = matcher.findMapping(star, tShape).orElseThrow();
        assertEquals(1, mapping.get(0));
        assertValidMapping(star, tShape, mapping);
        assertTrue(matcher.findMapping(star, linearDevice("line", 5)).isEmpty());
    }

    @Test
    @DisplayName("disconnected logical components are placed independently")
    void disconnectedComponents() {
        ResourceConstraints pairs = needs(4, new QubitPair(0, 1), new QubitPair(2, 3));
        ResourceDescriptor line = linearDevice("line", 4);

        assertValidMapping(pairs, line, matcher.findMapping(pairs, line).orElseThrow());
    }

    @Test
    @DisplayName("more logical qubits than physical ones never match")
    void tooManyQubits() {
        assertTrue(matcher.findMapping(needs(6), device("small", 5)).isEmpty());
    }

    @Test
    @DisplayName("search stops at the step limit")
    void stepLimit() {
        ResourceConstraints chain = needs(3, new QubitPair(0, 1), new QubitPair(1, 2));
        ResourceDescriptor line = linearDevice("line", 10);

        assertTrue(new ConnectivityMatcher().findMapping(chain, line).isPresent());
        assertTrue(new ConnectivityMatcher(2).findMapping(chain, line).isEmpty());
    }
}
