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

import dev.mars.qrtx.config.QrtxConfiguration;
import dev.mars.qrtx.core.StageDefinition;
import dev.mars.qrtx.resource.ResourceDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Properties;

import static dev.mars.qrtx.scheduler.SchedulerFixtures.quantumStage;
import static org.junit.jupiter.api.Assertions.*;

class QualityAwarePolicyTest {

    private static final Instant NOW = Instant.parse("2026-10-19T10:00:00Z");
    private static final long HORIZON_MS = Duration.ofHours(24).toMillis();

    private final StageDefinition stage = quantumStage("q", 2);
    private final QualityAwarePolicy policy = new QualityAwarePolicy();
    private SchedulingContext context;

    @BeforeEach
    void setUp() {
        context = contextWith(SchedulingContext.QualityWeights.DEFAULT);
    }

    private static SchedulingContext contextWith(SchedulingContext.QualityWeights weights) {
        return new SchedulingContext(new SchedulerFixtures.ManualClock(NOW), 3.0, weights, HORIZON_MS);
    }

    private static ResourceDescriptor.Builder resource(String id) {
        return ResourceDescriptor.builder(id).qubitCount(10).calibratedAt(NOW).successRate(0.9);
    }

    @Test
    @DisplayName("shorter queue wins when other signals are equal")
    void prefersShortQueue() {
        ResourceDescriptor busy = resource("busy").queueDepth(20).build();
        ResourceDescriptor idle = resource("idle").queueDepth(0).build();

        assertEquals("idle", policy.choose(stage, List.of(busy, idle), context).getId());
    }

    @Test
    @DisplayName("recent calibration wins when other signals are equal")
    void prefersRecentCalibration() {
        ResourceDescriptor stale = resource("stale").calibratedAt(NOW.minus(Duration.ofHours(20))).build();
        ResourceDescriptor fresh = resource("fresh").calibratedAt(NOW.minus(Duration.ofHours(1))).build();
        ResourceDescriptor never = resource("never").calibratedAt(null).build();

        assertEquals("fresh", policy.choose(stage, List.of(never, stale, fresh), context).getId());
    }

    @Test
    @DisplayName("observed failures lower the success signal")
    void observedOutcomes() {
        ResourceDescriptor flaky = resource("flaky").build();
        ResourceDescriptor steady = resource("steady").build();
        for (int i = 0; i < 5; i++) {
            context.recordOutcome("flaky", false);
            context.recordOutcome("steady", true);
        }

        assertEquals("steady", policy.choose(stage, List.of(flaky, steady), context).getId());
        assertEquals(0.9 / 6.0, context.observedSuccessRate("flaky", 0.9), 1e-9);
        assertEquals(0.9, context.observedSuccessRate("unknown", 0.9), 1e-9);
    }

    @Test
    @DisplayName("equal scores break on lowest estimated wait")
    void tieBreakOnWait() {
        ResourceDescriptor slow = resource("slow").estimatedWaitMs(5_000).build();
        ResourceDescriptor fast = resource("fast").estimatedWaitMs(100).build();

        assertEquals("fast", policy.choose(stage, List.of(slow, fast), context).getId());
    }

    @Test
    @DisplayName("weights decide between conflicting signals")
    void weightsMatter() {
        ResourceDescriptor shortQueueStale = resource("a").queueDepth(0).calibratedAt(NOW.minus(Duration.ofHours(23))).build();
        ResourceDescriptor longQueueFresh = resource("b").queueDepth(50).build();
        List<ResourceDescriptor> candidates = List.of(shortQueueStale, longQueueFresh);

        assertEquals("a", policy.choose(stage, candidates,
                contextWith(new SchedulingContext.QualityWeights(1.0, 0.0, 0.0))).getId());
        assertEquals("b", policy.choose(stage, candidates,
                contextWith(new SchedulingContext.QualityWeights(0.0, 1.0, 0.0))).getId());
    }

    @ParameterizedTest
    @CsvSource({"0, 1.0", "12, 0.5", "24, 0.0", "48, 0.0"})
    @DisplayName("calibration score decays linearly to the horizon")
    void calibrationDecay(long hoursAgo, double expected) {
        ResourceDescriptor r = resource("r").calibratedAt(NOW.minus(Duration.ofHours(hoursAgo))).build();

        assertEquals(expected, QualityAwarePolicy.calibrationScore(r, context), 1e-9);
    }

    @Test
    @DisplayName("policies resolve by configured name")
    void policyLookup() {
        assertInstanceOf(QualityAwarePolicy.class, SchedulingPolicies.fromName("Quality-Aware"));
        assertInstanceOf(FirstFitPolicy.class, SchedulingPolicies.fromName("first-fit"));
        assertInstanceOf(FirstFitPolicy.class, SchedulingPolicies.fromName("round-robin"));
        assertInstanceOf(FirstFitPolicy.class, SchedulingPolicies.fromName(null));
    }

    @Test
    @DisplayName("context picks up weights and lease factor from configuration")
    void contextFromConfiguration() {
        Properties properties = new Properties();
        properties.setProperty(QrtxConfiguration.SCHEDULER_LEASE_FACTOR, "2.5");
        properties.setProperty(QrtxConfiguration.POLICY_WEIGHT_QUEUE_DEPTH, "0.7");
        SchedulingContext configured = SchedulingContext.fromConfiguration(new QrtxConfiguration(properties),
                new SchedulerFixtures.ManualClock(NOW));

        assertEquals(2.5, configured.getLeaseFactor());
        assertEquals(0.7, configured.getWeights().queueDepth());
        assertEquals(0.3, configured.getWeights().calibration());
    }

    @Test
    @DisplayName("lease factor below one is rejected")
    void invalidLeaseFactor() {
        assertThrows(IllegalArgumentException.class, () -> new SchedulingContext(new SchedulerFixtures.ManualClock(NOW),
                0.5, SchedulingContext.QualityWeights.DEFAULT, HORIZON_MS));
    }
}
