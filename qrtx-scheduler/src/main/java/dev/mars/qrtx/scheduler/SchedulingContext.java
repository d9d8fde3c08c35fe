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

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Inputs a {@link SchedulingPolicy} may consult beyond the candidate list: the clock,
 * policy weights, and the outcomes observed for each resource by this orchestrator.
 *
 * <p>Passed explicitly to every selection call.</p>
 */
public class SchedulingContext {

    private final Clock clock;
    private final double leaseFactor;
    private final QualityWeights weights;
    private final long calibrationHorizonMs;
    private final Map<String, OutcomeCounter> outcomes = new ConcurrentHashMap<>();

    public SchedulingContext(Clock clock, double leaseFactor, QualityWeights weights, long calibrationHorizonMs) {
        this.clock = Objects.requireNonNull(clock, "clock");
        if (leaseFactor < 1.0) {
            throw new IllegalArgumentException("leaseFactor must be >= 1.0 (current: " + leaseFactor + ")");
        }
        if (calibrationHorizonMs <= 0) {
            throw new IllegalArgumentException("calibrationHorizonMs must be > 0");
        }
        this.leaseFactor = leaseFactor;
        this.weights = Objects.requireNonNull(weights, "weights");
        this.calibrationHorizonMs = calibrationHorizonMs;
    }

    public static SchedulingContext fromConfiguration(QrtxConfiguration config, Clock clock) {
        return new SchedulingContext(clock, config.getLeaseFactor(),
                new QualityWeights(config.getQueueDepthWeight(), config.getCalibrationWeight(),
                        config.getSuccessRateWeight()),
                config.getCalibrationHorizonMs());
    }

    public Clock getClock() {
        return clock;
    }

    public double getLeaseFactor() {
        return leaseFactor;
    }

    public QualityWeights getWeights() {
        return weights;
    }

    public long getCalibrationHorizonMs() {
        return calibrationHorizonMs;
    }

    public void recordOutcome(String resourceId, boolean success) {
        outcomes.computeIfAbsent(resourceId, id -> new OutcomeCounter()).record(success);
    }

    /**
     * Observed success ratio for a resource, falling back to {@code reported} until at
     * least one outcome has been recorded.
     */
    public double observedSuccessRate(String resourceId, double reported) {
        OutcomeCounter counter = outcomes.get(resourceId);
        return counter == null ? reported : counter.ratio(reported);
    }

    /**
     * Relative weights of the quality-aware score terms. Non-negative; they need not sum to one.
     */
    public record QualityWeights(double queueDepth, double calibration, double successRate) {

        public static final QualityWeights DEFAULT = new QualityWeights(0.4, 0.3, 0.3);

        public QualityWeights {
            if (queueDepth < 0 || calibration < 0 || successRate < 0) {
                throw new IllegalArgumentException("Policy weights must be non-negative");
            }
        }
    }

    private static final class OutcomeCounter {
        private long successes;
        private long total;

        synchronized void record(boolean success) {
            total++;
            if (success) {
                successes++;
            }
        }

        /** Reported rate counts as one prior observation. */
        synchronized double ratio(double reported) {
            return (successes + reported) / (total + 1.0);
        }
    }
}
