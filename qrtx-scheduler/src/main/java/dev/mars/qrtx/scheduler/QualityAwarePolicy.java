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

import dev.mars.qrtx.core.StageDefinition;
import dev.mars.qrtx.resource.ResourceDescriptor;

import java.time.Duration;
import java.time.Instant;

/**
 * Weighted blend of three signals, each normalised to [0, 1]:
 * <ul>
 *   <li>queue: {@code 1 / (1 + queueDepth)}</li>
 *   <li>calibration recency: linear decay from 1 at calibration time to 0 at the horizon;
 *       0 when the resource never reported a calibration</li>
 *   <li>success rate: observed outcomes blended with the rate the resource reports</li>
 * </ul>
 */
public class QualityAwarePolicy extends ScoringPolicy {

    public static final String NAME = "quality-aware";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected double score(StageDefinition stage, ResourceDescriptor candidate, SchedulingContext context) {
        SchedulingContext.QualityWeights weights = context.getWeights();
        return weights.queueDepth() * queueScore(candidate)
                + weights.calibration() * calibrationScore(candidate, context)
                + weights.successRate() * context.observedSuccessRate(candidate.getId(), candidate.getSuccessRate());
    }

    static double queueScore(ResourceDescriptor candidate) {
        return 1.0 / (1.0 + candidate.getQueueDepth());
    }

    static double calibrationScore(ResourceDescriptor candidate, SchedulingContext context) {
        Instant calibratedAt = candidate.getCalibratedAt();
        if (calibratedAt == null) {
            return 0.0;
        }
        long ageMs = Duration.between(calibratedAt, context.getClock().instant()).toMillis();
        if (ageMs <= 0) {
            return 1.0;
        }
        return Math.max(0.0, 1.0 - (double) ageMs / context.getCalibrationHorizonMs());
    }
}
