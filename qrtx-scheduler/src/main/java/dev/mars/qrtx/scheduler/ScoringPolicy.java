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

import java.util.List;

/**
 * Base for policies that rank candidates by a numeric fitness. The highest score wins;
 * ties go to the lowest estimated wait, then to registration order.
 */
public abstract class ScoringPolicy implements SchedulingPolicy {

    /**
     * Fitness of a candidate. Higher is better.
     */
    protected abstract double score(StageDefinition stage, ResourceDescriptor candidate, SchedulingContext context);

    @Override
    public ResourceDescriptor choose(StageDefinition stage, List<ResourceDescriptor> candidates, SchedulingContext context) {
        ResourceDescriptor best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (ResourceDescriptor candidate : candidates) {
            double candidateScore = score(stage, candidate, context);
            if (best == null
                    || candidateScore > bestScore
                    || (candidateScore == bestScore && candidate.getEstimatedWaitMs() < best.getEstimatedWaitMs())) {
                best = candidate;
                bestScore = candidateScore;
            }
        }
        return best;
    }
}
