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
 * Chooses one resource among candidates that already satisfy a stage's hard constraints
 * and have free capacity. Implementations never see an ineligible resource and must
 * return one of the given candidates.
 */
public interface SchedulingPolicy {

    String getName();

    /**
     * @param stage      stage being placed
     * @param candidates non-empty, in registration order
     * @param context    clock, weights and observed outcomes
     * @return the chosen candidate
     */
    ResourceDescriptor choose(StageDefinition stage, List<ResourceDescriptor> candidates, SchedulingContext context);
}
