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

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a {@link ResourceAllocation}.
 *
 * <pre>
 * RESERVED → ACTIVE → RELEASED
 *    │          └────→ EXPIRED
 *    └──→ RELEASED | EXPIRED
 * </pre>
 *
 * <p>Only {@code RESERVED} allocations may be re-selected; an {@code ACTIVE} allocation
 * belongs to a dispatched stage and is left alone until it is released or expires.</p>
 */
public enum AllocationState {

    /** Resource chosen, stage not yet handed to the backend. */
    RESERVED,

    /** Stage dispatched on the resource. */
    ACTIVE,

    RELEASED,

    /** Lease hard deadline passed before release. */
    EXPIRED;

    private static final Map<AllocationState, Set<AllocationState>> TRANSITIONS;

    static {
        var map = new EnumMap<AllocationState, Set<AllocationState>>(AllocationState.class);
        map.put(RESERVED, EnumSet.of(ACTIVE, RELEASED, EXPIRED));
        map.put(ACTIVE, EnumSet.of(RELEASED, EXPIRED));
        map.put(RELEASED, EnumSet.noneOf(AllocationState.class));
        map.put(EXPIRED, EnumSet.noneOf(AllocationState.class));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    /**
     * Whether the allocation still occupies a slot on its resource.
     */
    public boolean isHeld() {
        return this == RESERVED || this == ACTIVE;
    }

    public boolean canTransitionTo(AllocationState target) {
        return TRANSITIONS.getOrDefault(this, Set.of()).contains(target);
    }

    public Set<AllocationState> getValidTransitions() {
        return TRANSITIONS.getOrDefault(this, Set.of());
    }
}
