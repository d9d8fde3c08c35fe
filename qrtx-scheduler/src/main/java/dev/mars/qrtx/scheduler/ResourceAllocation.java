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

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Binding of one stage attempt to a resource for a lease window.
 *
 * <p>Immutable: state changes made by {@link SchedulingEngine} produce a new instance.
 * {@code hardDeadline} is null when the stage declared no duration estimate, in which case
 * the lease never expires on its own.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public final class ResourceAllocation {

    private final String allocationId;
    private final String jobId;
    private final String stageId;
    private final String resourceId;
    private final Map<Integer, Integer> qubitMapping;
    private final Instant leaseStart;
    private final Instant estimatedEnd;
    private final Instant hardDeadline;
    private final AllocationState state;

    ResourceAllocation(String allocationId, String jobId, String stageId, String resourceId,
                       Map<Integer, Integer> qubitMapping, Instant leaseStart, Instant estimatedEnd,
                       Instant hardDeadline, AllocationState state) {
        this.allocationId = Objects.requireNonNull(allocationId, "allocationId");
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.stageId = Objects.requireNonNull(stageId, "stageId");
        this.resourceId = Objects.requireNonNull(resourceId, "resourceId");
        this.qubitMapping = Map.copyOf(qubitMapping);
        this.leaseStart = Objects.requireNonNull(leaseStart, "leaseStart");
        this.estimatedEnd = estimatedEnd;
        this.hardDeadline = hardDeadline;
        this.state = Objects.requireNonNull(state, "state");
    }

    ResourceAllocation withState(AllocationState newState) {
        if (!state.canTransitionTo(newState)) {
            throw new IllegalStateException("Allocation " + allocationId + ": " + state + " → " + newState
                    + " not allowed. Valid targets: " + state.getValidTransitions());
        }
        return new ResourceAllocation(allocationId, jobId, stageId, resourceId, qubitMapping,
                leaseStart, estimatedEnd, hardDeadline, newState);
    }

    public String getAllocationId() {
        return allocationId;
    }

    public String getJobId() {
        return jobId;
    }

    public String getStageId() {
        return stageId;
    }

    public String getResourceId() {
        return resourceId;
    }

    /**
     * Logical qubit index to physical qubit index on the resource.
     */
    public Map<Integer, Integer> getQubitMapping() {
        return qubitMapping;
    }

    public Instant getLeaseStart() {
        return leaseStart;
    }

    public Instant getEstimatedEnd() {
        return estimatedEnd;
    }

    public Instant getHardDeadline() {
        return hardDeadline;
    }

    public AllocationState getState() {
        return state;
    }

    public boolean isExpiredAt(Instant now) {
        return hardDeadline != null && now.isAfter(hardDeadline);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResourceAllocation that = (ResourceAllocation) o;
        return allocationId.equals(that.allocationId) && state == that.state;
    }

    @Override
    public int hashCode() {
        return Objects.hash(allocationId, state);
    }

    @Override
    public String toString() {
        return "ResourceAllocation{" +
                "id='" + allocationId + '\'' +
                ", stage=" + jobId + "/" + stageId +
                ", resource='" + resourceId + '\'' +
                ", state=" + state +
                ", hardDeadline=" + hardDeadline +
                '}';
    }
}
