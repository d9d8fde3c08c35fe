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

package dev.mars.qrtx.resource;

import dev.mars.qrtx.core.QubitPair;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Snapshot of a schedulable quantum resource (device or simulator backend): its static
 * shape, used by the hard-constraint filter, and its soft quality signals, used by
 * quality-aware policies. Descriptors are immutable; the registry swaps whole snapshots
 * when a resource reports new calibration or queue data.
 *
 * <p>An empty coupling map means all-to-all connectivity.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public final class ResourceDescriptor {

    private final String id;
    private final int qubitCount;
    private final List<QubitPair> couplingMap;
    private final Set<String> supportedFormats;
    private final double fidelity;
    private final Instant calibratedAt;
    private final double successRate;
    private final int queueDepth;
    private final long estimatedWaitMs;
    private final int capacity;
    private final ResourceStatus status;

    private ResourceDescriptor(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Resource ID cannot be null");
        if (builder.qubitCount <= 0) {
            throw new IllegalArgumentException("qubitCount must be positive for resource " + builder.id);
        }
        if (builder.capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive for resource " + builder.id);
        }
        this.qubitCount = builder.qubitCount;
        this.couplingMap = List.copyOf(builder.couplingMap);
        this.supportedFormats = Set.copyOf(builder.supportedFormats);
        this.fidelity = builder.fidelity;
        this.calibratedAt = builder.calibratedAt;
        this.successRate = builder.successRate;
        this.queueDepth = Math.max(0, builder.queueDepth);
        this.estimatedWaitMs = Math.max(0, builder.estimatedWaitMs);
        this.capacity = builder.capacity;
        this.status = Objects.requireNonNull(builder.status, "Status cannot be null");
    }

    public static Builder builder(String id) {
        return new Builder().id(id);
    }

    public String getId() {
        return id;
    }

    public int getQubitCount() {
        return qubitCount;
    }

    public List<QubitPair> getCouplingMap() {
        return couplingMap;
    }

    public boolean isFullyConnected() {
        return couplingMap.isEmpty();
    }

    public boolean isCoupled(int physicalA, int physicalB) {
        if (couplingMap.isEmpty()) {
            return physicalA != physicalB;
        }
        for (QubitPair pair : couplingMap) {
            if (pair.connects(physicalA, physicalB)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Payload formats this resource accepts. Empty means any format.
     */
    public Set<String> getSupportedFormats() {
        return supportedFormats;
    }

    public boolean supportsFormat(String format) {
        return format == null || supportedFormats.isEmpty() || supportedFormats.contains(format);
    }

    public double getFidelity() {
        return fidelity;
    }

    public Instant getCalibratedAt() {
        return calibratedAt;
    }

    public double getSuccessRate() {
        return successRate;
    }

    public int getQueueDepth() {
        return queueDepth;
    }

    public long getEstimatedWaitMs() {
        return estimatedWaitMs;
    }

    /**
     * Number of stages that may hold an allocation on this resource at the same time.
     */
    public int getCapacity() {
        return capacity;
    }

    public ResourceStatus getStatus() {
        return status;
    }

    public ResourceDescriptor withStatus(ResourceStatus newStatus) {
        return new Builder(this).status(newStatus).build();
    }

    public ResourceDescriptor withQueue(int newQueueDepth, long newEstimatedWaitMs) {
        return new Builder(this).queueDepth(newQueueDepth).estimatedWaitMs(newEstimatedWaitMs).build();
    }

    public ResourceDescriptor withCalibration(Instant when, double newFidelity, double newSuccessRate) {
        return new Builder(this).calibratedAt(when).fidelity(newFidelity).successRate(newSuccessRate).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResourceDescriptor that = (ResourceDescriptor) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "ResourceDescriptor{" +
                "id='" + id + '\'' +
                ", qubits=" + qubitCount +
                ", status=" + status +
                ", queueDepth=" + queueDepth +
                '}';
    }

    /**
     * Builder for ResourceDescriptor instances.
     */
    public static class Builder {
        private String id;
        private int qubitCount;
        private List<QubitPair> couplingMap = List.of();
        private Set<String> supportedFormats = Set.of();
        private double fidelity = 1.0;
        private Instant calibratedAt;
        private double successRate = 1.0;
        private int queueDepth;
        private long estimatedWaitMs;
        private int capacity = 1;
        private ResourceStatus status = ResourceStatus.ONLINE;

        public Builder() {
        }

        public Builder(ResourceDescriptor existing) {
            this.id = existing.id;
            this.qubitCount = existing.qubitCount;
            this.couplingMap = existing.couplingMap;
            this.supportedFormats = existing.supportedFormats;
            this.fidelity = existing.fidelity;
            this.calibratedAt = existing.calibratedAt;
            this.successRate = existing.successRate;
            this.queueDepth = existing.queueDepth;
            this.estimatedWaitMs = existing.estimatedWaitMs;
            this.capacity = existing.capacity;
            this.status = existing.status;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder qubitCount(int qubitCount) {
            this.qubitCount = qubitCount;
            return this;
        }

        public Builder couplingMap(List<QubitPair> couplingMap) {
            this.couplingMap = couplingMap != null ? couplingMap : List.of();
            return this;
        }

        public Builder supportedFormats(Set<String> supportedFormats) {
            this.supportedFormats = supportedFormats != null ? supportedFormats : Set.of();
            return this;
        }

        public Builder fidelity(double fidelity) {
            this.fidelity = fidelity;
            return this;
        }

        public Builder calibratedAt(Instant calibratedAt) {
            this.calibratedAt = calibratedAt;
            return this;
        }

        public Builder successRate(double successRate) {
            this.successRate = successRate;
            return this;
        }

        public Builder queueDepth(int queueDepth) {
            this.queueDepth = queueDepth;
            return this;
        }

        public Builder estimatedWaitMs(long estimatedWaitMs) {
            this.estimatedWaitMs = estimatedWaitMs;
            return this;
        }

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder status(ResourceStatus status) {
            this.status = status;
            return this;
        }

        public ResourceDescriptor build() {
            return new ResourceDescriptor(this);
        }
    }
}
