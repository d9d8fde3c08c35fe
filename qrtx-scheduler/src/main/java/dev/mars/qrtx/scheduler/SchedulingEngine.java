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

import dev.mars.qrtx.core.ResourceConstraints;
import dev.mars.qrtx.core.StageDefinition;
import dev.mars.qrtx.core.exceptions.NoCandidateException;
import dev.mars.qrtx.resource.ResourceDescriptor;
import dev.mars.qrtx.resource.ResourceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Places quantum stages on resources and owns every allocation record.
 *
 * <p>Selection runs in two passes, mirroring agent selection in the controller: a hard
 * filter (not retired, enough qubits, payload format accepted, fidelity bound met,
 * connectivity subgraph present) followed by the configured {@link SchedulingPolicy} over
 * the candidates that are also online with a free slot. An empty hard-filter result is
 * {@link NoCandidateException.Reason#UNSATISFIABLE}; a non-empty one with nothing free is
 * {@link NoCandidateException.Reason#NONE_FREE}.</p>
 *
 * <p>All allocation, activation, release and expiry go through the synchronized methods of
 * this class. A resource never holds more {@code RESERVED}/{@code ACTIVE} allocations than
 * its declared capacity.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class SchedulingEngine {
    private static final Logger logger = LoggerFactory.getLogger(SchedulingEngine.class);

    private final ResourceRegistry registry;
    private final SchedulingContext context;
    private final SchedulingPolicy policy;
    private final ConnectivityMatcher matcher;

    private final Map<String, ResourceAllocation> allocations = new LinkedHashMap<>();
    private final Map<String, Integer> heldByResource = new HashMap<>();

    public SchedulingEngine(ResourceRegistry registry, SchedulingContext context, SchedulingPolicy policy) {
        this(registry, context, policy, new ConnectivityMatcher());
    }

    public SchedulingEngine(ResourceRegistry registry, SchedulingContext context, SchedulingPolicy policy,
                            ConnectivityMatcher matcher) {
        this.registry = registry;
        this.context = context;
        this.policy = policy;
        this.matcher = matcher;
        logger.info("Scheduling engine using policy {}", policy.getName());
    }

    public ResourceRegistry getRegistry() {
        return registry;
    }

    public SchedulingContext getContext() {
        return context;
    }

    public SchedulingPolicy getPolicy() {
        return policy;
    }

    /**
     * Place a stage using every resource in the registry as a candidate.
     */
    public ResourceAllocation selectResource(String jobId, StageDefinition stage) throws NoCandidateException {
        return selectResource(jobId, stage, registry.all());
    }

    /**
     * Place a stage on one of the given candidates and reserve a slot on it.
     *
     * @throws NoCandidateException with {@code NONE_FREE} when a matching resource exists but is
     *                              busy or unavailable, {@code UNSATISFIABLE} when none ever can
     */
    public synchronized ResourceAllocation selectResource(String jobId, StageDefinition stage,
                                                          List<ResourceDescriptor> candidates) throws NoCandidateException {
        return select(jobId, stage, candidates, Set.of());
    }

    /**
     * Hard-constraint filter only: the resources that could ever host the stage, with the
     * qubit mapping found for each.
     */
    public Map<ResourceDescriptor, Map<Integer, Integer>> satisfyingResources(StageDefinition stage,
                                                                              Collection<ResourceDescriptor> candidates) {
        requireResourceStage(stage);
        ResourceConstraints constraints = stage.getConstraints();
        Map<ResourceDescriptor, Map<Integer, Integer>> satisfying = new LinkedHashMap<>();
        for (ResourceDescriptor candidate : candidates) {
            if (candidate.getStatus() == ResourceStatus.RETIRED
                    || candidate.getQubitCount() < constraints.qubitCount()
                    || !candidate.supportsFormat(constraints.payloadFormat())
                    || candidate.getFidelity() < constraints.minFidelity()) {
                continue;
            }
            matcher.findMapping(constraints, candidate).ifPresent(mapping -> satisfying.put(candidate, mapping));
        }
        return satisfying;
    }

    /**
     * Mark a reserved allocation as dispatched.
     *
     * @return the active allocation, or empty when its resource is no longer available, in which
     * case the allocation stays reserved and the caller should {@link #reselect} it
     */
    public synchronized Optional<ResourceAllocation> activate(String allocationId) {
        ResourceAllocation allocation = requireAllocation(allocationId);
        boolean available = registry.get(allocation.getResourceId())
                .map(r -> r.getStatus().isAvailable())
                .orElse(false);
        if (!available) {
            logger.info("Resource {} became unavailable before dispatch of {}/{}",
                    allocation.getResourceId(), allocation.getJobId(), allocation.getStageId());
            return Optional.empty();
        }
        ResourceAllocation active = allocation.withState(AllocationState.ACTIVE);
        allocations.put(allocationId, active);
        return Optional.of(active);
    }

    /**
     * Give up a reserved allocation and select again, excluding its resource from this round.
     * Active allocations are never re-selected.
     *
     * @throws IllegalStateException if the allocation is not {@code RESERVED}
     */
    public synchronized ResourceAllocation reselect(String allocationId, StageDefinition stage) throws NoCandidateException {
        ResourceAllocation allocation = requireAllocation(allocationId);
        if (allocation.getState() != AllocationState.RESERVED) {
            throw new IllegalStateException("Cannot reselect allocation " + allocationId + " in state " + allocation.getState());
        }
        releaseInternal(allocation, AllocationState.RELEASED);
        logger.debug("Reselecting {}/{} away from {}", allocation.getJobId(), allocation.getStageId(),
                allocation.getResourceId());
        return select(allocation.getJobId(), stage, registry.all(), Set.of(allocation.getResourceId()));
    }

    /**
     * Release an allocation. Releasing one that is already released or expired is a no-op.
     *
     * @return the released allocation, or empty if nothing was held
     */
    public synchronized Optional<ResourceAllocation> release(String allocationId) {
        ResourceAllocation allocation = allocations.get(allocationId);
        if (allocation == null || !allocation.getState().isHeld()) {
            return Optional.empty();
        }
        return Optional.of(releaseInternal(allocation, AllocationState.RELEASED));
    }

    /**
     * Expire every held allocation whose hard deadline has passed.
     *
     * @return the expired allocations; their stages should be treated as timed out
     */
    public synchronized List<ResourceAllocation> expireLeases() {
        Instant now = context.getClock().instant();
        List<ResourceAllocation> expired = new ArrayList<>();
        for (ResourceAllocation allocation : new ArrayList<>(allocations.values())) {
            if (allocation.getState().isHeld() && allocation.isExpiredAt(now)) {
                expired.add(releaseInternal(allocation, AllocationState.EXPIRED));
                logger.warn("Lease {} for {}/{} on {} expired", allocation.getAllocationId(),
                        allocation.getJobId(), allocation.getStageId(), allocation.getResourceId());
            }
        }
        return expired;
    }

    /**
     * Record whether a stage run on a resource succeeded; feeds the observed success rate.
     */
    public void recordOutcome(String resourceId, boolean success) {
        context.recordOutcome(resourceId, success);
    }

    public synchronized Optional<ResourceAllocation> getAllocation(String allocationId) {
        return Optional.ofNullable(allocations.get(allocationId));
    }

    public synchronized int heldCount(String resourceId) {
        return heldByResource.getOrDefault(resourceId, 0);
    }

    public synchronized List<ResourceAllocation> heldAllocations() {
        return allocations.values().stream()
                .filter(a -> a.getState().isHeld())
                .collect(Collectors.toList());
    }

    private ResourceAllocation select(String jobId, StageDefinition stage, List<ResourceDescriptor> candidates,
                                      Set<String> excluded) throws NoCandidateException {
        Map<ResourceDescriptor, Map<Integer, Integer>> satisfying = satisfyingResources(stage, candidates);
        if (satisfying.isEmpty()) {
            throw new NoCandidateException(stage.getId(), NoCandidateException.Reason.UNSATISFIABLE,
                    "No resource can satisfy stage '" + stage.getId() + "' (" + describe(stage.getConstraints()) + ")");
        }

        List<ResourceDescriptor> free = satisfying.keySet().stream()
                .filter(r -> r.getStatus().isAvailable())
                .filter(r -> !excluded.contains(r.getId()))
                .filter(r -> heldCount(r.getId()) < r.getCapacity())
                .collect(Collectors.toList());
        if (free.isEmpty()) {
            throw new NoCandidateException(stage.getId(), NoCandidateException.Reason.NONE_FREE,
                    satisfying.size() + " matching resource(s) for stage '" + stage.getId() + "', none free");
        }

        ResourceDescriptor chosen = policy.choose(stage, free, context);
        if (chosen == null || !free.contains(chosen)) {
            throw new IllegalStateException("Policy " + policy.getName() + " returned a non-candidate resource");
        }

        Instant start = context.getClock().instant();
        long estimatedMs = stage.getConstraints().estimatedDurationMs();
        Instant estimatedEnd = start.plusMillis(estimatedMs);
        Instant hardDeadline = estimatedMs > 0
                ? start.plusMillis(Math.round(estimatedMs * context.getLeaseFactor()))
                : null;

        ResourceAllocation allocation = new ResourceAllocation(UUID.randomUUID().toString(), jobId, stage.getId(),
                chosen.getId(), satisfying.get(chosen), start, estimatedEnd, hardDeadline, AllocationState.RESERVED);
        allocations.put(allocation.getAllocationId(), allocation);
        heldByResource.merge(chosen.getId(), 1, Integer::sum);

        logger.debug("Reserved {} for {}/{} via {} ({} of {} candidates free)", chosen.getId(), jobId,
                stage.getId(), policy.getName(), free.size(), satisfying.size());
        return allocation;
    }

    private ResourceAllocation releaseInternal(ResourceAllocation allocation, AllocationState target) {
        ResourceAllocation released = allocation.withState(target);
        allocations.put(allocation.getAllocationId(), released);
        heldByResource.computeIfPresent(allocation.getResourceId(), (id, held) -> held <= 1 ? null : held - 1);
        return released;
    }

    private ResourceAllocation requireAllocation(String allocationId) {
        ResourceAllocation allocation = allocations.get(allocationId);
        if (allocation == null) {
            throw new IllegalArgumentException("Unknown allocation: " + allocationId);
        }
        return allocation;
    }

    private static void requireResourceStage(StageDefinition stage) {
        if (!stage.getKind().requiresResource()) {
            throw new IllegalArgumentException("Stage '" + stage.getId() + "' of kind " + stage.getKind()
                    + " does not take a resource allocation");
        }
    }

    private static String describe(ResourceConstraints constraints) {
        StringBuilder sb = new StringBuilder().append(constraints.qubitCount()).append(" qubits");
        if (!constraints.connectivity().isEmpty()) {
            sb.append(", couplings ").append(constraints.connectivity());
        }
        if (constraints.payloadFormat() != null) {
            sb.append(", format ").append(constraints.payloadFormat());
        }
        if (constraints.minFidelity() > 0) {
            sb.append(", fidelity >= ").append(constraints.minFidelity());
        }
        return sb.toString();
    }
}
