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

import dev.mars.qrtx.resource.ResourceDescriptor;
import dev.mars.qrtx.resource.ResourceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Candidate resources known to one scheduler instance. Registration order is preserved:
 * first-fit selection walks resources in the order they were registered.
 *
 * <p>Each orchestrator owns its registry; there is no process-wide instance.</p>
 */
public class ResourceRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ResourceRegistry.class);

    private final Map<String, ResourceDescriptor> resources = new LinkedHashMap<>();
    private final List<Consumer<ResourceDescriptor>> statusListeners = new CopyOnWriteArrayList<>();

    public synchronized void register(ResourceDescriptor descriptor) {
        ResourceDescriptor previous = resources.put(descriptor.getId(), descriptor);
        if (previous == null) {
            logger.info("Registered resource {} ({} qubits, {})", descriptor.getId(),
                    descriptor.getQubitCount(), descriptor.getStatus());
        } else {
            logger.debug("Updated resource {}", descriptor.getId());
            if (previous.getStatus() != descriptor.getStatus()) {
                notifyStatusChange(descriptor);
            }
        }
    }

    public synchronized Optional<ResourceDescriptor> get(String resourceId) {
        return Optional.ofNullable(resources.get(resourceId));
    }

    /**
     * Snapshot of all resources, in registration order.
     */
    public synchronized List<ResourceDescriptor> all() {
        return new ArrayList<>(resources.values());
    }

    public void updateStatus(String resourceId, ResourceStatus status) {
        ResourceDescriptor updated;
        synchronized (this) {
            ResourceDescriptor current = resources.get(resourceId);
            if (current == null) {
                throw new IllegalArgumentException("Unknown resource: " + resourceId);
            }
            if (current.getStatus() == status) {
                return;
            }
            updated = current.withStatus(status);
            resources.put(resourceId, updated);
        }
        logger.info("Resource {} is now {}", resourceId, status);
        notifyStatusChange(updated);
    }

    /**
     * Replace the queue signals of a resource, as reported by its backend.
     */
    public synchronized void updateQueue(String resourceId, int queueDepth, long estimatedWaitMs) {
        ResourceDescriptor current = resources.get(resourceId);
        if (current == null) {
            throw new IllegalArgumentException("Unknown resource: " + resourceId);
        }
        resources.put(resourceId, current.withQueue(queueDepth, estimatedWaitMs));
    }

    public void addStatusListener(Consumer<ResourceDescriptor> listener) {
        statusListeners.add(listener);
    }

    public synchronized int size() {
        return resources.size();
    }

    private void notifyStatusChange(ResourceDescriptor descriptor) {
        for (Consumer<ResourceDescriptor> listener : statusListeners) {
            try {
                listener.accept(descriptor);
            } catch (RuntimeException e) {
                logger.warn("Resource status listener failed for {}: {}", descriptor.getId(), e.getMessage());
            }
        }
    }
}
