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

package dev.mars.qrtx.runtime.events;

import dev.mars.qrtx.core.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Per-job ordered event log with replay and live subscription.
 *
 * <p>Sequences start at 1 and increase by one per event. A subscriber that reconnects
 * replays with {@link #events(String, long)} from the last sequence it saw. Once a job's
 * terminal event is published, further events for that job are dropped.</p>
 */
public class JobEventFeed {
    private static final Logger logger = LoggerFactory.getLogger(JobEventFeed.class);

    private final Clock clock;
    private final Map<String, JobLog> logs = new ConcurrentHashMap<>();
    private final Map<String, List<Consumer<JobEvent>>> subscribers = new ConcurrentHashMap<>();

    public JobEventFeed(Clock clock) {
        this.clock = clock;
    }

    /**
     * Continue a recovered job's feed after {@code lastSequence}.
     */
    public void restore(String jobId, long lastSequence) {
        logs.computeIfAbsent(jobId, id -> new JobLog(lastSequence));
    }

    public Optional<JobEvent> publish(String jobId, JobEventType type, JobState state, String stageId, String detail) {
        JobLog log = logs.computeIfAbsent(jobId, id -> new JobLog(0));
        JobEvent event;
        synchronized (log) {
            if (log.terminated) {
                logger.warn("Dropping {} event for job {} after its terminal event", type, jobId);
                return Optional.empty();
            }
            event = new JobEvent(jobId, log.nextSequence++, type, clock.instant(), state, stageId, detail);
            log.events.add(event);
            log.terminated = event.isTerminal();
        }
        for (Consumer<JobEvent> subscriber : subscribers.getOrDefault(jobId, List.of())) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException e) {
                logger.warn("Event subscriber failed for job {} at sequence {}: {}", jobId, event.sequence(), e.getMessage());
            }
        }
        return Optional.of(event);
    }

    /**
     * Events of a job with a sequence greater than {@code afterSequence}, in order.
     */
    public List<JobEvent> events(String jobId, long afterSequence) {
        JobLog log = logs.get(jobId);
        if (log == null) {
            return List.of();
        }
        synchronized (log) {
            List<JobEvent> result = new ArrayList<>();
            for (JobEvent event : log.events) {
                if (event.sequence() > afterSequence) {
                    result.add(event);
                }
            }
            return result;
        }
    }

    public long lastSequence(String jobId) {
        JobLog log = logs.get(jobId);
        if (log == null) {
            return 0;
        }
        synchronized (log) {
            return log.nextSequence - 1;
        }
    }

    /**
     * Receive future events of a job. Events are delivered on the publishing thread.
     */
    public void subscribe(String jobId, Consumer<JobEvent> subscriber) {
        subscribers.computeIfAbsent(jobId, id -> new CopyOnWriteArrayList<>()).add(subscriber);
    }

    public void unsubscribe(String jobId, Consumer<JobEvent> subscriber) {
        List<Consumer<JobEvent>> list = subscribers.get(jobId);
        if (list != null) {
            list.remove(subscriber);
        }
    }

    /**
     * Drop the log and subscribers of a job. Later queries see no events for it.
     */
    public void forget(String jobId) {
        logs.remove(jobId);
        subscribers.remove(jobId);
    }

    public boolean isTracked(String jobId) {
        return logs.containsKey(jobId);
    }

    private static final class JobLog {
        private final List<JobEvent> events = new ArrayList<>();
        private long nextSequence;
        private boolean terminated;

        JobLog(long lastSequence) {
            this.nextSequence = lastSequence + 1;
        }
    }
}
