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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("JobEventFeed")
class JobEventFeedTest {

    private JobEventFeed feed;

    @BeforeEach
    void setUp() {
        feed = new JobEventFeed(Clock.systemUTC());
    }

    @Test
    @DisplayName("Sequences start at 1 and are gap-free per job")
    void sequencesPerJob() {
        feed.publish("a", JobEventType.SUBMITTED, JobState.PENDING, null, null);
        feed.publish("b", JobEventType.SUBMITTED, JobState.PENDING, null, null);
        feed.publish("a", JobEventType.STATE_CHANGED, JobState.COMPILING, null, null);

        assertThat(feed.events("a", 0)).extracting(JobEvent::sequence).containsExactly(1L, 2L);
        assertThat(feed.events("b", 0)).extracting(JobEvent::sequence).containsExactly(1L);
        assertEquals(2, feed.lastSequence("a"));
    }

    @Test
    @DisplayName("Replay returns only events after the given sequence")
    void replayAfterSequence() {
        for (int i = 0; i < 5; i++) {
            feed.publish("a", JobEventType.STAGE_DISPATCHED, JobState.RUNNING, "s" + i, null);
        }

        List<JobEvent> tail = feed.events("a", 3);

        assertThat(tail).extracting(JobEvent::stageId).containsExactly("s3", "s4");
        assertThat(feed.events("unknown", 0)).isEmpty();
    }

    @Test
    @DisplayName("Nothing is published after the terminal event")
    void terminalEventOnce() {
        feed.publish("a", JobEventType.STATE_CHANGED, JobState.CANCELLED, null, null);

        assertTrue(feed.publish("a", JobEventType.STATE_CHANGED, JobState.DONE, null, null).isEmpty());
        assertTrue(feed.publish("a", JobEventType.STAGE_COMPLETED, JobState.CANCELLED, "s1", null).isEmpty());
        assertThat(feed.events("a", 0)).filteredOn(JobEvent::isTerminal).hasSize(1);
    }

    @Test
    @DisplayName("Restored feed continues after the persisted sequence")
    void restoreContinues() {
        feed.restore("a", 41);

        JobEvent next = feed.publish("a", JobEventType.RECOVERED, JobState.RUNNING, null, null).orElseThrow();

        assertEquals(42, next.sequence());
    }

    @Test
    @DisplayName("Subscribers see events in order and a failing subscriber does not block others")
    void subscribers() {
        List<Long> seen = new ArrayList<>();
        Consumer<JobEvent> failing = e -> {
            throw new IllegalStateException("boom");
        };
        Consumer<JobEvent> recording = e -> seen.add(e.sequence());
        feed.subscribe("a", failing);
        feed.subscribe("a", recording);

        feed.publish("a", JobEventType.SUBMITTED, JobState.PENDING, null, null);
        feed.publish("a", JobEventType.STATE_CHANGED, JobState.COMPILING, null, null);
        feed.unsubscribe("a", recording);
        feed.publish("a", JobEventType.STATE_CHANGED, JobState.QUEUED, null, null);

        assertThat(seen).containsExactly(1L, 2L);
    }

    @Test
    @DisplayName("A forgotten job drops its log and subscribers; other jobs are untouched")
    void forgetDropsJob() {
        List<Long> seen = new ArrayList<>();
        feed.subscribe("a", e -> seen.add(e.sequence()));
        feed.publish("a", JobEventType.SUBMITTED, JobState.PENDING, null, null);
        feed.publish("b", JobEventType.SUBMITTED, JobState.PENDING, null, null);

        feed.forget("a");

        assertFalse(feed.isTracked("a"));
        assertThat(feed.events("a", 0)).isEmpty();
        assertTrue(feed.isTracked("b"));
        assertThat(feed.events("b", 0)).hasSize(1);

        feed.publish("a", JobEventType.SUBMITTED, JobState.PENDING, null, null);
        assertThat(seen).containsExactly(1L);
    }
}
