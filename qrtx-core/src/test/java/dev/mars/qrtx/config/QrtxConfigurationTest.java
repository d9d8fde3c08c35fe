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

package dev.mars.qrtx.config;

import dev.mars.qrtx.core.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class QrtxConfigurationTest {

    @Test
    void testDefaults() {
        QrtxConfiguration config = new QrtxConfiguration(new Properties());

        assertEquals("first-fit", config.getSchedulerPolicy());
        assertEquals(3, config.getRetryMaxAttempts());
        assertEquals(3.0, config.getLeaseFactor());
        assertEquals("SHA-256", config.getChecksumAlgorithm());
        assertEquals(0, config.getCheckpointIntervalMs());
        assertEquals(600_000, config.getStageTimeoutMs());
        assertEquals(30_000, config.getStopGraceMs());
        assertEquals(600_000, config.getJobRetentionMs());
    }

    @Test
    void testOverrides() {
        Properties props = new Properties();
        props.setProperty(QrtxConfiguration.SCHEDULER_POLICY, "quality-aware");
        props.setProperty(QrtxConfiguration.RETRY_MAX_ATTEMPTS, "5");
        props.setProperty(QrtxConfiguration.RETRY_INITIAL_BACKOFF_MS, "20");
        props.setProperty(QrtxConfiguration.RETRY_MAX_BACKOFF_MS, "200");

        QrtxConfiguration config = new QrtxConfiguration(props);
        RetryPolicy policy = config.getDefaultRetryPolicy();

        assertEquals("quality-aware", config.getSchedulerPolicy());
        assertEquals(5, policy.maxAttempts());
        assertEquals(20, policy.initialBackoffMs());
        assertEquals(200, policy.maxBackoffMs());
    }

    @Test
    void testMalformedValuesFallBackToDefaults() {
        Properties props = new Properties();
        props.setProperty(QrtxConfiguration.PIPELINE_MAX_INFLIGHT, "lots");
        props.setProperty(QrtxConfiguration.SCHEDULER_LEASE_FACTOR, "x1.5");

        QrtxConfiguration config = new QrtxConfiguration(props);

        assertEquals(64, config.getMaxInflightStages());
        assertEquals(3.0, config.getLeaseFactor());
    }

    @Test
    void testInconsistentRetryConfigurationUsesDefaultPolicy() {
        Properties props = new Properties();
        props.setProperty(QrtxConfiguration.RETRY_MAX_ATTEMPTS, "0");

        assertEquals(RetryPolicy.DEFAULT, new QrtxConfiguration(props).getDefaultRetryPolicy());
    }
}
