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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Configuration of the orchestration kernel.
 *
 * <p>Values are layered: built-in defaults, then the first readable {@code qrtx.properties}
 * found on disk or the classpath, then {@code qrtx.*} system properties. Typed getters log a
 * warning and fall back to the default when a value cannot be parsed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 * @version 1.0
 */
public class QrtxConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(QrtxConfiguration.class);

    public static final String SCHEDULER_POLICY = "qrtx.scheduler.policy";
    public static final String SCHEDULER_REQUEUE_INTERVAL_MS = "qrtx.scheduler.requeue.interval.ms";
    public static final String SCHEDULER_LEASE_FACTOR = "qrtx.scheduler.lease.factor";
    public static final String PIPELINE_MAX_INFLIGHT = "qrtx.pipeline.max.inflight";
    public static final String PIPELINE_STAGE_TIMEOUT_MS = "qrtx.pipeline.stage.timeout.ms";
    public static final String PIPELINE_STOP_GRACE_MS = "qrtx.pipeline.stop.grace.ms";
    public static final String JOB_DEFAULT_DEADLINE_MS = "qrtx.job.default.deadline.ms";
    public static final String JOB_RETENTION_MS = "qrtx.job.retention.ms";
    public static final String RETRY_MAX_ATTEMPTS = "qrtx.retry.max.attempts";
    public static final String RETRY_INITIAL_BACKOFF_MS = "qrtx.retry.initial.backoff.ms";
    public static final String RETRY_MULTIPLIER = "qrtx.retry.multiplier";
    public static final String RETRY_MAX_BACKOFF_MS = "qrtx.retry.max.backoff.ms";
    public static final String CHECKPOINT_INTERVAL_MS = "qrtx.checkpoint.interval.ms";
    public static final String STORAGE_ROOT = "qrtx.storage.root";
    public static final String STORAGE_CHECKSUM_ALGORITHM = "qrtx.storage.checksum.algorithm";
    public static final String SHUTDOWN_DRAIN_TIMEOUT_MS = "qrtx.shutdown.drain.timeout.ms";
    public static final String SHUTDOWN_TIMEOUT_MS = "qrtx.shutdown.timeout.ms";
    public static final String POLICY_WEIGHT_QUEUE_DEPTH = "qrtx.policy.weight.queue.depth";
    public static final String POLICY_WEIGHT_CALIBRATION = "qrtx.policy.weight.calibration";
    public static final String POLICY_WEIGHT_SUCCESS_RATE = "qrtx.policy.weight.success.rate";
    public static final String POLICY_CALIBRATION_HORIZON_MS = "qrtx.policy.calibration.horizon.ms";

    // Default configuration values
    private static final String DEFAULT_SCHEDULER_POLICY = "first-fit";
    private static final long DEFAULT_REQUEUE_INTERVAL_MS = 1000;
    private static final double DEFAULT_LEASE_FACTOR = 3.0;
    private static final int DEFAULT_MAX_INFLIGHT = 64;
    private static final long DEFAULT_STAGE_TIMEOUT_MS = 600_000; // 10 minutes
    private static final long DEFAULT_STOP_GRACE_MS = 30_000;
    private static final long DEFAULT_JOB_DEADLINE_MS = 3_600_000; // 1 hour
    private static final long DEFAULT_JOB_RETENTION_MS = 600_000;
    private static final int DEFAULT_RETRY_MAX_ATTEMPTS = 3;
    private static final long DEFAULT_RETRY_INITIAL_BACKOFF_MS = 500;
    private static final double DEFAULT_RETRY_MULTIPLIER = 2.0;
    private static final long DEFAULT_RETRY_MAX_BACKOFF_MS = 30_000;
    private static final long DEFAULT_CHECKPOINT_INTERVAL_MS = 0; // disabled
    private static final String DEFAULT_CHECKSUM_ALGORITHM = "SHA-256";
    private static final long DEFAULT_SHUTDOWN_DRAIN_TIMEOUT_MS = 30_000;
    private static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 60_000;
    private static final double DEFAULT_WEIGHT_QUEUE_DEPTH = 0.4;
    private static final double DEFAULT_WEIGHT_CALIBRATION = 0.3;
    private static final double DEFAULT_WEIGHT_SUCCESS_RATE = 0.3;
    private static final long DEFAULT_CALIBRATION_HORIZON_MS = 86_400_000; // 24 hours

    private final Properties properties;

    public QrtxConfiguration() {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromFile();
        loadConfigurationFromSystemProperties();
    }

    public QrtxConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Scheduler
    public String getSchedulerPolicy() {
        return getStringProperty(SCHEDULER_POLICY, DEFAULT_SCHEDULER_POLICY);
    }

    public long getRequeueIntervalMs() {
        return getLongProperty(SCHEDULER_REQUEUE_INTERVAL_MS, DEFAULT_REQUEUE_INTERVAL_MS);
    }

    public double getLeaseFactor() {
        return getDoubleProperty(SCHEDULER_LEASE_FACTOR, DEFAULT_LEASE_FACTOR);
    }

    public double getQueueDepthWeight() {
        return getDoubleProperty(POLICY_WEIGHT_QUEUE_DEPTH, DEFAULT_WEIGHT_QUEUE_DEPTH);
    }

    public double getCalibrationWeight() {
        return getDoubleProperty(POLICY_WEIGHT_CALIBRATION, DEFAULT_WEIGHT_CALIBRATION);
    }

    public double getSuccessRateWeight() {
        return getDoubleProperty(POLICY_WEIGHT_SUCCESS_RATE, DEFAULT_WEIGHT_SUCCESS_RATE);
    }

    public long getCalibrationHorizonMs() {
        return getLongProperty(POLICY_CALIBRATION_HORIZON_MS, DEFAULT_CALIBRATION_HORIZON_MS);
    }

    // Pipeline
    public int getMaxInflightStages() {
        return getIntProperty(PIPELINE_MAX_INFLIGHT, DEFAULT_MAX_INFLIGHT);
    }

    /**
     * Longest a single stage attempt may wait on its collaborator before it is abandoned as a
     * transient failure. 0 disables the limit.
     */
    public long getStageTimeoutMs() {
        return getLongProperty(PIPELINE_STAGE_TIMEOUT_MS, DEFAULT_STAGE_TIMEOUT_MS);
    }

    /**
     * How long a cancelled, failed or timed-out job waits for in-flight stages before it gives
     * up on them.
     */
    public long getStopGraceMs() {
        return getLongProperty(PIPELINE_STOP_GRACE_MS, DEFAULT_STOP_GRACE_MS);
    }

    public long getDefaultJobDeadlineMs() {
        return getLongProperty(JOB_DEFAULT_DEADLINE_MS, DEFAULT_JOB_DEADLINE_MS);
    }

    /**
     * How long a terminal job stays in memory for status, results and event replay.
     */
    public long getJobRetentionMs() {
        return getLongProperty(JOB_RETENTION_MS, DEFAULT_JOB_RETENTION_MS);
    }

    // Retry
    public int getRetryMaxAttempts() {
        return getIntProperty(RETRY_MAX_ATTEMPTS, DEFAULT_RETRY_MAX_ATTEMPTS);
    }

    public long getRetryInitialBackoffMs() {
        return getLongProperty(RETRY_INITIAL_BACKOFF_MS, DEFAULT_RETRY_INITIAL_BACKOFF_MS);
    }

    public double getRetryMultiplier() {
        return getDoubleProperty(RETRY_MULTIPLIER, DEFAULT_RETRY_MULTIPLIER);
    }

    public long getRetryMaxBackoffMs() {
        return getLongProperty(RETRY_MAX_BACKOFF_MS, DEFAULT_RETRY_MAX_BACKOFF_MS);
    }

    /**
     * Retry policy applied to stages that declare none.
     * Falls back to {@link RetryPolicy#DEFAULT} if the configured values are inconsistent.
     */
    public RetryPolicy getDefaultRetryPolicy() {
        try {
            return new RetryPolicy(getRetryMaxAttempts(), getRetryInitialBackoffMs(),
                    getRetryMultiplier(), getRetryMaxBackoffMs());
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid retry configuration ({}). Using default: {}", e.getMessage(), RetryPolicy.DEFAULT);
            return RetryPolicy.DEFAULT;
        }
    }

    // Checkpoints and storage
    public long getCheckpointIntervalMs() {
        return getLongProperty(CHECKPOINT_INTERVAL_MS, DEFAULT_CHECKPOINT_INTERVAL_MS);
    }

    public String getStorageRoot() {
        return getStringProperty(STORAGE_ROOT, Paths.get(System.getProperty("java.io.tmpdir"), "qrtx").toString());
    }

    public String getChecksumAlgorithm() {
        return getStringProperty(STORAGE_CHECKSUM_ALGORITHM, DEFAULT_CHECKSUM_ALGORITHM);
    }

    // Shutdown
    public long getShutdownDrainTimeoutMs() {
        return getLongProperty(SHUTDOWN_DRAIN_TIMEOUT_MS, DEFAULT_SHUTDOWN_DRAIN_TIMEOUT_MS);
    }

    public long getShutdownTimeoutMs() {
        return getLongProperty(SHUTDOWN_TIMEOUT_MS, DEFAULT_SHUTDOWN_TIMEOUT_MS);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    // Utility methods for type conversion
    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private double getDoubleProperty(String key, double defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid decimal value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(SCHEDULER_POLICY, DEFAULT_SCHEDULER_POLICY);
        properties.setProperty(SCHEDULER_REQUEUE_INTERVAL_MS, String.valueOf(DEFAULT_REQUEUE_INTERVAL_MS));
        properties.setProperty(SCHEDULER_LEASE_FACTOR, String.valueOf(DEFAULT_LEASE_FACTOR));
        properties.setProperty(PIPELINE_MAX_INFLIGHT, String.valueOf(DEFAULT_MAX_INFLIGHT));
        properties.setProperty(PIPELINE_STAGE_TIMEOUT_MS, String.valueOf(DEFAULT_STAGE_TIMEOUT_MS));
        properties.setProperty(PIPELINE_STOP_GRACE_MS, String.valueOf(DEFAULT_STOP_GRACE_MS));
        properties.setProperty(JOB_DEFAULT_DEADLINE_MS, String.valueOf(DEFAULT_JOB_DEADLINE_MS));
        properties.setProperty(JOB_RETENTION_MS, String.valueOf(DEFAULT_JOB_RETENTION_MS));
        properties.setProperty(RETRY_MAX_ATTEMPTS, String.valueOf(DEFAULT_RETRY_MAX_ATTEMPTS));
        properties.setProperty(RETRY_INITIAL_BACKOFF_MS, String.valueOf(DEFAULT_RETRY_INITIAL_BACKOFF_MS));
        properties.setProperty(RETRY_MULTIPLIER, String.valueOf(DEFAULT_RETRY_MULTIPLIER));
        properties.setProperty(RETRY_MAX_BACKOFF_MS, String.valueOf(DEFAULT_RETRY_MAX_BACKOFF_MS));
        properties.setProperty(CHECKPOINT_INTERVAL_MS, String.valueOf(DEFAULT_CHECKPOINT_INTERVAL_MS));
        properties.setProperty(STORAGE_CHECKSUM_ALGORITHM, DEFAULT_CHECKSUM_ALGORITHM);
        properties.setProperty(SHUTDOWN_DRAIN_TIMEOUT_MS, String.valueOf(DEFAULT_SHUTDOWN_DRAIN_TIMEOUT_MS));
        properties.setProperty(SHUTDOWN_TIMEOUT_MS, String.valueOf(DEFAULT_SHUTDOWN_TIMEOUT_MS));
        properties.setProperty(POLICY_WEIGHT_QUEUE_DEPTH, String.valueOf(DEFAULT_WEIGHT_QUEUE_DEPTH));
        properties.setProperty(POLICY_WEIGHT_CALIBRATION, String.valueOf(DEFAULT_WEIGHT_CALIBRATION));
        properties.setProperty(POLICY_WEIGHT_SUCCESS_RATE, String.valueOf(DEFAULT_WEIGHT_SUCCESS_RATE));
        properties.setProperty(POLICY_CALIBRATION_HORIZON_MS, String.valueOf(DEFAULT_CALIBRATION_HORIZON_MS));
    }

    private void loadConfigurationFromFile() {
        String[] configFiles = {
                "qrtx.properties",
                "config/qrtx.properties",
                System.getProperty("user.home") + "/.qrtx/qrtx.properties",
                "/etc/qrtx/qrtx.properties"
        };

        for (String configFile : configFiles) {
            Path configPath = Paths.get(configFile);
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }

        try (InputStream input = getClass().getClassLoader().getResourceAsStream("qrtx.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("qrtx."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "QrtxConfiguration{" +
                "schedulerPolicy='" + getSchedulerPolicy() + '\'' +
                ", maxInflightStages=" + getMaxInflightStages() +
                ", defaultRetryPolicy=" + getDefaultRetryPolicy() +
                ", checkpointIntervalMs=" + getCheckpointIntervalMs() +
                '}';
    }
}
