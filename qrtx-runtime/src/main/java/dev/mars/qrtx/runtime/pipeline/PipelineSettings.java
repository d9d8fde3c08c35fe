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

package dev.mars.qrtx.runtime.pipeline;

import dev.mars.qrtx.config.QrtxConfiguration;
import dev.mars.qrtx.core.RetryPolicy;

/**
 * Driver tuning.
 *
 * @param maxInflightStages     stage attempts in flight across all jobs
 * @param requeueIntervalMs     delay before a stage waiting for a free resource tries again,
 *                              also the lease expiry sweep period
 * @param defaultDeadlineMs     job watchdog deadline when the submitter gives none, 0 disables it
 * @param checkpointIntervalMs  period of progress checkpoints for in-flight stages, 0 disables them
 * @param defaultRetry          retry policy of stages that declare none
 * @param stageTimeoutMs        limit on one stage attempt, 0 disables it
 * @param stopGraceMs           wait for in-flight stages of a stopping job before abandoning them
 * @param retentionMs           time a terminal job is kept in memory
 */
public record PipelineSettings(int maxInflightStages, long requeueIntervalMs, long defaultDeadlineMs,
                               long checkpointIntervalMs, RetryPolicy defaultRetry, long stageTimeoutMs,
                               long stopGraceMs, long retentionMs) {

    public PipelineSettings {
        if (maxInflightStages <= 0) {
            throw new IllegalArgumentException("maxInflightStages must be positive");
        }
        if (requeueIntervalMs <= 0) {
            throw new IllegalArgumentException("requeueIntervalMs must be positive");
        }
        if (defaultDeadlineMs < 0 || checkpointIntervalMs < 0) {
            throw new IllegalArgumentException("deadline and checkpoint interval must be >= 0");
        }
        if (stageTimeoutMs < 0 || retentionMs < 0) {
            throw new IllegalArgumentException("stage timeout and retention must be >= 0");
        }
        if (stopGraceMs <= 0) {
            throw new IllegalArgumentException("stopGraceMs must be positive");
        }
    }

    public static PipelineSettings fromConfiguration(QrtxConfiguration config) {
        return new PipelineSettings(config.getMaxInflightStages(), config.getRequeueIntervalMs(),
                config.getDefaultJobDeadlineMs(), config.getCheckpointIntervalMs(), config.getDefaultRetryPolicy(),
                config.getStageTimeoutMs(), config.getStopGraceMs(), config.getJobRetentionMs());
    }
}
