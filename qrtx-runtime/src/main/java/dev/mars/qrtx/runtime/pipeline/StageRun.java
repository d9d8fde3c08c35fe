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

import dev.mars.qrtx.core.StageDefinition;
import dev.mars.qrtx.core.StageState;

/**
 * Mutable execution record of one stage within a job. Touched only from the driver's context.
 */
final class StageRun {

    private final StageDefinition definition;
    private final int declarationIndex;
    private StageState state = StageState.WAITING;
    private int attempts;
    private long token;
    private String allocationId;
    private String resourceId;
    private String executionId;
    private String outputRef;
    private String checkpointRef;
    private String lastError;
    private long progressTimerId = -1;
    private long timeoutTimerId = -1;
    private boolean waitingForResource;

    StageRun(StageDefinition definition, int declarationIndex) {
        this.definition = definition;
        this.declarationIndex = declarationIndex;
    }

    String id() {
        return definition.getId();
    }

    StageDefinition definition() {
        return definition;
    }

    int declarationIndex() {
        return declarationIndex;
    }

    StageState state() {
        return state;
    }

    void setState(StageState state) {
        this.state = state;
    }

    int attempts() {
        return attempts;
    }

    void restoreCompleted(int attempts, String outputRef, String checkpointRef) {
        this.attempts = attempts;
        this.outputRef = outputRef;
        this.checkpointRef = checkpointRef;
        this.state = StageState.COMPLETED;
    }

    /**
     * Start a new attempt and return its token. Results carrying an older token are stale.
     */
    long beginAttempt(String allocationId, String resourceId, String executionId) {
        attempts++;
        token++;
        this.allocationId = allocationId;
        this.resourceId = resourceId;
        this.executionId = executionId;
        this.state = StageState.RUNNING;
        this.waitingForResource = false;
        return token;
    }

    /**
     * Mark the stage as queued behind busy resources.
     *
     * @return true on the first call since the last dispatched attempt
     */
    boolean startWaitingForResource() {
        boolean first = !waitingForResource;
        waitingForResource = true;
        return first;
    }

    long token() {
        return token;
    }

    /**
     * Detach the in-flight attempt so its eventual result is ignored.
     */
    void abandonAttempt() {
        token++;
    }

    String allocationId() {
        return allocationId;
    }

    String resourceId() {
        return resourceId;
    }

    String executionId() {
        return executionId;
    }

    String outputRef() {
        return outputRef;
    }

    void setOutputRef(String outputRef) {
        this.outputRef = outputRef;
    }

    String checkpointRef() {
        return checkpointRef;
    }

    void setCheckpointRef(String checkpointRef) {
        this.checkpointRef = checkpointRef;
    }

    String lastError() {
        return lastError;
    }

    void setLastError(String lastError) {
        this.lastError = lastError;
    }

    long progressTimerId() {
        return progressTimerId;
    }

    void setProgressTimerId(long progressTimerId) {
        this.progressTimerId = progressTimerId;
    }

    long timeoutTimerId() {
        return timeoutTimerId;
    }

    void setTimeoutTimerId(long timeoutTimerId) {
        this.timeoutTimerId = timeoutTimerId;
    }

    StageSummary summary() {
        return new StageSummary(id(), definition.getKind(), state, attempts, resourceId, outputRef, checkpointRef, lastError);
    }
}
