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

package dev.mars.qrtx.core.exceptions;

/**
 * Raised by the scheduling engine when a stage cannot be placed on any resource.
 *
 * <p>The {@link Reason} separates a queueing condition (a matching resource exists
 * but none is free right now) from a fatal one (no registered resource could ever
 * satisfy the stage's hard constraints).</p>
 */
public class NoCandidateException extends QrtxException {

    public enum Reason {
        /** At least one resource satisfies the hard constraints but all of them are busy or offline. */
        NONE_FREE,
        /** No non-retired resource satisfies the hard constraints. */
        UNSATISFIABLE
    }

    private final String stageId;
    private final Reason reason;

    public NoCandidateException(String stageId, Reason reason, String message) {
        super(message);
        this.stageId = stageId;
        this.reason = reason;
    }

    public String getStageId() {
        return stageId;
    }

    public Reason getReason() {
        return reason;
    }

    public boolean isRetryable() {
        return reason == Reason.NONE_FREE;
    }
}
