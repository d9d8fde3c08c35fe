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

package dev.mars.qrtx.core;

/**
 * Execution state of a single stage as reported in job status summaries.
 */
public enum StageState {

    /** Dependencies still unresolved. */
    WAITING,

    /** In the ready queue. */
    READY,

    /** Ready, but every matching resource is currently busy. */
    AWAITING_RESOURCE,

    /** Dispatched to a collaborator and not yet settled. */
    RUNNING,

    /** Failed transiently, backoff timer pending. */
    RETRY_WAIT,

    COMPLETED,

    FAILED,

    /** Never dispatched because the job stopped first. */
    SKIPPED;

    public boolean isSettled() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }
}
