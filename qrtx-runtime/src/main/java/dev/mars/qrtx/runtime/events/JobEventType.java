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

/**
 * Kinds of entries in a job's event feed.
 */
public enum JobEventType {
    SUBMITTED,
    RECOVERED,
    STATE_CHANGED,
    STAGE_DISPATCHED,
    STAGE_AWAITING_RESOURCE,
    STAGE_RETRY_SCHEDULED,
    STAGE_COMPLETED,
    STAGE_FAILED,
    CHECKPOINT_WRITTEN,
    CANCEL_REQUESTED
}
