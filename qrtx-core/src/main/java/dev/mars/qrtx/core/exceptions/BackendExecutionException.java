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
 * Failure reported by a backend executor for one circuit execution.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public class BackendExecutionException extends QrtxException {

    private final ExecutionFailureCause cause;
    private final String resourceId;

    public BackendExecutionException(ExecutionFailureCause cause, String resourceId, String message) {
        super(message);
        this.cause = cause;
        this.resourceId = resourceId;
    }

    public BackendExecutionException(ExecutionFailureCause cause, String resourceId, String message,
                                     Throwable throwable) {
        super(message, throwable);
        this.cause = cause;
        this.resourceId = resourceId;
    }

    public ExecutionFailureCause getFailureCause() {
        return cause;
    }

    public String getResourceId() {
        return resourceId;
    }
}
