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
 * An in-process classical function was unknown or rejected its inputs.
 * Re-running it with the same inputs cannot succeed.
 */
public class ClassicalEvaluationException extends QrtxException {

    private final String function;

    public ClassicalEvaluationException(String function, String message) {
        super(message);
        this.function = function;
    }

    public ClassicalEvaluationException(String function, String message, Throwable cause) {
        super(message, cause);
        this.function = function;
    }

    public String getFunction() {
        return function;
    }
}
