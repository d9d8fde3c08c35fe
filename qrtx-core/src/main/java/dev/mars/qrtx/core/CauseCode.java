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
 * Stable cause codes reported on jobs that end in {@link JobState#ERROR} or
 * {@link JobState#TIMEOUT}. Callers match on these codes, never on exception text.
 */
public enum CauseCode {

    NO_CANDIDATE("No resource can satisfy the stage's hard constraints"),
    RETRIES_EXHAUSTED("Stage retry budget exhausted"),
    PERMANENT_DISPATCH_FAILURE("Stage dispatch failed permanently"),
    COMPILATION_FAILED("Circuit compilation failed"),
    UNSUPPORTED_FORMAT("Payload format not supported by the target resource"),
    DEADLINE_EXCEEDED("Job deadline elapsed"),
    INTERNAL_ERROR("Internal orchestrator error");

    private final String description;

    CauseCode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
