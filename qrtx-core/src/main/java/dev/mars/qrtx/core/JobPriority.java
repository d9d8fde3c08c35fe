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
 * Priority of a job in the global ready queue.
 * Ready stages of higher priority jobs are dispatched first; within one priority level
 * stages are ordered by topological rank and then by arrival.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-19
 */
public enum JobPriority {

    /** Background work, dispatched when nothing more urgent is ready. */
    LOW(1),

    /** The default priority level. */
    NORMAL(5),

    /** Expedited experiments. */
    HIGH(8),

    /** Calibration or recovery runs that must go first. */
    CRITICAL(10);

    private final int value;

    JobPriority(int value) {
        this.value = value;
    }

    /**
     * Numeric value; higher values indicate higher priority.
     */
    public int getValue() {
        return value;
    }

    public boolean isHigherThan(JobPriority other) {
        return this.value > other.value;
    }

    /**
     * Parse a priority from a string, case-insensitively.
     *
     * @param value the name, or null
     * @return the matching priority, {@link #NORMAL} when null or unknown
     */
    public static JobPriority fromString(String value) {
        if (value == null) {
            return NORMAL;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return NORMAL;
        }
    }
}
