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

package dev.mars.qrtx.storage;

import java.util.regex.Pattern;

/**
 * Validation of job and stage identifiers used as storage path segments.
 */
public final class StorageNames {

    /** Stage id under which job-scoped artifacts (record, graph, job-level errors) are stored. */
    public static final String JOB_SCOPE = "_job";

    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9_.:-]+");

    private StorageNames() {
    }

    /**
     * @throws IllegalArgumentException if the segment is empty, contains a path separator,
     *                                  is a relative path component, or uses other characters
     */
    public static String requireValidSegment(String segment, String what) {
        if (segment == null || segment.isEmpty()) {
            throw new IllegalArgumentException(what + " cannot be empty");
        }
        if (segment.contains("/") || segment.contains("\\") || segment.contains("..")) {
            throw new IllegalArgumentException("Invalid " + what + " (path traversal): " + segment);
        }
        if (!ALLOWED.matcher(segment).matches()) {
            throw new IllegalArgumentException("Invalid " + what + ": " + segment);
        }
        return segment;
    }
}
