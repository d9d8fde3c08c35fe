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

/**
 * Reference to one checkpoint record. Sequence numbers are per job and strictly increasing.
 */
public record CheckpointRef(String jobId, String stageId, long sequence) implements Comparable<CheckpointRef> {

    private static final String SCHEME = "qfs://";
    private static final String SEGMENT = "/checkpoints/";

    public CheckpointRef {
        StorageNames.requireValidSegment(jobId, "job id");
        StorageNames.requireValidSegment(stageId, "stage id");
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be >= 0 (current: " + sequence + ")");
        }
    }

    /**
     * File name of the record: zero-padded sequence first so that names sort by sequence.
     */
    public String fileName() {
        return String.format("%010d-%s.json", sequence, stageId);
    }

    public static CheckpointRef fromFileName(String jobId, String fileName) {
        if (!fileName.endsWith(".json")) {
            throw new IllegalArgumentException("Not a checkpoint file: " + fileName);
        }
        String stem = fileName.substring(0, fileName.length() - ".json".length());
        int dash = stem.indexOf('-');
        if (dash <= 0) {
            throw new IllegalArgumentException("Not a checkpoint file: " + fileName);
        }
        return new CheckpointRef(jobId, stem.substring(dash + 1), Long.parseLong(stem.substring(0, dash)));
    }

    public String toUri() {
        return SCHEME + jobId + SEGMENT + fileName();
    }

    public static CheckpointRef parse(String uri) {
        if (uri == null || !uri.startsWith(SCHEME) || !uri.contains(SEGMENT)) {
            throw new IllegalArgumentException("Not a checkpoint reference: " + uri);
        }
        String rest = uri.substring(SCHEME.length());
        int idx = rest.indexOf(SEGMENT);
        return fromFileName(rest.substring(0, idx), rest.substring(idx + SEGMENT.length()));
    }

    @Override
    public int compareTo(CheckpointRef other) {
        return Long.compare(sequence, other.sequence);
    }

    @Override
    public String toString() {
        return toUri();
    }
}
