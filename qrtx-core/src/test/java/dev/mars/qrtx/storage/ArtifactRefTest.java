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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactRefTest {

    @Test
    void testUriRoundTrip() {
        ArtifactRef ref = new ArtifactRef("job-1", "compile", ArtifactKind.COMPILED_PAYLOAD);

        assertEquals("qfs://job-1/compile/compiled", ref.toUri());
        assertEquals(ref, ArtifactRef.parse(ref.toUri()));
    }

    @Test
    void testCheckpointFileNamesSortBySequence() {
        CheckpointRef ref = new CheckpointRef("job-1", "exec-a", 12);

        assertEquals("0000000012-exec-a.json", ref.fileName());
        assertEquals(ref, CheckpointRef.fromFileName("job-1", ref.fileName()));
        assertEquals(ref, CheckpointRef.parse(ref.toUri()));
        assertTrue(new CheckpointRef("job-1", "z", 2).fileName()
                .compareTo(new CheckpointRef("job-1", "a", 10).fileName()) < 0);
    }

    @ParameterizedTest
    @ValueSource(strings = {"../etc", "a/b", "a\\b", "..", "", "job id"})
    void testInvalidJobIdsRejected(String jobId) {
        assertThrows(IllegalArgumentException.class, () -> new ArtifactRef(jobId, "s", ArtifactKind.STAGE_OUTPUT));
    }

    @Test
    void testMalformedUriRejected() {
        assertThrows(IllegalArgumentException.class, () -> ArtifactRef.parse("s3://bucket/key"));
        assertThrows(IllegalArgumentException.class, () -> ArtifactRef.parse("qfs://job/only"));
    }
}
