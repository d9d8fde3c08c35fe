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

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ChecksumCalculatorTest {

    @Test
    void testKnownSha256() {
        ChecksumCalculator calculator = new ChecksumCalculator();

        assertEquals("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824",
                calculator.checksum("hello".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testVerify() {
        ChecksumCalculator calculator = new ChecksumCalculator("SHA-256");
        byte[] data = "counts".getBytes(StandardCharsets.UTF_8);
        String checksum = calculator.checksum(data);

        assertTrue(calculator.verify(data, checksum));
        assertTrue(calculator.verify(data, checksum.toUpperCase()));
        assertFalse(calculator.verify("tampered".getBytes(StandardCharsets.UTF_8), checksum));
        assertFalse(calculator.verify(data, null));
    }

    @Test
    void testUnsupportedAlgorithm() {
        assertFalse(ChecksumCalculator.isAlgorithmSupported("ROT13"));
        assertThrows(IllegalArgumentException.class, () -> new ChecksumCalculator("ROT13"));
    }
}
