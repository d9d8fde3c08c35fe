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

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Checksums over in-memory artifact bytes.
 * Supports SHA-256 by default with options for other algorithms.
 */
public class ChecksumCalculator {
    private static final String DEFAULT_ALGORITHM = "SHA-256";

    private final String algorithm;

    public ChecksumCalculator() {
        this(DEFAULT_ALGORITHM);
    }

    public ChecksumCalculator(String algorithm) {
        if (!isAlgorithmSupported(algorithm)) {
            throw new IllegalArgumentException("Unsupported checksum algorithm: " + algorithm);
        }
        this.algorithm = algorithm;
    }

    /**
     * Hex-encoded digest of the given bytes.
     */
    public String checksum(byte[] data) {
        try {
            return bytesToHex(MessageDigest.getInstance(algorithm).digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Checksum algorithm disappeared: " + algorithm, e);
        }
    }

    /**
     * Verify the bytes against an expected checksum.
     * A blank expectation never matches: a record without a checksum is not verifiable.
     */
    public boolean verify(byte[] data, String expectedChecksum) {
        if (expectedChecksum == null || expectedChecksum.isBlank()) {
            return false;
        }
        return expectedChecksum.equalsIgnoreCase(checksum(data));
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public static boolean isAlgorithmSupported(String algorithm) {
        if (algorithm == null) {
            return false;
        }
        try {
            MessageDigest.getInstance(algorithm);
            return true;
        } catch (NoSuchAlgorithmException e) {
            return false;
        }
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder result = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }

    @Override
    public String toString() {
        return "ChecksumCalculator{algorithm='" + algorithm + "'}";
    }
}
