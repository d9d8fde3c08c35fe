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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void testExponentialDelays() {
        RetryPolicy policy = new RetryPolicy(5, 100, 2.0, 10_000);

        assertEquals(100, policy.delayForAttempt(1));
        assertEquals(200, policy.delayForAttempt(2));
        assertEquals(400, policy.delayForAttempt(3));
        assertEquals(800, policy.delayForAttempt(4));
    }

    @Test
    void testDelayIsCappedAtMaximum() {
        RetryPolicy policy = new RetryPolicy(50, 1000, 3.0, 5000);

        assertEquals(5000, policy.delayForAttempt(3));
        assertEquals(5000, policy.delayForAttempt(40));
    }

    @Test
    void testJitterStaysWithinBounds() {
        RetryPolicy policy = new RetryPolicy(5, 1000, 2.0, 60_000, 0.5);

        for (int i = 0; i < 100; i++) {
            long delay = policy.delayForAttempt(2);
            assertTrue(delay >= 2000 && delay <= 3000, "delay out of range: " + delay);
        }
    }

    @Test
    void testAttemptsRemainingCountsFirstDispatch() {
        RetryPolicy policy = new RetryPolicy(3, 10, 2.0, 100);

        assertTrue(policy.hasAttemptsRemaining(0));
        assertTrue(policy.hasAttemptsRemaining(2));
        assertFalse(policy.hasAttemptsRemaining(3));
        assertFalse(RetryPolicy.NONE.hasAttemptsRemaining(1));
    }

    @Test
    void testInvalidParametersRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 10, 2.0, 100));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, -1, 2.0, 100));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, 10, 0.5, 100));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, 200, 2.0, 100));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(3, 10, 2.0, 100, 1.5));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.DEFAULT.delayForAttempt(0));
    }
}
