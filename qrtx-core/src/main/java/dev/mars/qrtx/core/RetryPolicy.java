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

import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded exponential backoff for one stage.
 *
 * <pre>
 * delay(n) = min(initialBackoffMs * multiplier^(n-1) + jitter, maxBackoffMs)
 * jitter   = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p>{@code maxAttempts} counts every dispatch including the first, so a policy with
 * {@code maxAttempts = 3} allows two retries.</p>
 *
 * @param maxAttempts      total dispatch attempts allowed, at least 1
 * @param initialBackoffMs delay before the first retry
 * @param multiplier       growth factor between consecutive retries, at least 1.0
 * @param maxBackoffMs     upper bound on any single delay
 * @param jitterFactor     random spread in {@code [0.0, 1.0]}, 0 disables jitter
 */
public record RetryPolicy(int maxAttempts, long initialBackoffMs, double multiplier,
                          long maxBackoffMs, double jitterFactor) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, 500, 2.0, 30_000, 0.0);

    /** A single attempt with no retries. */
    public static final RetryPolicy NONE = new RetryPolicy(1, 0, 1.0, 0, 0.0);

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1 (current: " + maxAttempts + ")");
        }
        if (initialBackoffMs < 0) {
            throw new IllegalArgumentException("initialBackoffMs must be >= 0 (current: " + initialBackoffMs + ")");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0 (current: " + multiplier + ")");
        }
        if (maxBackoffMs < initialBackoffMs) {
            throw new IllegalArgumentException(
                    "maxBackoffMs must be >= initialBackoffMs (initial: " + initialBackoffMs + ", max: " + maxBackoffMs + ")");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")");
        }
    }

    public RetryPolicy(int maxAttempts, long initialBackoffMs, double multiplier, long maxBackoffMs) {
        this(maxAttempts, initialBackoffMs, multiplier, maxBackoffMs, 0.0);
    }

    /**
     * @param attemptsMade dispatches already made for the stage
     * @return true if another dispatch is allowed
     */
    public boolean hasAttemptsRemaining(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    /**
     * Delay to wait before the next dispatch, after {@code failedAttempts} failures.
     *
     * @param failedAttempts failures so far, starting at 1
     * @return delay in milliseconds
     */
    public long delayForAttempt(int failedAttempts) {
        if (failedAttempts <= 0) {
            throw new IllegalArgumentException("failedAttempts must be positive (current: " + failedAttempts + ")");
        }
        double raw = initialBackoffMs * Math.pow(multiplier, failedAttempts - 1);
        long exponential = (long) Math.min(raw, (double) maxBackoffMs);
        long jitter = jitterFactor == 0.0 ? 0
                : (long) (exponential * jitterFactor * ThreadLocalRandom.current().nextDouble());
        return Math.min(exponential + jitter, maxBackoffMs);
    }
}
