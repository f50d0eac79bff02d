/*
 * Copyright 2026 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package com.linecorp.resilient.client.retry;

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter.
 *
 * <pre>
 * delay(attempt) = factor * 2^attempt + random(0, jitter)
 * </pre>
 * where {@code attempt} is the zero-based index of the attempt that has just failed.
 */
public final class Backoff {

    private final long factorNanos;

    private final long jitterNanos;

    public Backoff(Duration factor, Duration jitter) {
        requireNonNull(factor, "factor");
        requireNonNull(jitter, "jitter");
        if (factor.isNegative()) {
            throw new IllegalArgumentException("factor must not be negative");
        }
        if (jitter.isNegative()) {
            throw new IllegalArgumentException("jitter must not be negative");
        }
        factorNanos = factor.toNanos();
        jitterNanos = jitter.toNanos();
    }

    /**
     * Returns the delay in nanoseconds before the attempt following {@code attempt}.
     * The result lies in {@code [factor * 2^attempt, factor * 2^attempt + jitter]},
     * saturated at {@link Long#MAX_VALUE}.
     */
    public long delayNanos(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt: " + attempt + " (expected: >= 0)");
        }
        final long exponential = exponentialNanos(attempt);
        final long jitter = jitterNanos == 0 ? 0 : ThreadLocalRandom.current().nextLong(jitterNanos + 1);
        final long delay = exponential + jitter;
        // overflow
        return delay < exponential ? Long.MAX_VALUE : delay;
    }

    private long exponentialNanos(int attempt) {
        if (factorNanos == 0) {
            return 0;
        }
        if (attempt >= Long.numberOfLeadingZeros(factorNanos)) {
            return Long.MAX_VALUE;
        }
        return factorNanos << attempt;
    }

    public Duration factor() {
        return Duration.ofNanos(factorNanos);
    }

    public Duration jitter() {
        return Duration.ofNanos(jitterNanos);
    }

    @Override
    public String toString() {
        return "Backoff{factor=" + factor() + ", jitter=" + jitter() + '}';
    }
}
