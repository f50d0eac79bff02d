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

package com.linecorp.resilient.client.circuitbreaker;

/**
 * An immutable object that stores the cumulative count of events seen by a {@link CircuitBreaker}.
 */
public final class EventCount {

    public static final EventCount ZERO = new EventCount(0, 0, 0);

    private final long success;

    private final long failure;

    private final long rejected;

    EventCount(long success, long failure, long rejected) {
        assert 0 <= success;
        assert 0 <= failure;
        assert 0 <= rejected;
        this.success = success;
        this.failure = failure;
        this.rejected = rejected;
    }

    public long success() {
        return success;
    }

    public long failure() {
        return failure;
    }

    /**
     * Returns the number of requests refused without calling the remote service.
     */
    public long rejected() {
        return rejected;
    }

    /**
     * Returns the number of requests whose outcome reached the remote service.
     */
    public long total() {
        return success + failure;
    }

    public double failureRate() {
        final long total = total();
        return total == 0 ? 0 : failure / (double) total;
    }

    @Override
    public String toString() {
        return "EventCount{" +
               "success=" + success +
               ", failure=" + failure +
               ", rejected=" + rejected +
               '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final EventCount that = (EventCount) o;
        return success == that.success && failure == that.failure && rejected == that.rejected;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(success) * 31 * 31 + Long.hashCode(failure) * 31 + Long.hashCode(rejected);
    }
}
