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

package com.linecorp.resilient.client;

import java.util.OptionalLong;

import com.linecorp.resilient.client.circuitbreaker.CircuitState;
import com.linecorp.resilient.client.circuitbreaker.EventCount;

/**
 * An immutable snapshot of the failure-tracking state of a {@link ResilientClient}, for example
 * to be exported as metrics.
 */
public final class ResilienceState {

    private final int failureStreak;

    private final OptionalLong circuitOpenUntil;

    private final boolean circuitOpen;

    private final CircuitState circuitState;

    private final int maxRetries;

    private final EventCount eventCount;

    ResilienceState(int failureStreak, OptionalLong circuitOpenUntil, boolean circuitOpen,
                    CircuitState circuitState, int maxRetries, EventCount eventCount) {
        this.failureStreak = failureStreak;
        this.circuitOpenUntil = circuitOpenUntil;
        this.circuitOpen = circuitOpen;
        this.circuitState = circuitState;
        this.maxRetries = maxRetries;
        this.eventCount = eventCount;
    }

    /**
     * Returns the number of consecutive failures since the last success or the last time the circuit
     * opened.
     */
    public int failureStreak() {
        return failureStreak;
    }

    /**
     * Returns the monotonic time in nanoseconds until which the circuit stays open, or an empty
     * value if it is not open. The value may lie in the past if no request has been made since the
     * cooldown expired.
     */
    public OptionalLong circuitOpenUntil() {
        return circuitOpenUntil;
    }

    /**
     * Returns whether the circuit was open when this snapshot was taken. A circuit whose cooldown
     * has expired is not open even if no request has observed the expiry yet.
     */
    public boolean isCircuitOpen() {
        return circuitOpen;
    }

    public CircuitState circuitState() {
        return circuitState;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public EventCount eventCount() {
        return eventCount;
    }

    @Override
    public String toString() {
        return "ResilienceState{" +
               "failureStreak=" + failureStreak +
               ", circuitOpenUntil=" + circuitOpenUntil +
               ", circuitOpen=" + circuitOpen +
               ", circuitState=" + circuitState +
               ", maxRetries=" + maxRetries +
               ", eventCount=" + eventCount +
               '}';
    }
}
