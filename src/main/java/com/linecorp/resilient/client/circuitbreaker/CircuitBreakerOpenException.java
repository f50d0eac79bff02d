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

import static java.util.Objects.requireNonNull;

import java.time.Duration;

import com.linecorp.resilient.client.ResilientClientException;

/**
 * Raised when a request is refused because the circuit is open.
 * No network call has been attempted when this exception is raised.
 */
public final class CircuitBreakerOpenException extends ResilientClientException {

    private static final long serialVersionUID = 4613084567120365921L;

    private final String remoteServiceName;

    private final Duration remaining;

    public CircuitBreakerOpenException(String remoteServiceName, Duration remaining) {
        super("circuit breaker is open for " + remoteServiceName + " (retry in " +
              requireNonNull(remaining, "remaining").toMillis() / 1000.0 + "s)");
        this.remoteServiceName = requireNonNull(remoteServiceName, "remoteServiceName");
        this.remaining = remaining;
    }

    public String getRemoteServiceName() {
        return remoteServiceName;
    }

    /**
     * Returns the remaining cooldown of the open circuit. {@link Duration#ZERO} means the cooldown
     * has expired but another trial request is in progress.
     */
    public Duration getRemaining() {
        return remaining;
    }

    public double getRemainingSeconds() {
        return remaining.toNanos() / 1e9;
    }
}
