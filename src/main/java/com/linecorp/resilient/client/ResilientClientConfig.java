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

import java.time.Duration;
import java.util.Collections;
import java.util.Map;

import com.linecorp.resilient.client.circuitbreaker.Clock;
import com.linecorp.resilient.client.circuitbreaker.HalfOpenPolicy;
import com.linecorp.resilient.client.retry.RetryPolicy;

/**
 * Stores configurations of a {@link ResilientClient}.
 */
public final class ResilientClientConfig {

    private final String baseUri;

    private final String remoteServiceName;

    private final Duration timeout;

    private final Map<String, String> defaultHeaders;

    private final int maxRetries;

    private final Duration backoffFactor;

    private final Duration jitter;

    private final int circuitBreakerThreshold;

    private final Duration circuitBreakerReset;

    private final HalfOpenPolicy halfOpenPolicy;

    private final RetryPolicy retryPolicy;

    private final Clock clock;

    ResilientClientConfig(String baseUri, String remoteServiceName, Duration timeout,
                          Map<String, String> defaultHeaders, int maxRetries, Duration backoffFactor,
                          Duration jitter, int circuitBreakerThreshold, Duration circuitBreakerReset,
                          HalfOpenPolicy halfOpenPolicy, RetryPolicy retryPolicy, Clock clock) {
        this.baseUri = baseUri;
        this.remoteServiceName = remoteServiceName;
        this.timeout = timeout;
        this.defaultHeaders = Collections.unmodifiableMap(defaultHeaders);
        this.maxRetries = maxRetries;
        this.backoffFactor = backoffFactor;
        this.jitter = jitter;
        this.circuitBreakerThreshold = circuitBreakerThreshold;
        this.circuitBreakerReset = circuitBreakerReset;
        this.halfOpenPolicy = halfOpenPolicy;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
    }

    /**
     * Returns the base address without trailing slashes.
     */
    public String baseUri() {
        return baseUri;
    }

    public String remoteServiceName() {
        return remoteServiceName;
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Returns the headers sent with every request, keyed case-insensitively.
     */
    public Map<String, String> defaultHeaders() {
        return defaultHeaders;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Duration backoffFactor() {
        return backoffFactor;
    }

    public Duration jitter() {
        return jitter;
    }

    public int circuitBreakerThreshold() {
        return circuitBreakerThreshold;
    }

    public Duration circuitBreakerReset() {
        return circuitBreakerReset;
    }

    public HalfOpenPolicy halfOpenPolicy() {
        return halfOpenPolicy;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    Clock clock() {
        return clock;
    }

    @Override
    public String toString() {
        return "ResilientClientConfig{" +
               "baseUri='" + baseUri + '\'' +
               ", remoteServiceName='" + remoteServiceName + '\'' +
               ", timeout=" + timeout +
               ", defaultHeaders=" + defaultHeaders.keySet() +
               ", maxRetries=" + maxRetries +
               ", backoffFactor=" + backoffFactor +
               ", jitter=" + jitter +
               ", circuitBreakerThreshold=" + circuitBreakerThreshold +
               ", circuitBreakerReset=" + circuitBreakerReset +
               ", halfOpenPolicy=" + halfOpenPolicy +
               '}';
    }
}
