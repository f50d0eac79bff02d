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

import static java.util.Objects.requireNonNull;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;

import com.linecorp.resilient.client.circuitbreaker.Clock;
import com.linecorp.resilient.client.circuitbreaker.HalfOpenPolicy;
import com.linecorp.resilient.client.retry.RetryPolicy;

/**
 * Builds a {@link ResilientClientConfig} instance using builder pattern.
 */
public final class ResilientClientConfigBuilder {

    static final String JSON = "application/json";

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private static final int DEFAULT_MAX_RETRIES = 2;

    private static final Duration DEFAULT_BACKOFF_FACTOR = Duration.ofMillis(500);

    private static final Duration DEFAULT_JITTER = Duration.ofMillis(100);

    private static final int DEFAULT_CIRCUIT_BREAKER_THRESHOLD = 5;

    private static final Duration DEFAULT_CIRCUIT_BREAKER_RESET = Duration.ofSeconds(30);

    private static final HalfOpenPolicy DEFAULT_HALF_OPEN_POLICY = HalfOpenPolicy.SINGLE_TRIAL;

    private final String baseUri;

    private String remoteServiceName;

    private Duration timeout = DEFAULT_TIMEOUT;

    private final Map<String, String> defaultHeaders = newHeaderMap();

    private int maxRetries = DEFAULT_MAX_RETRIES;

    private Duration backoffFactor = DEFAULT_BACKOFF_FACTOR;

    private Duration jitter = DEFAULT_JITTER;

    private int circuitBreakerThreshold = DEFAULT_CIRCUIT_BREAKER_THRESHOLD;

    private Duration circuitBreakerReset = DEFAULT_CIRCUIT_BREAKER_RESET;

    private HalfOpenPolicy halfOpenPolicy = DEFAULT_HALF_OPEN_POLICY;

    private RetryPolicy retryPolicy = RetryPolicy.DEFAULT;

    private Clock clock = Clock.SYSTEM;

    /**
     * Creates a new {@link ResilientClientConfigBuilder} with the specified base address.
     *
     * @param baseUri The absolute {@code http} or {@code https} address every path is resolved against.
     *                Trailing slashes are stripped.
     */
    public ResilientClientConfigBuilder(String baseUri) {
        requireNonNull(baseUri, "baseUri");
        final String stripped = stripTrailingSlashes(baseUri);
        final URI uri;
        try {
            uri = URI.create(stripped);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("baseUri: " + baseUri + " (expected: an absolute URI)", e);
        }
        if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
            throw new IllegalArgumentException("baseUri: " + baseUri + " (expected: http or https)");
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("baseUri: " + baseUri + " (expected: a host)");
        }
        this.baseUri = stripped;
        remoteServiceName = uri.getAuthority();
        defaultHeaders.put("Content-Type", JSON);
        defaultHeaders.put("Accept", JSON);
    }

    /**
     * Sets the name of the remote service to be logged. The authority of the base address by default.
     */
    public ResilientClientConfigBuilder remoteServiceName(String remoteServiceName) {
        requireNonNull(remoteServiceName, "remoteServiceName");
        if (remoteServiceName.isEmpty()) {
            throw new IllegalArgumentException("remoteServiceName must not be empty");
        }
        this.remoteServiceName = remoteServiceName;
        return this;
    }

    /**
     * Sets the time allowed for each attempt.
     */
    public ResilientClientConfigBuilder timeout(Duration timeout) {
        requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be greater than zero");
        }
        this.timeout = timeout;
        return this;
    }

    /**
     * Adds a header sent with every request, overriding the default value of the same name.
     */
    public ResilientClientConfigBuilder header(String name, String value) {
        requireNonNull(name, "name");
        requireNonNull(value, "value");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("header name must not be empty");
        }
        defaultHeaders.put(name, value);
        return this;
    }

    /**
     * Adds headers sent with every request, overriding the default values of the same names.
     */
    public ResilientClientConfigBuilder headers(Map<String, String> headers) {
        requireNonNull(headers, "headers").forEach(this::header);
        return this;
    }

    /**
     * Sets the number of retries after the first attempt.
     */
    public ResilientClientConfigBuilder maxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = maxRetries;
        return this;
    }

    /**
     * Sets the base of the exponential backoff. The delay after the attempt {@code n} (zero-based)
     * is {@code backoffFactor * 2^n} plus the jitter.
     */
    public ResilientClientConfigBuilder backoffFactor(Duration backoffFactor) {
        requireNonNull(backoffFactor, "backoffFactor");
        if (backoffFactor.isNegative()) {
            throw new IllegalArgumentException("backoffFactor must be >= 0");
        }
        this.backoffFactor = backoffFactor;
        return this;
    }

    /**
     * Sets the upper bound of the uniformly random delay added to each backoff.
     */
    public ResilientClientConfigBuilder jitter(Duration jitter) {
        requireNonNull(jitter, "jitter");
        if (jitter.isNegative()) {
            throw new IllegalArgumentException("jitter must be >= 0");
        }
        this.jitter = jitter;
        return this;
    }

    /**
     * Sets the number of consecutive failures that opens the circuit.
     */
    public ResilientClientConfigBuilder circuitBreakerThreshold(int circuitBreakerThreshold) {
        if (circuitBreakerThreshold < 1) {
            throw new IllegalArgumentException("circuitBreakerThreshold must be >= 1");
        }
        this.circuitBreakerThreshold = circuitBreakerThreshold;
        return this;
    }

    /**
     * Sets the duration the circuit stays open.
     */
    public ResilientClientConfigBuilder circuitBreakerReset(Duration circuitBreakerReset) {
        requireNonNull(circuitBreakerReset, "circuitBreakerReset");
        if (circuitBreakerReset.isNegative()) {
            throw new IllegalArgumentException("circuitBreakerReset must be >= 0");
        }
        this.circuitBreakerReset = circuitBreakerReset;
        return this;
    }

    /**
     * Sets the {@link HalfOpenPolicy} applied after the cooldown of an open circuit.
     */
    public ResilientClientConfigBuilder halfOpenPolicy(HalfOpenPolicy halfOpenPolicy) {
        this.halfOpenPolicy = requireNonNull(halfOpenPolicy, "halfOpenPolicy");
        return this;
    }

    /**
     * Sets the {@link RetryPolicy} that decides whether a failed attempt is retried.
     */
    public ResilientClientConfigBuilder retryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = requireNonNull(retryPolicy, "retryPolicy");
        return this;
    }

    /**
     * Sets the {@link Clock} to be used inside the circuit breaker.
     */
    ResilientClientConfigBuilder clock(Clock clock) {
        this.clock = requireNonNull(clock, "clock");
        return this;
    }

    /**
     * Builds a {@link ResilientClientConfig} instance.
     */
    public ResilientClientConfig build() {
        final Map<String, String> headers = newHeaderMap();
        headers.putAll(defaultHeaders);
        return new ResilientClientConfig(baseUri, remoteServiceName, timeout, headers, maxRetries,
                                         backoffFactor, jitter, circuitBreakerThreshold,
                                         circuitBreakerReset, halfOpenPolicy, retryPolicy, clock);
    }

    static Map<String, String> newHeaderMap() {
        return new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    }

    private static String stripTrailingSlashes(String uri) {
        int end = uri.length();
        while (end > 0 && uri.charAt(end - 1) == '/') {
            end--;
        }
        return uri.substring(0, end);
    }
}
