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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.util.Collections;

import org.junit.Test;

import com.linecorp.resilient.client.circuitbreaker.HalfOpenPolicy;
import com.linecorp.resilient.client.retry.RetryPolicy;

public class ResilientClientConfigBuilderTest {

    private static final String baseUri = "http://127.0.0.1:8080/api";

    private static final Duration minusDuration = Duration.ZERO.minusMillis(1);

    private static void throwsException(Runnable runnable) {
        try {
            runnable.run();
            fail();
        } catch (IllegalArgumentException | NullPointerException e) {
        }
    }

    private static ResilientClientConfigBuilder builder() {
        return new ResilientClientConfigBuilder(baseUri);
    }

    @Test
    public void testDefaults() {
        final ResilientClientConfig config = builder().build();
        assertThat(config.baseUri(), is(baseUri));
        assertThat(config.remoteServiceName(), is("127.0.0.1:8080"));
        assertThat(config.timeout(), is(Duration.ofSeconds(30)));
        assertThat(config.maxRetries(), is(2));
        assertThat(config.backoffFactor(), is(Duration.ofMillis(500)));
        assertThat(config.jitter(), is(Duration.ofMillis(100)));
        assertThat(config.circuitBreakerThreshold(), is(5));
        assertThat(config.circuitBreakerReset(), is(Duration.ofSeconds(30)));
        assertThat(config.halfOpenPolicy(), is(HalfOpenPolicy.SINGLE_TRIAL));
        assertThat(config.retryPolicy(), is(RetryPolicy.DEFAULT));
        assertThat(config.defaultHeaders(), hasEntry("Content-Type", "application/json"));
        assertThat(config.defaultHeaders(), hasEntry("Accept", "application/json"));
    }

    @Test
    public void testTrailingSlashesAreStripped() {
        assertThat(new ResilientClientConfigBuilder("https://example.com/v1///").build().baseUri(),
                   is("https://example.com/v1"));
        assertThat(new ResilientClientConfigBuilder("https://example.com/").build().baseUri(),
                   is("https://example.com"));
    }

    @Test
    public void testConstructorWithInvalidArgument() {
        throwsException(() -> new ResilientClientConfigBuilder(null));
        throwsException(() -> new ResilientClientConfigBuilder(""));
        throwsException(() -> new ResilientClientConfigBuilder("/relative/path"));
        throwsException(() -> new ResilientClientConfigBuilder("ftp://example.com"));
        throwsException(() -> new ResilientClientConfigBuilder("http://"));
        throwsException(() -> new ResilientClientConfigBuilder("http://exa mple.com"));
    }

    @Test
    public void testHeadersOverrideDefaults() {
        final ResilientClientConfig config = builder()
                .header("content-type", "text/plain")
                .headers(Collections.singletonMap("X-Request-Source", "batch"))
                .build();
        assertThat(config.defaultHeaders().get("Content-Type"), is("text/plain"));
        assertThat(config.defaultHeaders().get("Accept"), is("application/json"));
        assertThat(config.defaultHeaders().get("x-request-source"), is("batch"));
        assertThat(config.defaultHeaders().size(), is(3));
    }

    @Test
    public void testMaxRetries() {
        assertThat(builder().maxRetries(0).build().maxRetries(), is(0));
        assertThat(builder().maxRetries(10).build().maxRetries(), is(10));
        throwsException(() -> builder().maxRetries(-1));
    }

    @Test
    public void testBackoff() {
        assertThat(builder().backoffFactor(Duration.ZERO).build().backoffFactor(), is(Duration.ZERO));
        assertThat(builder().jitter(Duration.ZERO).build().jitter(), is(Duration.ZERO));
        throwsException(() -> builder().backoffFactor(minusDuration));
        throwsException(() -> builder().backoffFactor(null));
        throwsException(() -> builder().jitter(minusDuration));
    }

    @Test
    public void testCircuitBreaker() {
        final ResilientClientConfig config = builder()
                .circuitBreakerThreshold(1)
                .circuitBreakerReset(Duration.ZERO)
                .halfOpenPolicy(HalfOpenPolicy.CONCURRENT_TRIALS)
                .build();
        assertThat(config.circuitBreakerThreshold(), is(1));
        assertThat(config.circuitBreakerReset(), is(Duration.ZERO));
        assertThat(config.halfOpenPolicy(), is(HalfOpenPolicy.CONCURRENT_TRIALS));

        throwsException(() -> builder().circuitBreakerThreshold(0));
        throwsException(() -> builder().circuitBreakerReset(minusDuration));
        throwsException(() -> builder().halfOpenPolicy(null));
    }

    @Test
    public void testTimeout() {
        assertThat(builder().timeout(Duration.ofMillis(1)).build().timeout(), is(Duration.ofMillis(1)));
        throwsException(() -> builder().timeout(Duration.ZERO));
        throwsException(() -> builder().timeout(minusDuration));
    }

    @Test
    public void testRemoteServiceName() {
        assertThat(builder().remoteServiceName("users").build().remoteServiceName(), is("users"));
        throwsException(() -> builder().remoteServiceName(""));
        throwsException(() -> builder().remoteServiceName(null));
    }
}
