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

/**
 * An outbound HTTP client for JSON services with retry, exponential backoff and a
 * <a href="http://martinfowler.com/bliki/CircuitBreaker.html">circuit breaker</a>.
 *
 * <h1>Usage</h1>
 * <pre>{@code
 * ResilientClientConfig config = new ResilientClientConfigBuilder("https://api.example.com/v1")
 *                                    .maxRetries(3)
 *                                    .circuitBreakerThreshold(5)
 *                                    .build();
 *
 * try (ResilientClient client = new ResilientClient(config)) {
 *     client.setAuthToken(token);
 *     Map<String, Object> user = client.get("/users/42");
 * } catch (CircuitBreakerOpenException e) {
 *     // fallback code
 * } catch (ResilientClientException e) {
 *     // error handling
 * }
 * }</pre>
 *
 * <h1>Request Pipeline</h1>
 * Every verb method goes through the same pipeline.
 * <ol>
 *     <li>If the circuit is open, the request fails immediately with a
 *     {@link com.linecorp.resilient.client.circuitbreaker.CircuitBreakerOpenException}.</li>
 *     <li>Otherwise up to {@code maxRetries + 1} attempts are made one after another. Each attempt is
 *     bounded by {@code timeout}.</li>
 *     <li>A failed attempt is recorded to the circuit breaker first. It is then retried after
 *     {@code backoffFactor * 2^attempt} plus a random jitter if the
 *     {@link com.linecorp.resilient.client.retry.RetryPolicy} allows it, or propagated as is.</li>
 *     <li>A successful attempt resets the failure streak and closes the circuit.</li>
 * </ol>
 *
 * <h1>Errors</h1>
 * <ul>
 *     <li>{@link com.linecorp.resilient.client.transport.TransportException} no response was obtained.
 *     Retried.</li>
 *     <li>{@link com.linecorp.resilient.client.RemoteServerException} a 5xx response. Retried.</li>
 *     <li>{@link com.linecorp.resilient.client.RemoteClientException} a 4xx response. Not retried.</li>
 *     <li>{@link com.linecorp.resilient.client.PayloadException} a malformed payload. Not retried.</li>
 * </ul>
 */
package com.linecorp.resilient.client;
