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
 * A circuit breaker that trips after consecutive failures.
 *
 * <h1>Circuit States and Transitions</h1>
 *
 * <h3>{@code CLOSED}</h3>
 * The initial state. All requests are sent to the remote service. When the number of consecutive
 * failures reaches the threshold, the state turns into {@code OPEN}.
 *
 * <h3>{@code OPEN}</h3>
 * All requests fail immediately without calling the remote service. After the cooldown,
 * the next request turns the state into {@code HALF_OPEN}.
 *
 * <h3>{@code HALF_OPEN}</h3>
 * A trial request is sent. Whether other requests are sent as well depends on the
 * {@link com.linecorp.resilient.client.circuitbreaker.HalfOpenPolicy}.
 * <ul>
 *     <li>If it succeeds, the state turns into {@code CLOSED}.</li>
 *     <li>If it fails, the state returns to {@code OPEN} and the cooldown restarts.</li>
 * </ul>
 */
package com.linecorp.resilient.client.circuitbreaker;
