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
 * A policy deciding how many requests may pass while the circuit is {@link CircuitState#HALF_OPEN}.
 */
public enum HalfOpenPolicy {
    /**
     * Only one trial request is sent. All other requests fail immediately until the trial completes.
     */
    SINGLE_TRIAL,
    /**
     * Every request arriving while {@link CircuitState#HALF_OPEN} is sent to the remote service.
     */
    CONCURRENT_TRIALS
}
