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

import com.linecorp.resilient.client.HttpStatusException;
import com.linecorp.resilient.client.transport.TransportException;

/**
 * Decides whether a failed attempt may be retried.
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * Retries when no response was obtained or the remote service answered with a 5xx status.
     */
    RetryPolicy DEFAULT = cause -> {
        if (cause instanceof TransportException) {
            return true;
        }
        if (cause instanceof HttpStatusException) {
            return ((HttpStatusException) cause).isServerError();
        }
        return false;
    };

    /**
     * Never retries.
     */
    RetryPolicy NEVER = cause -> false;

    /**
     * Returns {@code true} if the attempt that failed with {@code cause} may be retried.
     */
    boolean shouldRetry(Throwable cause);
}
