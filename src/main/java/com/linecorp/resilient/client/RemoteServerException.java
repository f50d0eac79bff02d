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

/**
 * Raised when the remote service answered with a 5xx status. An attempt failing with this exception
 * is retried by default.
 */
public final class RemoteServerException extends HttpStatusException {

    private static final long serialVersionUID = 2271809264408916873L;

    public RemoteServerException(int status, byte[] body) {
        super(status, body);
        if (!isServerError()) {
            throw new IllegalArgumentException("status: " + status + " (expected: 500-599)");
        }
    }
}
