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

package com.linecorp.resilient.client.transport;

import static java.util.Objects.requireNonNull;

/**
 * The status and raw body of a response obtained from the remote service.
 */
public final class TransportResponse {

    private static final byte[] EMPTY = new byte[0];

    private final int status;

    private final byte[] body;

    public TransportResponse(int status, byte[] body) {
        if (status < 100 || 999 < status) {
            throw new IllegalArgumentException("status: " + status + " (expected: 100-999)");
        }
        this.status = status;
        this.body = requireNonNull(body, "body");
    }

    public static TransportResponse of(int status) {
        return new TransportResponse(status, EMPTY);
    }

    public int status() {
        return status;
    }

    public byte[] body() {
        return body;
    }

    public boolean isSuccess() {
        return 200 <= status && status < 300;
    }

    @Override
    public String toString() {
        return "TransportResponse{status=" + status + ", bodyLength=" + body.length + '}';
    }
}
