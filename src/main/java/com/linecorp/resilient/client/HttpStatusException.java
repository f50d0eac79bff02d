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

import java.nio.charset.StandardCharsets;

/**
 * Raised when the remote service answered with a non-2xx status.
 */
public class HttpStatusException extends ResilientClientException {

    private static final long serialVersionUID = -3180716392755129434L;

    private static final int MAX_BODY_LENGTH_IN_MESSAGE = 256;

    private final int status;

    private final byte[] body;

    public HttpStatusException(int status, byte[] body) {
        super(message(status, body));
        this.status = status;
        this.body = body != null ? body : new byte[0];
    }

    /**
     * Creates the {@link HttpStatusException} that matches the class of {@code status}.
     */
    public static HttpStatusException of(int status, byte[] body) {
        if (500 <= status && status < 600) {
            return new RemoteServerException(status, body);
        }
        if (400 <= status && status < 500) {
            return new RemoteClientException(status, body);
        }
        return new HttpStatusException(status, body);
    }

    public int getStatus() {
        return status;
    }

    public byte[] getBody() {
        return body.clone();
    }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public boolean isServerError() {
        return 500 <= status && status < 600;
    }

    public boolean isClientError() {
        return 400 <= status && status < 500;
    }

    private static String message(int status, byte[] body) {
        if (body == null || body.length == 0) {
            return "HTTP " + status;
        }
        final int length = Math.min(body.length, MAX_BODY_LENGTH_IN_MESSAGE);
        return "HTTP " + status + ": " + new String(body, 0, length, StandardCharsets.UTF_8) +
               (length < body.length ? "..." : "");
    }
}
