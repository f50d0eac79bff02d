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

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.netty.handler.codec.http.HttpMethod;

/**
 * An HTTP request handed to an {@link HttpTransport}.
 */
public final class TransportRequest {

    private final HttpMethod method;

    private final URI uri;

    private final Map<String, String> headers;

    private final byte[] body;

    private final Duration timeout;

    /**
     * Creates a new instance.
     *
     * @param method The HTTP method
     * @param uri The absolute target
     * @param headers The request headers
     * @param body The serialized payload, or {@code null} if the request has no body
     * @param timeout The time allowed for the exchange
     */
    public TransportRequest(HttpMethod method, URI uri, Map<String, String> headers, byte[] body,
                            Duration timeout) {
        this.method = requireNonNull(method, "method");
        this.uri = requireNonNull(uri, "uri");
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(headers, "headers")));
        this.body = body != null ? body.clone() : null;
        this.timeout = requireNonNull(timeout, "timeout");
    }

    public HttpMethod method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    public Map<String, String> headers() {
        return headers;
    }

    /**
     * Returns a copy of the serialized payload, or {@code null} if the request has no body.
     */
    public byte[] body() {
        return body != null ? body.clone() : null;
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public String toString() {
        return "TransportRequest{" +
               "method=" + method +
               ", uri=" + uri +
               ", headers=" + headers.keySet() +
               ", bodyLength=" + (body != null ? body.length : 0) +
               ", timeout=" + timeout +
               '}';
    }
}
