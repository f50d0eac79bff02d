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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

import io.netty.handler.codec.http.HttpMethod;

public class TransportRequestTest {

    private static TransportRequest request(Map<String, String> headers, byte[] body) {
        return new TransportRequest(HttpMethod.POST, URI.create("https://example.com/items"), headers, body,
                                    Duration.ofSeconds(1));
    }

    @Test
    public void testBodyIsCopied() {
        final byte[] body = "{\"a\":1}".getBytes(StandardCharsets.UTF_8);
        final TransportRequest request = request(Map.of(), body);

        body[0] = 'x';
        request.body()[1] = 'x';

        assertThat(new String(request.body(), StandardCharsets.UTF_8), is("{\"a\":1}"));
    }

    @Test
    public void testHeadersAreCopied() {
        final Map<String, String> headers = new HashMap<>();
        headers.put("X-Trace", "1");
        final TransportRequest request = request(headers, null);

        headers.put("X-Trace", "2");

        assertThat(request.headers().get("X-Trace"), is("1"));
        assertThat(request.body(), is(nullValue()));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testHeadersAreUnmodifiable() {
        request(Map.of(), null).headers().put("X-Trace", "1");
    }
}
