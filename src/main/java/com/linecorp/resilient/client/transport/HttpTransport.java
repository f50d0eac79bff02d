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

import io.netty.channel.EventLoop;
import io.netty.util.concurrent.Future;

/**
 * Sends one HTTP request and receives its response.
 */
@FunctionalInterface
public interface HttpTransport {

    /**
     * Sends the specified request.
     *
     * <p>The returned {@link Future} succeeds with a {@link TransportResponse} whenever a response was
     * obtained, whatever its status. It fails, preferably with a {@link TransportException}, only when
     * no response was obtained. Cancelling the returned {@link Future} must abort the exchange.
     *
     * @param eventLoop The {@link EventLoop} that runs the request pipeline
     */
    Future<TransportResponse> send(EventLoop eventLoop, TransportRequest request);
}
