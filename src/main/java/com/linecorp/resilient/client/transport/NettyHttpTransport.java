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

import javax.net.ssl.SSLException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoop;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;

/**
 * An {@link HttpTransport} that opens one HTTP/1.1 connection per request with Netty.
 * The connection is closed once the response has been received.
 *
 * <p>The {@link EventLoop} given to {@link #send(EventLoop, TransportRequest)} must be able to
 * register a {@link NioSocketChannel}.
 */
public final class NettyHttpTransport implements HttpTransport {

    private static final Logger logger = LoggerFactory.getLogger(NettyHttpTransport.class);

    static final int DEFAULT_MAX_CONTENT_LENGTH = 10 * 1024 * 1024;

    private final int maxContentLength;

    private volatile SslContext sslContext;

    public NettyHttpTransport() {
        this(DEFAULT_MAX_CONTENT_LENGTH);
    }

    /**
     * Creates a new instance.
     *
     * @param maxContentLength The maximum length of a response body in bytes
     */
    public NettyHttpTransport(int maxContentLength) {
        if (maxContentLength <= 0) {
            throw new IllegalArgumentException("maxContentLength must be greater than zero");
        }
        this.maxContentLength = maxContentLength;
    }

    @Override
    public Future<TransportResponse> send(EventLoop eventLoop, TransportRequest request) {
        requireNonNull(eventLoop, "eventLoop");
        requireNonNull(request, "request");

        final Promise<TransportResponse> promise = eventLoop.newPromise();
        final URI uri = request.uri();
        final boolean secure = "https".equalsIgnoreCase(uri.getScheme());
        final String host = uri.getHost();
        if (host == null) {
            return promise.setFailure(new TransportException("missing host: " + uri));
        }
        final int port = uri.getPort() != -1 ? uri.getPort() : secure ? 443 : 80;

        final SslContext sslContext;
        try {
            sslContext = secure ? sslContext() : null;
        } catch (SSLException e) {
            return promise.setFailure(new TransportException("failed to initialize TLS", e));
        }

        final Bootstrap bootstrap = new Bootstrap()
                .group(eventLoop)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
                        (int) Math.min(Integer.MAX_VALUE, Math.max(1, request.timeout().toMillis())))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        final ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(maxContentLength));
                        p.addLast(new ResponseHandler(promise));
                    }
                });

        final ChannelFuture connectFuture = bootstrap.connect(host, port);
        promise.addListener(future -> {
            // aborts the exchange when the caller gives up
            if (future.isCancelled()) {
                connectFuture.channel().close();
            }
        });
        connectFuture.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                promise.tryFailure(new TransportException("failed to connect to " + host + ':' + port,
                                                          future.cause()));
                return;
            }
            if (promise.isDone()) {
                future.channel().close();
                return;
            }
            logger.trace("{} connected to {}:{}", future.channel(), host, port);
            future.channel().writeAndFlush(newRequest(request, host, port, secure))
                  .addListener((ChannelFutureListener) writeFuture -> {
                      if (!writeFuture.isSuccess()) {
                          promise.tryFailure(new TransportException("failed to send a request to " + uri,
                                                                    writeFuture.cause()));
                          writeFuture.channel().close();
                      }
                  });
        });
        return promise;
    }

    private SslContext sslContext() throws SSLException {
        SslContext sslContext = this.sslContext;
        if (sslContext == null) {
            synchronized (this) {
                sslContext = this.sslContext;
                if (sslContext == null) {
                    this.sslContext = sslContext = SslContextBuilder.forClient().build();
                }
            }
        }
        return sslContext;
    }

    private static FullHttpRequest newRequest(TransportRequest request, String host, int port,
                                              boolean secure) {
        final URI uri = request.uri();
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (uri.getRawQuery() != null) {
            path = path + '?' + uri.getRawQuery();
        }

        final byte[] body = request.body();
        final ByteBuf content = body != null ? Unpooled.wrappedBuffer(body) : Unpooled.EMPTY_BUFFER;
        final FullHttpRequest httpRequest =
                new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, request.method(), path, content);
        final HttpHeaders headers = httpRequest.headers();
        request.headers().forEach(headers::set);
        final boolean defaultPort = port == (secure ? 443 : 80);
        headers.set(HttpHeaderNames.HOST, defaultPort ? host : host + ':' + port);
        headers.set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        headers.setInt(HttpHeaderNames.CONTENT_LENGTH, content.readableBytes());
        return httpRequest;
    }

    private static final class ResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {

        private final Promise<TransportResponse> promise;

        ResponseHandler(Promise<TransportResponse> promise) {
            this.promise = promise;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse msg) {
            final byte[] body = ByteBufUtil.getBytes(msg.content());
            promise.trySuccess(new TransportResponse(msg.status().code(), body));
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            promise.tryFailure(new TransportException("connection closed before a response was received"));
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            promise.tryFailure(new TransportException("failed to receive a response", cause));
            ctx.close();
        }
    }
}
