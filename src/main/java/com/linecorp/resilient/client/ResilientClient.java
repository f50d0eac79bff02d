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

import static java.util.Objects.requireNonNull;

import java.net.URI;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linecorp.resilient.client.circuitbreaker.CircuitBreaker;
import com.linecorp.resilient.client.circuitbreaker.CircuitBreakerOpenException;
import com.linecorp.resilient.client.retry.Backoff;
import com.linecorp.resilient.client.transport.HttpTransport;
import com.linecorp.resilient.client.transport.NettyHttpTransport;
import com.linecorp.resilient.client.transport.TransportException;
import com.linecorp.resilient.client.transport.TransportRequest;
import com.linecorp.resilient.client.transport.TransportResponse;

import io.netty.channel.EventLoop;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.concurrent.Promise;
import io.netty.util.concurrent.ScheduledFuture;

/**
 * An HTTP client that exchanges JSON payloads with one remote service, retrying failed attempts with
 * exponential backoff and failing fast while a circuit breaker is open.
 *
 * <p>A {@link ResilientClient} is meant to be shared. All calls made on the same instance update the
 * same failure streak and circuit.
 */
public final class ResilientClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ResilientClient.class);

    static final String AUTHORIZATION = "Authorization";

    private static final String DEFAULT_AUTH_SCHEME = "Bearer";

    private final ResilientClientConfig config;

    private final HttpTransport transport;

    private final boolean ownsEventLoopGroup;

    private final CircuitBreaker circuitBreaker;

    private final Backoff backoff;

    private final JsonPayloadCodec codec = new JsonPayloadCodec();

    private volatile EventLoopGroup eventLoopGroup;

    private volatile Map<String, String> defaultHeaders;

    private volatile boolean closed;

    /**
     * Creates a new instance that sends requests with a {@link NettyHttpTransport}. The event loop it
     * runs on is created on the first request and shut down by {@link #close()}.
     */
    public ResilientClient(ResilientClientConfig config) {
        this(config, new NettyHttpTransport(), null, true);
    }

    /**
     * Creates a new instance that sends requests with the specified {@link HttpTransport} on the
     * specified {@link EventLoopGroup}. The {@link EventLoopGroup} is not shut down by {@link #close()}.
     */
    public ResilientClient(ResilientClientConfig config, HttpTransport transport,
                           EventLoopGroup eventLoopGroup) {
        this(config, transport, requireNonNull(eventLoopGroup, "eventLoopGroup"), false);
    }

    private ResilientClient(ResilientClientConfig config, HttpTransport transport,
                            EventLoopGroup eventLoopGroup, boolean ownsEventLoopGroup) {
        this.config = requireNonNull(config, "config");
        this.transport = requireNonNull(transport, "transport");
        this.eventLoopGroup = eventLoopGroup;
        this.ownsEventLoopGroup = ownsEventLoopGroup;
        circuitBreaker = new CircuitBreaker(config.remoteServiceName(), config.circuitBreakerThreshold(),
                                            config.circuitBreakerReset(), config.halfOpenPolicy(),
                                            config.clock());
        backoff = new Backoff(config.backoffFactor(), config.jitter());
        defaultHeaders = config.defaultHeaders();
    }

    public Map<String, Object> get(String path) {
        return get(path, null);
    }

    public Map<String, Object> get(String path, Map<String, String> headers) {
        return await(execute(HttpMethod.GET, path, null, headers));
    }

    public Map<String, Object> post(String path) {
        return post(path, null, null);
    }

    public Map<String, Object> post(String path, Object body) {
        return post(path, body, null);
    }

    public Map<String, Object> post(String path, Object body, Map<String, String> headers) {
        return await(execute(HttpMethod.POST, path, body, headers));
    }

    public Map<String, Object> put(String path) {
        return put(path, null, null);
    }

    public Map<String, Object> put(String path, Object body) {
        return put(path, body, null);
    }

    public Map<String, Object> put(String path, Object body, Map<String, String> headers) {
        return await(execute(HttpMethod.PUT, path, body, headers));
    }

    public Map<String, Object> delete(String path) {
        return delete(path, null);
    }

    public Map<String, Object> delete(String path, Map<String, String> headers) {
        return await(execute(HttpMethod.DELETE, path, null, headers));
    }

    /**
     * Sends a request through the retry and circuit breaker pipeline.
     *
     * <p>The returned {@link Future} succeeds with the decoded JSON object of the response, or fails
     * with the error of the last attempt. Cancelling it aborts the in-flight attempt or the pending
     * backoff.
     *
     * @param method The HTTP method
     * @param path The path resolved against the base address. Leading slashes are ignored.
     * @param body The payload serialized as JSON, or {@code null}
     * @param headers The headers overriding the default headers, or {@code null}
     */
    public Future<Map<String, Object>> execute(HttpMethod method, String path, Object body,
                                               Map<String, String> headers) {
        requireNonNull(method, "method");
        requireNonNull(path, "path");
        if (closed) {
            throw new IllegalStateException("client closed");
        }

        final EventLoop eventLoop = eventLoopGroup().next();
        final TransportRequest request;
        try {
            request = newRequest(method, path, body, headers);
        } catch (PayloadException e) {
            return eventLoop.newFailedFuture(e);
        }

        final boolean trial;
        try {
            trial = circuitBreaker.acquirePermission();
        } catch (CircuitBreakerOpenException e) {
            logger.debug("{} {} refused: {}", method, request.uri(), e.getMessage());
            return eventLoop.newFailedFuture(e);
        }

        final Promise<Map<String, Object>> promise = eventLoop.newPromise();
        final Execution execution = new Execution(eventLoop, request, promise, trial);
        try {
            eventLoop.execute(() -> execution.attempt(0));
        } catch (RejectedExecutionException e) {
            if (trial) {
                circuitBreaker.onTrialAbandoned();
            }
            return eventLoop.newFailedFuture(new ResilientClientException("event loop rejected a request", e));
        }
        return promise;
    }

    /**
     * Sets or overwrites the {@code Authorization} header sent with subsequent requests as
     * {@code "Bearer <token>"}.
     */
    public void setAuthToken(String token) {
        setAuthToken(token, DEFAULT_AUTH_SCHEME);
    }

    /**
     * Sets or overwrites the {@code Authorization} header sent with subsequent requests as
     * {@code "<scheme> <token>"}. Requests already sent are not affected.
     */
    public void setAuthToken(String token, String scheme) {
        requireNonNull(token, "token");
        requireNonNull(scheme, "scheme");
        synchronized (this) {
            final Map<String, String> headers = ResilientClientConfigBuilder.newHeaderMap();
            headers.putAll(defaultHeaders);
            headers.put(AUTHORIZATION, scheme + ' ' + token);
            defaultHeaders = Collections.unmodifiableMap(headers);
        }
        logger.info("name:{} authentication token set (scheme: {})", config.remoteServiceName(), scheme);
    }

    /**
     * Returns the headers sent with every request.
     */
    public Map<String, String> defaultHeaders() {
        return defaultHeaders;
    }

    /**
     * Returns a snapshot of the failure-tracking state. Taking a snapshot never changes the state.
     */
    public ResilienceState resilienceState() {
        final CircuitBreaker.State state = circuitBreaker.getState();
        final long now = config.clock().nanoTime();
        return new ResilienceState(state.failureStreak(), state.circuitOpenUntil(), state.isOpenAt(now),
                                   state.circuitStateAt(now), config.maxRetries(),
                                   circuitBreaker.eventCount());
    }

    public ResilientClientConfig config() {
        return config;
    }

    // visible for testing
    CircuitBreaker circuitBreaker() {
        return circuitBreaker;
    }

    /**
     * Shuts down the event loop created by this client, if any. Requests can no longer be sent.
     */
    @Override
    public void close() {
        final EventLoopGroup group;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            group = eventLoopGroup;
        }
        if (ownsEventLoopGroup && group != null) {
            group.shutdownGracefully(0, 5, TimeUnit.SECONDS).syncUninterruptibly();
        }
    }

    private EventLoopGroup eventLoopGroup() {
        EventLoopGroup group = eventLoopGroup;
        if (group == null) {
            synchronized (this) {
                group = eventLoopGroup;
                if (group == null) {
                    if (closed) {
                        throw new IllegalStateException("client closed");
                    }
                    eventLoopGroup = group = new NioEventLoopGroup(
                            1, new DefaultThreadFactory("resilient-client", true));
                }
            }
        }
        return group;
    }

    private TransportRequest newRequest(HttpMethod method, String path, Object body,
                                        Map<String, String> headers) {
        final Map<String, String> mergedHeaders = ResilientClientConfigBuilder.newHeaderMap();
        mergedHeaders.putAll(defaultHeaders);
        if (headers != null) {
            mergedHeaders.putAll(headers);
        }
        final byte[] payload = body != null ? codec.encode(body) : null;
        return new TransportRequest(method, resolve(path), mergedHeaders, payload, config.timeout());
    }

    private URI resolve(String path) {
        int start = 0;
        while (start < path.length() && path.charAt(start) == '/') {
            start++;
        }
        return URI.create(config.baseUri() + '/' + path.substring(start));
    }

    private static Map<String, Object> await(Future<Map<String, Object>> future) {
        try {
            future.await();
        } catch (InterruptedException e) {
            future.cancel(false);
            Thread.currentThread().interrupt();
            final CancellationException cancelled =
                    new CancellationException("interrupted while waiting for a response");
            cancelled.initCause(e);
            throw cancelled;
        }

        if (future.isSuccess()) {
            return future.getNow();
        }
        final Throwable cause = future.cause();
        if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        throw new ResilientClientException(cause);
    }

    /**
     * The attempts of one request. All methods run on {@link #eventLoop}.
     */
    private final class Execution {

        private final EventLoop eventLoop;

        private final TransportRequest request;

        private final Promise<Map<String, Object>> promise;

        private final boolean trial;

        private Future<TransportResponse> inFlight;

        private ScheduledFuture<?> pendingRetry;

        private boolean outcomeRecorded;

        Execution(EventLoop eventLoop, TransportRequest request, Promise<Map<String, Object>> promise,
                  boolean trial) {
            this.eventLoop = eventLoop;
            this.request = request;
            this.promise = promise;
            this.trial = trial;
            promise.addListener(future -> {
                if (future.isCancelled()) {
                    onCancelled();
                }
            });
        }

        void attempt(int attempt) {
            try {
                doAttempt(attempt);
            } catch (Throwable t) {
                abort(t);
            }
        }

        private void doAttempt(int attempt) {
            if (promise.isDone()) {
                // cancelled during the backoff
                return;
            }
            final int maxRetries = config.maxRetries();
            if (attempt > maxRetries) {
                abort(new IllegalStateException(
                        "unexpected state: attempt " + attempt + " exceeds maxRetries " + maxRetries));
                return;
            }

            logger.debug("{} {} (attempt {}/{})", request.method(), request.uri(), attempt + 1, maxRetries + 1);

            final Promise<TransportResponse> attemptPromise = eventLoop.newPromise();
            Future<TransportResponse> sent;
            try {
                sent = transport.send(eventLoop, request);
            } catch (Throwable t) {
                sent = eventLoop.newFailedFuture(t);
            }
            final Future<TransportResponse> future = requireNonNull(sent, "transport.send() returned null");
            inFlight = future;

            final ScheduledFuture<?> timeoutFuture = eventLoop.schedule(() -> {
                if (attemptPromise.tryFailure(new TransportException(
                        "timed out after " + config.timeout().toMillis() + "ms: " + request.uri()))) {
                    future.cancel(false);
                }
            }, config.timeout().toNanos(), TimeUnit.NANOSECONDS);

            attemptPromise.addListener((FutureListener<TransportResponse>) f -> {
                timeoutFuture.cancel(false);
                onAttemptDone(attempt, f);
            });
            future.addListener((FutureListener<TransportResponse>) f -> {
                if (f.isSuccess()) {
                    attemptPromise.trySuccess(f.getNow());
                } else {
                    attemptPromise.tryFailure(f.cause());
                }
            });
        }

        private void onAttemptDone(int attempt, Future<TransportResponse> future) {
            try {
                doOnAttemptDone(attempt, future);
            } catch (Throwable t) {
                abort(t);
            }
        }

        private void doOnAttemptDone(int attempt, Future<TransportResponse> future) {
            inFlight = null;
            if (promise.isDone()) {
                return;
            }

            Throwable cause = null;
            Map<String, Object> payload = null;
            if (future.isSuccess()) {
                final TransportResponse response = future.getNow();
                if (response.isSuccess()) {
                    try {
                        payload = codec.decode(response.body());
                    } catch (PayloadException e) {
                        cause = e;
                    }
                } else {
                    cause = HttpStatusException.of(response.status(), response.body());
                }
            } else {
                cause = toResilientClientException(future.cause());
            }

            if (cause == null) {
                circuitBreaker.onSuccess();
                outcomeRecorded = true;
                promise.trySuccess(payload);
                return;
            }

            final int maxRetries = config.maxRetries();
            final int streak = circuitBreaker.onFailure();
            outcomeRecorded = true;
            logger.warn("{} {} failed (attempt {}/{}, failure streak: {}): {}",
                        request.method(), request.uri(), attempt + 1, maxRetries + 1, streak, cause.toString());

            if (attempt >= maxRetries || !config.retryPolicy().shouldRetry(cause)) {
                promise.tryFailure(cause);
                return;
            }

            final long delayNanos = backoff.delayNanos(attempt);
            logger.debug("{} {} retrying in {}ms", request.method(), request.uri(),
                         TimeUnit.NANOSECONDS.toMillis(delayNanos));
            pendingRetry = eventLoop.schedule(() -> attempt(attempt + 1), delayNanos, TimeUnit.NANOSECONDS);
        }

        /**
         * Fails the request with an error raised by the pipeline itself, for example by a
         * {@link com.linecorp.resilient.client.retry.RetryPolicy}.
         */
        private void abort(Throwable cause) {
            if (!promise.tryFailure(cause)) {
                return;
            }
            logger.warn("{} {} aborted by an unexpected error", request.method(), request.uri(), cause);
            final ScheduledFuture<?> pendingRetry = this.pendingRetry;
            if (pendingRetry != null) {
                pendingRetry.cancel(false);
            }
            if (trial && !outcomeRecorded) {
                // the trial ends without an outcome
                circuitBreaker.onTrialAbandoned();
            }
        }

        private void onCancelled() {
            final Future<TransportResponse> inFlight = this.inFlight;
            if (inFlight != null) {
                inFlight.cancel(false);
            }
            final ScheduledFuture<?> pendingRetry = this.pendingRetry;
            if (pendingRetry != null) {
                pendingRetry.cancel(false);
            }
            if (trial) {
                circuitBreaker.onTrialAbandoned();
            }
            logger.debug("{} {} cancelled", request.method(), request.uri());
        }
    }

    private static ResilientClientException toResilientClientException(Throwable cause) {
        if (cause instanceof ResilientClientException) {
            return (ResilientClientException) cause;
        }
        // no response was obtained
        return new TransportException(String.valueOf(cause), cause);
    }
}
