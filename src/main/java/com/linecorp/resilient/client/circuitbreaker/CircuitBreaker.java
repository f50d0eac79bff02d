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

import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A non-blocking implementation of circuit breaker pattern that trips after a number of
 * consecutive failures.
 *
 * <p>All transitions are made by swapping an immutable {@link State} with compare-and-set,
 * so concurrent failures never lose the transition to {@link CircuitState#OPEN}.
 */
public final class CircuitBreaker {

    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

    private static final long NOT_OPEN = Long.MIN_VALUE;

    private final String name;

    private final int failureThreshold;

    private final long resetNanos;

    private final HalfOpenPolicy halfOpenPolicy;

    private final Clock clock;

    private final AtomicReference<State> current = new AtomicReference<>(State.INITIAL);

    private final LongAdder successCount = new LongAdder();

    private final LongAdder failureCount = new LongAdder();

    private final LongAdder rejectedCount = new LongAdder();

    /**
     * Creates a new {@link CircuitBreaker}.
     *
     * @param name The remote service name to be logged
     * @param failureThreshold The number of consecutive failures that opens the circuit
     * @param reset The duration the circuit stays open
     * @param halfOpenPolicy The number of trial requests allowed after the cooldown
     * @param clock The monotonic time source
     */
    public CircuitBreaker(String name, int failureThreshold, Duration reset,
                          HalfOpenPolicy halfOpenPolicy, Clock clock) {
        this.name = requireNonNull(name, "name");
        requireNonNull(reset, "reset");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (reset.isNegative()) {
            throw new IllegalArgumentException("reset must not be negative");
        }
        this.failureThreshold = failureThreshold;
        resetNanos = reset.toNanos();
        this.halfOpenPolicy = requireNonNull(halfOpenPolicy, "halfOpenPolicy");
        this.clock = requireNonNull(clock, "clock");
    }

    /**
     * Decides whether a request should be allowed or refused according to the current circuit state.
     *
     * @return {@code true} if the allowed request is a trial request of {@link CircuitState#HALF_OPEN},
     *         {@code false} if the circuit is closed
     * @throws CircuitBreakerOpenException if the request is refused
     */
    public boolean acquirePermission() {
        for (;;) {
            final State state = current.get();
            if (state.isClosed()) {
                // all requests are allowed during CLOSED
                return false;
            }
            if (state.isHalfOpen()) {
                if (halfOpenPolicy == HalfOpenPolicy.CONCURRENT_TRIALS) {
                    return true;
                }
                // a trial request is already in progress
                rejectedCount.increment();
                throw new CircuitBreakerOpenException(name, Duration.ZERO);
            }

            final long remaining = state.openUntilNanos - clock.nanoTime();
            if (remaining > 0) {
                rejectedCount.increment();
                throw new CircuitBreakerOpenException(name, Duration.ofNanos(remaining));
            }
            // changes to HALF_OPEN if OPEN state has timed out
            if (current.compareAndSet(state, new State(CircuitState.HALF_OPEN, state.failureStreak,
                                                       NOT_OPEN))) {
                logger.warn("name:{} cooldown expired, allowing a trial request", name);
                return true;
            }
        }
    }

    /**
     * Records a successful exchange. Any success fully resets the circuit.
     */
    public void onSuccess() {
        successCount.increment();
        for (;;) {
            final State state = current.get();
            if (state == State.INITIAL) {
                return;
            }
            if (current.compareAndSet(state, State.INITIAL)) {
                if (!state.isClosed()) {
                    logger.info("name:{} state:{} (recovered)", name, CircuitState.CLOSED);
                }
                return;
            }
        }
    }

    /**
     * Records a failed exchange.
     *
     * @return the failure streak after recording, which is {@code 0} if this failure opened the circuit
     */
    public int onFailure() {
        failureCount.increment();
        for (;;) {
            final State state = current.get();
            final int streak = state.failureStreak + 1;
            // a failed trial reopens the circuit immediately
            final boolean trip = state.isHalfOpen() || streak >= failureThreshold;
            final State next = trip ? newOpenState() : new State(state.circuitState, streak,
                                                                 state.openUntilNanos);
            if (current.compareAndSet(state, next)) {
                if (trip) {
                    logStateTransition(CircuitState.OPEN, streak);
                    return 0;
                }
                return streak;
            }
        }
    }

    /**
     * Releases a trial request that completed without an outcome, for example because it was cancelled.
     * The next request is allowed as a new trial.
     */
    public void onTrialAbandoned() {
        for (;;) {
            final State state = current.get();
            if (!state.isHalfOpen() || halfOpenPolicy != HalfOpenPolicy.SINGLE_TRIAL) {
                return;
            }
            final State expired = new State(CircuitState.OPEN, state.failureStreak, clock.nanoTime());
            if (current.compareAndSet(state, expired)) {
                return;
            }
        }
    }

    private State newOpenState() {
        return new State(CircuitState.OPEN, 0, clock.nanoTime() + resetNanos);
    }

    private void logStateTransition(CircuitState circuitState, int streak) {
        if (logger.isWarnEnabled()) {
            final StringBuilder builder = new StringBuilder(name.length() + 64);
            builder.append("name:");
            builder.append(name);
            builder.append(" state:");
            builder.append(circuitState.name());
            builder.append(" streak:");
            builder.append(streak);
            builder.append(" cooldown:");
            builder.append(resetNanos / 1_000_000);
            builder.append("ms");
            logger.warn(builder.toString());
        }
    }

    public String name() {
        return name;
    }

    public HalfOpenPolicy halfOpenPolicy() {
        return halfOpenPolicy;
    }

    /**
     * Returns the current {@link State}. The returned value never changes.
     */
    public State getState() {
        return current.get();
    }

    /**
     * Returns whether the circuit refuses requests at this moment. Unlike {@link #acquirePermission()},
     * this never moves an expired circuit to {@link CircuitState#HALF_OPEN}.
     */
    public boolean isOpen() {
        return current.get().isOpenAt(clock.nanoTime());
    }

    public EventCount eventCount() {
        return new EventCount(successCount.sum(), failureCount.sum(), rejectedCount.sum());
    }

    /**
     * A value object that stores the internal state of the circuit breaker.
     */
    public static final class State {

        static final State INITIAL = new State(CircuitState.CLOSED, 0, NOT_OPEN);

        private final CircuitState circuitState;
        private final int failureStreak;
        private final long openUntilNanos;

        private State(CircuitState circuitState, int failureStreak, long openUntilNanos) {
            this.circuitState = circuitState;
            this.failureStreak = failureStreak;
            this.openUntilNanos = openUntilNanos;
        }

        /**
         * Returns the stored state. An {@link CircuitState#OPEN} state whose cooldown has expired is
         * reported as is until a request observes the expiry. See {@link #circuitStateAt(long)}.
         */
        public CircuitState circuitState() {
            return circuitState;
        }

        /**
         * Returns the state as observed at {@code nanoTime}, applying the cooldown expiry.
         */
        public CircuitState circuitStateAt(long nanoTime) {
            if (isOpen() && openUntilNanos <= nanoTime) {
                return CircuitState.HALF_OPEN;
            }
            return circuitState;
        }

        /**
         * Returns the number of consecutive failures since the last success or the last time
         * the circuit opened.
         */
        public int failureStreak() {
            return failureStreak;
        }

        /**
         * Returns the monotonic time in nanoseconds until which the circuit stays open,
         * or an empty value if the circuit is not open.
         */
        public OptionalLong circuitOpenUntil() {
            return isOpen() ? OptionalLong.of(openUntilNanos) : OptionalLong.empty();
        }

        public boolean isOpenAt(long nanoTime) {
            return isOpen() && nanoTime < openUntilNanos;
        }

        boolean isOpen() {
            return circuitState == CircuitState.OPEN;
        }

        boolean isHalfOpen() {
            return circuitState == CircuitState.HALF_OPEN;
        }

        boolean isClosed() {
            return circuitState == CircuitState.CLOSED;
        }

        @Override
        public String toString() {
            return "State{" +
                   "circuitState=" + circuitState +
                   ", failureStreak=" + failureStreak +
                   (isOpen() ? ", openUntilNanos=" + openUntilNanos : "") +
                   '}';
        }
    }
}
