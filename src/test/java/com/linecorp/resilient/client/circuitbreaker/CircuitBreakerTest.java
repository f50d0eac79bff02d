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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CyclicBarrier;

import org.junit.Test;

public class CircuitBreakerTest {

    private static final String remoteServiceName = "testservice";

    private static final Duration reset = Duration.ofSeconds(30);

    private final TestClock clock = new TestClock();

    private CircuitBreaker create(int failureThreshold, HalfOpenPolicy halfOpenPolicy) {
        return new CircuitBreaker(remoteServiceName, failureThreshold, reset, halfOpenPolicy, clock);
    }

    private CircuitBreaker closedState(int failureThreshold) {
        final CircuitBreaker cb = create(failureThreshold, HalfOpenPolicy.SINGLE_TRIAL);
        assertThat(cb.getState().circuitState(), is(CircuitState.CLOSED));
        assertThat(cb.acquirePermission(), is(false));
        return cb;
    }

    private CircuitBreaker openState(int failureThreshold, HalfOpenPolicy halfOpenPolicy) {
        final CircuitBreaker cb = create(failureThreshold, halfOpenPolicy);
        for (int i = 0; i < failureThreshold; i++) {
            cb.onFailure();
        }
        assertThat(cb.getState().circuitState(), is(CircuitState.OPEN));
        assertRefused(cb);
        return cb;
    }

    private CircuitBreaker halfOpenState(int failureThreshold) {
        final CircuitBreaker cb = openState(failureThreshold, HalfOpenPolicy.SINGLE_TRIAL);

        clock.forward(reset);

        assertThat(cb.getState().circuitState(), is(CircuitState.OPEN));
        assertThat(cb.acquirePermission(), is(true)); // first request is a trial
        assertThat(cb.getState().circuitState(), is(CircuitState.HALF_OPEN));
        assertRefused(cb); // second request is refused
        return cb;
    }

    private static Duration assertRefused(CircuitBreaker cb) {
        try {
            cb.acquirePermission();
            fail();
            return null;
        } catch (CircuitBreakerOpenException e) {
            assertThat(e.getRemoteServiceName(), is(remoteServiceName));
            return e.getRemaining();
        }
    }

    @Test
    public void testClosed() {
        closedState(2);
    }

    @Test
    public void testFailureThreshold() {
        final CircuitBreaker cb = create(3, HalfOpenPolicy.SINGLE_TRIAL);

        assertThat(cb.onFailure(), is(1));
        assertThat(cb.onFailure(), is(2));
        assertThat(cb.getState().circuitState(), is(CircuitState.CLOSED));
        assertThat(cb.acquirePermission(), is(false));

        // the failure that reaches the threshold resets the streak
        assertThat(cb.onFailure(), is(0));
        assertThat(cb.getState().circuitState(), is(CircuitState.OPEN));
        assertThat(cb.getState().failureStreak(), is(0));
    }

    @Test
    public void testSuccessResetsFailureStreak() {
        final CircuitBreaker cb = create(3, HalfOpenPolicy.SINGLE_TRIAL);

        cb.onFailure();
        cb.onFailure();
        cb.onSuccess();
        assertThat(cb.getState().failureStreak(), is(0));

        cb.onFailure();
        cb.onFailure();
        assertThat(cb.getState().circuitState(), is(CircuitState.CLOSED));
    }

    @Test
    public void testClosedToOpen() {
        final CircuitBreaker cb = openState(2, HalfOpenPolicy.SINGLE_TRIAL);

        assertThat(cb.getState().circuitOpenUntil().getAsLong(), is(clock.nanoTime() + reset.toNanos()));
        assertThat(cb.isOpen(), is(true));

        clock.forward(Duration.ofSeconds(10));
        assertThat(assertRefused(cb), is(Duration.ofSeconds(20)));
    }

    @Test
    public void testOpenToHalfOpen() {
        final CircuitBreaker cb = halfOpenState(2);
        assertThat(cb.getState().circuitOpenUntil().isPresent(), is(false));
    }

    @Test
    public void testObservingDoesNotMoveToHalfOpen() {
        final CircuitBreaker cb = openState(1, HalfOpenPolicy.SINGLE_TRIAL);

        clock.forward(reset);

        assertThat(cb.isOpen(), is(false));
        assertThat(cb.getState().circuitStateAt(clock.nanoTime()), is(CircuitState.HALF_OPEN));
        // the stored state is still OPEN
        assertThat(cb.getState().circuitState(), is(CircuitState.OPEN));
        assertThat(cb.getState().circuitOpenUntil().isPresent(), is(true));
    }

    @Test
    public void testHalfOpenToClosed() {
        final CircuitBreaker cb = halfOpenState(2);

        cb.onSuccess();

        assertThat(cb.getState().circuitState(), is(CircuitState.CLOSED));
        assertThat(cb.acquirePermission(), is(false));
    }

    @Test
    public void testHalfOpenToOpen() {
        final CircuitBreaker cb = halfOpenState(5);

        // a single failed trial reopens the circuit regardless of the threshold
        cb.onFailure();

        assertThat(cb.getState().circuitState(), is(CircuitState.OPEN));
        assertThat(assertRefused(cb), is(reset));
    }

    @Test
    public void testAbandonedTrialAllowsAnotherTrial() {
        final CircuitBreaker cb = halfOpenState(2);

        cb.onTrialAbandoned();

        assertThat(cb.acquirePermission(), is(true));
        assertThat(cb.getState().circuitState(), is(CircuitState.HALF_OPEN));
        assertRefused(cb);
    }

    @Test
    public void testSingleTrialRefusesConcurrentRequests() {
        final CircuitBreaker cb = halfOpenState(2);

        assertThat(assertRefused(cb), is(Duration.ZERO));
        assertThat(cb.eventCount().rejected(), is(3L));
    }

    @Test
    public void testConcurrentTrialsAllowEveryRequest() {
        final CircuitBreaker cb = openState(2, HalfOpenPolicy.CONCURRENT_TRIALS);

        clock.forward(reset);

        assertThat(cb.acquirePermission(), is(true));
        assertThat(cb.acquirePermission(), is(true));
        assertThat(cb.acquirePermission(), is(true));

        // the first failed trial reopens the circuit
        cb.onFailure();
        assertRefused(cb);
    }

    @Test
    public void testZeroReset() {
        final CircuitBreaker cb = new CircuitBreaker(remoteServiceName, 1, Duration.ZERO,
                                                     HalfOpenPolicy.SINGLE_TRIAL, clock);
        cb.onFailure();
        assertThat(cb.getState().circuitState(), is(CircuitState.OPEN));
        assertThat(cb.acquirePermission(), is(true));
    }

    @Test
    public void testEventCount() {
        final CircuitBreaker cb = create(2, HalfOpenPolicy.SINGLE_TRIAL);
        cb.onSuccess();
        cb.onFailure();
        cb.onFailure();
        assertRefused(cb);

        assertThat(cb.eventCount(), is(new EventCount(1, 2, 1)));
        assertThat(cb.eventCount().total(), is(3L));
    }

    @Test
    public void testInvalidArguments() {
        try {
            create(0, HalfOpenPolicy.SINGLE_TRIAL);
            fail();
        } catch (IllegalArgumentException expected) {
        }
        try {
            new CircuitBreaker(remoteServiceName, 1, Duration.ofSeconds(-1), HalfOpenPolicy.SINGLE_TRIAL,
                               clock);
            fail();
        } catch (IllegalArgumentException expected) {
        }
    }

    @Test
    public void testConcurrentFailuresOpenTheCircuit() throws Exception {
        final int threshold = 8;
        for (int round = 0; round < 50; round++) {
            final CircuitBreaker cb = create(threshold, HalfOpenPolicy.SINGLE_TRIAL);
            final CyclicBarrier barrier = new CyclicBarrier(threshold);
            final List<Thread> threads = new ArrayList<>();
            for (int i = 0; i < threshold; i++) {
                final Thread thread = new Thread(() -> {
                    try {
                        barrier.await();
                    } catch (Exception e) {
                        throw new IllegalStateException(e);
                    }
                    cb.onFailure();
                });
                threads.add(thread);
                thread.start();
            }
            for (Thread thread : threads) {
                thread.join();
            }

            assertThat(cb.getState().circuitState(), is(CircuitState.OPEN));
            assertThat(cb.getState().failureStreak(), is(0));
            assertThat(cb.eventCount().failure(), is((long) threshold));
        }
    }
}
