/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.workbridge.resilience;

import me.golemcore.workbridge.domain.exception.CircuitOpenException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Fail-fast guard for a single named resource.
 *
 * <p>
 * Transitions:
 * <ul>
 * <li>CLOSED → OPEN after {@code failureThreshold} consecutive failures
 * <li>OPEN → HALF_OPEN on the first call after {@code timeout} has elapsed
 * <li>HALF_OPEN → CLOSED after {@code successThreshold} consecutive successes
 * <li>HALF_OPEN → OPEN on any failure, restarting the cooldown
 * </ul>
 *
 * <p>
 * All time checks are evaluated lazily against the injected {@link Clock}; no
 * timers are involved. State mutation is synchronized, the protected call
 * itself runs outside the lock.
 */
@Slf4j
public class CircuitBreaker {

    @FunctionalInterface
    public interface ProtectedCall<T> {
        T call() throws Exception;
    }

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private int halfOpenSuccesses;
    private long totalRequests;
    private long totalFailures;
    private Instant openedAt;
    private Instant lastFailureTime;
    private Instant lastStateChange;

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        this.name = name;
        this.config = config;
        this.clock = clock;
        this.lastStateChange = clock.instant();
    }

    public <T> T execute(ProtectedCall<T> call) throws Exception {
        acquirePermission();
        try {
            T result = call.call();
            onSuccess();
            return result;
        } catch (Exception e) {
            onFailure();
            throw e;
        }
    }

    private synchronized void acquirePermission() {
        Instant now = clock.instant();
        totalRequests++;

        if (state == CircuitState.OPEN) {
            long elapsed = Duration.between(openedAt, now).toMillis();
            if (elapsed < config.getTimeoutMs()) {
                throw new CircuitOpenException(name, config.getTimeoutMs() - elapsed);
            }
            transitionTo(CircuitState.HALF_OPEN, now);
        } else if (state == CircuitState.CLOSED) {
            forgetStaleFailures(now);
        }
    }

    private synchronized void onSuccess() {
        if (state == CircuitState.HALF_OPEN) {
            halfOpenSuccesses++;
            if (halfOpenSuccesses >= config.getSuccessThreshold()) {
                transitionTo(CircuitState.CLOSED, clock.instant());
            }
        } else if (state == CircuitState.CLOSED) {
            consecutiveFailures = 0;
        }
    }

    private synchronized void onFailure() {
        Instant now = clock.instant();
        totalFailures++;

        if (state == CircuitState.HALF_OPEN) {
            lastFailureTime = now;
            transitionTo(CircuitState.OPEN, now);
            return;
        }

        forgetStaleFailures(now);
        lastFailureTime = now;
        consecutiveFailures++;
        if (state == CircuitState.CLOSED && consecutiveFailures >= config.getFailureThreshold()) {
            transitionTo(CircuitState.OPEN, now);
        }
    }

    private void forgetStaleFailures(Instant now) {
        if (consecutiveFailures > 0 && lastFailureTime != null
                && Duration.between(lastFailureTime, now).toMillis() >= config.getResetTimeoutMs()) {
            log.debug("[CircuitBreaker:{}] Resetting {} stale failures", name, consecutiveFailures);
            consecutiveFailures = 0;
        }
    }

    private void transitionTo(CircuitState newState, Instant now) {
        CircuitState oldState = state;
        state = newState;
        lastStateChange = now;

        switch (newState) {
        case OPEN -> {
            openedAt = now;
            halfOpenSuccesses = 0;
        }
        case HALF_OPEN -> halfOpenSuccesses = 0;
        case CLOSED -> {
            consecutiveFailures = 0;
            halfOpenSuccesses = 0;
        }
        }

        if (newState == CircuitState.OPEN) {
            log.warn("[CircuitBreaker:{}] {} -> {} (cooldown {}ms)", name, oldState, newState,
                    config.getTimeoutMs());
        } else {
            log.info("[CircuitBreaker:{}] {} -> {}", name, oldState, newState);
        }
    }

    public synchronized void reset() {
        transitionTo(CircuitState.CLOSED, clock.instant());
        lastFailureTime = null;
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized CircuitBreakerStats getStats() {
        if (state == CircuitState.CLOSED) {
            forgetStaleFailures(clock.instant());
        }
        return CircuitBreakerStats.builder()
                .name(name)
                .state(state)
                .consecutiveFailures(consecutiveFailures)
                .halfOpenSuccesses(halfOpenSuccesses)
                .totalRequests(totalRequests)
                .totalFailures(totalFailures)
                .lastFailureTime(lastFailureTime)
                .lastStateChange(lastStateChange)
                .build();
    }

    public String getName() {
        return name;
    }
}
