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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named circuit breakers, created on first use. The first config supplied for
 * a name wins.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CircuitBreakerRegistry {

    private final Clock clock;

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreaker getOrCreate(String name, CircuitBreakerConfig config) {
        return breakers.computeIfAbsent(name, key -> {
            log.debug("[CircuitBreaker:{}] Created (failureThreshold={}, timeout={}ms)", key,
                    config.getFailureThreshold(), config.getTimeoutMs());
            return new CircuitBreaker(key, config, clock);
        });
    }

    public Optional<CircuitBreakerStats> getStats(String name) {
        CircuitBreaker breaker = breakers.get(name);
        return breaker != null ? Optional.of(breaker.getStats()) : Optional.empty();
    }

    public Map<String, CircuitBreakerStats> getAllStats() {
        Map<String, CircuitBreakerStats> stats = new ConcurrentHashMap<>();
        breakers.forEach((name, breaker) -> stats.put(name, breaker.getStats()));
        return stats;
    }

    public boolean reset(String name) {
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        log.info("[CircuitBreaker:{}] Manually reset", name);
        return true;
    }
}
