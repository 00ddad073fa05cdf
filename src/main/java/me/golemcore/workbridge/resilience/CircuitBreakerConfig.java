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

import lombok.Builder;
import lombok.Value;

/**
 * Thresholds for a {@link CircuitBreaker}.
 */
@Value
@Builder
public class CircuitBreakerConfig {

    /** Consecutive failures in CLOSED that open the circuit. */
    @Builder.Default
    int failureThreshold = 5;

    /** Consecutive successes in HALF_OPEN that close it again. */
    @Builder.Default
    int successThreshold = 2;

    /** Cooldown spent in OPEN before a trial call is let through. */
    @Builder.Default
    long timeoutMs = 60000;

    /** Inactivity after which the CLOSED failure counter is forgotten. */
    @Builder.Default
    long resetTimeoutMs = 300000;

    public static CircuitBreakerConfig defaults() {
        return CircuitBreakerConfig.builder().build();
    }
}
