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
package me.golemcore.workbridge.domain.model;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a throttle check for one event.
 */
@Data
@Builder
public class ThrottleDecision {

    private boolean allowed;
    private int recentCount;
    private int limit;
    private long retryAfterMs;

    public static ThrottleDecision unlimited() {
        return ThrottleDecision.builder()
                .allowed(true)
                .limit(Integer.MAX_VALUE)
                .build();
    }

    public static ThrottleDecision allowed(int recentCount, int limit) {
        return ThrottleDecision.builder()
                .allowed(true)
                .recentCount(recentCount)
                .limit(limit)
                .build();
    }

    public static ThrottleDecision denied(int recentCount, int limit, long retryAfterMs) {
        return ThrottleDecision.builder()
                .allowed(false)
                .recentCount(recentCount)
                .limit(limit)
                .retryAfterMs(retryAfterMs)
                .build();
    }
}
