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
package me.golemcore.workbridge.ratelimit;

import me.golemcore.workbridge.domain.model.ThrottleDecision;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window counter for a single event type.
 *
 * <p>
 * Keeps the arrival times of forwarded events. Entries older than the window
 * are pruned lazily on each check, so at most {@code maxEvents} events are let
 * through in any interval of length {@code window}.
 */
public class ThrottleWindow {

    private final Duration window;
    private final int maxEvents;
    private final Deque<Instant> recentEvents = new ArrayDeque<>();
    private Instant lastEmission;

    public ThrottleWindow(Duration window, int maxEvents) {
        this.window = window;
        this.maxEvents = maxEvents;
    }

    public synchronized ThrottleDecision tryAcquire(Instant now) {
        prune(now);
        if (recentEvents.size() >= maxEvents) {
            Instant oldest = recentEvents.peekFirst();
            long retryAfter = oldest != null
                    ? Duration.between(now, oldest.plus(window)).toMillis()
                    : window.toMillis();
            return ThrottleDecision.denied(recentEvents.size(), maxEvents, Math.max(0, retryAfter));
        }
        recentEvents.addLast(now);
        lastEmission = now;
        return ThrottleDecision.allowed(recentEvents.size(), maxEvents);
    }

    public synchronized int getRecentCount(Instant now) {
        prune(now);
        return recentEvents.size();
    }

    public synchronized Instant getLastEmission() {
        return lastEmission;
    }

    public Duration getWindow() {
        return window;
    }

    public int getMaxEvents() {
        return maxEvents;
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(window);
        while (!recentEvents.isEmpty() && !recentEvents.peekFirst().isAfter(cutoff)) {
            recentEvents.pollFirst();
        }
    }
}
