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
import me.golemcore.workbridge.domain.model.WorkspaceEventType;
import me.golemcore.workbridge.infrastructure.config.WorkbridgeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per event type rate governor for workspace events.
 *
 * <p>
 * Each {@link WorkspaceEventType} gets its own {@link ThrottleWindow} built from
 * {@code workbridge.throttle.rules.<TYPE>}. Defaults:
 * <ul>
 * <li>BUILD_COMPLETE - 2 per 5s</li>
 * <li>ERROR - 5 per 10s</li>
 * <li>GIT_OPERATION - 3 per 3s</li>
 * <li>FILE_CHANGED - 10 per 30s</li>
 * </ul>
 * A type without a rule, or with a disabled rule, is never throttled.
 *
 * @see ThrottleWindow
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventThrottle {

    private final WorkbridgeProperties properties;
    private final Clock clock;

    private final Map<WorkspaceEventType, ConfiguredWindow> windows = new ConcurrentHashMap<>();

    public ThrottleDecision tryAcquire(WorkspaceEventType type) {
        WorkbridgeProperties.ThrottleRuleProperties rule = properties.getThrottle().getRules().get(type);
        if (rule == null || !rule.isEnabled()) {
            return ThrottleDecision.unlimited();
        }

        ThrottleWindow window = resolveWindow(type, rule.getWindow(), rule.getMaxEvents());
        ThrottleDecision decision = window.tryAcquire(clock.instant());
        if (!decision.isAllowed()) {
            log.debug("[Throttle] {} dropped ({} in last {}ms)", type, decision.getRecentCount(), rule.getWindow());
        }
        return decision;
    }

    public Optional<ThrottleWindow> getWindow(WorkspaceEventType type) {
        ConfiguredWindow configured = windows.get(type);
        return configured != null ? Optional.of(configured.window()) : Optional.empty();
    }

    private ThrottleWindow resolveWindow(WorkspaceEventType type, long windowMs, int maxEvents) {
        ConfiguredWindow configured = windows.compute(type, (key, existing) -> {
            if (existing == null || existing.windowMs() != windowMs || existing.maxEvents() != maxEvents) {
                return new ConfiguredWindow(new ThrottleWindow(Duration.ofMillis(windowMs), maxEvents), windowMs,
                        maxEvents);
            }
            return existing;
        });
        return configured.window();
    }

    private record ConfiguredWindow(ThrottleWindow window, long windowMs, int maxEvents) {
    }
}
