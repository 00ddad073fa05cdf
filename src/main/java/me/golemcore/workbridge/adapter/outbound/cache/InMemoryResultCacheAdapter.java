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
package me.golemcore.workbridge.adapter.outbound.cache;

import me.golemcore.workbridge.domain.model.CommandResult;
import me.golemcore.workbridge.infrastructure.config.WorkbridgeProperties;
import me.golemcore.workbridge.port.outbound.ResultCachePort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * In-process TTL cache for command results.
 *
 * <p>
 * Expired entries are ignored on read and purged periodically. When the cache
 * is full, roughly the 10% of entries closest to expiry are evicted before a
 * new one is stored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InMemoryResultCacheAdapter implements ResultCachePort {

    private final WorkbridgeProperties properties;
    private final Clock clock;

    private final Map<String, CachedResult> entries = new ConcurrentHashMap<>();
    private ScheduledExecutorService cleanupExecutor;

    @PostConstruct
    public void init() {
        long interval = properties.getWorkspaceClient().getCacheCleanupInterval();
        cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "result-cache-cleanup");
            t.setDaemon(true);
            return t;
        });
        cleanupExecutor.scheduleAtFixedRate(this::purgeExpired, interval, interval, TimeUnit.MILLISECONDS);
    }

    @Override
    public Optional<CommandResult> get(String key) {
        CachedResult cached = entries.get(key);
        if (cached == null) {
            return Optional.empty();
        }
        if (cached.isExpired(clock.instant())) {
            entries.remove(key, cached);
            return Optional.empty();
        }
        return Optional.of(cached.result());
    }

    @Override
    public void put(String key, CommandResult result, long ttlMs) {
        if (entries.size() >= properties.getWorkspaceClient().getCacheMaxEntries()) {
            evictOldest();
        }
        entries.put(key, new CachedResult(result, clock.instant().plusMillis(ttlMs)));
    }

    @Override
    public void evictByPrefix(String keyPrefix) {
        entries.keySet().removeIf(key -> key.startsWith(keyPrefix));
    }

    int size() {
        return entries.size();
    }

    void purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(e -> e.getValue().isExpired(now));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("[Cache] Purged {} expired entries", removed);
        }
    }

    private void evictOldest() {
        int toRemove = Math.max(1, entries.size() / 10);

        List<Map.Entry<String, CachedResult>> sorted = new ArrayList<>(entries.entrySet());
        sorted.sort(Comparator.comparing(e -> e.getValue().expiresAt()));

        for (int i = 0; i < toRemove && i < sorted.size(); i++) {
            entries.remove(sorted.get(i).getKey());
        }
    }

    @PreDestroy
    public void destroy() {
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdownNow();
        }
    }

    private record CachedResult(CommandResult result, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
