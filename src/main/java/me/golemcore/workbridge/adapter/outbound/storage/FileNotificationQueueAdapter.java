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
package me.golemcore.workbridge.adapter.outbound.storage;

import me.golemcore.workbridge.domain.model.QueuedNotification;
import me.golemcore.workbridge.port.outbound.NotificationQueuePort;
import me.golemcore.workbridge.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;

/**
 * Notification queue kept in memory and mirrored to
 * {@code notifications/queue.json} after every change.
 *
 * <p>
 * The file is rewritten with {@link StoragePort#putTextAtomic}, so a crash
 * leaves either the previous or the new queue on disk, never a torn one. A
 * failed write is logged and the in-memory queue stays authoritative until
 * the next successful write.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FileNotificationQueueAdapter implements NotificationQueuePort {

    static final String DIRECTORY = "notifications";
    static final String FILE = "queue.json";
    private static final TypeReference<List<QueuedNotification>> LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private final Map<String, QueuedNotification> entries = new LinkedHashMap<>();

    @PostConstruct
    public synchronized void init() {
        String json;
        try {
            json = storagePort.getText(DIRECTORY, FILE).join();
        } catch (CompletionException e) {
            log.error("[Notifications] Failed to read queue file, starting empty: {}", e.getMessage());
            return;
        }
        if (json == null || json.isBlank()) {
            return;
        }
        try {
            List<QueuedNotification> restored = objectMapper.readValue(json, LIST_TYPE_REF);
            for (QueuedNotification item : restored) {
                if (item.getNotification() != null && item.getId() != null) {
                    entries.put(item.getId(), item);
                }
            }
            log.info("[Notifications] Restored {} queued notifications", entries.size());
        } catch (JsonProcessingException e) {
            log.error("[Notifications] Queue file is corrupt, starting empty: {}", e.getMessage());
        }
    }

    @Override
    public synchronized void enqueue(QueuedNotification item) {
        entries.put(item.getId(), item);
        persist();
    }

    @Override
    public synchronized Optional<QueuedNotification> nextDue(Instant now) {
        return entries.values().stream()
                .filter(item -> item.isDue(now))
                .findFirst();
    }

    @Override
    public synchronized void remove(Collection<String> notificationIds) {
        boolean changed = false;
        for (String id : notificationIds) {
            changed |= entries.remove(id) != null;
        }
        if (changed) {
            persist();
        }
    }

    @Override
    public synchronized void requeue(QueuedNotification item) {
        entries.remove(item.getId());
        entries.put(item.getId(), item);
        persist();
    }

    @Override
    public synchronized List<QueuedNotification> snapshot() {
        return new ArrayList<>(entries.values());
    }

    private void persist() {
        try {
            String json = objectMapper.writeValueAsString(new ArrayList<>(entries.values()));
            storagePort.putTextAtomic(DIRECTORY, FILE, json, false).join();
        } catch (JsonProcessingException | CompletionException e) {
            log.error("[Notifications] Failed to persist queue ({} entries): {}", entries.size(), e.getMessage());
        }
    }
}
