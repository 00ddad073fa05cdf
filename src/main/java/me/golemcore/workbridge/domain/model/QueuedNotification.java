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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Entry of the durable notification queue.
 *
 * <p>
 * {@link Mode#BATCHED} entries belong to an open per-recipient batch and leave
 * the queue when that batch is delivered. {@link Mode#DIRECT} entries are sent
 * one by one by the drain loop once {@code scheduledAt} has passed.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QueuedNotification {

    public enum Mode {
        BATCHED,
        DIRECT
    }

    private Notification notification;
    private Mode mode;
    private int attempts;
    private Instant scheduledAt;

    public static QueuedNotification batched(Notification notification) {
        return QueuedNotification.builder()
                .notification(notification)
                .mode(Mode.BATCHED)
                .scheduledAt(notification.getTimestamp())
                .build();
    }

    public static QueuedNotification direct(Notification notification, Instant scheduledAt, int attempts) {
        return QueuedNotification.builder()
                .notification(notification)
                .mode(Mode.DIRECT)
                .attempts(attempts)
                .scheduledAt(scheduledAt)
                .build();
    }

    @JsonIgnore
    public String getId() {
        return notification.getId();
    }

    public boolean isDue(Instant now) {
        return mode == Mode.DIRECT && (scheduledAt == null || !scheduledAt.isAfter(now));
    }
}
