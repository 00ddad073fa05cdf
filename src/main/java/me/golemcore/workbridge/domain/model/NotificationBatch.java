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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Notifications collected for one recipient during one batch window, in
 * arrival order.
 */
public class NotificationBatch {

    private final String recipient;
    private final Instant openedAt;
    private final List<Notification> notifications = new ArrayList<>();

    public NotificationBatch(String recipient, Instant openedAt) {
        this.recipient = recipient;
        this.openedAt = openedAt;
    }

    public synchronized void add(Notification notification) {
        notifications.add(notification);
    }

    public synchronized List<Notification> getNotifications() {
        return List.copyOf(notifications);
    }

    public synchronized int size() {
        return notifications.size();
    }

    public String getRecipient() {
        return recipient;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }
}
