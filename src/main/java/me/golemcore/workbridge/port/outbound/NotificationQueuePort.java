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
package me.golemcore.workbridge.port.outbound;

import me.golemcore.workbridge.domain.model.QueuedNotification;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable FIFO queue of notifications awaiting delivery. Read by a single
 * dispatcher; entries survive restarts and may be delivered more than once if
 * the process dies between delivery and removal.
 */
public interface NotificationQueuePort {

    void enqueue(QueuedNotification item);

    /**
     * Oldest DIRECT entry whose scheduled time has passed. Does not remove it.
     */
    Optional<QueuedNotification> nextDue(Instant now);

    void remove(Collection<String> notificationIds);

    /**
     * Replace the entry with the same notification id, moving it to the tail.
     */
    void requeue(QueuedNotification item);

    List<QueuedNotification> snapshot();
}
