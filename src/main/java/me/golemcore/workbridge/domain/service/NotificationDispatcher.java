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
package me.golemcore.workbridge.domain.service;

import me.golemcore.workbridge.domain.model.DeliveryResult;
import me.golemcore.workbridge.domain.model.Notification;
import me.golemcore.workbridge.domain.model.NotificationBatch;
import me.golemcore.workbridge.domain.model.NotificationPriority;
import me.golemcore.workbridge.domain.model.NotificationType;
import me.golemcore.workbridge.domain.model.QueuedNotification;
import me.golemcore.workbridge.domain.model.WorkspaceEvent;
import me.golemcore.workbridge.infrastructure.config.WorkbridgeProperties;
import me.golemcore.workbridge.port.outbound.NotificationQueuePort;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns notifications into delivered chat messages.
 *
 * <p>
 * Every notification is first written to the durable queue. Non-urgent ones
 * also join the recipient's open batch; the first notification of a batch
 * arms a single window timer, and when it fires the batch is removed
 * atomically and delivered as one message. A notification arriving after the
 * removal opens a new batch. Urgent notifications skip batching and are picked
 * up by the drain loop right away.
 *
 * <p>
 * A failed batch is re-queued as individual direct entries scheduled after
 * {@code retryDelay}; the drain loop keeps retrying transient failures and
 * drops permanent ones. Batched entries still in the queue at startup are
 * rebuilt into batches, so a crash may deliver a notification twice but never
 * loses one.
 *
 * <p>
 * Threads: a single timer thread only fires window timers and drain ticks.
 * Batch deliveries run on a pool of {@code deliveryThreads} workers and the
 * drain loop on its own thread, so slow batch sends never hold up urgent
 * notifications.
 */
@Service
@Slf4j
public class NotificationDispatcher {

    private final NotificationQueuePort queue;
    private final ResilientMessageSender sender;
    private final NotificationFormatter formatter;
    private final EventNotificationMapper mapper;
    private final WorkbridgeProperties.NotificationProperties settings;
    private final Clock clock;

    private final Map<String, NotificationBatch> batches = new ConcurrentHashMap<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean drainRequested = new AtomicBoolean(false);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final ScheduledExecutorService scheduler;
    private final ExecutorService batchExecutor;
    private final ExecutorService drainExecutor;

    public NotificationDispatcher(NotificationQueuePort queue, ResilientMessageSender sender,
            NotificationFormatter formatter, EventNotificationMapper mapper, WorkbridgeProperties properties,
            Clock clock) {
        this.queue = queue;
        this.sender = sender;
        this.formatter = formatter;
        this.mapper = mapper;
        this.settings = properties.getNotifications();
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(daemonThreads("notification-timer"));
        this.batchExecutor = Executors.newFixedThreadPool(Math.max(1, settings.getDeliveryThreads()),
                daemonThreads("notification-batch"));
        this.drainExecutor = Executors.newSingleThreadExecutor(daemonThreads("notification-drain"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger threadCounter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        recoverBatches();
        long interval = settings.getDrainInterval();
        scheduler.scheduleWithFixedDelay(this::triggerDrain, interval, interval, TimeUnit.MILLISECONDS);
        triggerDrain();
        log.info("[Notifications] Dispatcher started (batchWindow={}ms, drainInterval={}ms)",
                settings.getBatchWindow(), interval);
    }

    /**
     * Queue a notification for delivery.
     *
     * @return the generated notification id
     */
    public String queueNotification(String recipient, NotificationType type, NotificationPriority priority,
            String title, String body, Map<String, String> metadata) {
        Notification notification = Notification.builder()
                .id(UUID.randomUUID().toString())
                .recipient(recipient)
                .type(type)
                .priority(priority)
                .title(title)
                .body(body)
                .timestamp(clock.instant())
                .metadata(metadata != null ? new HashMap<>(metadata) : new HashMap<>())
                .build();

        if (notification.isUrgent()) {
            queue.enqueue(QueuedNotification.direct(notification, notification.getTimestamp(), 0));
            log.debug("[Notifications] Urgent notification {} for {} queued for immediate delivery",
                    notification.getId(), recipient);
            triggerDrain();
        } else {
            queue.enqueue(QueuedNotification.batched(notification));
            addToBatch(notification);
        }
        return notification.getId();
    }

    public String queueNotificationFromEvent(String recipient, WorkspaceEvent event) {
        EventNotificationMapper.EventNotification content = mapper.map(event);
        return queueNotification(recipient, content.type(), content.priority(), content.title(), content.body(),
                content.metadata());
    }

    /**
     * Deliver the recipient's open batch now instead of waiting for its timer.
     */
    public void flushBatch(String recipient) {
        NotificationBatch batch = batches.get(recipient);
        if (batch != null) {
            flushBatch(recipient, batch);
        }
    }

    public int getPendingBatchSize(String recipient) {
        NotificationBatch batch = batches.get(recipient);
        return batch != null ? batch.size() : 0;
    }

    public int getOpenBatchCount() {
        return batches.size();
    }

    private void addToBatch(Notification notification) {
        String recipient = notification.getRecipient();
        AtomicBoolean opened = new AtomicBoolean(false);
        NotificationBatch batch = batches.compute(recipient, (key, existing) -> {
            NotificationBatch target = existing;
            if (target == null) {
                target = new NotificationBatch(key, clock.instant());
                opened.set(true);
            }
            target.add(notification);
            return target;
        });

        if (opened.get()) {
            log.debug("[Notifications] Opened batch for {} ({}ms window)", recipient, settings.getBatchWindow());
            try {
                scheduler.schedule(() -> submitFlush(recipient, batch), settings.getBatchWindow(),
                        TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.warn("[Notifications] Dispatcher stopped, batch for {} stays queued", recipient);
            }
        }
    }

    private void submitFlush(String recipient, NotificationBatch batch) {
        try {
            batchExecutor.execute(() -> flushBatch(recipient, batch));
        } catch (RejectedExecutionException e) {
            log.warn("[Notifications] Dispatcher stopped, batch for {} stays queued", recipient);
        }
    }

    private void flushBatch(String recipient, NotificationBatch batch) {
        if (!batches.remove(recipient, batch)) {
            return;
        }
        try {
            deliverBatch(batch);
        } catch (RuntimeException e) {
            log.error("[Notifications] Unexpected error delivering batch for {}", recipient, e);
        }
    }

    private void deliverBatch(NotificationBatch batch) {
        List<Notification> notifications = batch.getNotifications();
        if (notifications.isEmpty()) {
            return;
        }
        String recipient = batch.getRecipient();
        List<String> ids = notifications.stream().map(Notification::getId).toList();

        DeliveryResult result = sender.send(recipient, formatter.formatBatch(notifications));
        if (result.isSuccess()) {
            queue.remove(ids);
            log.info("[Notifications] Delivered {} notification(s) to {}", notifications.size(), recipient);
            return;
        }
        if (!result.isRetryable()) {
            queue.remove(ids);
            log.error("[Notifications] Dropping {} notification(s) for {} after permanent failure: {}",
                    notifications.size(), recipient, result.getError());
            return;
        }

        Instant retryAt = clock.instant().plusMillis(settings.getRetryDelay());
        for (Notification notification : notifications) {
            queue.requeue(QueuedNotification.direct(notification, retryAt, 1));
        }
        log.warn("[Notifications] Batch delivery to {} failed ({}), re-queued {} notification(s) individually",
                recipient, result.getError(), notifications.size());
    }

    private void triggerDrain() {
        try {
            drainExecutor.execute(this::drainQueue);
        } catch (RejectedExecutionException e) {
            log.debug("[Notifications] Dispatcher stopped, drain skipped");
        }
    }

    void drainQueue() {
        if (!draining.compareAndSet(false, true)) {
            drainRequested.set(true);
            return;
        }
        try {
            do {
                drainRequested.set(false);
                drainDueEntries();
            } while (drainRequested.get());
        } catch (RuntimeException e) {
            log.error("[Notifications] Drain loop failed", e);
        } finally {
            draining.set(false);
        }
    }

    private void drainDueEntries() {
        Set<String> attempted = new HashSet<>();
        while (true) {
            Optional<QueuedNotification> next = queue.nextDue(clock.instant());
            if (next.isEmpty() || !attempted.add(next.get().getId())) {
                return;
            }
            deliverDirect(next.get());
        }
    }

    private void deliverDirect(QueuedNotification item) {
        Notification notification = item.getNotification();
        DeliveryResult result = sender.send(notification.getRecipient(), formatter.formatSingle(notification));

        if (result.isSuccess()) {
            queue.remove(List.of(notification.getId()));
            log.debug("[Notifications] Delivered notification {} to {}", notification.getId(),
                    notification.getRecipient());
        } else if (!result.isRetryable()) {
            queue.remove(List.of(notification.getId()));
            log.error("[Notifications] Dropping notification {} for {} after permanent failure: {}",
                    notification.getId(), notification.getRecipient(), result.getError());
        } else {
            int attempts = item.getAttempts() + 1;
            queue.requeue(QueuedNotification.direct(notification,
                    clock.instant().plusMillis(settings.getRetryDelay()), attempts));
            log.warn("[Notifications] Delivery of {} to {} failed (attempt {}): {}", notification.getId(),
                    notification.getRecipient(), attempts, result.getError());
        }
    }

    private void recoverBatches() {
        int recovered = 0;
        for (QueuedNotification item : queue.snapshot()) {
            if (item.getMode() == QueuedNotification.Mode.BATCHED) {
                addToBatch(item.getNotification());
                recovered++;
            }
        }
        if (recovered > 0) {
            log.info("[Notifications] Recovered {} batched notification(s) from the queue", recovered);
        }
    }

    /**
     * Flush every open batch, then stop the timers and the drain loop. Entries
     * whose delivery fails here stay in the durable queue.
     */
    @PreDestroy
    public void stop() {
        int open = batches.size();
        for (Map.Entry<String, NotificationBatch> entry : Map.copyOf(batches).entrySet()) {
            flushBatch(entry.getKey(), entry.getValue());
        }
        scheduler.shutdownNow();
        batchExecutor.shutdownNow();
        drainExecutor.shutdownNow();
        try {
            batchExecutor.awaitTermination(2, TimeUnit.SECONDS);
            drainExecutor.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[Notifications] Dispatcher stopped ({} open batch(es) flushed)", open);
    }
}
