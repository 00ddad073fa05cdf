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

import me.golemcore.workbridge.domain.model.ThrottleDecision;
import me.golemcore.workbridge.domain.model.WorkspaceEvent;
import me.golemcore.workbridge.infrastructure.config.WorkbridgeProperties;
import me.golemcore.workbridge.ratelimit.EventThrottle;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Rate-limited fan-out of workspace events.
 *
 * <p>
 * Events first pass the {@link EventThrottle}; survivors are emitted into a
 * multicast sink. Every subscriber reads through its own bounded buffer on its
 * own single thread, so a slow or failing subscriber never blocks the emitter
 * or the other subscribers. When a buffer is full the oldest pending event for
 * that subscriber is dropped.
 */
@Service
@Slf4j
public class WorkspaceEventBroadcaster {

    private final EventThrottle throttle;
    private final int subscriberBufferSize;

    private final Sinks.Many<WorkspaceEvent> sink = Sinks.many().multicast().directBestEffort();
    private final List<Disposable> subscriptions = new CopyOnWriteArrayList<>();

    public WorkspaceEventBroadcaster(EventThrottle throttle, WorkbridgeProperties properties) {
        this.throttle = throttle;
        this.subscriberBufferSize = Math.max(1, properties.getThrottle().getSubscriberBufferSize());
    }

    /**
     * Offer an event for fan-out.
     *
     * @return {@code false} if the event was throttled
     */
    public synchronized boolean publish(WorkspaceEvent event) {
        ThrottleDecision decision = throttle.tryAcquire(event.getType());
        if (!decision.isAllowed()) {
            log.debug("[Events] Throttled {} from workspace {}", event.getType(), event.getWorkspaceId());
            return false;
        }

        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("[Events] No subscribers for {}", event.getType());
        } else if (result.isFailure()) {
            log.warn("[Events] Failed to emit {}: {}", event.getType(), result);
        }
        return true;
    }

    /**
     * Register a subscriber. The handler runs on a dedicated thread; exceptions
     * it throws are logged and do not end the subscription.
     */
    public Disposable subscribe(String name, Consumer<WorkspaceEvent> handler) {
        Scheduler scheduler = Schedulers.newSingle("workspace-events-" + name, true);
        Disposable subscription = sink.asFlux()
                .onBackpressureBuffer(subscriberBufferSize,
                        dropped -> log.warn("[Events] Subscriber '{}' is lagging, dropped {} event", name,
                                dropped.getType()),
                        BufferOverflowStrategy.DROP_OLDEST)
                .publishOn(scheduler, 1)
                .subscribe(event -> deliver(name, handler, event),
                        error -> log.error("[Events] Subscriber '{}' terminated: {}", name, error.getMessage()));

        Disposable handle = Disposables.composite(subscription, scheduler);
        subscriptions.add(handle);
        log.info("[Events] Subscriber '{}' registered", name);
        return handle;
    }

    /**
     * Raw view of forwarded events, without per-subscriber buffering.
     */
    public Flux<WorkspaceEvent> events() {
        return sink.asFlux();
    }

    private void deliver(String name, Consumer<WorkspaceEvent> handler, WorkspaceEvent event) {
        try {
            handler.accept(event);
        } catch (RuntimeException e) {
            log.error("[Events] Subscriber '{}' failed on {}: {}", name, event.getType(), e.getMessage(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        sink.tryEmitComplete();
        for (Disposable subscription : subscriptions) {
            subscription.dispose();
        }
        subscriptions.clear();
    }
}
