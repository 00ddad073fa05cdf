package me.golemcore.workbridge.domain.service;

import me.golemcore.workbridge.MutableClock;
import me.golemcore.workbridge.domain.model.WorkspaceEvent;
import me.golemcore.workbridge.domain.model.WorkspaceEventType;
import me.golemcore.workbridge.infrastructure.config.WorkbridgeProperties;
import me.golemcore.workbridge.ratelimit.EventThrottle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceEventBroadcasterTest {

    private static final String WORKSPACE = "ws-1";

    private WorkbridgeProperties properties;
    private WorkspaceEventBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        properties = new WorkbridgeProperties();
        properties.getThrottle().setSubscriberBufferSize(2);
        EventThrottle throttle = new EventThrottle(properties, MutableClock.startingAt("2026-01-01T00:00:00Z"));
        broadcaster = new WorkspaceEventBroadcaster(throttle, properties);
    }

    @AfterEach
    void tearDown() {
        broadcaster.shutdown();
    }

    private static WorkspaceEvent event(WorkspaceEventType type, int seq) {
        return WorkspaceEvent.builder()
                .workspaceId(WORKSPACE)
                .type(type)
                .payload(Map.of("seq", seq))
                .build();
    }

    private static void awaitSize(List<?> list, int size) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (list.size() < size && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
    }

    @Test
    void shouldDropEventsOverThrottleLimit() {
        assertTrue(broadcaster.publish(event(WorkspaceEventType.BUILD_COMPLETE, 1)));
        assertTrue(broadcaster.publish(event(WorkspaceEventType.BUILD_COMPLETE, 2)));
        assertFalse(broadcaster.publish(event(WorkspaceEventType.BUILD_COMPLETE, 3)));
    }

    @Test
    void shouldAcceptPublishWithoutSubscribers() {
        assertTrue(broadcaster.publish(event(WorkspaceEventType.ERROR, 1)));
    }

    @Test
    void shouldDeliverInArrivalOrderToEverySubscriber() throws InterruptedException {
        List<Object> first = new CopyOnWriteArrayList<>();
        List<Object> second = new CopyOnWriteArrayList<>();
        broadcaster.subscribe("first", e -> first.add(e.getPayload().get("seq")));
        broadcaster.subscribe("second", e -> second.add(e.getPayload().get("seq")));

        for (int i = 1; i <= 3; i++) {
            broadcaster.publish(event(WorkspaceEventType.ERROR, i));
        }
        awaitSize(first, 3);
        awaitSize(second, 3);

        assertEquals(List.of(1, 2, 3), first);
        assertEquals(List.of(1, 2, 3), second);
    }

    @Test
    void shouldIsolateFailingSubscriber() throws InterruptedException {
        List<Object> healthy = new CopyOnWriteArrayList<>();
        broadcaster.subscribe("failing", e -> {
            throw new IllegalStateException("boom");
        });
        broadcaster.subscribe("healthy", e -> healthy.add(e.getPayload().get("seq")));

        broadcaster.publish(event(WorkspaceEventType.ERROR, 1));
        broadcaster.publish(event(WorkspaceEventType.ERROR, 2));
        awaitSize(healthy, 2);

        assertEquals(List.of(1, 2), healthy);
    }

    @Test
    void shouldDropOldestEventsForLaggingSubscriber() throws InterruptedException {
        properties.getThrottle().getRules().clear();
        CountDownLatch release = new CountDownLatch(1);
        List<Object> slow = new CopyOnWriteArrayList<>();
        List<Object> fast = new CopyOnWriteArrayList<>();
        broadcaster.subscribe("slow", e -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            slow.add(e.getPayload().get("seq"));
        });
        broadcaster.subscribe("fast", e -> fast.add(e.getPayload().get("seq")));

        for (int i = 1; i <= 10; i++) {
            broadcaster.publish(event(WorkspaceEventType.FILE_CHANGED, i));
        }
        awaitSize(fast, 10);
        release.countDown();
        Thread.sleep(200);

        assertEquals(10, fast.size());
        assertTrue(slow.size() < 10, "lagging subscriber should have lost events: " + slow);
        assertEquals(10, slow.get(slow.size() - 1));
    }

    @Test
    void shouldStopDeliveringAfterDispose() throws InterruptedException {
        List<Object> received = new CopyOnWriteArrayList<>();
        Disposable subscription = broadcaster.subscribe("temp", e -> received.add(e.getPayload().get("seq")));
        broadcaster.publish(event(WorkspaceEventType.ERROR, 1));
        awaitSize(received, 1);

        subscription.dispose();
        broadcaster.publish(event(WorkspaceEventType.ERROR, 2));
        Thread.sleep(100);

        assertEquals(List.of(1), received);
    }

    @Test
    void shouldExposeForwardedEventsAsFlux() {
        StepVerifier.create(broadcaster.events().take(1))
                .then(() -> broadcaster.publish(event(WorkspaceEventType.GIT_OPERATION, 7)))
                .assertNext(e -> assertEquals(7, e.getPayload().get("seq")))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }
}
