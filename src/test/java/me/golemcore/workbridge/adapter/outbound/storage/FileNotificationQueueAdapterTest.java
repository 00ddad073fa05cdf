package me.golemcore.workbridge.adapter.outbound.storage;

import me.golemcore.workbridge.domain.model.Notification;
import me.golemcore.workbridge.domain.model.NotificationPriority;
import me.golemcore.workbridge.domain.model.NotificationType;
import me.golemcore.workbridge.domain.model.QueuedNotification;
import me.golemcore.workbridge.infrastructure.config.WorkbridgeProperties;
import me.golemcore.workbridge.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class FileNotificationQueueAdapterTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private LocalStorageAdapter storage;
    private FileNotificationQueueAdapter queue;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        WorkbridgeProperties properties = new WorkbridgeProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
        queue = new FileNotificationQueueAdapter(storage, objectMapper);
        queue.init();
    }

    private static Notification notification(String id) {
        return Notification.builder()
                .id(id)
                .recipient("42")
                .type(NotificationType.BUILD_COMPLETE)
                .priority(NotificationPriority.MEDIUM)
                .title("Build Complete")
                .body("Build completed successfully")
                .timestamp(NOW)
                .metadata(Map.of("workspaceId", "ws-1"))
                .build();
    }

    @Test
    void shouldReturnOnlyDueDirectEntries() {
        queue.enqueue(QueuedNotification.batched(notification("batched")));
        queue.enqueue(QueuedNotification.direct(notification("later"), NOW.plusSeconds(60), 1));
        queue.enqueue(QueuedNotification.direct(notification("due"), NOW, 0));

        Optional<QueuedNotification> next = queue.nextDue(NOW);

        assertEquals("due", next.orElseThrow().getId());
        assertEquals("later", queue.nextDue(NOW.plusSeconds(120)).orElseThrow().getId());
    }

    @Test
    void shouldMoveRequeuedEntryToTail() {
        queue.enqueue(QueuedNotification.direct(notification("a"), NOW, 0));
        queue.enqueue(QueuedNotification.direct(notification("b"), NOW, 0));

        queue.requeue(QueuedNotification.direct(notification("a"), NOW, 1));

        List<QueuedNotification> snapshot = queue.snapshot();
        assertEquals(List.of("b", "a"), snapshot.stream().map(QueuedNotification::getId).toList());
        assertEquals(1, snapshot.get(1).getAttempts());
    }

    @Test
    void shouldRemoveEntries() {
        queue.enqueue(QueuedNotification.direct(notification("a"), NOW, 0));
        queue.enqueue(QueuedNotification.direct(notification("b"), NOW, 0));

        queue.remove(List.of("a", "unknown"));

        assertEquals(1, queue.snapshot().size());
        assertEquals("b", queue.snapshot().get(0).getId());
    }

    @Test
    void shouldRestoreQueueAfterRestart() {
        queue.enqueue(QueuedNotification.batched(notification("a")));
        queue.enqueue(QueuedNotification.direct(notification("b"), NOW.plusSeconds(5), 2));

        FileNotificationQueueAdapter restarted = new FileNotificationQueueAdapter(storage, objectMapper);
        restarted.init();

        List<QueuedNotification> restored = restarted.snapshot();
        assertEquals(2, restored.size());
        assertEquals(QueuedNotification.Mode.BATCHED, restored.get(0).getMode());
        QueuedNotification direct = restored.get(1);
        assertEquals(QueuedNotification.Mode.DIRECT, direct.getMode());
        assertEquals(2, direct.getAttempts());
        assertEquals(NOW.plusSeconds(5), direct.getScheduledAt());
        assertEquals("ws-1", direct.getNotification().getMetadata().get("workspaceId"));
    }

    @Test
    void shouldStartEmptyWhenQueueFileIsCorrupt() throws Exception {
        Files.writeString(tempDir.resolve("notifications").resolve("queue.json"), "{not json");

        FileNotificationQueueAdapter restarted = new FileNotificationQueueAdapter(storage, objectMapper);
        restarted.init();

        assertTrue(restarted.snapshot().isEmpty());
    }

    @Test
    void shouldKeepInMemoryStateWhenPersistFails() {
        StoragePort failingStorage = mock(StoragePort.class);
        when(failingStorage.getText(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(failingStorage.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));
        FileNotificationQueueAdapter fragile = new FileNotificationQueueAdapter(failingStorage, objectMapper);
        fragile.init();

        fragile.enqueue(QueuedNotification.direct(notification("a"), NOW, 0));

        assertEquals(1, fragile.snapshot().size());
    }
}
