package me.golemcore.workbridge.domain.service;

import me.golemcore.workbridge.domain.model.ConnectionState;
import me.golemcore.workbridge.domain.model.NotificationPriority;
import me.golemcore.workbridge.domain.model.NotificationType;
import me.golemcore.workbridge.domain.model.WorkspaceConnectionStateChangedEvent;
import me.golemcore.workbridge.domain.model.WorkspaceEvent;
import me.golemcore.workbridge.domain.model.WorkspaceEventType;
import me.golemcore.workbridge.infrastructure.i18n.MessageService;
import me.golemcore.workbridge.port.outbound.NotificationFilterPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class WorkspaceNotificationBridgeTest {

    private static final String WORKSPACE = "ws-1";

    private WorkspaceEventBroadcaster broadcaster;
    private WorkspaceBindingService bindingService;
    private NotificationFilterPort filter;
    private NotificationDispatcher dispatcher;
    private WorkspaceNotificationBridge bridge;

    @BeforeEach
    void setUp() {
        broadcaster = mock(WorkspaceEventBroadcaster.class);
        bindingService = mock(WorkspaceBindingService.class);
        when(bindingService.getRecipients(WORKSPACE)).thenReturn(List.of("1", "2"));
        filter = mock(NotificationFilterPort.class);
        when(filter.shouldNotify(anyString(), any())).thenReturn(true);
        dispatcher = mock(NotificationDispatcher.class);
        bridge = new WorkspaceNotificationBridge(broadcaster, bindingService, filter, dispatcher,
                new MessageService());
    }

    private static WorkspaceEvent event() {
        return WorkspaceEvent.builder()
                .workspaceId(WORKSPACE)
                .type(WorkspaceEventType.BUILD_COMPLETE)
                .timestamp(Instant.now())
                .payload(Map.of("success", true))
                .build();
    }

    @Test
    void shouldSubscribeOnlyOnce() {
        when(broadcaster.subscribe(anyString(), any())).thenReturn(mock(Disposable.class));

        bridge.start();
        bridge.start();

        verify(broadcaster, times(1)).subscribe(eq("notifications"), any());
    }

    @Test
    void shouldDisposeSubscriptionOnStop() {
        Disposable subscription = mock(Disposable.class);
        when(broadcaster.subscribe(anyString(), any())).thenReturn(subscription);
        bridge.start();

        bridge.stop();

        verify(subscription).dispose();
    }

    @Test
    void shouldFanOutEventToEveryRecipient() {
        WorkspaceEvent event = event();

        bridge.onWorkspaceEvent(event);

        verify(dispatcher).queueNotificationFromEvent("1", event);
        verify(dispatcher).queueNotificationFromEvent("2", event);
    }

    @Test
    void shouldRespectRecipientPreferences() {
        when(filter.shouldNotify("2", WorkspaceEventType.BUILD_COMPLETE)).thenReturn(false);
        WorkspaceEvent event = event();

        bridge.onWorkspaceEvent(event);

        verify(dispatcher).queueNotificationFromEvent("1", event);
        verify(dispatcher, never()).queueNotificationFromEvent(eq("2"), any());
    }

    @Test
    void shouldNotifyWhenFilterFails() {
        when(filter.shouldNotify(eq("1"), any())).thenThrow(new IllegalStateException("settings unavailable"));
        WorkspaceEvent event = event();

        bridge.onWorkspaceEvent(event);

        verify(dispatcher).queueNotificationFromEvent("1", event);
    }

    @Test
    void shouldSendUrgentNotificationWhenConnectionFails() {
        bridge.onConnectionStateChanged(new WorkspaceConnectionStateChangedEvent(WORKSPACE,
                ConnectionState.RECONNECTING, ConnectionState.FAILED, "reconnect attempts exhausted"));

        verify(dispatcher).queueNotification("1", NotificationType.WORKSPACE_STATUS, NotificationPriority.URGENT,
                "Workspace Disconnected", "Lost connection to workspace ws-1: reconnect attempts exhausted",
                Map.of("workspaceId", WORKSPACE));
        verify(dispatcher).queueNotification(eq("2"), any(), eq(NotificationPriority.URGENT), anyString(),
                anyString(), any());
    }

    @Test
    void shouldIgnoreOtherStateChanges() {
        bridge.onConnectionStateChanged(new WorkspaceConnectionStateChangedEvent(WORKSPACE,
                ConnectionState.CONNECTED, ConnectionState.RECONNECTING, "closed"));

        verifyNoInteractions(dispatcher);
    }
}
