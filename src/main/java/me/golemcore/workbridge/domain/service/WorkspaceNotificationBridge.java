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

import me.golemcore.workbridge.domain.model.ConnectionState;
import me.golemcore.workbridge.domain.model.NotificationPriority;
import me.golemcore.workbridge.domain.model.NotificationType;
import me.golemcore.workbridge.domain.model.WorkspaceConnectionStateChangedEvent;
import me.golemcore.workbridge.domain.model.WorkspaceEvent;
import me.golemcore.workbridge.infrastructure.i18n.MessageService;
import me.golemcore.workbridge.port.outbound.NotificationFilterPort;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;

import java.util.Map;

/**
 * Routes workspace events that passed the throttle to the recipients bound to
 * the workspace, honouring each recipient's notification preferences. Also
 * raises an urgent notification when a workspace connection is given up.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkspaceNotificationBridge {

    static final String SUBSCRIBER_NAME = "notifications";

    private final WorkspaceEventBroadcaster broadcaster;
    private final WorkspaceBindingService bindingService;
    private final NotificationFilterPort notificationFilter;
    private final NotificationDispatcher dispatcher;
    private final MessageService messageService;

    private volatile Disposable subscription;

    public synchronized void start() {
        if (subscription == null) {
            subscription = broadcaster.subscribe(SUBSCRIBER_NAME, this::onWorkspaceEvent);
            log.info("[Notifications] Subscribed to workspace events");
        }
    }

    void onWorkspaceEvent(WorkspaceEvent event) {
        for (String recipient : bindingService.getRecipients(event.getWorkspaceId())) {
            if (!isWanted(recipient, event)) {
                log.debug("[Notifications] {} filtered out for {}", event.getType(), recipient);
                continue;
            }
            dispatcher.queueNotificationFromEvent(recipient, event);
        }
    }

    @EventListener
    public void onConnectionStateChanged(WorkspaceConnectionStateChangedEvent event) {
        if (event.newState() != ConnectionState.FAILED) {
            return;
        }
        String title = messageService.getMessage("notification.disconnected.title");
        String body = messageService.getMessage("notification.disconnected.body", event.workspaceId(),
                event.reason() != null ? event.reason() : "unknown");
        for (String recipient : bindingService.getRecipients(event.workspaceId())) {
            dispatcher.queueNotification(recipient, NotificationType.WORKSPACE_STATUS, NotificationPriority.URGENT,
                    title, body, Map.of("workspaceId", event.workspaceId()));
        }
    }

    private boolean isWanted(String recipient, WorkspaceEvent event) {
        try {
            return notificationFilter.shouldNotify(recipient, event.getType());
        } catch (RuntimeException e) {
            log.warn("[Notifications] Filter failed for {}, notifying anyway: {}", recipient, e.getMessage());
            return true;
        }
    }

    @PreDestroy
    public synchronized void stop() {
        if (subscription != null) {
            subscription.dispose();
            subscription = null;
        }
    }
}
