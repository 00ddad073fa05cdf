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
package me.golemcore.workbridge.adapter.outbound.settings;

import me.golemcore.workbridge.domain.model.WorkspaceEventType;
import me.golemcore.workbridge.infrastructure.config.WorkbridgeProperties;
import me.golemcore.workbridge.port.outbound.NotificationFilterPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Per-recipient notification preferences from
 * {@code workbridge.notifications.recipients.<id>}. Recipients without an
 * entry receive everything.
 */
@Component
@RequiredArgsConstructor
public class PropertiesNotificationFilter implements NotificationFilterPort {

    private final WorkbridgeProperties properties;

    @Override
    public boolean shouldNotify(String recipient, WorkspaceEventType eventType) {
        WorkbridgeProperties.RecipientProperties settings = properties.getNotifications().getRecipients()
                .get(recipient);
        if (settings == null) {
            return true;
        }
        if (!settings.isEnabled()) {
            return false;
        }
        return settings.getTypes() == null || settings.getTypes().isEmpty()
                || settings.getTypes().contains(eventType);
    }
}
