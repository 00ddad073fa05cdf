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

import me.golemcore.workbridge.domain.model.Notification;
import me.golemcore.workbridge.domain.model.NotificationType;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders notifications as chat text (Telegram Markdown).
 *
 * <pre>
 * single:  {icon} *{title}*\n\n{body}
 * batch:   🔔 *N Workspace Updates*\n\n1. {icon} *{title}*\n   {body}\n\n2. ...
 * </pre>
 */
@Component
public class NotificationFormatter {

    private static final String BATCH_ICON = "🔔";

    public String formatSingle(Notification notification) {
        return icon(notification) + " *" + notification.getTitle() + "*\n\n" + notification.getBody();
    }

    public String formatBatch(List<Notification> notifications) {
        if (notifications.size() == 1) {
            return formatSingle(notifications.get(0));
        }

        StringBuilder sb = new StringBuilder();
        sb.append(BATCH_ICON).append(" *").append(notifications.size()).append(" Workspace Updates*\n\n");
        for (int i = 0; i < notifications.size(); i++) {
            Notification notification = notifications.get(i);
            sb.append(i + 1).append(". ")
                    .append(icon(notification)).append(" *").append(notification.getTitle()).append("*\n")
                    .append("   ").append(notification.getBody())
                    .append("\n\n");
        }
        return sb.toString().trim();
    }

    private String icon(Notification notification) {
        NotificationType type = notification.getType();
        return type != null ? type.getIcon() : NotificationType.GENERAL.getIcon();
    }
}
