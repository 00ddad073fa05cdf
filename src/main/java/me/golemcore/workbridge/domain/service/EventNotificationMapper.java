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

import me.golemcore.workbridge.domain.model.NotificationPriority;
import me.golemcore.workbridge.domain.model.NotificationType;
import me.golemcore.workbridge.domain.model.WorkspaceEvent;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Derives title, body and priority of a notification from a workspace event.
 */
@Component
public class EventNotificationMapper {

    public EventNotification map(WorkspaceEvent event) {
        Map<String, String> metadata = new HashMap<>();
        metadata.put("workspaceId", event.getWorkspaceId());
        metadata.put("eventType", event.getType().name());

        NotificationType type = NotificationType.from(event.getType());
        return switch (event.getType()) {
        case BUILD_COMPLETE -> mapBuild(event, type, metadata);
        case ERROR -> new EventNotification(type, NotificationPriority.HIGH, "Error Detected",
                describeError(event), metadata);
        case GIT_OPERATION -> new EventNotification(type, NotificationPriority.MEDIUM, "Git Operation",
                describeGitOperation(event), metadata);
        case FILE_CHANGED -> new EventNotification(type, NotificationPriority.LOW, "File Changed",
                "File modified: " + firstNonNull(event.payloadString("path"), event.payloadString("filePath"),
                        "unknown"),
                metadata);
        };
    }

    private EventNotification mapBuild(WorkspaceEvent event, NotificationType type, Map<String, String> metadata) {
        if (isSuccessfulBuild(event)) {
            Object duration = event.getPayload().get("duration");
            String body = duration != null
                    ? "Build completed successfully in " + formatNumber(duration) + "ms"
                    : "Build completed successfully";
            return new EventNotification(type, NotificationPriority.LOW, "Build Complete", body, metadata);
        }

        String error = event.payloadString("error");
        if (error == null && event.getPayload().get("errors") != null) {
            error = formatNumber(event.getPayload().get("errors")) + " error(s)";
        }
        return new EventNotification(type, NotificationPriority.HIGH, "Build Failed",
                "Build failed: " + (error != null ? error : "unknown error"), metadata);
    }

    private boolean isSuccessfulBuild(WorkspaceEvent event) {
        Object success = event.getPayload().get("success");
        if (success instanceof Boolean flag) {
            return flag;
        }
        return "success".equalsIgnoreCase(event.payloadString("status"));
    }

    private String describeError(WorkspaceEvent event) {
        String message = firstNonNull(event.payloadString("message"), event.payloadString("error"),
                "An error occurred in the workspace");
        String file = event.payloadString("file");
        return file != null ? message + " (" + file + ")" : message;
    }

    private String describeGitOperation(WorkspaceEvent event) {
        String operation = firstNonNull(event.payloadString("operation"), "Git operation", null);
        String message = event.payloadString("message");
        return message != null && !message.isBlank()
                ? operation + " completed: " + message
                : operation + " completed";
    }

    private static String formatNumber(Object value) {
        if (value instanceof Number number && number.doubleValue() == Math.rint(number.doubleValue())) {
            return Long.toString(number.longValue());
        }
        return String.valueOf(value);
    }

    private static String firstNonNull(String first, String second, String fallback) {
        if (first != null) {
            return first;
        }
        return second != null ? second : fallback;
    }

    public record EventNotification(NotificationType type, NotificationPriority priority, String title,
            String body, Map<String, String> metadata) {
    }
}
