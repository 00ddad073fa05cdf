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
package me.golemcore.workbridge.domain.model;

/**
 * Notification kinds and the icon shown next to their title.
 */
public enum NotificationType {

    BUILD_COMPLETE("✅"),
    ERROR("❌"),
    GIT_OPERATION("🔀"),
    FILE_CHANGED("📝"),
    WORKSPACE_STATUS("🔔"),
    GENERAL("🔔");

    private final String icon;

    NotificationType(String icon) {
        this.icon = icon;
    }

    public String getIcon() {
        return icon;
    }

    public static NotificationType from(WorkspaceEventType eventType) {
        return switch (eventType) {
        case BUILD_COMPLETE -> BUILD_COMPLETE;
        case ERROR -> ERROR;
        case GIT_OPERATION -> GIT_OPERATION;
        case FILE_CHANGED -> FILE_CHANGED;
        };
    }
}
