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

package me.golemcore.workbridge.domain.exception;

import me.golemcore.workbridge.domain.model.ErrorCategory;

/**
 * Failure on the workspace agent channel: not connected, timeout, connection
 * lost or authentication rejected.
 */
public class WorkspaceChannelException extends WorkbridgeException {

    private static final long serialVersionUID = 1L;

    private final String workspaceId;

    public WorkspaceChannelException(String workspaceId, ErrorCategory category, String message) {
        super(category, message);
        this.workspaceId = workspaceId;
    }

    public static WorkspaceChannelException notConnected(String workspaceId) {
        return new WorkspaceChannelException(workspaceId, ErrorCategory.NOT_CONNECTED,
                "Workspace " + workspaceId + " is not connected");
    }

    public static WorkspaceChannelException timeout(String workspaceId, long timeoutMs) {
        return new WorkspaceChannelException(workspaceId, ErrorCategory.TIMEOUT,
                "Command timeout after " + timeoutMs + "ms");
    }

    public static WorkspaceChannelException connectionLost(String workspaceId, String reason) {
        return new WorkspaceChannelException(workspaceId, ErrorCategory.CONNECTION_LOST,
                "Connection lost: " + reason);
    }

    public static WorkspaceChannelException authFailed(String workspaceId, String reason) {
        return new WorkspaceChannelException(workspaceId, ErrorCategory.AUTH_FAILED,
                "Authentication failed: " + reason);
    }

    public String getWorkspaceId() {
        return workspaceId;
    }
}
