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
package me.golemcore.workbridge.port.outbound;

import me.golemcore.workbridge.domain.model.CommandResult;
import me.golemcore.workbridge.domain.model.ConnectionState;
import me.golemcore.workbridge.domain.model.WorkspaceCommand;

import java.util.concurrent.CompletableFuture;

/**
 * Port for executing commands on remote workspace agents.
 */
public interface WorkspacePort {

    /**
     * Execute a command on the given workspace. Completes exceptionally with
     * {@link me.golemcore.workbridge.domain.exception.WorkspaceChannelException}
     * when the workspace is not connected, the command times out or the
     * connection drops while waiting.
     */
    CompletableFuture<CommandResult> execute(String workspaceId, WorkspaceCommand command);

    ConnectionState getConnectionState(String workspaceId);

    CompletableFuture<Void> connect(String workspaceId);

    void disconnect(String workspaceId);
}
