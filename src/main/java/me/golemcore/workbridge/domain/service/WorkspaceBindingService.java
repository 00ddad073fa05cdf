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

import me.golemcore.workbridge.infrastructure.config.WorkbridgeProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Which chat belongs to which workspace, read from
 * {@code workbridge.workspaces.<id>.recipients}. A chat listed under several
 * workspaces talks to the first enabled one.
 */
@Service
@RequiredArgsConstructor
public class WorkspaceBindingService {

    private final WorkbridgeProperties properties;

    public Optional<String> findWorkspaceFor(String recipient) {
        for (Map.Entry<String, WorkbridgeProperties.WorkspaceProperties> entry : properties.getWorkspaces()
                .entrySet()) {
            WorkbridgeProperties.WorkspaceProperties workspace = entry.getValue();
            if (workspace.isEnabled() && workspace.getRecipients().contains(recipient)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public List<String> getRecipients(String workspaceId) {
        WorkbridgeProperties.WorkspaceProperties workspace = properties.getWorkspaces().get(workspaceId);
        return workspace != null ? List.copyOf(workspace.getRecipients()) : List.of();
    }
}
