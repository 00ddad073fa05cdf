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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Event received from a workspace agent. Ephemeral; only forwarded, never
 * stored.
 */
@Value
@Builder
public class WorkspaceEvent {

    String workspaceId;
    WorkspaceEventType type;
    Instant timestamp;
    @Builder.Default
    Map<String, Object> payload = Map.of();

    public String payloadString(String key) {
        Object value = payload != null ? payload.get(key) : null;
        return value != null ? value.toString() : null;
    }
}
