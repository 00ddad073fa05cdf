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
package me.golemcore.workbridge.security;

import me.golemcore.workbridge.infrastructure.config.WorkbridgeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides which chat users may talk to the bridge at all.
 *
 * <p>
 * A user must be on the channel's {@code allow-from} list when that list is
 * non-empty, and must not be in {@code security.blocked-users}. An unknown
 * channel admits nobody.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AllowlistValidator {

    private final WorkbridgeProperties properties;

    public boolean isAllowed(String channelType, String userId) {
        WorkbridgeProperties.ChannelProperties channelProps = properties.getChannels().get(channelType);
        if (channelProps == null) {
            log.warn("[Security] Unauthorized: channel={}, user={} (unknown channel)", channelType, userId);
            return false;
        }

        List<String> allowedUsers = channelProps.getAllowFrom();
        if (allowedUsers == null || allowedUsers.isEmpty()) {
            return true;
        }

        boolean allowed = allowedUsers.contains(userId);
        if (!allowed) {
            log.warn("[Security] Unauthorized: channel={}, user={}", channelType, userId);
        }
        return allowed;
    }

    public boolean isBlocked(String userId) {
        List<String> blockedUsers = properties.getSecurity().getBlockedUsers();
        if (blockedUsers == null || blockedUsers.isEmpty()) {
            return false;
        }
        boolean blocked = blockedUsers.contains(userId);
        if (blocked) {
            log.warn("[Security] Blocked user: {}", userId);
        }
        return blocked;
    }
}
