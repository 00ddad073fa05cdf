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
import me.golemcore.workbridge.port.outbound.AuthorizationPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

/**
 * Properties-backed access check for file commands.
 *
 * <p>
 * Blocked users are always denied. Otherwise the requested path must lie
 * under one of the identity's accessible directories, falling back to
 * {@code default-accessible-directories}. With no directories configured at
 * all, every path is allowed. Paths are compared after normalization, so
 * {@code src/../secrets} is not inside {@code src}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PathAccessPolicy implements AuthorizationPort {

    private static final Path ROOT = Path.of(".");

    private final WorkbridgeProperties properties;

    @Override
    public AccessDecision authorize(String identity, String path) {
        WorkbridgeProperties.SecurityProperties security = properties.getSecurity();
        if (security.getBlockedUsers().contains(identity)) {
            log.warn("[Security] Blocked user {} tried to access {}", identity, path);
            return AccessDecision.deny("user is blocked");
        }

        List<String> directories = security.getAccessibleDirectories().getOrDefault(identity,
                security.getDefaultAccessibleDirectories());
        if (directories == null || directories.isEmpty()) {
            return AccessDecision.allow();
        }

        Path requested;
        try {
            requested = normalize(path);
        } catch (InvalidPathException e) {
            return AccessDecision.deny("invalid path");
        }

        for (String directory : directories) {
            Path allowed = normalize(directory);
            if (allowed.equals(ROOT.normalize()) || requested.startsWith(allowed)) {
                return AccessDecision.allow();
            }
        }
        log.debug("[Security] Denied {} for {} (allowed: {})", path, identity, directories);
        return AccessDecision.deny("path is outside your accessible directories");
    }

    private static Path normalize(String path) {
        if (path == null || path.isBlank() || ".".equals(path)) {
            return ROOT.normalize();
        }
        return Path.of(path).normalize();
    }
}
