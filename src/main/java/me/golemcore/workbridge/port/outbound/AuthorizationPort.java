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

/**
 * Access check consulted before file commands are sent to a workspace.
 */
public interface AuthorizationPort {

    /**
     * @param identity
     *            chat identity of the caller
     * @param path
     *            workspace-relative path, or {@code null} for workspace-wide
     *            access
     */
    AccessDecision authorize(String identity, String path);

    record AccessDecision(boolean allowed, String reason) {

        public static AccessDecision allow() {
            return new AccessDecision(true, null);
        }

        public static AccessDecision deny(String reason) {
            return new AccessDecision(false, reason);
        }
    }
}
