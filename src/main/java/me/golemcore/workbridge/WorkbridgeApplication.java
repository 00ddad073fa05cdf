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
package me.golemcore.workbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Chat-to-workspace bridge.
 *
 * <p>
 * Users send short text commands (read, list, search, status) over Telegram;
 * the bridge validates them, checks access, forwards them to the workspace
 * agent over a persistent WebSocket and replies with the result. Events
 * emitted by the workspace (builds, errors, git activity, file changes) are
 * throttled, batched per recipient and delivered back as notifications.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer     → TelegramAdapter, InboundMessageListener
 * Domain Layer    → CommandParser/Validator, WorkspaceCommandService,
 *                   WorkspaceEventBroadcaster, NotificationDispatcher
 * Infrastructure  → WorkspaceChannelClient, result cache, notification queue,
 *                   ResilientMessageSender (retry + circuit breaker)
 * </pre>
 *
 * <p>
 * All configuration lives in {@code application.properties} under the
 * {@code workbridge.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class WorkbridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(WorkbridgeApplication.class, args);
    }

}
