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
package me.golemcore.workbridge.port.inbound;

import me.golemcore.workbridge.domain.model.InboundMessage;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Port for messaging channels (Telegram) that carry user commands in and
 * replies and notifications out.
 *
 * <p>
 * Implementations must:
 * <ul>
 * <li>Call the registered handler for every authorized inbound text
 * message</li>
 * <li>Complete {@link #sendMessage} exceptionally with a
 * {@link me.golemcore.workbridge.domain.exception.DeliveryException} whose
 * category tells transient and permanent failures apart</li>
 * </ul>
 */
public interface ChannelPort {

    /**
     * Returns the channel type identifier (e.g., "telegram").
     */
    String getChannelType();

    void start();

    void stop();

    boolean isRunning();

    /**
     * Sends a text message to the specified chat.
     */
    CompletableFuture<Void> sendMessage(String chatId, String content);

    /**
     * Checks if a user is allowed to talk to the bridge.
     */
    boolean isAuthorized(String senderId);

    /**
     * Registers a callback handler that is invoked when new messages arrive.
     */
    void onMessage(Consumer<InboundMessage> handler);
}
