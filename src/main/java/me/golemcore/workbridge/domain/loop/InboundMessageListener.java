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
package me.golemcore.workbridge.domain.loop;

import me.golemcore.workbridge.domain.model.DeliveryResult;
import me.golemcore.workbridge.domain.model.InboundMessage;
import me.golemcore.workbridge.domain.model.InboundMessageEvent;
import me.golemcore.workbridge.domain.service.ResilientMessageSender;
import me.golemcore.workbridge.domain.service.WorkspaceCommandService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs inbound chat commands through {@link WorkspaceCommandService} and sends
 * the reply back to the same chat.
 *
 * <p>
 * The channel's polling thread only hands the message over; replies are sent
 * from a small worker pool because delivery may block on retry backoff.
 */
@Component
@Slf4j
public class InboundMessageListener {

    private static final int WORKER_THREADS = 4;

    private final WorkspaceCommandService commandService;
    private final ResilientMessageSender sender;
    private final ExecutorService replyExecutor;

    public InboundMessageListener(WorkspaceCommandService commandService, ResilientMessageSender sender) {
        this.commandService = commandService;
        this.sender = sender;
        AtomicInteger threadCounter = new AtomicInteger();
        this.replyExecutor = Executors.newFixedThreadPool(WORKER_THREADS, r -> {
            Thread t = new Thread(r, "inbound-reply-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @EventListener
    public void onInboundMessage(InboundMessageEvent event) {
        InboundMessage message = event.message();
        String chatId = message.getChatId();
        log.debug("[Inbound] Command from chat {} (channel={})", chatId, message.getChannelType());

        commandService.process(chatId, message.getText())
                .thenAcceptAsync(reply -> reply(chatId, reply), replyExecutor)
                .exceptionally(ex -> {
                    log.error("[Inbound] Failed to handle command from chat {}", chatId, ex);
                    return null;
                });
    }

    private void reply(String chatId, String reply) {
        DeliveryResult result = sender.send(chatId, reply);
        if (!result.isSuccess()) {
            log.warn("[Inbound] Reply to chat {} not delivered ({}): {}", chatId, result.getErrorCategory(),
                    result.getError());
        }
    }

    @PreDestroy
    public void shutdown() {
        replyExecutor.shutdown();
        try {
            if (!replyExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                replyExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            replyExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
