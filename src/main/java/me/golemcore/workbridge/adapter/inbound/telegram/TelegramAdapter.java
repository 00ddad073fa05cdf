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
package me.golemcore.workbridge.adapter.inbound.telegram;

import me.golemcore.workbridge.domain.exception.DeliveryException;
import me.golemcore.workbridge.domain.model.ErrorCategory;
import me.golemcore.workbridge.domain.model.InboundMessage;
import me.golemcore.workbridge.domain.model.InboundMessageEvent;
import me.golemcore.workbridge.infrastructure.config.WorkbridgeProperties;
import me.golemcore.workbridge.infrastructure.i18n.MessageService;
import me.golemcore.workbridge.port.inbound.ChannelPort;
import me.golemcore.workbridge.security.AllowlistValidator;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Telegram channel using long polling.
 *
 * <p>
 * Inbound text from authorized users is handed to the registered handler and
 * published as an {@link InboundMessageEvent}; everyone else gets a short
 * refusal. Outbound messages use Markdown and fall back to plain text when
 * Telegram rejects the entities. Send failures surface as
 * {@link DeliveryException}: HTTP 429 is rate limiting, 5xx a server error,
 * other 4xx a permanent client error, anything else a network problem.
 *
 * <p>
 * Active only when {@code workbridge.channels.telegram.enabled=true} and a
 * token is configured. Messages are not split here; callers keep them under
 * the channel limit.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramAdapter implements ChannelPort, LongPollingSingleThreadUpdateConsumer {

    private static final String CHANNEL_TYPE = "telegram";
    private static final String PARSE_MODE = "Markdown";
    private static final String ENTITY_PARSE_ERROR = "can't parse entities";

    private final WorkbridgeProperties properties;
    private final AllowlistValidator allowlistValidator;
    private final ApplicationEventPublisher eventPublisher;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final MessageService messageService;
    private final Clock clock;

    private TelegramClient telegramClient;
    private volatile Consumer<InboundMessage> messageHandler;
    private volatile boolean running = false;
    private final Object lifecycleLock = new Object();

    /**
     * Package-private setter for testing, allows injecting a mock TelegramClient.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
    }

    private WorkbridgeProperties.ChannelProperties settings() {
        return properties.getChannels().get(CHANNEL_TYPE);
    }

    private boolean isEnabled() {
        WorkbridgeProperties.ChannelProperties settings = settings();
        return settings != null && settings.isEnabled();
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("[Telegram] Adapter already running");
                return;
            }
            if (!isEnabled()) {
                log.info("[Telegram] Channel disabled");
                return;
            }
            String token = settings().getToken();
            if (token == null || token.isBlank()) {
                log.warn("[Telegram] Token not configured, adapter will not start");
                return;
            }
            if (telegramClient == null) {
                telegramClient = new OkHttpTelegramClient(token);
            }

            try {
                botsApplication.registerBot(token, this);
                running = true;
                log.info("[Telegram] Adapter started");
            } catch (TelegramApiException e) {
                log.error("[Telegram] Failed to start adapter", e);
            }
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            try {
                botsApplication.close();
                log.info("[Telegram] Adapter stopped");
            } catch (Exception e) {
                log.error("[Telegram] Error stopping adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void consume(Update update) {
        if (update.hasMessage() && update.getMessage().hasText()) {
            handleMessage(update.getMessage());
        }
    }

    private void handleMessage(org.telegram.telegrambots.meta.api.objects.message.Message telegramMessage) {
        String chatId = telegramMessage.getChatId().toString();
        String userId = telegramMessage.getFrom().getId().toString();

        if (!isAuthorized(userId)) {
            log.warn("[Telegram] Unauthorized user {} in chat {}", userId, chatId);
            sendMessage(chatId, messageService.getMessage("security.unauthorized"))
                    .exceptionally(ex -> {
                        log.debug("[Telegram] Failed to send refusal to {}: {}", chatId, ex.getMessage());
                        return null;
                    });
            return;
        }

        InboundMessage message = InboundMessage.builder()
                .channelType(CHANNEL_TYPE)
                .chatId(chatId)
                .senderId(userId)
                .text(telegramMessage.getText())
                .timestamp(clock.instant())
                .build();

        Consumer<InboundMessage> handler = this.messageHandler;
        if (handler != null) {
            handler.accept(message);
        }
        eventPublisher.publishEvent(new InboundMessageEvent(message));
    }

    @Override
    public CompletableFuture<Void> sendMessage(String chatId, String content) {
        return CompletableFuture.runAsync(() -> {
            TelegramClient client = telegramClient;
            if (client == null) {
                throw new DeliveryException(ErrorCategory.CLIENT, "Telegram client not initialized", null);
            }
            try {
                sendFormatted(client, chatId, content);
            } catch (TelegramApiException e) {
                throw toDeliveryException(chatId, e);
            }
        });
    }

    private void sendFormatted(TelegramClient client, String chatId, String content) throws TelegramApiException {
        SendMessage markdown = SendMessage.builder()
                .chatId(chatId)
                .text(content)
                .parseMode(PARSE_MODE)
                .build();
        try {
            client.execute(markdown);
        } catch (TelegramApiRequestException e) {
            if (e.getMessage() == null || !e.getMessage().contains(ENTITY_PARSE_ERROR)) {
                throw e;
            }
            log.debug("[Telegram] Markdown rejected, retrying as plain text: {}", e.getMessage());
            client.execute(SendMessage.builder()
                    .chatId(chatId)
                    .text(content)
                    .build());
        }
    }

    static DeliveryException toDeliveryException(String chatId, TelegramApiException e) {
        ErrorCategory category = ErrorCategory.NETWORK;
        if (e instanceof TelegramApiRequestException requestException && requestException.getErrorCode() != null) {
            int code = requestException.getErrorCode();
            if (code == 429) {
                category = ErrorCategory.RATE_LIMITED;
            } else if (code >= 500) {
                category = ErrorCategory.SERVER;
            } else if (code >= 400) {
                category = ErrorCategory.CLIENT;
            }
        }
        return new DeliveryException(category, "Telegram send to " + chatId + " failed: " + e.getMessage(), e);
    }

    @Override
    public boolean isAuthorized(String senderId) {
        return allowlistValidator.isAllowed(CHANNEL_TYPE, senderId)
                && !allowlistValidator.isBlocked(senderId);
    }

    @Override
    public void onMessage(Consumer<InboundMessage> handler) {
        this.messageHandler = handler;
    }
}
