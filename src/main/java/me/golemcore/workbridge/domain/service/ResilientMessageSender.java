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

import me.golemcore.workbridge.domain.model.DeliveryResult;
import me.golemcore.workbridge.domain.model.ErrorCategory;
import me.golemcore.workbridge.infrastructure.config.WorkbridgeProperties;
import me.golemcore.workbridge.port.inbound.ChannelPort;
import me.golemcore.workbridge.resilience.CircuitBreaker;
import me.golemcore.workbridge.resilience.CircuitBreakerConfig;
import me.golemcore.workbridge.resilience.CircuitBreakerRegistry;
import me.golemcore.workbridge.resilience.ErrorClassifier;
import me.golemcore.workbridge.resilience.RetryExecutor;
import me.golemcore.workbridge.resilience.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Sends text to the messaging channel through a circuit breaker and retry
 * with backoff, splitting it into chunks that fit the channel's size limit.
 *
 * <p>
 * Each chunk is one protected call: the breaker wraps the whole retry loop, so
 * a chunk that exhausts its retries counts as a single breaker failure. If a
 * chunk fails after earlier chunks went out, the recipient is told how many
 * parts arrived. Blocks the calling thread; call from worker threads only.
 */
@Service
@Slf4j
public class ResilientMessageSender {

    static final String BREAKER_PREFIX = "channel:";

    private final ChannelPort channel;
    private final MessageChunker chunker;
    private final RetryExecutor retryExecutor;
    private final CircuitBreakerRegistry breakerRegistry;
    private final WorkbridgeProperties.DeliveryProperties delivery;
    private final RetryPolicy retryPolicy;
    private final CircuitBreakerConfig breakerConfig;

    public ResilientMessageSender(ChannelPort channel, MessageChunker chunker, RetryExecutor retryExecutor,
            CircuitBreakerRegistry breakerRegistry, WorkbridgeProperties properties) {
        this.channel = channel;
        this.chunker = chunker;
        this.retryExecutor = retryExecutor;
        this.breakerRegistry = breakerRegistry;
        this.delivery = properties.getDelivery();
        this.retryPolicy = buildRetryPolicy(delivery.getRetry());
        this.breakerConfig = buildBreakerConfig(delivery.getCircuitBreaker());
    }

    public DeliveryResult send(String recipient, String text) {
        List<String> chunks = chunker.split(text, delivery.getMaxMessageLength());
        int total = chunks.size();
        CircuitBreaker breaker = breakerRegistry.getOrCreate(getBreakerName(), breakerConfig);

        for (int i = 0; i < total; i++) {
            String chunk = chunks.get(i);
            try {
                breaker.execute(() -> retryExecutor.execute("send to " + recipient, retryPolicy, () -> {
                    channel.sendMessage(recipient, chunk).join();
                    return null;
                }).getOrThrow());
            } catch (Exception e) {
                Throwable cause = ErrorClassifier.unwrap(e);
                ErrorCategory category = ErrorClassifier.classify(cause);
                boolean retryable = retryPolicy.isRetryable(cause);
                log.warn("[Delivery] Failed to send chunk {}/{} to {} ({}): {}", i + 1, total, recipient, category,
                        cause.getMessage());
                if (i > 0) {
                    notifyIncomplete(recipient, i, total);
                }
                return DeliveryResult.failed(category, cause.getMessage(), retryable, i, total);
            }

            if (i < total - 1 && delivery.getChunkDelay() > 0) {
                try {
                    pauseBetweenChunks(delivery.getChunkDelay());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.debug("[Delivery] Interrupted between chunks, sending remaining parts without delay");
                }
            }
        }

        if (total > 1) {
            log.debug("[Delivery] Sent {} chunks to {}", total, recipient);
        }
        return DeliveryResult.delivered(total);
    }

    public String getBreakerName() {
        return BREAKER_PREFIX + channel.getChannelType();
    }

    void pauseBetweenChunks(long delayMs) throws InterruptedException {
        Thread.sleep(delayMs);
    }

    private void notifyIncomplete(String recipient, int received, int total) {
        String notice = "⚠️ Message delivery incomplete. Received " + received + " of " + total + " parts.";
        channel.sendMessage(recipient, notice).exceptionally(ex -> {
            log.warn("[Delivery] Failed to send incomplete-delivery notice to {}: {}", recipient,
                    ErrorClassifier.unwrap(ex).getMessage());
            return null;
        });
    }

    private static RetryPolicy buildRetryPolicy(WorkbridgeProperties.RetryProperties retry) {
        Set<ErrorCategory> categories = retry.getRetryableCategories().isEmpty()
                ? Set.of()
                : EnumSet.copyOf(retry.getRetryableCategories());
        return RetryPolicy.builder()
                .maxAttempts(retry.getMaxAttempts())
                .initialDelayMs(retry.getInitialDelay())
                .maxDelayMs(retry.getMaxDelay())
                .multiplier(retry.getMultiplier())
                .retryableCategories(categories)
                .build();
    }

    private static CircuitBreakerConfig buildBreakerConfig(WorkbridgeProperties.CircuitBreakerProperties breaker) {
        return CircuitBreakerConfig.builder()
                .failureThreshold(breaker.getFailureThreshold())
                .successThreshold(breaker.getSuccessThreshold())
                .timeoutMs(breaker.getTimeout())
                .resetTimeoutMs(breaker.getResetTimeout())
                .build();
    }
}
