package me.golemcore.workbridge.domain.service;

import me.golemcore.workbridge.domain.exception.DeliveryException;
import me.golemcore.workbridge.domain.model.DeliveryResult;
import me.golemcore.workbridge.domain.model.ErrorCategory;
import me.golemcore.workbridge.infrastructure.config.WorkbridgeProperties;
import me.golemcore.workbridge.port.inbound.ChannelPort;
import me.golemcore.workbridge.resilience.CircuitBreakerRegistry;
import me.golemcore.workbridge.resilience.CircuitState;
import me.golemcore.workbridge.resilience.RetryExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ResilientMessageSenderTest {

    private static final String CHAT_ID = "42";

    private ChannelPort channel;
    private WorkbridgeProperties properties;
    private CircuitBreakerRegistry registry;
    private List<Long> pauses;
    private ResilientMessageSender sender;

    @BeforeEach
    void setUp() {
        channel = mock(ChannelPort.class);
        when(channel.getChannelType()).thenReturn("telegram");
        when(channel.sendMessage(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));

        properties = new WorkbridgeProperties();
        properties.getDelivery().setMaxMessageLength(100);
        properties.getDelivery().getRetry().setInitialDelay(1);
        properties.getDelivery().getRetry().setMaxDelay(1);
        properties.getDelivery().getCircuitBreaker().setFailureThreshold(2);
        registry = new CircuitBreakerRegistry(Clock.systemUTC());
        pauses = new ArrayList<>();
        sender = newSender();
    }

    private ResilientMessageSender newSender() {
        return new ResilientMessageSender(channel, new MessageChunker(), new RetryExecutor(), registry, properties) {
            @Override
            void pauseBetweenChunks(long delayMs) {
                pauses.add(delayMs);
            }
        };
    }

    private static CompletableFuture<Void> failure(ErrorCategory category) {
        return CompletableFuture.failedFuture(new DeliveryException(category, category + " failure", null));
    }

    // ===== Success =====

    @Test
    void shouldSendShortMessageAsSingleChunk() {
        DeliveryResult result = sender.send(CHAT_ID, "hello");

        assertTrue(result.isSuccess());
        assertEquals(1, result.getTotalChunks());
        verify(channel).sendMessage(CHAT_ID, "hello");
        assertTrue(pauses.isEmpty());
    }

    @Test
    void shouldSendLongMessageInOrderedChunks() {
        DeliveryResult result = sender.send(CHAT_ID, "z".repeat(200));

        assertTrue(result.isSuccess());
        assertEquals(3, result.getChunksSent());
        ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
        verify(channel, times(3)).sendMessage(eq(CHAT_ID), captor.capture());
        assertFalse(captor.getAllValues().get(0).startsWith("[Part"));
        assertTrue(captor.getAllValues().get(1).startsWith("[Part 2/3]"));
        assertTrue(captor.getAllValues().get(2).startsWith("[Part 3/3]"));
        assertEquals(List.of(500L, 500L), pauses);
    }

    // ===== Failures =====

    @Test
    void shouldNotRetryPermanentFailure() {
        when(channel.sendMessage(anyString(), anyString())).thenReturn(failure(ErrorCategory.CLIENT));

        DeliveryResult result = sender.send(CHAT_ID, "hello");

        assertFalse(result.isSuccess());
        assertFalse(result.isRetryable());
        assertEquals(ErrorCategory.CLIENT, result.getErrorCategory());
        verify(channel, times(1)).sendMessage(anyString(), anyString());
    }

    @Test
    void shouldRetryTransientFailureUpToMaxAttempts() {
        when(channel.sendMessage(anyString(), anyString())).thenReturn(failure(ErrorCategory.NETWORK));

        DeliveryResult result = sender.send(CHAT_ID, "hello");

        assertFalse(result.isSuccess());
        assertTrue(result.isRetryable());
        assertEquals(ErrorCategory.NETWORK, result.getErrorCategory());
        verify(channel, times(3)).sendMessage(anyString(), anyString());
    }

    @Test
    void shouldRecoverWhenRetrySucceeds() {
        when(channel.sendMessage(anyString(), anyString()))
                .thenReturn(failure(ErrorCategory.RATE_LIMITED))
                .thenReturn(CompletableFuture.completedFuture(null));

        assertTrue(sender.send(CHAT_ID, "hello").isSuccess());
        verify(channel, times(2)).sendMessage(CHAT_ID, "hello");
    }

    @Test
    void shouldTellRecipientWhenDeliveryIsIncomplete() {
        when(channel.sendMessage(eq(CHAT_ID), startsWith("[Part 2/3]"))).thenReturn(failure(ErrorCategory.CLIENT));

        DeliveryResult result = sender.send(CHAT_ID, "z".repeat(200));

        assertFalse(result.isSuccess());
        assertEquals(1, result.getChunksSent());
        assertEquals(3, result.getTotalChunks());
        verify(channel).sendMessage(CHAT_ID, "⚠️ Message delivery incomplete. Received 1 of 3 parts.");
        verify(channel, never()).sendMessage(eq(CHAT_ID), startsWith("[Part 3/3]"));
    }

    @Test
    void shouldNotSendIncompleteNoticeWhenFirstChunkFails() {
        when(channel.sendMessage(anyString(), anyString())).thenReturn(failure(ErrorCategory.CLIENT));

        sender.send(CHAT_ID, "z".repeat(200));

        verify(channel, never()).sendMessage(eq(CHAT_ID), startsWith("⚠️"));
    }

    // ===== Circuit breaker =====

    @Test
    void shouldFailFastOnceCircuitOpens() {
        properties.getDelivery().getRetry().setMaxAttempts(1);
        sender = newSender();
        when(channel.sendMessage(anyString(), anyString())).thenReturn(failure(ErrorCategory.SERVER));

        sender.send(CHAT_ID, "one");
        sender.send(CHAT_ID, "two");
        DeliveryResult result = sender.send(CHAT_ID, "three");

        assertEquals(ErrorCategory.CIRCUIT_OPEN, result.getErrorCategory());
        assertTrue(result.isRetryable());
        verify(channel, never()).sendMessage(CHAT_ID, "three");
        assertEquals(CircuitState.OPEN, registry.getStats("channel:telegram").orElseThrow().getState());
    }

    @Test
    void shouldNameBreakerAfterChannel() {
        assertEquals("channel:telegram", sender.getBreakerName());
    }
}
