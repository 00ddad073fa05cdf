package me.golemcore.workbridge.resilience;

import me.golemcore.workbridge.domain.exception.DeliveryException;
import me.golemcore.workbridge.domain.model.ErrorCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryExecutorTest {

    private static final String OPERATION = "test-op";

    private List<Long> sleeps;
    private RetryExecutor executor;

    @BeforeEach
    void setUp() {
        sleeps = new ArrayList<>();
        executor = new RetryExecutor() {
            @Override
            void sleepBeforeRetry(long delayMs) {
                sleeps.add(delayMs);
            }
        };
    }

    @Test
    void shouldReturnValueOnFirstSuccess() {
        RetryResult<String> result = executor.execute(OPERATION, RetryPolicy.defaults(), () -> "ok");

        assertTrue(result.isSuccess());
        assertEquals("ok", result.getValue());
        assertEquals(1, result.getAttempts());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldRetryTransientFailuresWithExponentialBackoff() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(4).initialDelayMs(100).maxDelayMs(250)
                .multiplier(2.0).build();

        RetryResult<String> result = executor.execute(OPERATION, policy, () -> {
            if (calls.incrementAndGet() < 4) {
                throw new IOException("connection reset");
            }
            return "done";
        });

        assertTrue(result.isSuccess());
        assertEquals(4, result.getAttempts());
        assertEquals(List.of(100L, 200L, 250L), sleeps);
    }

    @Test
    void shouldGiveUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        RetryResult<Object> result = executor.execute(OPERATION, RetryPolicy.defaults(), () -> {
            calls.incrementAndGet();
            throw new IOException("down");
        });

        assertFalse(result.isSuccess());
        assertEquals(3, calls.get());
        assertEquals(3, result.getAttempts());
        assertInstanceOf(IOException.class, result.getError());
        assertEquals(2, sleeps.size());
    }

    @Test
    void shouldNotRetryNonRetryableError() {
        AtomicInteger calls = new AtomicInteger();

        RetryResult<Object> result = executor.execute(OPERATION, RetryPolicy.defaults(), () -> {
            calls.incrementAndGet();
            throw new DeliveryException(ErrorCategory.CLIENT, "chat not found", null);
        });

        assertFalse(result.isSuccess());
        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldCallOnceWhenMaxAttemptsIsOne() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(1).build();

        executor.execute(OPERATION, policy, () -> {
            calls.incrementAndGet();
            throw new IOException("down");
        });

        assertEquals(1, calls.get());
    }

    @Test
    void shouldCallOnceWhenMaxAttemptsIsZero() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(0).build();

        executor.execute(OPERATION, policy, () -> calls.incrementAndGet());

        assertEquals(1, calls.get());
    }

    @Test
    void shouldUnwrapCompletionException() {
        RetryPolicy policy = RetryPolicy.builder().maxAttempts(1).build();

        RetryResult<Object> result = executor.execute(OPERATION, policy, () -> {
            throw new CompletionException(new DeliveryException(ErrorCategory.SERVER, "bad gateway", null));
        });

        DeliveryException error = assertInstanceOf(DeliveryException.class, result.getError());
        assertEquals(ErrorCategory.SERVER, error.getCategory());
    }

    @Test
    void shouldRespectConfiguredRetryableCategories() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = RetryPolicy.builder().retryableCategories(Set.of(ErrorCategory.RATE_LIMITED)).build();

        executor.execute(OPERATION, policy, () -> {
            calls.incrementAndGet();
            throw new IOException("network");
        });

        assertEquals(1, calls.get());
    }

    @Test
    void getOrThrowShouldRethrowLastError() {
        RetryResult<Object> result = executor.execute(OPERATION, RetryPolicy.builder().maxAttempts(1).build(),
                () -> {
                    throw new IOException("boom");
                });

        IOException thrown = assertThrows(IOException.class, result::getOrThrow);
        assertEquals("boom", thrown.getMessage());
    }
}
