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

package me.golemcore.workbridge.resilience;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Retry-with-backoff. Blocks the calling thread between attempts, so it must
 * only be used from worker threads, never from a connection's I/O thread.
 *
 * <p>
 * A non-retryable error (per {@link RetryPolicy#isRetryable(Throwable)})
 * short-circuits immediately. Exhaustion returns the last error together with
 * the number of attempts made.
 */
@Component
@Slf4j
public class RetryExecutor {

    @FunctionalInterface
    public interface RetryableCall<T> {
        T call() throws Exception;
    }

    public <T> RetryResult<T> execute(String operationName, RetryPolicy policy, RetryableCall<T> call) {
        int maxAttempts = Math.max(1, policy.getMaxAttempts());
        Throwable lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                T value = call.call();
                if (attempt > 1) {
                    log.info("[Retry] {} succeeded on attempt {}", operationName, attempt);
                }
                return RetryResult.success(value, attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return RetryResult.failure(e, attempt);
            } catch (Exception e) {
                lastError = ErrorClassifier.unwrap(e);
                if (!policy.isRetryable(lastError)) {
                    log.debug("[Retry] {} failed with non-retryable error: {}", operationName,
                            lastError.getMessage());
                    return RetryResult.failure(lastError, attempt);
                }
                if (attempt == maxAttempts) {
                    break;
                }
                long delay = policy.delayForAttempt(attempt);
                log.warn("[Retry] {} failed (attempt {}/{}): {}. Retrying in {}ms", operationName, attempt,
                        maxAttempts, lastError.getMessage(), delay);
                try {
                    sleepBeforeRetry(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return RetryResult.failure(lastError, attempt);
                }
            }
        }

        log.warn("[Retry] {} gave up after {} attempts: {}", operationName, maxAttempts,
                lastError != null ? lastError.getMessage() : "unknown error");
        return RetryResult.failure(lastError, maxAttempts);
    }

    void sleepBeforeRetry(long delayMs) throws InterruptedException {
        Thread.sleep(delayMs);
    }
}
