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

import me.golemcore.workbridge.domain.exception.WorkbridgeException;
import me.golemcore.workbridge.domain.model.ErrorCategory;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Exponential backoff settings for {@link RetryExecutor}.
 *
 * <p>
 * Delay after failed attempt {@code n} (1-based) is
 * {@code min(initialDelayMs * multiplier^(n-1), maxDelayMs)}.
 */
@Value
@Builder
public class RetryPolicy {

    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    long initialDelayMs = 1000;

    @Builder.Default
    long maxDelayMs = 10000;

    @Builder.Default
    double multiplier = 2.0;

    /**
     * Categories worth retrying. Empty means "whatever the classifier considers
     * transient".
     */
    @Builder.Default
    Set<ErrorCategory> retryableCategories = Set.of();

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    public long delayForAttempt(int attempt) {
        double raw = initialDelayMs * Math.pow(multiplier, Math.max(0, attempt - 1));
        return (long) Math.min(raw, maxDelayMs);
    }

    public boolean isRetryable(Throwable error) {
        Throwable cause = ErrorClassifier.unwrap(error);
        if (cause instanceof WorkbridgeException workbridgeException && !workbridgeException.isRetryable()) {
            return false;
        }
        if (retryableCategories == null || retryableCategories.isEmpty()) {
            return ErrorClassifier.isRetryable(cause);
        }
        return retryableCategories.contains(ErrorClassifier.classify(cause));
    }
}
