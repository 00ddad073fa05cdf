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

import lombok.Value;

/**
 * Outcome of a retried operation: the value or the last error, plus how many
 * attempts were made.
 */
@Value
public class RetryResult<T> {

    boolean success;
    T value;
    Throwable error;
    int attempts;

    public static <T> RetryResult<T> success(T value, int attempts) {
        return new RetryResult<>(true, value, null, attempts);
    }

    public static <T> RetryResult<T> failure(Throwable error, int attempts) {
        return new RetryResult<>(false, null, error, attempts);
    }

    /**
     * Returns the value or rethrows the last error, wrapping non-exception
     * throwables.
     */
    public T getOrThrow() throws Exception {
        if (success) {
            return value;
        }
        if (error instanceof Exception exception) {
            throw exception;
        }
        throw new IllegalStateException("Operation failed after " + attempts + " attempts", error);
    }
}
