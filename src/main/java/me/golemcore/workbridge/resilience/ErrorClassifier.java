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

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps arbitrary throwables onto {@link ErrorCategory}. Future wrappers are
 * unwrapped first so callers can classify whatever a {@code join()} or
 * {@code get()} threw.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static ErrorCategory classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof WorkbridgeException workbridgeException) {
            return workbridgeException.getCategory();
        }
        if (cause instanceof TimeoutException || cause instanceof SocketTimeoutException) {
            return ErrorCategory.TIMEOUT;
        }
        if (cause instanceof IOException) {
            return ErrorCategory.NETWORK;
        }
        return ErrorCategory.INTERNAL;
    }

    public static boolean isRetryable(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof WorkbridgeException workbridgeException) {
            return workbridgeException.isRetryable();
        }
        return classify(cause).isTransientByDefault();
    }
}
