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

package me.golemcore.workbridge.domain.exception;

import me.golemcore.workbridge.domain.model.ErrorCategory;

/**
 * Base unchecked exception for all bridge failures. Carries an
 * {@link ErrorCategory} and whether a retry may succeed.
 */
public class WorkbridgeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCategory category;
    private final boolean retryable;

    public WorkbridgeException(ErrorCategory category, String message) {
        this(category, message, category.isTransientByDefault(), null);
    }

    public WorkbridgeException(ErrorCategory category, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.retryable = retryable;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
