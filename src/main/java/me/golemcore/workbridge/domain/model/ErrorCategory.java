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

package me.golemcore.workbridge.domain.model;

/**
 * Coarse classification of failures. Retry policies select retryable errors by
 * category, and user-facing rendering decides whether to add the "may be
 * temporary" hint from it.
 */
public enum ErrorCategory {

    PARSE(false),
    VALIDATION(false),
    AUTHORIZATION(false),
    NOT_CONNECTED(true),
    TIMEOUT(true),
    CONNECTION_LOST(true),
    AUTH_FAILED(false),
    NETWORK(true),
    RATE_LIMITED(true),
    SERVER(true),
    CLIENT(false),
    CIRCUIT_OPEN(true),
    INTERNAL(false);

    private final boolean transientByDefault;

    ErrorCategory(boolean transientByDefault) {
        this.transientByDefault = transientByDefault;
    }

    public boolean isTransientByDefault() {
        return transientByDefault;
    }
}
