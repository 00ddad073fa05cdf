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

import java.util.Locale;

/**
 * Rule violations reported by the command validator. The user-facing text
 * lives in the {@code messages} bundles under {@link #getMessageKey()}.
 */
public enum ValidationError {

    INVALID_PATH_FORMAT,
    PATH_REQUIRED,
    PATH_TOO_LONG,
    ABSOLUTE_PATH_NOT_ALLOWED,
    PATH_TRAVERSAL_DETECTED,
    DIRECTORY_REQUIRED,
    INVALID_DIRECTORY_FORMAT,
    QUERY_REQUIRED,
    QUERY_TOO_SHORT,
    QUERY_TOO_LONG,
    INVALID_PATTERN,
    PATTERN_TOO_LONG,
    UNKNOWN_COMMAND_TYPE;

    public String getMessageKey() {
        return "validation." + name().toLowerCase(Locale.ROOT).replace('_', '.');
    }
}
