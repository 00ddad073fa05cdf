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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

/**
 * Answer of a workspace agent to one command. {@code fromCache} marks answers
 * served from the short-lived result cache.
 */
@Value
@Builder(toBuilder = true)
public class CommandResult {

    boolean success;
    JsonNode data;
    String error;
    long executionTimeMs;
    boolean fromCache;

    public static CommandResult success(JsonNode data, long executionTimeMs) {
        return CommandResult.builder()
                .success(true)
                .data(data)
                .executionTimeMs(executionTimeMs)
                .build();
    }

    public static CommandResult failure(String error, long executionTimeMs) {
        return CommandResult.builder()
                .success(false)
                .error(error)
                .executionTimeMs(executionTimeMs)
                .build();
    }

    public CommandResult asCacheHit() {
        return toBuilder().fromCache(true).build();
    }
}
