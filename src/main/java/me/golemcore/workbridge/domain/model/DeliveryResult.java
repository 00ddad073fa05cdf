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

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of sending one logical message to the messaging channel, possibly
 * split into several chunks.
 */
@Value
@Builder
public class DeliveryResult {

    boolean success;
    boolean retryable;
    String error;
    ErrorCategory errorCategory;
    int chunksSent;
    int totalChunks;

    public static DeliveryResult delivered(int chunks) {
        return DeliveryResult.builder()
                .success(true)
                .chunksSent(chunks)
                .totalChunks(chunks)
                .build();
    }

    public static DeliveryResult failed(ErrorCategory category, String error, boolean retryable, int chunksSent,
            int totalChunks) {
        return DeliveryResult.builder()
                .success(false)
                .retryable(retryable)
                .error(error)
                .errorCategory(category)
                .chunksSent(chunksSent)
                .totalChunks(totalChunks)
                .build();
    }
}
