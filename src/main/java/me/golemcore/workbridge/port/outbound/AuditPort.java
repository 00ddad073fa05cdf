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
package me.golemcore.workbridge.port.outbound;

import me.golemcore.workbridge.domain.model.CommandType;

/**
 * Audit sink for executed commands. Fire-and-forget: implementations must not
 * throw and must not block the caller.
 */
public interface AuditPort {

    enum Outcome {
        SUCCESS,
        FAILURE,
        DENIED,
        INVALID
    }

    /**
     * @param commandType
     *            {@code null} when the text could not be parsed
     */
    void record(String identity, CommandType commandType, Outcome outcome, String detail);
}
