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
package me.golemcore.workbridge.adapter.outbound.audit;

import me.golemcore.workbridge.domain.model.CommandType;
import me.golemcore.workbridge.port.outbound.AuditPort;
import me.golemcore.workbridge.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Appends one JSON line per command to {@code audit/commands-YYYY-MM-DD.jsonl}
 * (UTC date). Writes are asynchronous; failures are logged and never reach
 * the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonlAuditAdapter implements AuditPort {

    static final String DIRECTORY = "audit";

    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public void record(String identity, CommandType commandType, Outcome outcome, String detail) {
        Instant now = clock.instant();
        ObjectNode entry = objectMapper.createObjectNode();
        entry.put("timestamp", now.toString());
        entry.put("identity", identity);
        entry.put("commandType", commandType != null ? commandType.name() : null);
        entry.put("outcome", outcome.name());
        entry.put("detail", detail);

        String line;
        try {
            line = objectMapper.writeValueAsString(entry) + "\n";
        } catch (JsonProcessingException e) {
            log.warn("[Audit] Failed to serialize audit entry for {}: {}", identity, e.getMessage());
            return;
        }

        String path = "commands-" + FILE_DATE.format(now) + ".jsonl";
        storagePort.appendText(DIRECTORY, path, line)
                .exceptionally(ex -> {
                    log.warn("[Audit] Failed to write audit entry to {}/{}: {}", DIRECTORY, path, ex.getMessage());
                    return null;
                });
    }
}
