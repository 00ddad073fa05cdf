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
package me.golemcore.workbridge.domain.service;

import me.golemcore.workbridge.domain.model.CommandResult;
import me.golemcore.workbridge.domain.model.FileListCommand;
import me.golemcore.workbridge.domain.model.FileReadCommand;
import me.golemcore.workbridge.domain.model.SearchCommand;
import me.golemcore.workbridge.domain.model.WorkspaceCommand;
import me.golemcore.workbridge.infrastructure.i18n.MessageService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Renders a successful {@link CommandResult} as a chat reply: a per-command
 * header, a blank line, then the data. Text data is shown as-is, structured
 * data as pretty-printed JSON.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommandResultFormatter {

    private final MessageService messageService;
    private final ObjectMapper objectMapper;

    public String format(WorkspaceCommand command, CommandResult result) {
        return header(command) + "\n\n" + renderData(result.getData());
    }

    private String header(WorkspaceCommand command) {
        if (command instanceof FileReadCommand read) {
            return messageService.getMessage("result.file", read.path());
        }
        if (command instanceof FileListCommand list) {
            return messageService.getMessage("result.directory", list.directory());
        }
        if (command instanceof SearchCommand search) {
            return search.pattern() != null
                    ? messageService.getMessage("result.search.pattern", search.query(), search.pattern())
                    : messageService.getMessage("result.search", search.query());
        }
        return messageService.getMessage("result.status");
    }

    private String renderData(JsonNode data) {
        if (data == null || data.isNull() || data.isMissingNode()) {
            return messageService.getMessage("result.empty");
        }
        if (data.isValueNode()) {
            return data.asText();
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.warn("Failed to pretty-print command result: {}", e.getMessage());
            return data.toString();
        }
    }
}
