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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A parsed user command. Closed set of variants; each keeps the raw text it was
 * parsed from.
 *
 * <p>
 * Serialized to the workspace agent with a {@code type} discriminator, e.g.
 * {@code {"type":"FILE_READ","path":"src/index.ts","rawText":"read src/index.ts"}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FileReadCommand.class, name = "FILE_READ"),
        @JsonSubTypes.Type(value = FileListCommand.class, name = "FILE_LIST"),
        @JsonSubTypes.Type(value = SearchCommand.class, name = "SEARCH"),
        @JsonSubTypes.Type(value = StatusCommand.class, name = "STATUS"),
        @JsonSubTypes.Type(value = HelpCommand.class, name = "HELP")
})
public sealed interface WorkspaceCommand
        permits FileReadCommand, FileListCommand, SearchCommand, StatusCommand, HelpCommand {

    CommandType type();

    String rawText();
}
