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

import me.golemcore.workbridge.domain.model.FileListCommand;
import me.golemcore.workbridge.domain.model.FileReadCommand;
import me.golemcore.workbridge.domain.model.HelpCommand;
import me.golemcore.workbridge.domain.model.ParseError;
import me.golemcore.workbridge.domain.model.ParseResult;
import me.golemcore.workbridge.domain.model.SearchCommand;
import me.golemcore.workbridge.domain.model.StatusCommand;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one line of chat text into a {@link me.golemcore.workbridge.domain.model.WorkspaceCommand}.
 *
 * <p>
 * Whitespace is collapsed and a leading bot-command slash is dropped, then the
 * patterns below are tried in order; the first match wins. Verbs are matched
 * case-insensitively, arguments keep their case. Never throws: anything that
 * does not match is {@link ParseError#UNKNOWN_COMMAND}.
 */
@Component
public class CommandParser {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern FILE_READ = Pattern.compile(
            "^(?:read|show|cat|file|open)\\s+(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern FILE_LIST = Pattern.compile(
            "^(?:list|ls|dir|files)(?:\\s+(.+))?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEARCH = Pattern.compile(
            "^(?:search|find|grep)\\s+(.+?)(?:\\s+(?:in|pattern:)\\s*(.+))?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern STATUS = Pattern.compile(
            "^(?:status|workspace|info)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern HELP = Pattern.compile(
            "^(?:help|commands|\\?)$", Pattern.CASE_INSENSITIVE);

    public ParseResult parse(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return ParseResult.failure(ParseError.EMPTY_MESSAGE);
        }

        Matcher matcher = FILE_READ.matcher(normalized);
        if (matcher.matches()) {
            return ParseResult.success(new FileReadCommand(matcher.group(1).trim(), text));
        }

        matcher = FILE_LIST.matcher(normalized);
        if (matcher.matches()) {
            String directory = matcher.group(1) != null ? matcher.group(1).trim() : "";
            return ParseResult.success(new FileListCommand(
                    directory.isEmpty() ? FileListCommand.CURRENT_DIRECTORY : directory, text));
        }

        matcher = SEARCH.matcher(normalized);
        if (matcher.matches()) {
            String pattern = matcher.group(2) != null ? matcher.group(2).trim() : null;
            return ParseResult.success(new SearchCommand(matcher.group(1).trim(), pattern, text));
        }

        if (STATUS.matcher(normalized).matches()) {
            return ParseResult.success(new StatusCommand(text));
        }

        if (HELP.matcher(normalized).matches()) {
            return ParseResult.success(new HelpCommand(text));
        }

        return ParseResult.failure(ParseError.UNKNOWN_COMMAND);
    }

    private String normalize(String text) {
        if (text == null) {
            return "";
        }
        String collapsed = WHITESPACE.matcher(text.trim()).replaceAll(" ");
        if (collapsed.startsWith("/")) {
            collapsed = collapsed.substring(1).trim();
        }
        return collapsed;
    }
}
