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
import me.golemcore.workbridge.domain.model.SearchCommand;
import me.golemcore.workbridge.domain.model.StatusCommand;
import me.golemcore.workbridge.domain.model.ValidationError;
import me.golemcore.workbridge.domain.model.ValidationResult;
import me.golemcore.workbridge.domain.model.WorkspaceCommand;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Second pass over a parsed command. Collects every rule violation instead of
 * stopping at the first one. Stateless, so validating the same command twice
 * gives the same answer.
 */
@Component
public class CommandValidator {

    static final int MAX_PATH_LENGTH = 500;
    static final int MIN_QUERY_LENGTH = 2;
    static final int MAX_QUERY_LENGTH = 200;
    static final int MAX_PATTERN_LENGTH = 200;

    private static final Pattern DRIVE_PATH = Pattern.compile("^[a-zA-Z]:[\\\\/]");
    private static final Pattern FORBIDDEN_CHARS = Pattern.compile("[<>:\"|?*\\x00-\\x1F]");

    public ValidationResult validate(WorkspaceCommand command) {
        List<ValidationError> errors = new ArrayList<>();

        if (command instanceof FileReadCommand fileRead) {
            validatePath(fileRead.path(), errors);
        } else if (command instanceof FileListCommand fileList) {
            validateDirectory(fileList.directory(), errors);
        } else if (command instanceof SearchCommand search) {
            validateSearch(search, errors);
        } else if (!(command instanceof StatusCommand) && !(command instanceof HelpCommand)) {
            errors.add(ValidationError.UNKNOWN_COMMAND_TYPE);
        }

        return ValidationResult.of(errors);
    }

    private void validatePath(String path, List<ValidationError> errors) {
        if (path == null || path.isBlank()) {
            errors.add(ValidationError.PATH_REQUIRED);
            return;
        }
        checkLocation(path, errors);
        if (FORBIDDEN_CHARS.matcher(path).find()) {
            errors.add(ValidationError.INVALID_PATH_FORMAT);
        }
    }

    private void validateDirectory(String directory, List<ValidationError> errors) {
        if (directory == null || directory.isBlank()) {
            errors.add(ValidationError.DIRECTORY_REQUIRED);
            return;
        }
        if (FileListCommand.CURRENT_DIRECTORY.equals(directory)) {
            return;
        }
        checkLocation(directory, errors);
        if (FORBIDDEN_CHARS.matcher(directory).find()) {
            errors.add(ValidationError.INVALID_DIRECTORY_FORMAT);
        }
    }

    private void checkLocation(String path, List<ValidationError> errors) {
        if (path.length() > MAX_PATH_LENGTH) {
            errors.add(ValidationError.PATH_TOO_LONG);
        }
        if (isAbsolute(path)) {
            errors.add(ValidationError.ABSOLUTE_PATH_NOT_ALLOWED);
        }
        if (path.contains("..")) {
            errors.add(ValidationError.PATH_TRAVERSAL_DETECTED);
        }
    }

    private boolean isAbsolute(String path) {
        return path.startsWith("/") || path.startsWith("\\\\") || DRIVE_PATH.matcher(path).find();
    }

    private void validateSearch(SearchCommand search, List<ValidationError> errors) {
        String query = search.query();
        if (query == null || query.isBlank()) {
            errors.add(ValidationError.QUERY_REQUIRED);
        } else if (query.trim().length() < MIN_QUERY_LENGTH) {
            errors.add(ValidationError.QUERY_TOO_SHORT);
        } else if (query.length() > MAX_QUERY_LENGTH) {
            errors.add(ValidationError.QUERY_TOO_LONG);
        }

        String pattern = search.pattern();
        if (pattern == null) {
            return;
        }
        if (pattern.length() > MAX_PATTERN_LENGTH) {
            errors.add(ValidationError.PATTERN_TOO_LONG);
            return;
        }
        try {
            Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            errors.add(ValidationError.INVALID_PATTERN);
        }
    }
}
