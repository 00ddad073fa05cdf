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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Either a command or a parse error, never both.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ParseResult {

    WorkspaceCommand command;
    ParseError error;

    public static ParseResult success(WorkspaceCommand command) {
        return new ParseResult(command, null);
    }

    public static ParseResult failure(ParseError error) {
        return new ParseResult(null, error);
    }

    public boolean isSuccess() {
        return command != null;
    }
}
