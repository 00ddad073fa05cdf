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

import me.golemcore.workbridge.domain.exception.WorkbridgeException;
import me.golemcore.workbridge.domain.exception.WorkspaceChannelException;
import me.golemcore.workbridge.domain.model.ErrorCategory;
import me.golemcore.workbridge.domain.model.ParseError;
import me.golemcore.workbridge.domain.model.ValidationResult;
import me.golemcore.workbridge.infrastructure.i18n.MessageService;
import me.golemcore.workbridge.resilience.ErrorClassifier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * User-facing rendering of parse, validation and execution failures.
 */
@Component
@RequiredArgsConstructor
public class ErrorMessageFormatter {

    private final MessageService messageService;

    public String formatParseError(ParseError error) {
        String text = messageService.getMessage("error.title") + "\n\n"
                + messageService.getMessage(error.getMessageKey());
        if (error == ParseError.UNKNOWN_COMMAND) {
            return text;
        }
        return text + "\n\n" + messageService.getMessage("error.help.hint");
    }

    public String formatValidationErrors(ValidationResult result) {
        return messageService.getMessage("error.invalid.title") + "\n\n"
                + result.getErrors().stream()
                        .map(error -> "• " + messageService.getMessage(error.getMessageKey()))
                        .collect(Collectors.joining("\n"));
    }

    public String formatError(String message, boolean retryable) {
        String text = messageService.getMessage("error.title") + "\n\n" + message;
        if (retryable) {
            text += "\n\n" + messageService.getMessage("error.retry.hint");
        }
        return text;
    }

    public String formatException(Throwable error) {
        Throwable cause = ErrorClassifier.unwrap(error);
        boolean retryable = ErrorClassifier.isRetryable(cause);

        if (cause instanceof WorkspaceChannelException channelException
                && channelException.getCategory() == ErrorCategory.NOT_CONNECTED) {
            return formatError(messageService.getMessage("error.not.connected", channelException.getWorkspaceId()),
                    retryable);
        }
        if (cause instanceof WorkbridgeException) {
            return formatError(cause.getMessage(), retryable);
        }
        return formatError(messageService.getMessage("error.internal"), retryable);
    }
}
