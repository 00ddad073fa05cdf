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
import me.golemcore.workbridge.domain.model.CommandType;
import me.golemcore.workbridge.domain.model.FileListCommand;
import me.golemcore.workbridge.domain.model.FileReadCommand;
import me.golemcore.workbridge.domain.model.HelpCommand;
import me.golemcore.workbridge.domain.model.ParseResult;
import me.golemcore.workbridge.domain.model.ValidationResult;
import me.golemcore.workbridge.domain.model.WorkspaceCommand;
import me.golemcore.workbridge.infrastructure.i18n.MessageService;
import me.golemcore.workbridge.port.outbound.AuditPort;
import me.golemcore.workbridge.port.outbound.AuthorizationPort;
import me.golemcore.workbridge.port.outbound.WorkspacePort;
import me.golemcore.workbridge.resilience.ErrorClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Handles one chat command end to end and produces the reply text.
 *
 * <p>
 * Pipeline: parse, validate, answer {@code help} locally, check path access
 * for file commands, resolve the caller's workspace, execute, format. Every
 * failure becomes a formatted reply; the returned future never completes
 * exceptionally. Each outcome is recorded in the audit log.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkspaceCommandService {

    private final CommandParser parser;
    private final CommandValidator validator;
    private final AuthorizationPort authorizationPort;
    private final WorkspaceBindingService bindingService;
    private final WorkspacePort workspacePort;
    private final CommandResultFormatter resultFormatter;
    private final ErrorMessageFormatter errorFormatter;
    private final AuditPort auditPort;
    private final MessageService messageService;

    /**
     * @param identity
     *            chat identity of the caller, also the key for workspace
     *            binding and path access
     */
    public CompletableFuture<String> process(String identity, String text) {
        ParseResult parsed = parser.parse(text);
        if (!parsed.isSuccess()) {
            audit(identity, null, AuditPort.Outcome.INVALID, parsed.getError().name());
            return CompletableFuture.completedFuture(errorFormatter.formatParseError(parsed.getError()));
        }

        WorkspaceCommand command = parsed.getCommand();
        ValidationResult validation = validator.validate(command);
        if (!validation.isValid()) {
            audit(identity, command.type(), AuditPort.Outcome.INVALID, String.join(", ", validation.getErrorNames()));
            return CompletableFuture.completedFuture(errorFormatter.formatValidationErrors(validation));
        }

        if (command instanceof HelpCommand) {
            return CompletableFuture.completedFuture(messageService.getMessage("help.text"));
        }

        Optional<String> denial = checkAccess(identity, command);
        if (denial.isPresent()) {
            audit(identity, command.type(), AuditPort.Outcome.DENIED, denial.get());
            return CompletableFuture.completedFuture(errorFormatter.formatError(
                    messageService.getMessage("error.access.denied", denial.get()), false));
        }

        Optional<String> workspaceId = bindingService.findWorkspaceFor(identity);
        if (workspaceId.isEmpty()) {
            audit(identity, command.type(), AuditPort.Outcome.FAILURE, "no workspace bound");
            return CompletableFuture.completedFuture(
                    errorFormatter.formatError(messageService.getMessage("error.not.bound"), false));
        }

        log.debug("[Command] {} -> {} on workspace {}", identity, command.type(), workspaceId.get());
        CompletableFuture<CommandResult> execution;
        try {
            execution = workspacePort.execute(workspaceId.get(), command);
        } catch (RuntimeException e) {
            execution = CompletableFuture.failedFuture(e);
        }
        return execution.handle((result, error) -> render(identity, command, result, error));
    }

    private String render(String identity, WorkspaceCommand command, CommandResult result, Throwable error) {
        if (error != null) {
            Throwable cause = ErrorClassifier.unwrap(error);
            log.warn("[Command] {} for {} failed ({}): {}", command.type(), identity, ErrorClassifier.classify(cause),
                    cause.getMessage());
            audit(identity, command.type(), AuditPort.Outcome.FAILURE, cause.getMessage());
            return errorFormatter.formatException(cause);
        }
        if (!result.isSuccess()) {
            String message = result.getError() != null
                    ? result.getError()
                    : messageService.getMessage("error.command.failed");
            audit(identity, command.type(), AuditPort.Outcome.FAILURE, message);
            return errorFormatter.formatError(message, false);
        }

        audit(identity, command.type(), AuditPort.Outcome.SUCCESS,
                result.isFromCache() ? "cache hit" : result.getExecutionTimeMs() + "ms");
        return resultFormatter.format(command, result);
    }

    private Optional<String> checkAccess(String identity, WorkspaceCommand command) {
        String path;
        if (command instanceof FileReadCommand read) {
            path = read.path();
        } else if (command instanceof FileListCommand list) {
            path = list.directory();
        } else {
            return Optional.empty();
        }

        try {
            AuthorizationPort.AccessDecision decision = authorizationPort.authorize(identity, path);
            if (decision.allowed()) {
                return Optional.empty();
            }
            return Optional.of(decision.reason() != null ? decision.reason() : "not allowed");
        } catch (RuntimeException e) {
            log.error("[Command] Authorization check failed for {}", identity, e);
            return Optional.of("authorization unavailable");
        }
    }

    private void audit(String identity, CommandType type, AuditPort.Outcome outcome, String detail) {
        try {
            auditPort.record(identity, type, outcome, detail);
        } catch (RuntimeException e) {
            log.warn("[Audit] Failed to record {} for {}: {}", outcome, identity, e.getMessage());
        }
    }
}
