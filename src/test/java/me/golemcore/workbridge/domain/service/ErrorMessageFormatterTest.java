package me.golemcore.workbridge.domain.service;

import me.golemcore.workbridge.domain.exception.CircuitOpenException;
import me.golemcore.workbridge.domain.exception.WorkspaceChannelException;
import me.golemcore.workbridge.domain.model.ParseError;
import me.golemcore.workbridge.domain.model.ValidationError;
import me.golemcore.workbridge.domain.model.ValidationResult;
import me.golemcore.workbridge.infrastructure.i18n.MessageService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorMessageFormatterTest {

    private final ErrorMessageFormatter formatter = new ErrorMessageFormatter(new MessageService());

    @Test
    void shouldOmitHelpHintForUnknownCommand() {
        assertEquals("❌ *Error*\n\nUnknown command. Type \"help\" to see available commands.",
                formatter.formatParseError(ParseError.UNKNOWN_COMMAND));
    }

    @Test
    void shouldBulletValidationErrors() {
        ValidationResult result = ValidationResult.of(List.of(ValidationError.ABSOLUTE_PATH_NOT_ALLOWED,
                ValidationError.PATH_TRAVERSAL_DETECTED));

        assertEquals("❌ *Invalid command*\n\n"
                + "• Absolute paths are not allowed for security reasons\n"
                + "• Path traversal detected (../ is not allowed)", formatter.formatValidationErrors(result));
    }

    @Test
    void shouldRenderParseAndValidationErrorsInRussian() {
        MessageService russian = new MessageService();
        russian.setLanguage("ru");
        ErrorMessageFormatter russianFormatter = new ErrorMessageFormatter(russian);

        assertEquals("❌ *Ошибка*\n\nПустое сообщение\n\nВведите \"help\", чтобы увидеть список команд.",
                russianFormatter.formatParseError(ParseError.EMPTY_MESSAGE));
        assertEquals("❌ *Неверная команда*\n\n• Обнаружен выход за пределы каталога (../ запрещён)",
                russianFormatter.formatValidationErrors(
                        ValidationResult.of(List.of(ValidationError.PATH_TRAVERSAL_DETECTED))));
    }

    @ParameterizedTest
    @EnumSource(ValidationError.class)
    void shouldHaveTextForEveryValidationErrorInBothLanguages(ValidationError error) {
        MessageService messageService = new MessageService();

        assertNotEquals(error.getMessageKey(), messageService.getMessage(error.getMessageKey(), "en"));
        assertNotEquals(error.getMessageKey(), messageService.getMessage(error.getMessageKey(), "ru"));
    }

    @ParameterizedTest
    @EnumSource(ParseError.class)
    void shouldHaveTextForEveryParseErrorInBothLanguages(ParseError error) {
        MessageService messageService = new MessageService();

        assertNotEquals(error.getMessageKey(), messageService.getMessage(error.getMessageKey(), "en"));
        assertNotEquals(error.getMessageKey(), messageService.getMessage(error.getMessageKey(), "ru"));
    }

    @Test
    void shouldAppendRetryHintOnlyWhenRetryable() {
        assertEquals("❌ *Error*\n\nboom", formatter.formatError("boom", false));
        assertEquals("❌ *Error*\n\nboom\n\n💡 This error may be temporary. Please try again.",
                formatter.formatError("boom", true));
    }

    @Test
    void shouldUnwrapCompletionExceptions() {
        String text = formatter.formatException(
                new CompletionException(WorkspaceChannelException.connectionLost("ws-1", "closed (1001)")));

        assertEquals("❌ *Error*\n\nConnection lost: closed (1001)\n\n"
                + "💡 This error may be temporary. Please try again.", text);
    }

    @Test
    void shouldTreatOpenCircuitAsTemporary() {
        String text = formatter.formatException(new CircuitOpenException("channel:telegram", 30000));

        assertTrue(text.endsWith("Please try again."));
    }

    @Test
    void shouldHideDetailsOfUnexpectedErrors() {
        assertEquals("❌ *Error*\n\nSomething went wrong while processing the command.",
                formatter.formatException(new NullPointerException("x is null")));
    }
}
