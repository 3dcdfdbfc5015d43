package me.golemcore.gateway.infrastructure.i18n;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MessageServiceTest {

    private static final String KEY_UNAUTHORIZED = "security.unauthorized";

    private MessageService messageService;

    @BeforeEach
    void setUp() {
        messageService = new MessageService();
    }

    @Test
    void shouldReturnEnglishMessageByDefault() {
        assertEquals("You are not authorized to use this bot.", messageService.getMessage(KEY_UNAUTHORIZED));
    }

    @Test
    void shouldReturnRussianMessageWhenLanguageSetToRu() {
        messageService.setLanguage("ru");

        assertEquals("ru", messageService.getLanguage());
        assertEquals("У вас нет доступа к этому боту.", messageService.getMessage(KEY_UNAUTHORIZED));
    }

    @Test
    void shouldReturnKeyWhenMessageNotFound() {
        assertEquals("nonexistent.key", messageService.getMessage("nonexistent.key"));
    }

    @Test
    void shouldFormatParameters() {
        assertEquals("Note: 2 message(s) were dropped because too many were sent at once.",
                messageService.getMessage("buffer.overflow.notice", 2));
    }

    @Test
    void shouldFallBackToEnglishForUnsupportedLanguage() {
        messageService.setLanguage("fr");

        assertEquals("en", messageService.getLanguage());
        assertEquals("You are not authorized to use this bot.", messageService.getMessage(KEY_UNAUTHORIZED));
    }

    @Test
    void shouldFallBackToEnglishForNullLanguage() {
        messageService.setLanguage("ru");
        messageService.setLanguage(null);

        assertEquals("en", messageService.getLanguage());
    }
}
