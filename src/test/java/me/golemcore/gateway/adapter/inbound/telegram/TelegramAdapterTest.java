package me.golemcore.gateway.adapter.inbound.telegram;

import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.InboundEvent;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.infrastructure.i18n.MessageService;
import me.golemcore.gateway.port.inbound.InboundEventPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TelegramAdapterTest {

    private GatewayProperties.ChannelProperties channel;
    private TelegramBotsLongPollingApplication botsApplication;
    private InboundEventPort inboundEventPort;
    private MessageService messageService;
    private TelegramClient telegramClient;
    private TelegramAdapter adapter;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() throws Exception {
        GatewayProperties properties = new GatewayProperties();
        channel = new GatewayProperties.ChannelProperties();
        channel.setEnabled(true);
        channel.setToken("test-token");
        channel.setAllowFrom(List.of("123"));
        properties.getChannels().put("telegram", channel);

        botsApplication = mock(TelegramBotsLongPollingApplication.class);
        inboundEventPort = mock(InboundEventPort.class);
        messageService = new MessageService();
        telegramClient = mock(TelegramClient.class);
        when(telegramClient.execute(any(SendMessage.class))).thenReturn(mock(Message.class));

        ObjectProvider<InboundEventPort> inboundEventProvider = mock(ObjectProvider.class);
        when(inboundEventProvider.getObject()).thenReturn(inboundEventPort);
        adapter = new TelegramAdapter(properties, botsApplication, inboundEventProvider, messageService);
        adapter.setTelegramClient(telegramClient);
    }

    @Test
    void shouldForwardAuthorizedMessageAsEvent() {
        adapter.consume(textUpdate(123L, 100L, "hello"));

        ArgumentCaptor<InboundEvent> captor = ArgumentCaptor.forClass(InboundEvent.class);
        verify(inboundEventPort).onEvent(captor.capture());
        assertEquals("100", captor.getValue().getConversationId());
        assertEquals("123", captor.getValue().getSenderId());
        assertEquals(ContentKind.TEXT, captor.getValue().getKind());
        assertEquals("hello", captor.getValue().getText());
    }

    @Test
    void shouldForwardCommandsInsteadOfExecutingThem() {
        adapter.consume(textUpdate(123L, 100L, "/status"));

        ArgumentCaptor<InboundEvent> captor = ArgumentCaptor.forClass(InboundEvent.class);
        verify(inboundEventPort).onEvent(captor.capture());
        assertEquals(ContentKind.COMMAND, captor.getValue().getKind());
    }

    @Test
    void shouldRejectUnauthorizedSender() throws Exception {
        adapter.consume(textUpdate(999L, 100L, "hello"));

        verify(inboundEventPort, never()).onEvent(any());
        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(telegramClient).execute(captor.capture());
        assertEquals(messageService.getMessage("security.unauthorized"), captor.getValue().getText());
        assertEquals("100", captor.getValue().getChatId());
    }

    @Test
    void shouldIgnoreUpdatesWithoutMessage() {
        Update update = mock(Update.class);
        when(update.hasMessage()).thenReturn(false);

        adapter.consume(update);

        verify(inboundEventPort, never()).onEvent(any());
    }

    @Test
    void shouldDropUnsupportedContent() {
        Message sticker = baseMessage(123L, 100L);

        adapter.consume(update(sticker));

        verify(inboundEventPort, never()).onEvent(any());
    }

    @Test
    void shouldAuthorizeEveryoneWhenAllowListIsEmpty() {
        channel.setAllowFrom(List.of());

        assertTrue(adapter.isAuthorized("777"));
        assertTrue(adapter.isAuthorized(null));
    }

    @Test
    void shouldAuthorizeOnlyListedSenders() {
        assertTrue(adapter.isAuthorized("123"));
        assertFalse(adapter.isAuthorized("456"));
        assertFalse(adapter.isAuthorized(null));
    }

    @Test
    void shouldSplitLongNotices() throws Exception {
        String text = "A".repeat(3000) + "\n\n" + "B".repeat(3000);

        adapter.notify("100", text);

        verify(telegramClient, times(2)).execute(any(SendMessage.class));
    }

    @Test
    void shouldSwallowNoticeDeliveryFailure() throws Exception {
        when(telegramClient.execute(any(SendMessage.class))).thenThrow(new TelegramApiException("blocked"));

        assertDoesNotThrow(() -> adapter.notify("100", "hello"));
    }

    @Test
    void shouldSkipBlankNotice() throws Exception {
        adapter.notify("100", " ");

        verify(telegramClient, never()).execute(any(SendMessage.class));
    }

    @Test
    void shouldSendMessageAsynchronously() throws Exception {
        adapter.sendMessage("100", "hi").join();

        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(telegramClient).execute(captor.capture());
        assertEquals("hi", captor.getValue().getText());
    }

    @Test
    void shouldRegisterBotOnStartAndCloseOnStop() throws Exception {
        adapter.start();
        adapter.start();

        assertTrue(adapter.isRunning());
        verify(botsApplication, times(1)).registerBot(anyString(), any(TelegramAdapter.class));

        adapter.stop();

        assertFalse(adapter.isRunning());
        verify(botsApplication).close();
    }

    @Test
    void shouldNotStartWhenDisabled() throws Exception {
        channel.setEnabled(false);

        adapter.start();

        assertFalse(adapter.isRunning());
        verify(botsApplication, never()).registerBot(anyString(), any(TelegramAdapter.class));
    }

    @Test
    void shouldKeepShortTextInOneChunk() {
        assertEquals(List.of("Hello world"), TelegramAdapter.chunk("Hello world", 100));
    }

    @Test
    void shouldSplitAtParagraphBeforeLine() {
        String text = "A".repeat(30) + "\n\n" + "B".repeat(20) + "\n" + "C".repeat(30);

        List<String> chunks = TelegramAdapter.chunk(text, 60);

        assertEquals(List.of("A".repeat(30), "B".repeat(20) + "\n" + "C".repeat(30)), chunks);
    }

    @Test
    void shouldHardSplitWithoutNewlines() {
        List<String> chunks = TelegramAdapter.chunk("A".repeat(200), 80);

        assertEquals(List.of("A".repeat(80), "A".repeat(80), "A".repeat(40)), chunks);
    }

    private static Update textUpdate(long userId, long chatId, String text) {
        Message message = baseMessage(userId, chatId);
        when(message.hasText()).thenReturn(true);
        when(message.getText()).thenReturn(text);
        return update(message);
    }

    private static Message baseMessage(long userId, long chatId) {
        User user = mock(User.class);
        when(user.getId()).thenReturn(userId);
        Message message = mock(Message.class);
        when(message.getChatId()).thenReturn(chatId);
        when(message.getFrom()).thenReturn(user);
        when(message.getMessageId()).thenReturn(1);
        return message;
    }

    private static Update update(Message message) {
        Update update = mock(Update.class);
        when(update.hasMessage()).thenReturn(true);
        when(update.getMessage()).thenReturn(message);
        return update;
    }
}
