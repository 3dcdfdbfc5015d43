package me.golemcore.gateway.adapter.inbound.telegram;

import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.InboundEvent;
import me.golemcore.gateway.domain.model.PollPayload;
import org.junit.jupiter.api.Test;
import org.telegram.telegrambots.meta.api.objects.Contact;
import org.telegram.telegrambots.meta.api.objects.Document;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.Video;
import org.telegram.telegrambots.meta.api.objects.Voice;
import org.telegram.telegrambots.meta.api.objects.chat.Chat;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.api.objects.messageorigin.MessageOriginChannel;
import org.telegram.telegrambots.meta.api.objects.messageorigin.MessageOriginChat;
import org.telegram.telegrambots.meta.api.objects.messageorigin.MessageOriginHiddenUser;
import org.telegram.telegrambots.meta.api.objects.messageorigin.MessageOriginUser;
import org.telegram.telegrambots.meta.api.objects.PhotoSize;
import org.telegram.telegrambots.meta.api.objects.polls.Poll;
import org.telegram.telegrambots.meta.api.objects.polls.PollOption;
import org.telegram.telegrambots.meta.api.objects.VideoNote;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TelegramUpdateMapperTest {

    @Test
    void shouldMapTextWithReply() {
        Message replied = mock(Message.class);
        when(replied.getMessageId()).thenReturn(5);
        when(replied.hasText()).thenReturn(true);
        when(replied.getText()).thenReturn("original");
        Message message = message();
        when(message.hasText()).thenReturn(true);
        when(message.getText()).thenReturn("answer");
        when(message.getDate()).thenReturn(1_700_000_000);
        when(message.getReplyToMessage()).thenReturn(replied);

        InboundEvent event = TelegramUpdateMapper.toEvent(message).orElseThrow();

        assertEquals("100", event.getConversationId());
        assertEquals("42", event.getSenderId());
        assertEquals(7L, event.getEventId());
        assertEquals(ContentKind.TEXT, event.getKind());
        assertEquals(Instant.ofEpochSecond(1_700_000_000), event.getArrivedAt());
        assertEquals(5L, event.getReplyToEventId());
        assertEquals("original", event.getReplyToText());
    }

    @Test
    void shouldMapSlashTextToCommand() {
        Message message = message();
        when(message.hasText()).thenReturn(true);
        when(message.getText()).thenReturn("/help");

        assertEquals(ContentKind.COMMAND, TelegramUpdateMapper.toEvent(message).orElseThrow().getKind());
    }

    @Test
    void shouldPickLargestPhoto() {
        PhotoSize small = photo("small", 1000, 90, 90);
        PhotoSize large = photo("large", 80000, 1280, 960);
        Message message = message();
        when(message.hasPhoto()).thenReturn(true);
        when(message.getPhoto()).thenReturn(List.of(small, large));
        when(message.getCaption()).thenReturn("look");

        InboundEvent event = TelegramUpdateMapper.toEvent(message).orElseThrow();

        assertEquals(ContentKind.PHOTO, event.getKind());
        assertEquals("large", event.getMedia().fileId());
        assertEquals("image/jpeg", event.getMedia().mimeType());
        assertEquals(80000L, event.getMedia().fileSize());
        assertEquals("look", event.getCaption());
    }

    @Test
    void shouldMapVoiceWithDefaultMime() {
        Voice voice = mock(Voice.class);
        when(voice.getFileId()).thenReturn("v1");
        Message message = message();
        when(message.hasVoice()).thenReturn(true);
        when(message.getVoice()).thenReturn(voice);

        InboundEvent event = TelegramUpdateMapper.toEvent(message).orElseThrow();

        assertEquals(ContentKind.VOICE, event.getKind());
        assertEquals("voice.ogg", event.getMedia().fileName());
        assertEquals("audio/ogg", event.getMedia().mimeType());
    }

    @Test
    void shouldMapVideoNoteToVoice() {
        VideoNote note = mock(VideoNote.class);
        when(note.getFileId()).thenReturn("n1");
        Message message = message();
        when(message.hasVideoNote()).thenReturn(true);
        when(message.getVideoNote()).thenReturn(note);

        InboundEvent event = TelegramUpdateMapper.toEvent(message).orElseThrow();

        assertEquals(ContentKind.VOICE, event.getKind());
        assertEquals("video/mp4", event.getMedia().mimeType());
    }

    @Test
    void shouldMapVideo() {
        Video video = mock(Video.class);
        when(video.getFileId()).thenReturn("m1");
        when(video.getMimeType()).thenReturn("video/quicktime");
        Message message = message();
        when(message.hasVideo()).thenReturn(true);
        when(message.getVideo()).thenReturn(video);

        InboundEvent event = TelegramUpdateMapper.toEvent(message).orElseThrow();

        assertEquals(ContentKind.VIDEO, event.getKind());
        assertEquals("video.mp4", event.getMedia().fileName());
        assertEquals("video/quicktime", event.getMedia().mimeType());
    }

    @Test
    void shouldMapImageDocumentToPhoto() {
        Message message = documentMessage("scan.png", "image/png");

        assertEquals(ContentKind.PHOTO, TelegramUpdateMapper.toEvent(message).orElseThrow().getKind());
    }

    @Test
    void shouldMapOtherDocument() {
        Message message = documentMessage("report.pdf", "application/pdf");

        InboundEvent event = TelegramUpdateMapper.toEvent(message).orElseThrow();

        assertEquals(ContentKind.DOCUMENT, event.getKind());
        assertEquals("report.pdf", event.getMedia().fileName());
    }

    @Test
    void shouldMapContact() {
        Contact contact = mock(Contact.class);
        when(contact.getPhoneNumber()).thenReturn("+1555");
        when(contact.getFirstName()).thenReturn("Ann");
        when(contact.getUserId()).thenReturn(77L);
        Message message = message();
        when(message.hasContact()).thenReturn(true);
        when(message.getContact()).thenReturn(contact);

        InboundEvent event = TelegramUpdateMapper.toEvent(message).orElseThrow();

        assertEquals(ContentKind.CONTACT, event.getKind());
        assertEquals("+1555", event.getContact().phoneNumber());
        assertEquals("77", event.getContact().userId());
    }

    @Test
    void shouldMapPollWithMissingCounts() {
        PollOption yes = mock(PollOption.class);
        when(yes.getText()).thenReturn("Yes");
        when(yes.getVoterCount()).thenReturn(2);
        PollOption no = mock(PollOption.class);
        when(no.getText()).thenReturn("No");
        Poll poll = mock(Poll.class);
        when(poll.getQuestion()).thenReturn("Ship it?");
        when(poll.getOptions()).thenReturn(List.of(yes, no));
        when(poll.getType()).thenReturn("regular");
        when(poll.getIsAnonymous()).thenReturn(true);

        PollPayload payload = TelegramUpdateMapper.toPoll(poll);

        assertEquals("Ship it?", payload.question());
        assertEquals(0, payload.totalVoterCount());
        assertTrue(payload.anonymous());
        assertEquals(List.of(new PollPayload.Option("Yes", 2), new PollPayload.Option("No", 0)), payload.options());
    }

    @Test
    void shouldIgnoreUnsupportedContent() {
        assertTrue(TelegramUpdateMapper.toEvent(message()).isEmpty());
        assertTrue(TelegramUpdateMapper.toEvent(null).isEmpty());
    }

    @Test
    void shouldMapForwardFromUserHandle() {
        User author = mock(User.class);
        when(author.getUserName()).thenReturn("andrew");
        when(author.getFirstName()).thenReturn("Andrew");
        MessageOriginUser origin = mock(MessageOriginUser.class);
        when(origin.getSenderUser()).thenReturn(author);
        Message message = message();
        when(message.hasText()).thenReturn(true);
        when(message.getText()).thenReturn("meeting moved");
        when(message.getForwardOrigin()).thenReturn(origin);

        InboundEvent event = TelegramUpdateMapper.toEvent(message).orElseThrow();

        assertTrue(event.isForwarded());
        assertEquals("@andrew", event.getForwardedFrom());
    }

    @Test
    void shouldFallBackToFirstNameAndHiddenSender() {
        User author = mock(User.class);
        when(author.getFirstName()).thenReturn("Andrew");
        MessageOriginUser user = mock(MessageOriginUser.class);
        when(user.getSenderUser()).thenReturn(author);
        MessageOriginHiddenUser hidden = mock(MessageOriginHiddenUser.class);
        when(hidden.getSenderUserName()).thenReturn("John Doe");

        assertEquals("Andrew", TelegramUpdateMapper.forwardedFrom(user));
        assertEquals("John Doe", TelegramUpdateMapper.forwardedFrom(hidden));
        assertNull(TelegramUpdateMapper.forwardedFrom(null));
    }

    @Test
    void shouldLinkPublicChannelPost() {
        Chat channel = mock(Chat.class);
        when(channel.getTitle()).thenReturn("Market News");
        when(channel.getUserName()).thenReturn("marketnews");
        MessageOriginChannel origin = mock(MessageOriginChannel.class);
        when(origin.getChat()).thenReturn(channel);
        when(origin.getMessageId()).thenReturn(12);
        Chat group = mock(Chat.class);
        when(group.getTitle()).thenReturn("Team");
        MessageOriginChat anonymous = mock(MessageOriginChat.class);
        when(anonymous.getSenderChat()).thenReturn(group);

        assertEquals("channel \"Market News\" (https://t.me/marketnews/12)",
                TelegramUpdateMapper.forwardedFrom(origin));
        assertEquals("channel \"Team\"", TelegramUpdateMapper.forwardedFrom(anonymous));
    }

    @Test
    void shouldLeaveOrdinaryMessageUnforwarded() {
        Message message = message();
        when(message.hasText()).thenReturn(true);
        when(message.getText()).thenReturn("hi");

        assertFalse(TelegramUpdateMapper.toEvent(message).orElseThrow().isForwarded());
    }

    private static Message message() {
        User user = mock(User.class);
        when(user.getId()).thenReturn(42L);
        Message message = mock(Message.class);
        when(message.getChatId()).thenReturn(100L);
        when(message.getMessageId()).thenReturn(7);
        when(message.getFrom()).thenReturn(user);
        return message;
    }

    private static Message documentMessage(String fileName, String mimeType) {
        Document document = mock(Document.class);
        when(document.getFileId()).thenReturn("d1");
        when(document.getFileName()).thenReturn(fileName);
        when(document.getMimeType()).thenReturn(mimeType);
        Message message = message();
        when(message.hasDocument()).thenReturn(true);
        when(message.getDocument()).thenReturn(document);
        return message;
    }

    private static PhotoSize photo(String fileId, int fileSize, int width, int height) {
        PhotoSize photo = mock(PhotoSize.class);
        when(photo.getFileId()).thenReturn(fileId);
        when(photo.getFileSize()).thenReturn(fileSize);
        when(photo.getWidth()).thenReturn(width);
        when(photo.getHeight()).thenReturn(height);
        return photo;
    }
}
