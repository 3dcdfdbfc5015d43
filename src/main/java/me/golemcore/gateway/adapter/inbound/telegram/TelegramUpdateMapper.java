package me.golemcore.gateway.adapter.inbound.telegram;

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

import me.golemcore.gateway.domain.model.ContactCard;
import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.InboundEvent;
import me.golemcore.gateway.domain.model.MediaRef;
import me.golemcore.gateway.domain.model.PollPayload;
import org.telegram.telegrambots.meta.api.objects.Contact;
import org.telegram.telegrambots.meta.api.objects.Document;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.Video;
import org.telegram.telegrambots.meta.api.objects.Voice;
import org.telegram.telegrambots.meta.api.objects.chat.Chat;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.api.objects.messageorigin.MessageOrigin;
import org.telegram.telegrambots.meta.api.objects.messageorigin.MessageOriginChannel;
import org.telegram.telegrambots.meta.api.objects.messageorigin.MessageOriginChat;
import org.telegram.telegrambots.meta.api.objects.messageorigin.MessageOriginHiddenUser;
import org.telegram.telegrambots.meta.api.objects.messageorigin.MessageOriginUser;
import org.telegram.telegrambots.meta.api.objects.PhotoSize;
import org.telegram.telegrambots.meta.api.objects.polls.Poll;
import org.telegram.telegrambots.meta.api.objects.polls.PollOption;
import org.telegram.telegrambots.meta.api.objects.VideoNote;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Maps Telegram messages to {@link InboundEvent}s.
 *
 * <p>
 * Video notes are treated as voice (their audio is transcribed), documents
 * with an image MIME type as photos, and for photos the largest size is used.
 * Stickers, locations and other unsupported content map to nothing. The
 * origin of a forwarded message becomes a label such as {@code @handle} or
 * {@code channel "News"}.
 */
final class TelegramUpdateMapper {

    private static final String PHOTO_FILE_NAME = "photo.jpg";
    private static final String PHOTO_MIME = "image/jpeg";
    private static final String VOICE_FILE_NAME = "voice.ogg";
    private static final String VOICE_MIME = "audio/ogg";
    private static final String VIDEO_NOTE_FILE_NAME = "video_note.mp4";
    private static final String VIDEO_NOTE_MIME = "video/mp4";

    private TelegramUpdateMapper() {
    }

    static Optional<InboundEvent> toEvent(Message message) {
        if (message == null || message.getChatId() == null || message.getMessageId() == null) {
            return Optional.empty();
        }
        InboundEvent.InboundEventBuilder builder = InboundEvent.builder()
                .conversationId(message.getChatId().toString())
                .senderId(senderId(message.getFrom()))
                .eventId(message.getMessageId().longValue())
                .forwardedFrom(forwardedFrom(message.getForwardOrigin()));
        if (message.getDate() != null) {
            builder.arrivedAt(Instant.ofEpochSecond(message.getDate()));
        }

        Message replyTo = message.getReplyToMessage();
        if (replyTo != null && replyTo.getMessageId() != null) {
            builder.replyToEventId(replyTo.getMessageId().longValue())
                    .replyToText(replyTo.hasText() ? replyTo.getText() : replyTo.getCaption());
        }

        if (message.hasText()) {
            String text = message.getText();
            ContentKind kind = text.startsWith("/") ? ContentKind.COMMAND : ContentKind.TEXT;
            return Optional.of(builder.kind(kind).text(text).build());
        }
        if (message.hasPhoto() && message.getPhoto() != null && !message.getPhoto().isEmpty()) {
            PhotoSize largest = largest(message.getPhoto());
            return Optional.of(builder.kind(ContentKind.PHOTO)
                    .caption(message.getCaption())
                    .media(new MediaRef(largest.getFileId(), PHOTO_FILE_NAME, PHOTO_MIME, size(largest.getFileSize())))
                    .build());
        }
        if (message.hasVoice()) {
            Voice voice = message.getVoice();
            String mime = voice.getMimeType() != null ? voice.getMimeType() : VOICE_MIME;
            return Optional.of(builder.kind(ContentKind.VOICE)
                    .media(new MediaRef(voice.getFileId(), VOICE_FILE_NAME, mime, size(voice.getFileSize())))
                    .build());
        }
        if (message.hasVideoNote()) {
            VideoNote note = message.getVideoNote();
            return Optional.of(builder.kind(ContentKind.VOICE)
                    .media(new MediaRef(note.getFileId(), VIDEO_NOTE_FILE_NAME, VIDEO_NOTE_MIME,
                            size(note.getFileSize())))
                    .build());
        }
        if (message.hasVideo()) {
            Video video = message.getVideo();
            String name = video.getFileName() != null ? video.getFileName() : "video.mp4";
            String mime = video.getMimeType() != null ? video.getMimeType() : VIDEO_NOTE_MIME;
            return Optional.of(builder.kind(ContentKind.VIDEO)
                    .caption(message.getCaption())
                    .media(new MediaRef(video.getFileId(), name, mime, size(video.getFileSize())))
                    .build());
        }
        if (message.hasDocument()) {
            Document document = message.getDocument();
            boolean image = document.getMimeType() != null && document.getMimeType().startsWith("image/");
            return Optional.of(builder.kind(image ? ContentKind.PHOTO : ContentKind.DOCUMENT)
                    .caption(message.getCaption())
                    .media(new MediaRef(document.getFileId(), document.getFileName(), document.getMimeType(),
                            size(document.getFileSize())))
                    .build());
        }
        if (message.hasContact()) {
            Contact contact = message.getContact();
            return Optional.of(builder.kind(ContentKind.CONTACT)
                    .contact(new ContactCard(contact.getPhoneNumber(), contact.getFirstName(),
                            contact.getLastName(), contact.getUserId() != null ? contact.getUserId().toString() : null))
                    .build());
        }
        if (message.hasPoll()) {
            return Optional.of(builder.kind(ContentKind.POLL).poll(toPoll(message.getPoll())).build());
        }
        return Optional.empty();
    }

    static String forwardedFrom(MessageOrigin origin) {
        if (origin instanceof MessageOriginUser user && user.getSenderUser() != null) {
            User sender = user.getSenderUser();
            if (notBlank(sender.getUserName())) {
                return "@" + sender.getUserName();
            }
            return notBlank(sender.getFirstName()) ? sender.getFirstName() : null;
        }
        if (origin instanceof MessageOriginHiddenUser hidden) {
            return notBlank(hidden.getSenderUserName()) ? hidden.getSenderUserName() : null;
        }
        if (origin instanceof MessageOriginChannel channel && channel.getChat() != null) {
            return chatLabel(channel.getChat(), channel.getMessageId());
        }
        if (origin instanceof MessageOriginChat chat && chat.getSenderChat() != null) {
            return chatLabel(chat.getSenderChat(), null);
        }
        return null;
    }

    private static String chatLabel(Chat chat, Integer messageId) {
        String title = notBlank(chat.getTitle()) ? chat.getTitle() : chat.getUserName();
        if (!notBlank(title)) {
            return null;
        }
        String label = "channel \"" + title + "\"";
        if (notBlank(chat.getUserName()) && messageId != null) {
            label += " (https://t.me/" + chat.getUserName() + "/" + messageId + ")";
        }
        return label;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    static PollPayload toPoll(Poll poll) {
        List<PollPayload.Option> options = poll.getOptions() == null
                ? List.of()
                : poll.getOptions().stream().map(TelegramUpdateMapper::toOption).toList();
        return new PollPayload(poll.getQuestion(), options, poll.getType(), count(poll.getTotalVoterCount()),
                Boolean.TRUE.equals(poll.getIsAnonymous()));
    }

    private static PollPayload.Option toOption(PollOption option) {
        return new PollPayload.Option(option.getText(), count(option.getVoterCount()));
    }

    private static PhotoSize largest(List<PhotoSize> sizes) {
        Comparator<PhotoSize> bySize = Comparator.comparingLong(photo -> size(photo.getFileSize()));
        return sizes.stream()
                .max(bySize.thenComparingLong(photo -> size(photo.getWidth()) * size(photo.getHeight())))
                .orElseThrow();
    }

    private static String senderId(User from) {
        return from != null && from.getId() != null ? from.getId().toString() : null;
    }

    private static long size(Number fileSize) {
        return fileSize != null ? fileSize.longValue() : 0L;
    }

    private static int count(Integer value) {
        return value != null ? value : 0;
    }
}
