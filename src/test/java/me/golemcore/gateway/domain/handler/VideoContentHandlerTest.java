package me.golemcore.gateway.domain.handler;

import com.github.kokorin.jaffree.JaffreeException;
import me.golemcore.gateway.domain.model.AudioExtractionException;
import me.golemcore.gateway.domain.model.AudioFormat;
import me.golemcore.gateway.domain.model.CombinedMessage;
import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.HandlerResult;
import me.golemcore.gateway.domain.model.InboundEvent;
import me.golemcore.gateway.domain.model.MediaRef;
import me.golemcore.gateway.port.outbound.AudioExtractorPort;
import me.golemcore.gateway.port.outbound.TranscriptionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class VideoContentHandlerTest {

    private static final String CHAT_ID = "100";

    @TempDir
    Path tempDir;

    private MediaFixture fixture;
    private TranscriptionPort transcriptionPort;
    private AudioExtractorPort audioExtractor;
    private VideoContentHandler handler;

    @BeforeEach
    void setUp() throws Exception {
        fixture = new MediaFixture(tempDir);
        transcriptionPort = mock(TranscriptionPort.class);
        audioExtractor = mock(AudioExtractorPort.class);
        handler = new VideoContentHandler(fixture.mediaIntake, new MediaTranscriber(transcriptionPort),
                audioExtractor, fixture.support);
    }

    @Test
    void shouldDescribeVideoWithoutTranscriptionWhenUnavailable() throws Exception {
        MediaRef ref = fixture.serve("m1", "clip.mp4", "video/mp4", MediaFixture.MP4);

        HandlerResult result = handler.handle(message(video(1, ref, "look at this")), false);

        assertEquals(HandlerResult.Status.HANDLED, result.status());
        assertEquals("[Video: clip.mp4]\n\nlook at this", fixture.submittedRequest().getPrompt());
        assertTrue(fixture.submittedRequest().getAttachments().isEmpty());
        verify(audioExtractor, never()).extractAudio(any(), any());
        assertEquals(0, fixture.leftoverFiles());
    }

    @Test
    void shouldAppendTranscriptOfExtractedAudio() throws Exception {
        when(transcriptionPort.isAvailable()).thenReturn(true);
        MediaRef ref = fixture.serve("m1", "clip.mp4", "video/mp4", MediaFixture.MP4);
        doAnswer(invocation -> {
            Files.write(invocation.<Path>getArgument(1), new byte[] { 1, 2, 3 });
            return null;
        }).when(audioExtractor).extractAudio(any(), any());
        when(transcriptionPort.transcribe(any(), eq(AudioFormat.WAV)))
                .thenReturn(new TranscriptionPort.TranscriptionResult("spoken words", "en"));

        handler.handle(message(video(1, ref, null)), false);

        assertEquals("[Video: clip.mp4]\n[Video audio transcript]: spoken words",
                fixture.submittedRequest().getPrompt());
        assertEquals(0, fixture.leftoverFiles());
    }

    @Test
    void shouldReleaseBothAssetsWhenExtractionFails() throws Exception {
        when(transcriptionPort.isAvailable()).thenReturn(true);
        MediaRef ref = fixture.serve("m1", "clip.mp4", "video/mp4", MediaFixture.MP4);
        doAnswer(invocation -> {
            Files.write(invocation.<Path>getArgument(1), new byte[] { 1 });
            throw new AudioExtractionException("ffmpeg exited with 1");
        }).when(audioExtractor).extractAudio(any(), any());

        HandlerResult result = handler.handle(message(video(1, ref, null)), false);

        assertEquals(HandlerResult.Status.FAILED, result.status());
        assertEquals(fixture.messageService.getMessage("video.error.extraction"), result.notice());
        verify(fixture.agentPort, never()).submit(any());
        assertEquals(0, fixture.leftoverFiles());
    }

    @Test
    void shouldPropagateCancellationWrappedByExtractor() throws Exception {
        when(transcriptionPort.isAvailable()).thenReturn(true);
        MediaRef ref = fixture.serve("m1", "clip.mp4", "video/mp4", MediaFixture.MP4);
        doAnswer(invocation -> {
            Files.write(invocation.<Path>getArgument(1), new byte[] { 1 });
            throw new AudioExtractionException("FFmpeg failed to extract audio",
                    new JaffreeException("Failed to execute, was interrupted", new InterruptedException()));
        }).when(audioExtractor).extractAudio(any(), any());
        CombinedMessage message = message(video(1, ref, null));

        assertThrows(InterruptedException.class, () -> handler.handle(message, false));

        verify(fixture.agentPort, never()).submit(any());
        assertEquals(0, fixture.leftoverFiles());
    }

    @Test
    void shouldProcessOnlyFirstVideoOutsideAgentMode() throws Exception {
        MediaRef first = fixture.serve("m1", "a.mp4", "video/mp4", MediaFixture.MP4);
        MediaRef second = fixture.serve("m2", "b.mp4", "video/mp4", MediaFixture.MP4);

        HandlerResult result = handler.handle(message(video(1, first, null), video(2, second, null)), false);

        assertEquals(fixture.messageService.getMessage("video.only.first", 2), result.notice());
        assertEquals("[Video: a.mp4]", fixture.submittedRequest().getPrompt());
    }

    @Test
    void shouldUseTranscriptTakenInCollectMode() throws Exception {
        InboundEvent video = video(1, new MediaRef("m1", "clip.mp4", "video/mp4", 100), null).toBuilder()
                .transcript("see you at five")
                .build();

        HandlerResult result = handler.handle(message(video), true);

        assertEquals(HandlerResult.Status.HANDLED, result.status());
        assertEquals("[Video: clip.mp4]\n[Video audio transcript]: see you at five",
                fixture.submittedRequest().getPrompt());
        verify(fixture.mediaStore, never()).download(any(), any());
        verify(audioExtractor, never()).extractAudio(any(), any());
    }

    private static CombinedMessage message(InboundEvent... events) {
        return new CombinedMessage(CHAT_ID, "u1", List.of(events), 0, null);
    }

    private static InboundEvent video(long id, MediaRef ref, String caption) {
        return InboundEvent.builder().conversationId(CHAT_ID).eventId(id).kind(ContentKind.VIDEO).media(ref)
                .caption(caption).build();
    }
}
