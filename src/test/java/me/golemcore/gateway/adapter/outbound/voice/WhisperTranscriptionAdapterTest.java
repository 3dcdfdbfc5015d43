package me.golemcore.gateway.adapter.outbound.voice;

import me.golemcore.gateway.domain.model.AudioFormat;
import me.golemcore.gateway.infrastructure.config.AutoConfiguration;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.TranscriptionPort;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WhisperTranscriptionAdapterTest {

    private static final String CONTENT_TYPE = "Content-Type";
    private static final String APPLICATION_JSON = "application/json";

    private MockWebServer mockServer;
    private GatewayProperties properties;
    private WhisperTranscriptionAdapter adapter;
    private final List<Long> sleeps = new ArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(1, TimeUnit.SECONDS)
                .readTimeout(1, TimeUnit.SECONDS)
                .build();

        properties = new GatewayProperties();
        properties.getVoice().setWhisperUrl(mockServer.url("/").toString());

        adapter = new WhisperTranscriptionAdapter(client, properties, AutoConfiguration.objectMapper()) {
            @Override
            protected void sleepBeforeRetry(long backoffMs) {
                sleeps.add(backoffMs);
            }
        };
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    @Test
    void shouldTranscribeAndParseLanguage() {
        mockServer.enqueue(json("{\"text\":\"Hola\",\"language\":\"es\",\"duration\":1.5}"));

        TranscriptionPort.TranscriptionResult result = adapter.transcribe(new byte[] { 1, 2, 3 },
                AudioFormat.OGG_OPUS);

        assertEquals("Hola", result.text());
        assertEquals("es", result.language());
    }

    @Test
    void shouldSendMultipartWithModelAndFileName() throws InterruptedException {
        properties.getVoice().setWhisperModel("large-v3");
        mockServer.enqueue(json("{\"text\":\"test\"}"));

        TranscriptionPort.TranscriptionResult result = adapter.transcribe(new byte[] { 1 }, AudioFormat.WAV);

        assertEquals("unknown", result.language());
        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertNotNull(request);
        assertEquals("/v1/audio/transcriptions", request.getPath());
        assertTrue(request.getHeader(CONTENT_TYPE).contains("multipart/form-data"));
        String body = request.getBody().readUtf8();
        assertTrue(body.contains("audio.wav"));
        assertTrue(body.contains("large-v3"));
        assertTrue(body.contains("verbose_json"));
        assertNull(request.getHeader("Authorization"));
    }

    @Test
    void shouldSendBearerTokenWhenConfigured() throws InterruptedException {
        properties.getVoice().setWhisperApiKey("sk-test-key");
        mockServer.enqueue(json("{\"text\":\"test\"}"));

        adapter.transcribe(new byte[] { 1 }, AudioFormat.OGG_OPUS);

        RecordedRequest request = mockServer.takeRequest(1, TimeUnit.SECONDS);
        assertEquals("Bearer sk-test-key", request.getHeader("Authorization"));
    }

    @Test
    void shouldRetryOnServerError() {
        mockServer.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        mockServer.enqueue(json("{\"text\":\"recovered\",\"language\":\"en\"}"));

        TranscriptionPort.TranscriptionResult result = adapter.transcribe(new byte[] { 1 }, AudioFormat.OGG_OPUS);

        assertEquals("recovered", result.text());
        assertEquals(2, mockServer.getRequestCount());
        assertEquals(List.of(2000L), sleeps);
    }

    @Test
    void shouldHonorRetryAfterHeader() {
        mockServer.enqueue(new MockResponse().setResponseCode(429).addHeader("Retry-After", "7"));
        mockServer.enqueue(json("{\"text\":\"ok\"}"));

        adapter.transcribe(new byte[] { 1 }, AudioFormat.OGG_OPUS);

        assertEquals(List.of(7000L), sleeps);
    }

    @Test
    void shouldFailAfterMaxRetries() {
        for (int i = 0; i < 3; i++) {
            mockServer.enqueue(new MockResponse().setResponseCode(429).setBody("slow down"));
        }

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> adapter.transcribe(new byte[] { 1 }, AudioFormat.OGG_OPUS));

        assertTrue(error.getMessage().contains("429"));
        assertEquals(3, mockServer.getRequestCount());
        assertEquals(List.of(2000L, 4000L), sleeps);
    }

    @Test
    void shouldNotRetryClientError() {
        mockServer.enqueue(new MockResponse().setResponseCode(400).setBody("bad audio"));

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> adapter.transcribe(new byte[] { 1 }, AudioFormat.OGG_OPUS));

        assertTrue(error.getMessage().contains("bad audio"));
        assertEquals(1, mockServer.getRequestCount());
    }

    @Test
    void shouldWrapNetworkFailure() {
        properties.getVoice().setWhisperUrl("http://127.0.0.1:1");

        assertThrows(UncheckedIOException.class, () -> adapter.transcribe(new byte[] { 1 }, AudioFormat.OGG_OPUS));
    }

    @Test
    void shouldBeUnavailableWithoutUrl() {
        properties.getVoice().setWhisperUrl("");

        assertFalse(adapter.isAvailable());
        assertThrows(IllegalStateException.class, () -> adapter.transcribe(new byte[] { 1 }, AudioFormat.MP3));
    }

    private static MockResponse json(String body) {
        return new MockResponse().setBody(body).addHeader(CONTENT_TYPE, APPLICATION_JSON);
    }
}
