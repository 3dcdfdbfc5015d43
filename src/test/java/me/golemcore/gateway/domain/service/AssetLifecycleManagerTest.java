package me.golemcore.gateway.domain.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import me.golemcore.gateway.domain.model.ManagedAsset;
import me.golemcore.gateway.domain.model.MediaDownloadException;
import me.golemcore.gateway.domain.model.MediaRef;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.infrastructure.metrics.GatewayMetrics;
import me.golemcore.gateway.port.outbound.MediaStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;

class AssetLifecycleManagerTest {

    private static final MediaRef PHOTO = new MediaRef("file-1", "photo.jpg", "image/jpeg", 3);

    @TempDir
    Path tempDir;

    private MediaStorePort mediaStore;
    private AssetLifecycleManager manager;

    @BeforeEach
    void setUp() throws Exception {
        GatewayProperties properties = new GatewayProperties();
        properties.getMedia().setTempDir(tempDir.toString());
        mediaStore = mock(MediaStorePort.class);
        doAnswer(invocation -> {
            Path destination = invocation.getArgument(1);
            Files.write(destination, new byte[] { 1, 2, 3 });
            return null;
        }).when(mediaStore).download(any(), any());
        manager = new AssetLifecycleManager(properties, mediaStore, new GatewayMetrics(new SimpleMeterRegistry()));
        manager.init();
    }

    @Test
    void shouldRemoveFileAfterCallbackReturns() throws Exception {
        AtomicReference<Path> seen = new AtomicReference<>();

        int size = manager.withAsset(PHOTO, "image:100", path -> {
            seen.set(path);
            assertTrue(Files.exists(path));
            return (int) Files.size(path);
        });

        assertEquals(3, size);
        assertTrue(seen.get().getFileName().toString().startsWith("image_100-"));
        assertTrue(seen.get().getFileName().toString().endsWith(".jpg"));
        assertFalse(Files.exists(seen.get()));
        assertEquals(0, countFiles());
    }

    @Test
    void shouldRemoveFileWhenCallbackThrows() throws IOException {
        assertThrows(IllegalStateException.class, () -> manager.withAsset(PHOTO, "image:100", path -> {
            throw new IllegalStateException("processing failed");
        }));

        assertEquals(0, countFiles());
    }

    @Test
    void shouldRemoveFileWhenCallbackIsInterrupted() throws IOException {
        assertThrows(InterruptedException.class, () -> manager.withAsset(PHOTO, "image:100", path -> {
            throw new InterruptedException();
        }));

        assertEquals(0, countFiles());
    }

    @Test
    void shouldRemovePartialFileWhenDownloadFails() throws Exception {
        doAnswer(invocation -> {
            Path destination = invocation.getArgument(1);
            Files.writeString(destination, "partial", StandardCharsets.UTF_8);
            throw new MediaDownloadException("connection reset");
        }).when(mediaStore).download(any(), any());

        assertThrows(MediaDownloadException.class, () -> manager.withAsset(PHOTO, "image:100", path -> 1));

        assertEquals(0, countFiles());
    }

    @Test
    void shouldReleaseEveryAssetOfScope() throws Exception {
        ManagedAsset derived;
        try (AssetScope scope = manager.openScope("voice:100")) {
            scope.acquire(PHOTO);
            scope.acquire(new MediaRef("file-2", null, "audio/ogg", 3));
            derived = scope.allocate("wav");
            Files.write(derived.path(), new byte[] { 9 });

            assertEquals(3, scope.liveCount());
            assertEquals(3, countFiles());
        }

        assertTrue(derived.isReleased());
        assertEquals(0, countFiles());
    }

    @Test
    void shouldReleaseSiblingsWhenLaterDownloadFails() throws Exception {
        AssetScope scope = manager.openScope("image:100");
        scope.acquire(PHOTO);
        doAnswer(invocation -> {
            throw new MediaDownloadException("gone");
        }).when(mediaStore).download(any(), any());

        assertThrows(MediaDownloadException.class, () -> scope.acquire(PHOTO));
        assertEquals(1, countFiles());

        scope.close();
        assertEquals(0, countFiles());
    }

    @Test
    void shouldReleaseEarlyOnlyOnce() throws Exception {
        try (AssetScope scope = manager.openScope("image:100")) {
            ManagedAsset asset = scope.acquire(PHOTO);
            scope.release(asset);
            scope.release(asset);

            assertTrue(asset.isReleased());
            assertEquals(0, scope.liveCount());
        }
        assertEquals(0, countFiles());
    }

    @Test
    void shouldRefuseAcquireAfterClose() {
        AssetScope scope = manager.openScope("image:100");
        scope.close();

        assertThrows(IllegalStateException.class, () -> scope.allocate("wav"));
    }

    @Test
    void shouldFallBackToBinExtension() {
        try (AssetScope scope = manager.openScope("voice:100")) {
            assertTrue(scope.allocate(null).path().toString().endsWith(".bin"));
        }
    }

    @Test
    void shouldPurgeStaleFilesOnStartup() throws Exception {
        Files.writeString(tempDir.resolve("leftover.jpg"), "old");
        GatewayProperties properties = new GatewayProperties();
        properties.getMedia().setTempDir(tempDir.toString());

        new AssetLifecycleManager(properties, mediaStore, new GatewayMetrics(new SimpleMeterRegistry())).init();

        assertEquals(0, countFiles());
    }

    private long countFiles() throws IOException {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.count();
        }
    }
}
