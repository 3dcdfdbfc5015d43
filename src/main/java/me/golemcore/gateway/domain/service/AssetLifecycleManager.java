package me.golemcore.gateway.domain.service;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.ManagedAsset;
import me.golemcore.gateway.domain.model.MediaRef;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.infrastructure.metrics.GatewayMetrics;
import me.golemcore.gateway.port.outbound.MediaStorePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Scoped temporary files for downloaded media.
 *
 * <p>
 * Every temp file is created through an {@link AssetScope}; closing the scope
 * removes every file it created, whether the owner returned normally, threw, or
 * was interrupted. A download that fails after a partial write is removed
 * before the failure propagates. Cleanup failures are logged at WARN and
 * counted in {@code gateway.assets.cleanup.failures}.
 *
 * <pre>
 * try (AssetScope scope = assets.openScope("image:" + conversationId)) {
 *     ManagedAsset asset = scope.acquire(ref);
 *     ...
 * }
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssetLifecycleManager {

    private final GatewayProperties properties;
    private final MediaStorePort mediaStore;
    private final GatewayMetrics metrics;

    private Path tempDir;

    @PostConstruct
    public void init() {
        tempDir = GatewayProperties.resolvePath(properties.getMedia().getTempDir());
        try {
            Files.createDirectories(tempDir);
            purgeStaleFiles();
            log.info("[Assets] Temp directory: {}", tempDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create media temp directory " + tempDir, e);
        }
    }

    /**
     * Callback receiving the local path of an acquired asset.
     */
    @FunctionalInterface
    public interface AssetCallback<T> {
        T apply(Path path) throws IOException, InterruptedException;
    }

    /**
     * Downloads {@code ref} to a unique temp path, invokes {@code callback} and
     * removes the path afterwards on every exit path.
     */
    public <T> T withAsset(MediaRef ref, String owner, AssetCallback<T> callback)
            throws IOException, InterruptedException {
        try (AssetScope scope = openScope(owner)) {
            ManagedAsset asset = scope.acquire(ref);
            return callback.apply(asset.path());
        }
    }

    /**
     * Opens a scope that may acquire several assets; all of them are released
     * when the scope closes.
     */
    public AssetScope openScope(String owner) {
        return new AssetScope(this, owner);
    }

    Path getTempDir() {
        return tempDir;
    }

    ManagedAsset download(MediaRef ref, String owner) throws IOException, InterruptedException {
        ManagedAsset asset = allocate(owner, extensionOf(ref));
        boolean completed = false;
        try {
            mediaStore.download(ref, asset.path());
            completed = true;
            log.debug("[Assets] Acquired {}", asset);
            return asset;
        } finally {
            if (!completed) {
                release(asset);
            }
        }
    }

    ManagedAsset allocate(String owner, String extension) {
        String suffix = extension == null || extension.isBlank() ? ".bin" : "." + extension;
        Path path = tempDir.resolve(sanitize(owner) + "-" + UUID.randomUUID() + suffix);
        return new ManagedAsset(path, owner);
    }

    /**
     * Removes the asset file. Idempotent and never throws.
     */
    void release(ManagedAsset asset) {
        if (!asset.markReleased()) {
            return;
        }
        try {
            Files.deleteIfExists(asset.path());
            log.debug("[Assets] Released {}", asset);
        } catch (IOException | RuntimeException e) {
            metrics.recordCleanupFailure();
            log.warn("[Assets] Failed to remove {}: {}", asset, e.getMessage());
        }
    }

    private void purgeStaleFiles() throws IOException {
        try (Stream<Path> stale = Files.list(tempDir)) {
            long removed = stale.filter(Files::isRegularFile)
                    .filter(path -> {
                        try {
                            return Files.deleteIfExists(path);
                        } catch (IOException e) {
                            metrics.recordCleanupFailure();
                            log.warn("[Assets] Failed to remove stale file {}: {}", path.getFileName(),
                                    e.getMessage());
                            return false;
                        }
                    })
                    .count();
            if (removed > 0) {
                log.info("[Assets] Removed {} stale temp files left by a previous run", removed);
            }
        }
    }

    private static String extensionOf(MediaRef ref) {
        String extension = ref.extension();
        if (!extension.isEmpty()) {
            return extension;
        }
        String mimeType = ref.mimeType();
        if (mimeType == null) {
            return "";
        }
        int slash = mimeType.indexOf('/');
        return slash >= 0 ? mimeType.substring(slash + 1).toLowerCase(Locale.ROOT) : "";
    }

    private static String sanitize(String owner) {
        if (owner == null || owner.isBlank()) {
            return "asset";
        }
        return owner.replaceAll("[^A-Za-z0-9_-]", "_");
    }
}
