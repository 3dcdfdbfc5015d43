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

import me.golemcore.gateway.domain.model.ManagedAsset;
import me.golemcore.gateway.domain.model.MediaRef;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Owner of the temporary assets acquired during one handler invocation.
 * Not thread-safe; a scope belongs to the thread that opened it.
 */
public final class AssetScope implements AutoCloseable {

    private final AssetLifecycleManager manager;
    private final String owner;
    private final List<ManagedAsset> assets = new ArrayList<>();
    private boolean closed;

    AssetScope(AssetLifecycleManager manager, String owner) {
        this.manager = manager;
        this.owner = owner;
    }

    /**
     * Downloads the referenced media into a new asset owned by this scope. A
     * failed download leaves nothing on disk.
     */
    public ManagedAsset acquire(MediaRef ref) throws IOException, InterruptedException {
        ensureOpen();
        ManagedAsset asset = manager.download(ref, owner);
        assets.add(asset);
        return asset;
    }

    /**
     * Reserves a path for a derived file (for example extracted audio). The file
     * is not created; whatever the caller writes there is removed with the scope.
     */
    public ManagedAsset allocate(String extension) {
        ensureOpen();
        ManagedAsset asset = manager.allocate(owner, extension);
        assets.add(asset);
        return asset;
    }

    /**
     * Releases one asset early. Releasing twice is a no-op.
     */
    public void release(ManagedAsset asset) {
        manager.release(asset);
    }

    public String owner() {
        return owner;
    }

    public int liveCount() {
        return (int) assets.stream().filter(asset -> !asset.isReleased()).count();
    }

    /**
     * Releases every asset of this scope. Never throws.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (ManagedAsset asset : assets) {
            manager.release(asset);
        }
        assets.clear();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Asset scope already closed: " + owner);
        }
    }
}
