package me.golemcore.gateway.domain.model;

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

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Temporary local file owned by exactly one handler scope. Released at most
 * once.
 */
public final class ManagedAsset {

    private final Path path;
    private final String ownerScope;
    private final AtomicBoolean released = new AtomicBoolean();

    public ManagedAsset(Path path, String ownerScope) {
        this.path = Objects.requireNonNull(path, "path");
        this.ownerScope = ownerScope;
    }

    public Path path() {
        return path;
    }

    public String ownerScope() {
        return ownerScope;
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * @return {@code true} for the first caller only
     */
    public boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "ManagedAsset[" + path.getFileName() + ", owner=" + ownerScope + "]";
    }
}
