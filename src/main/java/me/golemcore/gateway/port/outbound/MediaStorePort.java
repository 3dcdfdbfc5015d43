package me.golemcore.gateway.port.outbound;

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

import me.golemcore.gateway.domain.model.MediaDownloadException;
import me.golemcore.gateway.domain.model.MediaRef;

import java.nio.file.Path;

/**
 * Transport media store. The destination path is allocated by the asset
 * lifecycle manager, which removes it on every exit path, including a
 * download that fails after a partial write.
 */
public interface MediaStorePort {

    /**
     * Downloads the referenced media into {@code destination}, replacing it.
     *
     * @throws MediaDownloadException
     *             on transient transport errors
     * @throws InterruptedException
     *             if the calling thread was interrupted
     */
    void download(MediaRef ref, Path destination) throws MediaDownloadException, InterruptedException;
}
