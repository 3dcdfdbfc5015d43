package me.golemcore.gateway.domain.handler;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.ContentKind;
import me.golemcore.gateway.domain.model.HandlerResult;
import me.golemcore.gateway.domain.model.InboundEvent;
import me.golemcore.gateway.domain.model.ManagedAsset;
import me.golemcore.gateway.domain.model.MediaDownloadException;
import me.golemcore.gateway.domain.model.MediaRef;
import me.golemcore.gateway.domain.model.ValidationResult;
import me.golemcore.gateway.domain.service.AssetLifecycleManager;
import me.golemcore.gateway.domain.service.AssetScope;
import me.golemcore.gateway.domain.service.MediaValidator;
import me.golemcore.gateway.infrastructure.i18n.MessageService;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;

/**
 * Download plus validation of one media item inside a handler's asset scope.
 * A rejected item is released immediately; an accepted one stays in the scope
 * until the scope closes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MediaIntake {

    private static final long ONE_MB = 1024L * 1024L;

    private final AssetLifecycleManager assetLifecycleManager;
    private final MediaValidator validator;
    private final MessageService messageService;

    /**
     * Accepted asset with its effective MIME type, or the failure to report.
     */
    public record Intake(ManagedAsset asset, String mimeType, HandlerResult failure) {

        public boolean accepted() {
            return failure == null;
        }
    }

    public AssetScope openScope(ContentKind kind, InboundEvent event) {
        return assetLifecycleManager.openScope(
                kind.getPolicyKey() + "-" + event.getConversationId() + "-" + event.getEventId());
    }

    public Intake fetch(AssetScope scope, ContentKind kind, MediaRef ref) throws InterruptedException {
        ValidationResult precheck = validator.precheck(kind, ref);
        if (!precheck.isValid()) {
            return new Intake(null, null, HandlerResult.rejected(rejectionNotice(kind, precheck)));
        }

        ManagedAsset asset;
        try {
            asset = scope.acquire(ref);
        } catch (MediaDownloadException e) {
            log.warn("[Media] {} download failed in {}: {}", kind, scope.owner(), e.getMessage());
            return new Intake(null, null, HandlerResult.failed(messageService.getMessage("media.error.download")));
        } catch (IOException e) {
            log.warn("[Media] {} download I/O failure in {}: {}", kind, scope.owner(), e.getMessage());
            return new Intake(null, null, HandlerResult.failed(messageService.getMessage("media.error.download")));
        }

        ValidationResult validation = validator.validate(kind, asset.path(), ref);
        if (!validation.isValid()) {
            scope.release(asset);
            return new Intake(null, null, HandlerResult.rejected(rejectionNotice(kind, validation)));
        }
        return new Intake(asset, validation.detectedMimeType(), null);
    }

    public byte[] read(ManagedAsset asset) throws IOException {
        return Files.readAllBytes(asset.path());
    }

    private String rejectionNotice(ContentKind kind, ValidationResult result) {
        String kindLabel = messageService.getMessage("media.kind." + kind.getPolicyKey());
        long limitMb = Math.max(1, validator.maxBytes(kind) / ONE_MB);
        return messageService.getMessage(result.reason().getMessageKey(), kindLabel, limitMb);
    }
}
