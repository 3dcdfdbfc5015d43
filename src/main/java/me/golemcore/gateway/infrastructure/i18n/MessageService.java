package me.golemcore.gateway.infrastructure.i18n;

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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Localized user-visible texts from {@code messages*.properties}.
 *
 * <p>
 * English is the base bundle, Russian is layered on top of it. A key missing
 * from the selected language falls back to English; a key missing everywhere
 * is returned as is. Parameters use {@link MessageFormat} syntax.
 */
@Service
@Slf4j
public class MessageService {

    private static final String BASE_NAME = "messages";
    private static final String FALLBACK_LANGUAGE = "en";

    private final Map<String, ResourceBundle> bundles;
    private volatile String language = FALLBACK_LANGUAGE;

    public MessageService() {
        ResourceBundle.Control control = ResourceBundle.Control
                .getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);
        this.bundles = Map.of(
                "en", ResourceBundle.getBundle(BASE_NAME, Locale.ROOT, control),
                "ru", ResourceBundle.getBundle(BASE_NAME, Locale.forLanguageTag("ru"), control));
    }

    public String getMessage(String key, Object... args) {
        String pattern = lookup(bundles.get(language), key);
        if (pattern == null && !FALLBACK_LANGUAGE.equals(language)) {
            pattern = lookup(bundles.get(FALLBACK_LANGUAGE), key);
        }
        if (pattern == null) {
            log.warn("[i18n] Missing message key: {}", key);
            return key;
        }
        return args.length > 0 ? MessageFormat.format(pattern, args) : pattern;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String lang) {
        if (lang != null && bundles.containsKey(lang)) {
            language = lang;
        } else {
            log.warn("[i18n] Unsupported language {}, using {}", lang, FALLBACK_LANGUAGE);
            language = FALLBACK_LANGUAGE;
        }
    }

    private static String lookup(ResourceBundle bundle, String key) {
        try {
            return bundle.getString(key);
        } catch (MissingResourceException e) {
            return null;
        }
    }
}
