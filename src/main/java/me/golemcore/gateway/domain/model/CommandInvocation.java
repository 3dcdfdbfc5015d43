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

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Slash command parsed from an event text: {@code /name@bot arg1 arg2}.
 *
 * @param name
 *            lower-case command name without slash and bot suffix
 * @param args
 *            whitespace-separated arguments
 * @param argumentText
 *            raw text after the command token, trimmed
 */
public record CommandInvocation(String name, List<String> args, String argumentText) {

    public CommandInvocation {
        args = args != null ? List.copyOf(args) : List.of();
        argumentText = argumentText != null ? argumentText : "";
    }

    /**
     * Parses a slash command. Returns empty for plain text, a lone slash or a
     * token that is not a word.
     */
    public static Optional<CommandInvocation> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (trimmed.length() < 2 || trimmed.charAt(0) != '/') {
            return Optional.empty();
        }
        String[] parts = trimmed.split("\\s+", 2);
        String name = parts[0].substring(1).split("@")[0].toLowerCase(Locale.ROOT);
        if (name.isEmpty() || !name.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '_')) {
            return Optional.empty();
        }
        String argumentText = parts.length > 1 ? parts[1].trim() : "";
        List<String> args = argumentText.isEmpty()
                ? List.of()
                : Arrays.asList(argumentText.split("\\s+"));
        return Optional.of(new CommandInvocation(name, args, argumentText));
    }
}
