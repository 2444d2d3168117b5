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

package me.golemcore.xfeed.domain.service;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Normalizes account handles typed by users: surrounding whitespace and a
 * leading {@code @} are dropped, then the handle must be 1 to 15 letters,
 * digits or underscores.
 */
public final class HandleNormalizer {

    private static final Pattern HANDLE = Pattern.compile("^[A-Za-z0-9_]{1,15}$");

    private HandleNormalizer() {
    }

    public static Optional<String> normalize(String input) {
        if (input == null) {
            return Optional.empty();
        }
        String handle = input.trim();
        if (handle.startsWith("@")) {
            handle = handle.substring(1).trim();
        }
        return HANDLE.matcher(handle).matches() ? Optional.of(handle) : Optional.empty();
    }
}
