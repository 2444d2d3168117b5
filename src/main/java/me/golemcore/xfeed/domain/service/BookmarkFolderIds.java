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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a bookmark folder id from a bookmarks URL or a bare numeric id.
 */
public final class BookmarkFolderIds {

    private static final Pattern FOLDER_URL = Pattern.compile("(?:twitter\\.com|x\\.com)/i/bookmarks/(\\d+)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern FOLDER_ID = Pattern.compile("^\\d{5,}$");

    private BookmarkFolderIds() {
    }

    public static Optional<String> extract(String input) {
        if (input == null || input.isBlank()) {
            return Optional.empty();
        }
        String trimmed = input.trim();
        Matcher url = FOLDER_URL.matcher(trimmed);
        if (url.find()) {
            return Optional.of(url.group(1));
        }
        return FOLDER_ID.matcher(trimmed).matches() ? Optional.of(trimmed) : Optional.empty();
    }
}
