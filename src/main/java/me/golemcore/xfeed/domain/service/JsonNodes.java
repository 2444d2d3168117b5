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

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Small helpers for reading loosely shaped GraphQL payloads.
 */
public final class JsonNodes {

    private JsonNodes() {
    }

    /**
     * Returns the trimmed textual value at the given path, or empty when the
     * node is missing, not a string or blank.
     */
    public static Optional<String> text(JsonNode node, String... path) {
        JsonNode current = at(node, path);
        if (current == null || !current.isTextual()) {
            return Optional.empty();
        }
        String value = current.asText().trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    /**
     * Returns the raw textual value at the given path without trimming.
     */
    public static Optional<String> rawText(JsonNode node, String... path) {
        JsonNode current = at(node, path);
        if (current == null || !current.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(current.asText());
    }

    public static Integer integer(JsonNode node, String... path) {
        JsonNode current = at(node, path);
        if (current == null || !current.canConvertToInt()) {
            return null;
        }
        return current.asInt();
    }

    public static Long longValue(JsonNode node, String... path) {
        JsonNode current = at(node, path);
        if (current == null || !current.isNumber()) {
            return null;
        }
        return current.asLong();
    }

    public static Boolean bool(JsonNode node, String... path) {
        JsonNode current = at(node, path);
        if (current == null || !current.isBoolean()) {
            return null;
        }
        return current.asBoolean();
    }

    /**
     * Returns the object at the given path, or {@code null}.
     */
    public static JsonNode object(JsonNode node, String... path) {
        JsonNode current = at(node, path);
        return current != null && current.isObject() ? current : null;
    }

    /**
     * Returns the elements of the array at the given path; missing or
     * non-array nodes yield an empty list.
     */
    public static List<JsonNode> array(JsonNode node, String... path) {
        JsonNode current = at(node, path);
        List<JsonNode> result = new ArrayList<>();
        if (current != null && current.isArray()) {
            current.forEach(result::add);
        }
        return result;
    }

    private static JsonNode at(JsonNode node, String... path) {
        JsonNode current = node;
        for (String segment : path) {
            if (current == null || current.isNull() || current.isMissingNode()) {
                return null;
            }
            current = current.get(segment);
        }
        if (current == null || current.isNull() || current.isMissingNode()) {
            return null;
        }
        return current;
    }
}
