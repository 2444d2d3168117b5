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
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Renders a rich article document (Draft.js {@code content_state}: a list of
 * blocks plus an entity map) into markdown-flavoured text.
 *
 * <p>
 * Block rendering:
 * <ul>
 * <li>{@code header-one/two/three} - {@code #}, {@code ##}, {@code ###}</li>
 * <li>{@code unordered-list-item} - {@code - text}</li>
 * <li>{@code ordered-list-item} - {@code n. text}; the counter restarts after
 * any other block type</li>
 * <li>{@code blockquote} - {@code > text}</li>
 * <li>{@code atomic} - the embedded entity (code, divider, post, link,
 * image)</li>
 * <li>anything else - the plain text</li>
 * </ul>
 * Blank blocks are skipped and rendered blocks are separated by a blank line.
 */
@Component
public class ContentStateRenderer {

    private static final String ORDERED_LIST_ITEM = "ordered-list-item";

    /**
     * Renders the document, or returns empty when it has no blocks or nothing
     * printable.
     */
    public Optional<String> render(JsonNode contentState) {
        List<JsonNode> blocks = JsonNodes.array(contentState, "blocks");
        if (blocks.isEmpty()) {
            return Optional.empty();
        }

        Map<Integer, JsonNode> entities = readEntityMap(contentState == null ? null : contentState.get("entityMap"));
        List<String> output = new ArrayList<>();
        int orderedCounter = 0;
        String previousType = null;

        for (JsonNode block : blocks) {
            String type = block.path("type").asText("unstyled");
            if (!ORDERED_LIST_ITEM.equals(type) && ORDERED_LIST_ITEM.equals(previousType)) {
                orderedCounter = 0;
            }

            String rendered;
            switch (type) {
            case "header-one" -> rendered = prefixed("# ", renderBlockText(block, entities));
            case "header-two" -> rendered = prefixed("## ", renderBlockText(block, entities));
            case "header-three" -> rendered = prefixed("### ", renderBlockText(block, entities));
            case "unordered-list-item" -> rendered = prefixed("- ", renderBlockText(block, entities));
            case ORDERED_LIST_ITEM -> {
                orderedCounter++;
                rendered = prefixed(orderedCounter + ". ", renderBlockText(block, entities));
            }
            case "blockquote" -> rendered = prefixed("> ", renderBlockText(block, entities));
            case "atomic" -> rendered = renderAtomicBlock(block, entities);
            default -> rendered = renderBlockText(block, entities);
            }

            if (rendered != null && !rendered.isEmpty()) {
                output.add(rendered);
            }
            previousType = type;
        }

        String result = String.join("\n\n", output).trim();
        return result.isEmpty() ? Optional.empty() : Optional.of(result);
    }

    private static String prefixed(String prefix, String text) {
        return text.isEmpty() ? null : prefix + text;
    }

    private String renderBlockText(JsonNode block, Map<Integer, JsonNode> entities) {
        String text = block.path("text").asText("");

        List<JsonNode> linkRanges = new ArrayList<>();
        for (JsonNode range : JsonNodes.array(block, "entityRanges")) {
            JsonNode entity = entities.get(range.path("key").asInt(-1));
            if (entity != null && "LINK".equals(entity.path("type").asText())
                    && JsonNodes.text(entity, "data", "url").isPresent()) {
                linkRanges.add(range);
            }
        }
        linkRanges.sort(Comparator.comparingInt((JsonNode range) -> range.path("offset").asInt()).reversed());

        for (JsonNode range : linkRanges) {
            int offset = range.path("offset").asInt();
            int end = offset + range.path("length").asInt();
            if (offset < 0 || end > text.length() || end < offset) {
                continue;
            }
            String url = entities.get(range.path("key").asInt()).path("data").path("url").asText();
            text = text.substring(0, offset) + "[" + text.substring(offset, end) + "](" + url + ")"
                    + text.substring(end);
        }
        return text.trim();
    }

    private String renderAtomicBlock(JsonNode block, Map<Integer, JsonNode> entities) {
        List<JsonNode> ranges = JsonNodes.array(block, "entityRanges");
        if (ranges.isEmpty()) {
            return null;
        }
        JsonNode entity = entities.get(ranges.get(0).path("key").asInt(-1));
        if (entity == null) {
            return null;
        }

        return switch (entity.path("type").asText()) {
        case "MARKDOWN" -> JsonNodes.text(entity, "data", "markdown").orElse(null);
        case "DIVIDER" -> "---";
        case "TWEET" -> JsonNodes.text(entity, "data", "tweetId")
                .map(id -> "[Embedded Tweet: https://x.com/i/status/" + id + "]")
                .orElse(null);
        case "LINK" -> JsonNodes.text(entity, "data", "url")
                .map(url -> "[Link: " + url + "]")
                .orElse(null);
        case "IMAGE" -> "[Image]";
        default -> null;
        };
    }

    /**
     * Reads the entity map in either of its wire forms: a list of
     * {@code {key, value}} pairs or an object keyed by the entity number.
     */
    private Map<Integer, JsonNode> readEntityMap(JsonNode entityMap) {
        Map<Integer, JsonNode> entities = new HashMap<>();
        if (entityMap == null) {
            return entities;
        }
        if (entityMap.isArray()) {
            for (JsonNode entry : entityMap) {
                parseKey(entry.path("key").asText()).ifPresent(key -> entities.put(key, entry.path("value")));
            }
        } else if (entityMap.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = entityMap.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                parseKey(field.getKey()).ifPresent(key -> entities.put(key, field.getValue()));
            }
        }
        return entities;
    }

    private static Optional<Integer> parseKey(String key) {
        try {
            return Optional.of(Integer.parseInt(key.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
