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
import me.golemcore.xfeed.domain.model.MappingOptions;
import me.golemcore.xfeed.domain.model.Tweet;
import me.golemcore.xfeed.domain.model.TwitterUser;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Turns timeline {@code instructions} into posts, accounts and cursors.
 *
 * <p>
 * A post can sit in four places inside an entry:
 * <ul>
 * <li>{@code content.itemContent}</li>
 * <li>{@code content.item.itemContent}</li>
 * <li>{@code content.items[].item.itemContent}, {@code .itemContent} or
 * {@code .content.itemContent} (conversation modules)</li>
 * </ul>
 * All shapes are probed in that order and the union is kept, de-duplicated by
 * post id.
 */
@Component
public class TimelineParser {

    private static final String[] TWEET_RESULT = { "itemContent", "tweet_results", "result" };

    private static final List<Function<JsonNode, JsonNode>> ENTRY_SHAPES = List.of(
            content -> at(content, TWEET_RESULT),
            content -> at(content.path("item"), TWEET_RESULT));

    private static final List<Function<JsonNode, JsonNode>> MODULE_ITEM_SHAPES = List.of(
            item -> at(item.path("item"), TWEET_RESULT),
            item -> at(item, TWEET_RESULT),
            item -> at(item.path("content"), TWEET_RESULT));

    private final TweetMapper tweetMapper;
    private final UserMapper userMapper;

    public TimelineParser(TweetMapper tweetMapper, UserMapper userMapper) {
        this.tweetMapper = tweetMapper;
        this.userMapper = userMapper;
    }

    public List<Tweet> parseTweets(JsonNode instructions, MappingOptions options) {
        List<Tweet> tweets = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (JsonNode entry : entries(instructions)) {
            for (JsonNode result : collectTweetResults(entry)) {
                tweetMapper.map(result, options)
                        .filter(tweet -> seen.add(tweet.getId()))
                        .ifPresent(tweets::add);
            }
        }
        return tweets;
    }

    public List<TwitterUser> parseUsers(JsonNode instructions) {
        List<TwitterUser> users = new ArrayList<>();
        for (JsonNode entry : entries(instructions)) {
            JsonNode result = at(entry.path("content"), "itemContent", "user_results", "result");
            if (result != null) {
                userMapper.map(result).ifPresent(users::add);
            }
        }
        return users;
    }

    /**
     * Returns the value of the first cursor entry of the given type, e.g.
     * {@code Bottom}.
     */
    public Optional<String> extractCursor(JsonNode instructions, String cursorType) {
        for (JsonNode entry : entries(instructions)) {
            JsonNode content = entry.path("content");
            if (cursorType.equals(content.path("cursorType").asText(null))) {
                Optional<String> value = JsonNodes.rawText(content, "value").filter(v -> !v.isEmpty());
                if (value.isPresent()) {
                    return value;
                }
            }
        }
        return Optional.empty();
    }

    public Optional<String> extractBottomCursor(JsonNode instructions) {
        return extractCursor(instructions, "Bottom");
    }

    /**
     * Finds the raw result of the post with the given id among the direct
     * entries.
     */
    public Optional<JsonNode> findTweet(JsonNode instructions, String tweetId) {
        for (JsonNode entry : entries(instructions)) {
            JsonNode result = TweetMapper.unwrap(at(entry.path("content"), TWEET_RESULT));
            if (result != null && tweetId.equals(result.path("rest_id").asText(null))) {
                return Optional.of(result);
            }
        }
        return Optional.empty();
    }

    List<JsonNode> collectTweetResults(JsonNode entry) {
        List<JsonNode> results = new ArrayList<>();
        JsonNode content = entry.path("content");
        for (Function<JsonNode, JsonNode> shape : ENTRY_SHAPES) {
            addIfPresent(results, shape.apply(content));
        }
        for (JsonNode item : JsonNodes.array(content, "items")) {
            for (Function<JsonNode, JsonNode> shape : MODULE_ITEM_SHAPES) {
                addIfPresent(results, shape.apply(item));
            }
        }
        return results;
    }

    private static void addIfPresent(List<JsonNode> results, JsonNode candidate) {
        JsonNode result = TweetMapper.unwrap(candidate);
        if (result != null && JsonNodes.rawText(result, "rest_id").filter(id -> !id.isEmpty()).isPresent()) {
            results.add(result);
        }
    }

    /**
     * Flattens the entries of all instructions. A replace-entry instruction
     * carries a single {@code entry} instead of a list.
     */
    private static List<JsonNode> entries(JsonNode instructions) {
        List<JsonNode> entries = new ArrayList<>();
        if (instructions == null || !instructions.isArray()) {
            return entries;
        }
        for (JsonNode instruction : instructions) {
            entries.addAll(JsonNodes.array(instruction, "entries"));
            JsonNode single = instruction.get("entry");
            if (single != null && single.isObject()) {
                entries.add(single);
            }
        }
        return entries;
    }

    private static JsonNode at(JsonNode node, String... path) {
        JsonNode current = node;
        for (String segment : path) {
            if (current == null) {
                return null;
            }
            current = current.get(segment);
        }
        return current != null && current.isObject() ? current : null;
    }
}
