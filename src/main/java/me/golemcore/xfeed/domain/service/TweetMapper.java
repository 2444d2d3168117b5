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
import me.golemcore.xfeed.domain.model.TweetAuthor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Maps a raw post result into a {@link Tweet}.
 *
 * <p>
 * Results without an id, an author handle or any text are dropped. Quoted
 * posts are followed while the quote depth allows it, each level with one
 * less.
 */
@Component
public class TweetMapper {

    private final TweetTextExtractor textExtractor;
    private final MediaExtractor mediaExtractor;

    public TweetMapper(TweetTextExtractor textExtractor, MediaExtractor mediaExtractor) {
        this.textExtractor = textExtractor;
        this.mediaExtractor = mediaExtractor;
    }

    public Optional<Tweet> map(JsonNode result, MappingOptions options) {
        if (result == null || !result.isObject()) {
            return Optional.empty();
        }
        Optional<String> id = JsonNodes.rawText(result, "rest_id").filter(value -> !value.isEmpty());
        JsonNode user = result.path("core").path("user_results").path("result");
        Optional<String> username = JsonNodes.rawText(user, "legacy", "screen_name")
                .or(() -> JsonNodes.rawText(user, "core", "screen_name"))
                .filter(value -> !value.isEmpty());
        if (id.isEmpty() || username.isEmpty()) {
            return Optional.empty();
        }

        Optional<String> text = textExtractor.extract(result);
        if (text.isEmpty()) {
            return Optional.empty();
        }

        String name = JsonNodes.rawText(user, "legacy", "name")
                .or(() -> JsonNodes.rawText(user, "core", "name"))
                .filter(value -> !value.isEmpty())
                .orElse(username.get());

        JsonNode legacy = result.path("legacy");
        Tweet.TweetBuilder builder = Tweet.builder()
                .id(id.get())
                .text(text.get())
                .author(new TweetAuthor(username.get(), name))
                .authorId(JsonNodes.rawText(user, "rest_id").orElse(null))
                .createdAt(JsonNodes.rawText(legacy, "created_at").orElse(null))
                .replyCount(JsonNodes.integer(legacy, "reply_count"))
                .retweetCount(JsonNodes.integer(legacy, "retweet_count"))
                .likeCount(JsonNodes.integer(legacy, "favorite_count"))
                .conversationId(JsonNodes.rawText(legacy, "conversation_id_str").orElse(null))
                .inReplyToStatusId(JsonNodes.rawText(legacy, "in_reply_to_status_id_str").orElse(null))
                .media(mediaExtractor.extract(result).orElse(null))
                .article(textExtractor.extractArticleMetadata(result).orElse(null));

        if (options.quoteDepth() > 0) {
            JsonNode quoted = unwrap(result.path("quoted_status_result").get("result"));
            if (quoted != null) {
                map(quoted, options.withQuoteDepth(options.quoteDepth() - 1)).ifPresent(builder::quotedTweet);
            }
        }
        if (options.includeRaw()) {
            builder.raw(result);
        }
        return Optional.of(builder.build());
    }

    /**
     * Unwraps a visibility wrapper ({@code TweetWithVisibilityResults} or any
     * result carrying a {@code tweet} object) by one level.
     */
    public static JsonNode unwrap(JsonNode result) {
        if (result == null || !result.isObject()) {
            return null;
        }
        JsonNode inner = result.get("tweet");
        if (inner != null && inner.isObject()) {
            return inner;
        }
        return result;
    }
}
