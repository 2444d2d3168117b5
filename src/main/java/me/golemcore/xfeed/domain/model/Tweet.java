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

package me.golemcore.xfeed.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Normalized post.
 *
 * <p>
 * {@code id}, {@code text} and the author's username are always present.
 * {@code quotedTweet} nests at most as deep as the quote depth the post was
 * mapped with, and {@code raw} is only filled when the caller asked for the
 * original payload.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Tweet {

    private String id;
    private String text;
    private TweetAuthor author;
    private String authorId;
    private String createdAt;
    private Integer replyCount;
    private Integer retweetCount;
    private Integer likeCount;
    private String conversationId;
    private String inReplyToStatusId;
    private Tweet quotedTweet;
    private List<TweetMedia> media;
    private ArticleMetadata article;
    private JsonNode raw;
}
