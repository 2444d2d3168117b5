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
import me.golemcore.xfeed.domain.model.TweetMedia;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Extracts photo and video attachments from a post.
 */
@Component
public class MediaExtractor {

    private static final String MP4 = "video/mp4";

    /**
     * Returns the attachments in payload order, or empty when there are none.
     * {@code extended_entities} is preferred since only it carries video
     * variants.
     */
    public Optional<List<TweetMedia>> extract(JsonNode tweetResult) {
        List<JsonNode> rawMedia = JsonNodes.array(tweetResult, "legacy", "extended_entities", "media");
        if (rawMedia.isEmpty()) {
            rawMedia = JsonNodes.array(tweetResult, "legacy", "entities", "media");
        }

        List<TweetMedia> media = new ArrayList<>();
        for (JsonNode item : rawMedia) {
            Optional<String> type = JsonNodes.rawText(item, "type");
            Optional<String> url = JsonNodes.rawText(item, "media_url_https");
            if (type.isEmpty() || type.get().isEmpty() || url.isEmpty() || url.get().isEmpty()) {
                continue;
            }
            media.add(toMedia(item, type.get(), url.get()));
        }
        return media.isEmpty() ? Optional.empty() : Optional.of(media);
    }

    private TweetMedia toMedia(JsonNode item, String type, String url) {
        TweetMedia.TweetMediaBuilder builder = TweetMedia.builder()
                .type(type)
                .url(url);

        JsonNode sizes = item.path("sizes");
        JsonNode dimensions = sizes.has("large") ? sizes.get("large") : sizes.get("medium");
        if (dimensions != null && dimensions.isObject()) {
            builder.width(JsonNodes.integer(dimensions, "w"))
                    .height(JsonNodes.integer(dimensions, "h"));
        }
        if (sizes.has("small")) {
            builder.previewUrl(url + ":small");
        }

        if (TweetMedia.TYPE_VIDEO.equals(type) || TweetMedia.TYPE_ANIMATED_GIF.equals(type)) {
            JsonNode videoInfo = item.path("video_info");
            selectVariant(JsonNodes.array(videoInfo, "variants")).ifPresent(builder::videoUrl);
            builder.durationMs(JsonNodes.longValue(videoInfo, "duration_millis"));
        }
        return builder.build();
    }

    private Optional<String> selectVariant(List<JsonNode> variants) {
        List<JsonNode> mp4 = variants.stream()
                .filter(variant -> MP4.equals(variant.path("content_type").asText()))
                .filter(variant -> variant.path("url").isTextual())
                .toList();

        Optional<JsonNode> best = mp4.stream()
                .filter(variant -> variant.path("bitrate").isNumber())
                .max(Comparator.comparingLong(variant -> variant.path("bitrate").asLong()));
        return best.or(() -> mp4.stream().findFirst())
                .map(variant -> variant.path("url").asText());
    }
}
