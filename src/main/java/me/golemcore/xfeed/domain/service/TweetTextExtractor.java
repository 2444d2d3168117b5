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
import me.golemcore.xfeed.domain.model.ArticleMetadata;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Picks the display text of a post.
 *
 * <p>
 * Sources are tried in priority order and the first non-blank one wins:
 * <ol>
 * <li>attached article (rich document, then plain-text variants, then any
 * text found in the article payload)</li>
 * <li>long-form note text</li>
 * <li>{@code legacy.full_text}</li>
 * </ol>
 */
@Component
public class TweetTextExtractor {

    private static final String[][] PLAIN_TEXT = { { "plain_text" } };

    private static final String[][] TEXT_VARIANTS = {
            { "body", "text" },
            { "body", "richtext", "text" },
            { "body", "rich_text", "text" },
            { "content", "text" },
            { "content", "richtext", "text" },
            { "content", "rich_text", "text" },
            { "text" },
            { "richtext", "text" },
            { "rich_text", "text" },
    };

    private static final String[][] NOTE_VARIANTS = {
            { "text" },
            { "richtext", "text" },
            { "rich_text", "text" },
            { "content", "text" },
            { "content", "richtext", "text" },
            { "content", "rich_text", "text" },
    };

    private static final Set<String> COLLECTED_KEYS = Set.of("text", "title");

    private final ContentStateRenderer contentStateRenderer;
    private final List<Function<JsonNode, Optional<String>>> extractors;

    public TweetTextExtractor(ContentStateRenderer contentStateRenderer) {
        this.contentStateRenderer = contentStateRenderer;
        this.extractors = List.of(this::extractArticleText, this::extractNoteText, this::extractLegacyText);
    }

    public Optional<String> extract(JsonNode tweetResult) {
        for (Function<JsonNode, Optional<String>> extractor : extractors) {
            Optional<String> text = extractor.apply(tweetResult);
            if (text.isPresent()) {
                return text;
            }
        }
        return Optional.empty();
    }

    public Optional<String> extractArticleText(JsonNode tweetResult) {
        JsonNode article = JsonNodes.object(tweetResult, "article");
        if (article == null) {
            return Optional.empty();
        }
        JsonNode articleResult = articleResult(article);
        String title = articleTitle(article).orElse(null);

        Optional<String> rich = contentStateRenderer.render(article.path("article_results").path("result")
                .get("content_state"));
        if (rich.isPresent()) {
            String body = rich.get();
            return Optional.of(title != null && !body.startsWith(title) ? title + "\n\n" + body : body);
        }

        String body = firstText(articleResult, PLAIN_TEXT)
                .or(() -> firstText(article, PLAIN_TEXT))
                .or(() -> firstText(articleResult, TEXT_VARIANTS))
                .or(() -> firstText(article, TEXT_VARIANTS))
                .orElse(null);
        if (body != null && body.equals(title)) {
            body = null;
        }

        if (body == null) {
            List<String> collected = new ArrayList<>();
            collectTextFields(articleResult, collected);
            collectTextFields(article, collected);
            Set<String> unique = new LinkedHashSet<>(collected);
            if (title != null) {
                unique.remove(title);
            }
            if (!unique.isEmpty()) {
                body = String.join("\n\n", unique);
            }
        }

        if (title != null && body != null && !body.startsWith(title)) {
            return Optional.of(title + "\n\n" + body);
        }
        return Optional.ofNullable(body != null ? body : title);
    }

    public Optional<String> extractNoteText(JsonNode tweetResult) {
        JsonNode note = JsonNodes.object(tweetResult, "note_tweet", "note_tweet_results", "result");
        return note == null ? Optional.empty() : firstText(note, NOTE_VARIANTS);
    }

    public Optional<String> extractLegacyText(JsonNode tweetResult) {
        return JsonNodes.text(tweetResult, "legacy", "full_text");
    }

    public Optional<ArticleMetadata> extractArticleMetadata(JsonNode tweetResult) {
        JsonNode article = JsonNodes.object(tweetResult, "article");
        if (article == null) {
            return Optional.empty();
        }
        return articleTitle(article).map(title -> new ArticleMetadata(title,
                JsonNodes.text(articleResult(article), "preview_text")
                        .or(() -> JsonNodes.text(article, "preview_text"))
                        .orElse(null)));
    }

    public Optional<String> articleTitle(JsonNode article) {
        return JsonNodes.text(articleResult(article), "title").or(() -> JsonNodes.text(article, "title"));
    }

    private static JsonNode articleResult(JsonNode article) {
        JsonNode result = JsonNodes.object(article, "article_results", "result");
        return result != null ? result : article;
    }

    private static Optional<String> firstText(JsonNode node, String[][] variants) {
        for (String[] path : variants) {
            Optional<String> text = JsonNodes.text(node, path);
            if (text.isPresent()) {
                return text;
            }
        }
        return Optional.empty();
    }

    private static void collectTextFields(JsonNode node, List<String> output) {
        if (node == null) {
            return;
        }
        if (node.isArray()) {
            node.forEach(item -> collectTextFields(item, output));
            return;
        }
        if (!node.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (COLLECTED_KEYS.contains(field.getKey()) && value.isTextual()) {
                String trimmed = value.asText().trim();
                if (!trimmed.isEmpty()) {
                    output.add(trimmed);
                }
                continue;
            }
            collectTextFields(value, output);
        }
    }
}
