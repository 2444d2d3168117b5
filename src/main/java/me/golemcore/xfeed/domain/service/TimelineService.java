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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.xfeed.domain.model.FeedResult;
import me.golemcore.xfeed.domain.model.GraphqlOperation;
import me.golemcore.xfeed.domain.model.GraphqlResult;
import me.golemcore.xfeed.domain.model.MappingOptions;
import me.golemcore.xfeed.domain.model.Page;
import me.golemcore.xfeed.domain.model.TimelineFetchOptions;
import me.golemcore.xfeed.domain.model.Tweet;
import me.golemcore.xfeed.domain.model.TweetLookupResult;
import me.golemcore.xfeed.domain.model.TwitterUser;
import me.golemcore.xfeed.domain.model.UserLookupResult;
import me.golemcore.xfeed.infrastructure.config.XFeedProperties;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Read operations over the web GraphQL API.
 *
 * <p>
 * Every operation returns a value and never throws: failures are reported in
 * {@link FeedResult}, {@link TweetLookupResult} or {@link UserLookupResult}.
 * Reads are sequential; a paginated read issues one request at a time.
 */
@Service
@Slf4j
public class TimelineService {

    private static final String[] HOME_INSTRUCTIONS = { "home", "home_timeline_urt", "instructions" };
    private static final String[] USER_TIMELINE_INSTRUCTIONS = { "user", "result", "timeline", "timeline",
            "instructions" };
    private static final String[] SEARCH_INSTRUCTIONS = { "search_by_raw_query", "search_timeline", "timeline",
            "instructions" };
    private static final String[] BOOKMARK_INSTRUCTIONS = { "bookmark_timeline_v2", "timeline", "instructions" };
    private static final String[] BOOKMARK_FOLDER_INSTRUCTIONS = { "bookmark_collection_timeline", "timeline",
            "instructions" };
    private static final String[] CONVERSATION_INSTRUCTIONS = { "threaded_conversation_with_injections_v2",
            "instructions" };

    private static final DateTimeFormatter TWITTER_DATE = DateTimeFormatter
            .ofPattern("EEE MMM dd HH:mm:ss Z yyyy", Locale.ENGLISH);

    private final GraphqlExecutor executor;
    private final CursorPaginator paginator;
    private final TimelineParser parser;
    private final TweetMapper tweetMapper;
    private final TweetTextExtractor textExtractor;
    private final RestUserLookup restUserLookup;
    private final XFeedProperties properties;

    public TimelineService(GraphqlExecutor executor, CursorPaginator paginator, TimelineParser parser,
            TweetMapper tweetMapper, TweetTextExtractor textExtractor, RestUserLookup restUserLookup,
            XFeedProperties properties) {
        this.executor = executor;
        this.paginator = paginator;
        this.parser = parser;
        this.tweetMapper = tweetMapper;
        this.textExtractor = textExtractor;
        this.restUserLookup = restUserLookup;
        this.properties = properties;
    }

    public FeedResult<Tweet> getHomeTimeline(int count, TimelineFetchOptions options) {
        return readHome(GraphqlOperation.HOME_TIMELINE, count, options);
    }

    public FeedResult<Tweet> getHomeLatestTimeline(int count, TimelineFetchOptions options) {
        return readHome(GraphqlOperation.HOME_LATEST_TIMELINE, count, options);
    }

    private FeedResult<Tweet> readHome(GraphqlOperation operation, int count, TimelineFetchOptions options) {
        return readTweets(TimelineQuery.builder(operation, HOME_INSTRUCTIONS)
                .features(FeatureFlags.timeline())
                .variables((cursor, pageCount) -> {
                    Map<String, Object> variables = new LinkedHashMap<>();
                    variables.put("count", pageCount);
                    variables.put("includePromotedContent", true);
                    variables.put("latestControlAvailable", true);
                    variables.put("requestContext", "launch");
                    variables.put("withCommunity", true);
                    return withCursor(variables, cursor);
                })
                .build(), count, options);
    }

    public FeedResult<Tweet> getUserTweets(String userId, int limit, TimelineFetchOptions options) {
        Map<String, Object> toggles = new LinkedHashMap<>();
        toggles.put("withArticlePlainText", false);
        return readTweets(TimelineQuery.builder(GraphqlOperation.USER_TWEETS, USER_TIMELINE_INSTRUCTIONS)
                .features(FeatureFlags.timeline())
                .fieldToggles(toggles)
                .errorTolerance(TimelineService::toleratesUserTimelineErrors)
                .variables((cursor, pageCount) -> {
                    Map<String, Object> variables = new LinkedHashMap<>();
                    variables.put("userId", userId);
                    variables.put("count", pageCount);
                    variables.put("includePromotedContent", false);
                    variables.put("withQuickPromoteEligibilityTweetFields", true);
                    variables.put("withVoice", true);
                    return withCursor(variables, cursor);
                })
                .build(), limit, options);
    }

    public FeedResult<Tweet> search(String query, int count, TimelineFetchOptions options) {
        return readTweets(TimelineQuery.builder(GraphqlOperation.SEARCH_TIMELINE, SEARCH_INSTRUCTIONS)
                .features(FeatureFlags.timeline())
                .requestStyles(List.of(GraphqlCall.RequestStyle.POST_QUERY_VARIABLES))
                .variables((cursor, pageCount) -> {
                    Map<String, Object> variables = new LinkedHashMap<>();
                    variables.put("rawQuery", query);
                    variables.put("count", pageCount);
                    variables.put("querySource", "typed_query");
                    variables.put("product", "Latest");
                    return withCursor(variables, cursor);
                })
                .build(), count, options);
    }

    public FeedResult<Tweet> getBookmarks(int count, TimelineFetchOptions options) {
        return readTweets(TimelineQuery.builder(GraphqlOperation.BOOKMARKS, BOOKMARK_INSTRUCTIONS)
                .features(FeatureFlags.bookmarks())
                .variables((cursor, pageCount) -> {
                    Map<String, Object> variables = new LinkedHashMap<>();
                    variables.put("count", pageCount);
                    variables.put("includePromotedContent", false);
                    variables.put("withDownvotePerspective", false);
                    variables.put("withReactionsMetadata", false);
                    variables.put("withReactionsPerspective", false);
                    return withCursor(variables, cursor);
                })
                .build(), count, options);
    }

    /**
     * Reads a bookmark folder. Some deployments reject the {@code count}
     * variable for this operation; the page is then re-requested without it
     * and later pages omit it too.
     *
     * @param folder
     *            numeric folder id or a bookmark folder URL
     */
    public FeedResult<Tweet> getBookmarkFolderTimeline(String folder, int count, TimelineFetchOptions options) {
        Optional<String> extracted = BookmarkFolderIds.extract(folder);
        if (extracted.isEmpty()) {
            return FeedResult.failure("Invalid bookmark folder: " + folder);
        }
        String folderId = extracted.get();
        AtomicBoolean omitCount = new AtomicBoolean(false);
        TimelineQuery query = TimelineQuery.builder(GraphqlOperation.BOOKMARK_FOLDER_TIMELINE,
                BOOKMARK_FOLDER_INSTRUCTIONS)
                .features(FeatureFlags.bookmarks())
                .variables((cursor, pageCount) -> {
                    Map<String, Object> variables = new LinkedHashMap<>();
                    variables.put("bookmark_collection_id", folderId);
                    variables.put("includePromotedContent", true);
                    if (!omitCount.get()) {
                        variables.put("count", pageCount);
                    }
                    return withCursor(variables, cursor);
                })
                .build();

        MappingOptions mapping = mappingOptions(options);
        CursorPaginator.PageFetcher<Tweet> fetcher = (cursor, pageCount) -> {
            Page<Tweet> page = fetchTweetPage(query, mapping, cursor, pageCount);
            if (!page.success() && !omitCount.get() && page.error() != null
                    && page.error().contains("Variable \"$count\"")) {
                log.debug("[Timeline] Bookmark folder rejected count, retrying without it");
                omitCount.set(true);
                page = fetchTweetPage(query, mapping, cursor, pageCount);
            }
            return page;
        };
        return paginateTweets(fetcher, count, options);
    }

    public FeedResult<Tweet> getLikes(String userId, int count, TimelineFetchOptions options) {
        return readTweets(TimelineQuery.builder(GraphqlOperation.LIKES, USER_TIMELINE_INSTRUCTIONS)
                .features(FeatureFlags.timeline())
                .variables((cursor, pageCount) -> {
                    Map<String, Object> variables = new LinkedHashMap<>();
                    variables.put("userId", userId);
                    variables.put("count", pageCount);
                    variables.put("includePromotedContent", false);
                    variables.put("withClientEventToken", false);
                    variables.put("withBirdwatchNotes", false);
                    variables.put("withVoice", true);
                    return withCursor(variables, cursor);
                })
                .build(), count, options);
    }

    public FeedResult<TwitterUser> getFollowing(String userId, int count, TimelineFetchOptions options) {
        return readUsers(GraphqlOperation.FOLLOWING, userId, count, options);
    }

    public FeedResult<TwitterUser> getFollowers(String userId, int count, TimelineFetchOptions options) {
        return readUsers(GraphqlOperation.FOLLOWERS, userId, count, options);
    }

    private FeedResult<TwitterUser> readUsers(GraphqlOperation operation, String userId, int count,
            TimelineFetchOptions options) {
        if (count <= 0) {
            return FeedResult.failure("Invalid limit: " + count);
        }
        TimelineQuery query = TimelineQuery.builder(operation, USER_TIMELINE_INSTRUCTIONS)
                .features(FeatureFlags.timeline())
                .variables((cursor, pageCount) -> {
                    Map<String, Object> variables = new LinkedHashMap<>();
                    variables.put("userId", userId);
                    variables.put("count", pageCount);
                    variables.put("includePromotedContent", false);
                    return withCursor(variables, cursor);
                })
                .build();

        TimelineFetchOptions effective = orDefaults(options);
        return paginator.paginate(CursorPaginator.PaginationRequest.<TwitterUser>builder()
                .fetcher((cursor, pageCount) -> {
                    GraphqlResult result = executor.execute(query.toCall(cursor, pageCount));
                    if (!result.isSuccess()) {
                        return Page.failure(result);
                    }
                    JsonNode instructions = query.instructions(result);
                    return Page.success(parser.parseUsers(instructions),
                            parser.extractBottomCursor(instructions).orElse(null));
                })
                .identityOf(TwitterUser::getId)
                .targetCount(count)
                .maxPages(effective.getMaxPages())
                .startCursor(effective.getCursor())
                .pageDelay(effective.getPageDelay())
                .build());
    }

    /**
     * Looks up a single post, following the article plain-text fallback when
     * the rich article body carries nothing beyond its title.
     */
    public TweetLookupResult getTweet(String tweetId, TimelineFetchOptions options) {
        GraphqlResult result = executor.execute(tweetDetailCall(tweetId, null));
        if (!result.isSuccess()) {
            return TweetLookupResult.failure(result.getError());
        }

        JsonNode data = result.data();
        JsonNode raw = TweetMapper.unwrap(data.path("tweetResult").get("result"));
        if (raw == null) {
            raw = parser.findTweet(at(data, CONVERSATION_INSTRUCTIONS), tweetId).orElse(null);
        }
        if (raw == null) {
            return TweetLookupResult.failure("Tweet not found in response");
        }

        JsonNode tweetResult = TweetMapper.unwrap(raw);
        Optional<Tweet> mapped = tweetMapper.map(tweetResult, mappingOptions(options));
        if (mapped.isEmpty()) {
            return TweetLookupResult.failure("Tweet not found in response");
        }
        Tweet tweet = mapped.get();
        applyArticleFallback(tweetResult, tweetId, tweet);
        return TweetLookupResult.success(tweet);
    }

    private void applyArticleFallback(JsonNode tweetResult, String tweetId, Tweet tweet) {
        JsonNode article = JsonNodes.object(tweetResult, "article");
        if (article == null) {
            return;
        }
        Optional<String> title = textExtractor.articleTitle(article);
        if (title.isEmpty()) {
            return;
        }
        Optional<String> articleText = textExtractor.extractArticleText(tweetResult);
        if (articleText.isPresent() && !articleText.get().trim().equals(title.get())) {
            return;
        }
        Optional<String> userId = JsonNodes.text(tweetResult, "core", "user_results", "result", "rest_id");
        if (userId.isEmpty()) {
            return;
        }

        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("userId", userId.get());
        variables.put("count", 20);
        variables.put("includePromotedContent", true);
        variables.put("withVoice", true);
        variables.put("withQuickPromoteEligibilityTweetFields", true);
        variables.put("withBirdwatchNotes", true);
        variables.put("withCommunity", true);
        variables.put("withSafetyModeUserFields", true);
        variables.put("withSuperFollowsUserFields", true);
        variables.put("withDownvotePerspective", false);
        variables.put("withReactionsMetadata", false);
        variables.put("withReactionsPerspective", false);
        variables.put("withSuperFollowsTweetFields", true);
        variables.put("withSuperFollowsReplyCount", false);
        variables.put("withClientEventToken", false);

        GraphqlResult result = executor.execute(GraphqlCall.builder()
                .operation(GraphqlOperation.USER_ARTICLES_TWEETS)
                .variables(variables)
                .features(FeatureFlags.article())
                .fieldToggles(FeatureFlags.articleFieldToggles())
                .build());
        if (!result.isSuccess()) {
            log.debug("[Timeline] Article fallback for {} failed: {}", tweetId, result.getError());
            return;
        }

        for (JsonNode entry : entries(at(result.data(), USER_TIMELINE_INSTRUCTIONS))) {
            JsonNode candidate = entry.path("content").path("itemContent").path("tweet_results").path("result");
            if (!tweetId.equals(candidate.path("rest_id").asText(null))) {
                continue;
            }
            JsonNode candidateArticle = candidate.path("article");
            JsonNode articleResult = candidateArticle.path("article_results").path("result");
            Optional<String> fallbackTitle = JsonNodes.text(articleResult, "title")
                    .or(() -> JsonNodes.text(candidateArticle, "title"));
            Optional<String> plainText = JsonNodes.text(articleResult, "plain_text")
                    .or(() -> JsonNodes.text(candidateArticle, "plain_text"));
            plainText.ifPresent(text -> tweet.setText(fallbackTitle.map(t -> t + "\n\n" + text).orElse(text)));
            return;
        }
    }

    /**
     * Replies to a post. Without an explicit page limit a single page is read.
     */
    public FeedResult<Tweet> getReplies(String tweetId, TimelineFetchOptions options) {
        MappingOptions mapping = mappingOptions(options);
        return paginateConversation(tweetId, options, (cursor, pageCount) -> {
            GraphqlResult result = executor.execute(tweetDetailCall(tweetId, cursor));
            if (!result.isSuccess()) {
                return Page.failure(result);
            }
            JsonNode instructions = at(result.data(), CONVERSATION_INSTRUCTIONS);
            List<Tweet> replies = parser.parseTweets(instructions, mapping).stream()
                    .filter(tweet -> tweetId.equals(tweet.getInReplyToStatusId()))
                    .toList();
            return Page.success(replies, parser.extractBottomCursor(instructions).orElse(null));
        });
    }

    /**
     * The conversation a post belongs to, oldest first. Without an explicit
     * page limit a single page is read.
     */
    public FeedResult<Tweet> getThread(String tweetId, TimelineFetchOptions options) {
        MappingOptions mapping = mappingOptions(options);
        AtomicReference<String> rootId = new AtomicReference<>();
        FeedResult<Tweet> result = paginateConversation(tweetId, options, (cursor, pageCount) -> {
            GraphqlResult response = executor.execute(tweetDetailCall(tweetId, cursor));
            if (!response.isSuccess()) {
                return Page.failure(response);
            }
            JsonNode instructions = at(response.data(), CONVERSATION_INSTRUCTIONS);
            List<Tweet> tweets = parser.parseTweets(instructions, mapping);
            if (rootId.get() == null) {
                rootId.set(tweets.stream()
                        .filter(tweet -> tweetId.equals(tweet.getId()))
                        .map(Tweet::getConversationId)
                        .filter(id -> id != null && !id.isEmpty())
                        .findFirst()
                        .orElse(tweetId));
            }
            List<Tweet> thread = tweets.stream()
                    .filter(tweet -> rootId.get().equals(tweet.getConversationId()))
                    .toList();
            return Page.success(thread, parser.extractBottomCursor(instructions).orElse(null));
        });

        if (result.getItems() == null) {
            return result;
        }
        List<Tweet> sorted = new ArrayList<>(result.getItems());
        sorted.sort(Comparator.comparingLong(tweet -> epochMillis(tweet.getCreatedAt())));
        result.setItems(List.copyOf(sorted));
        return result;
    }

    private FeedResult<Tweet> paginateConversation(String tweetId, TimelineFetchOptions options,
            CursorPaginator.PageFetcher<Tweet> fetcher) {
        TimelineFetchOptions effective = orDefaults(options);
        log.debug("[Timeline] Reading conversation of {}", tweetId);
        return paginator.paginate(CursorPaginator.PaginationRequest.<Tweet>builder()
                .fetcher(fetcher)
                .identityOf(Tweet::getId)
                .maxPages(effective.getMaxPages() != null ? effective.getMaxPages() : 1)
                .startCursor(effective.getCursor())
                .pageDelay(effective.getPageDelay())
                .build());
    }

    /**
     * Resolves a handle to an account id through {@code UserByScreenName},
     * falling back to the REST lookup unless the account is known to be
     * unavailable.
     */
    public UserLookupResult getUserIdByUsername(String username) {
        Optional<String> normalized = HandleNormalizer.normalize(username);
        if (normalized.isEmpty()) {
            return UserLookupResult.failure("Invalid username: " + username);
        }
        String handle = normalized.get();

        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("screen_name", handle);
        variables.put("withSafetyModeUserFields", true);
        Map<String, Object> toggles = new LinkedHashMap<>();
        toggles.put("withAuxiliaryUserLabels", false);

        GraphqlResult result = executor.execute(GraphqlCall.builder()
                .operation(GraphqlOperation.USER_BY_SCREEN_NAME)
                .variables(variables)
                .features(FeatureFlags.userLookup())
                .fieldToggles(toggles)
                .errorTolerance(root -> JsonNodes.text(root, "data", "user", "result", "rest_id").isPresent())
                .build());

        String error;
        if (result.isSuccess()) {
            JsonNode user = result.data().path("user").path("result");
            if ("UserUnavailable".equals(user.path("__typename").asText())) {
                return UserLookupResult.failure("User @" + handle + " not found or unavailable");
            }
            Optional<String> userId = JsonNodes.rawText(user, "rest_id");
            Optional<String> screenName = JsonNodes.rawText(user, "legacy", "screen_name")
                    .or(() -> JsonNodes.rawText(user, "core", "screen_name"));
            if (userId.isPresent() && screenName.isPresent()) {
                return UserLookupResult.success(userId.get(), screenName.get(),
                        JsonNodes.rawText(user, "legacy", "name")
                                .or(() -> JsonNodes.rawText(user, "core", "name"))
                                .orElse(null));
            }
            error = "Could not parse user data from response";
        } else {
            error = result.getError();
        }

        log.debug("[Timeline] GraphQL lookup of @{} failed ({}), trying REST", handle, error);
        return restUserLookup.lookup(handle, error);
    }

    private GraphqlCall tweetDetailCall(String tweetId, String cursor) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("focalTweetId", tweetId);
        variables.put("with_rux_injections", false);
        variables.put("rankingMode", "Relevance");
        variables.put("includePromotedContent", true);
        variables.put("withCommunity", true);
        variables.put("withQuickPromoteEligibilityTweetFields", true);
        variables.put("withBirdwatchNotes", true);
        variables.put("withVoice", true);
        withCursor(variables, cursor);

        return GraphqlCall.builder()
                .operation(GraphqlOperation.TWEET_DETAIL)
                .variables(variables)
                .features(FeatureFlags.tweetDetail())
                .fieldToggles(FeatureFlags.articleFieldToggles())
                .requestStyles(List.of(GraphqlCall.RequestStyle.GET_QUERY, GraphqlCall.RequestStyle.POST_JSON))
                .build();
    }

    private FeedResult<Tweet> readTweets(TimelineQuery query, int count, TimelineFetchOptions options) {
        MappingOptions mapping = mappingOptions(options);
        return paginateTweets((cursor, pageCount) -> fetchTweetPage(query, mapping, cursor, pageCount), count,
                options);
    }

    private FeedResult<Tweet> paginateTweets(CursorPaginator.PageFetcher<Tweet> fetcher, int count,
            TimelineFetchOptions options) {
        if (count <= 0) {
            return FeedResult.failure("Invalid limit: " + count);
        }
        TimelineFetchOptions effective = orDefaults(options);
        return paginator.paginate(CursorPaginator.PaginationRequest.<Tweet>builder()
                .fetcher(fetcher)
                .identityOf(Tweet::getId)
                .targetCount(count)
                .maxPages(effective.getMaxPages())
                .startCursor(effective.getCursor())
                .pageDelay(effective.getPageDelay())
                .build());
    }

    private Page<Tweet> fetchTweetPage(TimelineQuery query, MappingOptions mapping, String cursor, int pageCount) {
        GraphqlResult result = executor.execute(query.toCall(cursor, pageCount));
        if (!result.isSuccess()) {
            return Page.failure(result);
        }
        JsonNode instructions = query.instructions(result);
        return Page.success(parser.parseTweets(instructions, mapping),
                parser.extractBottomCursor(instructions).orElse(null));
    }

    private MappingOptions mappingOptions(TimelineFetchOptions options) {
        TimelineFetchOptions effective = orDefaults(options);
        XFeedProperties.MappingProperties mapping = properties.getMapping();
        int quoteDepth = effective.getQuoteDepth() != null ? effective.getQuoteDepth() : mapping.getQuoteDepth();
        return new MappingOptions(quoteDepth, effective.isIncludeRaw() || mapping.isIncludeRaw());
    }

    private static TimelineFetchOptions orDefaults(TimelineFetchOptions options) {
        return options != null ? options : TimelineFetchOptions.defaults();
    }

    private static Map<String, Object> withCursor(Map<String, Object> variables, String cursor) {
        if (cursor != null && !cursor.isEmpty()) {
            variables.put("cursor", cursor);
        }
        return variables;
    }

    static boolean toleratesUserTimelineErrors(JsonNode root) {
        String messages = JsonNodes.array(root, "errors").stream()
                .map(error -> error.path("message").asText(""))
                .collect(Collectors.joining(", "));
        if (messages.contains("User has been suspended") || messages.contains("User not found")) {
            return false;
        }
        JsonNode instructions = at(root.path("data"), USER_TIMELINE_INSTRUCTIONS);
        return instructions != null && instructions.isArray();
    }

    /**
     * Parses a post timestamp into epoch millis; unparseable or missing values
     * sort first.
     */
    static long epochMillis(String createdAt) {
        if (createdAt == null || createdAt.isBlank()) {
            return 0L;
        }
        try {
            return ZonedDateTime.parse(createdAt, TWITTER_DATE).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(createdAt).toInstant().toEpochMilli();
            } catch (DateTimeParseException ignored) {
                return 0L;
            }
        }
    }

    private static JsonNode at(JsonNode node, String... path) {
        JsonNode current = node;
        for (String segment : path) {
            if (current == null) {
                return null;
            }
            current = current.get(segment);
        }
        return current;
    }

    private static List<JsonNode> entries(JsonNode instructions) {
        List<JsonNode> entries = new ArrayList<>();
        if (instructions != null && instructions.isArray()) {
            instructions.forEach(instruction -> entries.addAll(JsonNodes.array(instruction, "entries")));
        }
        return entries;
    }

    /**
     * Static shape of one timeline operation: which operation, how to build
     * its variables per page, and where its instructions live.
     */
    private record TimelineQuery(
            GraphqlOperation operation,
            String[] instructionsPath,
            BiFunction<String, Integer, Map<String, Object>> variables,
            Map<String, Object> features,
            Map<String, Object> fieldToggles,
            List<GraphqlCall.RequestStyle> requestStyles,
            Predicate<JsonNode> errorTolerance) {

        static Builder builder(GraphqlOperation operation, String[] instructionsPath) {
            return new Builder(operation, instructionsPath);
        }

        GraphqlCall toCall(String cursor, int pageCount) {
            return GraphqlCall.builder()
                    .operation(operation)
                    .variables(variables.apply(cursor, pageCount))
                    .features(features)
                    .fieldToggles(fieldToggles)
                    .requestStyles(requestStyles)
                    .errorTolerance(errorTolerance)
                    .build();
        }

        JsonNode instructions(GraphqlResult result) {
            return at(result.data(), instructionsPath);
        }

        static final class Builder {
            private final GraphqlOperation operation;
            private final String[] instructionsPath;
            private BiFunction<String, Integer, Map<String, Object>> variables;
            private Map<String, Object> features = Map.of();
            private Map<String, Object> fieldToggles;
            private List<GraphqlCall.RequestStyle> requestStyles = List.of(GraphqlCall.RequestStyle.GET_QUERY);
            private Predicate<JsonNode> errorTolerance;

            private Builder(GraphqlOperation operation, String[] instructionsPath) {
                this.operation = operation;
                this.instructionsPath = instructionsPath;
            }

            Builder variables(BiFunction<String, Integer, Map<String, Object>> variables) {
                this.variables = variables;
                return this;
            }

            Builder features(Map<String, Object> features) {
                this.features = features;
                return this;
            }

            Builder fieldToggles(Map<String, Object> fieldToggles) {
                this.fieldToggles = fieldToggles;
                return this;
            }

            Builder requestStyles(List<GraphqlCall.RequestStyle> requestStyles) {
                this.requestStyles = requestStyles;
                return this;
            }

            Builder errorTolerance(Predicate<JsonNode> errorTolerance) {
                this.errorTolerance = errorTolerance;
                return this;
            }

            TimelineQuery build() {
                return new TimelineQuery(operation, instructionsPath, variables, features, fieldToggles,
                        requestStyles, errorTolerance);
            }
        }
    }
}
