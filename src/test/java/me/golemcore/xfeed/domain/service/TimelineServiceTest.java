package me.golemcore.xfeed.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.xfeed.domain.model.ExecutionFailureKind;
import me.golemcore.xfeed.domain.model.FeedResult;
import me.golemcore.xfeed.domain.model.GraphqlOperation;
import me.golemcore.xfeed.domain.model.GraphqlResult;
import me.golemcore.xfeed.domain.model.TimelineFetchOptions;
import me.golemcore.xfeed.domain.model.Tweet;
import me.golemcore.xfeed.domain.model.TweetLookupResult;
import me.golemcore.xfeed.domain.model.TwitterUser;
import me.golemcore.xfeed.domain.model.UserLookupResult;
import me.golemcore.xfeed.infrastructure.config.XFeedProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static me.golemcore.xfeed.testsupport.json.TweetJson.MAPPER;
import static me.golemcore.xfeed.testsupport.json.TweetJson.cursor;
import static me.golemcore.xfeed.testsupport.json.TweetJson.entry;
import static me.golemcore.xfeed.testsupport.json.TweetJson.fixture;
import static me.golemcore.xfeed.testsupport.json.TweetJson.instructions;
import static me.golemcore.xfeed.testsupport.json.TweetJson.tweet;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class TimelineServiceTest {

    private GraphqlExecutor executor;
    private RestUserLookup restUserLookup;
    private XFeedProperties properties;
    private TimelineService service;

    @BeforeEach
    void setUp() {
        executor = mock(GraphqlExecutor.class);
        restUserLookup = mock(RestUserLookup.class);
        properties = new XFeedProperties();
        properties.getPagination().setPageDelay(Duration.ZERO);

        TweetTextExtractor textExtractor = new TweetTextExtractor(new ContentStateRenderer());
        TweetMapper tweetMapper = new TweetMapper(textExtractor, new MediaExtractor());
        TimelineParser parser = new TimelineParser(tweetMapper, new UserMapper());
        service = new TimelineService(executor, new CursorPaginator(properties), parser, tweetMapper,
                textExtractor, restUserLookup, properties);
    }

    private static GraphqlResult ok(JsonNode body) {
        return GraphqlResult.success(body, "q");
    }

    private static JsonNode wrap(JsonNode instructions, String... path) {
        ObjectNode root = MAPPER.createObjectNode();
        ObjectNode current = root.putObject("data");
        for (int i = 0; i < path.length - 1; i++) {
            current = current.putObject(path[i]);
        }
        current.set(path[path.length - 1], instructions);
        return root;
    }

    private static JsonNode homePage(JsonNode instructions) {
        return wrap(instructions, "home", "home_timeline_urt", "instructions");
    }

    private static JsonNode userTimelinePage(JsonNode instructions) {
        return wrap(instructions, "user", "result", "timeline", "timeline", "instructions");
    }

    private GraphqlCall captureSingleCall() {
        ArgumentCaptor<GraphqlCall> captor = ArgumentCaptor.forClass(GraphqlCall.class);
        verify(executor).execute(captor.capture());
        return captor.getValue();
    }

    @Test
    void shouldReadHomeTimeline() {
        when(executor.execute(any())).thenReturn(ok(fixture("home_timeline.json")));

        FeedResult<Tweet> result = service.getHomeTimeline(3, null);

        assertTrue(result.isSuccess());
        assertEquals(List.of("1", "2", "3"), result.getItems().stream().map(Tweet::getId).toList());
        assertEquals("bottom-cursor-1", result.getNextCursor());

        GraphqlCall call = captureSingleCall();
        assertEquals(GraphqlOperation.HOME_TIMELINE, call.getOperation());
        assertEquals(3, call.getVariables().get("count"));
        assertEquals(true, call.getVariables().get("includePromotedContent"));
        assertEquals("launch", call.getVariables().get("requestContext"));
        assertFalse(call.getVariables().containsKey("cursor"));
    }

    @Test
    void shouldUseLatestOperationForChronologicalHome() {
        when(executor.execute(any())).thenReturn(ok(homePage(instructions())));

        service.getHomeLatestTimeline(5, TimelineFetchOptions.defaults());

        assertEquals(GraphqlOperation.HOME_LATEST_TIMELINE, captureSingleCall().getOperation());
    }

    @Test
    void shouldRejectNonPositiveLimit() {
        FeedResult<Tweet> result = service.getHomeTimeline(0, null);

        assertFalse(result.isSuccess());
        assertEquals("Invalid limit: 0", result.getError());
        assertEquals("Invalid limit: -1", service.getUserTweets("1", -1, null).getError());
        assertEquals("Invalid limit: 0", service.getFollowers("1", 0, null).getError());
        verifyNoInteractions(executor);
    }

    @Test
    void shouldFollowCursorAcrossPages() {
        when(executor.execute(any()))
                .thenReturn(ok(homePage(instructions(entry(tweet("1", "a", "one")), entry(tweet("2", "b", "two")),
                        cursor("Bottom", "c1")))))
                .thenReturn(ok(homePage(instructions(entry(tweet("2", "b", "two")), entry(tweet("3", "c", "three")),
                        cursor("Bottom", "c1")))));

        FeedResult<Tweet> result = service.getHomeTimeline(40,
                TimelineFetchOptions.builder().maxPages(5).build());

        assertTrue(result.isSuccess());
        assertEquals(List.of("1", "2", "3"), result.getItems().stream().map(Tweet::getId).toList());
        assertNull(result.getNextCursor());

        ArgumentCaptor<GraphqlCall> captor = ArgumentCaptor.forClass(GraphqlCall.class);
        verify(executor, times(2)).execute(captor.capture());
        assertEquals("c1", captor.getAllValues().get(1).getVariables().get("cursor"));
        assertEquals(20, captor.getAllValues().get(0).getVariables().get("count"));
    }

    @Test
    void shouldStartFromGivenCursor() {
        when(executor.execute(any())).thenReturn(ok(homePage(instructions())));

        service.getBookmarks(10, TimelineFetchOptions.builder().cursor("resume-here").build());

        GraphqlCall call = captureSingleCall();
        assertEquals(GraphqlOperation.BOOKMARKS, call.getOperation());
        assertEquals("resume-here", call.getVariables().get("cursor"));
        assertEquals(false, call.getVariables().get("withReactionsPerspective"));
    }

    @Test
    void shouldReturnFailureWhenFirstPageFails() {
        when(executor.execute(any())).thenReturn(GraphqlResult.failure(ExecutionFailureKind.HTTP, "HTTP 500: boom"));

        FeedResult<Tweet> result = service.getLikes("42", 10, null);

        assertFalse(result.isSuccess());
        assertEquals("HTTP 500: boom", result.getError());
        assertNull(result.getItems());
    }

    @Test
    void shouldSendUserTimelineVariables() {
        when(executor.execute(any())).thenReturn(ok(userTimelinePage(instructions())));

        service.getUserTweets("42", 5, null);

        GraphqlCall call = captureSingleCall();
        assertEquals(GraphqlOperation.USER_TWEETS, call.getOperation());
        assertEquals("42", call.getVariables().get("userId"));
        assertEquals(false, call.getVariables().get("includePromotedContent"));
        assertEquals(Map.of("withArticlePlainText", false), call.getFieldToggles());
        assertNotNull(call.getErrorTolerance());
    }

    @Test
    void shouldTolerateUserTimelineErrorsOnlyWithInstructions() throws Exception {
        JsonNode usable = MAPPER.readTree("""
                {"errors":[{"message":"Some tweets are hidden"}],
                 "data":{"user":{"result":{"timeline":{"timeline":{"instructions":[]}}}}}}
                """);
        JsonNode suspended = MAPPER.readTree("""
                {"errors":[{"message":"User has been suspended"}],
                 "data":{"user":{"result":{"timeline":{"timeline":{"instructions":[]}}}}}}
                """);
        JsonNode empty = MAPPER.readTree("{\"errors\":[{\"message\":\"oops\"}]}");

        assertTrue(TimelineService.toleratesUserTimelineErrors(usable));
        assertFalse(TimelineService.toleratesUserTimelineErrors(suspended));
        assertFalse(TimelineService.toleratesUserTimelineErrors(empty));
    }

    @Test
    void shouldSearchWithVariablesInUrl() {
        when(executor.execute(any())).thenReturn(ok(MAPPER.createObjectNode()));

        FeedResult<Tweet> result = service.search("from:jack java", 10, null);

        assertTrue(result.isSuccess());
        assertTrue(result.getItems().isEmpty());
        GraphqlCall call = captureSingleCall();
        assertEquals(GraphqlOperation.SEARCH_TIMELINE, call.getOperation());
        assertEquals(List.of(GraphqlCall.RequestStyle.POST_QUERY_VARIABLES), call.getRequestStyles());
        assertEquals("from:jack java", call.getVariables().get("rawQuery"));
        assertEquals("Latest", call.getVariables().get("product"));
        assertEquals("typed_query", call.getVariables().get("querySource"));
    }

    @Test
    void shouldRetryBookmarkFolderWithoutCount() {
        JsonNode page = wrap(instructions(entry(tweet("1", "a", "saved"))),
                "bookmark_collection_timeline", "timeline", "instructions");
        when(executor.execute(any()))
                .thenReturn(GraphqlResult.failure(ExecutionFailureKind.API,
                        "Variable \"$count\" is not defined by operation"))
                .thenReturn(ok(page));

        FeedResult<Tweet> result = service.getBookmarkFolderTimeline("https://x.com/i/bookmarks/123456", 5, null);

        assertTrue(result.isSuccess());
        assertEquals("saved", result.getItems().get(0).getText());

        ArgumentCaptor<GraphqlCall> captor = ArgumentCaptor.forClass(GraphqlCall.class);
        verify(executor, times(2)).execute(captor.capture());
        assertEquals("123456", captor.getAllValues().get(0).getVariables().get("bookmark_collection_id"));
        assertTrue(captor.getAllValues().get(0).getVariables().containsKey("count"));
        assertFalse(captor.getAllValues().get(1).getVariables().containsKey("count"));
    }

    @Test
    void shouldRejectInvalidBookmarkFolder() {
        assertEquals("Invalid bookmark folder: abc", service.getBookmarkFolderTimeline("abc", 5, null).getError());
        verifyNoInteractions(executor);
    }

    @Test
    void shouldListFollowing() {
        when(executor.execute(any())).thenReturn(ok(fixture("following.json")));

        FeedResult<TwitterUser> result = service.getFollowing("11", 2, null);

        assertTrue(result.isSuccess());
        assertEquals(List.of("11", "13"), result.getItems().stream().map(TwitterUser::getId).toList());
        assertEquals("users-next", result.getNextCursor());
        assertEquals(GraphqlOperation.FOLLOWING, captureSingleCall().getOperation());
    }

    @Test
    void shouldListFollowers() {
        when(executor.execute(any())).thenReturn(ok(fixture("following.json")));

        service.getFollowers("11", 2, null);

        assertEquals(GraphqlOperation.FOLLOWERS, captureSingleCall().getOperation());
    }

    @Test
    void shouldGetTweetFromTweetResult() {
        ObjectNode body = MAPPER.createObjectNode();
        body.putObject("data").putObject("tweetResult").set("result", tweet("500", "alice", "single post"));
        when(executor.execute(any())).thenReturn(ok(body));

        TweetLookupResult result = service.getTweet("500", null);

        assertTrue(result.success());
        assertEquals("single post", result.tweet().getText());
        GraphqlCall call = captureSingleCall();
        assertEquals(GraphqlOperation.TWEET_DETAIL, call.getOperation());
        assertEquals("500", call.getVariables().get("focalTweetId"));
        assertEquals(List.of(GraphqlCall.RequestStyle.GET_QUERY, GraphqlCall.RequestStyle.POST_JSON),
                call.getRequestStyles());
    }

    @Test
    void shouldGetTweetFromConversation() {
        when(executor.execute(any())).thenReturn(ok(fixture("tweet_detail.json")));

        TweetLookupResult result = service.getTweet("100", null);

        assertTrue(result.success());
        assertEquals("focal post", result.tweet().getText());
    }

    @Test
    void shouldReportMissingTweet() {
        when(executor.execute(any())).thenReturn(ok(fixture("tweet_detail.json")));

        assertEquals("Tweet not found in response", service.getTweet("999", null).error());
    }

    @Test
    void shouldReportTweetLookupFailure() {
        when(executor.execute(any())).thenReturn(GraphqlResult.failure(ExecutionFailureKind.TRANSPORT, "timeout"));

        TweetLookupResult result = service.getTweet("1", null);

        assertFalse(result.success());
        assertEquals("timeout", result.error());
    }

    @Test
    void shouldFillArticleBodyFromUserArticles() throws Exception {
        ObjectNode focal = tweet("500", "alice", "https://t.co/a");
        focal.set("article", MAPPER.readTree("{\"article_results\":{\"result\":{\"title\":\"Guide\"}}}"));
        ObjectNode detail = MAPPER.createObjectNode();
        detail.putObject("data").putObject("tweetResult").set("result", focal);

        ObjectNode articleTweet = MAPPER.createObjectNode();
        articleTweet.put("rest_id", "500");
        articleTweet.set("article", MAPPER.readTree(
                "{\"article_results\":{\"result\":{\"title\":\"Guide\",\"plain_text\":\"Full article text\"}}}"));
        JsonNode articles = userTimelinePage(instructions(entry(articleTweet)));

        when(executor.execute(any())).thenAnswer(invocation -> {
            GraphqlCall call = invocation.getArgument(0);
            return call.getOperation() == GraphqlOperation.TWEET_DETAIL ? ok(detail) : ok(articles);
        });

        TweetLookupResult result = service.getTweet("500", null);

        assertEquals("Guide\n\nFull article text", result.tweet().getText());
        ArgumentCaptor<GraphqlCall> captor = ArgumentCaptor.forClass(GraphqlCall.class);
        verify(executor, times(2)).execute(captor.capture());
        GraphqlCall articleCall = captor.getAllValues().get(1);
        assertEquals(GraphqlOperation.USER_ARTICLES_TWEETS, articleCall.getOperation());
        assertEquals("u-alice", articleCall.getVariables().get("userId"));
        assertEquals(20, articleCall.getVariables().get("count"));
    }

    @Test
    void shouldKeepTitleWhenArticleFallbackFails() throws Exception {
        ObjectNode focal = tweet("500", "alice", "https://t.co/a");
        focal.set("article", MAPPER.readTree("{\"title\":\"Guide\"}"));
        ObjectNode detail = MAPPER.createObjectNode();
        detail.putObject("data").putObject("tweetResult").set("result", focal);
        when(executor.execute(any()))
                .thenReturn(ok(detail))
                .thenReturn(GraphqlResult.failure(ExecutionFailureKind.HTTP, "HTTP 403: forbidden"));

        TweetLookupResult result = service.getTweet("500", null);

        assertTrue(result.success());
        assertEquals("Guide", result.tweet().getText());
    }

    @Test
    void shouldListDirectRepliesOnly() {
        when(executor.execute(any())).thenReturn(ok(fixture("tweet_detail.json")));

        FeedResult<Tweet> result = service.getReplies("100", null);

        assertTrue(result.isSuccess());
        assertEquals(List.of("101", "102"), result.getItems().stream().map(Tweet::getId).toList());
        assertEquals("detail-next", result.getNextCursor());
        verify(executor, times(1)).execute(any());
    }

    @Test
    void shouldOrderThreadChronologically() {
        when(executor.execute(any())).thenReturn(ok(fixture("tweet_detail.json")));

        FeedResult<Tweet> result = service.getThread("100", null);

        assertTrue(result.isSuccess());
        assertEquals(List.of("90", "103", "100", "102", "101"),
                result.getItems().stream().map(Tweet::getId).toList());
    }

    @Test
    void shouldReportThreadFailure() {
        when(executor.execute(any())).thenReturn(GraphqlResult.failure(ExecutionFailureKind.API, "Rate limit"));

        FeedResult<Tweet> result = service.getThread("100", null);

        assertFalse(result.isSuccess());
        assertEquals("Rate limit", result.getError());
    }

    @Test
    void shouldResolveUserIdByHandle() throws Exception {
        when(executor.execute(any())).thenReturn(ok(MAPPER.readTree("""
                {"data":{"user":{"result":{"__typename":"User","rest_id":"42",
                  "legacy":{"screen_name":"Alice","name":"Alice A"}}}}}
                """)));

        UserLookupResult result = service.getUserIdByUsername("@alice");

        assertTrue(result.success());
        assertEquals("42", result.userId());
        assertEquals("Alice", result.username());
        assertEquals("Alice A", result.name());
        GraphqlCall call = captureSingleCall();
        assertEquals("alice", call.getVariables().get("screen_name"));
        verifyNoInteractions(restUserLookup);
    }

    @Test
    void shouldRejectInvalidHandle() {
        assertEquals("Invalid username: not a handle", service.getUserIdByUsername("not a handle").error());
        verifyNoInteractions(executor);
    }

    @Test
    void shouldNotFallBackForUnavailableUser() throws Exception {
        when(executor.execute(any())).thenReturn(ok(MAPPER.readTree(
                "{\"data\":{\"user\":{\"result\":{\"__typename\":\"UserUnavailable\"}}}}")));

        UserLookupResult result = service.getUserIdByUsername("ghost");

        assertEquals("User @ghost not found or unavailable", result.error());
        verifyNoInteractions(restUserLookup);
    }

    @Test
    void shouldFallBackToRestLookupOnFailure() {
        when(executor.execute(any())).thenReturn(GraphqlResult.failure(ExecutionFailureKind.API, "Rate limit"));
        when(restUserLookup.lookup("alice", "Rate limit")).thenReturn(UserLookupResult.success("42", "alice", null));

        UserLookupResult result = service.getUserIdByUsername("alice");

        assertTrue(result.success());
        assertEquals("42", result.userId());
    }

    @Test
    void shouldFallBackToRestLookupOnUnparseableUser() throws Exception {
        when(executor.execute(any())).thenReturn(ok(MAPPER.readTree(
                "{\"data\":{\"user\":{\"result\":{\"__typename\":\"User\"}}}}")));
        when(restUserLookup.lookup(anyString(), anyString())).thenReturn(UserLookupResult.failure("User @bob not found"));

        UserLookupResult result = service.getUserIdByUsername("bob");

        assertFalse(result.success());
        verify(restUserLookup).lookup("bob", "Could not parse user data from response");
    }

    @Test
    void shouldParseTimestampsForOrdering() {
        assertEquals(1735725600000L, TimelineService.epochMillis("Wed Jan 01 10:00:00 +0000 2025"));
        assertEquals(1735725600000L, TimelineService.epochMillis("2025-01-01T10:00:00Z"));
        assertEquals(0L, TimelineService.epochMillis("yesterday"));
        assertEquals(0L, TimelineService.epochMillis(null));
    }
}
