package me.golemcore.xfeed.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.xfeed.domain.model.ExecutionFailureKind;
import me.golemcore.xfeed.domain.model.GraphqlOperation;
import me.golemcore.xfeed.domain.model.GraphqlResult;
import me.golemcore.xfeed.domain.model.XCredentials;
import me.golemcore.xfeed.infrastructure.config.XFeedProperties;
import me.golemcore.xfeed.port.outbound.CredentialsPort;
import me.golemcore.xfeed.port.outbound.HttpTransportPort;
import me.golemcore.xfeed.port.outbound.HttpTransportPort.HttpCall;
import me.golemcore.xfeed.port.outbound.HttpTransportPort.HttpReply;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class GraphqlExecutorTest {

    private static final String OK_BODY = "{\"data\":{\"home\":{}}}";
    private static final String QUERY_NOT_FOUND = "{\"errors\":[{\"message\":\"Query not found\"}]}";

    private HttpTransportPort transport;
    private QueryIdRegistry registry;
    private XFeedProperties properties;
    private GraphqlExecutor executor;

    @BeforeEach
    void setUp() {
        transport = mock(HttpTransportPort.class);
        registry = mock(QueryIdRegistry.class);
        CredentialsPort credentialsPort = mock(CredentialsPort.class);
        when(credentialsPort.getCredentials()).thenReturn(new XCredentials("auth", "csrf", null));
        properties = new XFeedProperties();

        executor = new GraphqlExecutor(transport, credentialsPort, registry, new GraphqlRequestHeaders(properties),
                new ObjectMapper(), properties);
    }

    private static GraphqlCall homeCall() {
        return GraphqlCall.builder()
                .operation(GraphqlOperation.HOME_TIMELINE)
                .variables(Map.of("count", 20))
                .features(Map.of("view_counts_everywhere_api_enabled", true))
                .build();
    }

    @Test
    void shouldEncodeGetRequest() throws IOException {
        when(registry.resolve(GraphqlOperation.HOME_TIMELINE)).thenReturn(List.of("q1"));
        when(transport.send(any())).thenReturn(new HttpReply(200, OK_BODY));

        GraphqlResult result = executor.execute(GraphqlCall.builder()
                .operation(GraphqlOperation.HOME_TIMELINE)
                .variables(Map.of("count", 20))
                .features(Map.of("flag", true))
                .fieldToggles(Map.of("withArticlePlainText", false))
                .build());

        assertTrue(result.isSuccess());
        assertEquals("q1", result.getQueryId());
        assertTrue(result.data().has("home"));

        ArgumentCaptor<HttpCall> captor = ArgumentCaptor.forClass(HttpCall.class);
        verify(transport).send(captor.capture());
        HttpCall call = captor.getValue();
        assertEquals("GET", call.method());
        String url = URLDecoder.decode(call.url(), StandardCharsets.UTF_8);
        assertTrue(url.startsWith("https://x.com/i/api/graphql/q1/HomeTimeline?variables="));
        assertTrue(url.contains("variables={\"count\":20}"));
        assertTrue(url.contains("features={\"flag\":true}"));
        assertTrue(url.contains("fieldToggles={\"withArticlePlainText\":false}"));
        assertEquals("csrf", call.headers().get("x-csrf-token"));
        assertEquals("auth_token=auth; ct0=csrf", call.headers().get("cookie"));
        assertEquals(32, call.headers().get("x-client-transaction-id").length());
    }

    @Test
    void shouldEncodePostVariants() throws IOException {
        when(registry.resolve(GraphqlOperation.SEARCH_TIMELINE)).thenReturn(List.of("s1"));
        when(transport.send(any())).thenReturn(new HttpReply(200, OK_BODY));

        executor.execute(GraphqlCall.builder()
                .operation(GraphqlOperation.SEARCH_TIMELINE)
                .variables(Map.of("rawQuery", "java"))
                .features(Map.of("flag", true))
                .requestStyles(List.of(GraphqlCall.RequestStyle.POST_QUERY_VARIABLES))
                .build());

        ArgumentCaptor<HttpCall> captor = ArgumentCaptor.forClass(HttpCall.class);
        verify(transport).send(captor.capture());
        HttpCall call = captor.getValue();
        assertEquals("POST", call.method());
        assertTrue(URLDecoder.decode(call.url(), StandardCharsets.UTF_8)
                .endsWith("/s1/SearchTimeline?variables={\"rawQuery\":\"java\"}"));
        assertEquals("{\"features\":{\"flag\":true},\"queryId\":\"s1\"}", call.body());
    }

    @Test
    void shouldEncodeJsonBody() throws IOException {
        when(registry.resolve(GraphqlOperation.TWEET_DETAIL)).thenReturn(List.of("t1"));
        when(transport.send(any())).thenReturn(new HttpReply(200, OK_BODY));

        executor.execute(GraphqlCall.builder()
                .operation(GraphqlOperation.TWEET_DETAIL)
                .variables(Map.of("focalTweetId", "1"))
                .features(Map.of("flag", true))
                .fieldToggles(Map.of("withArticleRichContentState", true))
                .requestStyles(List.of(GraphqlCall.RequestStyle.POST_JSON))
                .build());

        ArgumentCaptor<HttpCall> captor = ArgumentCaptor.forClass(HttpCall.class);
        verify(transport).send(captor.capture());
        assertEquals("https://x.com/i/api/graphql/t1/TweetDetail", captor.getValue().url());
        assertEquals("{\"variables\":{\"focalTweetId\":\"1\"},\"features\":{\"flag\":true},"
                + "\"fieldToggles\":{\"withArticleRichContentState\":true},\"queryId\":\"t1\"}",
                captor.getValue().body());
    }

    @Test
    void shouldFallBackToNextIdAndStyleOnNotFound() throws IOException {
        when(registry.resolve(GraphqlOperation.TWEET_DETAIL)).thenReturn(List.of("old", "new"));
        when(transport.send(any()))
                .thenReturn(new HttpReply(404, ""))
                .thenReturn(new HttpReply(200, QUERY_NOT_FOUND))
                .thenReturn(new HttpReply(200, OK_BODY));

        GraphqlResult result = executor.execute(GraphqlCall.builder()
                .operation(GraphqlOperation.TWEET_DETAIL)
                .requestStyles(List.of(GraphqlCall.RequestStyle.GET_QUERY, GraphqlCall.RequestStyle.POST_JSON))
                .build());

        assertTrue(result.isSuccess());
        assertEquals("new", result.getQueryId());
        verify(transport, times(3)).send(any());
        verify(registry, never()).refresh(any(), anyBoolean());
    }

    @Test
    void shouldRefreshOnceWhenEveryIdIsStale() throws IOException {
        when(registry.resolve(GraphqlOperation.HOME_TIMELINE))
                .thenReturn(List.of("stale"))
                .thenReturn(List.of("fresh", "stale"));
        when(transport.send(any()))
                .thenReturn(new HttpReply(404, ""))
                .thenReturn(new HttpReply(200, OK_BODY));

        GraphqlResult result = executor.execute(homeCall());

        assertTrue(result.isSuccess());
        assertEquals("fresh", result.getQueryId());
        verify(registry, times(1)).refresh(eq(GraphqlOperation.all()), eq(true));
    }

    @Test
    void shouldNotRefreshMoreThanOnce() throws IOException {
        when(registry.resolve(GraphqlOperation.HOME_TIMELINE)).thenReturn(List.of("stale"));
        when(transport.send(any())).thenReturn(new HttpReply(404, ""));

        GraphqlResult result = executor.execute(homeCall());

        assertFalse(result.isSuccess());
        assertEquals(ExecutionFailureKind.NOT_FOUND, result.getFailureKind());
        assertEquals("HTTP 404", result.getError());
        verify(registry, times(1)).refresh(any(), anyBoolean());
        verify(transport, times(2)).send(any());
    }

    @Test
    void shouldSkipRefreshWhenDisabled() throws IOException {
        properties.getQueryIds().setRefreshOnNotFound(false);
        when(registry.resolve(GraphqlOperation.HOME_TIMELINE)).thenReturn(List.of("stale"));
        when(transport.send(any())).thenReturn(new HttpReply(404, ""));

        assertTrue(executor.execute(homeCall()).isNotFound());
        verify(registry, never()).refresh(any(), anyBoolean());
    }

    @Test
    void shouldStopOnHttpError() throws IOException {
        when(registry.resolve(GraphqlOperation.HOME_TIMELINE)).thenReturn(List.of("q1", "q2"));
        when(transport.send(any())).thenReturn(new HttpReply(429, "x".repeat(500)));

        GraphqlResult result = executor.execute(homeCall());

        assertEquals(ExecutionFailureKind.HTTP, result.getFailureKind());
        assertEquals("HTTP 429: " + "x".repeat(200), result.getError());
        verify(transport, times(1)).send(any());
    }

    @Test
    void shouldReportTransportFailure() throws IOException {
        when(registry.resolve(GraphqlOperation.HOME_TIMELINE)).thenReturn(List.of("q1", "q2"));
        when(transport.send(any())).thenThrow(new IOException("connection reset"));

        GraphqlResult result = executor.execute(homeCall());

        assertEquals(ExecutionFailureKind.TRANSPORT, result.getFailureKind());
        assertEquals("connection reset", result.getError());
        verify(transport, times(1)).send(any());
    }

    @Test
    void shouldReportMalformedJson() throws IOException {
        when(registry.resolve(GraphqlOperation.HOME_TIMELINE)).thenReturn(List.of("q1"));
        when(transport.send(any())).thenReturn(new HttpReply(200, "<html>"));

        GraphqlResult result = executor.execute(homeCall());

        assertEquals(ExecutionFailureKind.MALFORMED, result.getFailureKind());
        assertTrue(result.getError().startsWith("Invalid JSON response: "));
    }

    @Test
    void shouldJoinApiErrors() throws IOException {
        when(registry.resolve(GraphqlOperation.HOME_TIMELINE)).thenReturn(List.of("q1"));
        when(transport.send(any())).thenReturn(new HttpReply(200,
                "{\"errors\":[{\"message\":\"Rate limit\"},{\"message\":\"Try later\"}]}"));

        GraphqlResult result = executor.execute(homeCall());

        assertEquals(ExecutionFailureKind.API, result.getFailureKind());
        assertEquals("Rate limit, Try later", result.getError());
    }

    @Test
    void shouldAcceptToleratedErrors() throws IOException {
        when(registry.resolve(GraphqlOperation.USER_TWEETS)).thenReturn(List.of("q1"));
        when(transport.send(any())).thenReturn(new HttpReply(200,
                "{\"errors\":[{\"message\":\"partial\"}],\"data\":{\"user\":{}}}"));

        GraphqlResult result = executor.execute(GraphqlCall.builder()
                .operation(GraphqlOperation.USER_TWEETS)
                .errorTolerance(root -> root.path("data").has("user"))
                .build());

        assertTrue(result.isSuccess());
    }

    @Test
    void shouldRecognizeQueryNotFoundMessages() {
        assertTrue(GraphqlExecutor.isQueryNotFound("Query not found"));
        assertTrue(GraphqlExecutor.isQueryNotFound("PersistedQueryNotFound"));
        assertFalse(GraphqlExecutor.isQueryNotFound("Rate limit exceeded"));
    }
}
