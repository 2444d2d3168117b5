package me.golemcore.xfeed.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.xfeed.domain.model.GraphqlOperation;
import me.golemcore.xfeed.infrastructure.config.XFeedProperties;
import me.golemcore.xfeed.port.outbound.QueryIdDiscoveryPort;
import me.golemcore.xfeed.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class QueryIdRegistryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private QueryIdDiscoveryPort discoveryPort;
    private StoragePort storagePort;
    private XFeedProperties properties;
    private ObjectMapper objectMapper;
    private QueryIdRegistry registry;

    @BeforeEach
    void setUp() {
        discoveryPort = mock(QueryIdDiscoveryPort.class);
        storagePort = mock(StoragePort.class);
        properties = new XFeedProperties();
        objectMapper = new ObjectMapper();

        when(storagePort.getText(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));

        registry = new QueryIdRegistry(discoveryPort, storagePort, objectMapper, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldResolveDefaultsWhenNothingWasDiscovered() {
        assertEquals(GraphqlOperation.SEARCH_TIMELINE.getDefaultQueryIds(),
                registry.resolve(GraphqlOperation.SEARCH_TIMELINE));
        assertTrue(registry.getRuntimeQueryId(GraphqlOperation.SEARCH_TIMELINE).isEmpty());
    }

    @Test
    void shouldPutDiscoveredIdFirstAndPersistIt() throws Exception {
        when(discoveryPort.discover(any())).thenReturn(Map.of("HomeTimeline", "freshHome"));

        assertTrue(registry.refresh(List.of(GraphqlOperation.HOME_TIMELINE), true));

        List<String> ids = registry.resolve(GraphqlOperation.HOME_TIMELINE);
        assertEquals("freshHome", ids.get(0));
        assertTrue(ids.containsAll(GraphqlOperation.HOME_TIMELINE.getDefaultQueryIds()));

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(storagePort).putTextAtomic(eq("query-ids"), eq("query-ids.json"), json.capture());
        JsonNode persisted = objectMapper.readTree(json.getValue());
        assertEquals("freshHome", persisted.path("ids").path("HomeTimeline").asText());
        assertEquals(NOW.toString(), persisted.path("fetchedAt").asText());
    }

    @Test
    void shouldNotDuplicateIdThatMatchesDefault() throws Exception {
        String defaultId = GraphqlOperation.LIKES.getDefaultQueryIds().get(0);
        when(discoveryPort.discover(any())).thenReturn(Map.of("Likes", defaultId));

        registry.refresh(List.of(GraphqlOperation.LIKES), true);

        assertEquals(List.of(defaultId), registry.resolve(GraphqlOperation.LIKES));
    }

    @Test
    void shouldLoadPersistedCacheLazily() {
        when(storagePort.getText("query-ids", "query-ids.json")).thenReturn(CompletableFuture.completedFuture(
                "{\"fetchedAt\":\"2026-03-01T11:00:00Z\",\"ids\":{\"Bookmarks\":\"cachedBookmarks\"}}"));

        assertEquals("cachedBookmarks", registry.resolve(GraphqlOperation.BOOKMARKS).get(0));
    }

    @Test
    void shouldSkipUnforcedRefreshWhileCacheIsFresh() throws Exception {
        when(storagePort.getText("query-ids", "query-ids.json")).thenReturn(CompletableFuture.completedFuture(
                "{\"fetchedAt\":\"2026-03-01T11:00:00Z\",\"ids\":{\"Bookmarks\":\"cachedBookmarks\"}}"));

        assertFalse(registry.refresh(GraphqlOperation.all(), false));

        verify(discoveryPort, never()).discover(any());
    }

    @Test
    void shouldRefreshStaleCacheWithoutForce() throws Exception {
        properties.getQueryIds().setCacheTtl(Duration.ofMinutes(30));
        when(storagePort.getText("query-ids", "query-ids.json")).thenReturn(CompletableFuture.completedFuture(
                "{\"fetchedAt\":\"2026-03-01T11:00:00Z\",\"ids\":{\"Bookmarks\":\"cachedBookmarks\"}}"));
        when(discoveryPort.discover(any())).thenReturn(Map.of("Likes", "freshLikes"));

        assertTrue(registry.refresh(GraphqlOperation.all(), false));

        assertEquals("cachedBookmarks", registry.getRuntimeQueryId(GraphqlOperation.BOOKMARKS).orElseThrow());
        assertEquals("freshLikes", registry.getRuntimeQueryId(GraphqlOperation.LIKES).orElseThrow());
    }

    @Test
    void shouldIgnoreCorruptCache() {
        when(storagePort.getText("query-ids", "query-ids.json"))
                .thenReturn(CompletableFuture.completedFuture("{not json"));

        assertEquals(GraphqlOperation.LIKES.getDefaultQueryIds(), registry.resolve(GraphqlOperation.LIKES));
    }

    @Test
    void shouldCountConsecutiveFailuresAndResetOnSuccess() throws Exception {
        when(discoveryPort.discover(any()))
                .thenThrow(new IOException("offline"))
                .thenReturn(Map.of())
                .thenReturn(Map.of("Likes", "freshLikes"));

        assertFalse(registry.refresh(GraphqlOperation.all(), true));
        assertEquals(1, registry.getConsecutiveRefreshFailures());

        assertFalse(registry.refresh(GraphqlOperation.all(), true));
        assertEquals(2, registry.getConsecutiveRefreshFailures());

        assertTrue(registry.refresh(GraphqlOperation.all(), true));
        assertEquals(0, registry.getConsecutiveRefreshFailures());
    }

    @Test
    void shouldKeepWorkingWhenPersistFails() throws Exception {
        when(discoveryPort.discover(any())).thenReturn(Map.of("Likes", "freshLikes"));
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));

        assertTrue(registry.refresh(List.of(GraphqlOperation.LIKES), true));

        assertEquals("freshLikes", registry.resolve(GraphqlOperation.LIKES).get(0));
    }
}
