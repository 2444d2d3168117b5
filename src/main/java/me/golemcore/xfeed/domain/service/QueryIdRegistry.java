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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.xfeed.domain.model.GraphqlOperation;
import me.golemcore.xfeed.infrastructure.config.XFeedProperties;
import me.golemcore.xfeed.port.outbound.QueryIdDiscoveryPort;
import me.golemcore.xfeed.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Resolves the ordered list of query ids to try for a GraphQL operation.
 *
 * <p>
 * Ids come from two layers:
 * <ul>
 * <li>a runtime overlay, loaded from the persisted cache on first use and
 * replaced after every successful refresh</li>
 * <li>the baked-in defaults of {@link GraphqlOperation}</li>
 * </ul>
 *
 * <p>
 * The overlay is an immutable snapshot behind an {@link AtomicReference}, so
 * readers never see a half-merged map. Refresh failures are logged and
 * counted, never thrown: callers keep working with the ids they already have.
 */
@Service
@Slf4j
public class QueryIdRegistry {

    private final QueryIdDiscoveryPort discoveryPort;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final XFeedProperties properties;
    private final Clock clock;

    private final AtomicReference<Snapshot> overlay = new AtomicReference<>();
    private final AtomicInteger consecutiveRefreshFailures = new AtomicInteger();
    private final Object refreshLock = new Object();

    public QueryIdRegistry(QueryIdDiscoveryPort discoveryPort, StoragePort storagePort,
            ObjectMapper objectMapper, XFeedProperties properties, Clock clock) {
        this.discoveryPort = discoveryPort;
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Returns the ids to try, most recently discovered first. Never empty.
     */
    public List<String> resolve(GraphqlOperation operation) {
        Set<String> ordered = new LinkedHashSet<>();
        getRuntimeQueryId(operation).ifPresent(ordered::add);
        ordered.addAll(operation.getDefaultQueryIds());
        return List.copyOf(ordered);
    }

    public Optional<String> getRuntimeQueryId(GraphqlOperation operation) {
        return Optional.ofNullable(currentSnapshot().ids().get(operation.getOperationName()));
    }

    public int getConsecutiveRefreshFailures() {
        return consecutiveRefreshFailures.get();
    }

    /**
     * Fetches fresh ids for the given operations and merges them into the
     * overlay.
     *
     * @param operations
     *            operations of interest
     * @param force
     *            refresh even if the cached snapshot is younger than the
     *            configured TTL
     * @return {@code true} if at least one id was discovered
     */
    public boolean refresh(Collection<GraphqlOperation> operations, boolean force) {
        synchronized (refreshLock) {
            Snapshot current = currentSnapshot();
            if (!force && current.isFresh(clock.instant(), properties.getQueryIds().getCacheTtl())) {
                log.debug("[QueryIds] Snapshot from {} is fresh, skipping refresh", current.fetchedAt());
                return false;
            }

            List<String> names = operations.stream().map(GraphqlOperation::getOperationName).toList();
            Map<String, String> discovered;
            try {
                discovered = discoveryPort.discover(names);
            } catch (IOException | RuntimeException e) {
                recordFailure("discovery failed: " + e.getMessage());
                return false;
            }

            if (discovered == null || discovered.isEmpty()) {
                recordFailure("no query ids discovered");
                return false;
            }

            Map<String, String> merged = new LinkedHashMap<>(current.ids());
            merged.putAll(discovered);
            Snapshot next = new Snapshot(clock.instant(), Collections.unmodifiableMap(merged));
            overlay.set(next);
            consecutiveRefreshFailures.set(0);
            log.info("[QueryIds] Refreshed {} query ids ({} known)", discovered.size(), merged.size());
            persist(next);
            return true;
        }
    }

    private void recordFailure(String reason) {
        int failures = consecutiveRefreshFailures.incrementAndGet();
        int threshold = properties.getQueryIds().getFailureAlertThreshold();
        if (failures >= threshold) {
            log.error("[QueryIds] Refresh failed {} times in a row: {}", failures, reason);
        } else {
            log.warn("[QueryIds] Refresh failed: {}", reason);
        }
    }

    private Snapshot currentSnapshot() {
        Snapshot snapshot = overlay.get();
        if (snapshot != null) {
            return snapshot;
        }
        Snapshot loaded = loadPersisted();
        if (overlay.compareAndSet(null, loaded)) {
            return loaded;
        }
        return overlay.get();
    }

    private Snapshot loadPersisted() {
        XFeedProperties.QueryIdsProperties config = properties.getQueryIds();
        try {
            String json = storagePort.getText(config.getCacheDirectory(), config.getCacheFile()).join();
            if (json == null || json.isBlank()) {
                return Snapshot.EMPTY;
            }
            JsonNode root = objectMapper.readTree(json);
            Instant fetchedAt = JsonNodes.text(root, "fetchedAt").map(Instant::parse).orElse(null);
            Map<String, String> ids = new LinkedHashMap<>();
            JsonNode idsNode = root.path("ids");
            Iterator<Map.Entry<String, JsonNode>> fields = idsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isTextual() && !field.getValue().asText().isBlank()) {
                    ids.put(field.getKey(), field.getValue().asText());
                }
            }
            log.debug("[QueryIds] Loaded {} cached query ids", ids.size());
            return new Snapshot(fetchedAt, Collections.unmodifiableMap(ids));
        } catch (JsonProcessingException | DateTimeException e) {
            log.warn("[QueryIds] Ignoring unreadable query id cache: {}", e.getMessage());
            return Snapshot.EMPTY;
        } catch (RuntimeException e) {
            log.warn("[QueryIds] Failed to read query id cache: {}", e.getMessage());
            return Snapshot.EMPTY;
        }
    }

    private void persist(Snapshot snapshot) {
        XFeedProperties.QueryIdsProperties config = properties.getQueryIds();
        try {
            ObjectNode root = objectMapper.createObjectNode();
            root.put("fetchedAt", snapshot.fetchedAt().toString());
            ObjectNode ids = root.putObject("ids");
            List<String> names = new ArrayList<>(snapshot.ids().keySet());
            Collections.sort(names);
            for (String name : names) {
                ids.put(name, snapshot.ids().get(name));
            }
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
            storagePort.putTextAtomic(config.getCacheDirectory(), config.getCacheFile(), json).join();
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[QueryIds] Failed to persist query id cache: {}", e.getMessage());
        }
    }

    private record Snapshot(Instant fetchedAt, Map<String, String> ids) {

        static final Snapshot EMPTY = new Snapshot(null, Map.of());

        boolean isFresh(Instant now, Duration ttl) {
            return fetchedAt != null && !ids.isEmpty() && fetchedAt.plus(ttl).isAfter(now);
        }
    }
}
