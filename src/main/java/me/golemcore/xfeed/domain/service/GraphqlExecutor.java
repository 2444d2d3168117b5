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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.xfeed.domain.model.ExecutionFailureKind;
import me.golemcore.xfeed.domain.model.GraphqlOperation;
import me.golemcore.xfeed.domain.model.GraphqlResult;
import me.golemcore.xfeed.infrastructure.config.XFeedProperties;
import me.golemcore.xfeed.port.outbound.CredentialsPort;
import me.golemcore.xfeed.port.outbound.HttpTransportPort;
import me.golemcore.xfeed.port.outbound.HttpTransportPort.HttpCall;
import me.golemcore.xfeed.port.outbound.HttpTransportPort.HttpReply;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Executes GraphQL reads against rotating query ids.
 *
 * <p>
 * Every candidate id from {@link QueryIdRegistry} is tried with every request
 * variant of the call. Only a "not found" answer moves on to the next
 * attempt; any other failure ends the call. When all candidates are stale the
 * registry is force-refreshed once and the candidates are walked one more
 * time.
 *
 * <p>
 * Failures are returned as {@link GraphqlResult} values:
 * <ul>
 * <li>transport errors - exception message</li>
 * <li>non-2xx - {@code HTTP <status>: <first 200 chars>}</li>
 * <li>unparsable body - {@code Invalid JSON response: ...}</li>
 * <li>errors list - messages joined by {@code ", "}</li>
 * </ul>
 */
@Service
@Slf4j
public class GraphqlExecutor {

    private static final int ERROR_SNIPPET_LENGTH = 200;

    private final HttpTransportPort transport;
    private final CredentialsPort credentialsPort;
    private final QueryIdRegistry queryIdRegistry;
    private final GraphqlRequestHeaders requestHeaders;
    private final ObjectMapper objectMapper;
    private final XFeedProperties properties;

    public GraphqlExecutor(HttpTransportPort transport, CredentialsPort credentialsPort,
            QueryIdRegistry queryIdRegistry, GraphqlRequestHeaders requestHeaders,
            ObjectMapper objectMapper, XFeedProperties properties) {
        this.transport = transport;
        this.credentialsPort = credentialsPort;
        this.queryIdRegistry = queryIdRegistry;
        this.requestHeaders = requestHeaders;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public GraphqlResult execute(GraphqlCall call) {
        GraphqlResult result = attemptAll(call);
        if (!result.isNotFound() || !properties.getQueryIds().isRefreshOnNotFound()) {
            return result;
        }

        log.info("[Executor] {}: every query id answered not found, refreshing",
                call.getOperation().getOperationName());
        queryIdRegistry.refresh(GraphqlOperation.all(), true);
        return attemptAll(call);
    }

    private GraphqlResult attemptAll(GraphqlCall call) {
        GraphqlResult last = GraphqlResult.failure(ExecutionFailureKind.NOT_FOUND, "HTTP 404");
        for (String queryId : queryIdRegistry.resolve(call.getOperation())) {
            for (GraphqlCall.RequestStyle style : call.getRequestStyles()) {
                GraphqlResult result = attempt(call, queryId, style);
                if (!result.isNotFound()) {
                    return result;
                }
                log.debug("[Executor] {} {} via {}: not found", call.getOperation().getOperationName(),
                        queryId, style);
                last = result;
            }
        }
        return last;
    }

    private GraphqlResult attempt(GraphqlCall call, String queryId, GraphqlCall.RequestStyle style) {
        HttpReply reply;
        try {
            reply = transport.send(buildHttpCall(call, queryId, style));
        } catch (JsonProcessingException e) {
            return GraphqlResult.failure(ExecutionFailureKind.MALFORMED,
                    "Failed to encode request: " + e.getOriginalMessage());
        } catch (IOException e) {
            log.debug("[Executor] {} transport failure: {}", call.getOperation().getOperationName(), e.getMessage());
            return GraphqlResult.failure(ExecutionFailureKind.TRANSPORT, describe(e));
        }

        if (reply.status() == 404) {
            return GraphqlResult.failure(ExecutionFailureKind.NOT_FOUND, "HTTP 404");
        }
        String body = reply.body() != null ? reply.body() : "";
        if (!reply.isSuccessful()) {
            return GraphqlResult.failure(ExecutionFailureKind.HTTP,
                    "HTTP " + reply.status() + ": " + snippet(body));
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return GraphqlResult.failure(ExecutionFailureKind.MALFORMED,
                    "Invalid JSON response: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return GraphqlResult.failure(ExecutionFailureKind.MALFORMED,
                    "Invalid JSON response: " + snippet(body));
        }

        List<String> errors = errorMessages(root);
        if (errors.isEmpty()) {
            return GraphqlResult.success(root, queryId);
        }
        if (errors.stream().allMatch(GraphqlExecutor::isQueryNotFound)) {
            return GraphqlResult.failure(ExecutionFailureKind.NOT_FOUND, String.join(", ", errors));
        }
        if (call.getErrorTolerance() != null && call.getErrorTolerance().test(root)) {
            log.debug("[Executor] {} tolerated API errors: {}", call.getOperation().getOperationName(), errors);
            return GraphqlResult.success(root, queryId);
        }
        return GraphqlResult.failure(ExecutionFailureKind.API, String.join(", ", errors));
    }

    private HttpCall buildHttpCall(GraphqlCall call, String queryId, GraphqlCall.RequestStyle style)
            throws JsonProcessingException {
        String url = properties.getApi().getGraphqlBaseUrl() + "/" + queryId + "/"
                + call.getOperation().getOperationName();
        Map<String, String> headers = requestHeaders.build(credentialsPort.getCredentials());

        if (style == GraphqlCall.RequestStyle.POST_QUERY_VARIABLES) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("features", orEmpty(call.getFeatures()));
            payload.put("queryId", queryId);
            return HttpCall.post(url + "?variables=" + encode(call.getVariables()), headers,
                    objectMapper.writeValueAsString(payload));
        }
        if (style == GraphqlCall.RequestStyle.POST_JSON) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("variables", orEmpty(call.getVariables()));
            payload.put("features", orEmpty(call.getFeatures()));
            if (call.getFieldToggles() != null) {
                payload.put("fieldToggles", call.getFieldToggles());
            }
            payload.put("queryId", queryId);
            return HttpCall.post(url, headers, objectMapper.writeValueAsString(payload));
        }

        StringBuilder query = new StringBuilder(url)
                .append("?variables=").append(encode(call.getVariables()))
                .append("&features=").append(encode(call.getFeatures()));
        if (call.getFieldToggles() != null) {
            query.append("&fieldToggles=").append(encode(call.getFieldToggles()));
        }
        return HttpCall.get(query.toString(), headers);
    }

    private String encode(Map<String, Object> value) throws JsonProcessingException {
        return URLEncoder.encode(objectMapper.writeValueAsString(orEmpty(value)), StandardCharsets.UTF_8);
    }

    private static Map<String, Object> orEmpty(Map<String, Object> value) {
        return value != null ? value : Map.of();
    }

    private static List<String> errorMessages(JsonNode root) {
        JsonNode errors = root.get("errors");
        List<String> messages = new ArrayList<>();
        if (errors == null || !errors.isArray() || errors.isEmpty()) {
            return messages;
        }
        for (JsonNode error : errors) {
            String message = error.path("message").asText("");
            messages.add(message.isBlank() ? "Unknown error" : message);
        }
        return messages;
    }

    static boolean isQueryNotFound(String message) {
        String normalized = message.toLowerCase(Locale.ROOT);
        return normalized.contains("query not found") || normalized.contains("persistedquerynotfound");
    }

    private static String snippet(String body) {
        return body.length() > ERROR_SNIPPET_LENGTH ? body.substring(0, ERROR_SNIPPET_LENGTH) : body;
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
