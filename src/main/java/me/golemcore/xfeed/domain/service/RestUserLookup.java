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
import me.golemcore.xfeed.domain.model.UserLookupResult;
import me.golemcore.xfeed.infrastructure.config.XFeedProperties;
import me.golemcore.xfeed.port.outbound.CredentialsPort;
import me.golemcore.xfeed.port.outbound.HttpTransportPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Handle lookup through the legacy REST {@code users/show} endpoints, used
 * when the GraphQL lookup fails for a reason other than the account being
 * unavailable.
 */
@Component
@Slf4j
public class RestUserLookup {

    private final HttpTransportPort transport;
    private final CredentialsPort credentialsPort;
    private final GraphqlRequestHeaders requestHeaders;
    private final ObjectMapper objectMapper;
    private final XFeedProperties properties;

    public RestUserLookup(HttpTransportPort transport, CredentialsPort credentialsPort,
            GraphqlRequestHeaders requestHeaders, ObjectMapper objectMapper, XFeedProperties properties) {
        this.transport = transport;
        this.credentialsPort = credentialsPort;
        this.requestHeaders = requestHeaders;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Tries every configured endpoint in order.
     *
     * @param handle
     *            normalized handle
     * @param previousError
     *            error reported when every endpoint fails without a better one
     */
    public UserLookupResult lookup(String handle, String previousError) {
        String lastError = previousError;
        String encoded = URLEncoder.encode(handle, StandardCharsets.UTF_8);

        for (String baseUrl : properties.getApi().getRestUserLookupUrls()) {
            String url = baseUrl + "?screen_name=" + encoded;
            try {
                HttpTransportPort.HttpReply reply = transport.send(HttpTransportPort.HttpCall.get(url,
                        requestHeaders.build(credentialsPort.getCredentials())));
                String body = reply.body() != null ? reply.body() : "";
                if (reply.status() == 404) {
                    return UserLookupResult.failure("User @" + handle + " not found");
                }
                if (!reply.isSuccessful()) {
                    lastError = "HTTP " + reply.status() + ": " + body.substring(0, Math.min(200, body.length()));
                    continue;
                }

                JsonNode root = objectMapper.readTree(body);
                JsonNode numericId = root.path("id");
                String userId = JsonNodes.rawText(root, "id_str")
                        .orElse(numericId.isNumber() ? numericId.asText() : null);
                if (userId == null) {
                    lastError = "Could not parse user ID from response";
                    continue;
                }
                return UserLookupResult.success(userId,
                        JsonNodes.rawText(root, "screen_name").orElse(handle),
                        JsonNodes.rawText(root, "name").orElse(null));
            } catch (JsonProcessingException e) {
                lastError = "Invalid JSON response: " + e.getOriginalMessage();
            } catch (IOException e) {
                log.debug("[UserLookup] {} failed: {}", baseUrl, e.getMessage());
                lastError = e.getMessage();
            }
        }
        return UserLookupResult.failure(lastError != null ? lastError : "Unknown error looking up user");
    }
}
