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

import me.golemcore.xfeed.domain.model.XCredentials;
import me.golemcore.xfeed.infrastructure.config.XFeedProperties;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Builds the header set the web client sends with every GraphQL request.
 *
 * <p>
 * The client uuid and device id are fixed for the lifetime of this bean; the
 * transaction id is fresh for each request.
 */
@Component
public class GraphqlRequestHeaders {

    private final XFeedProperties properties;
    private final SecureRandom random = new SecureRandom();
    private final String clientUuid = UUID.randomUUID().toString();
    private final String clientDeviceId = UUID.randomUUID().toString();

    public GraphqlRequestHeaders(XFeedProperties properties) {
        this.properties = properties;
    }

    public Map<String, String> build(XCredentials credentials) {
        XFeedProperties.ApiProperties api = properties.getApi();
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("accept", "*/*");
        headers.put("accept-language", "en-US,en;q=0.9");
        headers.put("authorization", "Bearer " + api.getBearerToken());
        headers.put("x-csrf-token", credentials.csrfToken());
        headers.put("x-twitter-auth-type", "OAuth2Session");
        headers.put("x-twitter-active-user", "yes");
        headers.put("x-twitter-client-language", api.getLanguage());
        headers.put("x-client-uuid", clientUuid);
        headers.put("x-twitter-client-deviceid", clientDeviceId);
        headers.put("x-client-transaction-id", newTransactionId());
        headers.put("cookie", credentials.effectiveCookieHeader());
        headers.put("user-agent", api.getUserAgent());
        headers.put("origin", api.getOrigin());
        headers.put("referer", api.getOrigin() + "/");
        headers.put("content-type", "application/json");
        return headers;
    }

    String newTransactionId() {
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
