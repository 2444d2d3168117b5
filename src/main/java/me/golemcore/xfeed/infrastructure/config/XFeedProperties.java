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

package me.golemcore.xfeed.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code xfeed.*} prefix:
 * <ul>
 * <li>{@link ApiProperties} - GraphQL endpoint and web-client identity</li>
 * <li>{@link HttpProperties} - OkHttp timeouts and pooling</li>
 * <li>{@link CredentialsProperties} - session cookies</li>
 * <li>{@link QueryIdsProperties} - query id refresh and cache</li>
 * <li>{@link PaginationProperties} - page size, hard cap, inter-page delay</li>
 * <li>{@link MappingProperties} - quote depth and raw payload echo</li>
 * <li>{@link StorageProperties} - local workspace for persisted state</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "xfeed")
@Data
public class XFeedProperties {

    private ApiProperties api = new ApiProperties();
    private HttpProperties http = new HttpProperties();
    private CredentialsProperties credentials = new CredentialsProperties();
    private QueryIdsProperties queryIds = new QueryIdsProperties();
    private PaginationProperties pagination = new PaginationProperties();
    private MappingProperties mapping = new MappingProperties();
    private StorageProperties storage = new StorageProperties();

    @Data
    public static class ApiProperties {
        private String graphqlBaseUrl = "https://x.com/i/api/graphql";
        private String bearerToken = "AAAAAAAAAAAAAAAAAAAAANRILgAAAAAAnNwIzUejRCOuH5E6I8xnZz4puTs%3D1Zv7ttfk8LF81IUq16cHjhLTvJu4FA33AGWWjCpTnA";
        private String userAgent = "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/131.0.0.0 Safari/537.36";
        private String origin = "https://x.com";
        private String language = "en";
        private List<String> restUserLookupUrls = new ArrayList<>(List.of(
                "https://x.com/i/api/1.1/users/show.json",
                "https://api.twitter.com/1.1/users/show.json"));
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        /** Whole-call timeout in milliseconds, 0 disables it. */
        private long callTimeout = 0;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class CredentialsProperties {
        private String authToken = "";
        private String ct0 = "";
        private String cookieHeader = "";
    }

    @Data
    public static class QueryIdsProperties {
        private boolean refreshOnNotFound = true;
        private Duration cacheTtl = Duration.ofHours(24);
        private String cacheDirectory = "query-ids";
        private String cacheFile = "query-ids.json";
        private int failureAlertThreshold = 3;
        private List<String> discoveryPages = new ArrayList<>(List.of(
                "https://x.com/?lang=en",
                "https://x.com/explore",
                "https://x.com/notifications",
                "https://x.com/settings/profile"));
    }

    @Data
    public static class PaginationProperties {
        private int pageSize = 20;
        private int hardMaxPages = 10;
        private Duration pageDelay = Duration.ofMillis(1000);
    }

    @Data
    public static class MappingProperties {
        private int quoteDepth = 1;
        private boolean includeRaw = false;
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.xfeed";
    }
}
