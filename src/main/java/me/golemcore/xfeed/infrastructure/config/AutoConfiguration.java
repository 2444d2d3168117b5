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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.xfeed.domain.model.GraphqlOperation;
import me.golemcore.xfeed.domain.service.QueryIdRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared beans and startup diagnostics.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the shared {@link ObjectMapper} and {@link Clock}</li>
 * <li>Logs startup information (endpoint, storage location, paging
 * limits)</li>
 * <li>Reports which operations already have a refreshed query id</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final XFeedProperties properties;
    private final QueryIdRegistry queryIdRegistry;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("xfeed v{} starting...", version);
        log.info("GraphQL endpoint: {}", properties.getApi().getGraphqlBaseUrl());
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
        log.info("Paging: size={}, hard cap={} pages, delay={}",
                properties.getPagination().getPageSize(),
                properties.getPagination().getHardMaxPages(),
                properties.getPagination().getPageDelay());

        long refreshed = GraphqlOperation.all().stream()
                .filter(operation -> queryIdRegistry.getRuntimeQueryId(operation).isPresent())
                .count();
        log.info("Query ids: {} operations, {} with a refreshed id", GraphqlOperation.all().size(), refreshed);
    }
}
