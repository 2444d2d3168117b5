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
import lombok.Builder;
import lombok.Data;
import me.golemcore.xfeed.domain.model.GraphqlOperation;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Description of one logical GraphQL read, independent of the query id that
 * ends up serving it.
 */
@Data
@Builder
public class GraphqlCall {

    private GraphqlOperation operation;
    private Map<String, Object> variables;
    private Map<String, Object> features;
    private Map<String, Object> fieldToggles;

    /**
     * Request variants tried for every query id, in order. A variant is only
     * moved past when it answers "not found".
     */
    @Builder.Default
    private List<RequestStyle> requestStyles = List.of(RequestStyle.GET_QUERY);

    /**
     * Accepts a response that carries an errors list anyway, when the payload
     * is still usable. {@code null} rejects every such response.
     */
    private Predicate<JsonNode> errorTolerance;

    public enum RequestStyle {
        /** Variables and features as URL query parameters. */
        GET_QUERY,
        /** Variables, features and query id as a JSON body. */
        POST_JSON,
        /** Variables as URL query parameter, features and query id as a JSON body. */
        POST_QUERY_VARIABLES
    }
}
