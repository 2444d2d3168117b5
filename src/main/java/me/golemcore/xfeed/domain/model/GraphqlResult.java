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

package me.golemcore.xfeed.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.Builder;
import lombok.Data;

/**
 * Result of one resilient GraphQL execution: the parsed response document on
 * success, a classified error otherwise.
 */
@Data
@Builder
public class GraphqlResult {

    private boolean success;
    private JsonNode body;
    private String queryId;
    private ExecutionFailureKind failureKind;
    private String error;

    public static GraphqlResult success(JsonNode body, String queryId) {
        return GraphqlResult.builder()
                .success(true)
                .body(body)
                .queryId(queryId)
                .build();
    }

    public static GraphqlResult failure(ExecutionFailureKind kind, String error) {
        return GraphqlResult.builder()
                .success(false)
                .failureKind(kind)
                .error(error)
                .build();
    }

    public boolean isNotFound() {
        return !success && failureKind == ExecutionFailureKind.NOT_FOUND;
    }

    /**
     * Returns the {@code data} object of the response, or a missing node.
     */
    public JsonNode data() {
        return body != null ? body.path("data") : MissingNode.getInstance();
    }
}
