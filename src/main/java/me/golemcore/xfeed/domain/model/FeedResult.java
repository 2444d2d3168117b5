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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Outcome of a paginated read.
 *
 * <p>
 * A successful result without {@code nextCursor} means the feed was
 * exhausted; with a cursor it means the read stopped at a page limit and can
 * be resumed. A failed result may still carry the items collected before the
 * failing page together with the cursor of that page.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FeedResult<T> {

    private boolean success;
    private List<T> items;
    private String nextCursor;
    private String error;

    public static <T> FeedResult<T> success(List<T> items) {
        return success(items, null);
    }

    public static <T> FeedResult<T> success(List<T> items, String nextCursor) {
        return FeedResult.<T>builder()
                .success(true)
                .items(List.copyOf(items))
                .nextCursor(nextCursor)
                .build();
    }

    public static <T> FeedResult<T> failure(String error) {
        return FeedResult.<T>builder()
                .success(false)
                .error(error)
                .build();
    }

    /**
     * Creates a failed result that keeps what was collected before the failure.
     * An empty list is reported as no items.
     */
    public static <T> FeedResult<T> partialFailure(String error, List<T> items, String nextCursor) {
        return FeedResult.<T>builder()
                .success(false)
                .error(error)
                .items(items == null || items.isEmpty() ? null : List.copyOf(items))
                .nextCursor(nextCursor)
                .build();
    }

    @JsonIgnore
    public List<T> getItemsOrEmpty() {
        return items != null ? items : List.of();
    }
}
