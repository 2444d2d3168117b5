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

import java.util.List;

/**
 * One fetched page of a cursor-paginated feed.
 *
 * @param success
 *            whether the page was fetched
 * @param items
 *            records of the page in feed order
 * @param cursor
 *            cursor of the following page, if any
 * @param notFound
 *            whether the failure was a stale query id
 * @param error
 *            failure message
 */
public record Page<T>(boolean success, List<T> items, String cursor, boolean notFound, String error) {

    public static <T> Page<T> success(List<T> items, String cursor) {
        return new Page<>(true, items != null ? items : List.of(), cursor, false, null);
    }

    public static <T> Page<T> failure(String error) {
        return new Page<>(false, List.of(), null, false, error);
    }

    public static <T> Page<T> failure(GraphqlResult result) {
        return new Page<>(false, List.of(), null, result.isNotFound(), result.getError());
    }
}
