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

/**
 * Classification of a failed GraphQL call. Only {@link #NOT_FOUND} makes the
 * executor move on to the next query id.
 */
public enum ExecutionFailureKind {
    /** HTTP 404 or an API error saying the query id is unknown. */
    NOT_FOUND,
    /** Connection, DNS or timeout failure. */
    TRANSPORT,
    /** Any other non-2xx status. */
    HTTP,
    /** 2xx response carrying an errors list. */
    API,
    /** 2xx response whose body is not JSON. */
    MALFORMED
}
