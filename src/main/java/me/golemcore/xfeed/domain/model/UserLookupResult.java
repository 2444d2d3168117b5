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

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a handle to account id lookup.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserLookupResult(boolean success, String userId, String username, String name, String error) {

    public static UserLookupResult success(String userId, String username, String name) {
        return new UserLookupResult(true, userId, username, name, null);
    }

    public static UserLookupResult failure(String error) {
        return new UserLookupResult(false, null, null, null, error);
    }
}
