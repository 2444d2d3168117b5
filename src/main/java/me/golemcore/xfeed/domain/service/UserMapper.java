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
import me.golemcore.xfeed.domain.model.TwitterUser;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Maps a raw account result into a {@link TwitterUser}. Only results typed
 * {@code User} with an id and a handle are kept.
 */
@Component
public class UserMapper {

    public Optional<TwitterUser> map(JsonNode rawResult) {
        JsonNode result = unwrap(rawResult);
        if (result == null || !"User".equals(result.path("__typename").asText())) {
            return Optional.empty();
        }

        JsonNode legacy = result.path("legacy");
        JsonNode core = result.path("core");
        Optional<String> id = JsonNodes.rawText(result, "rest_id").filter(value -> !value.isEmpty());
        Optional<String> username = JsonNodes.rawText(legacy, "screen_name")
                .or(() -> JsonNodes.rawText(core, "screen_name"))
                .filter(value -> !value.isEmpty());
        if (id.isEmpty() || username.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(TwitterUser.builder()
                .id(id.get())
                .username(username.get())
                .name(JsonNodes.rawText(legacy, "name")
                        .or(() -> JsonNodes.rawText(core, "name"))
                        .orElse(username.get()))
                .description(JsonNodes.rawText(legacy, "description").orElse(null))
                .followersCount(JsonNodes.integer(legacy, "followers_count"))
                .followingCount(JsonNodes.integer(legacy, "friends_count"))
                .isBlueVerified(JsonNodes.bool(result, "is_blue_verified"))
                .profileImageUrl(JsonNodes.rawText(legacy, "profile_image_url_https")
                        .or(() -> JsonNodes.rawText(result, "avatar", "image_url"))
                        .orElse(null))
                .createdAt(JsonNodes.rawText(legacy, "created_at")
                        .or(() -> JsonNodes.rawText(core, "created_at"))
                        .orElse(null))
                .build());
    }

    private static JsonNode unwrap(JsonNode result) {
        if (result != null && "UserWithVisibilityResults".equals(result.path("__typename").asText())
                && result.path("user").isObject()) {
            return result.get("user");
        }
        return result;
    }
}
