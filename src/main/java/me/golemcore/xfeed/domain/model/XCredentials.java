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
 * Session credentials of the signed-in web client.
 *
 * @param authToken
 *            value of the {@code auth_token} cookie
 * @param csrfToken
 *            value of the {@code ct0} cookie, echoed as the CSRF header
 * @param cookieHeader
 *            full cookie header; built from the two tokens when blank
 */
public record XCredentials(String authToken, String csrfToken, String cookieHeader) {

    public String effectiveCookieHeader() {
        if (cookieHeader != null && !cookieHeader.isBlank()) {
            return cookieHeader;
        }
        return "auth_token=" + authToken + "; ct0=" + csrfToken;
    }
}
