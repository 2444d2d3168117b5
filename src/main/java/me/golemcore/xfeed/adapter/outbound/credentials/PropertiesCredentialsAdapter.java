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

package me.golemcore.xfeed.adapter.outbound.credentials;

import lombok.RequiredArgsConstructor;
import me.golemcore.xfeed.domain.model.XCredentials;
import me.golemcore.xfeed.infrastructure.config.XFeedProperties;
import me.golemcore.xfeed.port.outbound.CredentialsPort;
import org.springframework.stereotype.Component;

/**
 * Reads session cookies from {@code xfeed.credentials.*}, which Spring also
 * binds from the {@code XFEED_CREDENTIALS_*} environment variables.
 */
@Component
@RequiredArgsConstructor
public class PropertiesCredentialsAdapter implements CredentialsPort {

    private final XFeedProperties properties;

    @Override
    public XCredentials getCredentials() {
        XFeedProperties.CredentialsProperties credentials = properties.getCredentials();
        return new XCredentials(credentials.getAuthToken(), credentials.getCt0(), credentials.getCookieHeader());
    }
}
