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

package me.golemcore.xfeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for xfeed.
 *
 * <p>
 * xfeed reads timelines from the x.com web GraphQL API and turns the
 * undocumented, frequently changing payloads into a small stable model.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Query id recovery</b> - rotating operation ids are refreshed from the
 * public web-client bundles when every known id answers "not found"</li>
 * <li><b>Cursor pagination</b> - bounded, de-duplicated page walking with
 * resumable cursors</li>
 * <li><b>Normalization</b> - timeline entries of every known shape, rich
 * article documents, long notes and quoted posts mapped to {@code Tweet}</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Domain Layer       → TimelineService, GraphqlExecutor, CursorPaginator, TimelineParser
 * Outbound Ports     → HttpTransportPort, CredentialsPort, QueryIdDiscoveryPort, StoragePort
 * Infrastructure     → OkHttp transport, bundle scanner, local storage
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code xfeed.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class XFeedApplication {

    public static void main(String[] args) {
        SpringApplication.run(XFeedApplication.class, args);
    }

}
