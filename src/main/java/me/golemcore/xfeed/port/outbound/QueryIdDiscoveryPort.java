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

package me.golemcore.xfeed.port.outbound;

import java.io.IOException;
import java.util.Collection;
import java.util.Map;

/**
 * Port for discovering the current query ids of GraphQL operations.
 */
public interface QueryIdDiscoveryPort {

    /**
     * Looks up fresh query ids.
     *
     * @param operationNames
     *            operation names of interest
     * @return operation name to query id, possibly partial or empty
     * @throws IOException
     *             when no source could be read at all
     */
    Map<String, String> discover(Collection<String> operationNames) throws IOException;
}
