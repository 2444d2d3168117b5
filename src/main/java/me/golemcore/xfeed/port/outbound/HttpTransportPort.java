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
import java.util.Map;

/**
 * Port for sending a single HTTP exchange to the GraphQL endpoint.
 * Implementations do not retry and do not interpret status codes.
 */
public interface HttpTransportPort {

    /**
     * Sends the request and returns the status and raw body.
     *
     * @throws IOException
     *             on connection failure or timeout
     */
    HttpReply send(HttpCall call) throws IOException;

    /**
     * Outgoing request. {@code body} is {@code null} for GET.
     */
    record HttpCall(
            String method,
            String url,
            Map<String, String> headers,
            String body) {

        public static HttpCall get(String url, Map<String, String> headers) {
            return new HttpCall("GET", url, headers, null);
        }

        public static HttpCall post(String url, Map<String, String> headers, String body) {
            return new HttpCall("POST", url, headers, body);
        }
    }

    /**
     * Status code and body text of a completed exchange.
     */
    record HttpReply(int status, String body) {

        public boolean isSuccessful() {
            return status >= 200 && status < 300;
        }
    }
}
