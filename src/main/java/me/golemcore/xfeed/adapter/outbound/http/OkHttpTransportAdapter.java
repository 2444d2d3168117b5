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

package me.golemcore.xfeed.adapter.outbound.http;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.xfeed.port.outbound.HttpTransportPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * OkHttp implementation of {@link HttpTransportPort}.
 *
 * <p>
 * Sends exactly one exchange per call on the shared {@link OkHttpClient}. The
 * {@code content-type} header, when present, also types the request body.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OkHttpTransportAdapter implements HttpTransportPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;

    @Override
    public HttpReply send(HttpCall call) throws IOException {
        Request.Builder builder = new Request.Builder().url(call.url());
        MediaType mediaType = JSON;
        if (call.headers() != null) {
            for (Map.Entry<String, String> header : call.headers().entrySet()) {
                builder.header(header.getKey(), header.getValue());
                if ("content-type".equalsIgnoreCase(header.getKey())) {
                    MediaType parsed = MediaType.parse(header.getValue());
                    if (parsed != null) {
                        mediaType = parsed;
                    }
                }
            }
        }

        if ("POST".equalsIgnoreCase(call.method())) {
            builder.post(RequestBody.create(call.body() != null ? call.body() : "", mediaType));
        } else {
            builder.get();
        }

        log.debug("[Http] {} {}", call.method(), call.url());
        try (Response response = httpClient.newCall(builder.build()).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            return new HttpReply(response.code(), text);
        }
    }
}
