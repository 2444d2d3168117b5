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

package me.golemcore.xfeed.adapter.outbound.discovery;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.xfeed.infrastructure.config.XFeedProperties;
import me.golemcore.xfeed.port.outbound.QueryIdDiscoveryPort;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Discovers query ids by scanning the JavaScript bundles of the web client.
 *
 * <p>
 * The configured discovery pages are downloaded, every client bundle they
 * reference is fetched, and each bundle is matched against the known
 * {@code operationName}/{@code queryId} layouts. The first id found for an
 * operation wins; scanning stops once every requested operation is resolved.
 */
@Component
@Slf4j
public class BundleQueryIdDiscoveryAdapter implements QueryIdDiscoveryPort {

    private static final Pattern BUNDLE_URL = Pattern.compile(
            "https://abs\\.twimg\\.com/responsive-web/client-web(?:-legacy)?/[A-Za-z0-9.-]+\\.js");
    private static final Pattern VALID_QUERY_ID = Pattern.compile("^[a-zA-Z0-9_-]+$");

    private static final List<OperationPattern> OPERATION_PATTERNS = List.of(
            new OperationPattern(Pattern.compile(
                    "e\\.exports=\\{queryId\\s*:\\s*[\"']([^\"']+)[\"']\\s*,\\s*operationName\\s*:\\s*[\"']([^\"']+)[\"']"),
                    2, 1),
            new OperationPattern(Pattern.compile(
                    "e\\.exports=\\{operationName\\s*:\\s*[\"']([^\"']+)[\"']\\s*,\\s*queryId\\s*:\\s*[\"']([^\"']+)[\"']"),
                    1, 2),
            new OperationPattern(Pattern.compile(
                    "operationName\\s*[:=]\\s*[\"']([^\"']+)[\"'](.{0,4000}?)queryId\\s*[:=]\\s*[\"']([^\"']+)[\"']",
                    Pattern.DOTALL),
                    1, 3),
            new OperationPattern(Pattern.compile(
                    "queryId\\s*[:=]\\s*[\"']([^\"']+)[\"'](.{0,4000}?)operationName\\s*[:=]\\s*[\"']([^\"']+)[\"']",
                    Pattern.DOTALL),
                    3, 1));

    private final OkHttpClient httpClient;
    private final XFeedProperties properties;

    public BundleQueryIdDiscoveryAdapter(OkHttpClient httpClient, XFeedProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    @Override
    public Map<String, String> discover(Collection<String> operationNames) throws IOException {
        Set<String> wanted = new LinkedHashSet<>(operationNames);
        Set<String> bundles = collectBundleUrls();
        log.debug("[Discovery] Found {} client bundles", bundles.size());

        Map<String, String> discovered = new LinkedHashMap<>();
        for (String bundleUrl : bundles) {
            if (discovered.size() == wanted.size()) {
                break;
            }
            String script;
            try {
                script = fetch(bundleUrl);
            } catch (IOException e) {
                log.debug("[Discovery] Skipping bundle {}: {}", bundleUrl, e.getMessage());
                continue;
            }
            if (script != null) {
                scan(script, wanted, discovered);
            }
        }

        log.debug("[Discovery] Resolved {}/{} operations", discovered.size(), wanted.size());
        return discovered;
    }

    static void scan(String script, Set<String> wanted, Map<String, String> discovered) {
        for (OperationPattern operationPattern : OPERATION_PATTERNS) {
            Matcher matcher = operationPattern.pattern().matcher(script);
            while (matcher.find()) {
                String operationName = matcher.group(operationPattern.operationGroup());
                String queryId = matcher.group(operationPattern.queryIdGroup());
                if (wanted.contains(operationName) && !discovered.containsKey(operationName)
                        && VALID_QUERY_ID.matcher(queryId).matches()) {
                    discovered.put(operationName, queryId);
                }
            }
        }
    }

    private Set<String> collectBundleUrls() throws IOException {
        Set<String> bundles = new LinkedHashSet<>();
        int pagesRead = 0;
        IOException lastFailure = null;
        for (String page : properties.getQueryIds().getDiscoveryPages()) {
            try {
                String html = fetch(page);
                if (html == null) {
                    continue;
                }
                pagesRead++;
                Matcher matcher = BUNDLE_URL.matcher(html);
                while (matcher.find()) {
                    bundles.add(matcher.group());
                }
            } catch (IOException e) {
                log.debug("[Discovery] Failed to read {}: {}", page, e.getMessage());
                lastFailure = e;
            }
        }
        if (pagesRead == 0) {
            throw new IOException("No discovery page could be read", lastFailure);
        }
        return bundles;
    }

    /**
     * Returns the body of a successful response, or {@code null} for a non-2xx
     * status.
     */
    private String fetch(String url) throws IOException {
        Request request = new Request.Builder()
                .url(url)
                .header("user-agent", properties.getApi().getUserAgent())
                .get()
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.debug("[Discovery] {} returned HTTP {}", url, response.code());
                return null;
            }
            ResponseBody body = response.body();
            return body != null ? body.string() : "";
        }
    }

    private record OperationPattern(Pattern pattern, int operationGroup, int queryIdGroup) {
    }
}
