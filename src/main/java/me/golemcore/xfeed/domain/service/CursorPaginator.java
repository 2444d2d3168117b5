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

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.xfeed.domain.model.FeedResult;
import me.golemcore.xfeed.domain.model.Page;
import me.golemcore.xfeed.domain.model.PaginationState;
import me.golemcore.xfeed.infrastructure.config.XFeedProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Function;

/**
 * Walks a cursor-paginated feed into a de-duplicated, bounded list.
 *
 * <p>
 * The walk ends in one of three ways:
 * <ul>
 * <li>exhausted - no cursor, a repeated cursor, an empty page or a page with
 * nothing new; no {@code nextCursor} is returned</li>
 * <li>capped - the page limit was hit or the target count was reached; the
 * cursor of the next page is returned</li>
 * <li>failed - a page could not be fetched; items collected so far are kept
 * together with the cursor of the failed page</li>
 * </ul>
 *
 * <p>
 * Pages are fetched strictly one after another, with the configured delay
 * before every page except the first.
 */
@Component
@Slf4j
public class CursorPaginator {

    private final XFeedProperties properties;

    public CursorPaginator(XFeedProperties properties) {
        this.properties = properties;
    }

    public <T> FeedResult<T> paginate(PaginationRequest<T> request) {
        XFeedProperties.PaginationProperties config = properties.getPagination();
        int pageSize = request.getPageSize() != null ? request.getPageSize() : config.getPageSize();
        Duration pageDelay = request.getPageDelay() != null ? request.getPageDelay() : config.getPageDelay();
        int maxPages = effectiveMaxPages(request.getTargetCount(), request.getMaxPages(), pageSize,
                config.getHardMaxPages());

        PaginationState<T> state = new PaginationState<>(request.getIdentityOf(), request.getTargetCount(),
                request.getStartCursor());

        while (!state.isTargetReached()) {
            if (state.getPagesFetched() > 0 && !pageDelay.isZero() && !pageDelay.isNegative()) {
                try {
                    sleepBetweenPages(pageDelay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return FeedResult.partialFailure("Interrupted while waiting for the next page",
                            state.getItems(), state.getCursor());
                }
            }

            Integer remaining = state.remaining();
            int requested = remaining == null ? pageSize : Math.min(pageSize, remaining);
            String usedCursor = state.getCursor();
            Page<T> page = request.getFetcher().fetch(usedCursor, requested);
            if (!page.success()) {
                log.debug("[Paginator] Page {} failed: {}", state.getPagesFetched() + 1, page.error());
                return FeedResult.partialFailure(page.error(), state.getItems(), usedCursor);
            }

            int added = state.accept(page.items());
            String pageCursor = page.cursor();
            log.debug("[Paginator] Page {}: {} items, {} new", state.getPagesFetched(), page.items().size(), added);

            if (pageCursor == null || pageCursor.isEmpty() || pageCursor.equals(usedCursor)
                    || page.items().isEmpty() || added == 0) {
                return FeedResult.success(state.getItems());
            }
            if (state.getPagesFetched() >= maxPages) {
                return FeedResult.success(state.getItems(), pageCursor);
            }
            state.advance(pageCursor);
        }
        return FeedResult.success(state.getItems(), state.getCursor());
    }

    static int effectiveMaxPages(Integer targetCount, Integer maxPages, int pageSize, int hardMaxPages) {
        if (maxPages != null) {
            return Math.min(hardMaxPages, Math.max(1, maxPages));
        }
        if (targetCount == null) {
            return hardMaxPages;
        }
        int computed = Math.max(1, (int) Math.ceil(targetCount / (double) pageSize));
        return Math.min(hardMaxPages, computed);
    }

    protected void sleepBetweenPages(Duration delay) throws InterruptedException {
        Thread.sleep(delay.toMillis());
    }

    /**
     * Fetches one page starting at {@code cursor} ({@code null} for the first
     * page) asking for {@code pageCount} records.
     */
    @FunctionalInterface
    public interface PageFetcher<T> {
        Page<T> fetch(String cursor, int pageCount);
    }

    /**
     * Parameters of one paginated read. {@code targetCount} {@code null} means
     * unbounded, bounded only by the page limit.
     */
    @Data
    @Builder
    public static class PaginationRequest<T> {
        private PageFetcher<T> fetcher;
        private Function<T, String> identityOf;
        private Integer targetCount;
        private Integer maxPages;
        private String startCursor;
        private Duration pageDelay;
        private Integer pageSize;
    }
}
