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

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Accumulator for one paginated read. Items keep first-seen order and an
 * identity is never added twice.
 */
public class PaginationState<T> {

    private final List<T> items = new ArrayList<>();
    private final Set<String> seen = new HashSet<>();
    private final Function<T, String> identityOf;
    private final Integer targetCount;

    @Getter
    private String cursor;
    @Getter
    private int pagesFetched;

    public PaginationState(Function<T, String> identityOf, Integer targetCount, String startCursor) {
        this.identityOf = identityOf;
        this.targetCount = targetCount;
        this.cursor = startCursor;
    }

    /**
     * Appends the unseen records of a page, stopping once the target count is
     * reached.
     *
     * @return number of records appended
     */
    public int accept(List<T> pageItems) {
        pagesFetched++;
        int added = 0;
        for (T item : pageItems) {
            if (isTargetReached()) {
                break;
            }
            String identity = identityOf.apply(item);
            if (identity == null || !seen.add(identity)) {
                continue;
            }
            items.add(item);
            added++;
        }
        return added;
    }

    public void advance(String nextCursor) {
        this.cursor = nextCursor;
    }

    public boolean isTargetReached() {
        return targetCount != null && items.size() >= targetCount;
    }

    /**
     * Number of records still wanted, or {@code null} when unbounded.
     */
    public Integer remaining() {
        return targetCount == null ? null : Math.max(0, targetCount - items.size());
    }

    public List<T> getItems() {
        return Collections.unmodifiableList(items);
    }
}
