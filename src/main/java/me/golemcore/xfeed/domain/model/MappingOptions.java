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
 * Options applied while mapping raw posts. A negative quote depth is treated
 * as zero.
 */
public record MappingOptions(int quoteDepth, boolean includeRaw) {

    public MappingOptions {
        quoteDepth = Math.max(0, quoteDepth);
    }

    public MappingOptions withQuoteDepth(int depth) {
        return new MappingOptions(depth, includeRaw);
    }
}
