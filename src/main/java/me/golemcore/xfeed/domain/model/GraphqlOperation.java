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

import java.util.List;

/**
 * Named GraphQL operations of the web client together with their baked-in
 * query ids.
 *
 * <p>
 * Query ids rotate without notice. The first default is the id the operation
 * shipped with; further defaults are ids observed from the web client that
 * kept working after a rotation. A refreshed runtime id, when present, is
 * always tried before these.
 */
@Getter
public enum GraphqlOperation {

    HOME_TIMELINE("HomeTimeline", "edseUwk9sP5Phz__9TIRnA"),
    HOME_LATEST_TIMELINE("HomeLatestTimeline", "iOEZpOdfekFsxSlPQCQtPg"),
    USER_TWEETS("UserTweets", "Wms1GvIiHXAPBaCr9KblaA"),
    USER_ARTICLES_TWEETS("UserArticlesTweets", "8zBy9h4L90aDL02RsBcCFg"),
    USER_BY_SCREEN_NAME("UserByScreenName",
            "xc8f1g7BYqr6VTzTbvNlGw", "qW5u-DAuXpMEG0zA1F7UGQ", "sLVLhk0bGj3MVFEKTdax1w"),
    TWEET_DETAIL("TweetDetail", "97JF30KziU00483E_8elBA", "aFvUsJm2c-oDkJV75blV6g"),
    SEARCH_TIMELINE("SearchTimeline",
            "M1jEez78PEfVfbQLvlWMvQ", "5h0kNbk3ii97rmfY6CdgAA", "Tp1sewRU1AsZpBWhqCZicQ"),
    BOOKMARKS("Bookmarks", "RV1g3b8n_SGOHwkqKYSCFw", "tmd4ifV8RHltzn8ymGg1aw"),
    BOOKMARK_FOLDER_TIMELINE("BookmarkFolderTimeline", "KJIQpsvxrTfRIlbaRIySHQ"),
    LIKES("Likes", "JR2gceKucIKcVNB_9JkhsA"),
    FOLLOWING("Following", "BEkNpEt5pNETESoqMsTEGA"),
    FOLLOWERS("Followers", "kuFUYP9eV1FPoEy4N-pi7w");

    private final String operationName;
    private final List<String> defaultQueryIds;

    GraphqlOperation(String operationName, String... defaultQueryIds) {
        this.operationName = operationName;
        this.defaultQueryIds = List.of(defaultQueryIds);
    }

    public static List<GraphqlOperation> all() {
        return List.of(values());
    }
}
