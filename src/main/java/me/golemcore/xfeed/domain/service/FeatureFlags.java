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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Feature switches and field toggles the web client sends with each
 * operation. The server rejects requests that omit switches it expects, so
 * these mirror what the browser sends.
 */
public final class FeatureFlags {

    private FeatureFlags() {
    }

    public static Map<String, Object> timeline() {
        Map<String, Object> features = new LinkedHashMap<>();
        features.put("rweb_video_screen_enabled", true);
        features.put("profile_label_improvements_pcf_label_in_post_enabled", true);
        features.put("responsive_web_profile_redirect_enabled", true);
        features.put("rweb_tipjar_consumption_enabled", true);
        features.put("verified_phone_label_enabled", false);
        features.put("creator_subscriptions_tweet_preview_api_enabled", true);
        features.put("responsive_web_graphql_timeline_navigation_enabled", true);
        features.put("responsive_web_graphql_exclude_directive_enabled", true);
        features.put("responsive_web_graphql_skip_user_profile_image_extensions_enabled", false);
        features.put("premium_content_api_read_enabled", false);
        features.put("communities_web_enable_tweet_community_results_fetch", true);
        features.put("c9s_tweet_anatomy_moderator_badge_enabled", true);
        features.put("responsive_web_grok_analyze_button_fetch_trends_enabled", false);
        features.put("responsive_web_grok_analyze_post_followups_enabled", false);
        features.put("responsive_web_jetfuel_frame", true);
        features.put("responsive_web_grok_share_attachment_enabled", true);
        features.put("responsive_web_edit_tweet_api_enabled", true);
        features.put("graphql_is_translatable_rweb_tweet_is_translatable_enabled", true);
        features.put("view_counts_everywhere_api_enabled", true);
        features.put("longform_notetweets_consumption_enabled", true);
        features.put("responsive_web_twitter_article_tweet_consumption_enabled", true);
        features.put("tweet_awards_web_tipping_enabled", false);
        features.put("responsive_web_grok_show_grok_translated_post", false);
        features.put("responsive_web_grok_analysis_button_from_backend", true);
        features.put("creator_subscriptions_quote_tweet_preview_enabled", false);
        features.put("freedom_of_speech_not_reach_fetch_enabled", true);
        features.put("standardized_nudges_misinfo", true);
        features.put("tweet_with_visibility_results_prefer_gql_limited_actions_policy_enabled", true);
        features.put("rweb_video_timestamps_enabled", true);
        features.put("longform_notetweets_rich_text_read_enabled", true);
        features.put("longform_notetweets_inline_media_enabled", true);
        features.put("responsive_web_grok_image_annotation_enabled", true);
        features.put("responsive_web_grok_imagine_annotation_enabled", true);
        features.put("responsive_web_grok_community_note_auto_translation_is_enabled", false);
        features.put("articles_preview_enabled", true);
        features.put("responsive_web_enhance_cards_enabled", false);
        return features;
    }

    public static Map<String, Object> bookmarks() {
        Map<String, Object> features = timeline();
        features.put("graphql_timeline_v2_bookmark_timeline", true);
        features.put("blue_business_profile_image_shape_enabled", true);
        features.put("responsive_web_text_conversations_enabled", false);
        features.put("tweetypie_unmention_optimization_enabled", true);
        features.put("vibe_api_enabled", true);
        features.put("responsive_web_twitter_blue_verified_badge_is_enabled", true);
        features.put("interactive_text_enabled", true);
        features.put("longform_notetweets_richtext_consumption_enabled", true);
        features.put("responsive_web_media_download_video_enabled", false);
        return features;
    }

    public static Map<String, Object> article() {
        Map<String, Object> features = timeline();
        features.remove("responsive_web_graphql_exclude_directive_enabled");
        features.remove("rweb_video_timestamps_enabled");
        return features;
    }

    public static Map<String, Object> tweetDetail() {
        Map<String, Object> features = article();
        features.put("responsive_web_graphql_exclude_directive_enabled", true);
        features.put("responsive_web_twitter_article_plain_text_enabled", true);
        features.put("responsive_web_twitter_article_seed_tweet_detail_enabled", true);
        features.put("responsive_web_twitter_article_seed_tweet_summary_enabled", true);
        features.put("articles_rest_api_enabled", true);
        features.put("rweb_video_timestamps_enabled", true);
        return features;
    }

    public static Map<String, Object> userLookup() {
        Map<String, Object> features = new LinkedHashMap<>();
        features.put("hidden_profile_subscriptions_enabled", true);
        features.put("hidden_profile_likes_enabled", true);
        features.put("rweb_tipjar_consumption_enabled", true);
        features.put("responsive_web_graphql_exclude_directive_enabled", true);
        features.put("verified_phone_label_enabled", false);
        features.put("subscriptions_verification_info_is_identity_verified_enabled", true);
        features.put("subscriptions_verification_info_verified_since_enabled", true);
        features.put("highlights_tweets_tab_ui_enabled", true);
        features.put("responsive_web_twitter_article_notes_tab_enabled", true);
        features.put("subscriptions_feature_can_gift_premium", true);
        features.put("creator_subscriptions_tweet_preview_api_enabled", true);
        features.put("responsive_web_graphql_skip_user_profile_image_extensions_enabled", false);
        features.put("responsive_web_graphql_timeline_navigation_enabled", true);
        features.put("blue_business_profile_image_shape_enabled", true);
        return features;
    }

    public static Map<String, Object> articleFieldToggles() {
        Map<String, Object> toggles = new LinkedHashMap<>();
        toggles.put("withPayments", false);
        toggles.put("withAuxiliaryUserLabels", false);
        toggles.put("withArticleRichContentState", true);
        toggles.put("withArticlePlainText", true);
        toggles.put("withGrokAnalyze", false);
        toggles.put("withDisallowedReplyControls", false);
        return toggles;
    }
}
