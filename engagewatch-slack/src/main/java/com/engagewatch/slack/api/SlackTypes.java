package com.engagewatch.slack.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Slack Web API data types, limited to the fields the engagement engine reads.
 */
public final class SlackTypes {

    private SlackTypes() {
    }

    /** Reserved id of the built-in Slackbot account. */
    public static final String SYSTEM_USER_ID = "USLACKBOT";

    // =========================================================================
    // Users
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SlackMember {
        private String id;
        /** Handle, e.g. "alee". */
        private String name;
        private boolean deleted;
        @JsonProperty("is_bot")
        private boolean bot;
        private SlackProfile profile;

        @JsonIgnore
        public boolean isSystem() {
            return SYSTEM_USER_ID.equals(id);
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SlackProfile {
        @JsonProperty("display_name")
        private String displayName;
        @JsonProperty("display_name_normalized")
        private String displayNameNormalized;
        @JsonProperty("real_name")
        private String realName;
        @JsonProperty("real_name_normalized")
        private String realNameNormalized;
    }

    // =========================================================================
    // Messages
    // =========================================================================

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SlackMessage {
        private String ts;
        /** Author id; absent for some subtypes (bot_message, file_comment...). */
        private String user;
        private String subtype;
        private List<SlackReaction> reactions;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SlackReaction {
        private String name;
        private List<String> users;
        private int count;
    }

    // =========================================================================
    // Pagination
    // =========================================================================

    /**
     * One page of a cursor-paginated listing. {@code nextCursor} is null or
     * empty on the last page.
     */
    public record SlackPage<T>(List<T> items, String nextCursor) {

        public SlackPage {
            items = items == null ? List.of() : List.copyOf(items);
        }

        public boolean hasMore() {
            return nextCursor != null && !nextCursor.isEmpty();
        }

        public static <T> SlackPage<T> last(List<T> items) {
            return new SlackPage<>(items, null);
        }
    }
}
