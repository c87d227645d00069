package com.engagewatch.common.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration type for EngageWatch.
 */
@Data
public class EngageWatchConfig {

    /** Slack workspace settings. */
    private SlackConfig slack;

    @Data
    public static class SlackConfig {
        /** Bot token (xoxb-...). Falls back to SLACK_BOT_TOKEN. */
        private String botToken;
        private String apiBaseUrl = "https://slack.com/api";
        /** Members never counted in any population, e.g. facilitators. */
        private List<String> excludedUserIds = new ArrayList<>();
        private String systemUserId = "USLACKBOT";
        /** Max names listed in the DM summary before "…and N more". */
        private int summaryLimit = 20;
        private int directoryPageSize = 200;
        private int memberPageSize = 1000;
        private int replyPageSize = 200;
        private String shortcutCallbackId = "find_non_engagers";
        private int workerThreads = 4;
        private int timeoutSeconds = 30;
    }
}
