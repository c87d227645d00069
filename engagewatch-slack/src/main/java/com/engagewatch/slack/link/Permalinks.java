package com.engagewatch.slack.link;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Slack permalink parsing and thread link building.
 * <p>
 * Permalinks carry the ts without its dot: {@code /archives/C123/p1700000000123456}
 * is ts {@code 1700000000.123456}. The last six digits are microseconds.
 */
public final class Permalinks {

    private Permalinks() {
    }

    private static final Pattern MESSAGE_URL = Pattern.compile(
            "https?://[^/\\s]+/archives/(?<channel>[A-Z0-9]+)/p(?<pts>\\d{16,})");

    private static final int MICROS_DIGITS = 6;

    /**
     * Find the first message permalink in free text.
     */
    public static Optional<MessageRef> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = MESSAGE_URL.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(new MessageRef(matcher.group("channel"), tsFromPermalinkDigits(matcher.group("pts"))));
    }

    /**
     * "1700000000123456" to "1700000000.123456".
     */
    public static String tsFromPermalinkDigits(String digits) {
        int split = digits.length() - MICROS_DIGITS;
        return digits.substring(0, split) + "." + digits.substring(split);
    }

    /**
     * Web client link opening the message's thread, for use in mrkdwn text.
     */
    public static String threadLink(String teamId, MessageRef ref) {
        return "https://app.slack.com/client/" + teamId + "/" + ref.channel()
                + "/thread/" + ref.channel() + "-" + ref.ts().replace(".", "");
    }
}
