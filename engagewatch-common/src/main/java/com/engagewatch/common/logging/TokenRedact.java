package com.engagewatch.common.logging;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks Slack credentials in text headed for logs or chat replies.
 */
public final class TokenRedact {

    private TokenRedact() {
    }

    private static final int MIN_TOKEN_LENGTH = 18;
    private static final int KEEP_START = 6;
    private static final int KEEP_END = 4;

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("\\b(xox[baprse]-[A-Za-z0-9-]{10,})\\b"),
            Pattern.compile("\\b(xapp-[A-Za-z0-9-]{10,})\\b"),
            Pattern.compile("\\bBearer\\s+([A-Za-z0-9._\\-+=]{18,})\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\"(?:token|botToken|accessToken)\"\\s*:\\s*\"([^\"]+)\""));

    /**
     * Redact Slack tokens in text. Null and empty input are returned as-is.
     */
    public static String redact(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (Pattern pattern : PATTERNS) {
            result = redactWithPattern(result, pattern);
        }
        return result;
    }

    /**
     * Mask a single token, preserving start/end characters.
     */
    public static String maskToken(String token) {
        if (token.length() < MIN_TOKEN_LENGTH) {
            return "***";
        }
        return token.substring(0, KEEP_START) + "…" + token.substring(token.length() - KEEP_END);
    }

    private static String redactWithPattern(String text, Pattern pattern) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String fullMatch = matcher.group(0);
            int tokenStart = matcher.start(1) - matcher.start();
            int tokenEnd = matcher.end(1) - matcher.start();
            String replacement = fullMatch.substring(0, tokenStart)
                    + maskToken(matcher.group(1))
                    + fullMatch.substring(tokenEnd);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
