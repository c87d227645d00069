package com.engagewatch.slack.api;

/**
 * Base type for failures reported by the Slack client.
 */
public class SlackException extends RuntimeException {

    public SlackException(String message) {
        super(message);
    }

    public SlackException(String message, Throwable cause) {
        super(message, cause);
    }
}
