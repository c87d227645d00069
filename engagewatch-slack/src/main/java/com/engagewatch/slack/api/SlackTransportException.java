package com.engagewatch.slack.api;

/**
 * The call never produced a usable Slack answer (I/O failure, unreadable body).
 */
public class SlackTransportException extends SlackException {

    public SlackTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
