package com.engagewatch.slack.api;

/**
 * No message exists at the requested (channel, ts).
 */
public class MessageNotFoundException extends SlackException {

    public MessageNotFoundException() {
        super("Message not found at that timestamp.");
    }
}
