package com.engagewatch.slack.api;

/**
 * Slack answered the call but refused it: {@code "ok": false} or a non-2xx
 * status. The reaction lookup treats this as recoverable; every other caller
 * treats it as fatal.
 */
public class SlackApiException extends SlackException {

    private final String method;
    private final String error;
    private final int status;

    public SlackApiException(String method, String error, int status) {
        super(method + " failed: " + error + (status != 200 ? " (HTTP " + status + ")" : ""));
        this.method = method;
        this.error = error;
        this.status = status;
    }

    public String getMethod() {
        return method;
    }

    /** Slack error code, e.g. "channel_not_found", "ratelimited". */
    public String getError() {
        return error;
    }

    public int getStatus() {
        return status;
    }
}
