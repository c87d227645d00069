package com.engagewatch.slack.api;

/**
 * Write side of the Slack Web API used to deliver results.
 */
public interface SlackMessagingApi {

    /** conversations.open; returns the DM channel id. */
    String openDirectMessage(String userId);

    /** chat.postMessage */
    void postMessage(String channel, String text);

    /** chat.postEphemeral */
    void postEphemeral(String channel, String userId, String text);

    /** External upload flow: getUploadURLExternal, raw upload, completeUploadExternal. */
    void uploadFile(String channel, String filename, String title, byte[] content);

    /** Post an ephemeral reply to a slash command's response_url. */
    void respond(String responseUrl, String text);
}
