package com.engagewatch.slack.api;

import com.engagewatch.slack.api.SlackTypes.SlackMember;
import com.engagewatch.slack.api.SlackTypes.SlackMessage;
import com.engagewatch.slack.api.SlackTypes.SlackPage;
import com.engagewatch.slack.api.SlackTypes.SlackReaction;

import java.util.List;

/**
 * Read side of the Slack Web API used by the engagement engine.
 * A {@code null} cursor requests the first page.
 */
public interface SlackReadApi {

    /** users.list */
    SlackPage<SlackMember> listUsers(String cursor);

    /** conversations.members */
    SlackPage<String> listChannelMembers(String channel, String cursor);

    /**
     * Fetch the message at exactly {@code ts}.
     *
     * @throws MessageNotFoundException when the channel has no message at ts
     */
    SlackMessage getMessage(String channel, String ts);

    /**
     * reactions.get
     *
     * @throws SlackApiException when Slack refuses the lookup
     */
    List<SlackReaction> getReactions(String channel, String ts);

    /** conversations.replies, parent message included. */
    SlackPage<SlackMessage> listThreadReplies(String channel, String ts, String cursor);
}
