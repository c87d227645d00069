package com.engagewatch.slack.engine;

import com.engagewatch.slack.api.SlackApiException;
import com.engagewatch.slack.api.SlackException;
import com.engagewatch.slack.api.SlackReadApi;
import com.engagewatch.slack.api.SlackTypes.SlackMessage;
import com.engagewatch.slack.api.SlackTypes.SlackReaction;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects who reacted to a message and who replied in its thread.
 */
@Slf4j
public class EngagementCollector {

    /** Which lookup produced a reactor set. */
    public enum ReactorSource {
        REACTIONS_API, MESSAGE_BODY
    }

    public record Reactors(Set<String> userIds, ReactorSource source) {
        public Reactors {
            userIds = Set.copyOf(userIds);
        }
    }

    private final SlackReadApi api;

    public EngagementCollector(SlackReadApi api) {
        this.api = api;
    }

    /**
     * Reactors via reactions.get; when Slack refuses that call, read the
     * reactions embedded in the message body instead. Transport failures and a
     * missing message on the fallback path propagate.
     */
    public Reactors reactors(String channel, String ts) {
        List<SlackReaction> reactions;
        try {
            reactions = api.getReactions(channel, ts);
        } catch (SlackApiException e) {
            log.warn("reactions.get refused for {}/{} ({}), reading message body", channel, ts, e.getError());
            SlackMessage message = api.getMessage(channel, ts);
            return new Reactors(unionOfUsers(message.getReactions()), ReactorSource.MESSAGE_BODY);
        }
        return new Reactors(unionOfUsers(reactions), ReactorSource.REACTIONS_API);
    }

    /**
     * Authors of thread replies, excluding subtyped entries and the parent's
     * own author.
     */
    public Set<String> repliers(String channel, String ts) {
        Set<String> repliers = new HashSet<>();
        Paginator.over(cursor -> api.listThreadReplies(channel, ts, cursor)).items()
                .filter(message -> message.getUser() != null && !message.getUser().isEmpty())
                .filter(message -> message.getSubtype() == null || message.getSubtype().isEmpty())
                .forEach(message -> repliers.add(message.getUser()));

        try {
            String parentAuthor = api.getMessage(channel, ts).getUser();
            if (parentAuthor != null) {
                repliers.remove(parentAuthor);
            }
        } catch (SlackException e) {
            log.warn("Parent lookup failed for {}/{}, keeping author in replier set: {}",
                    channel, ts, e.getMessage());
        }
        return repliers;
    }

    private static Set<String> unionOfUsers(List<SlackReaction> reactions) {
        Set<String> users = new HashSet<>();
        if (reactions == null) {
            return users;
        }
        for (SlackReaction reaction : reactions) {
            if (reaction.getUsers() != null) {
                users.addAll(reaction.getUsers());
            }
        }
        return users;
    }
}
