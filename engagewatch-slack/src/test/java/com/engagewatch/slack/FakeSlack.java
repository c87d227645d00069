package com.engagewatch.slack;

import com.engagewatch.slack.api.MessageNotFoundException;
import com.engagewatch.slack.api.SlackMessagingApi;
import com.engagewatch.slack.api.SlackReadApi;
import com.engagewatch.slack.api.SlackTypes.SlackMember;
import com.engagewatch.slack.api.SlackTypes.SlackMessage;
import com.engagewatch.slack.api.SlackTypes.SlackPage;
import com.engagewatch.slack.api.SlackTypes.SlackProfile;
import com.engagewatch.slack.api.SlackTypes.SlackReaction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * In-memory Slack workspace for engine and dispatcher tests. Listings are
 * served in fixed-size pages with cursors "1", "2", ...
 */
public class FakeSlack implements SlackReadApi, SlackMessagingApi {

    public final List<SlackMember> users = new ArrayList<>();
    public final Map<String, List<String>> channelMembers = new HashMap<>();
    public final Map<String, SlackMessage> messages = new HashMap<>();
    public final Map<String, List<SlackMessage>> threads = new HashMap<>();
    public final Map<String, List<SlackReaction>> reactions = new HashMap<>();

    /** When set, getReactions throws what it supplies. */
    public Supplier<RuntimeException> reactionsFailure;
    /** When set, getMessage throws what it supplies. */
    public Supplier<RuntimeException> messageFailure;
    public int pageSize = 2;

    public int userPageCalls;
    public int getMessageCalls;
    public final List<String> posted = new ArrayList<>();
    public final List<String> ephemerals = new ArrayList<>();
    public final List<String> responses = new ArrayList<>();
    public final List<byte[]> uploads = new ArrayList<>();
    public final List<String> uploadNames = new ArrayList<>();

    // =========================================================================
    // Fixture builders
    // =========================================================================

    public static SlackMember human(String id, String displayName, String realName) {
        return SlackMember.builder()
                .id(id)
                .name(id.toLowerCase())
                .profile(SlackProfile.builder()
                        .displayNameNormalized(displayName)
                        .realNameNormalized(realName)
                        .build())
                .build();
    }

    public static SlackMessage message(String ts, String user) {
        return SlackMessage.builder().ts(ts).user(user).build();
    }

    public static SlackReaction reaction(String name, String... users) {
        return SlackReaction.builder().name(name).users(List.of(users)).count(users.length).build();
    }

    public FakeSlack member(SlackMember member, String... channels) {
        users.add(member);
        for (String channel : channels) {
            channelMembers.computeIfAbsent(channel, c -> new ArrayList<>()).add(member.getId());
        }
        return this;
    }

    public FakeSlack post(String channel, SlackMessage message) {
        messages.put(channel + "/" + message.getTs(), message);
        threads.computeIfAbsent(channel + "/" + message.getTs(), k -> new ArrayList<>()).add(message);
        return this;
    }

    public FakeSlack reply(String channel, String parentTs, SlackMessage reply) {
        threads.computeIfAbsent(channel + "/" + parentTs, k -> new ArrayList<>()).add(reply);
        return this;
    }

    public FakeSlack react(String channel, String ts, SlackReaction reaction) {
        reactions.computeIfAbsent(channel + "/" + ts, k -> new ArrayList<>()).add(reaction);
        SlackMessage message = messages.get(channel + "/" + ts);
        if (message != null) {
            List<SlackReaction> embedded = message.getReactions() == null
                    ? new ArrayList<>()
                    : new ArrayList<>(message.getReactions());
            embedded.add(reaction);
            message.setReactions(embedded);
        }
        return this;
    }

    // =========================================================================
    // SlackReadApi
    // =========================================================================

    @Override
    public SlackPage<SlackMember> listUsers(String cursor) {
        userPageCalls++;
        return page(users, cursor);
    }

    @Override
    public SlackPage<String> listChannelMembers(String channel, String cursor) {
        return page(channelMembers.getOrDefault(channel, List.of()), cursor);
    }

    @Override
    public SlackMessage getMessage(String channel, String ts) {
        getMessageCalls++;
        if (messageFailure != null) {
            throw messageFailure.get();
        }
        SlackMessage message = messages.get(channel + "/" + ts);
        if (message == null) {
            throw new MessageNotFoundException();
        }
        return message;
    }

    @Override
    public List<SlackReaction> getReactions(String channel, String ts) {
        if (reactionsFailure != null) {
            throw reactionsFailure.get();
        }
        return reactions.getOrDefault(channel + "/" + ts, List.of());
    }

    @Override
    public SlackPage<SlackMessage> listThreadReplies(String channel, String ts, String cursor) {
        return page(threads.getOrDefault(channel + "/" + ts, List.of()), cursor);
    }

    // =========================================================================
    // SlackMessagingApi
    // =========================================================================

    @Override
    public String openDirectMessage(String userId) {
        return "D-" + userId;
    }

    @Override
    public void postMessage(String channel, String text) {
        posted.add(channel + ":" + text);
    }

    @Override
    public void postEphemeral(String channel, String userId, String text) {
        ephemerals.add(channel + ":" + userId + ":" + text);
    }

    @Override
    public void uploadFile(String channel, String filename, String title, byte[] content) {
        uploadNames.add(channel + ":" + filename + ":" + title);
        uploads.add(content);
    }

    @Override
    public void respond(String responseUrl, String text) {
        responses.add(text);
    }

    private <T> SlackPage<T> page(List<T> all, String cursor) {
        int start = cursor == null ? 0 : Integer.parseInt(cursor) * pageSize;
        int end = Math.min(all.size(), start + pageSize);
        List<T> items = new ArrayList<>(all.subList(Math.min(start, all.size()), end));
        String next = end < all.size() ? String.valueOf(start / pageSize + 1) : "";
        return new SlackPage<>(items, next);
    }
}
