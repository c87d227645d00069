package com.engagewatch.slack.engine;

import com.engagewatch.slack.api.SlackReadApi;
import com.engagewatch.slack.api.SlackTypes.SlackMember;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves the countable members of a channel: humans with a directory
 * record who are neither deactivated nor the system account.
 */
@Slf4j
public class PopulationResolver {

    private final SlackReadApi api;
    private final String systemUserId;

    public PopulationResolver(SlackReadApi api, String systemUserId) {
        this.api = api;
        this.systemUserId = systemUserId;
    }

    public Set<String> resolve(String channel, MemberDirectory directory) {
        Set<String> population = Paginator.over(cursor -> api.listChannelMembers(channel, cursor))
                .items()
                .filter(userId -> keep(directory.get(userId)))
                .collect(Collectors.toSet());
        log.debug("Population of {}: {} countable members", channel, population.size());
        return population;
    }

    boolean keep(SlackMember member) {
        if (member == null) {
            return false;
        }
        if (member.isBot() || member.isSystem() || member.getId().equals(systemUserId)) {
            return false;
        }
        return !member.isDeleted();
    }
}
