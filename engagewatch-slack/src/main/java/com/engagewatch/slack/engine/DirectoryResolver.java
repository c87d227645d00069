package com.engagewatch.slack.engine;

import com.engagewatch.slack.api.SlackReadApi;
import com.engagewatch.slack.api.SlackTypes.SlackMember;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;

/**
 * Fetches the whole workspace directory, every page, on each call.
 */
@Slf4j
public class DirectoryResolver {

    private final SlackReadApi api;

    public DirectoryResolver(SlackReadApi api) {
        this.api = api;
    }

    public MemberDirectory resolve() {
        Map<String, SlackMember> members = new HashMap<>();
        Paginator.over(api::listUsers).items()
                .filter(member -> member.getId() != null)
                .forEach(member -> members.put(member.getId(), member));
        log.debug("Directory resolved: {} members", members.size());
        return new MemberDirectory(members);
    }
}
