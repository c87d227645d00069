package com.engagewatch.slack.engine;

import com.engagewatch.common.config.EngageWatchConfig;
import com.engagewatch.slack.api.SlackTypes;

import java.util.Collection;
import java.util.Set;

/**
 * Fixed exclusion rules applied to every computation.
 *
 * @param excludedUserIds members never counted, engaged or not
 * @param systemUserId    reserved system account, never part of a population
 */
public record EngagementPolicy(Set<String> excludedUserIds, String systemUserId) {

    public EngagementPolicy {
        excludedUserIds = excludedUserIds == null ? Set.of() : Set.copyOf(excludedUserIds);
        systemUserId = systemUserId == null || systemUserId.isBlank() ? SlackTypes.SYSTEM_USER_ID : systemUserId;
    }

    public static EngagementPolicy excluding(Collection<String> userIds) {
        return new EngagementPolicy(userIds == null ? Set.of() : Set.copyOf(userIds), SlackTypes.SYSTEM_USER_ID);
    }

    public static EngagementPolicy from(EngageWatchConfig.SlackConfig config) {
        Set<String> excluded = config.getExcludedUserIds() == null ? Set.of() : Set.copyOf(config.getExcludedUserIds());
        return new EngagementPolicy(excluded, config.getSystemUserId());
    }

    public boolean isExcluded(String userId) {
        return excludedUserIds.contains(userId);
    }
}
