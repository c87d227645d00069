package com.engagewatch.slack.engine;

import java.util.List;
import java.util.Set;

/**
 * Outcome of one non-engager computation.
 *
 * @param populationIds   countable channel members after exclusions
 * @param engagedIds      engagers who are channel members (exclusions not removed)
 * @param nonEngagedIds   population minus engaged, ascending by id
 * @param nonEngagedNames display names parallel to {@code nonEngagedIds}
 */
public record NonEngagerReport(
        Set<String> populationIds,
        Set<String> engagedIds,
        List<String> nonEngagedIds,
        List<String> nonEngagedNames) {

    public NonEngagerReport {
        populationIds = Set.copyOf(populationIds);
        engagedIds = Set.copyOf(engagedIds);
        nonEngagedIds = List.copyOf(nonEngagedIds);
        nonEngagedNames = List.copyOf(nonEngagedNames);
        if (nonEngagedIds.size() != nonEngagedNames.size()) {
            throw new IllegalArgumentException("ids and names must be parallel");
        }
    }

    public boolean everyoneEngaged() {
        return nonEngagedIds.isEmpty();
    }
}
