package com.engagewatch.slack.engine;

import com.engagewatch.slack.api.SlackReadApi;
import com.engagewatch.slack.api.SlackTypes.SlackMessage;
import com.engagewatch.slack.link.MessageRef;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes which channel members did not react to, reply to, or author a
 * message.
 * <p>
 * Nothing is cached between calls: each computation re-reads the directory,
 * the channel membership and the message.
 */
@Slf4j
public class NonEngagerEngine {

    private final DirectoryResolver directoryResolver;
    private final PopulationResolver populationResolver;
    private final EngagementCollector engagementCollector;
    private final SlackReadApi api;
    private final EngagementPolicy policy;

    public NonEngagerEngine(SlackReadApi api, EngagementPolicy policy) {
        this.api = api;
        this.policy = policy;
        this.directoryResolver = new DirectoryResolver(api);
        this.populationResolver = new PopulationResolver(api, policy.systemUserId());
        this.engagementCollector = new EngagementCollector(api);
    }

    public NonEngagerReport compute(MessageRef ref) {
        String channel = ref.channel();
        String ts = ref.ts();

        MemberDirectory directory = directoryResolver.resolve();
        Set<String> population = populationResolver.resolve(channel, directory);
        SlackMessage message = api.getMessage(channel, ts);
        String author = message.getUser();

        Set<String> engagement = new HashSet<>(engagementCollector.reactors(channel, ts).userIds());
        engagement.addAll(engagementCollector.repliers(channel, ts));
        if (author != null && !author.isEmpty()) {
            engagement.add(author);
        }

        // Engagement is matched against the full population; exclusions only
        // shrink the population afterwards.
        Set<String> engaged = engagement.stream()
                .filter(population::contains)
                .collect(Collectors.toSet());
        Set<String> counted = population.stream()
                .filter(userId -> !policy.isExcluded(userId))
                .collect(Collectors.toSet());

        List<String> nonEngaged = counted.stream()
                .filter(userId -> !engaged.contains(userId))
                .sorted()
                .collect(Collectors.toList());
        List<String> names = nonEngaged.stream()
                .map(directory::nameOf)
                .collect(Collectors.toList());

        log.info("Non-engagers for {}: population={} engaged={} missing={}",
                ref, counted.size(), engaged.size(), nonEngaged.size());
        return new NonEngagerReport(counted, engaged, nonEngaged, names);
    }
}
