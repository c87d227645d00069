package com.engagewatch.slack;

import com.engagewatch.common.config.ConfigService;
import com.engagewatch.common.config.EngageWatchConfig;
import com.engagewatch.slack.api.SlackWebClient;
import com.engagewatch.slack.command.NonEngagerCommands;
import com.engagewatch.slack.engine.EngagementPolicy;
import com.engagewatch.slack.engine.NonEngagerEngine;
import com.engagewatch.slack.render.NonEngagerRenderer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for the Slack engagement beans.
 */
@Slf4j
@Configuration
public class SlackBeanConfig {

    private final EngageWatchConfig.SlackConfig slackConfig;

    public SlackBeanConfig(ConfigService configService) {
        this.slackConfig = configService.loadConfig().getSlack();
        if (slackConfig.getBotToken() == null) {
            log.warn("No Slack bot token configured (slack.botToken / SLACK_BOT_TOKEN); API calls will fail");
        }
    }

    @Bean
    public SlackWebClient slackWebClient() {
        return new SlackWebClient(slackConfig);
    }

    @Bean
    public NonEngagerEngine nonEngagerEngine(SlackWebClient slackWebClient) {
        EngagementPolicy policy = EngagementPolicy.from(slackConfig);
        log.info("Engagement policy: {} excluded member(s)", policy.excludedUserIds().size());
        return new NonEngagerEngine(slackWebClient, policy);
    }

    @Bean
    public NonEngagerRenderer nonEngagerRenderer() {
        return new NonEngagerRenderer(slackConfig.getSummaryLimit());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService nonEngagerExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(slackConfig.getWorkerThreads(), runnable -> {
            Thread thread = new Thread(runnable, "non-engagers-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public NonEngagerCommands nonEngagerCommands(NonEngagerEngine engine, SlackWebClient slackWebClient,
            NonEngagerRenderer renderer, ExecutorService nonEngagerExecutor) {
        return new NonEngagerCommands(engine, slackWebClient, renderer, nonEngagerExecutor);
    }
}
