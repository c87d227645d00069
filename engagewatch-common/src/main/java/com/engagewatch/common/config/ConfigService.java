package com.engagewatch.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches EngageWatch configuration from a JSON file.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    static final String BOT_TOKEN_ENV = "SLACK_BOT_TOKEN";

    private final ObjectMapper objectMapper;
    private final Cache<String, EngageWatchConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public EngageWatchConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public EngageWatchConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    private EngageWatchConfig doLoadConfig() {
        try {
            EngageWatchConfig config;
            if (!Files.exists(configPath)) {
                log.warn("Config file not found: {}, using defaults", configPath);
                config = new EngageWatchConfig();
            } else {
                String raw = substituteEnvVars(Files.readString(configPath));
                config = objectMapper.readValue(raw, EngageWatchConfig.class);
                log.info("Config loaded from: {}", configPath);
            }
            return applyDefaults(config);
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new EngageWatchConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.apply(varName);
            if (value == null) {
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Apply default values to missing config fields.
     */
    EngageWatchConfig applyDefaults(EngageWatchConfig config) {
        if (config.getSlack() == null) {
            config.setSlack(new EngageWatchConfig.SlackConfig());
        }
        EngageWatchConfig.SlackConfig slack = config.getSlack();
        if (slack.getBotToken() == null || slack.getBotToken().isBlank()) {
            String envToken = env.apply(BOT_TOKEN_ENV);
            slack.setBotToken(envToken != null && !envToken.isBlank() ? envToken : null);
        }
        if (slack.getExcludedUserIds() == null) {
            slack.setExcludedUserIds(new ArrayList<>());
        }
        if (slack.getApiBaseUrl() == null || slack.getApiBaseUrl().isBlank()) {
            slack.setApiBaseUrl("https://slack.com/api");
        }
        if (slack.getSummaryLimit() <= 0) {
            slack.setSummaryLimit(20);
        }
        if (slack.getWorkerThreads() <= 0) {
            slack.setWorkerThreads(4);
        }
        if (slack.getSystemUserId() == null || slack.getSystemUserId().isBlank()) {
            slack.setSystemUserId("USLACKBOT");
        }
        if (slack.getShortcutCallbackId() == null || slack.getShortcutCallbackId().isBlank()) {
            slack.setShortcutCallbackId("find_non_engagers");
        }
        if (slack.getDirectoryPageSize() <= 0) {
            slack.setDirectoryPageSize(200);
        }
        if (slack.getMemberPageSize() <= 0) {
            slack.setMemberPageSize(1000);
        }
        if (slack.getReplyPageSize() <= 0) {
            slack.setReplyPageSize(200);
        }
        if (slack.getTimeoutSeconds() <= 0) {
            slack.setTimeoutSeconds(30);
        }
        return config;
    }

    /**
     * Build a service over a fixed environment map (tests).
     */
    static ConfigService withEnv(Path configPath, Map<String, String> env) {
        return new ConfigService(configPath, DEFAULT_CACHE_TTL, env::get);
    }
}
