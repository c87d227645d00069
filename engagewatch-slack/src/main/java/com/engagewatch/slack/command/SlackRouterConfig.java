package com.engagewatch.slack.command;

import com.engagewatch.common.config.ConfigService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Slack request URLs, registered as Spring MVC functional endpoints.
 * <p>
 * Slack expects an answer within three seconds, so both routes acknowledge
 * immediately and hand the work to {@link NonEngagerCommands}' worker pool.
 * <ul>
 * <li>POST /slack/commands → slash command (form fields)</li>
 * <li>POST /slack/interactions → message shortcut ({@code payload} JSON field)</li>
 * </ul>
 */
@Slf4j
@Configuration
public class SlackRouterConfig {

    private static final MediaType TEXT_UTF8 = new MediaType("text", "plain", StandardCharsets.UTF_8);

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Bean
    public RouterFunction<ServerResponse> slackRoutes(NonEngagerCommands commands, ConfigService configService) {
        log.info("Slack routes registered at /slack/commands and /slack/interactions");

        return RouterFunctions.route()
                .POST("/slack/commands", request -> handleCommand(request, commands))
                .POST("/slack/interactions", request -> handleInteraction(request, commands,
                        configService.loadConfig().getSlack().getShortcutCallbackId()))
                .build();
    }

    private ServerResponse handleCommand(ServerRequest request, NonEngagerCommands commands) {
        String text = request.param("text").orElse("").trim();
        Optional<String> immediate = commands.immediateReply(text);
        if (immediate.isPresent()) {
            return ServerResponse.ok().contentType(TEXT_UTF8).body(immediate.get());
        }

        String userId = request.param("user_id").orElse(null);
        String responseUrl = request.param("response_url").orElse(null);
        if (userId == null || responseUrl == null) {
            return ServerResponse.badRequest().body("Missing required parameters");
        }

        commands.submitSlashCommand(new NonEngagerCommands.SlashCommandRequest(
                userId,
                request.param("team_id").orElse(null),
                request.param("channel_id").orElse(null),
                text,
                responseUrl));
        return ServerResponse.ok().build();
    }

    private ServerResponse handleInteraction(ServerRequest request, NonEngagerCommands commands,
            String callbackId) {
        String payload = request.param("payload").orElse(null);
        if (payload == null || payload.isBlank()) {
            return ServerResponse.badRequest().body("Missing payload");
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (IOException e) {
            log.warn("Unreadable interaction payload: {}", e.getMessage());
            return ServerResponse.badRequest().body("Malformed payload");
        }

        String type = node.path("type").asText("");
        if (!"message_action".equals(type) || !Objects.equals(callbackId, node.path("callback_id").asText(""))) {
            log.debug("Ignoring interaction type={} callback_id={}", type, node.path("callback_id").asText(""));
            return ServerResponse.ok().build();
        }

        commands.submitShortcut(new NonEngagerCommands.ShortcutRequest(
                node.path("user").path("id").asText(),
                node.path("team").path("id").asText(),
                node.path("channel").path("id").asText(),
                node.path("message").path("ts").asText()));
        return ServerResponse.ok().build();
    }
}
