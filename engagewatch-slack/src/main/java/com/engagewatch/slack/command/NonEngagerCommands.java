package com.engagewatch.slack.command;

import com.engagewatch.common.logging.TokenRedact;
import com.engagewatch.slack.api.SlackMessagingApi;
import com.engagewatch.slack.engine.NonEngagerEngine;
import com.engagewatch.slack.engine.NonEngagerReport;
import com.engagewatch.slack.link.MessageRef;
import com.engagewatch.slack.link.Permalinks;
import com.engagewatch.slack.render.NonEngagerRenderer;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Runs non-engager requests coming from the message shortcut and the
 * {@code /nonengagers} slash command and delivers the results by DM.
 * <p>
 * A given user can have only one computation per message in flight; repeats
 * are answered with a short notice instead of a second run.
 */
@Slf4j
public class NonEngagerCommands {

    static final String USAGE = "Usage: `/nonengagers <message link>`\n"
            + "Tip: Long-press a message → *Copy link* and paste here.";
    static final String DM_SENT = "I’ve DMed you the results (CSV + summary).";
    static final String ALREADY_RUNNING = "Already working on that message, hang tight.";

    /** Message shortcut invocation. */
    public record ShortcutRequest(String userId, String teamId, String channelId, String messageTs) {
    }

    /** Slash command invocation. */
    public record SlashCommandRequest(String userId, String teamId, String channelId, String text,
            String responseUrl) {
    }

    private final NonEngagerEngine engine;
    private final SlackMessagingApi messaging;
    private final NonEngagerRenderer renderer;
    private final Executor executor;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public NonEngagerCommands(NonEngagerEngine engine, SlackMessagingApi messaging,
            NonEngagerRenderer renderer, Executor executor) {
        this.engine = engine;
        this.messaging = messaging;
        this.renderer = renderer;
        this.executor = executor;
    }

    /**
     * Reply to return synchronously in the slash command's HTTP response, if
     * the request can be answered without running anything.
     */
    public Optional<String> immediateReply(String commandText) {
        return Permalinks.parse(commandText).isPresent() ? Optional.empty() : Optional.of(USAGE);
    }

    public CompletableFuture<Void> submitShortcut(ShortcutRequest request) {
        return CompletableFuture.runAsync(() -> handleShortcut(request), executor)
                .exceptionally(e -> {
                    log.error("Shortcut request for user {} could not be answered", request.userId(),
                            redactedForLog(e));
                    return null;
                });
    }

    public CompletableFuture<Void> submitSlashCommand(SlashCommandRequest request) {
        return CompletableFuture.runAsync(() -> handleSlashCommand(request), executor)
                .exceptionally(e -> {
                    log.error("Slash command for user {} could not be answered", request.userId(),
                            redactedForLog(e));
                    return null;
                });
    }

    // =========================================================================
    // Handlers
    // =========================================================================

    public void handleShortcut(ShortcutRequest request) {
        MessageRef ref = new MessageRef(request.channelId(), request.messageTs());
        String key = inFlightKey(request.userId(), ref);
        if (!inFlight.add(key)) {
            messaging.postEphemeral(request.channelId(), request.userId(), ALREADY_RUNNING);
            return;
        }
        try {
            log.info("Shortcut: non-engagers for {} requested by {}", ref, request.userId());
            NonEngagerReport report = engine.compute(ref);
            String dm = messaging.openDirectMessage(request.userId());
            messaging.postMessage(dm, renderer.shortcutText(report, Permalinks.threadLink(request.teamId(), ref)));
            if (!report.everyoneEngaged()) {
                uploadCsv(dm, report);
            }
        } catch (RuntimeException e) {
            log.error("Non-engager computation failed for {}", ref, redactedForLog(e));
            messaging.postEphemeral(request.channelId(), request.userId(), failureText(e));
        } finally {
            inFlight.remove(key);
        }
    }

    public void handleSlashCommand(SlashCommandRequest request) {
        Optional<MessageRef> parsed = Permalinks.parse(request.text());
        if (parsed.isEmpty()) {
            messaging.respond(request.responseUrl(), USAGE);
            return;
        }
        MessageRef ref = parsed.get();
        String key = inFlightKey(request.userId(), ref);
        if (!inFlight.add(key)) {
            messaging.respond(request.responseUrl(), ALREADY_RUNNING);
            return;
        }
        try {
            log.info("Command: non-engagers for {} requested by {}", ref, request.userId());
            NonEngagerReport report = engine.compute(ref);
            if (report.everyoneEngaged()) {
                messaging.respond(request.responseUrl(), renderer.summaryText(report));
                return;
            }
            String dm = messaging.openDirectMessage(request.userId());
            messaging.respond(request.responseUrl(), DM_SENT);
            messaging.postMessage(dm, renderer.summaryText(report));
            uploadCsv(dm, report);
        } catch (RuntimeException e) {
            log.error("Non-engager computation failed for {}", ref, redactedForLog(e));
            messaging.respond(request.responseUrl(), failureText(e));
        } finally {
            inFlight.remove(key);
        }
    }

    boolean isRunning(String userId, MessageRef ref) {
        return inFlight.contains(inFlightKey(userId, ref));
    }

    private void uploadCsv(String dm, NonEngagerReport report) {
        messaging.uploadFile(dm, NonEngagerRenderer.CSV_FILENAME, NonEngagerRenderer.CSV_TITLE,
                renderer.toCsv(report));
    }

    static String failureText(Throwable e) {
        String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return "Sorry, I couldn’t compute that: `" + TokenRedact.redact(detail) + "`";
    }

    /**
     * Copy of a failure whose message is safe to log. The stack trace is kept,
     * causes are not (their messages may carry tokens too).
     */
    static Throwable redactedForLog(Throwable e) {
        String detail = e.getMessage() != null ? TokenRedact.redact(e.getMessage()) : "";
        RuntimeException copy = new RuntimeException(e.getClass().getName() + ": " + detail);
        copy.setStackTrace(e.getStackTrace());
        return copy;
    }

    private static String inFlightKey(String userId, MessageRef ref) {
        return userId + "|" + ref.channel() + "|" + ref.ts();
    }
}
