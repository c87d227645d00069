package com.engagewatch.slack.api;

import com.engagewatch.common.config.EngageWatchConfig;
import com.engagewatch.slack.api.SlackTypes.SlackMember;
import com.engagewatch.slack.api.SlackTypes.SlackMessage;
import com.engagewatch.slack.api.SlackTypes.SlackPage;
import com.engagewatch.slack.api.SlackTypes.SlackReaction;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Blocking Slack Web API client over OkHttp.
 * <p>
 * Every method makes exactly one HTTP call per page; there are no retries and
 * a 429 surfaces as a {@link SlackApiException} like any other refusal.
 */
@Slf4j
public class SlackWebClient implements SlackReadApi, SlackMessagingApi {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    private static final MediaType OCTET_STREAM = MediaType.parse("application/octet-stream");

    private static final TypeReference<List<SlackMember>> MEMBER_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<SlackMessage>> MESSAGE_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<SlackReaction>> REACTION_LIST = new TypeReference<>() {
    };

    private final String botToken;
    private final String apiBase;
    private final int directoryPageSize;
    private final int memberPageSize;
    private final int replyPageSize;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public SlackWebClient(EngageWatchConfig.SlackConfig config) {
        this(config, new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .build());
    }

    /** Test constructor with an injected OkHttpClient. */
    SlackWebClient(EngageWatchConfig.SlackConfig config, OkHttpClient httpClient) {
        this.botToken = config.getBotToken();
        this.apiBase = trimTrailingSlash(config.getApiBaseUrl());
        this.directoryPageSize = config.getDirectoryPageSize();
        this.memberPageSize = config.getMemberPageSize();
        this.replyPageSize = config.getReplyPageSize();
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    // =========================================================================
    // Read API
    // =========================================================================

    @Override
    public SlackPage<SlackMember> listUsers(String cursor) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("limit", String.valueOf(directoryPageSize));
        putCursor(params, cursor);
        JsonNode node = call("users.list", params);
        return new SlackPage<>(read("users.list", node.get("members"), MEMBER_LIST), nextCursor(node));
    }

    @Override
    public SlackPage<String> listChannelMembers(String channel, String cursor) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("channel", channel);
        params.put("limit", String.valueOf(memberPageSize));
        putCursor(params, cursor);
        JsonNode node = call("conversations.members", params);
        return new SlackPage<>(read("conversations.members", node.get("members"), STRING_LIST), nextCursor(node));
    }

    @Override
    public SlackMessage getMessage(String channel, String ts) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("channel", channel);
        params.put("latest", ts);
        params.put("inclusive", "true");
        params.put("limit", "1");
        JsonNode node = call("conversations.history", params);
        List<SlackMessage> messages = read("conversations.history", node.get("messages"), MESSAGE_LIST);
        if (messages.isEmpty() || !ts.equals(messages.get(0).getTs())) {
            throw new MessageNotFoundException();
        }
        return messages.get(0);
    }

    @Override
    public List<SlackReaction> getReactions(String channel, String ts) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("channel", channel);
        params.put("timestamp", ts);
        params.put("full", "true");
        JsonNode node = call("reactions.get", params);
        return read("reactions.get", node.path("message").get("reactions"), REACTION_LIST);
    }

    @Override
    public SlackPage<SlackMessage> listThreadReplies(String channel, String ts, String cursor) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("channel", channel);
        params.put("ts", ts);
        params.put("limit", String.valueOf(replyPageSize));
        putCursor(params, cursor);
        JsonNode node = call("conversations.replies", params);
        return new SlackPage<>(read("conversations.replies", node.get("messages"), MESSAGE_LIST), nextCursor(node));
    }

    // =========================================================================
    // Messaging API
    // =========================================================================

    @Override
    public String openDirectMessage(String userId) {
        JsonNode node = call("conversations.open", Map.of("users", userId));
        String channelId = node.path("channel").path("id").asText(null);
        if (channelId == null || channelId.isEmpty()) {
            throw new SlackApiException("conversations.open", "missing_channel_id", 200);
        }
        return channelId;
    }

    @Override
    public void postMessage(String channel, String text) {
        call("chat.postMessage", Map.of("channel", channel, "text", text));
    }

    @Override
    public void postEphemeral(String channel, String userId, String text) {
        call("chat.postEphemeral", Map.of("channel", channel, "user", userId, "text", text));
    }

    @Override
    public void uploadFile(String channel, String filename, String title, byte[] content) {
        JsonNode ticket = call("files.getUploadURLExternal", Map.of(
                "filename", filename,
                "length", String.valueOf(content.length)));
        String uploadUrl = ticket.path("upload_url").asText(null);
        String fileId = ticket.path("file_id").asText(null);
        if (uploadUrl == null || fileId == null) {
            throw new SlackApiException("files.getUploadURLExternal", "missing_upload_url", 200);
        }

        Request upload = new Request.Builder()
                .url(uploadUrl)
                .post(RequestBody.create(content, OCTET_STREAM))
                .build();
        try (Response response = httpClient.newCall(upload).execute()) {
            if (!response.isSuccessful()) {
                throw new SlackApiException("files.upload", "upload_failed", response.code());
            }
        } catch (IOException e) {
            throw new SlackTransportException("file upload failed: " + e.getMessage(), e);
        }

        String files;
        try {
            files = objectMapper.writeValueAsString(List.of(Map.of("id", fileId, "title", title)));
        } catch (IOException e) {
            throw new SlackTransportException("could not encode upload descriptor", e);
        }
        call("files.completeUploadExternal", Map.of("files", files, "channel_id", channel));
        log.debug("Uploaded {} ({} bytes) to {}", filename, content.length, channel);
    }

    @Override
    public void respond(String responseUrl, String text) {
        String json;
        try {
            json = objectMapper.writeValueAsString(Map.of("response_type", "ephemeral", "text", text));
        } catch (IOException e) {
            throw new SlackTransportException("could not encode response", e);
        }
        Request request = new Request.Builder()
                .url(responseUrl)
                .post(RequestBody.create(json, JSON))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new SlackApiException("response_url", "respond_failed", response.code());
            }
        } catch (IOException e) {
            throw new SlackTransportException("response_url call failed: " + e.getMessage(), e);
        }
    }

    // =========================================================================
    // Transport
    // =========================================================================

    /**
     * POST a form-encoded Web API call and return the parsed body of an
     * {@code "ok": true} answer.
     */
    JsonNode call(String method, Map<String, String> params) {
        FormBody.Builder form = new FormBody.Builder();
        params.forEach(form::add);

        Request request = new Request.Builder()
                .url(apiBase + "/" + method)
                .header("Authorization", "Bearer " + (botToken != null ? botToken : ""))
                .post(form.build())
                .build();

        log.debug("Slack API call: {}", method);
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String raw = body != null ? body.string() : "";
            JsonNode node = parse(method, raw, response.code());

            if (!response.isSuccessful()) {
                String error = node != null ? node.path("error").asText("http_error") : "http_error";
                throw new SlackApiException(method, error, response.code());
            }
            if (node == null) {
                throw new SlackTransportException(method + " returned an unreadable body", null);
            }
            if (!node.path("ok").asBoolean(false)) {
                throw new SlackApiException(method, node.path("error").asText("unknown_error"), response.code());
            }
            return node;
        } catch (IOException e) {
            throw new SlackTransportException(method + " request failed: " + e.getMessage(), e);
        }
    }

    private JsonNode parse(String method, String raw, int status) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(raw);
        } catch (IOException e) {
            log.warn("Slack API {} returned non-JSON body (HTTP {})", method, status);
            return null;
        }
    }

    private <T> List<T> read(String method, JsonNode node, TypeReference<List<T>> type) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return List.of();
        }
        try {
            return objectMapper.convertValue(node, type);
        } catch (IllegalArgumentException e) {
            throw new SlackTransportException(method + " returned an unexpected shape", e);
        }
    }

    private static String nextCursor(JsonNode node) {
        String cursor = node.path("response_metadata").path("next_cursor").asText("");
        return cursor.isEmpty() ? null : cursor;
    }

    private static void putCursor(Map<String, String> params, String cursor) {
        if (cursor != null && !cursor.isEmpty()) {
            params.put("cursor", cursor);
        }
    }

    private static String trimTrailingSlash(String url) {
        String base = url != null ? url : "https://slack.com/api";
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
