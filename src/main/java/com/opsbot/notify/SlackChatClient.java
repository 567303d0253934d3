package com.opsbot.notify;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.logging.Logger;

/**
 * {@link ChatClient} backed by the Slack Web API.
 *
 * <p>Every call is a form-encoded POST to {@code <apiUrl>/<method>} with a bearer token.
 * Replies with {@code "ok": false}, HTTP errors (including 429 rate limiting) and I/O
 * failures all become {@link ChatClientException}.</p>
 */
public class SlackChatClient implements ChatClient {
    private static final Logger logger = Logger.getLogger(SlackChatClient.class.getName());

    public static final String DEFAULT_API_URL = "https://slack.com/api";
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final int SEARCH_PAGE_SIZE = 100;

    private final HttpClient httpClient;
    private final String apiUrl;
    private final String token;

    public SlackChatClient(String apiUrl, String token) {
        this(HttpClient.newBuilder().connectTimeout(REQUEST_TIMEOUT).build(), apiUrl, token);
    }

    SlackChatClient(HttpClient httpClient, String apiUrl, String token) {
        this.httpClient = httpClient;
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.token = token;
    }

    @Override
    public MessageRef postMessage(String channel, String text, String threadTs) throws ChatClientException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("channel", channel);
        params.put("text", text);
        putIfPresent(params, "thread_ts", threadTs);

        JSONObject reply = call("chat.postMessage", params);
        return new MessageRef(reply.optString("channel", channel), reply.optString("ts", null));
    }

    @Override
    public MessageRef postBlocks(String channel, JSONArray blocks, String fallbackText, String threadTs)
            throws ChatClientException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("channel", channel);
        params.put("text", fallbackText);
        params.put("blocks", blocks.toString());
        putIfPresent(params, "thread_ts", threadTs);

        JSONObject reply = call("chat.postMessage", params);
        return new MessageRef(reply.optString("channel", channel), reply.optString("ts", null));
    }

    /**
     * Three-step external upload: reserve an upload URL, send the bytes, then share the
     * file into the channel.
     */
    @Override
    public MessageRef uploadFile(String channel, String title, String content, String threadTs)
            throws ChatClientException {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);

        Map<String, String> reserve = new LinkedHashMap<>();
        reserve.put("filename", title);
        reserve.put("length", String.valueOf(bytes.length));
        JSONObject reserved = call("files.getUploadURLExternal", reserve);
        String uploadUrl = reserved.getString("upload_url");
        String fileId = reserved.getString("file_id");

        HttpRequest upload = HttpRequest.newBuilder(URI.create(uploadUrl))
                .timeout(REQUEST_TIMEOUT)
                .POST(HttpRequest.BodyPublishers.ofByteArray(bytes))
                .build();
        HttpResponse<String> uploaded = send(upload, "file upload");
        if (uploaded.statusCode() / 100 != 2) {
            throw new ChatClientException("file upload returned HTTP " + uploaded.statusCode());
        }

        Map<String, String> complete = new LinkedHashMap<>();
        complete.put("files", new JSONArray().put(new JSONObject().put("id", fileId).put("title", title)).toString());
        complete.put("channel_id", channel);
        putIfPresent(complete, "thread_ts", threadTs);
        call("files.completeUploadExternal", complete);

        return new MessageRef(channel, null);
    }

    @Override
    public String getPermalink(String channel, String messageTs) throws ChatClientException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("channel", channel);
        params.put("message_ts", messageTs);
        return call("chat.getPermalink", params).getString("permalink");
    }

    @Override
    public void addReaction(String channel, String messageTs, String reaction) throws ChatClientException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("channel", channel);
        params.put("timestamp", messageTs);
        params.put("name", reaction);
        call("reactions.add", params);
    }

    @Override
    public List<SearchMatch> searchMessages(String query) throws ChatClientException {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("query", query);
        params.put("count", String.valueOf(SEARCH_PAGE_SIZE));

        JSONObject reply = call("search.messages", params);
        List<SearchMatch> matches = new ArrayList<>();
        JSONObject messages = reply.optJSONObject("messages");
        if (messages == null) {
            return matches;
        }
        JSONArray hits = messages.optJSONArray("matches");
        if (hits == null) {
            return matches;
        }
        for (int i = 0; i < hits.length(); i++) {
            JSONObject hit = hits.getJSONObject(i);
            JSONObject channel = hit.optJSONObject("channel");
            matches.add(new SearchMatch(
                    channel == null ? null : channel.optString("id", null),
                    hit.optString("ts", null),
                    hit.optString("text", "")));
        }
        return matches;
    }

    private JSONObject call(String method, Map<String, String> params) throws ChatClientException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(apiUrl + "/" + method))
                .timeout(REQUEST_TIMEOUT)
                .header("Authorization", "Bearer " + token)
                .header("Content-Type", "application/x-www-form-urlencoded; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(formEncode(params)))
                .build();

        HttpResponse<String> response = send(request, method);
        if (response.statusCode() == 429) {
            throw new ChatClientException(method + " rate limited, retry after "
                    + response.headers().firstValue("Retry-After").orElse("?") + "s");
        }
        if (response.statusCode() / 100 != 2) {
            throw new ChatClientException(method + " returned HTTP " + response.statusCode());
        }

        JSONObject body;
        try {
            body = new JSONObject(response.body());
        } catch (JSONException e) {
            throw new ChatClientException(method + " returned a non-JSON body", e);
        }
        if (!body.optBoolean("ok", false)) {
            throw new ChatClientException(body.optString("error", method + " failed"));
        }
        logger.fine(method + " ok");
        return body;
    }

    private HttpResponse<String> send(HttpRequest request, String what) throws ChatClientException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ChatClientException(what + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChatClientException(what + " interrupted", e);
        }
    }

    private static void putIfPresent(Map<String, String> params, String key, String value) {
        if (value != null && !value.isEmpty()) {
            params.put(key, value);
        }
    }

    static String formEncode(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> entry : params.entrySet()) {
            joiner.add(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8) + "="
                    + URLEncoder.encode(entry.getValue() == null ? "" : entry.getValue(), StandardCharsets.UTF_8));
        }
        return joiner.toString();
    }
}
