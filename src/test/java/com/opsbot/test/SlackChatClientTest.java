package com.opsbot.test;

import com.opsbot.notify.ChatClientException;
import com.opsbot.notify.MessageRef;
import com.opsbot.notify.SearchMatch;
import com.opsbot.notify.SlackChatClient;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Talks to a local HTTP server that mimics the Slack Web API.
 */
public class SlackChatClientTest {

    private HttpServer server;
    private String baseUrl;
    private final Map<String, String> lastBodies = new ConcurrentHashMap<>();
    private final Map<String, String> lastAuth = new ConcurrentHashMap<>();
    private final Map<String, JSONObject> replies = new ConcurrentHashMap<>();
    private SlackChatClient client;

    @BeforeEach
    public void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/", this::handleApi);
        server.createContext("/upload/", exchange -> {
            lastBodies.put("upload", new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            respond(exchange, 200, "OK - 12");
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        client = new SlackChatClient(baseUrl + "/api/", "xoxb-test");
    }

    @AfterEach
    public void tearDown() {
        server.stop(0);
    }

    private void handleApi(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestURI().getPath().substring("/api/".length());
        lastBodies.put(method, new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        lastAuth.put(method, exchange.getRequestHeaders().getFirst("Authorization"));
        JSONObject reply = replies.getOrDefault(method, new JSONObject().put("ok", false).put("error", "unknown_method"));
        respond(exchange, 200, reply.toString());
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private String param(String method, String name) {
        for (String pair : lastBodies.get(method).split("&")) {
            String[] kv = pair.split("=", 2);
            if (URLDecoder.decode(kv[0], StandardCharsets.UTF_8).equals(name)) {
                return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    @Test
    public void testPostMessage() throws ChatClientException {
        replies.put("chat.postMessage", new JSONObject().put("ok", true).put("channel", "C123").put("ts", "17.5"));

        MessageRef ref = client.postMessage("C123", "hello & goodbye", "16.1");

        assertEquals(new MessageRef("C123", "17.5"), ref);
        assertEquals("Bearer xoxb-test", lastAuth.get("chat.postMessage"));
        assertEquals("hello & goodbye", param("chat.postMessage", "text"));
        assertEquals("16.1", param("chat.postMessage", "thread_ts"));
    }

    @Test
    public void testPostMessageWithoutThreadOmitsParameter() throws ChatClientException {
        replies.put("chat.postMessage", new JSONObject().put("ok", true).put("channel", "C1").put("ts", "1.1"));

        client.postMessage("C1", "top level", null);

        assertNull(param("chat.postMessage", "thread_ts"));
    }

    @Test
    public void testPostBlocks() throws ChatClientException {
        replies.put("chat.postMessage", new JSONObject().put("ok", true).put("channel", "C1").put("ts", "2.2"));
        JSONArray blocks = new JSONArray().put(new JSONObject().put("type", "divider"));

        client.postBlocks("C1", blocks, "fallback", null);

        assertEquals("fallback", param("chat.postMessage", "text"));
        assertEquals("divider", new JSONArray(param("chat.postMessage", "blocks")).getJSONObject(0).getString("type"));
    }

    @Test
    public void testErrorReplyBecomesException() {
        replies.put("chat.postMessage", new JSONObject().put("ok", false).put("error", "channel_not_found"));

        ChatClientException e = assertThrows(ChatClientException.class, () -> client.postMessage("nope", "x", null));
        assertEquals("channel_not_found", e.getError());
    }

    @Test
    public void testRateLimitBecomesException() {
        server.createContext("/limited/", exchange -> {
            exchange.getResponseHeaders().set("Retry-After", "7");
            respond(exchange, 429, "");
        });
        SlackChatClient limited = new SlackChatClient(baseUrl + "/limited", "xoxb-test");

        ChatClientException e = assertThrows(ChatClientException.class, () -> limited.getPermalink("C1", "1.1"));
        assertTrue(e.getMessage().contains("rate limited"));
        assertTrue(e.getMessage().contains("7"));
    }

    @Test
    public void testPermalinkAndReaction() throws ChatClientException {
        replies.put("chat.getPermalink", new JSONObject().put("ok", true).put("permalink", "https://x/p1"));
        replies.put("reactions.add", new JSONObject().put("ok", true));

        assertEquals("https://x/p1", client.getPermalink("C1", "1.1"));
        assertEquals("1.1", param("chat.getPermalink", "message_ts"));

        client.addReaction("C1", "1.1", "sos");
        assertEquals("sos", param("reactions.add", "name"));
        assertEquals("1.1", param("reactions.add", "timestamp"));
    }

    @Test
    public void testSearchMessages() throws ChatClientException {
        JSONArray matches = new JSONArray()
                .put(new JSONObject().put("ts", "5.5").put("text", "help tech-support")
                        .put("channel", new JSONObject().put("id", "C7").put("name", "general")));
        replies.put("search.messages", new JSONObject().put("ok", true)
                .put("messages", new JSONObject().put("matches", matches)));

        List<SearchMatch> results = client.searchMessages("\"tech-support\" -is:dm");

        assertEquals(1, results.size());
        assertEquals("C7", results.get(0).getChannel());
        assertEquals("5.5", results.get(0).getTs());
        assertEquals("help tech-support", results.get(0).getText());
        assertEquals("\"tech-support\" -is:dm", param("search.messages", "query"));
    }

    @Test
    public void testFileUploadUsesThreeSteps() throws ChatClientException {
        replies.put("files.getUploadURLExternal", new JSONObject().put("ok", true)
                .put("upload_url", baseUrl + "/upload/abc").put("file_id", "F1"));
        replies.put("files.completeUploadExternal", new JSONObject().put("ok", true));

        MessageRef ref = client.uploadFile("C1", "output.txt", "line 1\nline 2", "9.9");

        assertEquals("C1", ref.getChannel());
        assertEquals("13", param("files.getUploadURLExternal", "length"));
        assertEquals("line 1\nline 2", lastBodies.get("upload"));
        JSONArray files = new JSONArray(param("files.completeUploadExternal", "files"));
        assertEquals("F1", files.getJSONObject(0).getString("id"));
        assertEquals("C1", param("files.completeUploadExternal", "channel_id"));
        assertEquals("9.9", param("files.completeUploadExternal", "thread_ts"));
    }
}
