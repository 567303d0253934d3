package com.opsbot.test;

import com.opsbot.core.ReportFormat;
import com.opsbot.notify.MessageRef;
import com.opsbot.notify.Notifier;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for bounded-retry delivery.
 */
public class NotifierTest {

    @Test
    public void testPostReturnsMessageReference() {
        RecordingChatClient client = new RecordingChatClient();
        Notifier notifier = new Notifier(client, 3, 0, 100);

        MessageRef ref = notifier.post("C1", "hello", "99.1", ReportFormat.TEXT);

        assertNotNull(ref);
        assertEquals("C1", ref.getChannel());
        assertNotNull(ref.getTs());
        List<RecordingChatClient.Post> posts = client.getPosts();
        assertEquals(1, posts.size());
        assertEquals("hello", posts.get(0).text);
        assertEquals("99.1", posts.get(0).threadTs);
        assertEquals(ref.getTs(), posts.get(0).ts);
    }

    @Test
    public void testTransientFailureIsRetried() {
        RecordingChatClient client = new RecordingChatClient();
        client.failNextCalls = 2;
        Notifier notifier = new Notifier(client, 3, 1, 100);

        assertNotNull(notifier.post("C1", "eventually"));
        assertEquals(3, client.getAttempts());
        assertEquals(1, client.getPosts().size());
    }

    /**
     * Every attempt fails: the notifier gives up after the configured count and returns null.
     */
    @Test
    public void testAttemptsAreBounded() {
        RecordingChatClient client = new RecordingChatClient();
        client.failAlways = true;
        Notifier notifier = new Notifier(client, 4, 1, 100);

        assertNull(notifier.post("C1", "lost"));
        assertEquals(4, client.getAttempts());
        assertTrue(client.getPosts().isEmpty());
    }

    @Test
    public void testAtLeastOneAttempt() {
        RecordingChatClient client = new RecordingChatClient();
        Notifier notifier = new Notifier(client, 0, 0, 100);

        assertNotNull(notifier.post("C1", "once"));
        assertEquals(1, client.getAttempts());
    }

    @Test
    public void testCodeFormatIsFenced() {
        RecordingChatClient client = new RecordingChatClient();
        Notifier notifier = new Notifier(client, 1, 0, 100);

        notifier.post("C1", "load average: 0.1", null, ReportFormat.CODE);
        assertEquals("```load average: 0.1```", client.getPosts().get(0).text);
    }

    @Test
    public void testLongOutputIsUploaded() {
        RecordingChatClient client = new RecordingChatClient();
        Notifier notifier = new Notifier(client, 1, 0, 10);

        String output = "0123456789ABCDEF";
        MessageRef ref = notifier.post("C1", output, "5.5", ReportFormat.CODE);

        assertNotNull(ref);
        RecordingChatClient.Post post = client.getPosts().get(0);
        assertEquals("file:output.txt", post.kind);
        assertEquals(output, post.text, "Uploaded content is not fenced");
        assertEquals("5.5", post.threadTs);
    }

    @Test
    public void testBlocksArePostedWithFallback() {
        RecordingChatClient client = new RecordingChatClient();
        Notifier notifier = new Notifier(client, 1, 0, 10);

        JSONArray blocks = new JSONArray().put(new JSONObject()
                .put("type", "section")
                .put("text", new JSONObject().put("type", "mrkdwn").put("text", "*All good*")));
        assertNotNull(notifier.postBlocks("C1", blocks, null));

        RecordingChatClient.Post post = client.getPosts().get(0);
        assertEquals("blocks", post.kind);
        assertTrue(post.text.contains("All good"));
    }

    @Test
    public void testBlocksFormatRequiresPostBlocks() {
        Notifier notifier = new Notifier(new RecordingChatClient(), 1, 0, 10);
        assertThrows(IllegalArgumentException.class,
                () -> notifier.post("C1", "[]", null, ReportFormat.BLOCKS));
    }
}
