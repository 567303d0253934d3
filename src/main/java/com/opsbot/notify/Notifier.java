package com.opsbot.notify;

import com.opsbot.core.ReportFormat;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Posts messages through a {@link ChatClient} with a bounded number of attempts.
 *
 * <p>Delivery failures never propagate: once {@code maxAttempts} calls have failed the
 * message is dropped, the failure is logged, and {@code null} is returned. A job's outcome
 * does not depend on whether its notification arrived.</p>
 *
 * <p>Text and code messages longer than the inline limit are shared as a file instead of
 * being posted inline.</p>
 */
public class Notifier {
    private static final Logger logger = Logger.getLogger(Notifier.class.getName());

    static final String CODE_FENCE = "```";
    static final String UPLOAD_TITLE = "output.txt";

    private final ChatClient client;
    private final int maxAttempts;
    private final long retryDelayMillis;
    private final int inlineLimit;

    /**
     * @param maxAttempts total attempts per message, at least 1
     * @param retryDelayMillis base back-off; attempt n waits {@code n * retryDelayMillis} before the next
     * @param inlineLimit longest text posted inline
     */
    public Notifier(ChatClient client, int maxAttempts, long retryDelayMillis, int inlineLimit) {
        this.client = client;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryDelayMillis = Math.max(0, retryDelayMillis);
        this.inlineLimit = inlineLimit;
    }

    public ChatClient getClient() {
        return client;
    }

    public MessageRef post(String channel, String text) {
        return post(channel, text, null, ReportFormat.TEXT);
    }

    /**
     * Post plain or fenced text.
     *
     * @param format TEXT or CODE; BLOCKS callers must use {@link #postBlocks}
     * @return where the message landed, or null if every attempt failed
     */
    public MessageRef post(String channel, String text, String threadTs, ReportFormat format) {
        if (format == ReportFormat.BLOCKS) {
            throw new IllegalArgumentException("Use postBlocks for structured messages");
        }
        String body = text == null ? "" : text;

        if (body.length() > inlineLimit) {
            logger.info("Message for " + channel + " is " + body.length() + " chars, uploading as file");
            return deliver("file upload to " + channel,
                    () -> client.uploadFile(channel, UPLOAD_TITLE, body, threadTs));
        }

        String rendered = format == ReportFormat.CODE ? CODE_FENCE + body + CODE_FENCE : body;
        return deliver("message to " + channel, () -> client.postMessage(channel, rendered, threadTs));
    }

    /**
     * @return where the message landed, or null if every attempt failed
     */
    public MessageRef postBlocks(String channel, JSONArray blocks, String threadTs) {
        String fallback = fallbackText(blocks);
        return deliver("blocks to " + channel, () -> client.postBlocks(channel, blocks, fallback, threadTs));
    }

    private MessageRef deliver(String description, Delivery delivery) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return delivery.send();
            } catch (ChatClientException | RuntimeException e) {
                logger.warning("Failed to deliver " + description + " (attempt " + attempt + "/" + maxAttempts
                        + "): " + e.getMessage());
                if (attempt < maxAttempts && !pause(attempt)) {
                    break;
                }
                if (attempt == maxAttempts) {
                    logger.log(Level.SEVERE, "Giving up on " + description, e);
                }
            }
        }
        return null;
    }

    private boolean pause(int attempt) {
        if (retryDelayMillis == 0) {
            return true;
        }
        try {
            Thread.sleep(retryDelayMillis * attempt);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warning("Interrupted while waiting to retry delivery");
            return false;
        }
    }

    static String fallbackText(JSONArray blocks) {
        if (blocks.isEmpty()) {
            return "";
        }
        JSONObject first = blocks.optJSONObject(0);
        if (first == null) {
            return "";
        }
        JSONObject text = first.optJSONObject("text");
        return text == null ? "" : text.optString("text", "");
    }

    @FunctionalInterface
    private interface Delivery {
        MessageRef send() throws ChatClientException;
    }
}
