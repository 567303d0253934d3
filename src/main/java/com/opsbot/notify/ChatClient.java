package com.opsbot.notify;

import org.json.JSONArray;

import java.util.List;

/**
 * The chat platform, as seen by the dispatcher and the mention watcher.
 *
 * <p>Implementations make a single attempt per call; retrying is the {@link Notifier}'s job.</p>
 */
public interface ChatClient {

    MessageRef postMessage(String channel, String text, String threadTs) throws ChatClientException;

    /**
     * @param fallbackText shown by clients that cannot render blocks
     */
    MessageRef postBlocks(String channel, JSONArray blocks, String fallbackText, String threadTs)
            throws ChatClientException;

    /**
     * Share {@code content} as a file in the channel (or thread).
     */
    MessageRef uploadFile(String channel, String title, String content, String threadTs) throws ChatClientException;

    String getPermalink(String channel, String messageTs) throws ChatClientException;

    void addReaction(String channel, String messageTs, String reaction) throws ChatClientException;

    List<SearchMatch> searchMessages(String query) throws ChatClientException;
}
