package com.opsbot.notify;

/**
 * A chat API call failed: transport error, HTTP error, or an {@code ok: false} reply.
 */
public class ChatClientException extends Exception {
    private final String error;

    public ChatClientException(String error) {
        super(error);
        this.error = error;
    }

    public ChatClientException(String error, Throwable cause) {
        super(error, cause);
        this.error = error;
    }

    /**
     * @return the platform's error code (e.g. {@code channel_not_found}) or a transport description
     */
    public String getError() {
        return error;
    }
}
