package com.opsbot.notify;

/**
 * One hit from a message search.
 */
public final class SearchMatch {
    private final String channel;
    private final String ts;
    private final String text;

    public SearchMatch(String channel, String ts, String text) {
        this.channel = channel;
        this.ts = ts;
        this.text = text;
    }

    public String getChannel() { return channel; }
    public String getTs() { return ts; }
    public String getText() { return text; }

    @Override
    public String toString() {
        return "SearchMatch{channel='" + channel + "', ts='" + ts + "'}";
    }
}
