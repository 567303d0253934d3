package com.opsbot.notify;

import java.util.Objects;

/**
 * Where a posted message landed: enough to ask for its permalink later.
 */
public final class MessageRef {
    private final String channel;
    private final String ts;

    public MessageRef(String channel, String ts) {
        this.channel = channel;
        this.ts = ts;
    }

    public String getChannel() {
        return channel;
    }

    /**
     * @return the message timestamp, or null when the platform returned none (file uploads)
     */
    public String getTs() {
        return ts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageRef)) return false;
        MessageRef other = (MessageRef) o;
        return Objects.equals(channel, other.channel) && Objects.equals(ts, other.ts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(channel, ts);
    }

    @Override
    public String toString() {
        return "MessageRef{channel='" + channel + "', ts='" + ts + "'}";
    }
}
