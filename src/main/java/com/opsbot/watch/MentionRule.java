package com.opsbot.watch;

/**
 * A keyword to look for, the channel its mentions are forwarded to, and the reaction
 * that marks a mention as handled.
 */
public class MentionRule {
    private final String keyword;
    private final String channel;
    private final String reaction;

    public MentionRule(String keyword, String channel, String reaction) {
        if (keyword == null || keyword.isBlank()) {
            throw new IllegalArgumentException("Mention keyword must not be blank");
        }
        this.keyword = keyword;
        this.channel = channel;
        this.reaction = reaction;
    }

    public String getKeyword() { return keyword; }
    public String getChannel() { return channel; }
    public String getReaction() { return reaction; }

    @Override
    public String toString() {
        return keyword + " -> #" + channel + " :" + reaction + ":";
    }
}
