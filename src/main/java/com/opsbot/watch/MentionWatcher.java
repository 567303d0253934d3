package com.opsbot.watch;

import com.opsbot.notify.ChatClient;
import com.opsbot.notify.ChatClientException;
import com.opsbot.notify.Notifier;
import com.opsbot.notify.SearchMatch;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Polls chat search for keyword mentions nobody has acknowledged yet, reacts to them and
 * forwards a permalink to the rule's channel.
 *
 * <p>Search goes through a user-token client (bots cannot search); reactions, permalinks
 * and reposts go through the bot client behind the {@link Notifier}. The watcher never
 * touches the job store.</p>
 */
public class MentionWatcher {
    private static final Logger logger = Logger.getLogger(MentionWatcher.class.getName());

    static final int LOOKBACK_DAYS = 2;
    private static final Pattern LINK = Pattern.compile("<https?://[^>]+>");

    private final ChatClient searchClient;
    private final Notifier notifier;
    private final List<MentionRule> rules;
    private final String appUsername;
    private final Clock clock;
    private final long delayMillis;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public MentionWatcher(ChatClient searchClient, Notifier notifier, List<MentionRule> rules,
                          String appUsername, Clock clock, long delayMillis) {
        this.searchClient = searchClient;
        this.notifier = notifier;
        this.rules = List.copyOf(rules);
        this.appUsername = appUsername;
        this.clock = clock;
        this.delayMillis = delayMillis;
    }

    /**
     * Blocks until {@link #stop()} is called or the thread is interrupted.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            logger.warning("Mention watcher is already running");
            return;
        }
        logger.info("Mention watcher started with rules " + rules);

        while (running.get()) {
            try {
                runOnce();
                Thread.sleep(delayMillis);
            } catch (InterruptedException e) {
                logger.info("Mention watcher interrupted, stopping");
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Unexpected error in mention watcher", e);
            }
        }
        logger.info("Mention watcher exited");
    }

    public void stop() {
        running.set(false);
    }

    /**
     * Check every rule once.
     *
     * @return number of mentions forwarded
     */
    public int runOnce() {
        LocalDate after = LocalDate.now(clock).minusDays(LOOKBACK_DAYS);
        int forwarded = 0;
        for (MentionRule rule : rules) {
            try {
                forwarded += checkMessages(rule, after);
            } catch (ChatClientException e) {
                logger.warning("Search for '" + rule.getKeyword() + "' failed: " + e.getMessage());
            }
        }
        return forwarded;
    }

    /**
     * @return number of mentions forwarded for this rule
     * @throws ChatClientException if the search itself fails
     */
    public int checkMessages(MentionRule rule, LocalDate after) throws ChatClientException {
        List<SearchMatch> matches = searchClient.searchMessages(query(rule, after));
        Set<String> seen = new HashSet<>();
        int forwarded = 0;

        for (SearchMatch match : matches) {
            if (!seen.add(match.getChannel() + "/" + match.getTs())) {
                continue;
            }
            if (!mentionsOutsideLinks(match.getText(), rule.getKeyword())) {
                logger.fine("Skipping " + match + ": keyword only inside a link");
                continue;
            }
            try {
                forward(rule, match);
                forwarded++;
            } catch (ChatClientException | RuntimeException e) {
                logger.log(Level.WARNING, "Could not forward mention " + match, e);
            }
        }
        return forwarded;
    }

    private void forward(MentionRule rule, SearchMatch match) throws ChatClientException {
        ChatClient bot = notifier.getClient();
        bot.addReaction(match.getChannel(), match.getTs(), rule.getReaction());
        String permalink = bot.getPermalink(match.getChannel(), match.getTs());
        notifier.post(rule.getChannel(), permalink);
        logger.info("Forwarded '" + rule.getKeyword() + "' mention to #" + rule.getChannel() + ": " + permalink);
    }

    String query(MentionRule rule, LocalDate after) {
        return "\"" + rule.getKeyword() + "\""
                + " -has::" + rule.getReaction() + ":"
                + " -in:#" + rule.getChannel()
                + " -from:@" + appUsername
                + " -is:dm"
                + " after:" + after.format(DateTimeFormatter.ISO_LOCAL_DATE);
    }

    static boolean mentionsOutsideLinks(String text, String keyword) {
        if (text == null) {
            return false;
        }
        return LINK.matcher(text).replaceAll("").contains(keyword);
    }

    public boolean isRunning() {
        return running.get();
    }
}
