package com.opsbot.test;

import com.opsbot.notify.Notifier;
import com.opsbot.notify.SearchMatch;
import com.opsbot.watch.MentionRule;
import com.opsbot.watch.MentionWatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MentionWatcherTest {

    private static final MentionRule TECH_SUPPORT = new MentionRule("tech-support", "tech-support", "sos");

    private RecordingChatClient searchClient;
    private RecordingChatClient botClient;
    private MentionWatcher watcher;

    @BeforeEach
    public void setUp() {
        searchClient = new RecordingChatClient();
        botClient = new RecordingChatClient();
        watcher = new MentionWatcher(searchClient, new Notifier(botClient, 1, 0, 3000),
                List.of(TECH_SUPPORT), "opsbot", new MutableClock(LocalDateTime.of(2024, 7, 10, 23, 59, 0)), 10);
    }

    @Test
    public void testQueryExcludesHandledAndOwnMessages() {
        watcher.runOnce();

        assertEquals(List.of("\"tech-support\" -has::sos: -in:#tech-support -from:@opsbot -is:dm after:2024-07-08"),
                searchClient.getQueries());
    }

    @Test
    public void testGenuineMentionIsReactedAndReposted() throws Exception {
        searchClient.setSearchResults(List.of(new SearchMatch("C9", "111.222", "need tech-support here please")));

        assertEquals(1, watcher.checkMessages(TECH_SUPPORT, LocalDate.of(2024, 7, 8)));

        assertEquals(List.of("C9/111.222:sos"), botClient.getReactions());
        List<RecordingChatClient.Post> reposts = botClient.postsTo("tech-support");
        assertEquals(1, reposts.size());
        assertEquals("https://chat.example/archives/C9/p111222", reposts.get(0).text);
    }

    /**
     * The keyword only appears inside a link, so the message is left alone.
     */
    @Test
    public void testMentionOnlyInsideLinkIsSkipped() throws Exception {
        searchClient.setSearchResults(List.of(new SearchMatch("C9", "1.1",
                "see <https://wiki.example/tech-support/rota|rota>")));

        assertEquals(0, watcher.checkMessages(TECH_SUPPORT, LocalDate.of(2024, 7, 8)));
        assertTrue(botClient.getReactions().isEmpty());
        assertTrue(botClient.getPosts().isEmpty());
    }

    @Test
    public void testForwardedMessageWithoutTextIsSkipped() throws Exception {
        searchClient.setSearchResults(List.of(new SearchMatch("C9", "1.1", "")));

        assertEquals(0, watcher.checkMessages(TECH_SUPPORT, LocalDate.of(2024, 7, 8)));
        assertTrue(botClient.getPosts().isEmpty());
    }

    @Test
    public void testMentionInsideAndOutsideLinkIsForwardedOnce() throws Exception {
        SearchMatch match = new SearchMatch("C9", "2.2",
                "tech-support: see <https://wiki.example/tech-support> too");
        searchClient.setSearchResults(List.of(match, match));

        assertEquals(1, watcher.checkMessages(TECH_SUPPORT, LocalDate.of(2024, 7, 8)));
        assertEquals(1, botClient.getReactions().size());
        assertEquals(1, botClient.postsTo("tech-support").size());
    }

    @Test
    public void testOneFailingMessageDoesNotStopTheOthers() throws Exception {
        searchClient.setSearchResults(List.of(
                new SearchMatch("C1", "1.1", "tech-support first"),
                new SearchMatch("C2", "2.2", "tech-support second")));
        botClient.failNextCalls = 1;

        assertEquals(1, watcher.checkMessages(TECH_SUPPORT, LocalDate.of(2024, 7, 8)));
        assertEquals(List.of("C2/2.2:sos"), botClient.getReactions());
    }

    @Test
    public void testSearchFailureIsContained() {
        searchClient.failAlways = true;
        assertEquals(0, watcher.runOnce());
    }

    @Test
    public void testLoopStops() throws InterruptedException {
        Thread loop = new Thread(watcher::start, "watch-test");
        loop.start();
        Thread.sleep(100);
        assertTrue(watcher.isRunning());

        watcher.stop();
        loop.join(2000);
        assertFalse(loop.isAlive());
    }

    @Test
    public void testBlankKeywordIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MentionRule(" ", "x", "y"));
    }
}
