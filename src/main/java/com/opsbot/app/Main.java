package com.opsbot.app;

import com.opsbot.core.JobCatalog;
import com.opsbot.db.Database;
import com.opsbot.db.JobStore;
import com.opsbot.engine.Dispatcher;
import com.opsbot.engine.JobRunner;
import com.opsbot.engine.ScriptBundleFetcher;
import com.opsbot.engine.SuppressionManager;
import com.opsbot.notify.Notifier;
import com.opsbot.notify.SlackChatClient;
import com.opsbot.watch.MentionRule;
import com.opsbot.watch.MentionWatcher;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Process entry point.
 *
 * <pre>
 *   java -jar opsbot-dispatcher.jar dispatch   # dispatch loop (+ status server if STATUS_PORT is set)
 *   java -jar opsbot-dispatcher.jar watch      # mention watcher
 *   java -jar opsbot-dispatcher.jar            # both
 * </pre>
 */
public class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        configureLogging();
        String mode = args.length > 0 ? args[0] : "all";
        if (!List.of("dispatch", "watch", "all").contains(mode)) {
            System.err.println("Usage: Main [dispatch|watch]");
            System.exit(2);
        }

        logger.info("=== opsbot starting (" + mode + ") ===");
        Settings settings = Settings.fromEnvironment(System.getenv());
        Notifier notifier = new Notifier(
                new SlackChatClient(settings.getApiUrl(), settings.getBotToken()),
                settings.getMaxNotifyAttempts(),
                settings.getNotifyRetryDelayMillis(),
                settings.getInlineOutputLimit());

        List<Thread> loops = new ArrayList<>();
        try {
            if (!"watch".equals(mode)) {
                loops.add(startDispatch(settings, notifier));
            }
            if (!"dispatch".equals(mode)) {
                loops.add(startWatcher(settings, notifier));
            }
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Fatal error during startup", e);
            System.exit(1);
        }

        for (Thread loop : loops) {
            try {
                loop.join();
            } catch (InterruptedException e) {
                logger.info("Main thread interrupted");
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    private static Thread startDispatch(Settings settings, Notifier notifier) throws Exception {
        Database database = new Database(settings.getDbUrl());
        database.initialize();
        JobStore store = new JobStore(database, Clock.systemUTC());
        JobCatalog catalog = JobCatalog.load(settings.getJobCatalog());
        ScriptBundleFetcher fetcher = new ScriptBundleFetcher();

        Dispatcher dispatcher = new Dispatcher(store, new SuppressionManager(store),
                job -> new JobRunner(job, catalog, store, notifier, fetcher, settings),
                settings.getDispatchIntervalMillis());

        StatusServer statusServer = null;
        if (settings.getStatusPort() > 0) {
            statusServer = new StatusServer(store, settings.getStatusPort());
            statusServer.start();
        }

        StatusServer status = statusServer;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            if (status != null) {
                status.stop();
            }
            dispatcher.shutdown();
            database.close();
        }, "dispatch-shutdown"));

        Thread thread = new Thread(dispatcher::start, "dispatcher");
        thread.start();
        return thread;
    }

    private static Thread startWatcher(Settings settings, Notifier notifier) {
        List<MentionRule> rules = List.of(
                new MentionRule("tech-support", settings.getTechSupportChannel(), "sos"),
                new MentionRule("ops-admins", settings.getAdminsChannel(), "flamingo"));
        MentionWatcher watcher = new MentionWatcher(
                new SlackChatClient(settings.getApiUrl(), settings.getUserToken()),
                notifier, rules, settings.getAppUsername(), Clock.systemUTC(),
                settings.getMentionCheckDelayMillis());

        Thread thread = new Thread(watcher::start, "mention-watcher");
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            watcher.stop();
            thread.interrupt();
        }, "watch-shutdown"));
        thread.start();
        return thread;
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
    }
}
