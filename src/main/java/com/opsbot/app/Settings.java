package com.opsbot.app;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Process configuration read from environment variables.
 *
 * <p>Every value has a default so the bot starts against a local H2 file with no
 * environment at all; chat delivery then simply fails and is logged.</p>
 */
public class Settings {
    public static final String DEFAULT_DB_URL = "jdbc:h2:./opsbot;AUTO_SERVER=TRUE";

    private final String dbUrl;
    private final Path jobCatalog;
    private final Path workspaceDir;
    private final Path logsDir;
    private final Path hostLogsDir;
    private final String logsHost;
    private final String appUsername;
    private final String logsChannel;
    private final String techSupportChannel;
    private final String adminsChannel;
    private final String botToken;
    private final String userToken;
    private final String apiUrl;
    private final int maxNotifyAttempts;
    private final long notifyRetryDelayMillis;
    private final int inlineOutputLimit;
    private final long dispatchIntervalMillis;
    private final long mentionCheckDelayMillis;
    private final String absoluteBin;
    private final int statusPort;

    private Settings(Map<String, String> env) {
        this.dbUrl = string(env, "DB_URL", DEFAULT_DB_URL);
        this.jobCatalog = Paths.get(string(env, "JOB_CATALOG", "jobs.json"));
        this.workspaceDir = Paths.get(string(env, "WORKSPACE_DIR", "workspace"));
        this.logsDir = Paths.get(string(env, "LOGS_DIR", "logs"));
        this.hostLogsDir = Paths.get(string(env, "HOST_LOGS_DIR", logsDir.toString()));
        this.logsHost = string(env, "LOGS_HOST", "localhost");
        this.appUsername = string(env, "SLACK_APP_USERNAME", "opsbot");
        this.logsChannel = string(env, "SLACK_LOGS_CHANNEL", "opsbot-logs");
        this.techSupportChannel = string(env, "SLACK_TECH_SUPPORT_CHANNEL", "tech-support");
        this.adminsChannel = string(env, "SLACK_ADMINS_CHANNEL", "ops-admins");
        this.botToken = string(env, "SLACK_BOT_TOKEN", "");
        this.userToken = string(env, "SLACK_USER_TOKEN", "");
        this.apiUrl = string(env, "SLACK_API_URL", "https://slack.com/api");
        this.maxNotifyAttempts = integer(env, "MAX_NOTIFY_ATTEMPTS", 3);
        this.notifyRetryDelayMillis = integer(env, "NOTIFY_RETRY_DELAY_MS", 1000);
        this.inlineOutputLimit = integer(env, "INLINE_OUTPUT_LIMIT", 3000);
        this.dispatchIntervalMillis = integer(env, "DISPATCH_INTERVAL_MS", 1000);
        this.mentionCheckDelayMillis = integer(env, "MENTION_CHECK_DELAY_MS", 10000);
        this.absoluteBin = string(env, "ABSOLUTE_BIN", null);
        this.statusPort = integer(env, "STATUS_PORT", 0);
    }

    public static Settings fromEnvironment(Map<String, String> env) {
        return new Settings(env);
    }

    private static String string(Map<String, String> env, String key, String fallback) {
        String value = env.get(key);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static int integer(Map<String, String> env, String key, int fallback) {
        String value = string(env, key, null);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'", e);
        }
    }

    public String getDbUrl() { return dbUrl; }
    public Path getJobCatalog() { return jobCatalog; }
    public Path getWorkspaceDir() { return workspaceDir; }
    public Path getLogsDir() { return logsDir; }
    public Path getHostLogsDir() { return hostLogsDir; }
    public String getLogsHost() { return logsHost; }
    public String getAppUsername() { return appUsername; }
    /** Diagnostics destination, e.g. for failed bundle refreshes. */
    public String getLogsChannel() { return logsChannel; }
    /** Escalation destination for failed jobs. */
    public String getTechSupportChannel() { return techSupportChannel; }
    public String getAdminsChannel() { return adminsChannel; }
    public String getBotToken() { return botToken; }
    public String getUserToken() { return userToken; }
    public String getApiUrl() { return apiUrl; }
    public int getMaxNotifyAttempts() { return maxNotifyAttempts; }
    public long getNotifyRetryDelayMillis() { return notifyRetryDelayMillis; }
    public int getInlineOutputLimit() { return inlineOutputLimit; }
    public long getDispatchIntervalMillis() { return dispatchIntervalMillis; }
    public long getMentionCheckDelayMillis() { return mentionCheckDelayMillis; }
    /** Directory prepended to the child process PATH, or null. */
    public String getAbsoluteBin() { return absoluteBin; }
    public int getStatusPort() { return statusPort; }
}
