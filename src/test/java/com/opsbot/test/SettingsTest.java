package com.opsbot.test;

import com.opsbot.app.Settings;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SettingsTest {

    @Test
    public void testDefaults() {
        Settings settings = Settings.fromEnvironment(Map.of());

        assertEquals(Settings.DEFAULT_DB_URL, settings.getDbUrl());
        assertEquals(3, settings.getMaxNotifyAttempts());
        assertEquals(1000, settings.getNotifyRetryDelayMillis());
        assertEquals(3000, settings.getInlineOutputLimit());
        assertEquals(1000, settings.getDispatchIntervalMillis());
        assertEquals(10000, settings.getMentionCheckDelayMillis());
        assertEquals(0, settings.getStatusPort());
        assertNull(settings.getAbsoluteBin());
        assertEquals(settings.getLogsDir(), settings.getHostLogsDir(), "Host log dir defaults to the local one");
    }

    @Test
    public void testOverrides() {
        Settings settings = Settings.fromEnvironment(Map.of(
                "LOGS_DIR", "/var/log/opsbot",
                "HOST_LOGS_DIR", "/mnt/host/opsbot",
                "MAX_NOTIFY_ATTEMPTS", "5",
                "SLACK_TECH_SUPPORT_CHANNEL", "help-desk",
                "ABSOLUTE_BIN", " /opt/bin "));

        assertEquals(Paths.get("/var/log/opsbot"), settings.getLogsDir());
        assertEquals(Paths.get("/mnt/host/opsbot"), settings.getHostLogsDir());
        assertEquals(5, settings.getMaxNotifyAttempts());
        assertEquals("help-desk", settings.getTechSupportChannel());
        assertEquals("/opt/bin", settings.getAbsoluteBin());
    }

    @Test
    public void testBadNumberIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Settings.fromEnvironment(Map.of("STATUS_PORT", "http")));
        assertTrue(e.getMessage().contains("STATUS_PORT"));
    }
}
