package com.opsbot.core;

/**
 * How a job's stdout is rendered when it is reported back to chat.
 */
public enum ReportFormat {
    TEXT("text"),
    BLOCKS("blocks"),
    CODE("code");

    private final String configName;

    ReportFormat(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * @param name the catalog spelling ("text", "blocks" or "code"); null means text
     * @throws IllegalArgumentException for any other value
     */
    public static ReportFormat fromConfigName(String name) {
        if (name == null) {
            return TEXT;
        }
        for (ReportFormat format : values()) {
            if (format.configName.equalsIgnoreCase(name)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown report format: " + name);
    }
}
