package com.opsbot.core;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A unit of requested work as stored in the job table.
 *
 * <p>The type is {@code <namespace>_<job name>}, e.g. {@code proj_deploy}. The namespace
 * selects the workspace directory the command runs in; the full type selects the
 * {@link JobConfig} in the {@link JobCatalog}.</p>
 */
public class Job {
    private long id;
    private String type;
    private Map<String, String> args = new LinkedHashMap<>();
    private String channel;
    private String threadTs;
    private boolean im;
    private JobStatus status;
    private LocalDateTime scheduledAt;
    private LocalDateTime createdAt;
    private LocalDateTime reservedAt;
    private LocalDateTime completedAt;

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public Map<String, String> getArgs() { return Collections.unmodifiableMap(args); }
    public void setArgs(Map<String, String> args) {
        this.args = args == null ? new LinkedHashMap<>() : new LinkedHashMap<>(args);
    }

    public String getChannel() { return channel; }
    public void setChannel(String channel) { this.channel = channel; }

    public String getThreadTs() { return threadTs; }
    public void setThreadTs(String threadTs) { this.threadTs = threadTs; }

    /**
     * @return true if the destination is a direct or private conversation with the bot
     */
    public boolean isIm() { return im; }
    public void setIm(boolean im) { this.im = im; }

    public JobStatus getStatus() { return status; }
    public void setStatus(JobStatus status) { this.status = status; }

    public LocalDateTime getScheduledAt() { return scheduledAt; }
    public void setScheduledAt(LocalDateTime scheduledAt) { this.scheduledAt = scheduledAt; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getReservedAt() { return reservedAt; }
    public void setReservedAt(LocalDateTime reservedAt) { this.reservedAt = reservedAt; }

    public LocalDateTime getCompletedAt() { return completedAt; }
    public void setCompletedAt(LocalDateTime completedAt) { this.completedAt = completedAt; }

    public String getNamespace() {
        return namespaceOf(type);
    }

    /**
     * Namespace prefix of a job type: everything before the first underscore.
     */
    public static String namespaceOf(String jobType) {
        int idx = jobType.indexOf('_');
        return idx < 0 ? jobType : jobType.substring(0, idx);
    }

    @Override
    public String toString() {
        return "Job{id=" + id + ", type='" + type + "', status=" + status + ", scheduledAt=" + scheduledAt + "}";
    }
}
