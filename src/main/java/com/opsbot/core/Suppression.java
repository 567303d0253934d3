package com.opsbot.core;

import java.time.LocalDateTime;

/**
 * A window during which jobs of one type must not be reserved.
 */
public class Suppression {
    private long id;
    private String jobType;
    private LocalDateTime startAt;
    private LocalDateTime endAt;

    public Suppression() {
    }

    public Suppression(String jobType, LocalDateTime startAt, LocalDateTime endAt) {
        this.jobType = jobType;
        this.startAt = startAt;
        this.endAt = endAt;
    }

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }

    public String getJobType() { return jobType; }
    public void setJobType(String jobType) { this.jobType = jobType; }

    public LocalDateTime getStartAt() { return startAt; }
    public void setStartAt(LocalDateTime startAt) { this.startAt = startAt; }

    public LocalDateTime getEndAt() { return endAt; }
    public void setEndAt(LocalDateTime endAt) { this.endAt = endAt; }

    /**
     * Both ends are inclusive.
     */
    public boolean covers(LocalDateTime instant) {
        return !startAt.isAfter(instant) && !endAt.isBefore(instant);
    }

    public boolean isExpired(LocalDateTime now) {
        return endAt.isBefore(now);
    }

    @Override
    public String toString() {
        return "Suppression{jobType='" + jobType + "', startAt=" + startAt + ", endAt=" + endAt + "}";
    }
}
