package com.opsbot.engine;

import com.opsbot.core.Job;
import com.opsbot.core.SchedulerException;
import com.opsbot.core.Suppression;
import com.opsbot.db.JobStore;

import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Queuing API used by command and webhook handlers.
 *
 * <p>A thin façade over {@link JobStore} and {@link SuppressionManager}. Job types are
 * expected to have been resolved against the catalog by the caller. Store failures
 * surface as {@link SchedulerException}.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * scheduler.scheduleSuppression("proj_deploy", now, now.plusHours(2));
 * scheduler.scheduleJob("proj_deploy", Map.of(), "#proj", null, 60, false); // waits
 * scheduler.cancelSuppressions("proj_deploy");                               // now eligible
 * }</pre>
 */
public class Scheduler {
    private static final Logger logger = Logger.getLogger(Scheduler.class.getName());

    private final JobStore store;
    private final SuppressionManager suppressions;

    public Scheduler(JobStore store, SuppressionManager suppressions) {
        this.store = store;
        this.suppressions = suppressions;
    }

    /**
     * Queue a job to run after {@code delaySeconds}.
     *
     * <p>Accepted even if the type is suppressed; it runs once no window covers it.</p>
     *
     * @param args command arguments, may be null
     * @param threadTs thread to reply in, may be null or blank
     * @param delaySeconds negative values are treated as zero
     * @return the job id
     */
    public long scheduleJob(String type, Map<String, String> args, String channel, String threadTs,
                            long delaySeconds, boolean isIm) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Job type is required");
        }
        String thread = threadTs == null || threadTs.isBlank() ? null : threadTs;
        try {
            long id = store.enqueueJob(type, args == null ? Map.of() : args, channel, thread,
                    Math.max(0, delaySeconds), isIm);
            logger.info("Job scheduled: " + id + " (type: " + type + ")");
            return id;
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to schedule job of type " + type, e);
            throw new SchedulerException("Failed to schedule job " + type, e);
        }
    }

    public long scheduleJob(String type, Map<String, String> args, String channel, String threadTs,
                            long delaySeconds) {
        return scheduleJob(type, args, channel, threadTs, delaySeconds, false);
    }

    public long scheduleSuppression(String jobType, LocalDateTime startAt, LocalDateTime endAt) {
        try {
            return store.addSuppression(jobType, startAt, endAt);
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to suppress " + jobType, e);
            throw new SchedulerException("Failed to suppress " + jobType, e);
        }
    }

    /**
     * Remove every suppression window of a type, so its pending jobs become eligible.
     *
     * @return number of windows removed
     */
    public int cancelSuppressions(String jobType) {
        try {
            return store.removeSuppressions(jobType);
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to cancel suppressions of " + jobType, e);
            throw new SchedulerException("Failed to cancel suppressions of " + jobType, e);
        }
    }

    public List<Suppression> getSuppressions() {
        try {
            return store.listSuppressions();
        } catch (SQLException e) {
            throw new SchedulerException("Failed to list suppressions", e);
        }
    }

    /**
     * @return the window currently blocking the type, if any
     */
    public Optional<Suppression> activeSuppression(String jobType) {
        try {
            return suppressions.activeSuppression(jobType);
        } catch (SQLException e) {
            throw new SchedulerException("Failed to check suppressions of " + jobType, e);
        }
    }

    public List<Job> getJobsOfType(String type) {
        try {
            return store.jobsOfType(type);
        } catch (SQLException e) {
            throw new SchedulerException("Failed to list jobs of type " + type, e);
        }
    }

    public List<Job> getJobs() {
        try {
            return store.allJobs();
        } catch (SQLException e) {
            throw new SchedulerException("Failed to list jobs", e);
        }
    }

    /**
     * Cancel a job that has not started. Running jobs are never aborted.
     *
     * @return true if the job was removed
     */
    public boolean cancelJob(long jobId) {
        try {
            return store.cancelJob(jobId);
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to cancel job " + jobId, e);
            throw new SchedulerException("Failed to cancel job " + jobId, e);
        }
    }
}
