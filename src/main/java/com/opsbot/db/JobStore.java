package com.opsbot.db;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import com.opsbot.core.Job;
import com.opsbot.core.JobStatus;
import com.opsbot.core.Suppression;

import java.lang.reflect.Type;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Durable store for jobs and suppression windows.
 *
 * <p>This is the only class that writes the {@code job} and {@code suppression} tables.
 * All methods use PreparedStatement and try-with-resources.</p>
 *
 * <p><b>At-most-once dispatch:</b> {@link #reserveNext()} never flips a row with a
 * read-then-write. It selects candidates, then claims one with a conditional
 * {@code UPDATE ... WHERE status = 'PENDING'}; only the caller whose update count is 1
 * owns the job. The suppression predicate is repeated inside the claim so a window
 * added between the select and the update still blocks the job.</p>
 */
public class JobStore {
    private static final Logger logger = Logger.getLogger(JobStore.class.getName());
    private static final Gson gson = new Gson();
    private static final Type ARGS_TYPE = new TypeToken<LinkedHashMap<String, String>>() { }.getType();

    private static final int RESERVE_CANDIDATES = 10;

    private static final String NOT_SUPPRESSED =
            "NOT EXISTS (SELECT 1 FROM suppression s WHERE s.job_type = j.type " +
            "AND s.start_at <= ? AND s.end_at >= ?)";

    private final Database database;
    private final Clock clock;

    public JobStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /**
     * Insert a pending job that becomes eligible {@code delaySeconds} from now.
     *
     * <p>The type is not validated here and suppressions are not consulted: a job of a
     * suppressed type is accepted and simply waits.</p>
     *
     * @return the new job's id
     * @throws SQLException if the insert fails
     */
    public long enqueueJob(String type, Map<String, String> args, String channel, String threadTs,
                           long delaySeconds, boolean isIm) throws SQLException {
        String sql = "INSERT INTO job (type, args, channel, thread_ts, is_im, status, scheduled_at, created_at) " +
                     "VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

        LocalDateTime now = now();
        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            stmt.setString(1, type);
            stmt.setString(2, gson.toJson(args == null ? Map.of() : args));
            stmt.setString(3, channel);
            stmt.setString(4, threadTs);
            stmt.setBoolean(5, isIm);
            stmt.setString(6, JobStatus.PENDING.name());
            stmt.setTimestamp(7, Timestamp.valueOf(now.plusSeconds(delaySeconds)));
            stmt.setTimestamp(8, Timestamp.valueOf(now));
            stmt.executeUpdate();

            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for job of type " + type);
                }
                long id = keys.getLong(1);
                logger.info("Enqueued job " + id + " (type: " + type + ", delay: " + delaySeconds + "s)");
                return id;
            }
        }
    }

    /**
     * Atomically reserve one pending job that is due and whose type is not suppressed.
     *
     * <p>Safe under concurrent callers: each eligible job is handed to exactly one of them.</p>
     *
     * @return the reserved job, or null if nothing is eligible
     * @throws SQLException if a query fails
     */
    public Job reserveNext() throws SQLException {
        while (true) {
            LocalDateTime now = now();
            List<Long> candidates = findEligible(now);
            if (candidates.isEmpty()) {
                return null;
            }

            for (long id : candidates) {
                if (claim(id, now)) {
                    Job job = getJob(id);
                    logger.info("Reserved job " + id + " (type: " + (job == null ? "?" : job.getType()) + ")");
                    return job;
                }
            }
            // every candidate was claimed by someone else; look again
        }
    }

    private List<Long> findEligible(LocalDateTime now) throws SQLException {
        String sql = "SELECT j.id FROM job j WHERE j.status = ? AND j.scheduled_at <= ? AND " + NOT_SUPPRESSED +
                     " ORDER BY j.scheduled_at ASC, j.id ASC LIMIT ?";
        List<Long> ids = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            Timestamp ts = Timestamp.valueOf(now);
            stmt.setString(1, JobStatus.PENDING.name());
            stmt.setTimestamp(2, ts);
            stmt.setTimestamp(3, ts);
            stmt.setTimestamp(4, ts);
            stmt.setInt(5, RESERVE_CANDIDATES);

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getLong("id"));
                }
            }
        }
        return ids;
    }

    private boolean claim(long jobId, LocalDateTime now) throws SQLException {
        checkTransition(JobStatus.PENDING, JobStatus.RESERVED);
        String sql = "UPDATE job j SET status = ?, reserved_at = ? WHERE j.id = ? AND j.status = ? AND " + NOT_SUPPRESSED;

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            Timestamp ts = Timestamp.valueOf(now);
            stmt.setString(1, JobStatus.RESERVED.name());
            stmt.setTimestamp(2, ts);
            stmt.setLong(3, jobId);
            stmt.setString(4, JobStatus.PENDING.name());
            stmt.setTimestamp(5, ts);
            stmt.setTimestamp(6, ts);

            return stmt.executeUpdate() == 1;
        }
    }

    /**
     * Mark a reserved job as done. Calling it again, or on a job that was never
     * reserved, changes nothing.
     *
     * @return true if this call performed the transition
     * @throws SQLException if the update fails
     */
    public boolean markDone(long jobId) throws SQLException {
        checkTransition(JobStatus.RESERVED, JobStatus.DONE);
        String sql = "UPDATE job SET status = ?, completed_at = ? WHERE id = ? AND status = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, JobStatus.DONE.name());
            stmt.setTimestamp(2, Timestamp.valueOf(now()));
            stmt.setLong(3, jobId);
            stmt.setString(4, JobStatus.RESERVED.name());

            boolean updated = stmt.executeUpdate() == 1;
            if (updated) {
                logger.info("Marked job " + jobId + " done");
            }
            return updated;
        }
    }

    /**
     * Hand a reserved job that was never started back to the queue. Only for a job
     * whose runner could not be launched; a job that has started must be marked done.
     *
     * @return true if the job was reserved and is pending again
     * @throws SQLException if the update fails
     */
    public boolean release(long jobId) throws SQLException {
        checkTransition(JobStatus.RESERVED, JobStatus.PENDING);
        String sql = "UPDATE job SET status = ?, reserved_at = NULL WHERE id = ? AND status = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, JobStatus.PENDING.name());
            stmt.setLong(2, jobId);
            stmt.setString(3, JobStatus.RESERVED.name());

            boolean updated = stmt.executeUpdate() == 1;
            if (updated) {
                logger.info("Released job " + jobId + " back to pending");
            }
            return updated;
        }
    }

    private static void checkTransition(JobStatus from, JobStatus to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal job transition " + from + " -> " + to);
        }
    }

    /**
     * Delete a job that has not been reserved yet.
     *
     * @return true if the job was pending and is now gone
     * @throws SQLException if the delete fails
     */
    public boolean cancelJob(long jobId) throws SQLException {
        String sql = "DELETE FROM job WHERE id = ? AND status = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, jobId);
            stmt.setString(2, JobStatus.PENDING.name());

            boolean deleted = stmt.executeUpdate() == 1;
            if (deleted) {
                logger.info("Cancelled job " + jobId);
            } else {
                logger.info("Could not cancel job " + jobId + " (not pending)");
            }
            return deleted;
        }
    }

    /**
     * @return the job, or null if no job has that id
     */
    public Job getJob(long jobId) throws SQLException {
        String sql = "SELECT * FROM job WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, jobId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return mapJob(rs);
                }
            }
        }
        return null;
    }

    /**
     * Jobs of one type that are not done yet, soonest first. Used by callers that must
     * not schedule a second deploy while one is waiting.
     */
    public List<Job> jobsOfType(String type) throws SQLException {
        String sql = "SELECT * FROM job WHERE type = ? AND status <> ? ORDER BY scheduled_at ASC, id ASC";
        List<Job> jobs = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, type);
            stmt.setString(2, JobStatus.DONE.name());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    jobs.add(mapJob(rs));
                }
            }
        }
        return jobs;
    }

    /**
     * Every job that is not done yet, soonest first.
     */
    public List<Job> allJobs() throws SQLException {
        String sql = "SELECT * FROM job WHERE status <> ? ORDER BY scheduled_at ASC, id ASC";
        List<Job> jobs = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, JobStatus.DONE.name());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    jobs.add(mapJob(rs));
                }
            }
        }
        return jobs;
    }

    // ==================== SUPPRESSIONS ====================

    /**
     * @return the new suppression's id
     * @throws IllegalArgumentException if the window ends before it starts
     */
    public long addSuppression(String jobType, LocalDateTime startAt, LocalDateTime endAt) throws SQLException {
        if (endAt.isBefore(startAt)) {
            throw new IllegalArgumentException("Suppression ends before it starts: " + startAt + " > " + endAt);
        }
        String sql = "INSERT INTO suppression (job_type, start_at, end_at) VALUES (?, ?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            stmt.setString(1, jobType);
            stmt.setTimestamp(2, Timestamp.valueOf(startAt));
            stmt.setTimestamp(3, Timestamp.valueOf(endAt));
            stmt.executeUpdate();

            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for suppression of " + jobType);
                }
                logger.info("Suppressed " + jobType + " from " + startAt + " to " + endAt);
                return keys.getLong(1);
            }
        }
    }

    public List<Suppression> listSuppressions() throws SQLException {
        String sql = "SELECT * FROM suppression ORDER BY start_at ASC, id ASC";
        List<Suppression> suppressions = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                suppressions.add(mapSuppression(rs));
            }
        }
        return suppressions;
    }

    /**
     * Windows of the given type that cover {@code at}, latest-ending first.
     */
    public List<Suppression> activeSuppressions(String jobType, LocalDateTime at) throws SQLException {
        String sql = "SELECT * FROM suppression WHERE job_type = ? AND start_at <= ? AND end_at >= ? " +
                     "ORDER BY end_at DESC, id ASC";
        List<Suppression> suppressions = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            Timestamp ts = Timestamp.valueOf(at);
            stmt.setString(1, jobType);
            stmt.setTimestamp(2, ts);
            stmt.setTimestamp(3, ts);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    suppressions.add(mapSuppression(rs));
                }
            }
        }
        return suppressions;
    }

    /**
     * Delete every suppression whose end is strictly before {@code now}. A window still
     * covering {@code now} is never touched, so repeated calls are harmless.
     *
     * @return number of windows deleted
     */
    public int removeExpiredSuppressions(LocalDateTime now) throws SQLException {
        String sql = "DELETE FROM suppression WHERE end_at < ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setTimestamp(1, Timestamp.valueOf(now));
            int deleted = stmt.executeUpdate();
            if (deleted > 0) {
                logger.info("Removed " + deleted + " expired suppressions");
            }
            return deleted;
        }
    }

    /**
     * Delete every suppression window of a type, active or not.
     *
     * @return number of windows deleted
     */
    public int removeSuppressions(String jobType) throws SQLException {
        String sql = "DELETE FROM suppression WHERE job_type = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, jobType);
            int deleted = stmt.executeUpdate();
            logger.info("Removed " + deleted + " suppressions of " + jobType);
            return deleted;
        }
    }

    private Job mapJob(ResultSet rs) throws SQLException {
        Job job = new Job();

        job.setId(rs.getLong("id"));
        job.setType(rs.getString("type"));
        job.setArgs(gson.fromJson(rs.getString("args"), ARGS_TYPE));
        job.setChannel(rs.getString("channel"));
        job.setThreadTs(rs.getString("thread_ts"));
        job.setIm(rs.getBoolean("is_im"));
        job.setStatus(JobStatus.valueOf(rs.getString("status")));
        job.setScheduledAt(toLocal(rs.getTimestamp("scheduled_at")));
        job.setCreatedAt(toLocal(rs.getTimestamp("created_at")));
        job.setReservedAt(toLocal(rs.getTimestamp("reserved_at")));
        job.setCompletedAt(toLocal(rs.getTimestamp("completed_at")));

        return job;
    }

    private Suppression mapSuppression(ResultSet rs) throws SQLException {
        Suppression suppression = new Suppression(
                rs.getString("job_type"),
                toLocal(rs.getTimestamp("start_at")),
                toLocal(rs.getTimestamp("end_at")));
        suppression.setId(rs.getLong("id"));
        return suppression;
    }

    private static LocalDateTime toLocal(Timestamp ts) {
        return ts == null ? null : ts.toLocalDateTime();
    }
}
