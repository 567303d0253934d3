package com.opsbot.engine;

import com.opsbot.core.Suppression;
import com.opsbot.db.JobStore;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Answers whether a job type is currently forbidden from running, and clears windows
 * that have ended.
 *
 * <p>A type is suppressed iff some window of that type has
 * {@code start_at <= now <= end_at}. Windows may overlap. The same predicate is
 * evaluated inside {@link JobStore#reserveNext()}, which is where it is enforced.</p>
 */
public class SuppressionManager {
    private static final Logger logger = Logger.getLogger(SuppressionManager.class.getName());

    private final JobStore store;

    public SuppressionManager(JobStore store) {
        this.store = store;
    }

    public boolean isSuppressed(String jobType) throws SQLException {
        return activeSuppression(jobType).isPresent();
    }

    /**
     * @return the covering window that ends last, if the type is suppressed now
     */
    public Optional<Suppression> activeSuppression(String jobType) throws SQLException {
        List<Suppression> active = store.activeSuppressions(jobType, store.now());
        return active.isEmpty() ? Optional.empty() : Optional.of(active.get(0));
    }

    /**
     * Delete windows whose end is in the past. Called once per dispatch cycle.
     *
     * @return number of windows deleted
     */
    public int removeExpired() throws SQLException {
        int removed = store.removeExpiredSuppressions(store.now());
        if (removed > 0) {
            logger.fine("Garbage-collected " + removed + " suppressions");
        }
        return removed;
    }
}
