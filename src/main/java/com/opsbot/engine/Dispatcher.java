package com.opsbot.engine;

import com.opsbot.core.Job;
import com.opsbot.db.JobStore;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The dispatch loop: once per interval it drops expired suppression windows, then
 * reserves every eligible job and hands each to its own {@link JobRunner}.
 *
 * <p>Runners execute on a cached thread pool so a hung command never delays the next
 * cycle or other jobs. The loop itself only talks to the store.</p>
 *
 * <p><b>Error handling:</b></p>
 * <ul>
 *   <li>SQLException: back off for two intervals, continue</li>
 *   <li>InterruptedException: exit the loop</li>
 *   <li>Anything else: log and continue</li>
 * </ul>
 *
 * <p>Reserved jobs left behind by a crashed process are not reset on start; they stay
 * reserved so a job is never run twice. A job reserved while the runner pool is closing
 * was never started, so it is released back to pending instead.</p>
 */
public class Dispatcher {
    private static final Logger logger = Logger.getLogger(Dispatcher.class.getName());

    private final JobStore store;
    private final SuppressionManager suppressions;
    private final Function<Job, JobRunner> runnerFactory;
    private final long intervalMillis;
    private final ExecutorService executorService;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread loopThread;

    /**
     * @param runnerFactory builds the runner for a freshly reserved job
     * @param intervalMillis pause between cycles
     */
    public Dispatcher(JobStore store, SuppressionManager suppressions,
                      Function<Job, JobRunner> runnerFactory, long intervalMillis) {
        this.store = store;
        this.suppressions = suppressions;
        this.runnerFactory = runnerFactory;
        this.intervalMillis = intervalMillis;
        this.executorService = Executors.newCachedThreadPool(new RunnerThreadFactory());
    }

    /**
     * Blocks until {@link #shutdown()} is called or the thread is interrupted. Run it on its
     * own thread.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            logger.warning("Dispatcher is already running");
            return;
        }
        loopThread = Thread.currentThread();
        logger.info("Dispatcher started, polling every " + intervalMillis + " ms");

        while (running.get()) {
            try {
                runOnce();
                Thread.sleep(intervalMillis);
            } catch (InterruptedException e) {
                logger.info("Dispatcher interrupted, stopping");
                Thread.currentThread().interrupt();
                break;
            } catch (SQLException e) {
                logger.log(Level.SEVERE, "SQLException in dispatch loop", e);
                if (!backOff(intervalMillis * 2)) {
                    break;
                }
            } catch (Exception e) {
                logger.log(Level.SEVERE, "Unexpected error in dispatch loop", e);
                if (!backOff(intervalMillis)) {
                    break;
                }
            }
        }

        logger.info("Dispatch loop exited");
    }

    /**
     * One dispatch cycle.
     *
     * @return one future per runner launched in this cycle
     * @throws SQLException if cleanup or reservation fails; runners already launched keep going
     */
    public List<Future<?>> runOnce() throws SQLException {
        suppressions.removeExpired();

        List<Future<?>> launched = new ArrayList<>();
        Job job;
        while (!executorService.isShutdown() && (job = store.reserveNext()) != null) {
            logger.fine("Launching runner for job " + job.getId());
            try {
                launched.add(executorService.submit(runnerFactory.apply(job)));
            } catch (RejectedExecutionException e) {
                logger.warning("Runner pool is shut down, releasing job " + job.getId());
                store.release(job.getId());
                break;
            }
        }
        return launched;
    }

    private boolean backOff(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Stop the loop, let its current cycle finish, then wait for in-flight runners.
     */
    public void shutdown() {
        running.set(false);
        awaitLoopExit();
        logger.info("Dispatcher shutting down, waiting for running jobs");
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(60, TimeUnit.SECONDS)) {
                logger.warning("Jobs still running after 60s, interrupting them");
                executorService.shutdownNow();
                if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                    logger.severe("Runner pool did not terminate");
                }
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Dispatcher shutdown complete");
    }

    private void awaitLoopExit() {
        Thread loop = loopThread;
        if (loop == null || loop == Thread.currentThread()) {
            return;
        }
        try {
            loop.join(intervalMillis * 2 + 10_000);
            if (loop.isAlive()) {
                logger.warning("Dispatch loop still busy, closing the runner pool anyway");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private static class RunnerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "job-runner-" + counter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        }
    }
}
