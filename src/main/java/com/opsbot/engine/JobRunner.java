package com.opsbot.engine;

import com.opsbot.app.Settings;
import com.opsbot.core.Job;
import com.opsbot.core.JobCatalog;
import com.opsbot.core.JobConfig;
import com.opsbot.core.ReportFormat;
import com.opsbot.db.JobStore;
import com.opsbot.notify.ChatClientException;
import com.opsbot.notify.MessageRef;
import com.opsbot.notify.Notifier;
import org.json.JSONArray;
import org.json.JSONException;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one reserved job as a shell process and reports the outcome to chat.
 *
 * <p>States: {@code STARTING -> RUNNING -> REPORTING -> DONE}.</p>
 * <ol>
 *   <li><b>Starting:</b> create the namespace working directory, refresh the script
 *       bundle if one is configured, create a fresh log directory holding
 *       {@code stdout} and {@code stderr}.</li>
 *   <li><b>Running:</b> post the start notice, then run the rendered command with
 *       {@code /bin/sh -c} in the working directory, output redirected to the log files
 *       and stdin read from {@code /dev/null}.</li>
 *   <li><b>Reporting:</b> mark the job done, then post success output or a failure
 *       message (escalated to tech-support unless disabled or in a private conversation).</li>
 * </ol>
 *
 * <p>{@link #run()} never throws. A command that cannot even be started is recorded in
 * the stderr file and reported as a failure with exit code {@link #FAILED_TO_START}.</p>
 *
 * @see Dispatcher
 */
public class JobRunner implements Runnable {
    private static final Logger logger = Logger.getLogger(JobRunner.class.getName());

    public static final int FAILED_TO_START = -1;
    static final String STDOUT_FILE = "stdout";
    static final String STDERR_FILE = "stderr";
    private static final DateTimeFormatter LOG_DIR_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    public enum State { STARTING, RUNNING, REPORTING, DONE }

    private final Job job;
    private final JobCatalog catalog;
    private final JobStore store;
    private final Notifier notifier;
    private final ScriptBundleFetcher bundleFetcher;
    private final Settings settings;
    private final String channel;

    private volatile State state = State.STARTING;
    private volatile int exitCode = FAILED_TO_START;
    private Path workingDir;
    private Path logDir;
    private Path hostLogDir;
    private String setupFailure;

    public JobRunner(Job job, JobCatalog catalog, JobStore store, Notifier notifier,
                     ScriptBundleFetcher bundleFetcher, Settings settings) {
        this.job = job;
        this.catalog = catalog;
        this.store = store;
        this.notifier = notifier;
        this.bundleFetcher = bundleFetcher;
        this.settings = settings;
        this.channel = destination(job, catalog, settings);
    }

    // the requester's channel, else the namespace default, else the logs channel
    private static String destination(Job job, JobCatalog catalog, Settings settings) {
        if (job.getChannel() != null && !job.getChannel().isBlank()) {
            return job.getChannel();
        }
        String fallback = catalog.getNamespace(job.getNamespace()).getDefaultChannel();
        return fallback != null ? fallback : settings.getLogsChannel();
    }

    @Override
    public void run() {
        logger.info("Runner starting job " + job.getId() + " (type: " + job.getType() + ")");

        try {
            prepare();
            state = State.RUNNING;
            notifier.post(channel, "Command `" + job.getType() + "` about to start",
                    job.getThreadTs(), ReportFormat.TEXT);
            exitCode = execute();
        } catch (IOException | RuntimeException e) {
            logger.log(Level.SEVERE, "Job " + job.getId() + " could not be prepared", e);
            setupFailure = e.toString();
            if (logDir != null) {
                recordStartFailure(logDir.resolve(STDERR_FILE), e);
            }
            exitCode = FAILED_TO_START;
        }

        state = State.REPORTING;
        markDone();
        try {
            report();
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Reporting failed for job " + job.getId(), e);
        }

        state = State.DONE;
        logger.info("Runner finished job " + job.getId() + " with exit code " + exitCode);
    }

    private void prepare() throws IOException {
        String namespace = job.getNamespace();
        JobCatalog.Namespace ns = catalog.getNamespace(namespace);

        Path root = ns.getWorkspaceDir() != null ? ns.getWorkspaceDir() : settings.getWorkspaceDir();
        workingDir = root.resolve(namespace);
        Files.createDirectories(workingDir);

        if (ns.getScriptBundleUrl() != null) {
            refreshBundle(ns);
        }

        createLogDir();
        Files.createFile(logDir.resolve(STDOUT_FILE));
        Files.createFile(logDir.resolve(STDERR_FILE));
    }

    private void refreshBundle(JobCatalog.Namespace ns) {
        String url = ns.getScriptBundleUrl();
        try {
            bundleFetcher.fetch(url, workingDir.resolve(ns.getScriptBundleFile()));
        } catch (IOException | IllegalArgumentException e) {
            logger.warning("Could not refresh " + url + " for job " + job.getId() + ": " + e.getMessage());
            notifier.post(settings.getLogsChannel(), "Could not refresh " + url + ": " + e.getMessage());
        }
    }

    // <logs>/<type>/<yyyyMMdd-HHmmss>[-n]; createDirectory fails atomically on a taken name
    private void createLogDir() throws IOException {
        Path typeDir = settings.getLogsDir().resolve(job.getType());
        Files.createDirectories(typeDir);

        String stamp = LOG_DIR_FORMAT.format(store.now());
        for (int suffix = 0; ; suffix++) {
            String name = suffix == 0 ? stamp : stamp + "-" + suffix;
            try {
                logDir = Files.createDirectory(typeDir.resolve(name));
                hostLogDir = settings.getHostLogsDir().resolve(Paths.get(job.getType(), name));
                return;
            } catch (FileAlreadyExistsException e) {
                logger.fine("Log directory " + name + " taken, trying next suffix");
            }
        }
    }

    private int execute() {
        Path stdout = logDir.resolve(STDOUT_FILE);
        Path stderr = logDir.resolve(STDERR_FILE);
        Process process = null;
        try {
            JobConfig config = catalog.getConfig(job.getType());
            String command = CommandTemplate.render(config.getRunArgsTemplate(), job.getArgs());

            ProcessBuilder builder = new ProcessBuilder("/bin/sh", "-c", command)
                    .directory(workingDir.toFile())
                    .redirectInput(ProcessBuilder.Redirect.from(new File("/dev/null")))
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile());
            customizePath(builder.environment());

            logger.info("Job " + job.getId() + " running `" + command + "` in " + workingDir
                    + ", stdout=" + stdout + ", stderr=" + stderr);
            process = builder.start();
            int code = process.waitFor();
            logger.info("Job " + job.getId() + " exited with " + code);
            return code;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroy();
            }
            recordStartFailure(stderr, e);
            return FAILED_TO_START;
        } catch (IOException | RuntimeException e) {
            logger.log(Level.WARNING, "Job " + job.getId() + " failed to start", e);
            recordStartFailure(stderr, e);
            return FAILED_TO_START;
        }
    }

    private void customizePath(Map<String, String> env) {
        String bin = settings.getAbsoluteBin();
        if (bin == null) {
            return;
        }
        String path = env.getOrDefault("PATH", "");
        if (path.equals(bin) || path.startsWith(bin + File.pathSeparator)) {
            return;
        }
        env.put("PATH", path.isEmpty() ? bin : bin + File.pathSeparator + path);
    }

    private void recordStartFailure(Path stderr, Exception e) {
        StringWriter trace = new StringWriter();
        e.printStackTrace(new PrintWriter(trace));
        try {
            Files.writeString(stderr, trace.toString(), StandardCharsets.UTF_8);
        } catch (IOException io) {
            logger.log(Level.SEVERE, "Cannot write " + stderr, io);
        }
    }

    // Done before reporting: a slow or failed notification must not cause a re-run.
    private void markDone() {
        try {
            if (!store.markDone(job.getId())) {
                logger.warning("Job " + job.getId() + " was not in reserved state when marking done");
            }
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to mark job " + job.getId() + " done", e);
        }
    }

    private void report() {
        JobConfig config = catalog.hasJob(job.getType()) ? catalog.getConfig(job.getType()) : null;
        if (exitCode == 0 && config != null) {
            reportSuccess(config);
        } else {
            reportFailure(config == null || config.isCallTechSupportOnError());
        }
    }

    private void reportSuccess(JobConfig config) {
        String type = job.getType();
        if (config.isReportStdout()) {
            String output = readStdout();
            if (output.isBlank()) {
                notifier.post(channel, "No output found for command `" + type + "`",
                        job.getThreadTs(), ReportFormat.TEXT);
            } else if (config.getReportFormat() == ReportFormat.BLOCKS) {
                postBlocks(output);
            } else {
                notifier.post(channel, output, job.getThreadTs(), config.getReportFormat());
            }
        } else if (config.isReportSuccess()) {
            notifier.post(channel, "Command `" + type + "` succeeded", job.getThreadTs(), ReportFormat.TEXT);
        }
    }

    private void postBlocks(String output) {
        JSONArray blocks;
        try {
            blocks = new JSONArray(output);
        } catch (JSONException e) {
            logger.warning("Job " + job.getId() + " output is not a JSON block array, posting as text");
            notifier.post(channel, output, job.getThreadTs(), ReportFormat.TEXT);
            return;
        }
        notifier.postBlocks(channel, blocks, job.getThreadTs());
    }

    private String readStdout() {
        if (logDir == null) {
            return "";
        }
        try {
            return Files.readString(logDir.resolve(STDOUT_FILE), StandardCharsets.UTF_8).stripTrailing();
        } catch (IOException e) {
            logger.log(Level.WARNING, "Cannot read stdout of job " + job.getId(), e);
            return "";
        }
    }

    private void reportFailure(boolean callTechSupport) {
        boolean escalate = callTechSupport && !job.isIm();
        MessageRef failure = notifier.post(channel, failureText(escalate),
                job.getThreadTs(), ReportFormat.TEXT);

        if (!escalate) {
            return;
        }
        if (failure == null || failure.getTs() == null) {
            logger.warning("Failure message for job " + job.getId() + " was not delivered, skipping escalation");
            return;
        }
        try {
            String permalink = notifier.getClient().getPermalink(failure.getChannel(), failure.getTs());
            notifier.post(settings.getTechSupportChannel(), permalink);
        } catch (ChatClientException e) {
            logger.log(Level.WARNING, "Could not escalate job " + job.getId(), e);
        }
    }

    String failureText(boolean escalate) {
        StringBuilder text = new StringBuilder()
                .append("Command `").append(job.getType()).append("` failed.");
        if (setupFailure != null && hostLogDir == null) {
            text.append("\nCould not prepare it: ").append(setupFailure);
            if (escalate) {
                text.append("\nCalling tech-support.");
            }
            return text.toString();
        }

        String where = hostLogDir == null ? "(no log directory)" : hostLogDir.toString();
        String app = settings.getAppUsername();
        text.append("\n")
                .append("Find logs in ").append(where).append(" on ").append(settings.getLogsHost()).append(".\n")
                .append("Or check logs here with `showlogs head/tail/all`, e.g.\n")
                .append("* `@").append(app).append(" showlogs tail error ").append(where).append("`\n")
                .append("* `@").append(app).append(" showlogs all output ").append(where).append("`");
        if (escalate) {
            text.append("\nCalling tech-support.");
        }
        return text.toString();
    }

    public Job getJob() { return job; }
    public State getState() { return state; }
    public int getExitCode() { return exitCode; }
    /** Local log directory, or null if it could not be created. */
    public Path getLogDir() { return logDir; }
    /** The log directory as seen from the logs host. */
    public Path getHostLogDir() { return hostLogDir; }
    public Path getWorkingDir() { return workingDir; }
    /** Where the notices and reports of this job go. */
    public String getChannel() { return channel; }
}
