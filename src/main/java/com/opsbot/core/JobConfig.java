package com.opsbot.core;

/**
 * Run configuration for one job type. Read-only once the catalog is loaded.
 */
public class JobConfig {
    private final String runArgsTemplate;
    private final boolean reportStdout;
    private final ReportFormat reportFormat;
    private final boolean reportSuccess;
    private final boolean callTechSupportOnError;

    public JobConfig(String runArgsTemplate, boolean reportStdout, ReportFormat reportFormat,
                     boolean reportSuccess, boolean callTechSupportOnError) {
        if (runArgsTemplate == null || runArgsTemplate.isBlank()) {
            throw new IllegalArgumentException("run_args_template is required");
        }
        this.runArgsTemplate = runArgsTemplate;
        this.reportStdout = reportStdout;
        this.reportFormat = reportFormat == null ? ReportFormat.TEXT : reportFormat;
        this.reportSuccess = reportSuccess;
        this.callTechSupportOnError = callTechSupportOnError;
    }

    /**
     * Config with the catalog defaults: no stdout report, text format, bare success
     * reported, failures escalated.
     */
    public static JobConfig of(String runArgsTemplate) {
        return new JobConfig(runArgsTemplate, false, ReportFormat.TEXT, true, true);
    }

    public String getRunArgsTemplate() { return runArgsTemplate; }
    public boolean isReportStdout() { return reportStdout; }
    public ReportFormat getReportFormat() { return reportFormat; }
    public boolean isReportSuccess() { return reportSuccess; }
    public boolean isCallTechSupportOnError() { return callTechSupportOnError; }

    public JobConfig withReportStdout(ReportFormat format) {
        return new JobConfig(runArgsTemplate, true, format, reportSuccess, callTechSupportOnError);
    }

    public JobConfig withReportSuccess(boolean value) {
        return new JobConfig(runArgsTemplate, reportStdout, reportFormat, value, callTechSupportOnError);
    }

    public JobConfig withCallTechSupportOnError(boolean value) {
        return new JobConfig(runArgsTemplate, reportStdout, reportFormat, reportSuccess, value);
    }

    @Override
    public String toString() {
        return "JobConfig{template='" + runArgsTemplate + "', reportStdout=" + reportStdout
                + ", format=" + reportFormat + ", reportSuccess=" + reportSuccess
                + ", callTechSupportOnError=" + callTechSupportOnError + "}";
    }
}
