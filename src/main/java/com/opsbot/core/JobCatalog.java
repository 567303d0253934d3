package com.opsbot.core;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Job types known to the bot, keyed by {@code <namespace>_<job>}, plus the per-namespace
 * workspace settings.
 *
 * <p>The catalog is built once at startup, usually from a JSON file, and is only read
 * afterwards. Defaults for omitted job fields: {@code report_stdout=false},
 * {@code report_format=text}, {@code report_success=true},
 * {@code call_tech_support_on_error=true}.</p>
 */
public class JobCatalog {
    private static final Logger logger = Logger.getLogger(JobCatalog.class.getName());
    private static final Gson gson = new Gson();

    public static final String DEFAULT_SCRIPT_BUNDLE_FILE = "fabfile.py";

    private final Map<String, JobConfig> jobs = new LinkedHashMap<>();
    private final Map<String, Namespace> namespaces = new LinkedHashMap<>();

    /**
     * Workspace settings shared by every job of a namespace.
     */
    public static class Namespace {
        private final Path workspaceDir;
        private final String scriptBundleUrl;
        private final String scriptBundleFile;
        private final String defaultChannel;

        public Namespace(Path workspaceDir, String scriptBundleUrl, String scriptBundleFile, String defaultChannel) {
            this.workspaceDir = workspaceDir;
            this.scriptBundleUrl = scriptBundleUrl;
            this.scriptBundleFile = scriptBundleFile == null ? DEFAULT_SCRIPT_BUNDLE_FILE : scriptBundleFile;
            this.defaultChannel = defaultChannel;
        }

        public static Namespace defaults() {
            return new Namespace(null, null, null, null);
        }

        /** Override of the global workspace root, or null. */
        public Path getWorkspaceDir() { return workspaceDir; }
        /** URL of the auxiliary script bundle refreshed before each run, or null. */
        public String getScriptBundleUrl() { return scriptBundleUrl; }
        public String getScriptBundleFile() { return scriptBundleFile; }
        public String getDefaultChannel() { return defaultChannel; }
    }

    public JobCatalog register(String jobType, JobConfig config) {
        jobs.put(jobType, config);
        return this;
    }

    public JobCatalog namespace(String name, Namespace namespace) {
        namespaces.put(name, namespace);
        return this;
    }

    public boolean hasJob(String jobType) {
        return jobs.containsKey(jobType);
    }

    /**
     * @throws JobCatalogException if the type is not in the catalog
     */
    public JobConfig getConfig(String jobType) {
        JobConfig config = jobs.get(jobType);
        if (config == null) {
            throw new JobCatalogException("Unknown job type: " + jobType);
        }
        return config;
    }

    public Namespace getNamespace(String name) {
        return Optional.ofNullable(namespaces.get(name)).orElseGet(Namespace::defaults);
    }

    public Map<String, JobConfig> getJobs() {
        return Collections.unmodifiableMap(jobs);
    }

    public static JobCatalog load(Path file) {
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            JobCatalog catalog = fromJson(json);
            logger.info("Loaded " + catalog.jobs.size() + " job types from " + file);
            return catalog;
        } catch (IOException e) {
            throw new JobCatalogException("Cannot read job catalog " + file, e);
        }
    }

    public static JobCatalog fromJson(String json) {
        RawCatalog raw;
        try {
            raw = gson.fromJson(json, RawCatalog.class);
        } catch (JsonParseException e) {
            throw new JobCatalogException("Malformed job catalog", e);
        }

        JobCatalog catalog = new JobCatalog();
        if (raw == null || raw.namespaces == null) {
            return catalog;
        }

        for (Map.Entry<String, RawNamespace> nsEntry : raw.namespaces.entrySet()) {
            String ns = nsEntry.getKey();
            RawNamespace rawNs = nsEntry.getValue();
            if (ns.contains("_")) {
                throw new JobCatalogException("Namespace must not contain '_': " + ns);
            }
            catalog.namespace(ns, new Namespace(
                    rawNs.workspaceDir == null ? null : Paths.get(rawNs.workspaceDir),
                    rawNs.scriptBundleUrl,
                    rawNs.scriptBundleFile,
                    rawNs.defaultChannel));

            if (rawNs.jobs == null) {
                continue;
            }
            for (Map.Entry<String, RawJob> jobEntry : rawNs.jobs.entrySet()) {
                String jobType = ns + "_" + jobEntry.getKey();
                catalog.register(jobType, toConfig(jobType, jobEntry.getValue()));
            }
        }
        return catalog;
    }

    private static JobConfig toConfig(String jobType, RawJob raw) {
        try {
            return new JobConfig(
                    raw.runArgsTemplate,
                    raw.reportStdout != null && raw.reportStdout,
                    ReportFormat.fromConfigName(raw.reportFormat),
                    raw.reportSuccess == null || raw.reportSuccess,
                    raw.callTechSupportOnError == null || raw.callTechSupportOnError);
        } catch (IllegalArgumentException e) {
            throw new JobCatalogException("Invalid config for " + jobType + ": " + e.getMessage(), e);
        }
    }

    private static class RawCatalog {
        Map<String, RawNamespace> namespaces;
    }

    private static class RawNamespace {
        @SerializedName("workspace_dir")
        String workspaceDir;
        @SerializedName("script_bundle_url")
        String scriptBundleUrl;
        @SerializedName("script_bundle_file")
        String scriptBundleFile;
        @SerializedName("default_channel")
        String defaultChannel;
        Map<String, RawJob> jobs;
    }

    private static class RawJob {
        @SerializedName("run_args_template")
        String runArgsTemplate;
        @SerializedName("report_stdout")
        Boolean reportStdout;
        @SerializedName("report_format")
        String reportFormat;
        @SerializedName("report_success")
        Boolean reportSuccess;
        @SerializedName("call_tech_support_on_error")
        Boolean callTechSupportOnError;
    }
}
