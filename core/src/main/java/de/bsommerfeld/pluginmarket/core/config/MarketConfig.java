package de.bsommerfeld.pluginmarket.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Persisted user settings of the plugin market.
 *
 * <p>
 * Stored as JSON with snake_case keys. Unknown keys are ignored so that a
 * file written by a newer version still loads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MarketConfig {

    @JsonProperty("download_threads")
    private int downloadThreads = 8;

    @JsonProperty("worker_threads")
    private int workerThreads = 8;

    @JsonProperty("default_boot_drive")
    private String defaultBootRoot = "";

    @JsonProperty("default_download_path")
    private String defaultDownloadPath = "";

    @JsonProperty("probe_attempts")
    private int probeAttempts = 3;

    @JsonProperty("probe_timeout_seconds")
    private int probeTimeoutSeconds = 5;

    @JsonProperty("probe_retry_delay_seconds")
    private int probeRetryDelaySeconds = 1;

    /** Size of the HTTP client's executor. Never below 1. */
    public int getDownloadThreads() {
        return Math.max(1, downloadThreads);
    }

    public void setDownloadThreads(int downloadThreads) {
        this.downloadThreads = downloadThreads;
    }

    /** Size of the pool running fetches and lifecycle operations. Never below 1. */
    public int getWorkerThreads() {
        return Math.max(1, workerThreads);
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    /** Empty when no boot drive has been chosen. */
    public String getDefaultBootRoot() {
        return defaultBootRoot;
    }

    public void setDefaultBootRoot(String defaultBootRoot) {
        this.defaultBootRoot = defaultBootRoot == null ? "" : defaultBootRoot;
    }

    /** Empty when no download directory has been chosen. */
    public String getDefaultDownloadPath() {
        return defaultDownloadPath;
    }

    public void setDefaultDownloadPath(String defaultDownloadPath) {
        this.defaultDownloadPath = defaultDownloadPath == null ? "" : defaultDownloadPath;
    }

    public int getProbeAttempts() {
        return Math.max(1, probeAttempts);
    }

    public void setProbeAttempts(int probeAttempts) {
        this.probeAttempts = probeAttempts;
    }

    public int getProbeTimeoutSeconds() {
        return Math.max(1, probeTimeoutSeconds);
    }

    public void setProbeTimeoutSeconds(int probeTimeoutSeconds) {
        this.probeTimeoutSeconds = probeTimeoutSeconds;
    }

    public int getProbeRetryDelaySeconds() {
        return Math.max(0, probeRetryDelaySeconds);
    }

    public void setProbeRetryDelaySeconds(int probeRetryDelaySeconds) {
        this.probeRetryDelaySeconds = probeRetryDelaySeconds;
    }
}
