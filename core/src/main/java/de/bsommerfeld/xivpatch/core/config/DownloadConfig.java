package de.bsommerfeld.xivpatch.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import de.bsommerfeld.xivpatch.core.util.StorageUtils;

import java.nio.file.Path;

/**
 * Download parameters. Values are persisted in config.json and loaded at
 * startup.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DownloadConfig {

    @JsonProperty("patch-directory")
    @JsonPropertyDescription("Where downloaded patches are stored (empty: app data directory)")
    private String patchDirectory = "";

    @JsonProperty("max-attempts")
    @JsonPropertyDescription("Download attempts per patch before giving up (default: 3)")
    private int maxAttempts = 3;

    @JsonProperty("retry-delay-millis")
    @JsonPropertyDescription("Base delay between attempts, multiplied by the attempt number (default: 2000)")
    private long retryDelayMillis = 2000;

    @JsonProperty("speed-report-interval-millis")
    @JsonPropertyDescription("Interval between throughput/ETA updates (default: 500)")
    private long speedReportIntervalMillis = 500;

    @JsonProperty("verify-hashes")
    @JsonPropertyDescription("Check downloaded patches against the SHA-1 block hashes of the manifest")
    private boolean verifyHashes = true;

    @JsonProperty("keep-patches")
    @JsonPropertyDescription("Keep patch files after they were installed")
    private boolean keepPatches = true;

    public DownloadConfig() {
    }

    public DownloadConfig(Path patchDirectory, int maxAttempts, long retryDelayMillis) {
        this.patchDirectory = patchDirectory.toString();
        this.maxAttempts = maxAttempts;
        this.retryDelayMillis = retryDelayMillis;
    }

    /** Returns the configured patch directory, or the app data default when unset. */
    public Path resolvePatchDirectory() {
        if (patchDirectory == null || patchDirectory.isBlank()) {
            return StorageUtils.patchCacheDir();
        }
        return Path.of(patchDirectory);
    }

    public String getPatchDirectory() {
        return patchDirectory;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getRetryDelayMillis() {
        return retryDelayMillis;
    }

    public long getSpeedReportIntervalMillis() {
        return speedReportIntervalMillis;
    }

    public boolean isVerifyHashes() {
        return verifyHashes;
    }

    public void setVerifyHashes(boolean verifyHashes) {
        this.verifyHashes = verifyHashes;
    }

    public boolean isKeepPatches() {
        return keepPatches;
    }

    public void setKeepPatches(boolean keepPatches) {
        this.keepPatches = keepPatches;
    }
}
