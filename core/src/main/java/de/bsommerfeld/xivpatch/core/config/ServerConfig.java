package de.bsommerfeld.xivpatch.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Patch server endpoints. The defaults target the Taiwanese distribution;
 * tests point {@code version-check-host} at a local server.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServerConfig {

    @JsonProperty("version-check-host")
    @JsonPropertyDescription("Host (and optional port) of the version check endpoint")
    private String versionCheckHost = "patch-gamever.ffxiv.com.tw";

    @JsonProperty("product")
    @JsonPropertyDescription("Product path segment of the version check endpoint")
    private String product = "ffxivtc_release_tc_game";

    @JsonProperty("patch-list-url")
    @JsonPropertyDescription("Complete patch list, used when no base game version exists locally")
    private String patchListUrl = "https://user-cdn.ffxiv.com.tw/launcher/patch/v2.txt";

    @JsonProperty("patch-url-scheme")
    @JsonPropertyDescription("Prefix every patch download URL must start with")
    private String patchUrlScheme = "http://";

    @JsonProperty("user-agent")
    @JsonPropertyDescription("User-Agent header sent with every request")
    private String userAgent = "XIVTCLauncher/1.0";

    @JsonProperty("request-timeout-seconds")
    @JsonPropertyDescription("Timeout for version check and patch list requests (default: 30)")
    private long requestTimeoutSeconds = 30;

    @JsonProperty("download-timeout-minutes")
    @JsonPropertyDescription("Timeout for a single patch download (default: 30)")
    private long downloadTimeoutMinutes = 30;

    public ServerConfig() {
    }

    public ServerConfig(String versionCheckHost, String patchListUrl) {
        this.versionCheckHost = versionCheckHost;
        this.patchListUrl = patchListUrl;
    }

    /**
     * Builds the version check URL for the given base game version, e.g.
     * {@code http://patch-gamever.ffxiv.com.tw/http/win32/ffxivtc_release_tc_game/2025.05.01.0000.0000/}.
     */
    public String versionCheckUrl(String baseVersion) {
        return "http://" + versionCheckHost + "/http/win32/" + product + "/" + baseVersion + "/";
    }

    public String getVersionCheckHost() {
        return versionCheckHost;
    }

    public String getProduct() {
        return product;
    }

    public String getPatchListUrl() {
        return patchListUrl;
    }

    public String getPatchUrlScheme() {
        return patchUrlScheme;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public long getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public long getDownloadTimeoutMinutes() {
        return downloadTimeoutMinutes;
    }
}
