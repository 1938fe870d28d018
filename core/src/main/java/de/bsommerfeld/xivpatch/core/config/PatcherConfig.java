package de.bsommerfeld.xivpatch.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Root of {@code config.json}. Each section maps to one concern of the
 * patcher; missing sections fall back to their defaults so an outdated
 * config file from an older release still loads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PatcherConfig {

    @JsonProperty("server")
    @JsonPropertyDescription("Patch server endpoints")
    private ServerConfig server = new ServerConfig();

    @JsonProperty("download")
    @JsonPropertyDescription("Patch download behaviour")
    private DownloadConfig download = new DownloadConfig();

    @JsonProperty("install")
    @JsonPropertyDescription("Patch application behaviour")
    private InstallConfig install = new InstallConfig();

    @JsonProperty("game")
    @JsonPropertyDescription("Game installation lookup")
    private GameConfig game = new GameConfig();

    public ServerConfig getServer() {
        return server;
    }

    public DownloadConfig getDownload() {
        return download;
    }

    public InstallConfig getInstall() {
        return install;
    }

    public GameConfig getGame() {
        return game;
    }
}
