package de.bsommerfeld.xivpatch.launcher;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.xivpatch.core.config.ConfigLoader;
import de.bsommerfeld.xivpatch.core.config.DownloadConfig;
import de.bsommerfeld.xivpatch.core.config.GameConfig;
import de.bsommerfeld.xivpatch.core.config.InstallConfig;
import de.bsommerfeld.xivpatch.core.config.PatcherConfig;
import de.bsommerfeld.xivpatch.core.config.ServerConfig;
import de.bsommerfeld.xivpatch.zipatch.ZiPatchInstaller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Guice module wiring the patcher. Clients, planner, downloader and
 * coordinator are bound just in time through their {@code @Inject}
 * constructors.
 */
public class PatcherModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(PatcherModule.class);

    private final PatcherConfig preloaded;

    /** Loads the configuration from {@link ConfigLoader#resolveConfigPath()}. */
    public PatcherModule() {
        this(null);
    }

    public PatcherModule(PatcherConfig config) {
        this.preloaded = config;
    }

    @Override
    protected void configure() {
        PatcherConfig config = preloaded != null ? preloaded : loadConfig();

        bind(PatcherConfig.class).toInstance(config);

        // Sections are injected directly by the components that need them
        bind(ServerConfig.class).toInstance(config.getServer());
        bind(DownloadConfig.class).toInstance(config.getDownload());
        bind(InstallConfig.class).toInstance(config.getInstall());
        bind(GameConfig.class).toInstance(config.getGame());
    }

    @Provides
    @Singleton
    HttpClient httpClient(ServerConfig server) {
        // Patch URLs are plain http and may redirect to a mirror
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(server.getRequestTimeoutSeconds()))
                .build();
    }

    @Provides
    @Singleton
    ZiPatchInstaller ziPatchInstaller(InstallConfig install) {
        return new ZiPatchInstaller(install);
    }

    private static PatcherConfig loadConfig() {
        Path configPath = ConfigLoader.resolveConfigPath();
        LOG.info("Loading configuration from: {}", configPath.toAbsolutePath());
        try {
            return ConfigLoader.load(configPath);
        } catch (IOException e) {
            // Config is vital, fail fast
            throw new IllegalStateException("Failed to load configuration from " + configPath, e);
        }
    }
}
