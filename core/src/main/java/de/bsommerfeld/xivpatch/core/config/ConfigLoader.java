package de.bsommerfeld.xivpatch.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.bsommerfeld.xivpatch.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link PatcherConfig} from JSON. A missing file is created with the
 * defaults so users have something to edit after the first run.
 *
 * <p>
 * The location can be overridden with the {@code xivpatch.config} system
 * property or the {@code XIVPATCH_CONFIG} environment variable.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    static final String PROPERTY = "xivpatch.config";
    static final String ENVIRONMENT = "XIVPATCH_CONFIG";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private ConfigLoader() {
    }

    /** Resolves the config path: system property, environment, then app data. */
    public static Path resolveConfigPath() {
        String override = System.getProperty(PROPERTY);
        if (override == null || override.isEmpty()) {
            override = System.getenv(ENVIRONMENT);
        }
        if (override != null && !override.isEmpty()) {
            return Path.of(override);
        }
        return StorageUtils.appDataDir().resolve("config.json");
    }

    /**
     * Reads the config at {@code configPath}, writing defaults first if the
     * file does not exist yet.
     *
     * @throws IOException if the file exists but is not valid JSON
     */
    public static PatcherConfig load(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            PatcherConfig defaults = new PatcherConfig();
            save(defaults, configPath);
            LOG.info("Created default configuration at {}", configPath.toAbsolutePath());
            return defaults;
        }

        LOG.info("Loading configuration from {}", configPath.toAbsolutePath());
        return MAPPER.readValue(configPath.toFile(), PatcherConfig.class);
    }

    public static void save(PatcherConfig config, Path configPath) throws IOException {
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(configPath.toFile(), config);
    }
}
