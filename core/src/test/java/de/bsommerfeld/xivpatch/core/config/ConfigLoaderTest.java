package de.bsommerfeld.xivpatch.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldCreateDefaultsWhenFileIsMissing() throws IOException {
        Path configFile = tempDir.resolve("nested/config.json");

        PatcherConfig config = ConfigLoader.load(configFile);

        assertTrue(Files.exists(configFile));
        assertTrue(Files.readString(configFile).contains("\"version-check-host\""));
        assertEquals(3, config.getDownload().getMaxAttempts());
        assertEquals(2000, config.getDownload().getRetryDelayMillis());
        assertEquals(500, config.getDownload().getSpeedReportIntervalMillis());
        assertTrue(config.getInstall().isVerifyChunkCrc());
    }

    @Test
    void load_shouldMergePartialFileWithDefaults() throws IOException {
        Path configFile = tempDir.resolve("config.json");
        Files.writeString(configFile, """
                {
                  "download": { "max-attempts": 5, "verify-hashes": false },
                  "some-future-section": { "x": 1 }
                }
                """);

        PatcherConfig config = ConfigLoader.load(configFile);

        assertEquals(5, config.getDownload().getMaxAttempts());
        assertFalse(config.getDownload().isVerifyHashes());
        assertEquals(2000, config.getDownload().getRetryDelayMillis());
        assertEquals("ffxivtc_release_tc_game", config.getServer().getProduct());
    }

    @Test
    void load_shouldReadBackSavedConfig() throws IOException {
        Path configFile = tempDir.resolve("config.json");
        PatcherConfig original = new PatcherConfig();
        original.getInstall().setIgnoreMissing(false);
        ConfigLoader.save(original, configFile);

        PatcherConfig loaded = ConfigLoader.load(configFile);

        assertFalse(loaded.getInstall().isIgnoreMissing());
        assertEquals(original.getGame().getInstallPaths(), loaded.getGame().getInstallPaths());
    }

    @Test
    void load_shouldRejectMalformedJson() throws IOException {
        Path configFile = tempDir.resolve("config.json");
        Files.writeString(configFile, "{ not json");

        assertThrows(IOException.class, () -> ConfigLoader.load(configFile));
    }

    @Test
    void resolveConfigPath_shouldHonourSystemProperty() {
        String original = System.getProperty(ConfigLoader.PROPERTY);
        try {
            System.setProperty(ConfigLoader.PROPERTY, tempDir.resolve("custom.json").toString());
            assertEquals(tempDir.resolve("custom.json"), ConfigLoader.resolveConfigPath());
        } finally {
            if (original != null) {
                System.setProperty(ConfigLoader.PROPERTY, original);
            } else {
                System.clearProperty(ConfigLoader.PROPERTY);
            }
        }
    }

    @Test
    void versionCheckUrl_shouldEmbedBaseVersion() {
        ServerConfig server = new ServerConfig();

        assertEquals("http://patch-gamever.ffxiv.com.tw/http/win32/ffxivtc_release_tc_game/2025.05.01.0000.0000/",
                server.versionCheckUrl("2025.05.01.0000.0000"));
    }
}
