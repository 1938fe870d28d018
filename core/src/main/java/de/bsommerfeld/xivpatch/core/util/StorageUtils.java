package de.bsommerfeld.xivpatch.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves the per-user data directory of the patcher following each
 * platform's native conventions. Paths are absolute but <strong>not</strong>
 * created; callers create them before writing.
 *
 * <ul>
 * <li><strong>Windows</strong>: {@code %APPDATA%\xivpatch} (fallback:
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/xivpatch}</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/xivpatch} (fallback:
 * {@code ~/.local/share})</li>
 * </ul>
 */
public final class StorageUtils {

    public static final String APP_NAME = "xivpatch";

    private StorageUtils() {
    }

    public static Path appDataDir() {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
        String home = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            return appData != null
                    ? Paths.get(appData, APP_NAME)
                    : Paths.get(home, "AppData", "Roaming", APP_NAME);
        }
        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(home, "Library", "Application Support", APP_NAME);
        }
        String xdgData = System.getenv("XDG_DATA_HOME");
        if (xdgData != null && !xdgData.isBlank()) {
            return Paths.get(xdgData, APP_NAME);
        }
        return Paths.get(home, ".local", "share", APP_NAME);
    }

    /** Downloaded patch files, one sub-directory per repository. */
    public static Path patchCacheDir() {
        return appDataDir().resolve("patches");
    }

    public static Path logsDir() {
        return appDataDir().resolve("logs");
    }
}
