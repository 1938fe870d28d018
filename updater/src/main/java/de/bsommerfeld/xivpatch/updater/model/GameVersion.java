package de.bsommerfeld.xivpatch.updater.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A game version of the form {@code YYYY.MM.DD.XXXX.YYYY}.
 *
 * <p>
 * Every field is zero padded, so plain ordinal string comparison orders
 * versions chronologically. Anything that does not match the format is
 * rejected on construction, which keeps that guarantee for every instance.
 *
 * @param value the version string, e.g. {@code 2025.05.29.0000.0000}
 */
public record GameVersion(String value) implements Comparable<GameVersion> {

    /** Versions with this prefix are split parts of the full install package. */
    public static final String FULL_INSTALL_PREFIX = "2012.01.01";

    private static final Pattern FORMAT = Pattern.compile("\\d{4}\\.\\d{2}\\.\\d{2}\\.\\d{4}\\.\\d{4}");

    public GameVersion {
        Objects.requireNonNull(value, "value");
        if (!FORMAT.matcher(value).matches()) {
            throw new VersionFormatException(value);
        }
    }

    /**
     * Parses a version, ignoring surrounding whitespace.
     *
     * @throws VersionFormatException if the version is malformed
     */
    public static GameVersion parse(String raw) {
        if (raw == null) {
            throw new VersionFormatException("null");
        }
        return new GameVersion(raw.strip());
    }

    public boolean isFullInstallPackage() {
        return value.startsWith(FULL_INSTALL_PREFIX);
    }

    public boolean isNewerThan(GameVersion other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(GameVersion other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
