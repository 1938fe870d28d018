package de.bsommerfeld.xivpatch.updater.model;

/**
 * A version string does not have the form {@code YYYY.MM.DD.XXXX.YYYY}.
 */
public class VersionFormatException extends IllegalArgumentException {

    public VersionFormatException(String version) {
        super("Invalid game version: '" + version + "'");
    }
}
