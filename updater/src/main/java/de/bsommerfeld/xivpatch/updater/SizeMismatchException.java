package de.bsommerfeld.xivpatch.updater;

import java.nio.file.Path;

/**
 * A downloaded patch does not have the size the manifest declared. The file
 * has already been deleted when this is thrown.
 */
public class SizeMismatchException extends UpdateException {

    private final long expected;
    private final long actual;

    public SizeMismatchException(Path file, long expected, long actual) {
        super("Size mismatch for " + file.getFileName() + ": expected " + expected + " bytes, got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public long getExpected() {
        return expected;
    }

    public long getActual() {
        return actual;
    }
}
