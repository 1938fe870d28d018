package de.bsommerfeld.xivpatch.updater;

import java.nio.file.Path;

/**
 * A downloaded patch does not match the block hashes of the manifest.
 */
public class HashMismatchException extends UpdateException {

    private final int blockIndex;

    public HashMismatchException(Path file, int blockIndex) {
        super("Hash mismatch for " + file.getFileName() + " in block " + blockIndex);
        this.blockIndex = blockIndex;
    }

    public HashMismatchException(Path file, String message) {
        super("Hash mismatch for " + file.getFileName() + ": " + message);
        this.blockIndex = -1;
    }

    /** Index of the first mismatching block, or {@code -1} if the block count differs. */
    public int getBlockIndex() {
        return blockIndex;
    }
}
