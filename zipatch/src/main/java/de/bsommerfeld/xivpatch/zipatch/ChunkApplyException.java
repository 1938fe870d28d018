package de.bsommerfeld.xivpatch.zipatch;

import java.nio.file.Path;

/**
 * A chunk's filesystem effect failed. Carries the chunk type and the target
 * path so the failure can be traced back to the patch content.
 */
public class ChunkApplyException extends ZiPatchException {

    private final String chunkType;
    private final Path path;

    public ChunkApplyException(String chunkType, Path path, String message) {
        super(format(chunkType, path, message));
        this.chunkType = chunkType;
        this.path = path;
    }

    public ChunkApplyException(String chunkType, Path path, String message, Throwable cause) {
        super(format(chunkType, path, message), cause);
        this.chunkType = chunkType;
        this.path = path;
    }

    public String getChunkType() {
        return chunkType;
    }

    public Path getPath() {
        return path;
    }

    private static String format(String chunkType, Path path, String message) {
        return chunkType + " on " + path + ": " + message;
    }
}
