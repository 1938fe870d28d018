package de.bsommerfeld.xivpatch.zipatch;

import de.bsommerfeld.xivpatch.zipatch.sqpack.PlatformId;
import de.bsommerfeld.xivpatch.zipatch.store.FileHandle;
import de.bsommerfeld.xivpatch.zipatch.store.FileHandleStore;

import java.io.IOException;
import java.nio.file.Path;

/**
 * State shared by all chunks of one patch file while it is applied: the game
 * directory, the target platform, the apply options switched by
 * {@code APLY} chunks and the {@link FileHandleStore}.
 *
 * <p>
 * Closing the session closes the store. Use try-with-resources so handles
 * are released on failure as well.
 */
public final class ZiPatchSession implements AutoCloseable {

    private final Path gameDir;
    private final FileHandleStore store;

    private PlatformId platform = PlatformId.WIN32;
    private boolean ignoreMissing;
    private boolean ignoreOldMismatch;

    public ZiPatchSession(Path gameDir, boolean ignoreMissing) {
        this(gameDir, new FileHandleStore(), ignoreMissing);
    }

    ZiPatchSession(Path gameDir, FileHandleStore store, boolean ignoreMissing) {
        this.gameDir = gameDir.toAbsolutePath().normalize();
        this.store = store;
        this.ignoreMissing = ignoreMissing;
    }

    public Path gameDir() {
        return gameDir;
    }

    public FileHandleStore store() {
        return store;
    }

    /**
     * Resolves a path from the patch against the game directory. Leading
     * separators are ignored and backslashes are treated as separators.
     *
     * @param chunkType reported in the exception when the path is rejected
     * @throws ChunkApplyException if the path leaves the game directory
     */
    public Path resolve(String chunkType, String relativePath) throws ChunkApplyException {
        String cleaned = relativePath.replace('\\', '/');
        while (cleaned.startsWith("/")) {
            cleaned = cleaned.substring(1);
        }
        Path resolved = gameDir.resolve(cleaned).normalize();
        if (!resolved.startsWith(gameDir)) {
            throw new ChunkApplyException(chunkType, resolved, "path escapes the game directory");
        }
        return resolved;
    }

    /** Resolves and acquires a pack file handle in one step. */
    public FileHandle acquire(String chunkType, String relativePath) throws ChunkApplyException {
        Path path = resolve(chunkType, relativePath);
        try {
            return store.acquire(path);
        } catch (IOException e) {
            throw new ChunkApplyException(chunkType, path, "cannot open file", e);
        }
    }

    public PlatformId platform() {
        return platform;
    }

    public void setPlatform(PlatformId platform) {
        this.platform = platform;
    }

    public boolean ignoreMissing() {
        return ignoreMissing;
    }

    public void setIgnoreMissing(boolean ignoreMissing) {
        this.ignoreMissing = ignoreMissing;
    }

    /**
     * Recorded from {@code APLY} chunks only. No executor compares old
     * content before overwriting it, so the flag changes nothing yet.
     */
    public boolean ignoreOldMismatch() {
        return ignoreOldMismatch;
    }

    public void setIgnoreOldMismatch(boolean ignoreOldMismatch) {
        this.ignoreOldMismatch = ignoreOldMismatch;
    }

    @Override
    public void close() throws IOException {
        store.close();
    }
}
