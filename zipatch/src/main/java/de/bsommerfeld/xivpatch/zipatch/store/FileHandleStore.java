package de.bsommerfeld.xivpatch.zipatch.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Session-scoped cache of open file handles keyed by absolute, normalized
 * path. Every chunk touching the same pack file gets the same handle, so
 * writes of earlier chunks are visible to later ones without reopening.
 *
 * <h3>Lifecycle</h3>
 * Handles open lazily on the first {@link #acquire(Path)} and stay open
 * until {@link #release(Path)} or {@link #close()}. Closing flushes and
 * closes every handle; the first failure is rethrown with the others
 * attached as suppressed exceptions. A closed store cannot be reused.
 *
 * <p>
 * Not thread-safe. A store belongs to exactly one install session.
 */
public final class FileHandleStore implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(FileHandleStore.class);

    private final Map<Path, FileHandle> handles = new LinkedHashMap<>();
    private boolean closed;

    /**
     * Returns the handle for {@code path}, opening it on first use. Missing
     * parent directories are created; a missing file is created empty.
     *
     * @throws IOException if the file cannot be opened
     */
    public FileHandle acquire(Path path) throws IOException {
        ensureOpen();
        Path key = canonical(path);
        FileHandle existing = handles.get(key);
        if (existing != null) {
            return existing;
        }

        Path parent = key.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        FileChannel channel = FileChannel.open(key,
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
        FileHandle handle = new FileHandle(key, channel);
        handles.put(key, handle);
        LOG.debug("Opened {}", key);
        return handle;
    }

    /**
     * Closes and forgets the handle for {@code path}, if any. Needed before a
     * file is deleted or replaced from outside the store.
     */
    public void release(Path path) throws IOException {
        ensureOpen();
        FileHandle handle = handles.remove(canonical(path));
        if (handle != null) {
            handle.close();
            LOG.debug("Released {}", handle.path());
        }
    }

    public boolean isOpen(Path path) {
        return handles.containsKey(canonical(path));
    }

    public int openHandles() {
        return handles.size();
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;

        List<IOException> failures = new ArrayList<>();
        for (FileHandle handle : handles.values()) {
            try {
                handle.close();
            } catch (IOException e) {
                failures.add(e);
            }
        }
        LOG.debug("Closed {} file handle(s)", handles.size());
        handles.clear();

        if (!failures.isEmpty()) {
            IOException first = failures.get(0);
            for (int i = 1; i < failures.size(); i++) {
                first.addSuppressed(failures.get(i));
            }
            throw first;
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("File handle store is closed");
        }
    }

    private static Path canonical(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
