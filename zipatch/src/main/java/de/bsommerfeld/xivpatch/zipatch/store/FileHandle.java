package de.bsommerfeld.xivpatch.zipatch.store;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;

/**
 * Seekable read/write handle on one file, owned by a {@link FileHandleStore}.
 * Writes are positional; there is no shared cursor between callers.
 */
public final class FileHandle implements Closeable {

    private static final int WIPE_BUFFER_SIZE = 64 * 1024;

    private final Path path;
    private final FileChannel channel;

    FileHandle(Path path, FileChannel channel) {
        this.path = path;
        this.channel = channel;
    }

    public Path path() {
        return path;
    }

    public boolean isOpen() {
        return channel.isOpen();
    }

    public long size() throws IOException {
        return channel.size();
    }

    public void writeAt(long offset, byte[] data) throws IOException {
        writeAt(offset, ByteBuffer.wrap(data));
    }

    public void writeAt(long offset, ByteBuffer buffer) throws IOException {
        long position = offset;
        while (buffer.hasRemaining()) {
            position += channel.write(buffer, position);
        }
    }

    /** Overwrites {@code length} bytes starting at {@code offset} with zeros. */
    public void wipe(long offset, long length) throws IOException {
        ByteBuffer zeros = ByteBuffer.allocate((int) Math.min(WIPE_BUFFER_SIZE, Math.max(length, 0)));
        long position = offset;
        long left = length;
        while (left > 0) {
            zeros.clear();
            zeros.limit((int) Math.min(zeros.capacity(), left));
            int written = channel.write(zeros, position);
            position += written;
            left -= written;
        }
    }

    public void truncate(long size) throws IOException {
        channel.truncate(size);
    }

    public int readAt(long offset, ByteBuffer target) throws IOException {
        return channel.read(target, offset);
    }

    @Override
    public void close() throws IOException {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.force(false);
        } finally {
            channel.close();
        }
    }
}
