package de.bsommerfeld.xivpatch.zipatch;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * An opened ZiPatch file. The magic is checked on open; the chunks are read
 * lazily through {@link #chunks()}, which may be called only once because
 * the stream cannot be rewound.
 */
public final class ZiPatchFile implements Closeable {

    /** {@code \x91ZIPATCH\r\n\x1a\n} */
    public static final byte[] MAGIC = {
            (byte) 0x91, 0x5A, 0x49, 0x50, 0x41, 0x54, 0x43, 0x48, 0x0D, 0x0A, 0x1A, 0x0A
    };

    private static final int BUFFER_SIZE = 256 * 1024;

    private final InputStream in;
    private final long length;
    private final boolean verifyCrc;
    private boolean consumed;

    private ZiPatchFile(InputStream in, long length, boolean verifyCrc) {
        this.in = in;
        this.length = length;
        this.verifyCrc = verifyCrc;
    }

    /**
     * Opens a patch file from disk.
     *
     * @throws ChunkDecodeException if the file does not start with the magic
     */
    public static ZiPatchFile open(Path path, boolean verifyCrc) throws IOException {
        InputStream in = new BufferedInputStream(Files.newInputStream(path), BUFFER_SIZE);
        try {
            return open(in, Files.size(path), verifyCrc);
        } catch (IOException e) {
            in.close();
            throw e;
        }
    }

    /** Opens an in-memory patch image. */
    public static ZiPatchFile open(byte[] image, boolean verifyCrc) throws IOException {
        return open(new ByteArrayInputStream(image), image.length, verifyCrc);
    }

    private static ZiPatchFile open(InputStream in, long length, boolean verifyCrc) throws IOException {
        byte[] magic = in.readNBytes(MAGIC.length);
        if (!Arrays.equals(magic, MAGIC)) {
            throw new ChunkDecodeException("Not a ZiPatch file", 0);
        }
        return new ZiPatchFile(in, length, verifyCrc);
    }

    /** Total file length in bytes. */
    public long length() {
        return length;
    }

    /**
     * @throws IllegalStateException if called a second time
     */
    public ChunkStream chunks() {
        if (consumed) {
            throw new IllegalStateException("Chunk stream can only be read once");
        }
        consumed = true;
        return new ChunkStream(in, MAGIC.length, length, verifyCrc);
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
