package de.bsommerfeld.xivpatch.zipatch;

/**
 * The patch file is malformed: bad magic, truncated stream, a length field
 * inconsistent with the remaining bytes, a CRC mismatch or a payload its
 * decoder cannot fit into. The rest of the file cannot be trusted.
 */
public class ChunkDecodeException extends ZiPatchException {

    private final long offset;

    public ChunkDecodeException(String message, long offset) {
        super(message + " (at offset " + offset + ")");
        this.offset = offset;
    }

    public ChunkDecodeException(String message, long offset, Throwable cause) {
        super(message + " (at offset " + offset + ")", cause);
        this.offset = offset;
    }

    /** File offset of the chunk being decoded when the failure occurred. */
    public long getOffset() {
        return offset;
    }
}
