package de.bsommerfeld.xivpatch.zipatch.chunk;

/**
 * Framing shared by every chunk.
 *
 * @param tag    four character type tag, e.g. {@code SQPK}
 * @param offset file offset of the chunk's length field
 * @param length declared payload length in bytes, excluding tag and CRC
 */
public record ChunkHeader(String tag, long offset, long length) {

    /** Bytes the chunk occupies on disk: length field, tag, payload and CRC. */
    public long totalSize() {
        return 4 + 4 + length + 4;
    }
}
