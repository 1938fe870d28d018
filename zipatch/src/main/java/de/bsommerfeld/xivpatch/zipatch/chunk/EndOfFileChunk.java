package de.bsommerfeld.xivpatch.zipatch.chunk;

import de.bsommerfeld.xivpatch.zipatch.BinaryReader;
import de.bsommerfeld.xivpatch.zipatch.ZiPatchSession;

/**
 * {@code EOF_}: marks the end of the chunk stream.
 */
public record EndOfFileChunk(ChunkHeader header) implements Chunk {

    public static final String TAG = "EOF_";

    public static EndOfFileChunk decode(ChunkHeader header, BinaryReader reader) {
        return new EndOfFileChunk(header);
    }

    @Override
    public void apply(ZiPatchSession session) {
    }
}
