package de.bsommerfeld.xivpatch.zipatch.chunk;

import de.bsommerfeld.xivpatch.zipatch.BinaryReader;
import de.bsommerfeld.xivpatch.zipatch.ZiPatchSession;

/**
 * {@code APFS}: free space hint for the installer. Nothing to apply.
 */
public record ApplyFreeSpaceChunk(ChunkHeader header, long unknownA, long unknownB) implements Chunk {

    public static final String TAG = "APFS";

    public static ApplyFreeSpaceChunk decode(ChunkHeader header, BinaryReader reader) {
        return new ApplyFreeSpaceChunk(header, reader.readI64BE(), reader.readI64BE());
    }

    @Override
    public void apply(ZiPatchSession session) {
    }
}
