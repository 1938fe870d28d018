package de.bsommerfeld.xivpatch.zipatch.chunk;

import de.bsommerfeld.xivpatch.zipatch.BinaryReader;
import de.bsommerfeld.xivpatch.zipatch.ZiPatchSession;

/**
 * {@code SQPK X}: install size information. Nothing to apply.
 */
public record SqpkPatchInfo(ChunkHeader header, int status, int version, long installSize)
        implements SqpkCommand {

    public static final char COMMAND = 'X';

    public static SqpkPatchInfo decode(ChunkHeader header, BinaryReader reader) {
        int status = reader.readU8();
        int version = reader.readU8();
        reader.skip(1);
        return new SqpkPatchInfo(header, status, version, reader.readI64BE());
    }

    @Override
    public char command() {
        return COMMAND;
    }

    @Override
    public void apply(ZiPatchSession session) {
    }
}
