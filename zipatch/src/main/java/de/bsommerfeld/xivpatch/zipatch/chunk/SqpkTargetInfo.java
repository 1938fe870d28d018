package de.bsommerfeld.xivpatch.zipatch.chunk;

import de.bsommerfeld.xivpatch.zipatch.BinaryReader;
import de.bsommerfeld.xivpatch.zipatch.ZiPatchSession;
import de.bsommerfeld.xivpatch.zipatch.sqpack.PlatformId;

/**
 * {@code SQPK T}: declares the target platform. Pack file names resolved by
 * later chunks use its platform infix.
 */
public record SqpkTargetInfo(ChunkHeader header, PlatformId platform, int region, boolean debug,
                             int version, long deletedDataSize, long seekCount) implements SqpkCommand {

    public static final char COMMAND = 'T';

    public static SqpkTargetInfo decode(ChunkHeader header, BinaryReader reader) {
        reader.skip(3);
        PlatformId platform = PlatformId.fromId(reader.readU16BE());
        int region = reader.readI16BE();
        boolean debug = reader.readI16BE() != 0;
        int version = reader.readU16BE();
        long deletedDataSize = reader.readI64LE();
        long seekCount = reader.readI64LE();
        return new SqpkTargetInfo(header, platform, region, debug, version, deletedDataSize, seekCount);
    }

    @Override
    public char command() {
        return COMMAND;
    }

    @Override
    public void apply(ZiPatchSession session) {
        session.setPlatform(platform);
    }
}
