package de.bsommerfeld.xivpatch.zipatch.chunk;

import de.bsommerfeld.xivpatch.zipatch.BinaryReader;
import de.bsommerfeld.xivpatch.zipatch.ZiPatchSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code APLY}: switches an apply option for the remainder of the session.
 */
public record ApplyOptionChunk(ChunkHeader header, long option, boolean value) implements Chunk {

    public static final String TAG = "APLY";

    public static final long IGNORE_MISSING = 1;
    public static final long IGNORE_OLD_MISMATCH = 2;

    private static final Logger LOG = LoggerFactory.getLogger(ApplyOptionChunk.class);

    public static ApplyOptionChunk decode(ChunkHeader header, BinaryReader reader) {
        long option = reader.readU32BE();
        reader.skip(4);
        boolean value = reader.readU32BE() != 0;
        return new ApplyOptionChunk(header, option, value);
    }

    @Override
    public void apply(ZiPatchSession session) {
        if (option == IGNORE_MISSING) {
            session.setIgnoreMissing(value);
        } else if (option == IGNORE_OLD_MISMATCH) {
            session.setIgnoreOldMismatch(value);
        } else {
            LOG.warn("Ignoring unknown apply option {} = {}", option, value);
        }
    }
}
