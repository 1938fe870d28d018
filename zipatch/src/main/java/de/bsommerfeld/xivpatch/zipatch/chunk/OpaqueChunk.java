package de.bsommerfeld.xivpatch.zipatch.chunk;

import de.bsommerfeld.xivpatch.zipatch.ZiPatchSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A chunk whose tag (or SQPK command) is not known. Its payload was skipped
 * and applying it does nothing, so newer patch formats do not break older
 * installers.
 *
 * @param kind the unknown tag, or {@code SQPK:<command>}
 */
public record OpaqueChunk(ChunkHeader header, String kind) implements Chunk {

    private static final Logger LOG = LoggerFactory.getLogger(OpaqueChunk.class);

    @Override
    public String type() {
        return kind;
    }

    @Override
    public void apply(ZiPatchSession session) {
        LOG.debug("Skipping unknown chunk {} at offset {}", kind, header.offset());
    }
}
