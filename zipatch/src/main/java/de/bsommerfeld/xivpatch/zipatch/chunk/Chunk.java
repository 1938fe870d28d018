package de.bsommerfeld.xivpatch.zipatch.chunk;

import de.bsommerfeld.xivpatch.zipatch.ChunkApplyException;
import de.bsommerfeld.xivpatch.zipatch.ZiPatchSession;

/**
 * One decoded operation of a ZiPatch file. The set of variants is closed;
 * tags the decoder does not know become an {@link OpaqueChunk}.
 *
 * <h3>Application</h3>
 * {@link #apply(ZiPatchSession)} performs the chunk's filesystem effect
 * relative to the session's game directory. Chunks must be applied in
 * stream order, one at a time. Every variant may be applied again after a
 * partial run without failing on state the first run already produced.
 */
public sealed interface Chunk permits FileHeaderChunk, ApplyOptionChunk, ApplyFreeSpaceChunk,
        AddDirectoryChunk, DeleteDirectoryChunk, EndOfFileChunk, OpaqueChunk, SqpkCommand {

    ChunkHeader header();

    /**
     * Type name used in logs and errors: the tag, or {@code SQPK:<command>}
     * for SQPK commands.
     */
    default String type() {
        return header().tag();
    }

    /**
     * @throws ChunkApplyException if the filesystem effect fails
     */
    void apply(ZiPatchSession session) throws ChunkApplyException;
}
