package de.bsommerfeld.xivpatch.zipatch;

import de.bsommerfeld.xivpatch.zipatch.chunk.Chunk;
import de.bsommerfeld.xivpatch.zipatch.chunk.ChunkHeader;

/**
 * Decodes the payload of one chunk type. The reader is bounded to the
 * chunk's payload; bytes a decoder leaves unread are skipped by the stream.
 */
@FunctionalInterface
public interface ChunkDecoder {

    Chunk decode(ChunkHeader header, BinaryReader payload) throws ChunkDecodeException;
}
