package de.bsommerfeld.xivpatch.zipatch;

import com.google.common.collect.ImmutableMap;
import de.bsommerfeld.xivpatch.zipatch.chunk.AddDirectoryChunk;
import de.bsommerfeld.xivpatch.zipatch.chunk.ApplyFreeSpaceChunk;
import de.bsommerfeld.xivpatch.zipatch.chunk.ApplyOptionChunk;
import de.bsommerfeld.xivpatch.zipatch.chunk.Chunk;
import de.bsommerfeld.xivpatch.zipatch.chunk.ChunkHeader;
import de.bsommerfeld.xivpatch.zipatch.chunk.DeleteDirectoryChunk;
import de.bsommerfeld.xivpatch.zipatch.chunk.EndOfFileChunk;
import de.bsommerfeld.xivpatch.zipatch.chunk.FileHeaderChunk;
import de.bsommerfeld.xivpatch.zipatch.chunk.OpaqueChunk;
import de.bsommerfeld.xivpatch.zipatch.chunk.SqpkAddData;
import de.bsommerfeld.xivpatch.zipatch.chunk.SqpkDeleteData;
import de.bsommerfeld.xivpatch.zipatch.chunk.SqpkExpandData;
import de.bsommerfeld.xivpatch.zipatch.chunk.SqpkFileOperations;
import de.bsommerfeld.xivpatch.zipatch.chunk.SqpkHeader;
import de.bsommerfeld.xivpatch.zipatch.chunk.SqpkIndex;
import de.bsommerfeld.xivpatch.zipatch.chunk.SqpkPatchInfo;
import de.bsommerfeld.xivpatch.zipatch.chunk.SqpkTargetInfo;

import java.util.Map;

/**
 * Registration table from chunk tag to decoder, and from SQPK command to
 * decoder. Tags and commands missing from the tables decode to an
 * {@link OpaqueChunk}.
 */
public final class ChunkDecoders {

    public static final String SQPK_TAG = "SQPK";

    private static final Map<Character, ChunkDecoder> SQPK_COMMANDS = ImmutableMap.<Character, ChunkDecoder>builder()
            .put(SqpkAddData.COMMAND, SqpkAddData::decode)
            .put(SqpkDeleteData.COMMAND, SqpkDeleteData::decode)
            .put(SqpkExpandData.COMMAND, SqpkExpandData::decode)
            .put(SqpkHeader.COMMAND, SqpkHeader::decode)
            .put(SqpkFileOperations.COMMAND, SqpkFileOperations::decode)
            .put(SqpkTargetInfo.COMMAND, SqpkTargetInfo::decode)
            .put(SqpkIndex.COMMAND, SqpkIndex::decode)
            .put(SqpkPatchInfo.COMMAND, SqpkPatchInfo::decode)
            .build();

    private static final Map<String, ChunkDecoder> CHUNKS = ImmutableMap.<String, ChunkDecoder>builder()
            .put(FileHeaderChunk.TAG, FileHeaderChunk::decode)
            .put(ApplyOptionChunk.TAG, ApplyOptionChunk::decode)
            .put(ApplyFreeSpaceChunk.TAG, ApplyFreeSpaceChunk::decode)
            .put(AddDirectoryChunk.TAG, AddDirectoryChunk::decode)
            .put(DeleteDirectoryChunk.TAG, DeleteDirectoryChunk::decode)
            .put(EndOfFileChunk.TAG, EndOfFileChunk::decode)
            .put(SQPK_TAG, ChunkDecoders::decodeSqpk)
            .build();

    private ChunkDecoders() {
    }

    /** Decodes a payload using the decoder registered for the header's tag. */
    public static Chunk decode(ChunkHeader header, BinaryReader payload) throws ChunkDecodeException {
        ChunkDecoder decoder = CHUNKS.get(header.tag());
        if (decoder == null) {
            return new OpaqueChunk(header, header.tag());
        }
        return decoder.decode(header, payload);
    }

    /**
     * SQPK payloads repeat their own length before the command byte. The
     * repeated length must match the chunk length.
     */
    private static Chunk decodeSqpk(ChunkHeader header, BinaryReader payload) throws ChunkDecodeException {
        long innerSize = payload.readU32BE();
        if (innerSize != header.length()) {
            throw new ChunkDecodeException(
                    "SQPK inner size " + innerSize + " does not match chunk length " + header.length(), header.offset());
        }
        char command = payload.readChar();
        ChunkDecoder decoder = SQPK_COMMANDS.get(command);
        if (decoder == null) {
            return new OpaqueChunk(header, SQPK_TAG + ":" + command);
        }
        return decoder.decode(header, payload);
    }
}
