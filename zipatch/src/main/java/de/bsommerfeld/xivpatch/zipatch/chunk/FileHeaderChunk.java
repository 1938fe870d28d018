package de.bsommerfeld.xivpatch.zipatch.chunk;

import de.bsommerfeld.xivpatch.zipatch.BinaryReader;
import de.bsommerfeld.xivpatch.zipatch.ZiPatchSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code FHDR}: describes the patch file. Version 3 headers carry
 * statistics about the contained commands; older headers leave them zero.
 */
public record FileHeaderChunk(ChunkHeader header, int version, String fileType, long entryFiles,
                              long addDirectories, long deleteDirectories, long deleteDataSize,
                              long minorVersion, long repositoryName, long commands) implements Chunk {

    public static final String TAG = "FHDR";

    private static final Logger LOG = LoggerFactory.getLogger(FileHeaderChunk.class);

    public static FileHeaderChunk decode(ChunkHeader header, BinaryReader reader) {
        int version = (int) ((reader.readU32LE() >> 16) & 0xFF);
        String fileType = reader.readFixedString(4);
        long entryFiles = reader.readU32BE();

        if (version != 3) {
            return new FileHeaderChunk(header, version, fileType, entryFiles, 0, 0, 0, 0, 0, 0);
        }

        long addDirectories = reader.readU32BE();
        long deleteDirectories = reader.readU32BE();
        long deleteDataLow = reader.readU32BE();
        long deleteDataHigh = reader.readU32BE();
        long minorVersion = reader.readU32BE();
        long repositoryName = reader.readU32BE();
        long commands = reader.readU32BE();
        return new FileHeaderChunk(header, version, fileType, entryFiles, addDirectories, deleteDirectories,
                deleteDataLow | (deleteDataHigh << 32), minorVersion, repositoryName, commands);
    }

    @Override
    public void apply(ZiPatchSession session) {
        LOG.debug("Patch file v{} type {} with {} entries", version, fileType, entryFiles);
    }
}
