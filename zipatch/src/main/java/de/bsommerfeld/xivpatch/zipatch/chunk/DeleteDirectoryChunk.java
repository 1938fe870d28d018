package de.bsommerfeld.xivpatch.zipatch.chunk;

import de.bsommerfeld.xivpatch.zipatch.BinaryReader;
import de.bsommerfeld.xivpatch.zipatch.ChunkApplyException;
import de.bsommerfeld.xivpatch.zipatch.ZiPatchSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@code DELD}: removes an empty directory. A directory that is already gone
 * counts as removed; a non-empty one is an error.
 */
public record DeleteDirectoryChunk(ChunkHeader header, String directoryName) implements Chunk {

    public static final String TAG = "DELD";

    private static final Logger LOG = LoggerFactory.getLogger(DeleteDirectoryChunk.class);

    public static DeleteDirectoryChunk decode(ChunkHeader header, BinaryReader reader) {
        int nameLength = (int) reader.readU32BE();
        return new DeleteDirectoryChunk(header, reader.readFixedString(nameLength));
    }

    @Override
    public void apply(ZiPatchSession session) throws ChunkApplyException {
        Path directory = session.resolve(type(), directoryName);
        try {
            if (!Files.deleteIfExists(directory)) {
                LOG.debug("Directory {} already absent", directory);
            }
        } catch (IOException e) {
            throw new ChunkApplyException(type(), directory, "cannot delete directory", e);
        }
    }
}
