package de.bsommerfeld.xivpatch.zipatch.chunk;

import de.bsommerfeld.xivpatch.zipatch.BinaryReader;
import de.bsommerfeld.xivpatch.zipatch.ChunkApplyException;
import de.bsommerfeld.xivpatch.zipatch.ZiPatchSession;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@code ADIR}: creates a directory below the game directory. An existing
 * directory is left as is.
 */
public record AddDirectoryChunk(ChunkHeader header, String directoryName) implements Chunk {

    public static final String TAG = "ADIR";

    public static AddDirectoryChunk decode(ChunkHeader header, BinaryReader reader) {
        int nameLength = (int) reader.readU32BE();
        return new AddDirectoryChunk(header, reader.readFixedString(nameLength));
    }

    @Override
    public void apply(ZiPatchSession session) throws ChunkApplyException {
        Path directory = session.resolve(type(), directoryName);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ChunkApplyException(type(), directory, "cannot create directory", e);
        }
    }
}
