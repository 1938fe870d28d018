package de.bsommerfeld.xivpatch.zipatch.chunk;

import de.bsommerfeld.xivpatch.zipatch.ChunkApplyException;
import de.bsommerfeld.xivpatch.zipatch.ZiPatchSession;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@code SQPK F/M}: creates a directory and all missing parents.
 */
public record SqpkMakeDirTree(ChunkHeader header, String path) implements SqpkCommand {

    @Override
    public char command() {
        return SqpkFileOperations.COMMAND;
    }

    @Override
    public String type() {
        return "SQPK:F:M";
    }

    @Override
    public void apply(ZiPatchSession session) throws ChunkApplyException {
        Path directory = session.resolve(type(), path);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ChunkApplyException(type(), directory, "cannot create directory tree", e);
        }
    }
}
