package de.bsommerfeld.xivpatch.zipatch.chunk;

import de.bsommerfeld.xivpatch.zipatch.ChunkApplyException;
import de.bsommerfeld.xivpatch.zipatch.ZiPatchSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@code SQPK F/D}: deletes a loose file. A missing file is only accepted
 * while the session ignores missing targets.
 */
public record SqpkDeleteFile(ChunkHeader header, String path) implements SqpkCommand {

    private static final Logger LOG = LoggerFactory.getLogger(SqpkDeleteFile.class);

    @Override
    public char command() {
        return SqpkFileOperations.COMMAND;
    }

    @Override
    public String type() {
        return "SQPK:F:D";
    }

    @Override
    public void apply(ZiPatchSession session) throws ChunkApplyException {
        Path target = session.resolve(type(), path);
        boolean deleted;
        try {
            session.store().release(target);
            deleted = Files.deleteIfExists(target);
        } catch (IOException e) {
            throw new ChunkApplyException(type(), target, "cannot delete file", e);
        }

        if (!deleted) {
            if (!session.ignoreMissing()) {
                throw new ChunkApplyException(type(), target, "file to delete does not exist");
            }
            LOG.debug("File {} already absent", target);
        }
    }
}
