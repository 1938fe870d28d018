package de.bsommerfeld.xivpatch.zipatch.chunk;

import de.bsommerfeld.xivpatch.zipatch.ChunkApplyException;
import de.bsommerfeld.xivpatch.zipatch.ZiPatchSession;
import de.bsommerfeld.xivpatch.zipatch.store.FileHandle;

import java.io.IOException;
import java.util.List;
import java.util.zip.DataFormatException;

/**
 * {@code SQPK F/A}: writes (part of) a loose file. Large files are split
 * across several commands; the first one starts at offset 0 and truncates
 * whatever was there before.
 */
public record SqpkAddFile(ChunkHeader header, String path, long fileOffset, long fileSize,
                          List<CompressedBlock> blocks) implements SqpkCommand {

    @Override
    public char command() {
        return SqpkFileOperations.COMMAND;
    }

    @Override
    public String type() {
        return "SQPK:F:A";
    }

    @Override
    public void apply(ZiPatchSession session) throws ChunkApplyException {
        FileHandle file = session.acquire(type(), path);
        try {
            if (fileOffset == 0) {
                file.truncate(0);
            }
            long position = fileOffset;
            for (CompressedBlock block : blocks) {
                byte[] content = block.content();
                file.writeAt(position, content);
                position += content.length;
            }
        } catch (IOException e) {
            throw new ChunkApplyException(type(), file.path(), "cannot write file", e);
        } catch (DataFormatException e) {
            throw new ChunkApplyException(type(), file.path(), "corrupt compressed block", e);
        }
    }
}
