package de.bsommerfeld.xivpatch.zipatch.chunk;

import de.bsommerfeld.xivpatch.zipatch.BinaryReader;
import de.bsommerfeld.xivpatch.zipatch.ChunkApplyException;
import de.bsommerfeld.xivpatch.zipatch.ZiPatchSession;
import de.bsommerfeld.xivpatch.zipatch.sqpack.SqpackFile;
import de.bsommerfeld.xivpatch.zipatch.store.FileHandle;

import java.io.IOException;

/**
 * {@code SQPK E}: grows a pack data file by zero-filled, empty blocks.
 */
public record SqpkExpandData(ChunkHeader header, SqpackFile target, long blockOffset, long blockCount)
        implements SqpkCommand {

    public static final char COMMAND = 'E';

    public static SqpkExpandData decode(ChunkHeader header, BinaryReader reader) {
        reader.skip(3);
        SqpackFile target = SqpackFile.read(reader);
        long blockOffset = reader.readU32BE() << 7;
        long blockCount = reader.readU32BE();
        reader.skip(4);
        return new SqpkExpandData(header, target, blockOffset, blockCount);
    }

    @Override
    public char command() {
        return COMMAND;
    }

    @Override
    public void apply(ZiPatchSession session) throws ChunkApplyException {
        FileHandle file = session.acquire(type(), target.datPath(session.platform()));
        try {
            EmptyBlocks.write(file, blockOffset, blockCount);
        } catch (IOException e) {
            throw new ChunkApplyException(type(), file.path(), "cannot expand data blocks", e);
        }
    }
}
