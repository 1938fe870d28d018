package de.bsommerfeld.xivpatch.zipatch.chunk;

import de.bsommerfeld.xivpatch.zipatch.BinaryReader;
import de.bsommerfeld.xivpatch.zipatch.ChunkApplyException;
import de.bsommerfeld.xivpatch.zipatch.ZiPatchSession;
import de.bsommerfeld.xivpatch.zipatch.sqpack.SqpackFile;
import de.bsommerfeld.xivpatch.zipatch.store.FileHandle;

import java.io.IOException;

/**
 * {@code SQPK A}: writes a block of data into a pack data file and zeroes the
 * given number of bytes right after it. Offsets and sizes are stored in
 * 128-byte units.
 */
public record SqpkAddData(ChunkHeader header, SqpackFile target, long blockOffset, byte[] data,
                          long deleteSize) implements SqpkCommand {

    public static final char COMMAND = 'A';

    public static SqpkAddData decode(ChunkHeader header, BinaryReader reader) {
        reader.skip(3);
        SqpackFile target = SqpackFile.read(reader);
        long blockOffset = reader.readU32BE() << 7;
        long dataSize = reader.readU32BE() << 7;
        long deleteSize = reader.readU32BE() << 7;
        byte[] data = reader.readBytes(Math.toIntExact(dataSize));
        return new SqpkAddData(header, target, blockOffset, data, deleteSize);
    }

    @Override
    public char command() {
        return COMMAND;
    }

    @Override
    public void apply(ZiPatchSession session) throws ChunkApplyException {
        FileHandle file = session.acquire(type(), target.datPath(session.platform()));
        try {
            file.writeAt(blockOffset, data);
            file.wipe(blockOffset + data.length, deleteSize);
        } catch (IOException e) {
            throw new ChunkApplyException(type(), file.path(), "cannot write data block", e);
        }
    }
}
