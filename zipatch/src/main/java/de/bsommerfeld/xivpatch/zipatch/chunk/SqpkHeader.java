package de.bsommerfeld.xivpatch.zipatch.chunk;

import de.bsommerfeld.xivpatch.zipatch.BinaryReader;
import de.bsommerfeld.xivpatch.zipatch.ChunkApplyException;
import de.bsommerfeld.xivpatch.zipatch.ChunkDecodeException;
import de.bsommerfeld.xivpatch.zipatch.ZiPatchSession;
import de.bsommerfeld.xivpatch.zipatch.sqpack.SqpackFile;
import de.bsommerfeld.xivpatch.zipatch.store.FileHandle;

import java.io.IOException;

/**
 * {@code SQPK H}: replaces one 1024-byte header of a data or index file. The
 * version header sits at offset 0, the index and data headers follow it.
 */
public record SqpkHeader(ChunkHeader header, char fileKind, char headerKind, SqpackFile target,
                         byte[] headerData) implements SqpkCommand {

    public static final char COMMAND = 'H';
    public static final int HEADER_SIZE = 1024;

    public static final char FILE_DAT = 'D';
    public static final char FILE_INDEX = 'I';
    public static final char HEADER_VERSION = 'V';

    public static SqpkHeader decode(ChunkHeader header, BinaryReader reader) throws ChunkDecodeException {
        char fileKind = reader.readChar();
        char headerKind = reader.readChar();
        reader.skip(1);
        if (fileKind != FILE_DAT && fileKind != FILE_INDEX) {
            throw new ChunkDecodeException("Unknown header file kind '" + fileKind + "'", header.offset());
        }
        if (headerKind != HEADER_VERSION && headerKind != 'I' && headerKind != 'D') {
            throw new ChunkDecodeException("Unknown header kind '" + headerKind + "'", header.offset());
        }
        SqpackFile target = SqpackFile.read(reader);
        return new SqpkHeader(header, fileKind, headerKind, target, reader.readBytes(HEADER_SIZE));
    }

    @Override
    public char command() {
        return COMMAND;
    }

    public long targetOffset() {
        return headerKind == HEADER_VERSION ? 0 : HEADER_SIZE;
    }

    @Override
    public void apply(ZiPatchSession session) throws ChunkApplyException {
        String path = fileKind == FILE_DAT
                ? target.datPath(session.platform())
                : target.indexPath(session.platform());
        FileHandle file = session.acquire(type(), path);
        try {
            file.writeAt(targetOffset(), headerData);
        } catch (IOException e) {
            throw new ChunkApplyException(type(), file.path(), "cannot write header", e);
        }
    }
}
