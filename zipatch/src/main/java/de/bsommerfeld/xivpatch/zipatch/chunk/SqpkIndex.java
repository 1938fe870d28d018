package de.bsommerfeld.xivpatch.zipatch.chunk;

import de.bsommerfeld.xivpatch.zipatch.BinaryReader;
import de.bsommerfeld.xivpatch.zipatch.ChunkApplyException;
import de.bsommerfeld.xivpatch.zipatch.ZiPatchSession;
import de.bsommerfeld.xivpatch.zipatch.sqpack.SqpackFile;

/**
 * {@code SQPK I}: index entry add/delete. The index files are rewritten in
 * full by header and data commands of the same patch, so the entry itself is
 * informational; the index file is still routed through the store.
 */
public record SqpkIndex(ChunkHeader header, char indexCommand, boolean synonym, SqpackFile target,
                        long fileHash, long blockOffset, long blockNumber) implements SqpkCommand {

    public static final char COMMAND = 'I';

    public static SqpkIndex decode(ChunkHeader header, BinaryReader reader) {
        char indexCommand = reader.readChar();
        boolean synonym = reader.readBoolean();
        reader.skip(1);
        SqpackFile target = SqpackFile.read(reader);
        long fileHash = reader.readI64BE();
        long blockOffset = reader.readU32BE();
        long blockNumber = reader.readU32BE();
        return new SqpkIndex(header, indexCommand, synonym, target, fileHash, blockOffset, blockNumber);
    }

    @Override
    public char command() {
        return COMMAND;
    }

    @Override
    public void apply(ZiPatchSession session) throws ChunkApplyException {
        session.acquire(type(), target.indexPath(session.platform()));
    }
}
