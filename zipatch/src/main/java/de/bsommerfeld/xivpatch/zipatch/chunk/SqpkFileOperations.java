package de.bsommerfeld.xivpatch.zipatch.chunk;

import de.bsommerfeld.xivpatch.zipatch.BinaryReader;
import de.bsommerfeld.xivpatch.zipatch.ChunkDecodeException;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes {@code SQPK F} commands. All four operations share one layout and
 * differ only in the operation byte:
 *
 * <pre>
 * op(1) align(2) fileOffset(i64) fileSize(u64) pathLength(u32)
 * expansionId(u16) pad(2) path(pathLength) [blocks...]
 * </pre>
 */
public final class SqpkFileOperations {

    public static final char COMMAND = 'F';

    static final char ADD_FILE = 'A';
    static final char REMOVE_ALL = 'R';
    static final char DELETE_FILE = 'D';
    static final char MAKE_DIR_TREE = 'M';

    private SqpkFileOperations() {
    }

    public static SqpkCommand decode(ChunkHeader header, BinaryReader reader) throws ChunkDecodeException {
        char operation = reader.readChar();
        reader.skip(2);
        long fileOffset = reader.readI64BE();
        long fileSize = reader.readI64BE();
        int pathLength = Math.toIntExact(reader.readU32BE());
        int expansionId = reader.readU16BE();
        reader.skip(2);
        String path = reader.readFixedString(pathLength);

        switch (operation) {
            case ADD_FILE: {
                List<CompressedBlock> blocks = new ArrayList<>();
                while (reader.remaining() > 0) {
                    blocks.add(CompressedBlock.decode(reader));
                }
                return new SqpkAddFile(header, path, fileOffset, fileSize, List.copyOf(blocks));
            }
            case REMOVE_ALL:
                return new SqpkRemoveAll(header, expansionId);
            case DELETE_FILE:
                return new SqpkDeleteFile(header, path);
            case MAKE_DIR_TREE:
                return new SqpkMakeDirTree(header, path);
            default:
                throw new ChunkDecodeException("Unknown file operation '" + operation + "'", header.offset());
        }
    }
}
