package de.bsommerfeld.xivpatch.zipatch.chunk;

import de.bsommerfeld.xivpatch.zipatch.store.FileHandle;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Writes an empty file block into a pack data file: the range is zeroed and
 * a block header marking it as free is placed at its start.
 */
final class EmptyBlocks {

    static final int BLOCK_HEADER_SIZE = 1 << 7;

    private EmptyBlocks() {
    }

    static void write(FileHandle file, long offset, long blockCount) throws IOException {
        file.wipe(offset, blockCount << 7);

        ByteBuffer header = ByteBuffer.allocate(20).order(ByteOrder.LITTLE_ENDIAN);
        header.putInt(BLOCK_HEADER_SIZE);
        header.putInt(0);
        header.putInt(0);
        header.putInt((int) (blockCount - 1));
        header.putInt(0);
        header.flip();
        file.writeAt(offset, header);
    }
}
