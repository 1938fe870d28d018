package de.bsommerfeld.xivpatch.zipatch.chunk;

import de.bsommerfeld.xivpatch.zipatch.BinaryReader;

import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * One block of file content inside an {@code SQPK F} add command. Blocks are
 * raw-deflate compressed unless their compressed size carries the stored
 * marker {@code 0x7d00}. Each block including its 16-byte header is padded
 * to a multiple of 128 bytes.
 */
public record CompressedBlock(boolean compressed, int decompressedSize, byte[] data) {

    public static final int STORED_MARKER = 0x7d00;

    /** SqPack data blocks never hold more than 16000 bytes once inflated. */
    public static final int MAX_BLOCK_SIZE = 16_000;

    /**
     * @throws IndexOutOfBoundsException if a size field is out of range or
     *                                   the block runs past the payload
     */
    public static CompressedBlock decode(BinaryReader reader) {
        int headerSize = reader.readI32LE();
        reader.skip(4);
        int compressedSize = reader.readI32LE();
        int decompressedSize = reader.readI32LE();
        if (decompressedSize < 0 || decompressedSize > MAX_BLOCK_SIZE) {
            throw new IndexOutOfBoundsException("Block size " + decompressedSize + " outside 0.." + MAX_BLOCK_SIZE);
        }
        if (compressedSize < 0) {
            throw new IndexOutOfBoundsException("Negative compressed block size " + compressedSize);
        }

        boolean compressed = compressedSize != STORED_MARKER;
        int dataSize = compressed ? compressedSize : decompressedSize;
        int paddedSize = (dataSize + headerSize + 0x7F) & ~0x7F;

        byte[] data = reader.readBytes(dataSize);
        reader.skip(paddedSize - dataSize - headerSize);
        return new CompressedBlock(compressed, decompressedSize, data);
    }

    /**
     * Returns the block content, inflating it if necessary.
     *
     * @throws DataFormatException if the deflate stream is corrupt or does not
     *                             yield the declared size
     */
    public byte[] content() throws DataFormatException {
        if (!compressed) {
            return data;
        }

        byte[] out = new byte[decompressedSize];
        Inflater inflater = new Inflater(true);
        try {
            inflater.setInput(data);
            int total = 0;
            while (total < out.length && !inflater.finished()) {
                int inflated = inflater.inflate(out, total, out.length - total);
                if (inflated == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    break;
                }
                total += inflated;
            }
            if (total != out.length) {
                throw new DataFormatException("Inflated " + total + " bytes, expected " + out.length);
            }
            return out;
        } finally {
            inflater.end();
        }
    }
}
