package de.bsommerfeld.xivpatch.zipatch;

import de.bsommerfeld.xivpatch.zipatch.chunk.Chunk;
import de.bsommerfeld.xivpatch.zipatch.chunk.ChunkHeader;
import de.bsommerfeld.xivpatch.zipatch.chunk.EndOfFileChunk;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.zip.CRC32;

/**
 * Forward-only reader of the chunks that follow the ZiPatch magic.
 *
 * <h3>Framing</h3>
 * Each chunk is {@code length(u32 BE) tag(4) payload(length) crc32(u32 BE)},
 * the CRC covering tag and payload. The payload is read in full before it is
 * decoded, so the cursor always ends on the next chunk boundary no matter
 * how much of the payload the decoder consumed.
 *
 * <h3>Errors</h3>
 * A truncated chunk, a length larger than the bytes left in the file, a CRC
 * mismatch or a decoder reading past the payload raises
 * {@link ChunkDecodeException}. The stream is unusable afterwards.
 */
public final class ChunkStream {

    private static final int MAX_PAYLOAD = Integer.MAX_VALUE - 16;

    private final InputStream in;
    private final long fileLength;
    private final boolean verifyCrc;

    private long position;
    private boolean finished;

    /**
     * @param in         stream positioned right after the magic
     * @param position   file offset of the stream's current position
     * @param fileLength total file length, or {@code -1} if unknown
     * @param verifyCrc  whether chunk checksums are checked
     */
    ChunkStream(InputStream in, long position, long fileLength, boolean verifyCrc) {
        this.in = in;
        this.position = position;
        this.fileLength = fileLength;
        this.verifyCrc = verifyCrc;
    }

    /** File offset of the next chunk. */
    public long position() {
        return position;
    }

    /**
     * Reads and decodes the next chunk.
     *
     * @return the chunk, or empty after {@code EOF_} or at the end of input
     * @throws ChunkDecodeException if the chunk is malformed
     * @throws IOException          if the underlying stream fails
     */
    public Optional<Chunk> next() throws IOException {
        if (finished) {
            return Optional.empty();
        }

        long chunkOffset = position;
        byte[] lengthField = in.readNBytes(4);
        if (lengthField.length == 0) {
            finished = true;
            return Optional.empty();
        }
        if (lengthField.length < 4) {
            throw fail("Truncated chunk length", chunkOffset);
        }

        long length = toUnsignedInt(lengthField);
        if (length > MAX_PAYLOAD) {
            throw fail("Chunk length " + length + " is not supported", chunkOffset);
        }
        if (fileLength >= 0 && length + 12 > fileLength - chunkOffset) {
            throw fail("Chunk length " + length + " exceeds the " + (fileLength - chunkOffset - 12)
                    + " bytes left in the file", chunkOffset);
        }

        byte[] tagBytes = readExactly(4, chunkOffset, "tag");
        String tag = new String(tagBytes, StandardCharsets.US_ASCII);
        byte[] payload = readExactly((int) length, chunkOffset, "payload of " + tag);
        long storedCrc = toUnsignedInt(readExactly(4, chunkOffset, "checksum of " + tag));

        if (verifyCrc) {
            CRC32 crc = new CRC32();
            crc.update(tagBytes);
            crc.update(payload);
            if (crc.getValue() != storedCrc) {
                throw fail("Checksum mismatch in " + tag + " chunk", chunkOffset);
            }
        }

        ChunkHeader header = new ChunkHeader(tag, chunkOffset, length);
        position = chunkOffset + header.totalSize();

        Chunk chunk;
        try {
            chunk = ChunkDecoders.decode(header, new BinaryReader(payload));
        } catch (IndexOutOfBoundsException | IllegalArgumentException | ArithmeticException e) {
            finished = true;
            throw new ChunkDecodeException("Malformed " + tag + " chunk: " + e.getMessage(), chunkOffset, e);
        } catch (ChunkDecodeException e) {
            finished = true;
            throw e;
        }

        if (chunk instanceof EndOfFileChunk) {
            finished = true;
        }
        return Optional.of(chunk);
    }

    private byte[] readExactly(int count, long chunkOffset, String what) throws IOException {
        byte[] bytes = in.readNBytes(count);
        if (bytes.length < count) {
            throw fail("Truncated " + what, chunkOffset);
        }
        return bytes;
    }

    private ChunkDecodeException fail(String message, long chunkOffset) {
        finished = true;
        return new ChunkDecodeException(message, chunkOffset);
    }

    private static long toUnsignedInt(byte[] bytes) {
        return ((bytes[0] & 0xFFL) << 24) | ((bytes[1] & 0xFFL) << 16) | ((bytes[2] & 0xFFL) << 8) | (bytes[3] & 0xFFL);
    }
}
