package de.bsommerfeld.xivpatch.zipatch;

import java.nio.charset.StandardCharsets;

/**
 * Cursor over one chunk payload. ZiPatch mixes byte orders: the framing and
 * most SQPK fields are big-endian, compressed block headers and a few
 * legacy fields are little-endian, so both are offered explicitly.
 *
 * <p>
 * Reading past the payload throws {@link IndexOutOfBoundsException}; the
 * chunk stream turns that into a {@link ChunkDecodeException}.
 */
public final class BinaryReader {

    private final byte[] data;
    private final int limit;
    private int position;

    public BinaryReader(byte[] data) {
        this.data = data;
        this.limit = data.length;
    }

    public int position() {
        return position;
    }

    public int remaining() {
        return limit - position;
    }

    public int readU8() {
        ensureAvailable(1);
        return data[position++] & 0xFF;
    }

    /** Reads a single ASCII character, used for SQPK command and kind codes. */
    public char readChar() {
        return (char) readU8();
    }

    public boolean readBoolean() {
        return readU8() != 0;
    }

    public int readU16BE() {
        ensureAvailable(2);
        int value = ((data[position] & 0xFF) << 8) | (data[position + 1] & 0xFF);
        position += 2;
        return value;
    }

    public short readI16BE() {
        return (short) readU16BE();
    }

    public int readI32BE() {
        ensureAvailable(4);
        int value = ((data[position] & 0xFF) << 24)
                | ((data[position + 1] & 0xFF) << 16)
                | ((data[position + 2] & 0xFF) << 8)
                | (data[position + 3] & 0xFF);
        position += 4;
        return value;
    }

    public long readU32BE() {
        return readI32BE() & 0xFFFFFFFFL;
    }

    public long readI64BE() {
        return (readU32BE() << 32) | readU32BE();
    }

    public int readI32LE() {
        ensureAvailable(4);
        int value = (data[position] & 0xFF)
                | ((data[position + 1] & 0xFF) << 8)
                | ((data[position + 2] & 0xFF) << 16)
                | ((data[position + 3] & 0xFF) << 24);
        position += 4;
        return value;
    }

    public long readU32LE() {
        return readI32LE() & 0xFFFFFFFFL;
    }

    public long readI64LE() {
        long low = readU32LE();
        long high = readU32LE();
        return (high << 32) | low;
    }

    public byte[] readBytes(int count) {
        if (count < 0) {
            throw new IndexOutOfBoundsException("Negative length: " + count);
        }
        ensureAvailable(count);
        byte[] result = new byte[count];
        System.arraycopy(data, position, result, 0, count);
        position += count;
        return result;
    }

    public void skip(int count) {
        if (count < 0) {
            throw new IndexOutOfBoundsException("Negative length: " + count);
        }
        ensureAvailable(count);
        position += count;
    }

    /**
     * Reads a fixed-width string field. Trailing NUL padding is stripped.
     */
    public String readFixedString(int length) {
        byte[] raw = readBytes(length);
        int end = raw.length;
        while (end > 0 && raw[end - 1] == 0) {
            end--;
        }
        return new String(raw, 0, end, StandardCharsets.UTF_8);
    }

    private void ensureAvailable(int count) {
        if (count > limit - position) {
            throw new IndexOutOfBoundsException(
                    "Need " + count + " bytes at position " + position + " but only " + (limit - position) + " remain");
        }
    }
}
