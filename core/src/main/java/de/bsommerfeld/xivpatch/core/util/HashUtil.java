package de.bsommerfeld.xivpatch.core.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * SHA-1 hashing for patch verification. The patch server publishes one hash
 * per fixed-size block of a patch file, so files are hashed block by block
 * with streaming I/O.
 */
public final class HashUtil {

    private static final String ALGORITHM = "SHA-1";
    private static final int BUFFER_SIZE = 64 * 1024;

    private HashUtil() {}

    /**
     * Computes the hex-encoded SHA-1 of every {@code blockSize} slice of the
     * file. The last block may be shorter.
     *
     * @throws IOException if the file cannot be read
     */
    public static List<String> sha1Blocks(Path file, long blockSize) throws IOException {
        if (blockSize <= 0) {
            throw new IllegalArgumentException("Block size must be positive: " + blockSize);
        }

        List<String> hashes = new ArrayList<>();
        MessageDigest digest = newDigest();
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            long inBlock = 0;
            int read;
            while ((read = in.read(buffer, 0, (int) Math.min(buffer.length, blockSize - inBlock))) != -1) {
                digest.update(buffer, 0, read);
                inBlock += read;
                if (inBlock == blockSize) {
                    hashes.add(HexFormat.of().formatHex(digest.digest()));
                    inBlock = 0;
                }
            }
            if (inBlock > 0) {
                hashes.add(HexFormat.of().formatHex(digest.digest()));
            }
        }
        return hashes;
    }

    /** Computes the hex-encoded SHA-1 of a byte array. */
    public static String sha1(byte[] data) {
        MessageDigest digest = newDigest();
        digest.update(data);
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // every Java platform ships SHA-1
            throw new AssertionError(ALGORITHM + " not available", e);
        }
    }
}
