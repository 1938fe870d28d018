package de.bsommerfeld.xivpatch.updater.download;

import de.bsommerfeld.xivpatch.core.config.DownloadConfig;
import de.bsommerfeld.xivpatch.core.util.HashUtil;
import de.bsommerfeld.xivpatch.updater.HashMismatchException;
import de.bsommerfeld.xivpatch.updater.UpdateException;
import de.bsommerfeld.xivpatch.updater.model.PatchDescriptor;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Checks downloaded patches against the block hashes of the manifest.
 * Only SHA-1 block lists can be verified; other hash types (the CRC32 of
 * the full patch list) are accepted on size alone.
 */
public class PatchVerifier {

    private static final Logger LOG = LoggerFactory.getLogger(PatchVerifier.class);

    static final String SHA1 = "sha1";

    private final DownloadConfig config;

    @Inject
    public PatchVerifier(DownloadConfig config) {
        this.config = config;
    }

    public boolean canVerify(PatchDescriptor patch) {
        return config.isVerifyHashes()
                && SHA1.equalsIgnoreCase(patch.hashType())
                && patch.hashBlockSize() > 0
                && !patch.hashes().isEmpty();
    }

    /**
     * @throws HashMismatchException if the block count or any block hash
     *                               differs
     */
    public void verify(PatchDescriptor patch, Path file) throws UpdateException {
        if (!canVerify(patch)) {
            return;
        }
        List<String> actual;
        try {
            actual = HashUtil.sha1Blocks(file, patch.hashBlockSize());
        } catch (IOException e) {
            throw new UpdateException("Cannot hash " + file.getFileName(), e);
        }

        List<String> expected = patch.hashes();
        if (actual.size() != expected.size()) {
            throw new HashMismatchException(file,
                    "expected " + expected.size() + " blocks, got " + actual.size());
        }
        for (int i = 0; i < expected.size(); i++) {
            if (!expected.get(i).equalsIgnoreCase(actual.get(i))) {
                throw new HashMismatchException(file, i);
            }
        }
        LOG.debug("Verified {} blocks of {}", expected.size(), file.getFileName());
    }
}
