package de.bsommerfeld.xivpatch.zipatch;

import de.bsommerfeld.xivpatch.core.concurrent.CancellationToken;
import de.bsommerfeld.xivpatch.core.config.InstallConfig;
import de.bsommerfeld.xivpatch.zipatch.chunk.Chunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Applies one patch file to a game directory.
 *
 * <p>
 * Every patch gets its own {@link ZiPatchSession}; chunks are decoded and
 * applied one at a time in file order. The session, and with it every file
 * handle, is closed before {@link #install} returns, whether the patch
 * applied or not. A failure leaves the chunks applied so far in place.
 */
public class ZiPatchInstaller {

    private static final Logger LOG = LoggerFactory.getLogger(ZiPatchInstaller.class);

    private final InstallConfig config;

    public ZiPatchInstaller(InstallConfig config) {
        this.config = config;
    }

    /**
     * @param patchFile the ZiPatch file to apply
     * @param gameDir   the {@code game} directory of the installation
     * @param token     checked before every chunk
     * @param listener  notified after every chunk
     * @return the number of chunks applied
     * @throws ChunkDecodeException                        if the patch file is malformed
     * @throws ChunkApplyException                         if a chunk cannot be applied
     * @throws java.util.concurrent.CancellationException if cancelled
     */
    public int install(Path patchFile, Path gameDir, CancellationToken token, InstallProgressListener listener)
            throws IOException {
        Files.createDirectories(gameDir);
        LOG.info("Applying {} to {}", patchFile.getFileName(), gameDir);

        int applied = 0;
        try (ZiPatchFile patch = ZiPatchFile.open(patchFile, config.isVerifyChunkCrc());
             ZiPatchSession session = new ZiPatchSession(gameDir, config.isIgnoreMissing())) {
            ChunkStream stream = patch.chunks();
            Optional<Chunk> next;
            while (true) {
                token.throwIfCancellationRequested();
                next = stream.next();
                if (next.isEmpty()) {
                    break;
                }
                Chunk chunk = next.get();
                LOG.debug("Applying {} at offset {}", chunk.type(), chunk.header().offset());
                chunk.apply(session);
                applied++;
                listener.onChunkApplied(chunk, stream.position(), patch.length());
            }
        }

        LOG.info("Applied {} chunks from {}", applied, patchFile.getFileName());
        return applied;
    }
}
