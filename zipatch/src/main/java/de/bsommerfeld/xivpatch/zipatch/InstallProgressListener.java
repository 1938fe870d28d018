package de.bsommerfeld.xivpatch.zipatch;

import de.bsommerfeld.xivpatch.zipatch.chunk.Chunk;

/**
 * Receives a callback after every applied chunk.
 */
@FunctionalInterface
public interface InstallProgressListener {

    InstallProgressListener NONE = (chunk, position, length) -> {
    };

    /**
     * @param chunk    the chunk that was just applied
     * @param position file offset after the chunk
     * @param length   total patch file length
     */
    void onChunkApplied(Chunk chunk, long position, long length);
}
