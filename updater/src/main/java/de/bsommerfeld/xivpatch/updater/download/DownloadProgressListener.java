package de.bsommerfeld.xivpatch.updater.download;

/**
 * Callback for download progress reporting.
 *
 * <p>
 * {@code totalBytes} is the size declared by the patch descriptor.
 * Implementations must be thread-safe if the download runs on a
 * background thread and the listener updates shared state.
 */
@FunctionalInterface
public interface DownloadProgressListener {

    DownloadProgressListener NONE = (bytesRead, totalBytes) -> {
    };

    void onProgress(long bytesRead, long totalBytes);

    /** Called before attempt {@code attempt} after the previous one failed. */
    default void onRetry(int attempt, int maxAttempts, Exception cause) {
    }
}
