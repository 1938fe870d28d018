package de.bsommerfeld.xivpatch.updater.download;

import de.bsommerfeld.xivpatch.core.concurrent.CancellationToken;
import de.bsommerfeld.xivpatch.core.config.DownloadConfig;
import de.bsommerfeld.xivpatch.core.config.ServerConfig;
import de.bsommerfeld.xivpatch.updater.NetworkException;
import de.bsommerfeld.xivpatch.updater.SizeMismatchException;
import de.bsommerfeld.xivpatch.updater.UpdateException;
import de.bsommerfeld.xivpatch.updater.api.Requests;
import de.bsommerfeld.xivpatch.updater.model.PatchDescriptor;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * Streams patch files to disk.
 *
 * <p>
 * Each attempt writes into a {@code .tmp} sibling and renames it to the
 * target once the transfer completed, so a half written file is never
 * mistaken for a downloaded patch.
 *
 * <h3>Retries</h3>
 * Transport and status failures are retried up to {@code max-attempts}
 * times with a linear backoff of {@code retry-delay-millis * attempt}.
 * Cancellation is never retried. A completed transfer whose size differs
 * from the declared one is deleted and not retried either, since the
 * server would hand out the same bytes again.
 */
public class PatchDownloader {

    private static final Logger LOG = LoggerFactory.getLogger(PatchDownloader.class);

    static final int BUFFER_SIZE = 81920;

    private final HttpClient http;
    private final ServerConfig server;
    private final DownloadConfig config;

    @Inject
    public PatchDownloader(HttpClient http, ServerConfig server, DownloadConfig config) {
        this.http = http;
        this.server = server;
        this.config = config;
    }

    /**
     * Downloads {@code patch} to {@code target}.
     *
     * @throws NetworkException      when every attempt failed
     * @throws SizeMismatchException when the transferred size is wrong, which
     *                               is not retried
     * @throws CancellationException when {@code token} is cancelled
     */
    public void download(PatchDescriptor patch, Path target, CancellationToken token,
            DownloadProgressListener listener) throws UpdateException {
        int maxAttempts = Math.max(1, config.getMaxAttempts());
        UpdateException lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            token.throwIfCancellationRequested();
            if (attempt > 1) {
                listener.onRetry(attempt, maxAttempts, lastFailure);
            }

            AttemptResult result = attempt(patch, target, token, listener);
            if (result instanceof AttemptResult.Success success) {
                LOG.info("Downloaded {} ({} bytes)", patch.fileName(), success.bytes());
                return;
            }
            if (result instanceof AttemptResult.Fatal fatal) {
                throw fatal.cause();
            }

            lastFailure = ((AttemptResult.Retryable) result).cause();
            LOG.warn("Download of {} failed (attempt {}/{}): {}",
                    patch.fileName(), attempt, maxAttempts, lastFailure.getMessage());
            if (attempt < maxAttempts) {
                token.sleep(config.getRetryDelayMillis() * attempt);
            }
        }
        throw new NetworkException("Download of " + patch.fileName() + " failed after "
                + maxAttempts + " attempts", lastFailure);
    }

    /**
     * Runs one transfer and classifies its outcome.
     *
     * @throws CancellationException when {@code token} is cancelled
     */
    AttemptResult attempt(PatchDescriptor patch, Path target, CancellationToken token,
            DownloadProgressListener listener) {
        try {
            downloadOnce(patch, target, token, listener);
        } catch (NetworkException e) {
            return new AttemptResult.Retryable(e);
        } catch (UpdateException e) {
            return new AttemptResult.Fatal(e);
        }
        try {
            return new AttemptResult.Success(verifySize(target, patch.size()));
        } catch (UpdateException e) {
            return new AttemptResult.Fatal(e);
        }
    }

    void downloadOnce(PatchDescriptor patch, Path target, CancellationToken token,
            DownloadProgressListener listener) throws UpdateException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(patch.url()))
                .timeout(Duration.ofMinutes(server.getDownloadTimeoutMinutes()))
                .header("User-Agent", server.getUserAgent())
                .GET()
                .build();
        HttpResponse<InputStream> response = Requests.send(http, request, HttpResponse.BodyHandlers.ofInputStream());

        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try (InputStream in = response.body()) {
            Requests.validateStatus(response.statusCode(), patch.url());
            Files.createDirectories(target.getParent());
            transferWithProgress(in, temp, patch.size(), token, listener);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            deleteQuietly(temp, e);
            throw new NetworkException("Transfer of " + patch.fileName() + " failed: " + e.getMessage(), e);
        } catch (RuntimeException | UpdateException e) {
            deleteQuietly(temp, e);
            throw e;
        }
    }

    private static void transferWithProgress(InputStream in, Path target, long totalBytes,
            CancellationToken token, DownloadProgressListener listener) throws IOException {
        try (OutputStream out = Files.newOutputStream(target)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            long transferred = 0;
            int read;
            while ((read = in.read(buffer)) != -1) {
                token.throwIfCancellationRequested();
                out.write(buffer, 0, read);
                transferred += read;
                listener.onProgress(transferred, totalBytes);
            }
        }
    }

    /** Deletes {@code file} and throws if its size differs from {@code expected}. */
    static long verifySize(Path file, long expected) throws UpdateException {
        try {
            long actual = Files.size(file);
            if (actual != expected) {
                Files.deleteIfExists(file);
                throw new SizeMismatchException(file, expected, actual);
            }
            return actual;
        } catch (IOException e) {
            throw new UpdateException("Cannot check size of " + file.getFileName(), e);
        }
    }

    private static void deleteQuietly(Path temp, Exception primary) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }
}
