package de.bsommerfeld.xivpatch.updater.update;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Tracks plan-wide download progress. Throughput only counts bytes that
 * actually crossed the network, so patches skipped because they are
 * already cached do not inflate the speed. Not thread-safe; owned by the
 * update worker.
 */
final class TransferMeter {

    private final long totalBytes;
    private final long reportIntervalNanos;
    private final Stopwatch stopwatch;

    private long completedBytes;
    private long currentBytes;
    private long networkBytes;
    private long lastReportNanos;

    TransferMeter(long totalBytes, long reportIntervalMillis, Ticker ticker) {
        this.totalBytes = totalBytes;
        this.reportIntervalNanos = TimeUnit.MILLISECONDS.toNanos(reportIntervalMillis);
        this.stopwatch = Stopwatch.createStarted(ticker);
    }

    /** Counts a patch that needs no transfer. */
    void skip(long bytes) {
        completedBytes += bytes;
    }

    /** Records the byte count of the running transfer; a lower count means it restarted. */
    void progress(long bytesInPatch) {
        if (bytesInPatch > currentBytes) {
            networkBytes += bytesInPatch - currentBytes;
        }
        currentBytes = bytesInPatch;
    }

    void finishPatch(long size) {
        completedBytes += size;
        currentBytes = 0;
    }

    long transferred() {
        return completedBytes + currentBytes;
    }

    double ratio() {
        return totalBytes <= 0 ? 1.0 : Math.min(1.0, (double) transferred() / totalBytes);
    }

    /** Returns stats when the report interval elapsed since the last sample. */
    Optional<TransferStats> sample(String fileName, int patchIndex, int patchCount) {
        long now = stopwatch.elapsed(TimeUnit.NANOSECONDS);
        if (now - lastReportNanos < reportIntervalNanos) {
            return Optional.empty();
        }
        lastReportNanos = now;
        return Optional.of(snapshot(fileName, patchIndex, patchCount));
    }

    TransferStats snapshot(String fileName, int patchIndex, int patchCount) {
        long elapsedMillis = stopwatch.elapsed(TimeUnit.MILLISECONDS);
        long speed = elapsedMillis <= 0 ? 0 : networkBytes * 1000 / elapsedMillis;
        long remaining = speed <= 0 ? -1 : Math.max(0, totalBytes - transferred()) / speed;
        return new TransferStats(fileName, patchIndex, patchCount, transferred(), totalBytes, speed, remaining);
    }
}
