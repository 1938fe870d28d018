package de.bsommerfeld.xivpatch.updater.update;

import de.bsommerfeld.xivpatch.core.util.ByteFormatter;

/**
 * Download counters sampled at the speed report interval.
 *
 * @param fileName         patch currently transferring
 * @param patchIndex       1-based index of that patch in the plan
 * @param patchCount       number of patches in the plan
 * @param transferredBytes plan bytes on disk, skipped files included
 * @param totalBytes       plan size in bytes
 * @param bytesPerSecond   average network throughput of this run
 * @param remainingSeconds estimated time left, -1 while unknown
 */
public record TransferStats(String fileName, int patchIndex, int patchCount, long transferredBytes,
                            long totalBytes, long bytesPerSecond, long remainingSeconds) {

    public double ratio() {
        return totalBytes <= 0 ? 0.0 : Math.min(1.0, (double) transferredBytes / totalBytes);
    }

    public String formattedSpeed() {
        return ByteFormatter.formatRate(bytesPerSecond);
    }

    public String formattedRemaining() {
        return ByteFormatter.formatDuration(remainingSeconds);
    }

    @Override
    public String toString() {
        return ByteFormatter.format(transferredBytes) + " / " + ByteFormatter.format(totalBytes)
                + ", " + formattedSpeed() + ", " + formattedRemaining() + " left";
    }
}
