package de.bsommerfeld.xivpatch.updater.update;

/**
 * Immutable snapshot of update progress, consumed by the collaborator to
 * drive its progress bar and status labels.
 *
 * <h3>Progress model</h3>
 * The ratio covers the current phase. Downloading reports the share of
 * plan bytes on disk, installing the share of patches applied. A ratio of
 * {@code -1} signals indeterminate progress.
 *
 * @param phase         high-level phase name shown as the primary label
 *                      (e.g. "Downloading patches", "Installing patches")
 * @param detail        optional secondary label with specifics
 *                      (e.g. "ex1/D2025.05.29.0000.0000.patch, 2 of 5")
 * @param progressRatio 0.0 to 1.0 within the current phase, or -1 for
 *                      indeterminate
 */
public record UpdateProgress(String phase, String detail, double progressRatio) {

    /** Creates an indeterminate progress event with no detail text. */
    public static UpdateProgress indeterminate(String phase) {
        return new UpdateProgress(phase, null, -1);
    }

    /** Creates a determinate progress event with no detail text. */
    public static UpdateProgress of(String phase, double ratio) {
        return new UpdateProgress(phase, null, clamp(ratio));
    }

    /** Creates a determinate progress event with detail text. */
    public static UpdateProgress of(String phase, String detail, double ratio) {
        return new UpdateProgress(phase, detail, clamp(ratio));
    }

    /** Creates an indeterminate progress event with detail text. */
    public static UpdateProgress indeterminate(String phase, String detail) {
        return new UpdateProgress(phase, detail, -1);
    }

    public boolean isIndeterminate() {
        return progressRatio < 0;
    }

    private static double clamp(double ratio) {
        return Math.max(0.0, Math.min(1.0, ratio));
    }
}
