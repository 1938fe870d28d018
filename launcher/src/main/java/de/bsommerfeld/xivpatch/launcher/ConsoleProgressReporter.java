package de.bsommerfeld.xivpatch.launcher;

import de.bsommerfeld.xivpatch.updater.update.TransferStats;
import de.bsommerfeld.xivpatch.updater.update.UpdateListener;
import de.bsommerfeld.xivpatch.updater.update.UpdateProgress;
import de.bsommerfeld.xivpatch.updater.update.UpdateState;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;

/**
 * Prints coordinator events as plain lines. Progress of the same step is
 * printed once per ten percent.
 */
final class ConsoleProgressReporter implements UpdateListener {

    private final PrintStream out;

    private String lastStep;
    private int lastDecile = -1;

    ConsoleProgressReporter(PrintStream out) {
        this.out = out;
    }

    @Override
    public synchronized void onStateChanged(UpdateState state) {
        out.println("[" + state.name().toLowerCase(Locale.ROOT).replace('_', ' ') + "]");
    }

    @Override
    public synchronized void onProgress(UpdateProgress progress) {
        String step = progress.phase() + (progress.detail() != null ? ": " + progress.detail() : "");
        int percent = progress.isIndeterminate() ? -1 : (int) Math.floor(progress.progressRatio() * 100);
        int decile = percent < 0 ? -1 : percent / 10;
        if (Objects.equals(step, lastStep) && decile == lastDecile) {
            return;
        }
        out.println(percent < 0 ? step : String.format(Locale.ROOT, "%3d%% %s", percent, step));
        lastStep = step;
        lastDecile = decile;
    }

    @Override
    public synchronized void onTransfer(TransferStats stats) {
        out.println("     " + stats.fileName() + " [" + stats.patchIndex() + "/" + stats.patchCount() + "] " + stats);
    }
}
