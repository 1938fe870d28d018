package de.bsommerfeld.xivpatch.launcher;

import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.xivpatch.core.concurrent.CancellationToken;
import de.bsommerfeld.xivpatch.core.config.GameConfig;
import de.bsommerfeld.xivpatch.core.util.StorageUtils;
import de.bsommerfeld.xivpatch.updater.model.GameInstallation;
import de.bsommerfeld.xivpatch.updater.model.PatchDescriptor;
import de.bsommerfeld.xivpatch.updater.model.UpdatePlan;
import de.bsommerfeld.xivpatch.updater.update.UpdateCheckResult;
import de.bsommerfeld.xivpatch.updater.update.UpdateCoordinator;
import de.bsommerfeld.xivpatch.updater.update.UpdateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command-line entry point: <strong>detect → check → confirm → update</strong>.
 *
 * <h3>Exit codes</h3>
 * <ul>
 * <li>{@code 0}: up to date, updated, or the user declined</li>
 * <li>{@code 1}: the check or the update failed</li>
 * <li>{@code 2}: bad arguments or no installation found</li>
 * <li>{@code 130}: cancelled with Ctrl-C</li>
 * </ul>
 *
 * <h3>Thread model</h3>
 * The update runs on the coordinator's worker thread. A shutdown hook
 * cancels it on Ctrl-C and waits until the run unwound, so the current
 * chunk finishes and no version file is half written.
 */
public final class PatcherMain {

    static final String LOG_DIR_PROPERTY = "xivpatch.logs";

    static {
        // Read by logback.xml, must be set before the first logger exists
        if (System.getProperty(LOG_DIR_PROPERTY) == null) {
            System.setProperty(LOG_DIR_PROPERTY, StorageUtils.logsDir().toString());
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(PatcherMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_CANCELLED = 130;

    private static final long SHUTDOWN_GRACE_SECONDS = 30;

    private final UpdateCoordinator coordinator;
    private final GameConfig gameConfig;
    private final BufferedReader in;
    private final PrintStream out;
    private final CancellationToken token = new CancellationToken();
    private final CountDownLatch finished = new CountDownLatch(1);

    PatcherMain(UpdateCoordinator coordinator, GameConfig gameConfig, InputStream in, PrintStream out) {
        this.coordinator = coordinator;
        this.gameConfig = gameConfig;
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    public static void main(String[] args) {
        CommandLine commandLine;
        try {
            commandLine = CommandLine.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(CommandLine.USAGE);
            System.exit(EXIT_USAGE);
            return;
        }
        if (commandLine.help()) {
            System.out.println(CommandLine.USAGE);
            return;
        }

        Injector injector;
        try {
            injector = Guice.createInjector(new PatcherModule());
        } catch (CreationException e) {
            LOG.error("Failed to start patcher", e);
            System.exit(EXIT_FAILED);
            return;
        }

        UpdateCoordinator coordinator = injector.getInstance(UpdateCoordinator.class);
        PatcherMain patcher = new PatcherMain(coordinator, injector.getInstance(GameConfig.class), System.in, System.out);
        Runtime.getRuntime().addShutdownHook(new Thread(patcher::cancelAndAwait, "xivpatch-shutdown"));

        int exitCode = patcher.run(commandLine);
        coordinator.shutdown();
        System.exit(exitCode);
    }

    int run(CommandLine commandLine) {
        try {
            return execute(commandLine);
        } finally {
            finished.countDown();
        }
    }

    /** Requests cancellation and waits for the active run to unwind. */
    void cancelAndAwait() {
        if (finished.getCount() == 0) {
            return;
        }
        LOG.info("Cancelling update");
        token.cancel();
        try {
            if (!finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Update did not stop within {}s", SHUTDOWN_GRACE_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // =====================================================================
    // Pipeline Phases
    // =====================================================================

    private int execute(CommandLine commandLine) {
        Optional<Path> resolved = commandLine.gameRoot()
                .or(() -> GameInstallation.detect(gameConfig.getInstallPaths()).map(GameInstallation::root));
        if (resolved.isEmpty()) {
            out.println("No game installation found. Pass the game root, e.g. xivpatch \"D:\\FINAL FANTASY XIV TC\"");
            return EXIT_USAGE;
        }
        Path root = resolved.get().toAbsolutePath();
        if (!new GameInstallation(root).isValid()) {
            LOG.warn("{} has no game executable, treating it as a fresh install", root);
        }
        out.println("Game root: " + root);

        ConsoleProgressReporter reporter = new ConsoleProgressReporter(out);
        UpdateCheckResult check = coordinator.checkForUpdates(root, reporter);
        if (check.isFailed()) {
            out.println("Update check failed: " + check.errorMessage());
            return EXIT_FAILED;
        }
        if (!check.isUpdateAvailable()) {
            out.println("Game is up to date.");
            return EXIT_OK;
        }

        UpdatePlan plan = check.plan();
        printPlan(plan);
        if (commandLine.checkOnly()) {
            return EXIT_OK;
        }
        if (!commandLine.assumeYes() && !confirm(plan)) {
            out.println("Update skipped.");
            return EXIT_OK;
        }

        UpdateResult result = coordinator.applyUpdateAsync(root, plan, token, reporter).join();
        switch (result.state()) {
            case COMPLETED:
                out.println("Update complete.");
                return EXIT_OK;
            case CANCELLED:
                out.println("Update cancelled. Run again to resume.");
                return EXIT_CANCELLED;
            default:
                out.println("Update failed: " + result.errorMessage());
                return EXIT_FAILED;
        }
    }

    private void printPlan(UpdatePlan plan) {
        out.println(plan.patchCount() + " patch(es) to install, " + plan.formattedTotalSize() + ":");
        for (PatchDescriptor patch : plan.patches()) {
            out.println(String.format(Locale.ROOT, "  %-4s %-22s %10s  %s",
                    patch.repositoryName(), patch.version(), patch.formattedSize(), patch.fileName()));
        }
    }

    private boolean confirm(UpdatePlan plan) {
        out.print("Download and install " + plan.formattedTotalSize() + "? [y/N] ");
        out.flush();
        try {
            String answer = in.readLine();
            return answer != null && (answer.strip().equalsIgnoreCase("y") || answer.strip().equalsIgnoreCase("yes"));
        } catch (IOException e) {
            LOG.warn("Cannot read confirmation", e);
            return false;
        }
    }
}
