package de.bsommerfeld.xivpatch.updater.update;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Singleton;
import de.bsommerfeld.xivpatch.core.concurrent.CancellationToken;
import de.bsommerfeld.xivpatch.core.config.DownloadConfig;
import de.bsommerfeld.xivpatch.updater.HashMismatchException;
import de.bsommerfeld.xivpatch.updater.UpdateException;
import de.bsommerfeld.xivpatch.updater.api.PatchListClient;
import de.bsommerfeld.xivpatch.updater.api.VersionCheckClient;
import de.bsommerfeld.xivpatch.updater.download.DownloadProgressListener;
import de.bsommerfeld.xivpatch.updater.download.PatchDownloader;
import de.bsommerfeld.xivpatch.updater.download.PatchVerifier;
import de.bsommerfeld.xivpatch.updater.model.GameInstallation;
import de.bsommerfeld.xivpatch.updater.model.PatchDescriptor;
import de.bsommerfeld.xivpatch.updater.model.UpdatePlan;
import de.bsommerfeld.xivpatch.updater.model.VersionVector;
import de.bsommerfeld.xivpatch.updater.plan.PatchPlanner;
import de.bsommerfeld.xivpatch.zipatch.ZiPatchException;
import de.bsommerfeld.xivpatch.zipatch.ZiPatchInstaller;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives an installation from its local versions to the newest server
 * version.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 * 1. Read the local version files
 * 2. Ask the version check endpoint (or the full patch list on a fresh install)
 * 3. Plan the patches still needed
 * 4. Download every patch into the patch cache, skipping complete files
 * 5. Apply the patches in plan order, recording each repository version
 *    right after its patch applied
 * </pre>
 *
 * <h3>Runs</h3>
 * One run at a time: starting a check or an update while another is active
 * throws {@link IllegalStateException}. Within a run everything is strictly
 * sequential. Cancellation is observed before every patch, inside the
 * transfer loop and before every chunk; chunks applied before it stay
 * applied, and the version file of an interrupted patch is not touched, so
 * the next run applies that patch again from the start.
 */
@Singleton
public class UpdateCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(UpdateCoordinator.class);

    static final String PHASE_CHECK = "Checking for updates";
    static final String PHASE_DOWNLOAD = "Downloading patches";
    static final String PHASE_INSTALL = "Installing patches";

    private final VersionCheckClient versionCheckClient;
    private final PatchListClient patchListClient;
    private final PatchPlanner planner;
    private final PatchDownloader downloader;
    private final PatchVerifier verifier;
    private final ZiPatchInstaller installer;
    private final DownloadConfig downloadConfig;
    private final Ticker ticker;

    private final AtomicBoolean running = new AtomicBoolean();
    private final ExecutorService worker = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
            .setNameFormat("xivpatch-update-%d")
            .setDaemon(true)
            .build());

    private volatile UpdateState state = UpdateState.IDLE;

    @Inject
    public UpdateCoordinator(VersionCheckClient versionCheckClient, PatchListClient patchListClient,
            PatchPlanner planner, PatchDownloader downloader, PatchVerifier verifier,
            ZiPatchInstaller installer, DownloadConfig downloadConfig) {
        this(versionCheckClient, patchListClient, planner, downloader, verifier, installer, downloadConfig,
                Ticker.systemTicker());
    }

    @VisibleForTesting
    UpdateCoordinator(VersionCheckClient versionCheckClient, PatchListClient patchListClient,
            PatchPlanner planner, PatchDownloader downloader, PatchVerifier verifier,
            ZiPatchInstaller installer, DownloadConfig downloadConfig, Ticker ticker) {
        this.versionCheckClient = versionCheckClient;
        this.patchListClient = patchListClient;
        this.planner = planner;
        this.downloader = downloader;
        this.verifier = verifier;
        this.installer = installer;
        this.downloadConfig = downloadConfig;
        this.ticker = ticker;
    }

    public UpdateState state() {
        return state;
    }

    // =====================================================================
    // Check
    // =====================================================================

    public UpdateCheckResult checkForUpdates(Path root) {
        return checkForUpdates(root, UpdateListener.NONE);
    }

    /**
     * Compares the installation at {@code root} against the patch server.
     * Failures are reported in the result, never thrown.
     *
     * @throws IllegalStateException if another run is active
     */
    public UpdateCheckResult checkForUpdates(Path root, UpdateListener listener) {
        reserve();
        try {
            return check(root, listener);
        } finally {
            running.set(false);
        }
    }

    private UpdateCheckResult check(Path root, UpdateListener listener) {
        transition(UpdateState.CHECKING_VERSION, listener);
        listener.onProgress(UpdateProgress.indeterminate(PHASE_CHECK, "Reading local versions"));
        try {
            VersionVector local = new GameInstallation(root).readVersions();
            LOG.info("Local versions at {}: {}", root, local);

            List<PatchDescriptor> available;
            if (local.base().isEmpty()) {
                LOG.info("No base game version found, planning a fresh install");
                listener.onProgress(UpdateProgress.indeterminate(PHASE_CHECK, "Fetching full patch list"));
                available = patchListClient.fetchPatchList();
            } else {
                listener.onProgress(UpdateProgress.indeterminate(PHASE_CHECK, "Contacting patch server"));
                Optional<List<PatchDescriptor>> announced = versionCheckClient.checkVersion(local);
                if (announced.isEmpty()) {
                    transition(UpdateState.IDLE, listener);
                    listener.onProgress(UpdateProgress.of("Up to date", 1.0));
                    return UpdateCheckResult.noUpdate(UpdatePlan.empty(local));
                }
                available = announced.get();
            }

            UpdatePlan plan = planner.plan(available, local);
            transition(UpdateState.IDLE, listener);
            if (plan.isEmpty()) {
                listener.onProgress(UpdateProgress.of("Up to date", 1.0));
                return UpdateCheckResult.noUpdate(plan);
            }
            listener.onProgress(UpdateProgress.of("Update available",
                    plan.patchCount() + " patch(es), " + plan.formattedTotalSize(), 1.0));
            return UpdateCheckResult.updateAvailable(plan);
        } catch (CancellationException e) {
            LOG.info("Update check cancelled");
            transition(UpdateState.CANCELLED, listener);
            return UpdateCheckResult.failed("Update check cancelled");
        } catch (UpdateException | IOException | RuntimeException e) {
            LOG.error("Update check failed", e);
            transition(UpdateState.FAILED, listener);
            return UpdateCheckResult.failed(messageOf(e));
        }
    }

    // =====================================================================
    // Apply
    // =====================================================================

    public UpdateResult applyUpdate(Path root, UpdatePlan plan, CancellationToken token) {
        return applyUpdate(root, plan, token, UpdateListener.NONE);
    }

    /**
     * Downloads and installs {@code plan} on the calling thread.
     *
     * @throws IllegalStateException if another run is active
     */
    public UpdateResult applyUpdate(Path root, UpdatePlan plan, CancellationToken token, UpdateListener listener) {
        reserve();
        try {
            return apply(root, plan, token, listener);
        } finally {
            running.set(false);
        }
    }

    /**
     * Same as {@link #applyUpdate(Path, UpdatePlan, CancellationToken, UpdateListener)}
     * on the coordinator's worker thread. The run is reserved before this
     * method returns, so a second call fails immediately.
     *
     * @throws IllegalStateException if another run is active
     */
    public CompletableFuture<UpdateResult> applyUpdateAsync(Path root, UpdatePlan plan, CancellationToken token,
            UpdateListener listener) {
        reserve();
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return apply(root, plan, token, listener);
                } finally {
                    running.set(false);
                }
            }, worker);
        } catch (RejectedExecutionException e) {
            running.set(false);
            throw new IllegalStateException("Coordinator has been shut down", e);
        }
    }

    /** Stops the worker thread once queued runs finished. */
    public void shutdown() {
        worker.shutdown();
    }

    private UpdateResult apply(Path root, UpdatePlan plan, CancellationToken token, UpdateListener listener) {
        GameInstallation installation = new GameInstallation(root);
        try {
            transition(UpdateState.DOWNLOADING, listener);
            List<Path> files = downloadAll(plan, token, listener);

            transition(UpdateState.INSTALLING, listener);
            installAll(installation, plan, files, token, listener);

            transition(UpdateState.COMPLETED, listener);
            listener.onProgress(UpdateProgress.of("Update complete", 1.0));
            LOG.info("Applied {} patch(es) to {}", plan.patchCount(), root);
            return UpdateResult.completed();
        } catch (CancellationException e) {
            LOG.info("Update cancelled");
            transition(UpdateState.CANCELLED, listener);
            return UpdateResult.cancelled();
        } catch (UpdateException | IOException | RuntimeException e) {
            LOG.error("Update failed", e);
            transition(UpdateState.FAILED, listener);
            return UpdateResult.failed(messageOf(e));
        }
    }

    // =====================================================================
    // Pipeline Phases
    // =====================================================================

    private List<Path> downloadAll(UpdatePlan plan, CancellationToken token, UpdateListener listener)
            throws UpdateException, IOException {
        Path patchDirectory = downloadConfig.resolvePatchDirectory();
        TransferMeter meter = new TransferMeter(plan.totalSize(),
                downloadConfig.getSpeedReportIntervalMillis(), ticker);
        int count = plan.patchCount();
        List<Path> files = new ArrayList<>(count);

        for (int i = 0; i < count; i++) {
            token.throwIfCancellationRequested();
            PatchDescriptor patch = plan.patches().get(i);
            Path target = patchDirectory.resolve(patch.localPath());
            int index = i + 1;
            String detail = describe(patch, index, count);

            if (isCached(patch, target)) {
                LOG.info("Using cached {}", target);
                meter.skip(patch.size());
            } else {
                Files.deleteIfExists(target);
                downloader.download(patch, target, token, new DownloadProgressListener() {
                    @Override
                    public void onProgress(long bytesRead, long totalBytes) {
                        meter.progress(bytesRead);
                        listener.onProgress(UpdateProgress.of(PHASE_DOWNLOAD, detail, meter.ratio()));
                        meter.sample(patch.fileName(), index, count).ifPresent(listener::onTransfer);
                    }

                    @Override
                    public void onRetry(int attempt, int maxAttempts, Exception cause) {
                        listener.onProgress(UpdateProgress.indeterminate(PHASE_DOWNLOAD,
                                detail + ", retry " + attempt + " of " + maxAttempts));
                    }
                });
                verifyDownloaded(patch, target);
                meter.finishPatch(patch.size());
            }

            listener.onProgress(UpdateProgress.of(PHASE_DOWNLOAD, detail, meter.ratio()));
            files.add(target);
        }
        if (count > 0) {
            PatchDescriptor last = plan.patches().get(count - 1);
            listener.onTransfer(meter.snapshot(last.fileName(), count, count));
        }
        return files;
    }

    private void installAll(GameInstallation installation, UpdatePlan plan, List<Path> files,
            CancellationToken token, UpdateListener listener) throws UpdateException, IOException {
        int count = plan.patchCount();
        for (int i = 0; i < count; i++) {
            token.throwIfCancellationRequested();
            PatchDescriptor patch = plan.patches().get(i);
            Path file = files.get(i);
            String detail = describe(patch, i + 1, count);
            int done = i;

            listener.onProgress(UpdateProgress.of(PHASE_INSTALL, detail, (double) done / count));
            try {
                installer.install(file, installation.gameDir(), token, (chunk, position, length) ->
                        listener.onProgress(UpdateProgress.of(PHASE_INSTALL, detail,
                                (done + (double) position / Math.max(1, length)) / count)));
            } catch (ZiPatchException e) {
                throw new UpdateException("Failed to apply " + patch.fileName() + ": " + e.getMessage(), e);
            }

            installation.writeVersion(patch.repository(), patch.version());
            if (!downloadConfig.isKeepPatches()) {
                Files.deleteIfExists(file);
            }
        }
    }

    /** A cached file is reused when its size, and its hashes where known, match. */
    private boolean isCached(PatchDescriptor patch, Path target) throws UpdateException, IOException {
        if (!Files.isRegularFile(target) || Files.size(target) != patch.size()) {
            return false;
        }
        try {
            verifier.verify(patch, target);
            return true;
        } catch (HashMismatchException e) {
            LOG.warn("Cached {} is corrupt, downloading again: {}", target.getFileName(), e.getMessage());
            return false;
        }
    }

    private void verifyDownloaded(PatchDescriptor patch, Path target) throws UpdateException, IOException {
        try {
            verifier.verify(patch, target);
        } catch (HashMismatchException e) {
            Files.deleteIfExists(target);
            throw e;
        }
    }

    // =====================================================================
    // State
    // =====================================================================

    private void reserve() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("An update run is already active (" + state + ")");
        }
    }

    private void transition(UpdateState next, UpdateListener listener) {
        LOG.debug("State {} -> {}", state, next);
        state = next;
        listener.onStateChanged(next);
    }

    private static String describe(PatchDescriptor patch, int index, int count) {
        return patch.repositoryName() + "/" + patch.fileName() + " (" + index + " of " + count + ")";
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
