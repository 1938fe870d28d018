package de.bsommerfeld.xivpatch.updater.update;

/**
 * Receives state changes and progress of the {@link UpdateCoordinator}.
 * Called on the thread running the update; implementations that touch UI
 * state must hand the events over themselves.
 */
public interface UpdateListener {

    UpdateListener NONE = new UpdateListener() {
    };

    default void onStateChanged(UpdateState state) {
    }

    default void onProgress(UpdateProgress progress) {
    }

    /** Sampled at most once per speed report interval while downloading. */
    default void onTransfer(TransferStats stats) {
    }
}
