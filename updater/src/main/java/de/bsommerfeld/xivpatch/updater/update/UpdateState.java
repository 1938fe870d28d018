package de.bsommerfeld.xivpatch.updater.update;

/** Lifecycle of the {@link UpdateCoordinator}. */
public enum UpdateState {
    IDLE,
    CHECKING_VERSION,
    DOWNLOADING,
    INSTALLING,
    COMPLETED,
    FAILED,
    CANCELLED
}
