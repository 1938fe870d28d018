package de.bsommerfeld.xivpatch.updater.update;

/**
 * Terminal outcome of {@link UpdateCoordinator#applyUpdate}.
 *
 * @param state        {@link UpdateState#COMPLETED}, {@link UpdateState#CANCELLED}
 *                     or {@link UpdateState#FAILED}
 * @param errorMessage set when failed
 */
public record UpdateResult(UpdateState state, String errorMessage) {

    public static UpdateResult completed() {
        return new UpdateResult(UpdateState.COMPLETED, null);
    }

    public static UpdateResult cancelled() {
        return new UpdateResult(UpdateState.CANCELLED, null);
    }

    public static UpdateResult failed(String errorMessage) {
        return new UpdateResult(UpdateState.FAILED, errorMessage);
    }

    public boolean isSuccess() {
        return state == UpdateState.COMPLETED;
    }
}
