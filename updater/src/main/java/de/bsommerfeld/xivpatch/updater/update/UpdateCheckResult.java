package de.bsommerfeld.xivpatch.updater.update;

import de.bsommerfeld.xivpatch.updater.model.UpdatePlan;

/**
 * Result of comparing the local installation against the patch server.
 *
 * @param plan         patches to apply; empty when up to date, {@code null} on failure
 * @param errorMessage human readable failure, {@code null} on success
 */
public record UpdateCheckResult(UpdatePlan plan, String errorMessage) {

    public static UpdateCheckResult noUpdate(UpdatePlan emptyPlan) {
        return new UpdateCheckResult(emptyPlan, null);
    }

    public static UpdateCheckResult updateAvailable(UpdatePlan plan) {
        return new UpdateCheckResult(plan, null);
    }

    public static UpdateCheckResult failed(String errorMessage) {
        return new UpdateCheckResult(null, errorMessage);
    }

    public boolean isFailed() {
        return errorMessage != null;
    }

    public boolean isUpdateAvailable() {
        return plan != null && !plan.isEmpty();
    }
}
