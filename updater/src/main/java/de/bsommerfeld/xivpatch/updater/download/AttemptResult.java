package de.bsommerfeld.xivpatch.updater.download;

import de.bsommerfeld.xivpatch.updater.UpdateException;

/**
 * Outcome of a single download attempt. The retry loop only ever repeats
 * {@link Retryable} attempts.
 */
public sealed interface AttemptResult {

    record Success(long bytes) implements AttemptResult {
    }

    /** Transport or status failure; another attempt may succeed. */
    record Retryable(UpdateException cause) implements AttemptResult {
    }

    /** The server answered but the result is unusable; retrying would not help. */
    record Fatal(UpdateException cause) implements AttemptResult {
    }
}
