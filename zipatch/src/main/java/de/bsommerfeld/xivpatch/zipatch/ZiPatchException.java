package de.bsommerfeld.xivpatch.zipatch;

import java.io.IOException;

/**
 * Base class for failures while reading or applying a ZiPatch file.
 */
public class ZiPatchException extends IOException {

    public ZiPatchException(String message) {
        super(message);
    }

    public ZiPatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
