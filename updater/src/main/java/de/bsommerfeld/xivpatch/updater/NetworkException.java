package de.bsommerfeld.xivpatch.updater;

/**
 * Transport failure, timeout or non-success HTTP status.
 */
public class NetworkException extends UpdateException {

    private final int statusCode;

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public NetworkException(int statusCode, String url) {
        super("HTTP " + statusCode + " for " + url);
        this.statusCode = statusCode;
    }

    /** The HTTP status, or {@code -1} if the request never got a response. */
    public int getStatusCode() {
        return statusCode;
    }
}
