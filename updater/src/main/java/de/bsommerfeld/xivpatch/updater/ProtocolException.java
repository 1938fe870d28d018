package de.bsommerfeld.xivpatch.updater;

/**
 * A manifest line cannot be parsed. Parsers recover from this by dropping
 * the line.
 */
public class ProtocolException extends UpdateException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
