package de.asta.usersync.exception;

/**
 * The desired state could not be loaded: unreadable or malformed users file, or a failed
 * table schema/row fetch. Raised before any backend is touched.
 */
public class SourceException extends UserSyncException {

    public SourceException(String message) {
        super(message);
    }

    public SourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
