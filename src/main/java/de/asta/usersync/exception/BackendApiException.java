package de.asta.usersync.exception;

/**
 * A call against a backend failed. Aborts the remainder of that backend's pass.
 */
public class BackendApiException extends UserSyncException {

    private final String backend;

    public BackendApiException(String backend, String message) {
        super("[" + backend + "] " + message);
        this.backend = backend;
    }

    public BackendApiException(String backend, String message, Throwable cause) {
        super("[" + backend + "] " + message, cause);
        this.backend = backend;
    }

    public String getBackend() {
        return backend;
    }
}
