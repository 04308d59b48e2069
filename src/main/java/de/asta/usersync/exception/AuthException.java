package de.asta.usersync.exception;

/**
 * A bearer credential could not be acquired for a backend.
 */
public class AuthException extends UserSyncException {

    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
