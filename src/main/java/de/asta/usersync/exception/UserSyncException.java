package de.asta.usersync.exception;

/**
 * Base exception for every failure that aborts a sync run.
 */
public abstract class UserSyncException extends RuntimeException {

    protected UserSyncException(String message) {
        super(message);
    }

    protected UserSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
