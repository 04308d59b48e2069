package de.asta.usersync.model.domain;

/**
 * A user as it currently exists in a backend.
 */
public interface ProviderUser {

    /** The backend's own id for this user. */
    String providerId();

    /** The key compared against {@link CanonicalUser#identifier()}. */
    String identifier();
}
