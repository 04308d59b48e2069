package de.asta.usersync.client;

import de.asta.usersync.model.domain.CanonicalUser;
import de.asta.usersync.model.domain.DesiredState;
import de.asta.usersync.model.domain.ProviderUser;

import java.util.List;
import java.util.Optional;

/**
 * A backend whose users are converged to the desired state. Implemented once per target system.
 *
 * Every mutating call is a single blocking request. Failures are reported as
 * {@link de.asta.usersync.exception.BackendApiException}.
 *
 * @param <P> the backend's user representation
 */
public interface BackendAdapter<P extends ProviderUser> {

    /** Short name used in logs and error messages. */
    String name();

    /**
     * Narrows the desired state to the users this backend manages. Defaults to all of them.
     */
    default DesiredState scope(DesiredState desired) {
        return desired;
    }

    List<P> fetchActualUsers();

    /**
     * Looks up a single backend user by username, for backends where listing and lookup are
     * separate calls.
     */
    Optional<P> resolveIdentifier(String username);

    void create(CanonicalUser user);

    /** Pushes the full desired record onto an existing backend user. */
    void update(P providerUser, CanonicalUser user);

    void delete(P providerUser);
}
