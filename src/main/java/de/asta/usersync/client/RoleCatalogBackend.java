package de.asta.usersync.client;

import de.asta.usersync.model.domain.ProviderUser;
import de.asta.usersync.model.domain.RoleCatalogEntry;

import java.util.List;

/**
 * A backend with a named, backend-wide role catalog that is separate from per-user assignment.
 */
public interface RoleCatalogBackend<P extends ProviderUser> extends BackendAdapter<P> {

    List<RoleCatalogEntry> fetchRoleCatalog();

    void createRole(String name);

    List<RoleCatalogEntry> fetchUserRoles(P providerUser);

    void addRoles(P providerUser, List<RoleCatalogEntry> roles);

    void removeRoles(P providerUser, List<RoleCatalogEntry> roles);

    /**
     * Applies one user's role diff. Empty sides issue no request.
     */
    default void assignRoles(P providerUser, List<RoleCatalogEntry> rolesToAdd, List<RoleCatalogEntry> rolesToRemove) {
        if (!rolesToAdd.isEmpty()) {
            addRoles(providerUser, rolesToAdd);
        }
        if (!rolesToRemove.isEmpty()) {
            removeRoles(providerUser, rolesToRemove);
        }
    }
}
