package de.asta.usersync.model.dto;

import de.asta.usersync.model.domain.CanonicalUser;
import de.asta.usersync.model.domain.ProviderUser;

import java.util.List;

/**
 * The create/update/delete partition of one backend. Single use: consumed by the apply step.
 */
public record ReconciliationPlan<P extends ProviderUser>(
    List<CanonicalUser> toCreate,
    List<MatchedUser<P>> toUpdate,
    List<P> toDelete
) {

    public ReconciliationPlan {
        toCreate = List.copyOf(toCreate);
        toUpdate = List.copyOf(toUpdate);
        toDelete = List.copyOf(toDelete);
    }

    public boolean isEmpty() {
        return toCreate.isEmpty() && toUpdate.isEmpty() && toDelete.isEmpty();
    }
}
