package de.asta.usersync.model.dto;

import de.asta.usersync.model.domain.CanonicalUser;
import de.asta.usersync.model.domain.ProviderUser;

/**
 * A backend user paired with the desired record sharing its identifier.
 */
public record MatchedUser<P extends ProviderUser>(P providerUser, CanonicalUser desired) {}
