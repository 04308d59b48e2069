package de.asta.usersync.model.dto;

import de.asta.usersync.model.domain.CanonicalUser;

/**
 * Body of the Keycloak create and update user calls. Updates always send the full record.
 */
public record KeycloakUserPayload(
    String username,
    String firstName,
    String lastName,
    String email,
    boolean enabled
) {

    public static KeycloakUserPayload from(String username, CanonicalUser user) {
        return new KeycloakUserPayload(username, user.firstName(), user.lastName(), user.email(), user.enabled());
    }
}
