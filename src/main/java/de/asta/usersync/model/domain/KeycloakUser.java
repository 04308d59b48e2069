package de.asta.usersync.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Keycloak user representation, reduced to the fields this tool reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record KeycloakUser(
    String id,
    String username,
    String email,
    String firstName,
    String lastName,
    Boolean enabled
) implements ProviderUser {

    @Override
    public String providerId() {
        return id;
    }

    @Override
    public String identifier() {
        return username;
    }
}
