package de.asta.usersync.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import de.asta.usersync.model.domain.RoleCatalogEntry;

@JsonIgnoreProperties(ignoreUnknown = true)
public record KeycloakRole(String id, String name) {

    public static KeycloakRole from(RoleCatalogEntry entry) {
        return new KeycloakRole(entry.providerRoleId(), entry.name());
    }

    public RoleCatalogEntry toCatalogEntry() {
        return new RoleCatalogEntry(id, name);
    }
}
