package de.asta.usersync.model.domain;

/**
 * A role registered in a backend-wide role catalog.
 */
public record RoleCatalogEntry(String providerRoleId, String name) {}
