package de.asta.usersync.model.dto;

/**
 * What one backend pass changed.
 */
public record SyncSummary(
    String backend,
    int created,
    int updated,
    int deleted,
    int rolesCreated,
    int roleAssignmentsChanged
) {}
