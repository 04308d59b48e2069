package de.asta.usersync.model.dto;

import de.asta.usersync.model.domain.RoleCatalogEntry;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The role diff of a single user.
 */
public record RoleAssignment(List<RoleCatalogEntry> rolesToAdd, List<RoleCatalogEntry> rolesToRemove) {

    public RoleAssignment {
        rolesToAdd = List.copyOf(rolesToAdd);
        rolesToRemove = List.copyOf(rolesToRemove);
    }

    /**
     * @param desiredRoles role names the user should hold
     * @param catalog     the backend's role catalog, fetched after missing roles were created
     * @param assigned    roles the user currently holds
     */
    public static RoleAssignment compute(Collection<String> desiredRoles,
                                         List<RoleCatalogEntry> catalog,
                                         List<RoleCatalogEntry> assigned) {
        Set<String> desired = new HashSet<>(desiredRoles);
        Set<String> alreadyAssigned = assigned.stream()
                .map(RoleCatalogEntry::name)
                .collect(Collectors.toSet());

        List<RoleCatalogEntry> toAdd = catalog.stream()
                .filter(role -> desired.contains(role.name()))
                .filter(role -> !alreadyAssigned.contains(role.name()))
                .collect(Collectors.toList());
        List<RoleCatalogEntry> toRemove = assigned.stream()
                .filter(role -> !desired.contains(role.name()))
                .collect(Collectors.toList());
        return new RoleAssignment(toAdd, toRemove);
    }

    public boolean isEmpty() {
        return rolesToAdd.isEmpty() && rolesToRemove.isEmpty();
    }
}
