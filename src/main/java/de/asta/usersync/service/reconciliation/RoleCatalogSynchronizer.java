package de.asta.usersync.service.reconciliation;

import de.asta.usersync.client.RoleCatalogBackend;
import de.asta.usersync.model.domain.DesiredState;
import de.asta.usersync.model.domain.ProviderUser;
import de.asta.usersync.model.domain.RoleCatalogEntry;
import de.asta.usersync.model.dto.MatchedUser;
import de.asta.usersync.model.dto.RoleAssignment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converges role catalog and role assignments of a {@link RoleCatalogBackend}.
 *
 * <ol>
 *   <li>Catalog phase: every role name some desired user holds is created once if the catalog
 *   lacks it, then the catalog is fetched again.</li>
 *   <li>Assignment phase: for every user matched to an existing backend account, the assigned
 *   roles are fetched and diffed against the desired roles.</li>
 * </ol>
 * Users created in the same pass are not assigned roles until the next run.
 */
@Slf4j
@Service
public class RoleCatalogSynchronizer {

    /**
     * The catalog as re-fetched after the catalog phase.
     */
    public record CatalogSnapshot(List<RoleCatalogEntry> entries, int created) {}

    /**
     * Creates missing roles and returns the refreshed catalog.
     */
    public CatalogSnapshot synchronizeCatalog(DesiredState desired, RoleCatalogBackend<?> backend) {
        Set<String> existing = backend.fetchRoleCatalog().stream()
                .map(RoleCatalogEntry::name)
                .collect(Collectors.toSet());

        int created = 0;
        for (String roleName : desired.allRoleNames()) {
            if (!existing.contains(roleName)) {
                log.info("Create role {}", roleName);
                backend.createRole(roleName);
                created++;
            }
        }
        log.info("Role catalog of {}: {} roles created", backend.name(), created);
        return new CatalogSnapshot(backend.fetchRoleCatalog(), created);
    }

    /**
     * @return number of users whose assignments changed
     */
    public <P extends ProviderUser> int synchronizeAssignments(List<MatchedUser<P>> matchedUsers,
                                                               List<RoleCatalogEntry> catalog,
                                                               RoleCatalogBackend<P> backend) {
        int changed = 0;
        for (MatchedUser<P> match : matchedUsers) {
            List<RoleCatalogEntry> assigned = backend.fetchUserRoles(match.providerUser());
            RoleAssignment assignment = RoleAssignment.compute(match.desired().roles(), catalog, assigned);
            if (assignment.isEmpty()) {
                log.debug("Roles of {} are in sync", match.desired().identifier());
                continue;
            }
            log.debug("Roles of {}: +{} -{}", match.desired().identifier(),
                    assignment.rolesToAdd(), assignment.rolesToRemove());
            backend.assignRoles(match.providerUser(), assignment.rolesToAdd(), assignment.rolesToRemove());
            changed++;
        }
        return changed;
    }
}
