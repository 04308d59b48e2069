package de.asta.usersync.service.reconciliation;

import de.asta.usersync.client.BackendAdapter;
import de.asta.usersync.client.RoleCatalogBackend;
import de.asta.usersync.model.domain.DesiredState;
import de.asta.usersync.model.domain.ProviderUser;
import de.asta.usersync.model.dto.ReconciliationPlan;
import de.asta.usersync.model.dto.SyncSummary;
import de.asta.usersync.service.reconciliation.RoleCatalogSynchronizer.CatalogSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs one full pass against one backend.
 *
 * Order: creates, updates, role catalog sync (role-capable backends only), deletes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackendSyncService {

    private final ReconciliationEngine reconciliationEngine;
    private final RoleCatalogSynchronizer roleCatalogSynchronizer;

    public <P extends ProviderUser> SyncSummary synchronize(DesiredState desired, BackendAdapter<P> backend) {
        MDC.put("backend", backend.name());
        try {
            log.info("🔄 Starting sync of {}...", backend.name());

            // 1. Desired and actual state
            DesiredState scoped = backend.scope(desired);
            List<P> actual = backend.fetchActualUsers();
            log.info("📥 {} desired users, {} users in {}", scoped.size(), actual.size(), backend.name());

            // 2. Diff
            ReconciliationPlan<P> plan = reconciliationEngine.plan(scoped, actual);
            log.info("Users to create: {}", plan.toCreate().size());
            log.info("Users to update: {}", plan.toUpdate().size());
            log.info("Users to delete: {}", plan.toDelete().size());

            // 3. Apply
            int created = reconciliationEngine.applyCreates(plan, backend);
            int updated = reconciliationEngine.applyUpdates(plan, backend);

            int rolesCreated = 0;
            int assignmentsChanged = 0;
            if (backend instanceof RoleCatalogBackend<P> roleBackend) {
                CatalogSnapshot catalog = roleCatalogSynchronizer.synchronizeCatalog(scoped, roleBackend);
                rolesCreated = catalog.created();
                assignmentsChanged = roleCatalogSynchronizer.synchronizeAssignments(
                        plan.toUpdate(), catalog.entries(), roleBackend);
            }

            int deleted = reconciliationEngine.applyDeletes(plan, backend);

            SyncSummary summary = new SyncSummary(backend.name(), created, updated, deleted, rolesCreated, assignmentsChanged);
            log.info("✅ Sync of {} complete: {}", backend.name(), summary);
            return summary;
        } finally {
            MDC.remove("backend");
        }
    }
}
