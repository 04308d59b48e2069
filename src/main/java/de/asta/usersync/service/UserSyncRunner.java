package de.asta.usersync.service;

import de.asta.usersync.client.BackendAdapter;
import de.asta.usersync.model.domain.DesiredState;
import de.asta.usersync.model.dto.SyncSummary;
import de.asta.usersync.service.reconciliation.BackendSyncService;
import de.asta.usersync.service.source.UserSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs one sync on startup: load the desired state once, then converge every enabled backend
 * in order.
 *
 * Fail-fast: the first failure ends the run, backends after the failing one are not touched
 * and the process exits non-zero.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "usersync.runner.enabled", havingValue = "true", matchIfMissing = true)
public class UserSyncRunner implements CommandLineRunner {

    private final UserSource userSource;
    private final BackendSyncService backendSyncService;
    private final ObjectProvider<BackendAdapter<?>> backends;

    public UserSyncRunner(UserSource userSource,
                          BackendSyncService backendSyncService,
                          ObjectProvider<BackendAdapter<?>> backends) {
        this.userSource = userSource;
        this.backendSyncService = backendSyncService;
        this.backends = backends;
    }

    @Override
    public void run(String... args) {
        runOnce();
    }

    public List<SyncSummary> runOnce() {
        log.info("🚀 Starting user sync...");
        DesiredState desired = userSource.load();
        log.info("📥 Desired state contains {} users", desired.size());

        List<SyncSummary> summaries = new ArrayList<>();
        for (BackendAdapter<?> backend : backends.orderedStream().collect(Collectors.toList())) {
            try {
                summaries.add(backendSyncService.synchronize(desired, backend));
            } catch (RuntimeException e) {
                log.error("💥 Sync of {} failed, skipping remaining backends", backend.name(), e);
                throw e;
            }
        }

        if (summaries.isEmpty()) {
            log.warn("No backend is enabled, nothing to do");
        }
        log.info("✅ User sync complete: {}", summaries);
        return summaries;
    }
}
