package de.asta.usersync.service.reconciliation;

import de.asta.usersync.client.BackendAdapter;
import de.asta.usersync.exception.BackendApiException;
import de.asta.usersync.model.domain.CanonicalUser;
import de.asta.usersync.model.domain.DesiredState;
import de.asta.usersync.model.domain.ProviderUser;
import de.asta.usersync.model.dto.MatchedUser;
import de.asta.usersync.model.dto.ReconciliationPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Diffs desired users against a backend's actual users and applies the result.
 *
 * Planning is pure set membership on the identifier: there is no field-level comparison, an
 * update always pushes the full desired record. Applying runs creates, then updates, then
 * deletes, one user at a time. The first failing call ends the pass; operations already
 * applied stay applied.
 */
@Slf4j
@Service
public class ReconciliationEngine {

    public <P extends ProviderUser> ReconciliationPlan<P> plan(DesiredState desired, List<P> actual) {
        List<MatchedUser<P>> toUpdate = new ArrayList<>();
        List<P> toDelete = new ArrayList<>();
        Set<String> matched = new HashSet<>();

        for (P providerUser : actual) {
            String identifier = providerUser.identifier();
            CanonicalUser desiredUser = identifier != null ? desired.get(identifier).orElse(null) : null;
            if (desiredUser != null) {
                toUpdate.add(new MatchedUser<>(providerUser, desiredUser));
                matched.add(identifier);
            } else {
                toDelete.add(providerUser);
            }
        }

        List<CanonicalUser> toCreate = new ArrayList<>();
        for (CanonicalUser user : desired.users()) {
            if (!matched.contains(user.identifier())) {
                toCreate.add(user);
            }
        }

        return new ReconciliationPlan<>(toCreate, toUpdate, toDelete);
    }

    /**
     * Applies the whole plan: creates, updates, deletes.
     */
    public <P extends ProviderUser> void apply(ReconciliationPlan<P> plan, BackendAdapter<P> backend) {
        applyCreates(plan, backend);
        applyUpdates(plan, backend);
        applyDeletes(plan, backend);
    }

    public <P extends ProviderUser> int applyCreates(ReconciliationPlan<P> plan, BackendAdapter<P> backend) {
        for (CanonicalUser user : plan.toCreate()) {
            run(backend, "create", user.identifier(), () -> backend.create(user));
        }
        return plan.toCreate().size();
    }

    public <P extends ProviderUser> int applyUpdates(ReconciliationPlan<P> plan, BackendAdapter<P> backend) {
        for (MatchedUser<P> match : plan.toUpdate()) {
            run(backend, "update", match.desired().identifier(),
                    () -> backend.update(match.providerUser(), match.desired()));
        }
        return plan.toUpdate().size();
    }

    public <P extends ProviderUser> int applyDeletes(ReconciliationPlan<P> plan, BackendAdapter<P> backend) {
        for (P providerUser : plan.toDelete()) {
            run(backend, "delete", providerUser.identifier(), () -> backend.delete(providerUser));
        }
        return plan.toDelete().size();
    }

    private void run(BackendAdapter<?> backend, String operation, String identifier, Runnable call) {
        try {
            call.run();
        } catch (BackendApiException e) {
            log.error("❌ {} of {} on {} failed, aborting this backend", operation, identifier, backend.name());
            throw e;
        } catch (RuntimeException e) {
            log.error("❌ {} of {} on {} failed, aborting this backend", operation, identifier, backend.name(), e);
            throw new BackendApiException(backend.name(), operation + " of " + identifier + " failed", e);
        }
    }
}
