package de.asta.usersync.service.reconciliation;

import de.asta.usersync.client.BackendAdapter;
import de.asta.usersync.exception.BackendApiException;
import de.asta.usersync.helper.RecordingBackend;
import de.asta.usersync.model.domain.CanonicalUser;
import de.asta.usersync.model.domain.DesiredState;
import de.asta.usersync.model.domain.ProviderUser;
import de.asta.usersync.model.dto.SyncSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.util.List;

import static de.asta.usersync.helper.TestUsers.desired;
import static de.asta.usersync.helper.TestUsers.user;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("BackendSyncService Tests")
class BackendSyncServiceTest {

    private final BackendSyncService service =
            new BackendSyncService(new ReconciliationEngine(), new RoleCatalogSynchronizer());

    @Nested
    @DisplayName("Role-capable backend")
    class RoleCatalogBackendTests {

        @Test
        @DisplayName("Runs creates, updates, role sync and deletes in that order")
        void runsPhasesInOrder() {
            RecordingBackend backend = new RecordingBackend()
                    .withUser("keep")
                    .withUser("gone")
                    .withAssignedRole("keep", "Stale");
            DesiredState desired = desired(user("new", "CS"), user("keep", "CS"));

            SyncSummary summary = service.synchronize(desired, backend);

            assertThat(backend.calls()).containsExactly(
                    "create:new",
                    "update:keep",
                    "createRole:CS",
                    "addRoles:keep:[CS]",
                    "removeRoles:keep:[Stale]",
                    "delete:gone");
            assertThat(summary).isEqualTo(new SyncSummary("recording", 1, 1, 1, 1, 1));
        }

        @Test
        @DisplayName("Users created in this pass get no role assignment yet")
        void newUsersAreNotAssigned() {
            RecordingBackend backend = new RecordingBackend();

            service.synchronize(desired(user("new", "CS")), backend);

            assertThat(backend.callsStartingWith("addRoles")).isEmpty();
        }

        @Test
        @DisplayName("A failing update stops the pass before role sync and deletes")
        void failureAbortsPass() {
            RecordingBackend backend = new RecordingBackend()
                    .withUser("keep")
                    .withUser("gone")
                    .failOn("update:keep");

            assertThatThrownBy(() -> service.synchronize(desired(user("keep", "CS")), backend))
                    .isInstanceOf(BackendApiException.class);

            assertThat(backend.calls()).containsExactly("update:keep");
        }

        @Test
        @DisplayName("A failing role creation stops the pass before deletes")
        void roleCreationFailureSkipsDeletes() {
            RecordingBackend backend = new RecordingBackend()
                    .withUser("keep")
                    .withUser("gone")
                    .failOn("createRole:CS");

            assertThatThrownBy(() -> service.synchronize(desired(user("keep", "CS")), backend))
                    .isInstanceOf(BackendApiException.class)
                    .hasMessageContaining("createRole:CS");

            assertThat(backend.calls()).containsExactly("update:keep", "createRole:CS");
            assertThat(backend.callsStartingWith("delete:")).isEmpty();
        }

        @Test
        @DisplayName("A failing role assignment stops the pass before deletes")
        void roleAssignmentFailureSkipsDeletes() {
            RecordingBackend backend = new RecordingBackend()
                    .withUser("keep")
                    .withUser("other")
                    .withUser("gone")
                    .withRole("CS")
                    .failOn("addRoles:keep:[CS]");

            assertThatThrownBy(() -> service.synchronize(desired(user("keep", "CS"), user("other", "CS")), backend))
                    .isInstanceOf(BackendApiException.class)
                    .hasMessageContaining("addRoles:keep");

            assertThat(backend.callsStartingWith("addRoles:")).containsExactly("addRoles:keep:[CS]");
            assertThat(backend.callsStartingWith("delete:")).isEmpty();
        }

        @Test
        @DisplayName("The backend name is only on the MDC during the pass")
        void clearsMdc() {
            service.synchronize(DesiredState.empty(), new RecordingBackend("keycloak"));

            assertThat(MDC.get("backend")).isNull();
        }
    }

    @Nested
    @DisplayName("Plain backend")
    class PlainBackendTests {

        record Member(String providerId, String identifier) implements ProviderUser {}

        @Mock
        private BackendAdapter<Member> backend;

        @Test
        @DisplayName("Scopes the desired state and skips role sync")
        void scopesAndSkipsRoles() {
            DesiredState desired = desired(user("owner", "Owner"), user("other", "Member"));
            Member existing = new Member("7", "stale");
            when(backend.name()).thenReturn("gitlab");
            when(backend.scope(desired)).thenReturn(desired.filter(u -> u.hasRole("Owner")));
            when(backend.fetchActualUsers()).thenReturn(List.of(existing));

            SyncSummary summary = service.synchronize(desired, backend);

            verify(backend).create(desired.get("owner").orElseThrow());
            verify(backend, never()).create(desired.get("other").orElseThrow());
            verify(backend, never()).update(any(Member.class), any(CanonicalUser.class));
            verify(backend).delete(existing);
            assertThat(summary).isEqualTo(new SyncSummary("gitlab", 1, 0, 1, 0, 0));
        }

        @Test
        @DisplayName("Nothing to do issues no mutating call")
        void noChanges() {
            DesiredState desired = desired(user("same"));
            when(backend.name()).thenReturn("gitlab");
            when(backend.scope(desired)).thenReturn(desired);
            when(backend.fetchActualUsers()).thenReturn(List.of(new Member("1", "same")));

            SyncSummary summary = service.synchronize(desired, backend);

            verify(backend).update(new Member("1", "same"), desired.get("same").orElseThrow());
            verify(backend, never()).create(any());
            verify(backend, never()).delete(any());
            assertThat(summary.updated()).isEqualTo(1);
        }
    }
}
