package de.asta.usersync.service.extract;

import de.asta.usersync.config.UserSyncProperties;
import de.asta.usersync.model.domain.CanonicalUser;
import de.asta.usersync.model.domain.DesiredState;
import de.asta.usersync.model.table.DecodedRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps decoded table rows onto canonical users.
 *
 * A row becomes a user only if identifier, first name, last name, department and the role list
 * are all present with the expected cell type. Rows sharing an identifier are merged: the first
 * row's names and email win, roles of all rows are concatenated.
 */
@Slf4j
@Service
public class CanonicalUserExtractor {

    private final UserSyncProperties.ColumnMapping mapping;

    public CanonicalUserExtractor(UserSyncProperties properties) {
        this.mapping = properties.getColumnMapping();
    }

    public DesiredState extract(List<DecodedRow> rows) {
        Map<String, CanonicalUser> users = new LinkedHashMap<>();
        int dropped = 0;
        for (DecodedRow row : rows) {
            Optional<CanonicalUser> user = toUser(row);
            if (user.isEmpty()) {
                dropped++;
                log.debug("Dropping incomplete row {}", row);
                continue;
            }
            users.merge(user.get().identifier(), user.get(),
                    (existing, additional) -> existing.withAppendedRoles(additional.roles()));
        }
        log.info("Extracted {} users from {} rows ({} rows dropped)", users.size(), rows.size(), dropped);
        return DesiredState.of(users);
    }

    Optional<CanonicalUser> toUser(DecodedRow row) {
        Optional<String> identifier = row.getString(mapping.getIdentifier());
        Optional<String> firstName = row.getString(mapping.getFirstName());
        Optional<String> lastName = row.getString(mapping.getLastName());
        Optional<List<String>> baseRoles = row.getList(mapping.getRoles());
        Optional<String> department = row.getString(mapping.getDepartment());

        if (identifier.isEmpty() || identifier.get().isEmpty() || firstName.isEmpty() || lastName.isEmpty()
                || baseRoles.isEmpty() || department.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(new CanonicalUser(
                identifier.get(),
                firstName.get(),
                lastName.get(),
                identifier.get() + "@" + mapping.getEmailDomain(),
                null,
                deriveRoles(department.get(), baseRoles.get()),
                true));
    }

    /**
     * {@code ["Admin", "Finance"]} in department {@code CS} becomes
     * {@code ["CS - Admin", "CS - Finance", "CS"]}.
     */
    static List<String> deriveRoles(String department, List<String> baseRoles) {
        List<String> roles = new ArrayList<>(baseRoles.size() + 1);
        for (String role : baseRoles) {
            roles.add(department + " - " + role);
        }
        roles.add(department);
        return roles;
    }
}
