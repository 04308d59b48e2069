package de.asta.usersync.model.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * An immutable record of the state a user should have in every backend.
 *
 * {@code identifier} is the reconciliation key shared by all backends. Role order is kept and
 * duplicates are allowed.
 */
public record CanonicalUser(
    String identifier,
    String firstName,
    String lastName,
    String email,
    String matrixId,
    List<String> roles,
    boolean enabled
) {

    public CanonicalUser {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("identifier must not be empty");
        }
        roles = roles != null ? List.copyOf(roles) : List.of();
    }

    /**
     * Returns a copy of this user with {@code additionalRoles} appended to its roles.
     */
    public CanonicalUser withAppendedRoles(List<String> additionalRoles) {
        List<String> merged = new ArrayList<>(roles);
        merged.addAll(additionalRoles);
        return new CanonicalUser(identifier, firstName, lastName, email, matrixId, merged, enabled);
    }

    public boolean hasRole(String role) {
        return role != null && roles.contains(role);
    }
}
