package de.asta.usersync.model.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * The desired users of one run, keyed by identifier. Built once, never modified.
 */
public final class DesiredState {

    private final Map<String, CanonicalUser> users;

    private DesiredState(Map<String, CanonicalUser> users) {
        this.users = Collections.unmodifiableMap(users);
    }

    public static DesiredState of(Map<String, CanonicalUser> users) {
        Map<String, CanonicalUser> copy = new LinkedHashMap<>();
        users.forEach((identifier, user) -> {
            if (!identifier.equals(user.identifier())) {
                throw new IllegalArgumentException(
                        "Key '" + identifier + "' does not match user identifier '" + user.identifier() + "'");
            }
            copy.put(identifier, user);
        });
        return new DesiredState(copy);
    }

    public static DesiredState empty() {
        return new DesiredState(Map.of());
    }

    public Optional<CanonicalUser> get(String identifier) {
        return Optional.ofNullable(users.get(identifier));
    }

    public boolean contains(String identifier) {
        return users.containsKey(identifier);
    }

    public Collection<CanonicalUser> users() {
        return users.values();
    }

    public Set<String> identifiers() {
        return users.keySet();
    }

    public int size() {
        return users.size();
    }

    public boolean isEmpty() {
        return users.isEmpty();
    }

    /**
     * Every role name held by any desired user, without duplicates, in first-seen order.
     */
    public Set<String> allRoleNames() {
        Set<String> names = new LinkedHashSet<>();
        users.values().forEach(user -> names.addAll(user.roles()));
        return names;
    }

    public DesiredState filter(Predicate<CanonicalUser> predicate) {
        Map<String, CanonicalUser> filtered = new LinkedHashMap<>();
        users.forEach((identifier, user) -> {
            if (predicate.test(user)) {
                filtered.put(identifier, user);
            }
        });
        return new DesiredState(filtered);
    }

    @Override
    public String toString() {
        return "DesiredState{" + users.keySet() + "}";
    }
}
