package de.asta.usersync.client.impl;

import de.asta.usersync.client.RoleCatalogBackend;
import de.asta.usersync.config.UserSyncProperties;
import de.asta.usersync.exception.BackendApiException;
import de.asta.usersync.model.domain.CanonicalUser;
import de.asta.usersync.model.domain.KeycloakUser;
import de.asta.usersync.model.domain.RoleCatalogEntry;
import de.asta.usersync.model.dto.KeycloakRole;
import de.asta.usersync.model.dto.KeycloakUserPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Keycloak admin REST API for one realm. Users are keyed by username; realm roles form the
 * role catalog.
 */
@Slf4j
@Service
@Order(1)
@ConditionalOnProperty(name = "usersync.keycloak.enabled", havingValue = "true")
public class KeycloakAdminClient implements RoleCatalogBackend<KeycloakUser> {

    private static final ParameterizedTypeReference<List<KeycloakUser>> USER_LIST = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<KeycloakRole>> ROLE_LIST = new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final UserSyncProperties.Keycloak keycloak;

    public KeycloakAdminClient(@Qualifier("keycloakRestTemplate") RestTemplate restTemplate,
                               UserSyncProperties properties) {
        this.restTemplate = restTemplate;
        this.keycloak = properties.getKeycloak();
    }

    @Override
    public String name() {
        return "keycloak";
    }

    @Override
    public List<KeycloakUser> fetchActualUsers() {
        log.debug("Getting all users of realm {}", keycloak.getRealm());
        int pageSize = keycloak.getPageSize();
        List<KeycloakUser> users = new ArrayList<>();
        int first = 0;
        while (true) {
            int offset = first;
            List<KeycloakUser> page = call("list users", () -> restTemplate.exchange(
                    "/users?first={first}&max={max}", HttpMethod.GET, null, USER_LIST, offset, pageSize).getBody());
            if (page == null || page.isEmpty()) {
                break;
            }
            users.addAll(page);
            if (page.size() < pageSize) {
                break;
            }
            first += pageSize;
        }
        log.info("Retrieved {} users from Keycloak realm {}", users.size(), keycloak.getRealm());
        return users;
    }

    @Override
    public Optional<KeycloakUser> resolveIdentifier(String username) {
        List<KeycloakUser> matches = call("search user " + username, () -> restTemplate.exchange(
                "/users?username={username}&exact=true", HttpMethod.GET, null, USER_LIST, username).getBody());
        if (matches == null) {
            return Optional.empty();
        }
        return matches.stream()
                .filter(user -> username.equals(user.username()))
                .findFirst();
    }

    @Override
    public void create(CanonicalUser user) {
        log.info("Creating Keycloak user {}", user.identifier());
        call("create user " + user.identifier(), () ->
                restTemplate.postForEntity("/users", KeycloakUserPayload.from(user.identifier(), user), Void.class));
    }

    @Override
    public void update(KeycloakUser providerUser, CanonicalUser user) {
        log.info("Updating Keycloak user {}", providerUser.username());
        call("update user " + providerUser.username(), () -> {
            restTemplate.put("/users/{id}", KeycloakUserPayload.from(providerUser.username(), user), providerUser.id());
            return null;
        });
    }

    @Override
    public void delete(KeycloakUser providerUser) {
        if (keycloak.isDisableInsteadOfDelete()) {
            log.info("Disabling Keycloak user {}", providerUser.username());
            call("disable user " + providerUser.username(), () -> {
                restTemplate.put("/users/{id}", Map.of("enabled", false), providerUser.id());
                return null;
            });
            return;
        }
        log.info("Deleting Keycloak user {}", providerUser.username());
        call("delete user " + providerUser.username(), () -> {
            restTemplate.delete("/users/{id}", providerUser.id());
            return null;
        });
    }

    @Override
    public List<RoleCatalogEntry> fetchRoleCatalog() {
        log.debug("Getting all realm roles from Keycloak");
        List<KeycloakRole> roles = call("list realm roles",
                () -> restTemplate.exchange("/roles", HttpMethod.GET, null, ROLE_LIST).getBody());
        return toEntries(roles);
    }

    @Override
    public void createRole(String name) {
        log.info("Creating Keycloak realm role {}", name);
        call("create realm role " + name,
                () -> restTemplate.postForEntity("/roles", Map.of("name", name), Void.class));
    }

    @Override
    public List<RoleCatalogEntry> fetchUserRoles(KeycloakUser providerUser) {
        log.debug("Getting realm roles for user {}", providerUser.username());
        List<KeycloakRole> roles = call("list realm roles of " + providerUser.username(),
                () -> restTemplate.exchange("/users/{id}/role-mappings/realm", HttpMethod.GET, null, ROLE_LIST,
                        providerUser.id()).getBody());
        return toEntries(roles);
    }

    @Override
    public void addRoles(KeycloakUser providerUser, List<RoleCatalogEntry> roles) {
        log.info("Adding realm roles {} to {}", names(roles), providerUser.username());
        call("add realm roles to " + providerUser.username(), () -> restTemplate.exchange(
                "/users/{id}/role-mappings/realm", HttpMethod.POST, new HttpEntity<>(toRepresentations(roles)),
                Void.class, providerUser.id()));
    }

    @Override
    public void removeRoles(KeycloakUser providerUser, List<RoleCatalogEntry> roles) {
        log.info("Removing realm roles {} from {}", names(roles), providerUser.username());
        call("remove realm roles from " + providerUser.username(), () -> restTemplate.exchange(
                "/users/{id}/role-mappings/realm", HttpMethod.DELETE, new HttpEntity<>(toRepresentations(roles)),
                Void.class, providerUser.id()));
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientException e) {
            log.error("Keycloak call '{}' failed: {}", operation, e.getMessage());
            throw new BackendApiException(name(), operation + " failed", e);
        }
    }

    private static List<RoleCatalogEntry> toEntries(List<KeycloakRole> roles) {
        if (roles == null) {
            return Collections.emptyList();
        }
        return roles.stream().map(KeycloakRole::toCatalogEntry).collect(Collectors.toList());
    }

    private static List<KeycloakRole> toRepresentations(List<RoleCatalogEntry> roles) {
        return roles.stream().map(KeycloakRole::from).collect(Collectors.toList());
    }

    private static List<String> names(List<RoleCatalogEntry> roles) {
        return roles.stream().map(RoleCatalogEntry::name).collect(Collectors.toList());
    }
}
