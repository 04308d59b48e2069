package de.asta.usersync.client.impl;

import de.asta.usersync.client.BackendAdapter;
import de.asta.usersync.config.UserSyncProperties;
import de.asta.usersync.exception.BackendApiException;
import de.asta.usersync.model.domain.CanonicalUser;
import de.asta.usersync.model.domain.DesiredState;
import de.asta.usersync.model.domain.GitLabMember;
import de.asta.usersync.model.dto.GitLabMembershipRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Membership of a single GitLab group.
 *
 * Only users holding the configured owner or maintainer role are managed, and only if a GitLab
 * account with their identifier exists. GitLab accounts themselves are never created or deleted;
 * "create" adds a group member and "delete" removes one.
 */
@Slf4j
@Service
@Order(2)
@ConditionalOnProperty(name = "usersync.gitlab.enabled", havingValue = "true")
public class GitLabGroupClient implements BackendAdapter<GitLabMember> {

    static final int OWNER = 50;
    static final int MAINTAINER = 40;
    private static final int PAGE_SIZE = 100;
    private static final ParameterizedTypeReference<List<GitLabMember>> MEMBER_LIST = new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final UserSyncProperties.GitLab gitlab;

    // accounts resolved during scope(), reused by create()
    private final Map<String, GitLabMember> resolvedAccounts = new HashMap<>();

    public GitLabGroupClient(@Qualifier("gitlabRestTemplate") RestTemplate restTemplate,
                             UserSyncProperties properties) {
        this.restTemplate = restTemplate;
        this.gitlab = properties.getGitlab();
    }

    @Override
    public String name() {
        return "gitlab";
    }

    @Override
    public DesiredState scope(DesiredState desired) {
        DesiredState scoped = desired
                .filter(user -> user.hasRole(gitlab.getOwnerRole()) || user.hasRole(gitlab.getMaintainerRole()))
                .filter(user -> {
                    Optional<GitLabMember> account = resolveIdentifier(user.identifier());
                    if (account.isEmpty()) {
                        log.warn("No GitLab account for {}, skipping", user.identifier());
                        return false;
                    }
                    resolvedAccounts.put(user.identifier(), account.get());
                    return true;
                });
        log.info("{} of {} desired users are managed in GitLab group {}", scoped.size(), desired.size(), gitlab.getGroupId());
        return scoped;
    }

    @Override
    public List<GitLabMember> fetchActualUsers() {
        List<GitLabMember> members = new ArrayList<>();
        String page = "1";
        while (page != null && !page.isBlank()) {
            String current = page;
            ResponseEntity<List<GitLabMember>> response = call("list members of group " + gitlab.getGroupId(),
                    () -> restTemplate.exchange("/groups/{groupId}/members?per_page={perPage}&page={page}",
                            HttpMethod.GET, null, MEMBER_LIST, gitlab.getGroupId(), PAGE_SIZE, current));
            if (response.getBody() != null) {
                members.addAll(response.getBody());
            }
            page = response.getHeaders().getFirst("X-Next-Page");
        }
        log.info("Group {} has {} direct members", gitlab.getGroupId(), members.size());
        return members;
    }

    @Override
    public Optional<GitLabMember> resolveIdentifier(String username) {
        List<GitLabMember> matches = call("search user " + username, () -> restTemplate.exchange(
                "/users?username={username}", HttpMethod.GET, null, MEMBER_LIST, username).getBody());
        if (matches == null || matches.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(matches.get(matches.size() - 1));
    }

    @Override
    public void create(CanonicalUser user) {
        GitLabMember account = Optional.ofNullable(resolvedAccounts.get(user.identifier()))
                .or(() -> resolveIdentifier(user.identifier()))
                .orElseThrow(() -> new BackendApiException(name(), "No GitLab account for " + user.identifier()));
        int accessLevel = accessLevelFor(user);
        log.info("Adding {} to group {} with access level {}", user.identifier(), gitlab.getGroupId(), accessLevel);
        call("add member " + user.identifier(), () -> restTemplate.postForEntity(
                "/groups/{groupId}/members", new GitLabMembershipRequest(account.id(), accessLevel), Void.class,
                gitlab.getGroupId()));
    }

    @Override
    public void update(GitLabMember providerUser, CanonicalUser user) {
        int accessLevel = accessLevelFor(user);
        log.info("Setting access level of {} in group {} to {}", providerUser.username(), gitlab.getGroupId(), accessLevel);
        call("edit member " + providerUser.username(), () -> {
            restTemplate.put("/groups/{groupId}/members/{userId}", new GitLabMembershipRequest(null, accessLevel),
                    gitlab.getGroupId(), providerUser.id());
            return null;
        });
    }

    @Override
    public void delete(GitLabMember providerUser) {
        log.info("Removing {} from group {}", providerUser.username(), gitlab.getGroupId());
        call("remove member " + providerUser.username(), () -> {
            restTemplate.delete("/groups/{groupId}/members/{userId}", gitlab.getGroupId(), providerUser.id());
            return null;
        });
    }

    int accessLevelFor(CanonicalUser user) {
        return user.hasRole(gitlab.getOwnerRole()) ? OWNER : MAINTAINER;
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientException e) {
            log.error("GitLab call '{}' failed: {}", operation, e.getMessage());
            throw new BackendApiException(name(), operation + " failed", e);
        }
    }
}
