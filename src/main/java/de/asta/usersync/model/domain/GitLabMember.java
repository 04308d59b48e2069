package de.asta.usersync.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A GitLab user, either found through the user search or listed as a group member.
 * {@code accessLevel} is only set for group members.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitLabMember(
    long id,
    String username,
    @JsonProperty("access_level") Integer accessLevel
) implements ProviderUser {

    @Override
    public String providerId() {
        return String.valueOf(id);
    }

    @Override
    public String identifier() {
        return username;
    }
}
