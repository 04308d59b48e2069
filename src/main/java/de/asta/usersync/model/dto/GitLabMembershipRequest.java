package de.asta.usersync.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GitLabMembershipRequest(
    @JsonProperty("user_id") Long userId,
    @JsonProperty("access_level") int accessLevel
) {}
