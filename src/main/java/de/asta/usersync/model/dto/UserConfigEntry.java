package de.asta.usersync.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * One entry of the JSON users file. The identifier is the key of the surrounding object.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserConfigEntry {
    @JsonProperty("first_name")
    private String firstName;

    @JsonProperty("last_name")
    private String lastName;

    @JsonProperty("email")
    private String email;

    @JsonProperty("matrix_id")
    private String matrixId;

    @JsonProperty("roles")
    private List<String> roles;

    @JsonProperty("enabled")
    private boolean enabled = true;
}
