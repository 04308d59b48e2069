package de.asta.usersync.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Envelope of Nextcloud OCS API responses: {@code {"ocs": {"meta": ..., "data": ...}}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OcsResponse<T>(Ocs<T> ocs) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Ocs<T>(T data) {}
}
