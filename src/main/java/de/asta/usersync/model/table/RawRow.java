package de.asta.usersync.model.table;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RawRow(List<RawCell> data) {

    public RawRow {
        data = data != null ? List.copyOf(data) : List.of();
    }
}
