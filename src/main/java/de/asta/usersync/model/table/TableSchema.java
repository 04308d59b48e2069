package de.asta.usersync.model.table;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Optional;

/**
 * Column schema of a table. Column ids are unique, titles are not.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TableSchema(String title, List<ColumnDefinition> columns) {

    public TableSchema {
        columns = columns != null ? List.copyOf(columns) : List.of();
    }

    public Optional<ColumnDefinition> findColumn(long columnId) {
        return columns.stream()
                .filter(column -> column.id() == columnId)
                .findFirst();
    }
}
