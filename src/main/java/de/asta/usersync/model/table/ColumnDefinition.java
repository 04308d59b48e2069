package de.asta.usersync.model.table;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Optional;

/**
 * One column of a table schema, as described by the Nextcloud Tables scheme endpoint.
 *
 * The set of kinds is closed: {@link TextColumn}, {@link SelectionColumn}, and
 * {@link UnsupportedColumn} for every column type this tool does not interpret
 * (number, datetime, ...). Cells of unsupported columns are always dropped by the decoder.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type", defaultImpl = ColumnDefinition.UnsupportedColumn.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = ColumnDefinition.TextColumn.class, name = "text"),
        @JsonSubTypes.Type(value = ColumnDefinition.SelectionColumn.class, name = "selection")
})
public sealed interface ColumnDefinition
        permits ColumnDefinition.TextColumn, ColumnDefinition.SelectionColumn, ColumnDefinition.UnsupportedColumn {

    long id();

    String title();

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TextColumn(long id, String title) implements ColumnDefinition {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SelectionColumn(
            long id,
            String title,
            SelectionType subtype,
            @JsonProperty("selectionOptions") List<SelectionOption> options
    ) implements ColumnDefinition {

        public SelectionColumn {
            options = options != null ? List.copyOf(options) : List.of();
        }

        public Optional<SelectionOption> findOption(long optionId) {
            return options.stream()
                    .filter(option -> option.id() == optionId)
                    .findFirst();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record UnsupportedColumn(long id, String title) implements ColumnDefinition {}
}
