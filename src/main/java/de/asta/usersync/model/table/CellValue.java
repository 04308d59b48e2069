package de.asta.usersync.model.table;

import java.util.List;

/**
 * A decoded, typed table cell.
 */
public sealed interface CellValue permits CellValue.StringValue, CellValue.BoolValue, CellValue.ListValue {

    record StringValue(String value) implements CellValue {}

    record BoolValue(boolean value) implements CellValue {}

    record ListValue(List<String> values) implements CellValue {
        public ListValue {
            values = List.copyOf(values);
        }
    }
}
