package de.asta.usersync.model.table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A table row resolved against its schema: column title to typed cell.
 */
public final class DecodedRow {

    private final Map<String, CellValue> cells;

    public DecodedRow(Map<String, CellValue> cells) {
        this.cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
    }

    public Map<String, CellValue> cells() {
        return cells;
    }

    public Optional<CellValue> get(String title) {
        return Optional.ofNullable(cells.get(title));
    }

    /** The text of the cell, or empty if the cell is absent or not a {@link CellValue.StringValue}. */
    public Optional<String> getString(String title) {
        return get(title)
                .filter(CellValue.StringValue.class::isInstance)
                .map(cell -> ((CellValue.StringValue) cell).value());
    }

    public Optional<List<String>> getList(String title) {
        return get(title)
                .filter(CellValue.ListValue.class::isInstance)
                .map(cell -> ((CellValue.ListValue) cell).values());
    }

    public Optional<Boolean> getBool(String title) {
        return get(title)
                .filter(CellValue.BoolValue.class::isInstance)
                .map(cell -> ((CellValue.BoolValue) cell).value());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return cells.equals(((DecodedRow) o).cells);
    }

    @Override
    public int hashCode() {
        return cells.hashCode();
    }

    @Override
    public String toString() {
        return "DecodedRow" + cells;
    }
}
