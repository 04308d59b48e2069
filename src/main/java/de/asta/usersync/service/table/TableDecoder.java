package de.asta.usersync.service.table;

import de.asta.usersync.model.table.CellPayload;
import de.asta.usersync.model.table.CellValue;
import de.asta.usersync.model.table.ColumnDefinition;
import de.asta.usersync.model.table.ColumnDefinition.SelectionColumn;
import de.asta.usersync.model.table.ColumnDefinition.TextColumn;
import de.asta.usersync.model.table.DecodedRow;
import de.asta.usersync.model.table.RawCell;
import de.asta.usersync.model.table.RawRow;
import de.asta.usersync.model.table.SelectionOption;
import de.asta.usersync.model.table.SelectionType;
import de.asta.usersync.model.table.TableSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves raw table rows against their column schema into typed cells.
 *
 * Decoding is lenient: a cell whose column is unknown, or whose payload does not fit the
 * column kind, is left out of the row. Nothing here throws for bad data.
 *
 * <pre>
 * Text             + text            -> StringValue
 * Selection/Check  + "true"|"false"  -> BoolValue
 * Selection/Single + number          -> StringValue(option label), if the option exists and has a label
 * Selection/Multi  + list            -> ListValue(labels of the labeled options that exist)
 * </pre>
 */
@Slf4j
@Service
public class TableDecoder {

    public List<DecodedRow> decode(TableSchema schema, List<RawRow> rows) {
        List<DecodedRow> decoded = new ArrayList<>(rows.size());
        for (RawRow row : rows) {
            decoded.add(decodeRow(schema, row));
        }
        return decoded;
    }

    DecodedRow decodeRow(TableSchema schema, RawRow row) {
        Map<String, CellValue> cells = new LinkedHashMap<>();
        for (RawCell cell : row.data()) {
            Optional<ColumnDefinition> column = schema.findColumn(cell.columnId());
            if (column.isEmpty()) {
                log.debug("Dropping cell of unknown column {}", cell.columnId());
                continue;
            }
            Optional<CellValue> value = resolve(column.get(), cell.payload());
            if (value.isEmpty()) {
                log.debug("Dropping cell of column '{}': payload {} does not fit {}",
                        column.get().title(), cell.payload(), column.get());
                continue;
            }
            cells.put(column.get().title(), value.get());
        }
        return new DecodedRow(cells);
    }

    Optional<CellValue> resolve(ColumnDefinition column, CellPayload payload) {
        if (payload == null) {
            return Optional.empty();
        }
        if (column instanceof TextColumn) {
            if (payload instanceof CellPayload.TextPayload text) {
                return Optional.of(new CellValue.StringValue(text.value()));
            }
            return Optional.empty();
        }
        if (column instanceof SelectionColumn selection) {
            return resolveSelection(selection, payload);
        }
        // UnsupportedColumn
        return Optional.empty();
    }

    private Optional<CellValue> resolveSelection(SelectionColumn column, CellPayload payload) {
        SelectionType subtype = column.subtype();
        if (subtype == SelectionType.CHECK && payload instanceof CellPayload.TextPayload text) {
            if ("true".equals(text.value())) {
                return Optional.of(new CellValue.BoolValue(true));
            }
            if ("false".equals(text.value())) {
                return Optional.of(new CellValue.BoolValue(false));
            }
            return Optional.empty();
        }
        if (subtype == SelectionType.SINGLE && payload instanceof CellPayload.NumberPayload number) {
            return column.findOption(number.value())
                    .filter(option -> option.label() != null)
                    .map(option -> new CellValue.StringValue(option.label()));
        }
        if (subtype == SelectionType.MULTI && payload instanceof CellPayload.ListPayload list) {
            List<String> labels = new ArrayList<>(list.values().size());
            for (Long optionId : list.values()) {
                Optional<SelectionOption> option = column.findOption(optionId);
                if (option.isPresent() && option.get().label() != null) {
                    labels.add(option.get().label());
                } else {
                    log.debug("Skipping unknown or unlabeled option {} in column '{}'", optionId, column.title());
                }
            }
            return Optional.of(new CellValue.ListValue(labels));
        }
        return Optional.empty();
    }
}
