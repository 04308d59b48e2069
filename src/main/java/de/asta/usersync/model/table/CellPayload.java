package de.asta.usersync.model.table;

import java.util.List;

/**
 * The untyped value carried by a raw table cell. It has no tag tying it to a column kind;
 * compatibility with the schema is decided by the decoder.
 */
public sealed interface CellPayload permits CellPayload.NumberPayload, CellPayload.TextPayload, CellPayload.ListPayload {

    record NumberPayload(long value) implements CellPayload {}

    record TextPayload(String value) implements CellPayload {}

    record ListPayload(List<Long> values) implements CellPayload {
        public ListPayload {
            values = List.copyOf(values);
        }
    }
}
