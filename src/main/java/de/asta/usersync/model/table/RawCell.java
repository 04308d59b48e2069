package de.asta.usersync.model.table;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * A cell as returned by the rows endpoint. {@code payload} is {@code null} when the JSON value
 * has a shape that is neither a number, a string, nor a list of numbers.
 */
@JsonDeserialize(using = RawCellDeserializer.class)
public record RawCell(long columnId, CellPayload payload) {}
