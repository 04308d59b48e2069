package de.asta.usersync.model.table;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Subtype of a selection column. Nextcloud sends an empty string for single selection.
 */
public enum SelectionType {
    SINGLE, MULTI, CHECK;

    /**
     * Maps the wire value to a subtype. Unknown subtypes map to {@code null}, which the
     * decoder treats like any other unmatched column kind.
     */
    @JsonCreator
    public static SelectionType fromWireValue(String value) {
        if (value == null || value.isEmpty()) {
            return SINGLE;
        }
        switch (value.toLowerCase()) {
            case "multi":
                return MULTI;
            case "check":
                return CHECK;
            default:
                return null;
        }
    }
}
