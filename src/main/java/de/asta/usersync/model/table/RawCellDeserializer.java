package de.asta.usersync.model.table;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@code {"columnId": 3, "value": ...}} into a {@link RawCell}, classifying the value by
 * its JSON shape.
 */
public class RawCellDeserializer extends StdDeserializer<RawCell> {

    public RawCellDeserializer() {
        super(RawCell.class);
    }

    @Override
    public RawCell deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);
        long columnId = node.path("columnId").asLong();
        return new RawCell(columnId, toPayload(node.get("value")));
    }

    static CellPayload toPayload(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            return new CellPayload.TextPayload(value.textValue());
        }
        if (value.isIntegralNumber() && value.canConvertToLong()) {
            return new CellPayload.NumberPayload(value.longValue());
        }
        if (value.isArray()) {
            List<Long> ids = new ArrayList<>(value.size());
            for (JsonNode element : value) {
                if (!element.isIntegralNumber() || !element.canConvertToLong()) {
                    return null;
                }
                ids.add(element.longValue());
            }
            return new CellPayload.ListPayload(ids);
        }
        return null;
    }
}
