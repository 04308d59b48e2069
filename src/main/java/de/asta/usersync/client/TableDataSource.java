package de.asta.usersync.client;

import de.asta.usersync.model.table.RawRow;
import de.asta.usersync.model.table.TableSchema;

import java.util.List;

/**
 * Read access to a table holding the canonical user data.
 */
public interface TableDataSource {

    TableSchema fetchSchema(long tableId);

    List<RawRow> fetchRows(long tableId);
}
