package de.asta.usersync.service.source;

import de.asta.usersync.client.TableDataSource;
import de.asta.usersync.config.UserSyncProperties;
import de.asta.usersync.model.domain.DesiredState;
import de.asta.usersync.model.table.DecodedRow;
import de.asta.usersync.model.table.RawRow;
import de.asta.usersync.model.table.TableSchema;
import de.asta.usersync.service.extract.CanonicalUserExtractor;
import de.asta.usersync.service.table.TableDecoder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Builds the desired state from a Nextcloud table: fetch schema and rows, decode, extract.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "usersync.users-provider.type", havingValue = "nextcloud-table")
public class NextcloudTableUserSource implements UserSource {

    private final TableDataSource tableDataSource;
    private final TableDecoder tableDecoder;
    private final CanonicalUserExtractor extractor;
    private final long tableId;

    public NextcloudTableUserSource(TableDataSource tableDataSource,
                                    TableDecoder tableDecoder,
                                    CanonicalUserExtractor extractor,
                                    UserSyncProperties properties) {
        this.tableDataSource = tableDataSource;
        this.tableDecoder = tableDecoder;
        this.extractor = extractor;
        this.tableId = properties.getUsersProvider().getNextcloud().getTableId();
    }

    @Override
    public DesiredState load() {
        TableSchema schema = tableDataSource.fetchSchema(tableId);
        List<RawRow> rows = tableDataSource.fetchRows(tableId);
        List<DecodedRow> decoded = tableDecoder.decode(schema, rows);
        return extractor.extract(decoded);
    }
}
