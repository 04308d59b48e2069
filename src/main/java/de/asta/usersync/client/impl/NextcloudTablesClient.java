package de.asta.usersync.client.impl;

import de.asta.usersync.client.TableDataSource;
import de.asta.usersync.exception.SourceException;
import de.asta.usersync.model.dto.OcsResponse;
import de.asta.usersync.model.table.RawRow;
import de.asta.usersync.model.table.TableSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Collections;
import java.util.List;

/**
 * Reads table schema and rows from the Nextcloud Tables app.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "usersync.users-provider.type", havingValue = "nextcloud-table")
public class NextcloudTablesClient implements TableDataSource {

    private static final String SCHEME_PATH = "/ocs/v2.php/apps/tables/api/2/tables/scheme/{tableId}";
    private static final String ROWS_PATH = "/index.php/apps/tables/api/1/tables/{tableId}/rows";
    private static final ParameterizedTypeReference<OcsResponse<TableSchema>> SCHEMA_RESPONSE = new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<RawRow>> ROW_LIST = new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;

    public NextcloudTablesClient(@Qualifier("nextcloudRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public TableSchema fetchSchema(long tableId) {
        log.info("Fetching schema of table {} from Nextcloud...", tableId);
        try {
            ResponseEntity<OcsResponse<TableSchema>> response = restTemplate.exchange(
                    SCHEME_PATH, HttpMethod.GET, null, SCHEMA_RESPONSE, tableId);
            OcsResponse<TableSchema> body = response.getBody();
            if (body == null || body.ocs() == null || body.ocs().data() == null) {
                throw new SourceException("Empty schema response for table " + tableId);
            }
            TableSchema schema = body.ocs().data();
            log.info("Table '{}' has {} columns", schema.title(), schema.columns().size());
            return schema;
        } catch (RestClientException e) {
            throw new SourceException("Failed to fetch schema of table " + tableId, e);
        }
    }

    @Override
    public List<RawRow> fetchRows(long tableId) {
        log.info("Fetching rows of table {} from Nextcloud...", tableId);
        try {
            ResponseEntity<List<RawRow>> response = restTemplate.exchange(
                    ROWS_PATH, HttpMethod.GET, null, ROW_LIST, tableId);
            List<RawRow> rows = response.getBody() != null ? response.getBody() : Collections.emptyList();
            log.info("Retrieved {} rows from table {}", rows.size(), tableId);
            return rows;
        } catch (RestClientException e) {
            throw new SourceException("Failed to fetch rows of table " + tableId, e);
        }
    }
}
