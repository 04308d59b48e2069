package de.asta.usersync.client.impl;

import de.asta.usersync.exception.SourceException;
import de.asta.usersync.model.table.CellPayload;
import de.asta.usersync.model.table.ColumnDefinition;
import de.asta.usersync.model.table.ColumnDefinition.SelectionColumn;
import de.asta.usersync.model.table.RawRow;
import de.asta.usersync.model.table.SelectionType;
import de.asta.usersync.model.table.TableSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("NextcloudTablesClient Tests")
class NextcloudTablesClientTest {

    private static final String BASE_URL = "https://cloud.example.org";

    private MockRestServiceServer server;
    private NextcloudTablesClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri(BASE_URL).build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new NextcloudTablesClient(restTemplate);
    }

    @Test
    @DisplayName("Schema is unwrapped from the OCS envelope with every column kind")
    void fetchesSchema() {
        server.expect(requestTo(BASE_URL + "/ocs/v2.php/apps/tables/api/2/tables/scheme/7"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        {"ocs": {"meta": {"status": "ok", "statuscode": 200},
                                 "data": {"title": "Funktionen", "columns": [
                          {"id": 1, "title": "Funktionskennung", "type": "text", "subtype": "line"},
                          {"id": 2, "title": "Funktion", "type": "selection", "subtype": "multi",
                           "selectionOptions": [{"id": 1, "label": "Admin"}, {"id": 2, "label": "Kasse"}]},
                          {"id": 3, "title": "Fachschaft", "type": "selection", "subtype": "",
                           "selectionOptions": [{"id": 4, "label": "CS"}]},
                          {"id": 4, "title": "Aktiv", "type": "selection", "subtype": "check"},
                          {"id": 5, "title": "Seit", "type": "datetime", "subtype": "date"}
                        ]}}}
                        """, MediaType.APPLICATION_JSON));

        TableSchema schema = client.fetchSchema(7);

        assertThat(schema.title()).isEqualTo("Funktionen");
        assertThat(schema.columns()).extracting(ColumnDefinition::title)
                .containsExactly("Funktionskennung", "Funktion", "Fachschaft", "Aktiv", "Seit");
        assertThat(schema.columns().get(0)).isInstanceOf(ColumnDefinition.TextColumn.class);
        SelectionColumn roles = (SelectionColumn) schema.columns().get(1);
        assertThat(roles.subtype()).isEqualTo(SelectionType.MULTI);
        assertThat(roles.findOption(2)).hasValueSatisfying(option -> assertThat(option.label()).isEqualTo("Kasse"));
        assertThat(((SelectionColumn) schema.columns().get(2)).subtype()).isEqualTo(SelectionType.SINGLE);
        assertThat(((SelectionColumn) schema.columns().get(3)).subtype()).isEqualTo(SelectionType.CHECK);
        assertThat(schema.columns().get(4)).isInstanceOf(ColumnDefinition.UnsupportedColumn.class);
        server.verify();
    }

    @Test
    @DisplayName("Row cells are classified by the shape of their value")
    void fetchesRows() {
        server.expect(requestTo(BASE_URL + "/index.php/apps/tables/api/1/tables/7/rows"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        [{"id": 11, "tableId": 7, "data": [
                          {"columnId": 1, "value": "jdoe"},
                          {"columnId": 2, "value": [1, 2]},
                          {"columnId": 3, "value": 4},
                          {"columnId": 4, "value": {"unexpected": true}},
                          {"columnId": 5, "value": 1.5}
                        ]}]
                        """, MediaType.APPLICATION_JSON));

        List<RawRow> rows = client.fetchRows(7);

        assertThat(rows).hasSize(1);
        RawRow row = rows.get(0);
        assertThat(row.data()).hasSize(5);
        assertThat(row.data().get(0).payload()).isEqualTo(new CellPayload.TextPayload("jdoe"));
        assertThat(row.data().get(1).payload()).isEqualTo(new CellPayload.ListPayload(List.of(1L, 2L)));
        assertThat(row.data().get(2).payload()).isEqualTo(new CellPayload.NumberPayload(4));
        assertThat(row.data().get(3).payload()).isNull();
        assertThat(row.data().get(4).payload()).isNull();
        server.verify();
    }

    @Test
    @DisplayName("A failed fetch is reported as a source failure")
    void failedFetch() {
        server.expect(requestTo(BASE_URL + "/index.php/apps/tables/api/1/tables/7/rows"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.fetchRows(7))
                .isInstanceOf(SourceException.class)
                .hasMessageContaining("table 7");
    }

    @Test
    @DisplayName("A schema response without data is rejected")
    void emptySchema() {
        server.expect(requestTo(BASE_URL + "/ocs/v2.php/apps/tables/api/2/tables/scheme/7"))
                .andRespond(withSuccess("{\"ocs\": {\"meta\": {\"status\": \"ok\"}}}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.fetchSchema(7)).isInstanceOf(SourceException.class);
    }
}
