package de.asta.usersync.service.extract;

import de.asta.usersync.config.UserSyncProperties;
import de.asta.usersync.model.domain.CanonicalUser;
import de.asta.usersync.model.domain.DesiredState;
import de.asta.usersync.model.table.CellPayload;
import de.asta.usersync.model.table.CellValue;
import de.asta.usersync.model.table.ColumnDefinition;
import de.asta.usersync.model.table.DecodedRow;
import de.asta.usersync.model.table.RawCell;
import de.asta.usersync.model.table.RawRow;
import de.asta.usersync.model.table.SelectionOption;
import de.asta.usersync.model.table.SelectionType;
import de.asta.usersync.model.table.TableSchema;
import de.asta.usersync.service.table.TableDecoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CanonicalUserExtractor Tests")
class CanonicalUserExtractorTest {

    private CanonicalUserExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new CanonicalUserExtractor(new UserSyncProperties());
    }

    private static DecodedRow row(String identifier, String firstName, String lastName,
                                  String department, List<String> roles) {
        Map<String, CellValue> cells = new LinkedHashMap<>();
        if (identifier != null) cells.put("Funktionskennung", new CellValue.StringValue(identifier));
        if (firstName != null) cells.put("Vorname", new CellValue.StringValue(firstName));
        if (lastName != null) cells.put("Nachname", new CellValue.StringValue(lastName));
        if (department != null) cells.put("Fachschaft", new CellValue.StringValue(department));
        if (roles != null) cells.put("Funktion", new CellValue.ListValue(roles));
        return new DecodedRow(cells);
    }

    @Test
    @DisplayName("Complete row becomes a canonical user with derived roles and email")
    void extractsCompleteRow() {
        DesiredState state = extractor.extract(List.of(row("jdoe", "Jane", "Doe", "CS", List.of("Admin", "Finance"))));

        assertThat(state.size()).isEqualTo(1);
        CanonicalUser user = state.get("jdoe").orElseThrow();
        assertThat(user.firstName()).isEqualTo("Jane");
        assertThat(user.lastName()).isEqualTo("Doe");
        assertThat(user.email()).isEqualTo("jdoe@hhu.de");
        assertThat(user.matrixId()).isNull();
        assertThat(user.enabled()).isTrue();
        assertThat(user.roles()).containsExactly("CS - Admin", "CS - Finance", "CS");
    }

    @Test
    @DisplayName("Rows sharing an identifier merge: first scalars win, roles are concatenated")
    void mergesRepeatedIdentifiers() {
        DesiredState state = extractor.extract(List.of(
                row("abc123", "Anna", "Berg", "Math", List.of("X")),
                row("abc123", "Other", "Name", "Physics", List.of("Y"))));

        assertThat(state.size()).isEqualTo(1);
        CanonicalUser user = state.get("abc123").orElseThrow();
        assertThat(user.firstName()).isEqualTo("Anna");
        assertThat(user.lastName()).isEqualTo("Berg");
        assertThat(user.roles()).containsExactly("Math - X", "Math", "Physics - Y", "Physics");
    }

    @Test
    @DisplayName("Duplicate roles from merged rows are kept")
    void keepsDuplicateRoles() {
        DesiredState state = extractor.extract(List.of(
                row("abc123", "Anna", "Berg", "Math", List.of("X")),
                row("abc123", "Anna", "Berg", "Math", List.of("X"))));

        assertThat(state.get("abc123").orElseThrow().roles())
                .containsExactly("Math - X", "Math", "Math - X", "Math");
    }

    @Test
    @DisplayName("Incomplete rows are dropped entirely")
    void dropsIncompleteRows() {
        DesiredState state = extractor.extract(List.of(
                row(null, "Jane", "Doe", "CS", List.of("Admin")),
                row("a", null, "Doe", "CS", List.of("Admin")),
                row("b", "Jane", null, "CS", List.of("Admin")),
                row("c", "Jane", "Doe", null, List.of("Admin")),
                row("d", "Jane", "Doe", "CS", null),
                row("ok", "Jane", "Doe", "CS", List.of())));

        assertThat(state.identifiers()).containsExactly("ok");
        assertThat(state.get("ok").orElseThrow().roles()).containsExactly("CS");
    }

    @Test
    @DisplayName("Cells of the wrong variant count as missing")
    void dropsWrongVariants() {
        Map<String, CellValue> cells = new LinkedHashMap<>(row("jdoe", "Jane", "Doe", "CS", List.of("Admin")).cells());
        cells.put("Funktion", new CellValue.StringValue("Admin"));

        DesiredState state = extractor.extract(List.of(new DecodedRow(cells)));

        assertThat(state.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Column titles and mail domain follow the configured mapping")
    void usesConfiguredMapping() {
        UserSyncProperties properties = new UserSyncProperties();
        properties.getColumnMapping().setIdentifier("Login");
        properties.getColumnMapping().setEmailDomain("example.org");
        CanonicalUserExtractor custom = new CanonicalUserExtractor(properties);

        Map<String, CellValue> cells = new LinkedHashMap<>(row(null, "Jane", "Doe", "CS", List.of("Admin")).cells());
        cells.put("Login", new CellValue.StringValue("jdoe"));

        DesiredState state = custom.extract(List.of(new DecodedRow(cells)));

        assertThat(state.get("jdoe").orElseThrow().email()).isEqualTo("jdoe@example.org");
    }

    @Test
    @DisplayName("Decoded table rows end up as the expected canonical user")
    void endToEndFromRawTable() {
        TableSchema schema = new TableSchema("Mitglieder", List.of(
                new ColumnDefinition.TextColumn(1, "Vorname"),
                new ColumnDefinition.SelectionColumn(2, "Funktion", SelectionType.MULTI,
                        List.of(new SelectionOption(10, "Admin"))),
                new ColumnDefinition.TextColumn(3, "Funktionskennung"),
                new ColumnDefinition.TextColumn(4, "Nachname"),
                new ColumnDefinition.TextColumn(5, "Fachschaft")));
        RawRow raw = new RawRow(List.of(
                new RawCell(1, new CellPayload.TextPayload("Jane")),
                new RawCell(2, new CellPayload.ListPayload(List.of(10L))),
                new RawCell(3, new CellPayload.TextPayload("jdoe")),
                new RawCell(4, new CellPayload.TextPayload("Doe")),
                new RawCell(5, new CellPayload.TextPayload("CS"))));

        DesiredState state = extractor.extract(new TableDecoder().decode(schema, List.of(raw)));

        assertThat(state.users()).containsExactly(new CanonicalUser(
                "jdoe", "Jane", "Doe", "jdoe@hhu.de", null, List.of("CS - Admin", "CS"), true));
    }
}
