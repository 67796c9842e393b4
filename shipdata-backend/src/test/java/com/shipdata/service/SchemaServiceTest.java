package com.shipdata.service;

import com.shipdata.api.OverrideResponse;
import com.shipdata.api.QueryDataResponse;
import com.shipdata.api.SchemaResponse;
import com.shipdata.error.ValidationException;
import com.shipdata.model.ColumnType;
import com.shipdata.model.SchemaColumn;
import com.shipdata.model.SourceType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class SchemaServiceTest {

    @TempDir
    Path tempDir;

    private final SchemaService schemaService = new SchemaService();
    private final QueryService queryService = new QueryService(1000, 100);
    private IngestSession session;

    @BeforeEach
    void setUp() throws IOException {
        session = ServiceFixtures.sessionWithShipments(tempDir);
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    @Test
    void getSchema_reportsInferredColumns() {
        SchemaResponse schema = schemaService.getSchema(session);

        assertThat(schema.getSourceType()).isEqualTo(SourceType.DELIMITED_FILE);
        assertThat(schema.getRowCount()).isEqualTo(4);
        assertThat(schema.getColumns()).extracting(SchemaColumn::getName)
                .containsExactly("id", "code", "amount", "shipped", "note");
        assertThat(schema.getColumns()).extracting(SchemaColumn::getType).containsExactly(
                ColumnType.INTEGER, ColumnType.STRING, ColumnType.DOUBLE, ColumnType.DATE, ColumnType.STRING);
        assertThat(schema.getColumns().get(1).getWarnings()).anyMatch(w -> w.contains("mixed value types"));
        assertThat(schema.getColumns().get(2).isNullable()).isTrue();
        assertThat(schema.getColumns().get(0).isNullable()).isFalse();
        assertThat(schema.getOverrides()).isEmpty();
    }

    @Test
    void override_countsUnconvertibleValues() {
        OverrideResponse response = schemaService.overrideColumnType(session, "code", "integer");

        assertThat(response.getColumn()).isEqualTo("code");
        assertThat(response.getOriginalType()).isEqualTo(ColumnType.STRING);
        assertThat(response.getNewType()).isEqualTo(ColumnType.INTEGER);
        assertThat(response.getUnconvertibleValues()).isEqualTo(1);
        assertThat(response.getWarnings())
                .containsExactly("1 values in column 'code' cannot be read as integer and will show as null");

        SchemaResponse schema = schemaService.getSchema(session);
        assertThat(schema.getOverrides()).containsExactly(entry("code", "integer"));
        assertThat(schema.getColumns().get(1).getTypeOverride()).isEqualTo(ColumnType.INTEGER);
        assertThat(schema.getColumns().get(1).getType()).isEqualTo(ColumnType.STRING);
    }

    @Test
    void override_matchesColumnIgnoringCaseAndAcceptsAliases() {
        OverrideResponse response = schemaService.overrideColumnType(session, "AMOUNT", "text");

        assertThat(response.getColumn()).isEqualTo("amount");
        assertThat(response.getNewType()).isEqualTo(ColumnType.STRING);
        assertThat(response.getUnconvertibleValues()).isZero();
    }

    @Test
    void override_toStoredTypeConvertsEverything() {
        assertThat(schemaService.overrideColumnType(session, "id", "integer").getUnconvertibleValues()).isZero();
    }

    @Test
    void override_unknownColumnListsAvailableColumns() {
        ValidationException e = catchThrowableOfType(
                () -> schemaService.overrideColumnType(session, "weight", "double"), ValidationException.class);

        assertThat(e.getMessage()).contains("weight");
        assertThat(e.getSuggestion()).isEqualTo("Available columns: id, code, amount, shipped, note");
    }

    @Test
    void override_unknownTypeListsValidTypes() {
        ValidationException e = catchThrowableOfType(
                () -> schemaService.overrideColumnType(session, "code", "money"), ValidationException.class);

        assertThat(e.getSuggestion()).startsWith("Valid types: ").contains("integer", "big-integer", "timestamp");
        assertThat(schemaService.getSchema(session).getOverrides()).isEmpty();
    }

    @Test
    void override_isVisibleThroughView() {
        schemaService.overrideColumnType(session, "code", "integer");

        QueryDataResponse response = queryService.queryData(session,
                "SELECT id, code FROM imported_data ORDER BY id");

        assertThat(response.getRows()).extracting(row -> row.get("code")).containsExactly(100, 200, null, 400);
    }

    @Test
    void override_leavesStoredValuesAlone() {
        schemaService.overrideColumnType(session, "code", "integer");

        QueryDataResponse response = queryService.queryData(session,
                "SELECT code FROM imported_data_raw WHERE _row_num = 3");

        assertThat(response.getRows().get(0)).containsEntry("code", "ABC");
    }

    @Test
    void clearOverrides_restoresInferredTypes() {
        schemaService.overrideColumnType(session, "code", "integer");
        schemaService.overrideColumnType(session, "amount", "string");

        SchemaResponse schema = schemaService.clearOverrides(session);

        assertThat(schema.getOverrides()).isEmpty();
        assertThat(schema.getColumns()).allMatch(c -> c.getTypeOverride() == null);
        assertThat(queryService.getRow(session, 3).getData()).containsEntry("code", "ABC");
    }

    @Test
    void reimport_dropsOverrides() throws IOException {
        schemaService.overrideColumnType(session, "code", "integer");

        ServiceFixtures.importService().importFile(session,
                ServiceFixtures.write(tempDir, "other.csv", "code,label\nX1,a\nX2,b\n").toString());

        SchemaResponse schema = schemaService.getSchema(session);
        assertThat(schema.getColumns()).extracting(SchemaColumn::getName).containsExactly("code", "label");
        assertThat(schema.getOverrides()).isEmpty();
        assertThat(schema.getRowCount()).isEqualTo(2);
        assertThat(queryService.getRow(session, 1).getData()).containsEntry("code", "X1");
    }

    @Test
    void withoutSource_isValidationError() {
        try (IngestSession empty = ServiceFixtures.openSession()) {
            assertThatThrownBy(() -> schemaService.getSchema(empty)).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> schemaService.overrideColumnType(empty, "code", "integer"))
                    .isInstanceOf(ValidationException.class);
        }
    }
}
