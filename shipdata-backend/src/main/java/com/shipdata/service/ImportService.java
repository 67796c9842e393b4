package com.shipdata.service;

import com.shipdata.adapter.DelimitedFileAdapter;
import com.shipdata.adapter.DelimitedImportParameters;
import com.shipdata.adapter.RemoteDatabaseAdapter;
import com.shipdata.adapter.RemoteImportParameters;
import com.shipdata.adapter.SourceAdapter;
import com.shipdata.adapter.SpreadsheetAdapter;
import com.shipdata.adapter.SpreadsheetImportParameters;
import com.shipdata.adapter.StagingTable;
import com.shipdata.api.TablesResponse;
import com.shipdata.error.IngestException;
import com.shipdata.error.ValidationException;
import com.shipdata.model.DataSourceInfo;
import com.shipdata.model.ImportResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;

/**
 * Runs adapter imports against a session and commits the result.
 *
 * <p>Rows are staged first; the committed DataSource is only replaced once the adapter has
 * finished. A failed import leaves the previous source and its overrides untouched.
 */
@Slf4j
@Service
public class ImportService {

    static final List<String> DELIMITED_EXTENSIONS = List.of("csv", "txt");
    static final List<String> TAB_EXTENSIONS = List.of("tsv", "tab");
    static final List<String> SPREADSHEET_EXTENSIONS = List.of("xlsx", "xlsm", "xls");

    private final DelimitedFileAdapter delimitedFileAdapter;
    private final SpreadsheetAdapter spreadsheetAdapter;
    private final RemoteDatabaseAdapter remoteDatabaseAdapter;

    public ImportService(
            DelimitedFileAdapter delimitedFileAdapter,
            SpreadsheetAdapter spreadsheetAdapter,
            RemoteDatabaseAdapter remoteDatabaseAdapter
    ) {
        this.delimitedFileAdapter = delimitedFileAdapter;
        this.spreadsheetAdapter = spreadsheetAdapter;
        this.remoteDatabaseAdapter = remoteDatabaseAdapter;
    }

    public ImportResult importDelimited(IngestSession session, DelimitedImportParameters parameters) {
        return runImport(session, delimitedFileAdapter, parameters);
    }

    public ImportResult importSpreadsheet(IngestSession session, SpreadsheetImportParameters parameters) {
        return runImport(session, spreadsheetAdapter, parameters);
    }

    public ImportResult importDatabase(IngestSession session, RemoteImportParameters parameters) {
        return runImport(session, remoteDatabaseAdapter, parameters);
    }

    /**
     * Import a file with defaults chosen by its extension: comma for {@code .csv/.txt}, tab for
     * {@code .tsv/.tab}, the first sheet for workbooks. Header row assumed.
     *
     * @param session session
     * @param path file path
     * @return import result
     */
    public ImportResult importFile(IngestSession session, String path) {
        String extension = extensionOf(path);
        if (DELIMITED_EXTENSIONS.contains(extension)) {
            return importDelimited(session, DelimitedImportParameters.builder().path(path).build());
        }
        if (TAB_EXTENSIONS.contains(extension)) {
            return importDelimited(session, DelimitedImportParameters.builder().path(path).delimiter("\t").build());
        }
        if (SPREADSHEET_EXTENSIONS.contains(extension)) {
            return importSpreadsheet(session, SpreadsheetImportParameters.builder().path(path).build());
        }
        throw new ValidationException(
                extension.isEmpty() ? "File has no extension: " + path : "Unsupported file extension '." + extension + "'",
                "Supported extensions: .csv, .txt, .tsv, .tab, .xlsx, .xlsm, .xls");
    }

    public List<String> listSheets(String path) {
        return spreadsheetAdapter.listSheets(path);
    }

    public TablesResponse listTables(IngestSession session, String connectionString, String schema) {
        return session.withLock(() -> new TablesResponse(
                remoteDatabaseAdapter.getLargeTableThreshold(),
                remoteDatabaseAdapter.listTables(session.getConnection(), connectionString, schema)));
    }

    <P> ImportResult runImport(IngestSession session, SourceAdapter<P> adapter, P parameters) {
        return session.withLock(() -> {
            long startTime = System.currentTimeMillis();
            try (StagingTable staging = StagingTable.create(session.getConnection())) {
                ImportResult result = adapter.importData(staging, parameters);
                staging.promote(result.getColumns());
                session.replaceSource(DataSourceInfo.builder()
                        .sourceType(result.getSourceType())
                        .rowCount(result.getRowCount())
                        .columnCount(result.getColumns().size())
                        .createdAt(OffsetDateTime.now())
                        .columns(result.getColumns())
                        .provenance(result.getProvenance())
                        .build());
                log.info("Imported data source: session_id={}, source_type={}, rows={}, columns={}, warnings={}, duration_ms={}",
                        session.getSessionId(), result.getSourceType(), result.getRowCount(),
                        result.getColumns().size(), result.getWarnings().size(),
                        System.currentTimeMillis() - startTime);
                return result;
            } catch (IngestException e) {
                log.warn("Import failed: session_id={}, source_type={}, code={}, message={}",
                        session.getSessionId(), adapter.sourceType(), e.getCode(), e.getMessage());
                throw e;
            }
        });
    }

    private static String extensionOf(String path) {
        if (path == null || path.isBlank()) {
            throw new ValidationException("path is required", "Pass the path of a file readable by the server");
        }
        String name = path.trim();
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        int dot = name.lastIndexOf('.');
        if (dot <= slash) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
