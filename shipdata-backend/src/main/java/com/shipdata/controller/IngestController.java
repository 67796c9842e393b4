package com.shipdata.controller;

import com.shipdata.adapter.DelimitedImportParameters;
import com.shipdata.adapter.RemoteImportParameters;
import com.shipdata.adapter.SpreadsheetImportParameters;
import com.shipdata.api.ChecksumVerifyResponse;
import com.shipdata.api.ChecksumsResponse;
import com.shipdata.api.FilterRequest;
import com.shipdata.api.FilterResponse;
import com.shipdata.api.ImportDatabaseRequest;
import com.shipdata.api.ImportDelimitedRequest;
import com.shipdata.api.ImportFileRequest;
import com.shipdata.api.ImportSpreadsheetRequest;
import com.shipdata.api.ListTablesRequest;
import com.shipdata.api.OverrideRequest;
import com.shipdata.api.OverrideResponse;
import com.shipdata.api.QueryDataResponse;
import com.shipdata.api.QueryRequest;
import com.shipdata.api.SchemaResponse;
import com.shipdata.api.SessionResponse;
import com.shipdata.api.SheetsResponse;
import com.shipdata.api.SourceInfoResponse;
import com.shipdata.api.TablesResponse;
import com.shipdata.api.VerifyChecksumRequest;
import com.shipdata.model.ImportResult;
import com.shipdata.model.RowData;
import com.shipdata.model.SourceMetadata;
import com.shipdata.service.ChecksumService;
import com.shipdata.service.ImportService;
import com.shipdata.service.IngestSession;
import com.shipdata.service.QueryService;
import com.shipdata.service.SchemaService;
import com.shipdata.service.SessionManager;
import com.shipdata.service.SourceInfoService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/v1")
public class IngestController {

    private static final Logger log = LoggerFactory.getLogger(IngestController.class);

    private final SessionManager sessionManager;
    private final ImportService importService;
    private final SchemaService schemaService;
    private final QueryService queryService;
    private final ChecksumService checksumService;
    private final SourceInfoService sourceInfoService;

    public IngestController(
            SessionManager sessionManager,
            ImportService importService,
            SchemaService schemaService,
            QueryService queryService,
            ChecksumService checksumService,
            SourceInfoService sourceInfoService
    ) {
        this.sessionManager = sessionManager;
        this.importService = importService;
        this.schemaService = schemaService;
        this.queryService = queryService;
        this.checksumService = checksumService;
        this.sourceInfoService = sourceInfoService;
    }

    /**
     * Open a session with an empty in-memory store.
     *
     * POST /v1/sessions
     */
    @PostMapping("/sessions")
    public ResponseEntity<SessionResponse> openSession() {
        IngestSession session = sessionManager.createSession();
        return ResponseEntity.ok(SessionResponse.builder()
                .sessionId(session.getSessionId())
                .traceId(MDC.get("trace_id"))
                .createdAt(session.getCreatedAt())
                .expiresAt(session.getExpiresAt())
                .build());
    }

    /**
     * Close a session and release its store.
     *
     * POST /v1/sessions/close
     */
    @PostMapping("/sessions/close")
    public ResponseEntity<Void> closeSession(@RequestParam("session_id") String sessionId) {
        log.info("Close requested: session_id={}, trace_id={}", sessionId, MDC.get("trace_id"));
        sessionManager.terminateSession(sessionId);
        return ResponseEntity.ok().build();
    }

    /**
     * GET /v1/sessions/validate
     */
    @GetMapping("/sessions/validate")
    public ResponseEntity<SessionResponse> validateSession(@RequestParam("session_id") String sessionId) {
        IngestSession session = session(sessionId);
        return ResponseEntity.ok(SessionResponse.builder()
                .sessionId(session.getSessionId())
                .traceId(MDC.get("trace_id"))
                .createdAt(session.getCreatedAt())
                .expiresAt(session.getExpiresAt())
                .build());
    }

    /**
     * Import a delimited text file, replacing the active data source.
     *
     * POST /v1/import/delimited
     *
     * @param request path, delimiter, header flag and encoding
     * @return row count, inferred schema and warnings
     */
    @PostMapping("/import/delimited")
    public ResponseEntity<ImportResult> importDelimited(@Valid @RequestBody ImportDelimitedRequest request) {
        IngestSession session = session(request.getSessionId());
        DelimitedImportParameters parameters = DelimitedImportParameters.builder()
                .path(request.getPath())
                .delimiter(request.getDelimiter())
                .header(request.isHeader())
                .encoding(request.getEncoding())
                .build();
        return ResponseEntity.ok(importService.importDelimited(session, parameters));
    }

    /**
     * POST /v1/import/spreadsheet
     */
    @PostMapping("/import/spreadsheet")
    public ResponseEntity<ImportResult> importSpreadsheet(@Valid @RequestBody ImportSpreadsheetRequest request) {
        IngestSession session = session(request.getSessionId());
        SpreadsheetImportParameters parameters = SpreadsheetImportParameters.builder()
                .path(request.getPath())
                .sheet(request.getSheet())
                .header(request.isHeader())
                .build();
        return ResponseEntity.ok(importService.importSpreadsheet(session, parameters));
    }

    /**
     * Import a file using defaults picked from its extension.
     *
     * POST /v1/import/file
     */
    @PostMapping("/import/file")
    public ResponseEntity<ImportResult> importFile(@Valid @RequestBody ImportFileRequest request) {
        IngestSession session = session(request.getSessionId());
        return ResponseEntity.ok(importService.importFile(session, request.getPath()));
    }

    /**
     * Snapshot a remote table into the session.
     *
     * POST /v1/import/database
     *
     * @param request connection string, schema, table and optional filter
     * @return row count, mapped schema and warnings
     */
    @PostMapping("/import/database")
    public ResponseEntity<ImportResult> importDatabase(@Valid @RequestBody ImportDatabaseRequest request) {
        IngestSession session = session(request.getSessionId());
        log.info("Remote import requested: session_id={}, schema={}, table={}, filtered={}",
                request.getSessionId(), request.getSchema(), request.getTable(),
                request.getFilter() != null && !request.getFilter().isBlank());
        RemoteImportParameters parameters = RemoteImportParameters.builder()
                .connectionString(request.getConnectionString())
                .schema(request.getSchema())
                .table(request.getTable())
                .filter(request.getFilter())
                .build();
        return ResponseEntity.ok(importService.importDatabase(session, parameters));
    }

    /**
     * GET /v1/import/sheets
     */
    @GetMapping("/import/sheets")
    public ResponseEntity<SheetsResponse> listSheets(
            @RequestParam("session_id") String sessionId,
            @RequestParam("path") String path
    ) {
        session(sessionId);
        return ResponseEntity.ok(new SheetsResponse(path, importService.listSheets(path)));
    }

    /**
     * List remote tables with row counts. The connection string travels in the body only.
     *
     * POST /v1/import/tables
     */
    @PostMapping("/import/tables")
    public ResponseEntity<TablesResponse> listTables(@Valid @RequestBody ListTablesRequest request) {
        IngestSession session = session(request.getSessionId());
        return ResponseEntity.ok(importService.listTables(session, request.getConnectionString(), request.getSchema()));
    }

    /**
     * GET /v1/schema
     */
    @GetMapping("/schema")
    public ResponseEntity<SchemaResponse> getSchema(@RequestParam("session_id") String sessionId) {
        return ResponseEntity.ok(schemaService.getSchema(session(sessionId)));
    }

    /**
     * Reinterpret a column's type at read time.
     *
     * POST /v1/schema/override
     */
    @PostMapping("/schema/override")
    public ResponseEntity<OverrideResponse> overrideColumnType(@Valid @RequestBody OverrideRequest request) {
        IngestSession session = session(request.getSessionId());
        return ResponseEntity.ok(schemaService.overrideColumnType(session, request.getColumn(), request.getType()));
    }

    /**
     * POST /v1/schema/overrides/clear
     */
    @PostMapping("/schema/overrides/clear")
    public ResponseEntity<SchemaResponse> clearOverrides(@RequestParam("session_id") String sessionId) {
        return ResponseEntity.ok(schemaService.clearOverrides(session(sessionId)));
    }

    /**
     * GET /v1/rows/{row_number}
     */
    @GetMapping("/rows/{row_number}")
    public ResponseEntity<RowData> getRow(
            @RequestParam("session_id") String sessionId,
            @PathVariable("row_number") long rowNumber
    ) {
        return ResponseEntity.ok(queryService.getRow(session(sessionId), rowNumber));
    }

    /**
     * POST /v1/rows/filter
     */
    @PostMapping("/rows/filter")
    public ResponseEntity<FilterResponse> getRowsByFilter(@Valid @RequestBody FilterRequest request) {
        IngestSession session = session(request.getSessionId());
        return ResponseEntity.ok(queryService.getRowsByFilter(
                session, request.getPredicate(), request.getLimit(), request.getOffset()));
    }

    /**
     * Run a single read-only SELECT against the imported data.
     *
     * POST /v1/query
     */
    @PostMapping("/query")
    public ResponseEntity<QueryDataResponse> queryData(@Valid @RequestBody QueryRequest request) {
        IngestSession session = session(request.getSessionId());
        return ResponseEntity.ok(queryService.queryData(session, request.getSql()));
    }

    /**
     * GET /v1/checksums
     */
    @GetMapping("/checksums")
    public ResponseEntity<ChecksumsResponse> computeChecksums(
            @RequestParam("session_id") String sessionId,
            @RequestParam(value = "start_row", required = false) Long startRow,
            @RequestParam(value = "end_row", required = false) Long endRow
    ) {
        return ResponseEntity.ok(checksumService.computeChecksums(session(sessionId), startRow, endRow));
    }

    /**
     * POST /v1/checksums/verify
     */
    @PostMapping("/checksums/verify")
    public ResponseEntity<ChecksumVerifyResponse> verifyChecksum(@Valid @RequestBody VerifyChecksumRequest request) {
        IngestSession session = session(request.getSessionId());
        return ResponseEntity.ok(checksumService.verifyChecksum(
                session, request.getRowNumber(), request.getExpectedChecksum()));
    }

    /**
     * GET /v1/source
     */
    @GetMapping("/source")
    public ResponseEntity<SourceInfoResponse> getSourceInfo(@RequestParam("session_id") String sessionId) {
        return ResponseEntity.ok(sourceInfoService.getSourceInfo(session(sessionId)));
    }

    /**
     * GET /v1/source/metadata
     */
    @GetMapping("/source/metadata")
    public ResponseEntity<SourceMetadata> getMetadata(@RequestParam("session_id") String sessionId) {
        return ResponseEntity.ok(sourceInfoService.getMetadata(session(sessionId)));
    }

    /**
     * POST /v1/source/clear
     */
    @PostMapping("/source/clear")
    public ResponseEntity<SourceInfoResponse> clearSource(@RequestParam("session_id") String sessionId) {
        return ResponseEntity.ok(sourceInfoService.clearSource(session(sessionId)));
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, String>> getStatus() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "active_sessions", String.valueOf(sessionManager.activeSessionCount())));
    }

    private IngestSession session(String sessionId) {
        MDC.put("session_id", sessionId);
        return sessionManager.requireSession(sessionId);
    }
}
