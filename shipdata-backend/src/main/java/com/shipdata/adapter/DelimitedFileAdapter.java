package com.shipdata.adapter;

import com.shipdata.error.SourceNotFoundException;
import com.shipdata.error.StoreException;
import com.shipdata.error.ValidationException;
import com.shipdata.inference.ColumnTypeAccumulator;
import com.shipdata.inference.InferredColumn;
import com.shipdata.inference.TypeInference;
import com.shipdata.model.ImportResult;
import com.shipdata.model.SchemaColumn;
import com.shipdata.model.SourceType;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Imports delimited text files (CSV, TSV and similar).
 *
 * <p>The file is read twice: a full scan decides every column type, then a second pass loads
 * canonical values. Inference never looks at a prefix only.
 */
@Slf4j
@Component
public class DelimitedFileAdapter implements SourceAdapter<DelimitedImportParameters> {

    private static final char BOM = '\uFEFF';

    @Override
    public SourceType sourceType() {
        return SourceType.DELIMITED_FILE;
    }

    @Override
    public ImportResult importData(StagingTable staging, DelimitedImportParameters parameters) {
        Path path = requireFile(parameters.getPath());
        char delimiter = parseDelimiter(parameters.getDelimiter());
        Charset charset = parseCharset(parameters.getEncoding());
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreEmptyLines(false)
                .build();

        ScanResult scan = scan(path, charset, format, parameters.isHeader());
        List<String> warnings = new ArrayList<>();
        List<InferredColumn> columns = new ArrayList<>();
        for (ColumnTypeAccumulator accumulator : scan.accumulators) {
            InferredColumn column = accumulator.resolve();
            columns.add(column);
            warnings.addAll(column.getWarnings());
        }
        if (scan.emptyFile) {
            warnings.add("File is empty");
        }
        if (scan.truncatedRows > 0) {
            warnings.add(String.format("%d rows had more fields than the header; extra fields were dropped",
                    scan.truncatedRows));
        }

        StagingTable.FinishedRows finished;
        try (TextTableLoader loader = new TextTableLoader(staging, columns)) {
            forEachRecord(path, charset, format, parameters.isHeader(), record -> {
                String[] values = new String[columns.size()];
                for (int i = 0; i < columns.size() && i < record.size(); i++) {
                    InferredColumn column = columns.get(i);
                    values[i] = TypeInference.normalize(record.get(i), column.getType(), column.getDateOrder());
                }
                loader.append(values);
            });
            finished = loader.finish();
        } catch (SQLException e) {
            throw new StoreException("Failed to load " + path.getFileName() + ": " + e.getMessage(), e);
        }
        if (finished.skippedRows() > 0) {
            warnings.add(String.format("Skipped %d empty rows", finished.skippedRows()));
        }

        List<SchemaColumn> schema = toSchema(staging, columns);
        Map<String, String> provenance = new LinkedHashMap<>();
        provenance.put("path", path.toString());
        provenance.put("delimiter", String.valueOf(delimiter));
        provenance.put("header", String.valueOf(parameters.isHeader()));
        provenance.put("encoding", charset.name());

        log.info("Delimited import staged: file={}, rows={}, columns={}, skipped={}",
                path.getFileName(), finished.rowCount(), schema.size(), finished.skippedRows());
        return ImportResult.builder()
                .rowCount(finished.rowCount())
                .columns(schema)
                .warnings(warnings)
                .sourceType(sourceType())
                .provenance(provenance)
                .build();
    }

    static List<SchemaColumn> toSchema(StagingTable staging, List<InferredColumn> columns) {
        try {
            List<StagingTable.StoredColumn> stored = staging.storedColumns();
            List<SchemaColumn> schema = new ArrayList<>(columns.size());
            for (int i = 0; i < columns.size(); i++) {
                InferredColumn column = columns.get(i);
                StagingTable.StoredColumn storedColumn = stored.get(i);
                schema.add(SchemaColumn.builder()
                        .name(column.getName())
                        .type(column.getType())
                        .storageType(storedColumn.storageType())
                        .nullable(storedColumn.nullable())
                        .warnings(new ArrayList<>(column.getWarnings()))
                        .build());
            }
            return schema;
        } catch (SQLException e) {
            throw new StoreException("Failed to describe staged rows: " + e.getMessage(), e);
        }
    }

    private ScanResult scan(Path path, Charset charset, CSVFormat format, boolean header) {
        ScanResult result = new ScanResult();
        try (BufferedReader reader = open(path, charset);
             CSVParser parser = format.parse(reader)) {
            boolean first = true;
            for (CSVRecord record : parser) {
                if (first && header) {
                    first = false;
                    List<String> headerNames = new ArrayList<>();
                    record.forEach(headerNames::add);
                    for (String name : ColumnNames.normalize(headerNames)) {
                        result.accumulators.add(new ColumnTypeAccumulator(name));
                    }
                    continue;
                }
                first = false;
                if (header && record.size() > result.accumulators.size()) {
                    result.truncatedRows++;
                }
                // Without a header the widest record decides the width; earlier rows were null there.
                while (!header && result.accumulators.size() < record.size()) {
                    result.accumulators.add(new ColumnTypeAccumulator("column_" + (result.accumulators.size() + 1)));
                }
                for (int i = 0; i < result.accumulators.size() && i < record.size(); i++) {
                    result.accumulators.get(i).observe(record.get(i));
                }
            }
            result.emptyFile = first;
        } catch (IOException | UncheckedIOException e) {
            throw unreadable(path, e);
        }
        return result;
    }

    private void forEachRecord(Path path, Charset charset, CSVFormat format, boolean header, RecordConsumer consumer)
            throws SQLException {
        try (BufferedReader reader = open(path, charset);
             CSVParser parser = format.parse(reader)) {
            boolean skipHeader = header;
            for (CSVRecord record : parser) {
                if (skipHeader) {
                    skipHeader = false;
                    continue;
                }
                consumer.accept(record);
            }
        } catch (IOException | UncheckedIOException e) {
            throw unreadable(path, e);
        }
    }

    private static BufferedReader open(Path path, Charset charset) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), charset));
        reader.mark(1);
        if (reader.read() != BOM) {
            reader.reset();
        }
        return reader;
    }

    private static ValidationException unreadable(Path path, Exception e) {
        log.warn("Failed to parse {}: {}", path.getFileName(), e.getMessage());
        return new ValidationException("Could not parse " + path.getFileName() + ": " + e.getMessage(),
                "Check the delimiter and that quoted fields are closed");
    }

    static Path requireFile(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            throw new ValidationException("A file path is required", "Pass the path of the file to import");
        }
        Path path = Path.of(rawPath.trim());
        if (!Files.isRegularFile(path)) {
            throw new SourceNotFoundException("File not found: " + rawPath.trim());
        }
        return path;
    }

    static char parseDelimiter(String delimiter) {
        if (delimiter == null || delimiter.isEmpty()) {
            return ',';
        }
        if ("\\t".equals(delimiter) || "tab".equalsIgnoreCase(delimiter.trim())) {
            return '\t';
        }
        if (delimiter.length() != 1) {
            throw new ValidationException("Delimiter must be a single character, got '" + delimiter + "'",
                    "Use a single character such as ',', ';', '|' or '\\t' for tab");
        }
        char c = delimiter.charAt(0);
        if (c == '"' || c == '\r' || c == '\n') {
            throw new ValidationException("Delimiter cannot be a quote or line break",
                    "Use a single character such as ',', ';', '|' or '\\t' for tab");
        }
        return c;
    }

    static Charset parseCharset(String encoding) {
        if (encoding == null || encoding.isBlank()) {
            return StandardCharsets.UTF_8;
        }
        try {
            return Charset.forName(encoding.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown encoding '" + encoding + "'",
                    "Use a standard charset name such as UTF-8, ISO-8859-1 or windows-1252");
        }
    }

    @FunctionalInterface
    private interface RecordConsumer {
        void accept(CSVRecord record) throws SQLException;
    }

    private static final class ScanResult {
        private final List<ColumnTypeAccumulator> accumulators = new ArrayList<>();
        private long truncatedRows;
        private boolean emptyFile;
    }
}
