package com.shipdata.adapter;

import com.shipdata.error.StoreException;
import com.shipdata.error.ValidationException;
import com.shipdata.inference.ColumnTypeAccumulator;
import com.shipdata.inference.DateOrder;
import com.shipdata.inference.InferredColumn;
import com.shipdata.inference.TypeInference;
import com.shipdata.model.ColumnType;
import com.shipdata.model.ImportResult;
import com.shipdata.model.SchemaColumn;
import com.shipdata.model.SourceType;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Imports one sheet of an {@code .xlsx} / {@code .xls} workbook.
 *
 * <p>Cells keep the type the workbook gives them: numeric cells formatted as dates become dates
 * or timestamps, text cells stay text even when they look numeric.
 */
@Slf4j
@Component
public class SpreadsheetAdapter implements SourceAdapter<SpreadsheetImportParameters> {

    // Whole doubles at or beyond 2^63 do not fit a BIGINT.
    private static final double LONG_LIMIT = 9.223372036854775807E18;

    @Override
    public SourceType sourceType() {
        return SourceType.SPREADSHEET;
    }

    /**
     * Sheet names in workbook order. Reads metadata only.
     *
     * @param rawPath workbook path
     * @return sheet names
     */
    public List<String> listSheets(String rawPath) {
        Path path = DelimitedFileAdapter.requireFile(rawPath);
        try (Workbook workbook = openWorkbook(path)) {
            return sheetNames(workbook);
        } catch (IOException e) {
            throw unreadable(path, e);
        }
    }

    @Override
    public ImportResult importData(StagingTable staging, SpreadsheetImportParameters parameters) {
        Path path = DelimitedFileAdapter.requireFile(parameters.getPath());
        SheetData data;
        String sheetName;
        try (Workbook workbook = openWorkbook(path)) {
            Sheet sheet = selectSheet(workbook, parameters.getSheet());
            sheetName = sheet.getSheetName();
            data = readSheet(sheet, parameters.isHeader());
        } catch (IOException e) {
            throw unreadable(path, e);
        }

        List<String> warnings = new ArrayList<>();
        if (data.names.isEmpty()) {
            warnings.add("Sheet is empty");
        }
        if (data.truncatedRows > 0) {
            warnings.add(String.format("%d rows had more cells than the header; extra cells were dropped",
                    data.truncatedRows));
        }

        List<InferredColumn> columns = new ArrayList<>(data.names.size());
        for (int c = 0; c < data.names.size(); c++) {
            ColumnTypeAccumulator accumulator = new ColumnTypeAccumulator(data.names.get(c));
            for (TypedCell[] row : data.rows) {
                TypedCell cell = row[c];
                accumulator.observeTyped(cell != null ? cell.type() : null);
            }
            InferredColumn column = accumulator.resolve();
            columns.add(column);
            warnings.addAll(column.getWarnings());
        }

        StagingTable.FinishedRows finished;
        try (TextTableLoader loader = new TextTableLoader(staging, columns)) {
            for (TypedCell[] row : data.rows) {
                String[] values = new String[columns.size()];
                for (int c = 0; c < columns.size(); c++) {
                    TypedCell cell = row[c];
                    if (cell != null) {
                        values[c] = TypeInference.normalize(cell.text(), columns.get(c).getType(), DateOrder.MONTH_FIRST);
                    }
                }
                loader.append(values);
            }
            finished = loader.finish();
        } catch (SQLException e) {
            throw new StoreException("Failed to load sheet " + sheetName + ": " + e.getMessage(), e);
        }
        if (finished.skippedRows() > 0) {
            warnings.add(String.format("Skipped %d empty rows", finished.skippedRows()));
        }

        List<SchemaColumn> schema = DelimitedFileAdapter.toSchema(staging, columns);
        Map<String, String> provenance = new LinkedHashMap<>();
        provenance.put("path", path.toString());
        provenance.put("sheet", sheetName);
        provenance.put("header", String.valueOf(parameters.isHeader()));

        log.info("Spreadsheet import staged: file={}, sheet={}, rows={}, columns={}, skipped={}",
                path.getFileName(), sheetName, finished.rowCount(), schema.size(), finished.skippedRows());
        return ImportResult.builder()
                .rowCount(finished.rowCount())
                .columns(schema)
                .warnings(warnings)
                .sourceType(sourceType())
                .provenance(provenance)
                .build();
    }

    private static Workbook openWorkbook(Path path) throws IOException {
        try {
            return WorkbookFactory.create(path.toFile(), null, true);
        } catch (EncryptedDocumentException e) {
            throw new ValidationException("Workbook " + path.getFileName() + " is password protected",
                    "Remove the workbook password and import again");
        } catch (RuntimeException e) {
            // POI signals unrecognised content with assorted runtime exceptions.
            throw new IOException(e.getMessage(), e);
        }
    }

    private static List<String> sheetNames(Workbook workbook) {
        List<String> names = new ArrayList<>(workbook.getNumberOfSheets());
        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            names.add(workbook.getSheetName(i));
        }
        return names;
    }

    private static Sheet selectSheet(Workbook workbook, String requested) {
        if (workbook.getNumberOfSheets() == 0) {
            throw new ValidationException("Workbook has no sheets", "Import a workbook that contains at least one sheet");
        }
        if (requested == null || requested.isBlank()) {
            return workbook.getSheetAt(0);
        }
        Sheet sheet = workbook.getSheet(requested);
        if (sheet == null) {
            throw new ValidationException("Sheet '" + requested + "' not found",
                    "Available sheets: " + String.join(", ", sheetNames(workbook)));
        }
        return sheet;
    }

    private SheetData readSheet(Sheet sheet, boolean header) {
        SheetData data = new SheetData();
        if (sheet.getPhysicalNumberOfRows() == 0) {
            return data;
        }
        int firstRow = sheet.getFirstRowNum();
        int lastRow = sheet.getLastRowNum();

        int width;
        int dataStart;
        if (header) {
            Row headerRow = sheet.getRow(firstRow);
            width = headerRow == null ? 0 : Math.max(headerRow.getLastCellNum(), 0);
            DataFormatter formatter = new DataFormatter();
            List<String> rawNames = new ArrayList<>(width);
            for (int c = 0; c < width; c++) {
                Cell cell = headerRow.getCell(c);
                rawNames.add(cell == null ? null : formatter.formatCellValue(cell));
            }
            data.names.addAll(ColumnNames.normalize(rawNames));
            dataStart = firstRow + 1;
        } else {
            width = 0;
            for (int r = firstRow; r <= lastRow; r++) {
                Row row = sheet.getRow(r);
                if (row != null) {
                    width = Math.max(width, row.getLastCellNum());
                }
            }
            data.names.addAll(ColumnNames.generated(width));
            dataStart = firstRow;
        }

        for (int r = dataStart; r <= lastRow; r++) {
            Row row = sheet.getRow(r);
            TypedCell[] cells = new TypedCell[width];
            if (row != null) {
                if (row.getLastCellNum() > width && hasValueBeyond(row, width)) {
                    data.truncatedRows++;
                }
                for (int c = 0; c < width; c++) {
                    cells[c] = readCell(row.getCell(c));
                }
            }
            data.rows.add(cells);
        }
        return data;
    }

    private static boolean hasValueBeyond(Row row, int width) {
        for (int c = width; c < row.getLastCellNum(); c++) {
            if (readCell(row.getCell(c)) != null) {
                return true;
            }
        }
        return false;
    }

    /**
     * Typed view of one cell, or null when it is empty.
     */
    static TypedCell readCell(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case NUMERIC:
                return numericCell(cell);
            case STRING: {
                String text = cell.getStringCellValue();
                return text == null || text.isBlank() ? null : new TypedCell(ColumnType.STRING, text);
            }
            case BOOLEAN:
                return new TypedCell(ColumnType.BOOLEAN, String.valueOf(cell.getBooleanCellValue()));
            case ERROR:
                return new TypedCell(ColumnType.STRING, FormulaError.forInt(cell.getErrorCellValue()).getString());
            default:
                return null;
        }
    }

    private static TypedCell numericCell(Cell cell) {
        if (DateUtil.isCellDateFormatted(cell)) {
            LocalDateTime value = cell.getLocalDateTimeCellValue();
            if (value.toLocalTime().equals(LocalTime.MIDNIGHT)) {
                return new TypedCell(ColumnType.DATE, value.toLocalDate().toString());
            }
            return new TypedCell(ColumnType.TIMESTAMP, TypeInference.formatTimestamp(value));
        }
        double d = cell.getNumericCellValue();
        if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < LONG_LIMIT) {
            long whole = (long) d;
            ColumnType type = whole >= Integer.MIN_VALUE && whole <= Integer.MAX_VALUE
                    ? ColumnType.INTEGER
                    : ColumnType.BIG_INTEGER;
            return new TypedCell(type, Long.toString(whole));
        }
        return new TypedCell(ColumnType.DOUBLE, BigDecimal.valueOf(d).toPlainString());
    }

    private static ValidationException unreadable(Path path, IOException e) {
        log.warn("Failed to read workbook {}: {}", path.getFileName(), e.getMessage());
        return new ValidationException("File " + path.getFileName() + " is not a readable workbook",
                "Import .xlsx or .xls files; use import_delimited for CSV text");
    }

    record TypedCell(ColumnType type, String text) {
    }

    private static final class SheetData {
        private final List<String> names = new ArrayList<>();
        private final List<TypedCell[]> rows = new ArrayList<>();
        private long truncatedRows;
    }
}
