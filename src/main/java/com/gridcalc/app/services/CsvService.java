package com.gridcalc.app.services;

import com.gridcalc.app.config.GridCalcProperties;
import com.gridcalc.app.dto.CellUpdateRequest;
import com.gridcalc.app.dto.CsvImportRequest;
import com.gridcalc.app.dto.SpreadsheetDetails;
import com.gridcalc.app.dto.UpdateCellsRequest;
import com.gridcalc.app.dto.UpdateCellsResponse;
import com.gridcalc.app.exceptions.CsvFormatException;
import com.gridcalc.app.exceptions.InvalidRangeException;
import com.gridcalc.app.exceptions.SheetNotFoundException;
import com.gridcalc.app.models.Cell;
import com.gridcalc.app.models.CellRange;
import com.gridcalc.app.models.Sheet;
import com.gridcalc.app.models.Spreadsheet;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV import and export for single sheets.
 * An import is one edit batch, so it gets one revision and one recalculation.
 */
@Service
public class CsvService {

    private static final Logger log = LoggerFactory.getLogger(CsvService.class);

    static final String DEFAULT_IMPORT_NAME = "Imported spreadsheet";

    private final SpreadsheetRegistry registry;
    private final SpreadsheetService spreadsheetService;
    private final SheetService sheetService;
    private final GridCalcProperties properties;

    public CsvService(SpreadsheetRegistry registry, SpreadsheetService spreadsheetService,
                      SheetService sheetService, GridCalcProperties properties) {
        this.registry = registry;
        this.spreadsheetService = spreadsheetService;
        this.sheetService = sheetService;
        this.properties = properties;
    }

    /**
     * Writes the records of the CSV text into an existing sheet as one batch.
     * Short records are padded with empty fields, which clear their cells,
     * so the import always overwrites a full rectangle.
     */
    public UpdateCellsResponse importCsv(String spreadsheetId, int sheetIndex, CsvImportRequest request) {
        if (request.getStartRow() < 0 || request.getStartColumn() < 0) {
            throw new InvalidRangeException("Import must start at a non-negative position");
        }
        List<List<String>> records = readRecords(request.getCsv(), delimiterOf(request.getDelimiter()));
        int width = 0;
        for (List<String> record : records) {
            width = Math.max(width, record.size());
        }
        if (width == 0) {
            throw new CsvFormatException("CSV text holds no records");
        }

        List<CellUpdateRequest> updates = new ArrayList<>();
        for (int r = 0; r < records.size(); r++) {
            List<String> record = records.get(r);
            for (int c = 0; c < width; c++) {
                String field = c < record.size() ? record.get(c) : "";
                updates.add(new CellUpdateRequest(request.getStartRow() + r, request.getStartColumn() + c, field));
            }
        }
        log.info("Importing {} CSV record(s) of width {} into spreadsheet {} sheet {}",
                records.size(), width, spreadsheetId, sheetIndex);
        return sheetService.updateCells(spreadsheetId, sheetIndex,
                new UpdateCellsRequest(request.getParticipantId(), updates));
    }

    /**
     * Creates a spreadsheet and loads the CSV text into its first sheet.
     * A rejected import removes the spreadsheet again.
     */
    public SpreadsheetDetails importAsSpreadsheet(CsvImportRequest request) {
        String name = request.getName() == null || request.getName().isBlank()
                ? DEFAULT_IMPORT_NAME
                : request.getName();
        SpreadsheetDetails created = spreadsheetService.createSpreadsheet(name);
        try {
            importCsv(created.getId(), 0, request);
        } catch (RuntimeException e) {
            log.warn("CSV import into new spreadsheet {} failed, discarding it: {}", created.getId(), e.getMessage());
            spreadsheetService.deleteSpreadsheet(created.getId());
            throw e;
        }
        return spreadsheetService.getSpreadsheet(created.getId());
    }

    /**
     * Renders the used range of a sheet, from A1 to its last occupied row and column.
     * Cells hold their formatted values, or the text that was entered when
     * {@code entered} is set. An empty sheet exports as an empty string.
     */
    public String exportCsv(String spreadsheetId, int sheetIndex, String delimiter, boolean entered) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiterOf(delimiter))
                .build();
        Spreadsheet spreadsheet = registry.require(spreadsheetId);
        spreadsheet.getLock().readLock().lock();
        try {
            Sheet sheet = spreadsheet.getSheet(sheetIndex);
            if (sheet == null) {
                throw new SheetNotFoundException("Sheet index " + sheetIndex + " not found in spreadsheet "
                        + spreadsheetId);
            }
            if (sheet.size() == 0) {
                return "";
            }
            int lastRow = 0;
            int lastColumn = 0;
            for (Cell cell : sheet.getCells()) {
                lastRow = Math.max(lastRow, cell.getRow());
                lastColumn = Math.max(lastColumn, cell.getColumn());
            }
            CellRange used = new CellRange(0, 0, lastRow, lastColumn);
            long maxCells = properties.getRange().getMaxCells();
            if (used.cellCount() > maxCells) {
                throw new InvalidRangeException("Used range " + used.toA1() + " spans " + used.cellCount()
                        + " cells; the limit is " + maxCells);
            }

            StringBuilder out = new StringBuilder();
            try (CSVPrinter printer = new CSVPrinter(out, format)) {
                for (int row = 0; row <= lastRow; row++) {
                    List<String> fields = new ArrayList<>();
                    for (int column = 0; column <= lastColumn; column++) {
                        Cell cell = sheet.getCell(row, column);
                        fields.add(cell == null ? "" : fieldOf(cell, entered));
                    }
                    printer.printRecord(fields);
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            log.debug("Exported {} of spreadsheet {} sheet {}", used.toA1(), spreadsheetId, sheetIndex);
            return out.toString();
        } finally {
            spreadsheet.getLock().readLock().unlock();
        }
    }

    private static String fieldOf(Cell cell, boolean entered) {
        return entered ? cell.getContent().getSource() : cell.getValue().getFormatted();
    }

    static List<List<String>> readRecords(String text, char delimiter) {
        if (text == null) {
            throw new CsvFormatException("CSV text is required");
        }
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .build();
        List<List<String>> records = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(text, format)) {
            for (CSVRecord record : parser) {
                List<String> fields = new ArrayList<>();
                for (int i = 0; i < record.size(); i++) {
                    fields.add(record.get(i));
                }
                records.add(fields);
            }
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            throw new CsvFormatException("Malformed CSV: " + e.getMessage(), e);
        }
        return records;
    }

    /**
     * One character, and not one the CSV format reserves for quoting or line breaks.
     */
    static char delimiterOf(String delimiter) {
        if (delimiter == null || delimiter.isEmpty()) {
            return ',';
        }
        if (delimiter.length() != 1) {
            throw new CsvFormatException("Delimiter must be a single character, got '" + delimiter + "'");
        }
        char c = delimiter.charAt(0);
        if (c == '"' || c == '\r' || c == '\n') {
            throw new CsvFormatException("Delimiter cannot be a quote or a line break");
        }
        return c;
    }
}
