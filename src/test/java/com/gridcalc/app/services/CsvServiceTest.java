package com.gridcalc.app.services;

import com.gridcalc.app.dto.CsvImportRequest;
import com.gridcalc.app.dto.SpreadsheetDetails;
import com.gridcalc.app.dto.UpdateCellsResponse;
import com.gridcalc.app.exceptions.CsvFormatException;
import com.gridcalc.app.exceptions.FormulaParseException;
import com.gridcalc.app.exceptions.InvalidRangeException;
import com.gridcalc.app.exceptions.SheetNotFoundException;
import com.gridcalc.app.models.CellValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvServiceTest {

    private EngineFixture fixture;
    private CsvService csvService;
    private String spreadsheetId;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        csvService = fixture.csvService;
        spreadsheetId = fixture.newSpreadsheet();
    }

    private CellValue valueOf(String address) {
        return fixture.sheetService.getCell(spreadsheetId, 0, address).getValue();
    }

    /**
     * Fields are coerced like typed input, and the whole file is one revision.
     */
    @Test
    void testImportIsOneBatch() {
        CsvImportRequest request = new CsvImportRequest("Region,Amount\nEast,10\nWest,\"=B2*2\"\n", ",");
        UpdateCellsResponse response = csvService.importCsv(spreadsheetId, 0, request);

        assertEquals(1, response.getRevision());
        assertEquals("A1:B3", response.getUpdated().getRange());
        assertEquals(CellValue.string("Region"), valueOf("A1"));
        assertEquals(CellValue.number(10), valueOf("B2"));
        assertEquals(CellValue.number(20), valueOf("B3"));
    }

    @Test
    void testImportWithDelimiterAndOffset() {
        CsvImportRequest request = new CsvImportRequest("a;\"b;c\"\n1;TRUE", ";");
        request.setStartRow(2);
        request.setStartColumn(1);
        csvService.importCsv(spreadsheetId, 0, request);

        assertEquals(CellValue.string("b;c"), valueOf("C3"));
        assertEquals(CellValue.number(1), valueOf("B4"));
        assertEquals(CellValue.bool(true), valueOf("C4"));
    }

    @Test
    void testShortRecordsClearTheRestOfTheRow() {
        fixture.sheetService.setCell(spreadsheetId, 0, "C2", 99, null);
        csvService.importCsv(spreadsheetId, 0, new CsvImportRequest("x,y,z\nonly", ","));

        assertEquals(CellValue.string("only"), valueOf("A2"));
        assertTrue(valueOf("C2").isEmpty());
    }

    @Test
    void testRejectedImportStoresNothing() {
        assertThrows(FormulaParseException.class, () ->
                csvService.importCsv(spreadsheetId, 0, new CsvImportRequest("1,\"=(1+\"", ",")));
        assertThrows(CsvFormatException.class, () ->
                csvService.importCsv(spreadsheetId, 0, new CsvImportRequest("a,\"unterminated\n", ",")));
        assertThrows(CsvFormatException.class, () ->
                csvService.importCsv(spreadsheetId, 0, new CsvImportRequest("a,b", "::")));
        assertThrows(CsvFormatException.class, () ->
                csvService.importCsv(spreadsheetId, 0, new CsvImportRequest("", ",")));

        assertTrue(valueOf("A1").isEmpty());
        assertEquals(0, fixture.registry.require(spreadsheetId).getRevision());
    }

    @Test
    void testImportAsNewSpreadsheet() {
        CsvImportRequest request = new CsvImportRequest("q1\tq2\n5\t=A2+1", "\t");
        request.setName("Quarterly");
        SpreadsheetDetails details = csvService.importAsSpreadsheet(request);

        assertEquals("Quarterly", details.getName());
        assertEquals(CellValue.number(6), fixture.sheetService.getCell(details.getId(), 0, "B2").getValue());
    }

    @Test
    void testFailedImportDiscardsNewSpreadsheet() {
        int before = fixture.spreadsheetService.listSpreadsheets().size();
        assertThrows(FormulaParseException.class, () ->
                csvService.importAsSpreadsheet(new CsvImportRequest("=(1+", ",")));
        assertEquals(before, fixture.spreadsheetService.listSpreadsheets().size());
    }

    @Test
    void testExportValuesAndEnteredText() {
        fixture.sheetService.setCell(spreadsheetId, 0, "A1", "Item, large", null);
        fixture.sheetService.setCell(spreadsheetId, 0, "B1", 2.5, null);
        fixture.sheetService.setCell(spreadsheetId, 0, "A2", "=B1*2", null);
        fixture.sheetService.setCell(spreadsheetId, 0, "C2", "x", null);

        assertEquals("\"Item, large\",2.5,\r\n5,,x\r\n", csvService.exportCsv(spreadsheetId, 0, ",", false));
        assertEquals("Item, large;2.5;\r\n=B1*2;;x\r\n", csvService.exportCsv(spreadsheetId, 0, ";", true));
    }

    @Test
    void testExportedTextImportsBack() {
        fixture.sheetService.setCell(spreadsheetId, 0, "A1", 3, null);
        fixture.sheetService.setCell(spreadsheetId, 0, "B2", "=A1*A1", null);
        String csv = csvService.exportCsv(spreadsheetId, 0, ",", true);

        String copy = fixture.newSpreadsheet();
        csvService.importCsv(copy, 0, new CsvImportRequest(csv, ","));
        assertEquals(CellValue.number(9), fixture.sheetService.getCell(copy, 0, "B2").getValue());
    }

    @Test
    void testExportEdgeCases() {
        assertEquals("", csvService.exportCsv(spreadsheetId, 0, ",", false));
        assertThrows(SheetNotFoundException.class, () -> csvService.exportCsv(spreadsheetId, 4, ",", false));

        fixture.sheetService.setCell(spreadsheetId, 0, "K11", 1, null);
        assertThrows(InvalidRangeException.class, () -> csvService.exportCsv(spreadsheetId, 0, ",", false));
    }

    @Test
    void testReadRecords() {
        List<List<String>> records = CsvService.readRecords("a,\"b \"\"quoted\"\"\"\n\nc", ',');
        assertEquals(2, records.size());
        assertEquals(Arrays.asList("a", "b \"quoted\""), records.get(0));
        assertEquals(Arrays.asList("c"), records.get(1));
    }
}
