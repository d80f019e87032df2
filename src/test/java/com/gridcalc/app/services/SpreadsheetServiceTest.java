package com.gridcalc.app.services;

import com.gridcalc.app.dto.SheetSummary;
import com.gridcalc.app.dto.SpreadsheetDetails;
import com.gridcalc.app.dto.UpdateSpreadsheetRequest;
import com.gridcalc.app.exceptions.InvalidCellValueException;
import com.gridcalc.app.exceptions.SheetNotFoundException;
import com.gridcalc.app.exceptions.SheetOperationException;
import com.gridcalc.app.exceptions.SpreadsheetNotFoundException;
import com.gridcalc.app.models.CellValue;
import com.gridcalc.app.models.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SpreadsheetServiceTest {

    private EngineFixture fixture;
    private SpreadsheetService spreadsheetService;
    private SheetService sheetService;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        spreadsheetService = fixture.spreadsheetService;
        sheetService = fixture.sheetService;
    }

    @Test
    void testCreateListAndDelete() {
        SpreadsheetDetails named = spreadsheetService.createSpreadsheet("  Budget ");
        SpreadsheetDetails unnamed = spreadsheetService.createSpreadsheet(null);

        assertEquals("Budget", named.getName());
        assertEquals("Untitled spreadsheet", unnamed.getName());
        assertEquals(1, named.getSheets().size());
        assertEquals("Sheet1", named.getSheets().get(0).getName());
        assertEquals(2, spreadsheetService.listSpreadsheets().size());

        spreadsheetService.deleteSpreadsheet(named.getId());
        assertThrows(SpreadsheetNotFoundException.class, () -> spreadsheetService.getSpreadsheet(named.getId()));
        assertThrows(SpreadsheetNotFoundException.class, () -> spreadsheetService.deleteSpreadsheet(named.getId()));
        assertEquals(1, spreadsheetService.listSpreadsheets().size());
    }

    @Test
    void testAddRenameAndDeleteSheets() {
        String id = fixture.newSpreadsheet();
        SheetSummary second = spreadsheetService.addSheet(id, null);
        assertEquals("Sheet2", second.getName());
        assertEquals(1, second.getIndex());

        assertThrows(SheetOperationException.class, () -> spreadsheetService.addSheet(id, "sheet1"));
        assertEquals("Totals", spreadsheetService.renameSheet(id, 1, " Totals ").getName());
        assertThrows(SheetOperationException.class, () -> spreadsheetService.renameSheet(id, 1, " "));
        assertThrows(SheetNotFoundException.class, () -> spreadsheetService.renameSheet(id, 5, "X"));

        spreadsheetService.deleteSheet(id, 0);
        SpreadsheetDetails details = spreadsheetService.getSpreadsheet(id);
        assertEquals(1, details.getSheets().size());
        assertEquals("Totals", details.getSheets().get(0).getName());
        assertEquals(0, details.getSheets().get(0).getIndex());
        assertThrows(SheetOperationException.class, () -> spreadsheetService.deleteSheet(id, 0));
    }

    /**
     * References follow sheet names: a renamed sheet breaks them, adding it back repairs them.
     */
    @Test
    void testSheetNamesResolveLazily() {
        String id = fixture.newSpreadsheet();
        sheetService.setCell(id, 0, "A1", "=Rates!A1*2", null);
        assertEquals(CellValue.error(ErrorCode.REF), sheetService.getCell(id, 0, "A1").getValue());

        spreadsheetService.addSheet(id, "Rates");
        sheetService.setCell(id, 1, "A1", 21, null);
        assertEquals(CellValue.number(42), sheetService.getCell(id, 0, "A1").getValue());

        spreadsheetService.renameSheet(id, 1, "Old rates");
        assertEquals(CellValue.error(ErrorCode.REF), sheetService.getCell(id, 0, "A1").getValue());
    }

    @Test
    void testVariables() {
        String id = fixture.newSpreadsheet();
        sheetService.setCell(id, 0, "A1", "=price*qty", null);
        assertEquals(CellValue.error(ErrorCode.NAME), sheetService.getCell(id, 0, "A1").getValue());

        Map<String, Object> variables = new HashMap<>();
        variables.put("price", 2.5);
        variables.put("qty", "4");
        SpreadsheetDetails details = spreadsheetService.updateSpreadsheet(id,
                new UpdateSpreadsheetRequest("Shop", variables));

        assertEquals("Shop", details.getName());
        assertEquals(CellValue.number(2.5), details.getVariables().get("price"));
        assertEquals(CellValue.number(10), sheetService.getCell(id, 0, "A1").getValue());
    }

    @Test
    void testInvalidVariables() {
        String id = fixture.newSpreadsheet();
        Map<String, Object> cellLike = new HashMap<>();
        cellLike.put("AB12", 1);
        assertThrows(InvalidCellValueException.class, () ->
                spreadsheetService.updateSpreadsheet(id, new UpdateSpreadsheetRequest(null, cellLike)));

        Map<String, Object> formula = new HashMap<>();
        formula.put("rate", "=1+1");
        assertThrows(InvalidCellValueException.class, () ->
                spreadsheetService.updateSpreadsheet(id, new UpdateSpreadsheetRequest(null, formula)));

        assertTrue(SpreadsheetService.isValidVariableName("tax_rate.2024"));
        assertFalse(SpreadsheetService.isValidVariableName("true"));
        assertFalse(SpreadsheetService.isValidVariableName("2x"));
        assertFalse(SpreadsheetService.isValidVariableName("$A$1"));
    }
}
