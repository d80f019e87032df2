package com.gridcalc.app.controllers;

import com.gridcalc.app.dto.CreateSpreadsheetRequest;
import com.gridcalc.app.dto.SheetRequest;
import com.gridcalc.app.dto.SheetSummary;
import com.gridcalc.app.dto.SpreadsheetDetails;
import com.gridcalc.app.dto.SpreadsheetSummary;
import com.gridcalc.app.dto.UpdateSpreadsheetRequest;
import com.gridcalc.app.services.SpreadsheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST endpoints for spreadsheets and their sheets.
 * "/spreadsheets" is the base path.
 */
@RestController
@RequestMapping("/spreadsheets")
public class SpreadsheetController {

    @Autowired
    private SpreadsheetService spreadsheetService;

    /**
     * POST /spreadsheets
     * Body: { "name" } (optional). Creates a spreadsheet with one sheet.
     */
    @PostMapping
    public ResponseEntity<SpreadsheetDetails> createSpreadsheet(
            @RequestBody(required = false) CreateSpreadsheetRequest request) {
        String name = request == null ? null : request.getName();
        return ResponseEntity.status(HttpStatus.CREATED).body(spreadsheetService.createSpreadsheet(name));
    }

    /**
     * GET /spreadsheets
     * Lists all spreadsheets, oldest first.
     */
    @GetMapping
    public ResponseEntity<List<SpreadsheetSummary>> listSpreadsheets() {
        return ResponseEntity.ok(spreadsheetService.listSpreadsheets());
    }

    /**
     * GET /spreadsheets/{id}
     */
    @GetMapping("/{id}")
    public ResponseEntity<SpreadsheetDetails> getSpreadsheet(@PathVariable String id) {
        return ResponseEntity.ok(spreadsheetService.getSpreadsheet(id));
    }

    /**
     * PUT /spreadsheets/{id}
     * Body: { "name", "variables": { "RATE": 0.2, ... } }; absent fields are left unchanged.
     */
    @PutMapping("/{id}")
    public ResponseEntity<SpreadsheetDetails> updateSpreadsheet(@PathVariable String id,
                                                                @RequestBody UpdateSpreadsheetRequest request) {
        return ResponseEntity.ok(spreadsheetService.updateSpreadsheet(id, request));
    }

    /**
     * DELETE /spreadsheets/{id}
     * Also ends its collaboration session, if any.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteSpreadsheet(@PathVariable String id) {
        spreadsheetService.deleteSpreadsheet(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /spreadsheets/{id}/sheets
     * Body: { "name" } (optional). Appends a sheet.
     */
    @PostMapping("/{id}/sheets")
    public ResponseEntity<SheetSummary> addSheet(@PathVariable String id,
                                                 @RequestBody(required = false) SheetRequest request) {
        String name = request == null ? null : request.getName();
        return ResponseEntity.status(HttpStatus.CREATED).body(spreadsheetService.addSheet(id, name));
    }

    /**
     * PUT /spreadsheets/{id}/sheets/{index}
     * Body: { "name" }. Renames the sheet; formulas using the old name turn into #REF!.
     */
    @PutMapping("/{id}/sheets/{index}")
    public ResponseEntity<SheetSummary> renameSheet(@PathVariable String id, @PathVariable int index,
                                                    @RequestBody SheetRequest request) {
        return ResponseEntity.ok(spreadsheetService.renameSheet(id, index, request.getName()));
    }

    /**
     * DELETE /spreadsheets/{id}/sheets/{index}
     */
    @DeleteMapping("/{id}/sheets/{index}")
    public ResponseEntity<Void> deleteSheet(@PathVariable String id, @PathVariable int index) {
        spreadsheetService.deleteSheet(id, index);
        return ResponseEntity.noContent().build();
    }
}
