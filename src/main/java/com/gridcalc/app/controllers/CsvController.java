package com.gridcalc.app.controllers;

import com.gridcalc.app.dto.CsvImportRequest;
import com.gridcalc.app.dto.SpreadsheetDetails;
import com.gridcalc.app.dto.UpdateCellsResponse;
import com.gridcalc.app.services.CsvService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * CSV in and out of sheets.
 */
@RestController
@RequestMapping("/spreadsheets")
public class CsvController {

    @Autowired
    private CsvService csvService;

    /**
     * POST /spreadsheets/import
     * Body: { "name", "csv", "delimiter" }. Creates a spreadsheet whose first sheet holds the records.
     */
    @PostMapping("/import")
    public ResponseEntity<SpreadsheetDetails> importSpreadsheet(@Valid @RequestBody CsvImportRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(csvService.importAsSpreadsheet(request));
    }

    /**
     * PUT /spreadsheets/{id}/sheets/{index}/import/csv
     * Body: { "csv", "delimiter", "startRow", "startColumn", "participantId" }
     */
    @PutMapping("/{id}/sheets/{index}/import/csv")
    public ResponseEntity<UpdateCellsResponse> importCsv(@PathVariable String id, @PathVariable int index,
                                                         @Valid @RequestBody CsvImportRequest request) {
        return ResponseEntity.ok(csvService.importCsv(id, index, request));
    }

    /**
     * GET /spreadsheets/{id}/sheets/{index}/export?delimiter=,&entered=false
     * Returns text/csv. With entered=true formula cells carry their source instead of their value.
     */
    @GetMapping("/{id}/sheets/{index}/export")
    public ResponseEntity<String> exportCsv(@PathVariable String id, @PathVariable int index,
                                            @RequestParam(defaultValue = ",") String delimiter,
                                            @RequestParam(defaultValue = "false") boolean entered) {
        return ResponseEntity.ok()
                .contentType(new MediaType("text", "csv"))
                .body(csvService.exportCsv(id, index, delimiter, entered));
    }
}
