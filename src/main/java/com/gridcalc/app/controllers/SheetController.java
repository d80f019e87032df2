package com.gridcalc.app.controllers;

import com.gridcalc.app.dto.CellSnapshot;
import com.gridcalc.app.dto.DependencyResponse;
import com.gridcalc.app.dto.EvaluateRequest;
import com.gridcalc.app.dto.EvaluationResponse;
import com.gridcalc.app.dto.ImportRowsRequest;
import com.gridcalc.app.dto.RangeSnapshot;
import com.gridcalc.app.dto.UpdateCellsRequest;
import com.gridcalc.app.dto.UpdateCellsResponse;
import com.gridcalc.app.services.SheetService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST endpoints for cell contents, ad-hoc evaluation and the dependency graph.
 */
@RestController
@RequestMapping("/spreadsheets/{id}")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * PUT /spreadsheets/{id}/cells?sheetIndex=0
     * Body: { "participantId", "updates": [ { "address": "A1", "value": 5 }, { "row": 0, "column": 1, "value": "=A1*2" } ] }
     * Applies the batch as one revision and returns the edited cells after recalculation, plus their
     * bounding range when it fits the range cap.
     * A malformed formula rejects the whole batch with 400.
     */
    @PutMapping("/cells")
    public ResponseEntity<UpdateCellsResponse> updateCells(@PathVariable String id,
                                                           @RequestParam(defaultValue = "0") int sheetIndex,
                                                           @Valid @RequestBody UpdateCellsRequest request) {
        return ResponseEntity.ok(sheetService.updateCells(id, sheetIndex, request));
    }

    /**
     * GET /spreadsheets/{id}/cells?sheetIndex=0&startRow=0&endRow=9&startCol=0&endCol=3
     * Returns the dense grid for the inclusive, zero-based bounds.
     */
    @GetMapping("/cells")
    public ResponseEntity<RangeSnapshot> getRange(@PathVariable String id,
                                                  @RequestParam(defaultValue = "0") int sheetIndex,
                                                  @RequestParam int startRow,
                                                  @RequestParam int endRow,
                                                  @RequestParam int startCol,
                                                  @RequestParam int endCol) {
        return ResponseEntity.ok(sheetService.getRange(id, sheetIndex, startRow, endRow, startCol, endCol));
    }

    /**
     * GET /spreadsheets/{id}/cells/{address}?sheetIndex=0
     */
    @GetMapping("/cells/{address}")
    public ResponseEntity<CellSnapshot> getCell(@PathVariable String id, @PathVariable String address,
                                                @RequestParam(defaultValue = "0") int sheetIndex) {
        return ResponseEntity.ok(sheetService.getCell(id, sheetIndex, address));
    }

    /**
     * POST /spreadsheets/{id}/evaluate
     * Body: { "formula": "=SUM(A1:A3)", "sheetIndex": 0 }. Nothing is stored.
     */
    @PostMapping("/evaluate")
    public ResponseEntity<EvaluationResponse> evaluate(@PathVariable String id,
                                                       @Valid @RequestBody EvaluateRequest request) {
        return ResponseEntity.ok(sheetService.evaluateFormula(id, request.getSheetIndex(), request.getFormula()));
    }

    /**
     * PUT /spreadsheets/{id}/sheets/{index}/import
     * Body: { "startRow", "startColumn", "participantId", "rows": [[...], ...] }
     */
    @PutMapping("/sheets/{index}/import")
    public ResponseEntity<UpdateCellsResponse> importRows(@PathVariable String id, @PathVariable int index,
                                                          @Valid @RequestBody ImportRowsRequest request) {
        return ResponseEntity.ok(sheetService.importRows(id, index, request));
    }

    /**
     * GET /spreadsheets/{id}/sheets/{index}/dependencies[?cell=B2]
     * With a cell: its precedents and direct dependents.
     * Without: the forward adjacency of every formula on the sheet.
     */
    @GetMapping("/sheets/{index}/dependencies")
    public ResponseEntity<DependencyResponse> dependencies(@PathVariable String id, @PathVariable int index,
                                                           @RequestParam(required = false) String cell) {
        return ResponseEntity.ok(sheetService.dependencies(id, index, cell));
    }
}
