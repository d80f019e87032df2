package com.gridcalc.app.controllers;

import com.gridcalc.app.dto.PivotTableResponse;
import com.gridcalc.app.models.PivotConfig;
import com.gridcalc.app.services.PivotService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST endpoints for pivot tables of a spreadsheet.
 */
@RestController
@RequestMapping("/spreadsheets/{id}/pivots")
public class PivotController {

    @Autowired
    private PivotService pivotService;

    /**
     * POST /spreadsheets/{id}/pivots
     * Body: pivot config { "name", "sheetIndex", "sourceRange", "groupBy", "measures", "filters", "showGrandTotal" }.
     * Unknown fields or sheets give 400 VALIDATION_ERROR.
     */
    @PostMapping
    public ResponseEntity<PivotTableResponse> createPivot(@PathVariable String id,
                                                          @Valid @RequestBody PivotConfig config) {
        return ResponseEntity.status(HttpStatus.CREATED).body(pivotService.createPivot(id, config));
    }

    @GetMapping
    public ResponseEntity<List<PivotTableResponse>> listPivots(@PathVariable String id) {
        return ResponseEntity.ok(pivotService.listPivots(id));
    }

    @GetMapping("/{pivotId}")
    public ResponseEntity<PivotTableResponse> getPivot(@PathVariable String id, @PathVariable String pivotId) {
        return ResponseEntity.ok(pivotService.getPivot(id, pivotId));
    }

    /**
     * PUT /spreadsheets/{id}/pivots/{pivotId}
     * Replaces the configuration; the pivot keeps its id.
     */
    @PutMapping("/{pivotId}")
    public ResponseEntity<PivotTableResponse> updatePivot(@PathVariable String id, @PathVariable String pivotId,
                                                          @Valid @RequestBody PivotConfig config) {
        return ResponseEntity.ok(pivotService.updatePivot(id, pivotId, config));
    }

    @DeleteMapping("/{pivotId}")
    public ResponseEntity<Void> deletePivot(@PathVariable String id, @PathVariable String pivotId) {
        pivotService.deletePivot(id, pivotId);
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /spreadsheets/{id}/pivots/{pivotId}/refresh
     * Re-reads the source range.
     */
    @PostMapping("/{pivotId}/refresh")
    public ResponseEntity<PivotTableResponse> refreshPivot(@PathVariable String id, @PathVariable String pivotId) {
        return ResponseEntity.ok(pivotService.refreshPivot(id, pivotId));
    }
}
