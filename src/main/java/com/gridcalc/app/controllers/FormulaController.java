package com.gridcalc.app.controllers;

import com.gridcalc.app.dto.ValidateFormulaRequest;
import com.gridcalc.app.dto.ValidationResponse;
import com.gridcalc.app.services.FormulaService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/formulas")
public class FormulaController {

    @Autowired
    private FormulaService formulaService;

    /**
     * POST /formulas/validate
     * Body: { "formula" }. Always 200; "valid" is false with a message and position on a syntax error.
     */
    @PostMapping("/validate")
    public ResponseEntity<ValidationResponse> validate(@Valid @RequestBody ValidateFormulaRequest request) {
        return ResponseEntity.ok(formulaService.validateFormula(request.getFormula()));
    }
}
