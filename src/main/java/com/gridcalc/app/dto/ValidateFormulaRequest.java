package com.gridcalc.app.dto;

import jakarta.validation.constraints.NotBlank;

public class ValidateFormulaRequest {
    @NotBlank
    private String formula;

    public ValidateFormulaRequest() {
    }

    public ValidateFormulaRequest(String formula) {
        this.formula = formula;
    }

    public String getFormula() {
        return formula;
    }

    public void setFormula(String formula) {
        this.formula = formula;
    }
}
