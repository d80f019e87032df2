package com.gridcalc.app.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public class EvaluateRequest {
    @NotBlank
    private String formula;
    @Min(0)
    private int sheetIndex;

    public EvaluateRequest() {
    }

    public EvaluateRequest(String formula, int sheetIndex) {
        this.formula = formula;
        this.sheetIndex = sheetIndex;
    }

    public String getFormula() {
        return formula;
    }

    public void setFormula(String formula) {
        this.formula = formula;
    }

    public int getSheetIndex() {
        return sheetIndex;
    }

    public void setSheetIndex(int sheetIndex) {
        this.sheetIndex = sheetIndex;
    }
}
