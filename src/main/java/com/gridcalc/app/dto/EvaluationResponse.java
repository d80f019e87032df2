package com.gridcalc.app.dto;

import com.gridcalc.app.models.CellValue;

import java.util.List;

public class EvaluationResponse {
    private final String formula;
    private final CellValue value;
    private final List<String> references;

    public EvaluationResponse(String formula, CellValue value, List<String> references) {
        this.formula = formula;
        this.value = value;
        this.references = references;
    }

    public String getFormula() {
        return formula;
    }

    public CellValue getValue() {
        return value;
    }

    public List<String> getReferences() {
        return references;
    }
}
