package com.gridcalc.app.dto;

import java.util.Map;

/**
 * Partial update: null fields are left unchanged.
 * 'variables' replaces the whole variable set when present.
 */
public class UpdateSpreadsheetRequest {
    private String name;
    private Map<String, Object> variables;

    public UpdateSpreadsheetRequest() {
    }

    public UpdateSpreadsheetRequest(String name, Map<String, Object> variables) {
        this.name = name;
        this.variables = variables;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Map<String, Object> getVariables() {
        return variables;
    }

    public void setVariables(Map<String, Object> variables) {
        this.variables = variables;
    }
}
