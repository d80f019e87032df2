package com.gridcalc.app.dto;

public class CreateSpreadsheetRequest {
    private String name;

    public CreateSpreadsheetRequest() {
    }

    public CreateSpreadsheetRequest(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }
}
