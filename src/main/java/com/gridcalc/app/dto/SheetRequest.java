package com.gridcalc.app.dto;

public class SheetRequest {
    private String name;

    public SheetRequest() {
    }

    public SheetRequest(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }
}
