package com.gridcalc.app.dto;

import com.gridcalc.app.models.Spreadsheet;

import java.time.Instant;

public class SpreadsheetSummary {
    private final String id;
    private final String name;
    private final int sheetCount;
    private final Instant createdAt;
    private final Instant updatedAt;

    public SpreadsheetSummary(Spreadsheet spreadsheet) {
        this.id = spreadsheet.getId();
        this.name = spreadsheet.getName();
        this.sheetCount = spreadsheet.getSheets().size();
        this.createdAt = spreadsheet.getCreatedAt();
        this.updatedAt = spreadsheet.getUpdatedAt();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getSheetCount() {
        return sheetCount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
