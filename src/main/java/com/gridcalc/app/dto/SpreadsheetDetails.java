package com.gridcalc.app.dto;

import com.gridcalc.app.models.CellValue;
import com.gridcalc.app.models.Sheet;
import com.gridcalc.app.models.Spreadsheet;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class SpreadsheetDetails {
    private final String id;
    private final String name;
    private final long revision;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final List<SheetSummary> sheets = new ArrayList<>();
    private final Map<String, CellValue> variables;
    private final int pivotCount;

    public SpreadsheetDetails(Spreadsheet spreadsheet) {
        this.id = spreadsheet.getId();
        this.name = spreadsheet.getName();
        this.revision = spreadsheet.getRevision();
        this.createdAt = spreadsheet.getCreatedAt();
        this.updatedAt = spreadsheet.getUpdatedAt();
        for (Sheet sheet : spreadsheet.getSheets()) {
            sheets.add(new SheetSummary(sheet));
        }
        this.variables = new LinkedHashMap<>(spreadsheet.getVariables());
        this.pivotCount = spreadsheet.getPivotTables().size();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public long getRevision() {
        return revision;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public List<SheetSummary> getSheets() {
        return sheets;
    }

    public Map<String, CellValue> getVariables() {
        return variables;
    }

    public int getPivotCount() {
        return pivotCount;
    }
}
