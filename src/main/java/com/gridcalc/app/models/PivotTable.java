package com.gridcalc.app.models;

import java.time.Instant;
import java.util.UUID;

/**
 * A pivot table owned by a spreadsheet. The source sheet is tracked by its
 * stable id so that reordering sheets does not retarget the pivot.
 */
public class PivotTable {
    private final String id;
    private PivotConfig config;
    private String sourceSheetId;
    private CellRange sourceRange;
    private PivotResult result;
    private Instant refreshedAt;

    public PivotTable(PivotConfig config, String sourceSheetId, CellRange sourceRange) {
        this.id = UUID.randomUUID().toString();
        this.config = config;
        this.sourceSheetId = sourceSheetId;
        this.sourceRange = sourceRange;
    }

    public String getId() {
        return id;
    }

    public PivotConfig getConfig() {
        return config;
    }

    public String getSourceSheetId() {
        return sourceSheetId;
    }

    public CellRange getSourceRange() {
        return sourceRange;
    }

    /**
     * Swaps in a new configuration while keeping the pivot's identity.
     */
    public void reconfigure(PivotConfig config, String sourceSheetId, CellRange sourceRange) {
        this.config = config;
        this.sourceSheetId = sourceSheetId;
        this.sourceRange = sourceRange;
        this.result = null;
    }

    public PivotResult getResult() {
        return result;
    }

    public Instant getRefreshedAt() {
        return refreshedAt;
    }

    public void setResult(PivotResult result, Instant refreshedAt) {
        this.result = result;
        this.refreshedAt = refreshedAt;
    }
}
