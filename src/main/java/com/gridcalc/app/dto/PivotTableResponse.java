package com.gridcalc.app.dto;

import com.gridcalc.app.models.PivotConfig;
import com.gridcalc.app.models.PivotResult;
import com.gridcalc.app.models.PivotTable;

import java.time.Instant;

public class PivotTableResponse {
    private final String id;
    private final String name;
    private final int sheetIndex;
    private final String sourceRange;
    private final PivotConfig config;
    private final PivotResult result;
    private final Instant refreshedAt;

    public PivotTableResponse(PivotTable pivot, int sheetIndex) {
        this.id = pivot.getId();
        this.name = pivot.getConfig().getName();
        this.sheetIndex = sheetIndex;
        this.sourceRange = pivot.getSourceRange().toA1();
        this.config = pivot.getConfig();
        this.result = pivot.getResult();
        this.refreshedAt = pivot.getRefreshedAt();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getSheetIndex() {
        return sheetIndex;
    }

    public String getSourceRange() {
        return sourceRange;
    }

    public PivotConfig getConfig() {
        return config;
    }

    public PivotResult getResult() {
        return result;
    }

    public Instant getRefreshedAt() {
        return refreshedAt;
    }
}
