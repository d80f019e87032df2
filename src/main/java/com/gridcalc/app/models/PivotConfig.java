package com.gridcalc.app.models;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarative pivot definition: the source range (whose first row holds the
 * field names), the group-by fields, the measures and optional filters.
 */
public class PivotConfig {
    @NotBlank
    private String name = "PivotTable1";
    @Min(0)
    private int sheetIndex;
    @NotBlank
    private String sourceRange;
    private List<String> groupBy = new ArrayList<>();
    @Valid
    private List<PivotMeasure> measures = new ArrayList<>();
    @Valid
    private List<PivotFilter> filters = new ArrayList<>();
    private boolean showGrandTotal;

    public PivotConfig() {
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getSheetIndex() {
        return sheetIndex;
    }

    public void setSheetIndex(int sheetIndex) {
        this.sheetIndex = sheetIndex;
    }

    public String getSourceRange() {
        return sourceRange;
    }

    public void setSourceRange(String sourceRange) {
        this.sourceRange = sourceRange;
    }

    public List<String> getGroupBy() {
        return groupBy;
    }

    public void setGroupBy(List<String> groupBy) {
        this.groupBy = groupBy;
    }

    public List<PivotMeasure> getMeasures() {
        return measures;
    }

    public void setMeasures(List<PivotMeasure> measures) {
        this.measures = measures;
    }

    public List<PivotFilter> getFilters() {
        return filters;
    }

    public void setFilters(List<PivotFilter> filters) {
        this.filters = filters;
    }

    public boolean isShowGrandTotal() {
        return showGrandTotal;
    }

    public void setShowGrandTotal(boolean showGrandTotal) {
        this.showGrandTotal = showGrandTotal;
    }
}
