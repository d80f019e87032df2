package com.gridcalc.app.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Either the precedents / dependents of one cell, or the forward reference map of a sheet.
 * References on other sheets are written as 'Sheet Name'!A1.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DependencyResponse {
    private final int sheetIndex;
    private final String cell;
    private final List<String> precedents;
    private final List<String> dependents;
    private final Map<String, List<String>> forward;

    private DependencyResponse(int sheetIndex, String cell, List<String> precedents, List<String> dependents,
                               Map<String, List<String>> forward) {
        this.sheetIndex = sheetIndex;
        this.cell = cell;
        this.precedents = precedents;
        this.dependents = dependents;
        this.forward = forward;
    }

    public static DependencyResponse forCell(int sheetIndex, String cell, List<String> precedents,
                                             List<String> dependents) {
        return new DependencyResponse(sheetIndex, cell, precedents, dependents, null);
    }

    public static DependencyResponse forSheet(int sheetIndex, Map<String, List<String>> forward) {
        return new DependencyResponse(sheetIndex, null, null, null, forward);
    }

    public int getSheetIndex() {
        return sheetIndex;
    }

    public String getCell() {
        return cell;
    }

    public List<String> getPrecedents() {
        return precedents;
    }

    public List<String> getDependents() {
        return dependents;
    }

    public Map<String, List<String>> getForward() {
        return forward;
    }
}
