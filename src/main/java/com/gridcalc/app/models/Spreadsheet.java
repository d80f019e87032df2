package com.gridcalc.app.models;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents an entire spreadsheet:
 * - Has a unique ID and a name
 * - An ordered list of Sheets it owns exclusively
 * - Named variables formulas can refer to
 * - Pivot tables built over its sheets
 * - One dependency graph spanning its sheets
 * - A read/write lock covering cells and graph together
 */
public class Spreadsheet {

    private final String id;
    private String name;
    private final Instant createdAt;
    private Instant updatedAt;
    private final List<Sheet> sheets = new ArrayList<>();
    // Upper-cased variable name -> value
    private final Map<String, CellValue> variables = new LinkedHashMap<>();
    private final Map<String, PivotTable> pivotTables = new LinkedHashMap<>();
    private final DependencyGraph dependencyGraph = new DependencyGraph();
    private long revision;

    // Serializes edits; reads share the lock so they never see a half-recalculated sheet
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Spreadsheet(String name, Instant createdAt) {
        this.id = UUID.randomUUID().toString();
        this.name = name;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void touch(Instant now) {
        this.updatedAt = now;
    }

    public List<Sheet> getSheets() {
        return Collections.unmodifiableList(sheets);
    }

    /**
     * Returns the sheet at 'index', or null when out of range.
     */
    public Sheet getSheet(int index) {
        if (index < 0 || index >= sheets.size()) {
            return null;
        }
        return sheets.get(index);
    }

    public Sheet findSheetByName(String sheetName) {
        for (Sheet sheet : sheets) {
            if (sheet.getName().equalsIgnoreCase(sheetName)) {
                return sheet;
            }
        }
        return null;
    }

    public Sheet findSheetById(String sheetId) {
        for (Sheet sheet : sheets) {
            if (sheet.getId().equals(sheetId)) {
                return sheet;
            }
        }
        return null;
    }

    /**
     * Current position of the sheet, or Integer.MAX_VALUE for a sheet no longer present.
     */
    public int indexOfSheet(String sheetId) {
        Sheet sheet = findSheetById(sheetId);
        return sheet == null ? Integer.MAX_VALUE : sheet.getIndex();
    }

    public Sheet addSheet(String sheetName) {
        Sheet sheet = new Sheet(sheetName, sheets.size());
        sheets.add(sheet);
        return sheet;
    }

    public Sheet removeSheet(int index) {
        Sheet removed = sheets.remove(index);
        for (int i = 0; i < sheets.size(); i++) {
            sheets.get(i).setIndex(i);
        }
        return removed;
    }

    public Map<String, CellValue> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    public CellValue getVariable(String variableName) {
        return variables.get(variableName.toUpperCase(Locale.ROOT));
    }

    public void replaceVariables(Map<String, CellValue> newVariables) {
        variables.clear();
        for (Map.Entry<String, CellValue> entry : newVariables.entrySet()) {
            variables.put(entry.getKey().toUpperCase(Locale.ROOT), entry.getValue());
        }
    }

    public Map<String, PivotTable> getPivotTables() {
        return pivotTables;
    }

    public DependencyGraph getDependencyGraph() {
        return dependencyGraph;
    }

    public long getRevision() {
        return revision;
    }

    public long nextRevision() {
        return ++revision;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
