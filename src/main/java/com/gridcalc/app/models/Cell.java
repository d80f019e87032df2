package com.gridcalc.app.models;

import com.gridcalc.app.formula.ast.Expr;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - its position in the sheet
 * - content (literal or formula source, kept verbatim)
 * - for formulas, the parsed AST and the cached evaluated value
 * - dirty flag to signal if the cached evaluatedValue is stale
 * - the revision and participant of the edit that last wrote it
 */
public class Cell {
    private final CellAddress address;
    private final CellContent content;
    // Parsed once when the content is set; null for literals
    private final Expr formula;
    private CellValue evaluatedValue;
    private boolean dirty;
    private final long revision;
    private final String lastEditor;

    public Cell(CellAddress address, CellContent content, Expr formula, long revision, String lastEditor) {
        if (content.isFormula() && formula == null) {
            throw new IllegalArgumentException("Formula cell " + address + " needs a parsed expression");
        }
        this.address = address;
        this.content = content;
        this.formula = content.isFormula() ? formula : null;
        this.revision = revision;
        this.lastEditor = lastEditor;
        // Formula cells start stale until the recalculation pass reaches them
        this.dirty = content.isFormula();
    }

    public CellAddress getAddress() {
        return address;
    }

    public int getRow() {
        return address.getRow();
    }

    public int getColumn() {
        return address.getColumn();
    }

    public CellContent getContent() {
        return content;
    }

    public boolean isFormula() {
        return content.isFormula();
    }

    public Expr getFormula() {
        return formula;
    }

    /**
     * The value other cells observe: the literal itself, or the cached formula result.
     */
    public CellValue getValue() {
        if (!content.isFormula()) {
            return content.getLiteral();
        }
        return evaluatedValue == null ? CellValue.empty() : evaluatedValue;
    }

    public void setEvaluatedValue(CellValue evaluatedValue) {
        this.evaluatedValue = evaluatedValue;
        this.dirty = false; // Once computed, mark no longer dirty
    }

    public void setDirty(boolean dirty) {
        this.dirty = dirty;
    }

    public boolean isDirty() {
        return dirty;
    }

    public long getRevision() {
        return revision;
    }

    public String getLastEditor() {
        return lastEditor;
    }
}
