package com.gridcalc.app.dto;

import jakarta.validation.constraints.Min;

/**
 * One edit inside a batch. The target is either 'address' ("B3")
 * or the zero-based 'row' / 'column' pair.
 * 'value' is the raw JSON input: a number, a boolean, text, formula text or null to clear.
 */
public class CellUpdateRequest {
    private String address;
    @Min(0)
    private Integer row;
    @Min(0)
    private Integer column;
    private Object value;
    // Revision of the cell the client last saw, used to report overwrites
    private Long baseRevision;

    public CellUpdateRequest() {
    }

    public CellUpdateRequest(String address, Object value) {
        this.address = address;
        this.value = value;
    }

    public CellUpdateRequest(int row, int column, Object value) {
        this.row = row;
        this.column = column;
        this.value = value;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public Integer getRow() {
        return row;
    }

    public void setRow(Integer row) {
        this.row = row;
    }

    public Integer getColumn() {
        return column;
    }

    public void setColumn(Integer column) {
        this.column = column;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    public Long getBaseRevision() {
        return baseRevision;
    }

    public void setBaseRevision(Long baseRevision) {
        this.baseRevision = baseRevision;
    }
}
