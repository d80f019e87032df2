package com.gridcalc.app.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Bulk load: row i, entry j lands at (startRow + i, startColumn + j).
 */
public class ImportRowsRequest {
    @Min(0)
    private int startRow;
    @Min(0)
    private int startColumn;
    private String participantId;
    @NotNull
    private List<List<Object>> rows;

    public ImportRowsRequest() {
    }

    public ImportRowsRequest(int startRow, int startColumn, List<List<Object>> rows) {
        this.startRow = startRow;
        this.startColumn = startColumn;
        this.rows = rows;
    }

    public int getStartRow() {
        return startRow;
    }

    public void setStartRow(int startRow) {
        this.startRow = startRow;
    }

    public int getStartColumn() {
        return startColumn;
    }

    public void setStartColumn(int startColumn) {
        this.startColumn = startColumn;
    }

    public String getParticipantId() {
        return participantId;
    }

    public void setParticipantId(String participantId) {
        this.participantId = participantId;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public void setRows(List<List<Object>> rows) {
        this.rows = rows;
    }
}
