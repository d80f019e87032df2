package com.gridcalc.app.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * CSV text to load into a sheet. Record i, field j lands at (startRow + i, startColumn + j).
 * The name is only read when the import creates a new spreadsheet.
 */
public class CsvImportRequest {
    private String name;
    @NotNull
    private String csv;
    private String delimiter = ",";
    @Min(0)
    private int startRow;
    @Min(0)
    private int startColumn;
    private String participantId;

    public CsvImportRequest() {
    }

    public CsvImportRequest(String csv, String delimiter) {
        this.csv = csv;
        this.delimiter = delimiter;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getCsv() {
        return csv;
    }

    public void setCsv(String csv) {
        this.csv = csv;
    }

    public String getDelimiter() {
        return delimiter;
    }

    public void setDelimiter(String delimiter) {
        this.delimiter = delimiter;
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
}
