package com.gridcalc.app.models;

/**
 * Pushed to every collaboration participant when a cell's content or value changes.
 * 'overwrittenParticipantId' names the editor whose concurrent write lost, if any,
 * so that client can reconcile.
 */
public class CellUpdateEvent {
    private final String spreadsheetId;
    private final int sheetIndex;
    private final String address;
    private final int row;
    private final int column;
    private final String content;
    private final CellValue value;
    private final long revision;
    private final String editorParticipantId;
    private final String overwrittenParticipantId;

    public CellUpdateEvent(String spreadsheetId, int sheetIndex, CellAddress address, String content,
                           CellValue value, long revision, String editorParticipantId,
                           String overwrittenParticipantId) {
        this.spreadsheetId = spreadsheetId;
        this.sheetIndex = sheetIndex;
        this.address = address.toA1();
        this.row = address.getRow();
        this.column = address.getColumn();
        this.content = content;
        this.value = value;
        this.revision = revision;
        this.editorParticipantId = editorParticipantId;
        this.overwrittenParticipantId = overwrittenParticipantId;
    }

    public String getSpreadsheetId() {
        return spreadsheetId;
    }

    public int getSheetIndex() {
        return sheetIndex;
    }

    public String getAddress() {
        return address;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    public String getContent() {
        return content;
    }

    public CellValue getValue() {
        return value;
    }

    public long getRevision() {
        return revision;
    }

    public String getEditorParticipantId() {
        return editorParticipantId;
    }

    public String getOverwrittenParticipantId() {
        return overwrittenParticipantId;
    }

    public boolean isConflict() {
        return overwrittenParticipantId != null;
    }
}
