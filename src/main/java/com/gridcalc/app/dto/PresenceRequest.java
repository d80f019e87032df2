package com.gridcalc.app.dto;

import com.gridcalc.app.models.CursorPosition;
import com.gridcalc.app.models.SelectionRange;
import jakarta.validation.Valid;

public class PresenceRequest {
    @Valid
    private CursorPosition cursor;
    @Valid
    private SelectionRange selection;

    public PresenceRequest() {
    }

    public PresenceRequest(CursorPosition cursor, SelectionRange selection) {
        this.cursor = cursor;
        this.selection = selection;
    }

    public CursorPosition getCursor() {
        return cursor;
    }

    public void setCursor(CursorPosition cursor) {
        this.cursor = cursor;
    }

    public SelectionRange getSelection() {
        return selection;
    }

    public void setSelection(SelectionRange selection) {
        this.selection = selection;
    }
}
