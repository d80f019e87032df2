package com.gridcalc.app.models;

import java.time.Instant;

/**
 * Immutable snapshot of a participant's cursor and selection.
 * Replaced wholesale on every update, so readers never see a torn pair.
 */
public final class Presence {
    private final CursorPosition cursor;
    private final SelectionRange selection;
    private final Instant updatedAt;

    public Presence(CursorPosition cursor, SelectionRange selection, Instant updatedAt) {
        this.cursor = cursor;
        this.selection = selection;
        this.updatedAt = updatedAt;
    }

    public CursorPosition getCursor() {
        return cursor;
    }

    public SelectionRange getSelection() {
        return selection;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
