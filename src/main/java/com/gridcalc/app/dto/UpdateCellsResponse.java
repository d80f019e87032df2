package com.gridcalc.app.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class UpdateCellsResponse {
    private final long revision;
    // Bounding range of the edited cells, after recalculation; null when it exceeds the range cap
    private final RangeSnapshot updated;
    private final List<CellSnapshot> edited;
    private final List<CellSnapshot> recalculated;
    private final List<String> circular;
    private final List<CellConflict> conflicts;
    private final List<String> refreshedPivots;

    public UpdateCellsResponse(long revision, RangeSnapshot updated, List<CellSnapshot> edited,
                               List<CellSnapshot> recalculated, List<String> circular,
                               List<CellConflict> conflicts, List<String> refreshedPivots) {
        this.revision = revision;
        this.updated = updated;
        this.edited = edited;
        this.recalculated = recalculated;
        this.circular = circular;
        this.conflicts = conflicts;
        this.refreshedPivots = refreshedPivots;
    }

    public long getRevision() {
        return revision;
    }

    public RangeSnapshot getUpdated() {
        return updated;
    }

    /**
     * Every edited cell after recalculation, in the order the batch named them.
     */
    public List<CellSnapshot> getEdited() {
        return edited;
    }

    /**
     * Formula cells recomputed by the edit, in evaluation order.
     */
    public List<CellSnapshot> getRecalculated() {
        return recalculated;
    }

    public List<String> getCircular() {
        return circular;
    }

    public List<CellConflict> getConflicts() {
        return conflicts;
    }

    public List<String> getRefreshedPivots() {
        return refreshedPivots;
    }
}
