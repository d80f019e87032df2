package com.gridcalc.app.services;

import com.gridcalc.app.models.CellKey;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Outcome of one recalculation pass.
 */
public class RecalculationResult {

    private final List<CellKey> recomputed;
    private final Set<CellKey> circular;

    public RecalculationResult(List<CellKey> recomputed, Set<CellKey> circular) {
        this.recomputed = Collections.unmodifiableList(recomputed);
        this.circular = Collections.unmodifiableSet(circular);
    }

    /**
     * Formula cells in the order they were evaluated.
     */
    public List<CellKey> getRecomputed() {
        return recomputed;
    }

    /**
     * Edited cells whose references would have closed a cycle.
     */
    public Set<CellKey> getCircular() {
        return circular;
    }
}
