package com.gridcalc.app.models;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derived index over the formulas of one spreadsheet:
 * - forward adjacency: formula cell -> references it reads
 * - reverse adjacency for single-cell references: target -> cells reading it
 * - multi-cell range references, grouped per sheet and scanned on lookup
 * - suspended cells: formulas whose references would close a cycle
 *
 * The active edge set is always a DAG. Guarded by the owning spreadsheet's lock.
 */
public class DependencyGraph {

    private final Map<CellKey, List<SheetRange>> forward = new HashMap<>();
    private final Map<CellKey, Set<CellKey>> reverse = new HashMap<>();
    private final Map<String, Map<CellKey, List<CellRange>>> rangeReaders = new HashMap<>();
    private final Map<CellKey, List<SheetRange>> suspended = new LinkedHashMap<>();

    /**
     * Registers the references 'cell' reads. Any previous edges of 'cell' must
     * have been cleared first.
     */
    public void setPrecedents(CellKey cell, List<SheetRange> references) {
        List<SheetRange> copy = new ArrayList<>(references);
        forward.put(cell, copy);
        for (SheetRange ref : copy) {
            if (ref.isSingleCell()) {
                CellKey target = new CellKey(ref.getSheetId(), ref.getRange().start());
                reverse.computeIfAbsent(target, k -> new HashSet<>()).add(cell);
            } else {
                rangeReaders
                        .computeIfAbsent(ref.getSheetId(), k -> new HashMap<>())
                        .computeIfAbsent(cell, k -> new ArrayList<>())
                        .add(ref.getRange());
            }
        }
    }

    /**
     * Removes all forward references from 'cell', its reverse entries,
     * and any suspension it was under.
     */
    public void clearPrecedents(CellKey cell) {
        suspended.remove(cell);
        List<SheetRange> oldTargets = forward.remove(cell);
        if (oldTargets == null) {
            return;
        }
        for (SheetRange ref : oldTargets) {
            if (ref.isSingleCell()) {
                CellKey target = new CellKey(ref.getSheetId(), ref.getRange().start());
                Set<CellKey> readers = reverse.get(target);
                if (readers != null) {
                    readers.remove(cell);
                    if (readers.isEmpty()) {
                        reverse.remove(target);
                    }
                }
            } else {
                Map<CellKey, List<CellRange>> bySheet = rangeReaders.get(ref.getSheetId());
                if (bySheet != null) {
                    bySheet.remove(cell);
                    if (bySheet.isEmpty()) {
                        rangeReaders.remove(ref.getSheetId());
                    }
                }
            }
        }
    }

    public List<SheetRange> precedentsOf(CellKey cell) {
        List<SheetRange> refs = forward.get(cell);
        return refs == null ? Collections.emptyList() : Collections.unmodifiableList(refs);
    }

    /**
     * Cells whose formulas read 'cell' directly, through a single-cell or a range reference.
     */
    public Set<CellKey> directDependents(CellKey cell) {
        Set<CellKey> result = new HashSet<>(reverse.getOrDefault(cell, Collections.emptySet()));
        Map<CellKey, List<CellRange>> bySheet = rangeReaders.get(cell.getSheetId());
        if (bySheet != null) {
            for (Map.Entry<CellKey, List<CellRange>> entry : bySheet.entrySet()) {
                for (CellRange range : entry.getValue()) {
                    if (range.contains(cell.getAddress())) {
                        result.add(entry.getKey());
                        break;
                    }
                }
            }
        }
        return result;
    }

    /**
     * Every cell reachable from 'starts' by following dependents, at least one edge away.
     */
    public Set<CellKey> transitiveDependents(Collection<CellKey> starts) {
        Set<CellKey> reached = new HashSet<>();
        Deque<CellKey> queue = new ArrayDeque<>(starts);
        while (!queue.isEmpty()) {
            CellKey current = queue.poll();
            for (CellKey child : directDependents(current)) {
                if (reached.add(child)) {
                    queue.add(child);
                }
            }
        }
        return reached;
    }

    /**
     * Depth-first traversal over the dependents of 'cell': giving 'cell' these
     * references closes a cycle iff one of them covers 'cell' or anything that
     * (transitively) depends on it.
     */
    public boolean wouldCreateCycle(CellKey cell, List<SheetRange> references) {
        Set<CellKey> visited = new HashSet<>();
        Deque<CellKey> stack = new ArrayDeque<>();
        stack.push(cell);
        visited.add(cell);
        while (!stack.isEmpty()) {
            CellKey current = stack.pop();
            for (SheetRange ref : references) {
                if (ref.contains(current)) {
                    return true;
                }
            }
            for (CellKey child : directDependents(current)) {
                if (visited.add(child)) {
                    stack.push(child);
                }
            }
        }
        return false;
    }

    /**
     * Holds a formula cell out of the edge set because its references would close a cycle.
     */
    public void suspend(CellKey cell, List<SheetRange> references) {
        suspended.put(cell, new ArrayList<>(references));
    }

    public boolean isSuspended(CellKey cell) {
        return suspended.containsKey(cell);
    }

    public Map<CellKey, List<SheetRange>> getSuspended() {
        return Collections.unmodifiableMap(suspended);
    }

    public boolean hasPrecedents(CellKey cell) {
        return forward.containsKey(cell);
    }

    /**
     * Forward adjacency, restricted to one sheet's formula cells.
     */
    public Map<CellKey, List<SheetRange>> forwardEntries(String sheetId) {
        Map<CellKey, List<SheetRange>> result = new HashMap<>();
        for (Map.Entry<CellKey, List<SheetRange>> entry : forward.entrySet()) {
            if (entry.getKey().getSheetId().equals(sheetId)) {
                result.put(entry.getKey(), Collections.unmodifiableList(entry.getValue()));
            }
        }
        return result;
    }

    public int edgeCount() {
        int count = 0;
        for (List<SheetRange> refs : forward.values()) {
            count += refs.size();
        }
        return count;
    }

    public void clear() {
        forward.clear();
        reverse.clear();
        rangeReaders.clear();
        suspended.clear();
    }
}
