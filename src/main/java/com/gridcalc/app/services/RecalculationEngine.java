package com.gridcalc.app.services;

import com.gridcalc.app.formula.FormulaEvaluator;
import com.gridcalc.app.formula.FormulaReference;
import com.gridcalc.app.formula.ReferenceCollector;
import com.gridcalc.app.models.Cell;
import com.gridcalc.app.models.CellKey;
import com.gridcalc.app.models.CellValue;
import com.gridcalc.app.models.DependencyGraph;
import com.gridcalc.app.models.ErrorCode;
import com.gridcalc.app.models.Sheet;
import com.gridcalc.app.models.SheetRange;
import com.gridcalc.app.models.Spreadsheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Keeps a spreadsheet's dependency graph in step with its formulas and recomputes
 * exactly the cells an edit can affect, precedents before dependents.
 *
 * Every method must be called with the spreadsheet's write lock held.
 */
@Component
public class RecalculationEngine {

    private static final Logger log = LoggerFactory.getLogger(RecalculationEngine.class);

    private final FormulaEvaluator evaluator;
    private final Clock clock;

    public RecalculationEngine(FormulaEvaluator evaluator, Clock clock) {
        this.evaluator = evaluator;
        this.clock = clock;
    }

    /**
     * Re-links the edited cells and recomputes them with all their transitive dependents.
     * Edited cells that are now empty or literal simply drop their outgoing edges.
     */
    public RecalculationResult recalculate(Spreadsheet spreadsheet, Collection<CellKey> edited) {
        DependencyGraph graph = spreadsheet.getDependencyGraph();
        Comparator<CellKey> order = positionOrder(spreadsheet);

        List<CellKey> editedInOrder = new ArrayList<>(new LinkedHashSet<>(edited));
        editedInOrder.sort(order);

        // 1) drop old edges first, so a batch may rewire cells that referenced each other
        for (CellKey key : editedInOrder) {
            graph.clearPrecedents(key);
        }

        // 2) link the new formulas, holding back any that would close a cycle
        Set<CellKey> circular = new LinkedHashSet<>();
        for (CellKey key : editedInOrder) {
            Cell cell = cellAt(spreadsheet, key);
            if (cell == null || !cell.isFormula()) {
                continue;
            }
            if (!link(spreadsheet, graph, key, cell)) {
                circular.add(key);
            }
        }

        // 3) a suspended cell may be free of its cycle now
        Set<CellKey> revived = retrySuspended(spreadsheet, graph, new HashSet<>(editedInOrder));

        // 4) everything downstream of what changed
        Set<CellKey> starts = new LinkedHashSet<>(editedInOrder);
        starts.addAll(revived);
        Set<CellKey> affected = new HashSet<>(starts);
        affected.addAll(graph.transitiveDependents(starts));

        // 5) evaluate in dependency order
        List<CellKey> recomputed = evaluateInOrder(spreadsheet, graph, affected, order);

        if (!circular.isEmpty()) {
            log.warn("Circular reference in spreadsheet {}: {}", spreadsheet.getId(), circular);
        }
        log.debug("Recalculated {} cell(s) in spreadsheet {} after editing {}",
                recomputed.size(), spreadsheet.getId(), editedInOrder.size());
        return new RecalculationResult(recomputed, circular);
    }

    /**
     * Rebuilds the graph from scratch and recomputes every formula once.
     * Used after structural changes such as sheet renames or variable updates.
     */
    public RecalculationResult recalculateAll(Spreadsheet spreadsheet) {
        spreadsheet.getDependencyGraph().clear();
        List<CellKey> formulas = new ArrayList<>();
        for (Sheet sheet : spreadsheet.getSheets()) {
            for (Cell cell : sheet.formulaCells()) {
                formulas.add(new CellKey(sheet.getId(), cell.getAddress()));
            }
        }
        log.debug("Rebuilding dependency graph of spreadsheet {} ({} formulas)", spreadsheet.getId(),
                formulas.size());
        return recalculate(spreadsheet, formulas);
    }

    /**
     * Resolves the references a formula reads to stable sheet ids.
     * References to sheets that do not exist get no edge; they evaluate to #REF!.
     */
    public List<SheetRange> resolveReferences(Spreadsheet spreadsheet, Sheet owner, Cell cell) {
        List<SheetRange> resolved = new ArrayList<>();
        for (FormulaReference reference : ReferenceCollector.references(cell.getFormula())) {
            Sheet target = reference.getSheetName() == null
                    ? owner
                    : spreadsheet.findSheetByName(reference.getSheetName());
            if (target != null) {
                resolved.add(new SheetRange(target.getId(), reference.getRange()));
            }
        }
        return resolved;
    }

    private boolean link(Spreadsheet spreadsheet, DependencyGraph graph, CellKey key, Cell cell) {
        Sheet owner = spreadsheet.findSheetById(key.getSheetId());
        List<SheetRange> references = resolveReferences(spreadsheet, owner, cell);
        if (graph.wouldCreateCycle(key, references)) {
            graph.suspend(key, references);
            return false;
        }
        graph.setPrecedents(key, references);
        return true;
    }

    private Set<CellKey> retrySuspended(Spreadsheet spreadsheet, DependencyGraph graph, Set<CellKey> edited) {
        Set<CellKey> revived = new LinkedHashSet<>();
        List<Map.Entry<CellKey, List<SheetRange>>> candidates = new ArrayList<>(graph.getSuspended().entrySet());
        for (Map.Entry<CellKey, List<SheetRange>> entry : candidates) {
            CellKey key = entry.getKey();
            if (edited.contains(key)) {
                continue;
            }
            Cell cell = cellAt(spreadsheet, key);
            if (cell == null || !cell.isFormula()) {
                graph.clearPrecedents(key);
                continue;
            }
            List<SheetRange> references = entry.getValue();
            if (!graph.wouldCreateCycle(key, references)) {
                graph.clearPrecedents(key);
                graph.setPrecedents(key, references);
                revived.add(key);
                log.info("Cell {} rejoined the dependency graph of spreadsheet {}", key, spreadsheet.getId());
            }
        }
        return revived;
    }

    /**
     * Kahn's algorithm over the affected cells; the priority queue breaks ties by
     * (sheet index, row, column) so the order is deterministic.
     */
    private List<CellKey> evaluateInOrder(Spreadsheet spreadsheet, DependencyGraph graph,
                                          Set<CellKey> affected, Comparator<CellKey> order) {
        Map<CellKey, Integer> inDegree = new HashMap<>();
        Map<CellKey, List<CellKey>> children = new HashMap<>();
        for (CellKey key : affected) {
            inDegree.putIfAbsent(key, 0);
            for (CellKey dependent : graph.directDependents(key)) {
                if (affected.contains(dependent) && !dependent.equals(key)) {
                    children.computeIfAbsent(key, k -> new ArrayList<>()).add(dependent);
                    inDegree.merge(dependent, 1, Integer::sum);
                }
            }
        }

        // Mark every affected formula stale before computing anything
        for (CellKey key : affected) {
            Cell cell = cellAt(spreadsheet, key);
            if (cell != null && cell.isFormula()) {
                cell.setDirty(true);
            }
        }

        PriorityQueue<CellKey> ready = new PriorityQueue<>(order);
        for (Map.Entry<CellKey, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                ready.add(entry.getKey());
            }
        }

        List<CellKey> recomputed = new ArrayList<>();
        Set<CellKey> done = new HashSet<>();
        while (!ready.isEmpty()) {
            CellKey key = ready.poll();
            done.add(key);
            if (evaluate(spreadsheet, graph, key)) {
                recomputed.add(key);
            }
            for (CellKey child : children.getOrDefault(key, new ArrayList<>())) {
                if (inDegree.merge(child, -1, Integer::sum) == 0) {
                    ready.add(child);
                }
            }
        }

        if (done.size() < affected.size()) {
            // The active edge set is kept acyclic, so this means the graph is corrupt
            for (CellKey key : affected) {
                if (!done.contains(key)) {
                    Cell cell = cellAt(spreadsheet, key);
                    if (cell != null && cell.isFormula()) {
                        cell.setEvaluatedValue(CellValue.error(ErrorCode.CIRCULAR));
                        recomputed.add(key);
                    }
                }
            }
            log.error("Dependency graph of spreadsheet {} contained a cycle; {} cell(s) forced to {}",
                    spreadsheet.getId(), affected.size() - done.size(), ErrorCode.CIRCULAR.getDisplay());
        }
        return recomputed;
    }

    private boolean evaluate(Spreadsheet spreadsheet, DependencyGraph graph, CellKey key) {
        Sheet sheet = spreadsheet.findSheetById(key.getSheetId());
        Cell cell = sheet == null ? null : sheet.getCell(key.getAddress());
        if (cell == null || !cell.isFormula()) {
            return false;
        }
        if (graph.isSuspended(key)) {
            cell.setEvaluatedValue(CellValue.error(ErrorCode.CIRCULAR));
            return true;
        }
        SpreadsheetEvaluationContext context = new SpreadsheetEvaluationContext(spreadsheet, sheet, clock);
        cell.setEvaluatedValue(evaluator.evaluate(cell.getFormula(), context));
        return true;
    }

    private static Cell cellAt(Spreadsheet spreadsheet, CellKey key) {
        Sheet sheet = spreadsheet.findSheetById(key.getSheetId());
        return sheet == null ? null : sheet.getCell(key.getAddress());
    }

    static Comparator<CellKey> positionOrder(Spreadsheet spreadsheet) {
        return Comparator.<CellKey>comparingInt(key -> spreadsheet.indexOfSheet(key.getSheetId()))
                .thenComparing(CellKey::getAddress);
    }
}
