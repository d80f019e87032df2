package com.gridcalc.app.services;

import com.gridcalc.app.config.GridCalcProperties;
import com.gridcalc.app.dto.CellConflict;
import com.gridcalc.app.dto.CellSnapshot;
import com.gridcalc.app.dto.CellUpdateRequest;
import com.gridcalc.app.dto.DependencyResponse;
import com.gridcalc.app.dto.EvaluationResponse;
import com.gridcalc.app.dto.ImportRowsRequest;
import com.gridcalc.app.dto.RangeSnapshot;
import com.gridcalc.app.dto.UpdateCellsRequest;
import com.gridcalc.app.dto.UpdateCellsResponse;
import com.gridcalc.app.exceptions.FormulaParseException;
import com.gridcalc.app.exceptions.InvalidRangeException;
import com.gridcalc.app.exceptions.SheetNotFoundException;
import com.gridcalc.app.formula.FormulaEvaluator;
import com.gridcalc.app.formula.FormulaParser;
import com.gridcalc.app.formula.FormulaReference;
import com.gridcalc.app.formula.ReferenceCollector;
import com.gridcalc.app.formula.ast.Expr;
import com.gridcalc.app.models.Cell;
import com.gridcalc.app.models.CellAddress;
import com.gridcalc.app.models.CellContent;
import com.gridcalc.app.models.CellKey;
import com.gridcalc.app.models.CellRange;
import com.gridcalc.app.models.CellUpdateEvent;
import com.gridcalc.app.models.CellValue;
import com.gridcalc.app.models.DependencyGraph;
import com.gridcalc.app.models.SheetRange;
import com.gridcalc.app.models.Sheet;
import com.gridcalc.app.models.Spreadsheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * The cell store: edits, reads and ad-hoc evaluation against one sheet of a spreadsheet.
 */
@Service
public class SheetService {

    private static final Logger log = LoggerFactory.getLogger(SheetService.class);

    private final SpreadsheetRegistry registry;
    private final FormulaParser parser;
    private final FormulaEvaluator evaluator;
    private final RecalculationEngine recalculationEngine;
    private final PivotService pivotService;
    private final CollaborationService collaborationService;
    private final GridCalcProperties properties;
    private final Clock clock;

    public SheetService(SpreadsheetRegistry registry, FormulaParser parser, FormulaEvaluator evaluator,
                        RecalculationEngine recalculationEngine, PivotService pivotService,
                        CollaborationService collaborationService, GridCalcProperties properties, Clock clock) {
        this.registry = registry;
        this.parser = parser;
        this.evaluator = evaluator;
        this.recalculationEngine = recalculationEngine;
        this.pivotService = pivotService;
        this.collaborationService = collaborationService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Applies a batch of edits as one revision:
     * 1) Parse every input up front, so a malformed formula rejects the whole batch untouched.
     * 2) Under the write lock, store the new contents and note overwritten foreign edits.
     * 3) Re-link and recompute the edited cells and their transitive dependents.
     * 4) Refresh pivots reading any changed cell.
     * 5) After the lock is released, notify collaborators.
     */
    public UpdateCellsResponse updateCells(String spreadsheetId, int sheetIndex, UpdateCellsRequest request) {
        Spreadsheet spreadsheet = registry.require(spreadsheetId);
        String participantId = request.getParticipantId();
        if (request.getUpdates() == null || request.getUpdates().isEmpty()) {
            throw new InvalidRangeException("No cell updates given");
        }

        // 1) parse outside the lock; later edits of the same address win
        Map<CellAddress, PendingEdit> edits = new LinkedHashMap<>();
        for (CellUpdateRequest update : request.getUpdates()) {
            CellAddress address = resolveAddress(update);
            CellContent content = CellContent.fromInput(update.getValue());
            Expr formula = null;
            if (content.isFormula()) {
                try {
                    formula = parser.parse(content.getSource());
                } catch (FormulaParseException e) {
                    log.warn("Rejected formula for {} in spreadsheet {}: {}", address.toA1(), spreadsheetId,
                            e.getMessage());
                    throw e;
                }
            }
            edits.remove(address);
            edits.put(address, new PendingEdit(address, content, formula, update.getBaseRevision()));
        }

        UpdateCellsResponse response;
        List<CellUpdateEvent> events = new ArrayList<>();
        spreadsheet.getLock().writeLock().lock();
        try {
            Sheet sheet = requireSheet(spreadsheet, sheetIndex);
            long revision = spreadsheet.nextRevision();

            // 2) store
            List<CellKey> editedKeys = new ArrayList<>();
            List<CellConflict> conflicts = new ArrayList<>();
            Map<CellAddress, String> overwritten = new LinkedHashMap<>();
            for (PendingEdit edit : edits.values()) {
                Cell existing = sheet.getCell(edit.address);
                if (isConflict(existing, edit, participantId)) {
                    conflicts.add(new CellConflict(edit.address.toA1(), edit.baseRevision,
                            existing.getRevision(), existing.getLastEditor()));
                    overwritten.put(edit.address, existing.getLastEditor());
                }
                if (edit.content.isEmpty()) {
                    sheet.removeCell(edit.address);
                } else {
                    sheet.putCell(new Cell(edit.address, edit.content, edit.formula, revision, participantId));
                }
                editedKeys.add(new CellKey(sheet.getId(), edit.address));
            }

            // 3) recompute
            RecalculationResult recalculation = recalculationEngine.recalculate(spreadsheet, editedKeys);
            spreadsheet.touch(clock.instant());

            // 4) pivots
            List<String> refreshedPivots = Collections.emptyList();
            if (properties.getPivot().isAutoRefresh() && !spreadsheet.getPivotTables().isEmpty()) {
                Set<CellKey> changed = new LinkedHashSet<>(editedKeys);
                changed.addAll(recalculation.getRecomputed());
                refreshedPivots = pivotService.refreshAffected(spreadsheet, changed);
            }

            if (!conflicts.isEmpty()) {
                log.info("Revision {} of spreadsheet {} overwrote {} cell(s) last written by other participants",
                        revision, spreadsheetId, conflicts.size());
            }
            // far-apart edits get no dense box
            CellRange touched = boundingRange(edits.keySet());
            RangeSnapshot updated = touched.cellCount() <= properties.getRange().getMaxCells()
                    ? snapshot(sheet, touched)
                    : null;
            response = new UpdateCellsResponse(revision, updated, editedSnapshots(sheet, edits.keySet()),
                    recalculatedSnapshots(spreadsheet, recalculation.getRecomputed()),
                    describe(spreadsheet, sheet, recalculation.getCircular()),
                    conflicts, refreshedPivots);
            events.addAll(buildEvents(spreadsheet, sheet, editedKeys, recalculation, participantId, overwritten));
            log.debug("Spreadsheet {} sheet {} at revision {}: {} edit(s), {} recomputed",
                    spreadsheetId, sheetIndex, revision, editedKeys.size(), recalculation.getRecomputed().size());
        } finally {
            spreadsheet.getLock().writeLock().unlock();
        }

        // 5) fire-and-forget, outside the lock
        collaborationService.publish(spreadsheetId, events);
        return response;
    }

    /**
     * Single-cell convenience over {@link #updateCells}.
     */
    public UpdateCellsResponse setCell(String spreadsheetId, int sheetIndex, String address, Object value,
                                       String participantId) {
        List<CellUpdateRequest> updates = new ArrayList<>();
        updates.add(new CellUpdateRequest(address, value));
        return updateCells(spreadsheetId, sheetIndex, new UpdateCellsRequest(participantId, updates));
    }

    public CellSnapshot getCell(String spreadsheetId, int sheetIndex, String address) {
        CellAddress cellAddress = CellAddress.parseA1(address);
        if (cellAddress == null) {
            throw new InvalidRangeException("Invalid cell address: " + address);
        }
        Spreadsheet spreadsheet = registry.require(spreadsheetId);
        spreadsheet.getLock().readLock().lock();
        try {
            Sheet sheet = requireSheet(spreadsheet, sheetIndex);
            Cell cell = sheet.getCell(cellAddress);
            return cell == null ? CellSnapshot.empty(sheetIndex, cellAddress) : CellSnapshot.of(sheetIndex, cell);
        } finally {
            spreadsheet.getLock().readLock().unlock();
        }
    }

    /**
     * Dense grid for inclusive, zero-based bounds. Positions without content come back empty.
     */
    public RangeSnapshot getRange(String spreadsheetId, int sheetIndex, int startRow, int endRow,
                                  int startColumn, int endColumn) {
        if (startRow < 0 || startColumn < 0 || endRow < startRow || endColumn < startColumn) {
            throw new InvalidRangeException("Invalid range bounds: rows " + startRow + ".." + endRow
                    + ", columns " + startColumn + ".." + endColumn);
        }
        if (endRow > CellAddress.MAX_INDEX || endColumn > CellAddress.MAX_INDEX) {
            throw new InvalidRangeException("Range bounds must not exceed " + CellAddress.MAX_INDEX);
        }
        CellRange range = new CellRange(startRow, startColumn, endRow, endColumn);
        long maxCells = properties.getRange().getMaxCells();
        if (range.cellCount() > maxCells) {
            throw new InvalidRangeException("Range " + range.toA1() + " spans " + range.cellCount()
                    + " cells; the limit is " + maxCells);
        }
        Spreadsheet spreadsheet = registry.require(spreadsheetId);
        spreadsheet.getLock().readLock().lock();
        try {
            return snapshot(requireSheet(spreadsheet, sheetIndex), range);
        } finally {
            spreadsheet.getLock().readLock().unlock();
        }
    }

    /**
     * Evaluates a formula against a sheet without storing it. The leading "=" is optional.
     */
    public EvaluationResponse evaluateFormula(String spreadsheetId, int sheetIndex, String formula) {
        String source = formula.trim();
        if (!source.startsWith(CellContent.FORMULA_MARKER)) {
            source = CellContent.FORMULA_MARKER + source;
        }
        Expr expr = parser.parse(source);
        List<String> references = new ArrayList<>();
        for (FormulaReference reference : ReferenceCollector.references(expr)) {
            references.add(reference.toA1());
        }
        Spreadsheet spreadsheet = registry.require(spreadsheetId);
        spreadsheet.getLock().readLock().lock();
        try {
            Sheet sheet = requireSheet(spreadsheet, sheetIndex);
            CellValue value = evaluator.evaluate(expr, new SpreadsheetEvaluationContext(spreadsheet, sheet, clock));
            return new EvaluationResponse(source, value, references);
        } finally {
            spreadsheet.getLock().readLock().unlock();
        }
    }

    /**
     * Writes a block of rows starting at the given corner as one edit batch.
     * Null entries clear their cell.
     */
    public UpdateCellsResponse importRows(String spreadsheetId, int sheetIndex, ImportRowsRequest request) {
        if (request.getStartRow() < 0 || request.getStartColumn() < 0) {
            throw new InvalidRangeException("Import must start at a non-negative position");
        }
        List<CellUpdateRequest> updates = new ArrayList<>();
        List<List<Object>> rows = request.getRows();
        for (int r = 0; r < rows.size(); r++) {
            List<Object> row = rows.get(r);
            if (row == null) {
                continue;
            }
            for (int c = 0; c < row.size(); c++) {
                updates.add(new CellUpdateRequest(request.getStartRow() + r, request.getStartColumn() + c, row.get(c)));
            }
        }
        if (updates.isEmpty()) {
            throw new InvalidRangeException("Nothing to import");
        }
        log.info("Importing {} row(s) into spreadsheet {} sheet {}", rows.size(), spreadsheetId, sheetIndex);
        return updateCells(spreadsheetId, sheetIndex, new UpdateCellsRequest(request.getParticipantId(), updates));
    }

    /**
     * Precedents and dependents of one cell, or the whole forward adjacency of the sheet
     * when no cell is given.
     */
    public DependencyResponse dependencies(String spreadsheetId, int sheetIndex, String cell) {
        Spreadsheet spreadsheet = registry.require(spreadsheetId);
        spreadsheet.getLock().readLock().lock();
        try {
            Sheet sheet = requireSheet(spreadsheet, sheetIndex);
            DependencyGraph graph = spreadsheet.getDependencyGraph();
            if (cell == null || cell.isBlank()) {
                Map<String, List<String>> forward = new LinkedHashMap<>();
                Map<CellAddress, List<SheetRange>> sorted = new TreeMap<>();
                for (Map.Entry<CellKey, List<SheetRange>> entry : graph.forwardEntries(sheet.getId()).entrySet()) {
                    sorted.put(entry.getKey().getAddress(), entry.getValue());
                }
                for (Map.Entry<CellAddress, List<SheetRange>> entry : sorted.entrySet()) {
                    forward.put(entry.getKey().toA1(), describeRanges(spreadsheet, sheet, entry.getValue()));
                }
                return DependencyResponse.forSheet(sheetIndex, forward);
            }
            CellAddress address = CellAddress.parseA1(cell);
            if (address == null) {
                throw new InvalidRangeException("Invalid cell address: " + cell);
            }
            CellKey key = new CellKey(sheet.getId(), address);
            List<String> precedents = describeRanges(spreadsheet, sheet, graph.precedentsOf(key));
            List<CellKey> dependents = new ArrayList<>(graph.directDependents(key));
            dependents.sort(RecalculationEngine.positionOrder(spreadsheet));
            return DependencyResponse.forCell(sheetIndex, address.toA1(), precedents,
                    describe(spreadsheet, sheet, dependents));
        } finally {
            spreadsheet.getLock().readLock().unlock();
        }
    }

    /**
     * One event per edited cell plus one per recomputed formula elsewhere.
     */
    List<CellUpdateEvent> buildEvents(Spreadsheet spreadsheet, Sheet sheet, List<CellKey> editedKeys,
                                      RecalculationResult recalculation, String participantId,
                                      Map<CellAddress, String> overwritten) {
        List<CellUpdateEvent> events = new ArrayList<>();
        Set<CellKey> seen = new LinkedHashSet<>();
        for (CellKey key : editedKeys) {
            seen.add(key);
            Cell cell = sheet.getCell(key.getAddress());
            if (cell == null) {
                events.add(new CellUpdateEvent(spreadsheet.getId(), sheet.getIndex(), key.getAddress(), null,
                        CellValue.empty(), spreadsheet.getRevision(), participantId,
                        overwritten.get(key.getAddress())));
            } else {
                events.add(toEvent(spreadsheet, sheet.getIndex(), cell, participantId,
                        overwritten.get(key.getAddress())));
            }
        }
        for (CellKey key : recalculation.getRecomputed()) {
            if (!seen.add(key)) {
                continue;
            }
            Sheet owner = spreadsheet.findSheetById(key.getSheetId());
            Cell cell = owner == null ? null : owner.getCell(key.getAddress());
            if (cell != null) {
                events.add(toEvent(spreadsheet, owner.getIndex(), cell, participantId, null));
            }
        }
        return events;
    }

    private static CellUpdateEvent toEvent(Spreadsheet spreadsheet, int sheetIndex, Cell cell, String editor,
                                           String overwrittenParticipantId) {
        return new CellUpdateEvent(spreadsheet.getId(), sheetIndex, cell.getAddress(),
                cell.getContent().getSource(), cell.getValue(), cell.getRevision(), editor, overwrittenParticipantId);
    }

    private static boolean isConflict(Cell existing, PendingEdit edit, String participantId) {
        if (existing == null || edit.baseRevision == null || existing.getRevision() <= edit.baseRevision) {
            return false;
        }
        String lastEditor = existing.getLastEditor();
        return lastEditor != null && !lastEditor.equals(participantId);
    }

    private static CellAddress resolveAddress(CellUpdateRequest update) {
        if (update.getAddress() != null && !update.getAddress().isBlank()) {
            CellAddress address = CellAddress.parseA1(update.getAddress());
            if (address == null) {
                throw new InvalidRangeException("Invalid cell address: " + update.getAddress());
            }
            return address;
        }
        if (update.getRow() == null || update.getColumn() == null) {
            throw new InvalidRangeException("Each update needs an address or a row and column");
        }
        if (update.getRow() < 0 || update.getColumn() < 0) {
            throw new InvalidRangeException("Row and column must be non-negative");
        }
        if (update.getRow() > CellAddress.MAX_INDEX || update.getColumn() > CellAddress.MAX_INDEX) {
            throw new InvalidRangeException("Row and column must not exceed " + CellAddress.MAX_INDEX);
        }
        return new CellAddress(update.getRow(), update.getColumn());
    }

    private static CellRange boundingRange(Set<CellAddress> addresses) {
        int startRow = Integer.MAX_VALUE;
        int startColumn = Integer.MAX_VALUE;
        int endRow = 0;
        int endColumn = 0;
        for (CellAddress address : addresses) {
            startRow = Math.min(startRow, address.getRow());
            startColumn = Math.min(startColumn, address.getColumn());
            endRow = Math.max(endRow, address.getRow());
            endColumn = Math.max(endColumn, address.getColumn());
        }
        return new CellRange(startRow, startColumn, endRow, endColumn);
    }

    private static RangeSnapshot snapshot(Sheet sheet, CellRange range) {
        List<List<CellSnapshot>> rows = new ArrayList<>();
        for (int row = range.getStartRow(); row <= range.getEndRow(); row++) {
            List<CellSnapshot> line = new ArrayList<>();
            for (int column = range.getStartColumn(); column <= range.getEndColumn(); column++) {
                Cell cell = sheet.getCell(row, column);
                line.add(cell == null
                        ? CellSnapshot.empty(sheet.getIndex(), new CellAddress(row, column))
                        : CellSnapshot.of(sheet.getIndex(), cell));
            }
            rows.add(line);
        }
        return new RangeSnapshot(sheet.getIndex(), range, rows);
    }

    private static List<CellSnapshot> editedSnapshots(Sheet sheet, Set<CellAddress> addresses) {
        List<CellSnapshot> result = new ArrayList<>();
        for (CellAddress address : addresses) {
            Cell cell = sheet.getCell(address);
            result.add(cell == null
                    ? CellSnapshot.empty(sheet.getIndex(), address)
                    : CellSnapshot.of(sheet.getIndex(), cell));
        }
        return result;
    }

    private static List<CellSnapshot> recalculatedSnapshots(Spreadsheet spreadsheet, List<CellKey> keys) {
        List<CellSnapshot> result = new ArrayList<>();
        for (CellKey key : keys) {
            Sheet owner = spreadsheet.findSheetById(key.getSheetId());
            Cell cell = owner == null ? null : owner.getCell(key.getAddress());
            if (cell != null) {
                result.add(CellSnapshot.of(owner.getIndex(), cell));
            }
        }
        return result;
    }

    /**
     * A1 names for cells; cells on other sheets are qualified with their sheet name.
     */
    private static List<String> describe(Spreadsheet spreadsheet, Sheet current, Iterable<CellKey> keys) {
        List<String> result = new ArrayList<>();
        for (CellKey key : keys) {
            result.add(qualify(spreadsheet, current, key.getSheetId(), CellRange.single(key.getAddress())));
        }
        return result;
    }

    private static List<String> describeRanges(Spreadsheet spreadsheet, Sheet current, List<SheetRange> ranges) {
        List<String> result = new ArrayList<>();
        for (SheetRange range : ranges) {
            result.add(qualify(spreadsheet, current, range.getSheetId(), range.getRange()));
        }
        return result;
    }

    private static String qualify(Spreadsheet spreadsheet, Sheet current, String sheetId, CellRange range) {
        Sheet sheet = spreadsheet.findSheetById(sheetId);
        if (sheetId.equals(current.getId()) || sheet == null) {
            return range.toA1();
        }
        return new FormulaReference(sheet.getName(), range).toA1();
    }

    private static Sheet requireSheet(Spreadsheet spreadsheet, int sheetIndex) {
        Sheet sheet = spreadsheet.getSheet(sheetIndex);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet index " + sheetIndex + " not found in spreadsheet "
                    + spreadsheet.getId());
        }
        return sheet;
    }

    private static final class PendingEdit {
        private final CellAddress address;
        private final CellContent content;
        private final Expr formula;
        private final Long baseRevision;

        PendingEdit(CellAddress address, CellContent content, Expr formula, Long baseRevision) {
            this.address = address;
            this.content = content;
            this.formula = formula;
            this.baseRevision = baseRevision;
        }
    }
}
