package com.gridcalc.app.services;

import com.gridcalc.app.dto.PivotTableResponse;
import com.gridcalc.app.exceptions.PivotTableNotFoundException;
import com.gridcalc.app.exceptions.PivotValidationException;
import com.gridcalc.app.models.AggregationType;
import com.gridcalc.app.models.Cell;
import com.gridcalc.app.models.CellKey;
import com.gridcalc.app.models.CellRange;
import com.gridcalc.app.models.CellValue;
import com.gridcalc.app.models.ErrorCode;
import com.gridcalc.app.models.PivotConfig;
import com.gridcalc.app.models.PivotFilter;
import com.gridcalc.app.models.PivotMeasure;
import com.gridcalc.app.models.PivotResult;
import com.gridcalc.app.models.PivotTable;
import com.gridcalc.app.models.Sheet;
import com.gridcalc.app.models.Spreadsheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Grouped / aggregated views over a sheet range whose first row names the fields.
 * Pivot state lives in the spreadsheet and is guarded by its lock.
 */
@Service
public class PivotService {

    private static final Logger log = LoggerFactory.getLogger(PivotService.class);

    static final String GRAND_TOTAL_LABEL = "Grand Total";

    private final SpreadsheetRegistry registry;
    private final Clock clock;

    public PivotService(SpreadsheetRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    public PivotTableResponse createPivot(String spreadsheetId, PivotConfig config) {
        Spreadsheet spreadsheet = registry.require(spreadsheetId);
        spreadsheet.getLock().writeLock().lock();
        try {
            Source source = resolveSource(spreadsheet, config);
            PivotResult result = compute(source, config);
            PivotTable pivot = new PivotTable(config, source.sheet.getId(), source.range);
            pivot.setResult(result, clock.instant());
            spreadsheet.getPivotTables().put(pivot.getId(), pivot);
            log.info("Pivot {} '{}' created on spreadsheet {} over {}", pivot.getId(), config.getName(),
                    spreadsheetId, source.range.toA1());
            return toResponse(spreadsheet, pivot);
        } finally {
            spreadsheet.getLock().writeLock().unlock();
        }
    }

    public PivotTableResponse getPivot(String spreadsheetId, String pivotId) {
        Spreadsheet spreadsheet = registry.require(spreadsheetId);
        spreadsheet.getLock().readLock().lock();
        try {
            return toResponse(spreadsheet, requirePivot(spreadsheet, pivotId));
        } finally {
            spreadsheet.getLock().readLock().unlock();
        }
    }

    public List<PivotTableResponse> listPivots(String spreadsheetId) {
        Spreadsheet spreadsheet = registry.require(spreadsheetId);
        spreadsheet.getLock().readLock().lock();
        try {
            List<PivotTableResponse> result = new ArrayList<>();
            for (PivotTable pivot : spreadsheet.getPivotTables().values()) {
                result.add(toResponse(spreadsheet, pivot));
            }
            return result;
        } finally {
            spreadsheet.getLock().readLock().unlock();
        }
    }

    /**
     * Replaces the configuration and recomputes; the pivot keeps its id.
     */
    public PivotTableResponse updatePivot(String spreadsheetId, String pivotId, PivotConfig config) {
        Spreadsheet spreadsheet = registry.require(spreadsheetId);
        spreadsheet.getLock().writeLock().lock();
        try {
            PivotTable pivot = requirePivot(spreadsheet, pivotId);
            Source source = resolveSource(spreadsheet, config);
            PivotResult result = compute(source, config);
            pivot.reconfigure(config, source.sheet.getId(), source.range);
            pivot.setResult(result, clock.instant());
            log.info("Pivot {} reconfigured on spreadsheet {}", pivotId, spreadsheetId);
            return toResponse(spreadsheet, pivot);
        } finally {
            spreadsheet.getLock().writeLock().unlock();
        }
    }

    public void deletePivot(String spreadsheetId, String pivotId) {
        Spreadsheet spreadsheet = registry.require(spreadsheetId);
        spreadsheet.getLock().writeLock().lock();
        try {
            if (spreadsheet.getPivotTables().remove(pivotId) == null) {
                throw new PivotTableNotFoundException("Pivot table not found: " + pivotId);
            }
            log.info("Pivot {} deleted from spreadsheet {}", pivotId, spreadsheetId);
        } finally {
            spreadsheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Re-reads the source range and replaces the cached grid.
     */
    public PivotTableResponse refreshPivot(String spreadsheetId, String pivotId) {
        Spreadsheet spreadsheet = registry.require(spreadsheetId);
        spreadsheet.getLock().writeLock().lock();
        try {
            PivotTable pivot = requirePivot(spreadsheet, pivotId);
            recompute(spreadsheet, pivot);
            return toResponse(spreadsheet, pivot);
        } finally {
            spreadsheet.getLock().writeLock().unlock();
        }
    }

    /**
     * Refreshes pivots whose source range holds one of the changed cells.
     * Caller holds the write lock. Returns the ids of refreshed pivots.
     */
    public List<String> refreshAffected(Spreadsheet spreadsheet, Collection<CellKey> changed) {
        List<String> refreshed = new ArrayList<>();
        for (PivotTable pivot : spreadsheet.getPivotTables().values()) {
            for (CellKey key : changed) {
                if (key.getSheetId().equals(pivot.getSourceSheetId()) && pivot.getSourceRange().contains(key.getAddress())) {
                    if (tryRecompute(spreadsheet, pivot)) {
                        refreshed.add(pivot.getId());
                    }
                    break;
                }
            }
        }
        return refreshed;
    }

    /**
     * Refreshes every pivot, after structural changes. Caller holds the write lock.
     */
    public void refreshAll(Spreadsheet spreadsheet) {
        for (PivotTable pivot : spreadsheet.getPivotTables().values()) {
            tryRecompute(spreadsheet, pivot);
        }
    }

    /**
     * Deletes the pivots sourced from a sheet that is being removed. Caller holds the write lock.
     */
    public void removePivotsOnSheet(Spreadsheet spreadsheet, String sheetId) {
        Iterator<PivotTable> it = spreadsheet.getPivotTables().values().iterator();
        while (it.hasNext()) {
            PivotTable pivot = it.next();
            if (pivot.getSourceSheetId().equals(sheetId)) {
                it.remove();
                log.info("Pivot {} removed with its source sheet {}", pivot.getId(), sheetId);
            }
        }
    }

    private void recompute(Spreadsheet spreadsheet, PivotTable pivot) {
        Sheet sheet = spreadsheet.findSheetById(pivot.getSourceSheetId());
        if (sheet == null) {
            throw new PivotValidationException("Source sheet of pivot " + pivot.getId() + " no longer exists");
        }
        Source source = new Source(sheet, pivot.getSourceRange());
        pivot.setResult(compute(source, pivot.getConfig()), clock.instant());
        log.debug("Pivot {} refreshed", pivot.getId());
    }

    /**
     * Automatic refresh: a source that no longer validates (e.g. a renamed header)
     * keeps its previous grid.
     */
    private boolean tryRecompute(Spreadsheet spreadsheet, PivotTable pivot) {
        try {
            recompute(spreadsheet, pivot);
            return true;
        } catch (PivotValidationException e) {
            log.warn("Pivot {} could not be refreshed: {}", pivot.getId(), e.getMessage());
            return false;
        }
    }

    private PivotTable requirePivot(Spreadsheet spreadsheet, String pivotId) {
        PivotTable pivot = spreadsheet.getPivotTables().get(pivotId);
        if (pivot == null) {
            throw new PivotTableNotFoundException("Pivot table not found: " + pivotId);
        }
        return pivot;
    }

    private Source resolveSource(Spreadsheet spreadsheet, PivotConfig config) {
        Sheet sheet = spreadsheet.getSheet(config.getSheetIndex());
        if (sheet == null) {
            throw new PivotValidationException("Unknown sheet index: " + config.getSheetIndex());
        }
        CellRange range = CellRange.parseA1(config.getSourceRange());
        if (range == null) {
            throw new PivotValidationException("Invalid source range: " + config.getSourceRange());
        }
        return new Source(sheet, range);
    }

    /**
     * Builds the result grid. Validation happens here too, so a refresh sees
     * the same rules as creation.
     */
    PivotResult compute(Source source, PivotConfig config) {
        CellRange range = source.range;
        if (range.rowCount() < 2) {
            throw new PivotValidationException("Source range " + range.toA1() + " has no data rows");
        }
        if (config.getMeasures() == null || config.getMeasures().isEmpty()) {
            throw new PivotValidationException("At least one measure is required");
        }

        Map<String, Integer> fields = readHeader(source);
        List<Integer> groupColumns = new ArrayList<>();
        for (String field : config.getGroupBy()) {
            groupColumns.add(requireField(fields, field, "group-by"));
        }
        List<Integer> measureColumns = new ArrayList<>();
        for (PivotMeasure measure : config.getMeasures()) {
            if (measure.getAggregation() == null) {
                throw new PivotValidationException("Measure on '" + measure.getField() + "' has no aggregation");
            }
            measureColumns.add(requireField(fields, measure.getField(), "measure"));
        }
        List<Integer> filterColumns = new ArrayList<>();
        for (PivotFilter filter : config.getFilters()) {
            filterColumns.add(requireField(fields, filter.getField(), "filter"));
        }

        Map<List<CellValue>, Accumulator[]> groups = new LinkedHashMap<>();
        Accumulator[] totals = newAccumulators(config.getMeasures());
        int included = 0;
        for (int row = range.getStartRow() + 1; row <= range.getEndRow(); row++) {
            if (isEmptyRow(source, row)) {
                continue;
            }
            if (!passesFilters(source, row, config.getFilters(), filterColumns)) {
                continue;
            }
            included++;
            List<CellValue> key = new ArrayList<>();
            for (int column : groupColumns) {
                key.add(valueAt(source, row, column));
            }
            Accumulator[] accumulators = groups.computeIfAbsent(key, k -> newAccumulators(config.getMeasures()));
            for (int m = 0; m < measureColumns.size(); m++) {
                CellValue value = valueAt(source, row, measureColumns.get(m));
                accumulators[m].add(value);
                totals[m].add(value);
            }
        }

        List<String> headers = new ArrayList<>(config.getGroupBy());
        for (PivotMeasure measure : config.getMeasures()) {
            headers.add(measure.label());
        }
        List<List<CellValue>> rows = new ArrayList<>();
        for (Map.Entry<List<CellValue>, Accumulator[]> entry : groups.entrySet()) {
            List<CellValue> line = new ArrayList<>(entry.getKey());
            for (Accumulator accumulator : entry.getValue()) {
                line.add(accumulator.result());
            }
            rows.add(line);
        }
        List<CellValue> grandTotal = null;
        if (config.isShowGrandTotal()) {
            grandTotal = new ArrayList<>();
            for (int i = 0; i < groupColumns.size(); i++) {
                grandTotal.add(i == 0 ? CellValue.string(GRAND_TOTAL_LABEL) : CellValue.empty());
            }
            for (Accumulator accumulator : totals) {
                grandTotal.add(accumulator.result());
            }
        }
        return new PivotResult(headers, rows, grandTotal, included);
    }

    private Map<String, Integer> readHeader(Source source) {
        Map<String, Integer> fields = new LinkedHashMap<>();
        CellRange range = source.range;
        for (int column = range.getStartColumn(); column <= range.getEndColumn(); column++) {
            String name = valueAt(source, range.getStartRow(), column).getFormatted().trim();
            if (!name.isEmpty()) {
                fields.putIfAbsent(name.toLowerCase(Locale.ROOT), column);
            }
        }
        return fields;
    }

    private static int requireField(Map<String, Integer> fields, String field, String role) {
        Integer column = field == null ? null : fields.get(field.trim().toLowerCase(Locale.ROOT));
        if (column == null) {
            throw new PivotValidationException("Unknown " + role + " field: " + field);
        }
        return column;
    }

    private static boolean isEmptyRow(Source source, int row) {
        for (int column = source.range.getStartColumn(); column <= source.range.getEndColumn(); column++) {
            if (!valueAt(source, row, column).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private static boolean passesFilters(Source source, int row, List<PivotFilter> filters, List<Integer> columns) {
        for (int i = 0; i < filters.size(); i++) {
            String formatted = valueAt(source, row, columns.get(i)).getFormatted();
            if (!filters.get(i).accepts(formatted)) {
                return false;
            }
        }
        return true;
    }

    private static CellValue valueAt(Source source, int row, int column) {
        Cell cell = source.sheet.getCell(row, column);
        return cell == null ? CellValue.empty() : cell.getValue();
    }

    private static Accumulator[] newAccumulators(List<PivotMeasure> measures) {
        Accumulator[] accumulators = new Accumulator[measures.size()];
        for (int i = 0; i < accumulators.length; i++) {
            accumulators[i] = new Accumulator(measures.get(i).getAggregation());
        }
        return accumulators;
    }

    private PivotTableResponse toResponse(Spreadsheet spreadsheet, PivotTable pivot) {
        Sheet sheet = spreadsheet.findSheetById(pivot.getSourceSheetId());
        return new PivotTableResponse(pivot, sheet == null ? -1 : sheet.getIndex());
    }

    static final class Source {
        private final Sheet sheet;
        private final CellRange range;

        Source(Sheet sheet, CellRange range) {
            this.sheet = sheet;
            this.range = range;
        }
    }

    /**
     * Running aggregate for one measure of one group.
     */
    private static final class Accumulator {
        private final AggregationType type;
        private double sum;
        private int numericCount;
        private int nonEmptyCount;
        private double min = Double.POSITIVE_INFINITY;
        private double max = Double.NEGATIVE_INFINITY;
        private ErrorCode error;

        Accumulator(AggregationType type) {
            this.type = type;
        }

        void add(CellValue value) {
            if (value.isEmpty()) {
                return;
            }
            nonEmptyCount++;
            if (value.isError()) {
                if (error == null) {
                    error = value.getError();
                }
                return;
            }
            if (value.isNumber()) {
                double n = value.getNumber();
                numericCount++;
                sum += n;
                min = Math.min(min, n);
                max = Math.max(max, n);
            }
        }

        CellValue result() {
            if (error != null) {
                return CellValue.error(error);
            }
            switch (type) {
                case COUNT:
                    return CellValue.number(nonEmptyCount);
                case AVERAGE:
                    return numericCount == 0 ? CellValue.error(ErrorCode.DIV_ZERO) : CellValue.number(sum / numericCount);
                case MIN:
                    return CellValue.number(numericCount == 0 ? 0d : min);
                case MAX:
                    return CellValue.number(numericCount == 0 ? 0d : max);
                case SUM:
                default:
                    return CellValue.number(sum);
            }
        }
    }
}
