package com.gridcalc.app.services;

import com.gridcalc.app.dto.SheetSummary;
import com.gridcalc.app.dto.SpreadsheetDetails;
import com.gridcalc.app.dto.SpreadsheetSummary;
import com.gridcalc.app.dto.UpdateSpreadsheetRequest;
import com.gridcalc.app.exceptions.InvalidCellValueException;
import com.gridcalc.app.exceptions.SheetNotFoundException;
import com.gridcalc.app.exceptions.SheetOperationException;
import com.gridcalc.app.models.Cell;
import com.gridcalc.app.models.CellAddress;
import com.gridcalc.app.models.CellContent;
import com.gridcalc.app.models.CellKey;
import com.gridcalc.app.models.CellUpdateEvent;
import com.gridcalc.app.models.CellValue;
import com.gridcalc.app.models.Sheet;
import com.gridcalc.app.models.Spreadsheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Lifecycle of spreadsheets and their sheets, plus spreadsheet-level variables.
 * Structural changes rebuild the dependency graph, since formulas address sheets by name.
 */
@Service
public class SpreadsheetService {

    private static final Logger log = LoggerFactory.getLogger(SpreadsheetService.class);

    static final String DEFAULT_SPREADSHEET_NAME = "Untitled spreadsheet";
    static final String DEFAULT_SHEET_PREFIX = "Sheet";

    // Same shape the formula lexer accepts as a name, minus anything that reads as a cell
    private static final Pattern VARIABLE_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_.]*$");

    private final SpreadsheetRegistry registry;
    private final RecalculationEngine recalculationEngine;
    private final PivotService pivotService;
    private final CollaborationService collaborationService;
    private final Clock clock;

    public SpreadsheetService(SpreadsheetRegistry registry, RecalculationEngine recalculationEngine,
                              PivotService pivotService, CollaborationService collaborationService, Clock clock) {
        this.registry = registry;
        this.recalculationEngine = recalculationEngine;
        this.pivotService = pivotService;
        this.collaborationService = collaborationService;
        this.clock = clock;
    }

    /**
     * Creates a spreadsheet holding one empty sheet, "Sheet1".
     */
    public SpreadsheetDetails createSpreadsheet(String name) {
        String resolved = name == null || name.isBlank() ? DEFAULT_SPREADSHEET_NAME : name.trim();
        Spreadsheet spreadsheet = new Spreadsheet(resolved, clock.instant());
        spreadsheet.addSheet(DEFAULT_SHEET_PREFIX + 1);
        registry.add(spreadsheet);
        log.info("Spreadsheet {} '{}' created", spreadsheet.getId(), resolved);
        return new SpreadsheetDetails(spreadsheet);
    }

    public List<SpreadsheetSummary> listSpreadsheets() {
        List<SpreadsheetSummary> result = new ArrayList<>();
        for (Spreadsheet spreadsheet : registry.all()) {
            spreadsheet.getLock().readLock().lock();
            try {
                result.add(new SpreadsheetSummary(spreadsheet));
            } finally {
                spreadsheet.getLock().readLock().unlock();
            }
        }
        return result;
    }

    public SpreadsheetDetails getSpreadsheet(String spreadsheetId) {
        Spreadsheet spreadsheet = registry.require(spreadsheetId);
        spreadsheet.getLock().readLock().lock();
        try {
            return new SpreadsheetDetails(spreadsheet);
        } finally {
            spreadsheet.getLock().readLock().unlock();
        }
    }

    /**
     * Renames the spreadsheet and/or replaces its variables. Formulas reading
     * variables are recomputed when the variable set changes.
     */
    public SpreadsheetDetails updateSpreadsheet(String spreadsheetId, UpdateSpreadsheetRequest request) {
        Spreadsheet spreadsheet = registry.require(spreadsheetId);
        Map<String, CellValue> variables = null;
        if (request.getVariables() != null) {
            variables = toVariables(request.getVariables());
        }

        List<CellUpdateEvent> events = new ArrayList<>();
        SpreadsheetDetails details;
        spreadsheet.getLock().writeLock().lock();
        try {
            if (request.getName() != null && !request.getName().isBlank()) {
                spreadsheet.setName(request.getName().trim());
            }
            if (variables != null) {
                spreadsheet.replaceVariables(variables);
                events.addAll(rebuild(spreadsheet));
                log.info("Spreadsheet {} now defines {} variable(s)", spreadsheetId, variables.size());
            }
            spreadsheet.touch(clock.instant());
            details = new SpreadsheetDetails(spreadsheet);
        } finally {
            spreadsheet.getLock().writeLock().unlock();
        }
        collaborationService.publish(spreadsheetId, events);
        return details;
    }

    public void deleteSpreadsheet(String spreadsheetId) {
        registry.remove(spreadsheetId);
        collaborationService.discardSession(spreadsheetId);
        log.info("Spreadsheet {} deleted", spreadsheetId);
    }

    /**
     * Appends a sheet. Without a name the first free "SheetN" is used.
     */
    public SheetSummary addSheet(String spreadsheetId, String name) {
        Spreadsheet spreadsheet = registry.require(spreadsheetId);
        List<CellUpdateEvent> events;
        SheetSummary summary;
        spreadsheet.getLock().writeLock().lock();
        try {
            String resolved = name == null || name.isBlank() ? nextSheetName(spreadsheet) : name.trim();
            requireFreeName(spreadsheet, resolved, null);
            Sheet sheet = spreadsheet.addSheet(resolved);
            // formulas that referenced this name as a missing sheet can now resolve
            events = rebuild(spreadsheet);
            spreadsheet.touch(clock.instant());
            summary = new SheetSummary(sheet);
            log.info("Sheet '{}' added to spreadsheet {} at index {}", resolved, spreadsheetId, sheet.getIndex());
        } finally {
            spreadsheet.getLock().writeLock().unlock();
        }
        collaborationService.publish(spreadsheetId, events);
        return summary;
    }

    /**
     * Renames a sheet. Formulas are not rewritten: references to the old name become #REF!.
     */
    public SheetSummary renameSheet(String spreadsheetId, int sheetIndex, String name) {
        if (name == null || name.isBlank()) {
            throw new SheetOperationException("Sheet name must not be blank");
        }
        Spreadsheet spreadsheet = registry.require(spreadsheetId);
        List<CellUpdateEvent> events;
        SheetSummary summary;
        spreadsheet.getLock().writeLock().lock();
        try {
            Sheet sheet = requireSheet(spreadsheet, sheetIndex);
            String resolved = name.trim();
            requireFreeName(spreadsheet, resolved, sheet);
            String previous = sheet.getName();
            sheet.setName(resolved);
            events = rebuild(spreadsheet);
            spreadsheet.touch(clock.instant());
            summary = new SheetSummary(sheet);
            log.info("Sheet '{}' of spreadsheet {} renamed to '{}'", previous, spreadsheetId, resolved);
        } finally {
            spreadsheet.getLock().writeLock().unlock();
        }
        collaborationService.publish(spreadsheetId, events);
        return summary;
    }

    /**
     * Removes a sheet with its cells and the pivots sourced from it. The last sheet cannot be removed.
     */
    public void deleteSheet(String spreadsheetId, int sheetIndex) {
        Spreadsheet spreadsheet = registry.require(spreadsheetId);
        List<CellUpdateEvent> events;
        spreadsheet.getLock().writeLock().lock();
        try {
            Sheet sheet = requireSheet(spreadsheet, sheetIndex);
            if (spreadsheet.getSheets().size() == 1) {
                throw new SheetOperationException("A spreadsheet must keep at least one sheet");
            }
            pivotService.removePivotsOnSheet(spreadsheet, sheet.getId());
            spreadsheet.removeSheet(sheetIndex);
            events = rebuild(spreadsheet);
            spreadsheet.touch(clock.instant());
            log.info("Sheet '{}' removed from spreadsheet {}", sheet.getName(), spreadsheetId);
        } finally {
            spreadsheet.getLock().writeLock().unlock();
        }
        collaborationService.publish(spreadsheetId, events);
    }

    /**
     * Full recalculation plus pivot refresh. Caller holds the write lock.
     */
    private List<CellUpdateEvent> rebuild(Spreadsheet spreadsheet) {
        RecalculationResult result = recalculationEngine.recalculateAll(spreadsheet);
        pivotService.refreshAll(spreadsheet);
        List<CellUpdateEvent> events = new ArrayList<>();
        for (CellKey key : result.getRecomputed()) {
            Sheet sheet = spreadsheet.findSheetById(key.getSheetId());
            Cell cell = sheet == null ? null : sheet.getCell(key.getAddress());
            if (cell != null) {
                events.add(new CellUpdateEvent(spreadsheet.getId(), sheet.getIndex(), cell.getAddress(),
                        cell.getContent().getSource(), cell.getValue(), cell.getRevision(), null, null));
            }
        }
        return events;
    }

    private static Map<String, CellValue> toVariables(Map<String, Object> raw) {
        Map<String, CellValue> variables = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            String name = entry.getKey() == null ? "" : entry.getKey().trim();
            if (!isValidVariableName(name)) {
                throw new InvalidCellValueException("Invalid variable name: '" + name + "'");
            }
            CellContent content = CellContent.fromInput(entry.getValue());
            if (content.isFormula()) {
                throw new InvalidCellValueException("Variable " + name + " must hold a value, not a formula");
            }
            variables.put(name, content.getLiteral());
        }
        return variables;
    }

    static boolean isValidVariableName(String name) {
        if (!VARIABLE_NAME.matcher(name).matches() || CellAddress.parseA1(name) != null) {
            return false;
        }
        String upper = name.toUpperCase(Locale.ROOT);
        return !"TRUE".equals(upper) && !"FALSE".equals(upper);
    }

    private static String nextSheetName(Spreadsheet spreadsheet) {
        int n = spreadsheet.getSheets().size() + 1;
        while (spreadsheet.findSheetByName(DEFAULT_SHEET_PREFIX + n) != null) {
            n++;
        }
        return DEFAULT_SHEET_PREFIX + n;
    }

    private static void requireFreeName(Spreadsheet spreadsheet, String name, Sheet self) {
        if (name.isEmpty()) {
            throw new SheetOperationException("Sheet name must not be blank");
        }
        Sheet existing = spreadsheet.findSheetByName(name);
        if (existing != null && existing != self) {
            throw new SheetOperationException("A sheet named '" + name + "' already exists");
        }
    }

    private static Sheet requireSheet(Spreadsheet spreadsheet, int sheetIndex) {
        Sheet sheet = spreadsheet.getSheet(sheetIndex);
        if (sheet == null) {
            throw new SheetNotFoundException("Sheet index " + sheetIndex + " not found in spreadsheet "
                    + spreadsheet.getId());
        }
        return sheet;
    }
}
