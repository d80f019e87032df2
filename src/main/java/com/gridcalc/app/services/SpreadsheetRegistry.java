package com.gridcalc.app.services;

import com.gridcalc.app.exceptions.SpreadsheetNotFoundException;
import com.gridcalc.app.models.Spreadsheet;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory home of every spreadsheet; nothing is persisted.
 */
@Component
public class SpreadsheetRegistry {

    private final Map<String, Spreadsheet> spreadsheets = new ConcurrentHashMap<>();

    public void add(Spreadsheet spreadsheet) {
        spreadsheets.put(spreadsheet.getId(), spreadsheet);
    }

    /**
     * Retrieves a Spreadsheet by ID. Throws if not found.
     */
    public Spreadsheet require(String spreadsheetId) {
        Spreadsheet spreadsheet = spreadsheets.get(spreadsheetId);
        if (spreadsheet == null) {
            throw new SpreadsheetNotFoundException("Spreadsheet not found: " + spreadsheetId);
        }
        return spreadsheet;
    }

    public Spreadsheet remove(String spreadsheetId) {
        Spreadsheet removed = spreadsheets.remove(spreadsheetId);
        if (removed == null) {
            throw new SpreadsheetNotFoundException("Spreadsheet not found: " + spreadsheetId);
        }
        return removed;
    }

    public boolean contains(String spreadsheetId) {
        return spreadsheets.containsKey(spreadsheetId);
    }

    /**
     * All spreadsheets, oldest first.
     */
    public List<Spreadsheet> all() {
        List<Spreadsheet> result = new ArrayList<>(spreadsheets.values());
        result.sort(Comparator.comparing(Spreadsheet::getCreatedAt).thenComparing(Spreadsheet::getId));
        return result;
    }
}
