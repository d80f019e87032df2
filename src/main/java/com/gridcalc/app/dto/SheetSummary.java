package com.gridcalc.app.dto;

import com.gridcalc.app.models.Sheet;

public class SheetSummary {
    private final String id;
    private final int index;
    private final String name;
    private final int cellCount;

    public SheetSummary(Sheet sheet) {
        this.id = sheet.getId();
        this.index = sheet.getIndex();
        this.name = sheet.getName();
        this.cellCount = sheet.size();
    }

    public String getId() {
        return id;
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public int getCellCount() {
        return cellCount;
    }
}
