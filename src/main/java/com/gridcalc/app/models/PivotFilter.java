package com.gridcalc.app.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Restricts the source rows of a pivot by the formatted value of one field.
 * With exclude=false only listed values pass; with exclude=true listed values are dropped.
 */
public class PivotFilter {
    private String field;
    private List<String> values = new ArrayList<>();
    private boolean exclude;

    public PivotFilter() {
    }

    public PivotFilter(String field, List<String> values, boolean exclude) {
        this.field = field;
        this.values = values;
        this.exclude = exclude;
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public List<String> getValues() {
        return values;
    }

    public void setValues(List<String> values) {
        this.values = values;
    }

    public boolean isExclude() {
        return exclude;
    }

    public void setExclude(boolean exclude) {
        this.exclude = exclude;
    }

    public boolean accepts(String formattedValue) {
        boolean listed = false;
        for (String value : values) {
            if (value.equalsIgnoreCase(formattedValue)) {
                listed = true;
                break;
            }
        }
        return exclude != listed;
    }
}
