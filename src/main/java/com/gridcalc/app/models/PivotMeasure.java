package com.gridcalc.app.models;

/**
 * One value column of a pivot table: which source field to aggregate, how,
 * and an optional display alias (defaults to "Sum of Amount" style labels).
 */
public class PivotMeasure {
    private String field;
    private AggregationType aggregation = AggregationType.SUM;
    private String alias;

    // Default constructor needed for JSON (de)serialization
    public PivotMeasure() {
    }

    public PivotMeasure(String field, AggregationType aggregation) {
        this.field = field;
        this.aggregation = aggregation;
    }

    public PivotMeasure(String field, AggregationType aggregation, String alias) {
        this(field, aggregation);
        this.alias = alias;
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public AggregationType getAggregation() {
        return aggregation;
    }

    public void setAggregation(AggregationType aggregation) {
        this.aggregation = aggregation;
    }

    public String getAlias() {
        return alias;
    }

    public void setAlias(String alias) {
        this.alias = alias;
    }

    public String label() {
        if (alias != null && !alias.isBlank()) {
            return alias;
        }
        return aggregation.getLabel() + " of " + field;
    }
}
