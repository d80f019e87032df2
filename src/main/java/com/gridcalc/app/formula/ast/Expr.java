package com.gridcalc.app.formula.ast;

/**
 * Node of a parsed formula. The set of node kinds is closed.
 */
public abstract class Expr {

    public enum Kind {
        LITERAL,
        CELL_REF,
        RANGE_REF,
        NAME,
        FUNCTION_CALL,
        UNARY,
        BINARY
    }

    private final int position;

    protected Expr(int position) {
        this.position = position;
    }

    /**
     * Offset of the node's first token in the formula source.
     */
    public int getPosition() {
        return position;
    }

    public abstract Kind getKind();

    public abstract <R> R accept(ExprVisitor<R> visitor);
}
