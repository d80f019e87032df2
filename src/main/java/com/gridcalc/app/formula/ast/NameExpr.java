package com.gridcalc.app.formula.ast;

/**
 * Bare identifier: resolved against the spreadsheet's named variables at evaluation time.
 */
public final class NameExpr extends Expr {

    private final String name;

    public NameExpr(String name, int position) {
        super(position);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public Kind getKind() {
        return Kind.NAME;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitName(this);
    }

    @Override
    public String toString() {
        return "Name(" + name + ")";
    }
}
