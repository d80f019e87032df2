package com.gridcalc.app.formula.ast;

import com.gridcalc.app.models.CellValue;

public final class LiteralExpr extends Expr {

    private final CellValue value;

    public LiteralExpr(CellValue value, int position) {
        super(position);
        this.value = value;
    }

    public CellValue getValue() {
        return value;
    }

    @Override
    public Kind getKind() {
        return Kind.LITERAL;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String toString() {
        return "Literal(" + value + ")";
    }
}
