package com.gridcalc.app.formula.ast;

public final class BinaryExpr extends Expr {

    private final BinaryOperator operator;
    private final Expr left;
    private final Expr right;

    public BinaryExpr(BinaryOperator operator, Expr left, Expr right, int position) {
        super(position);
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public Expr getLeft() {
        return left;
    }

    public Expr getRight() {
        return right;
    }

    @Override
    public Kind getKind() {
        return Kind.BINARY;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
