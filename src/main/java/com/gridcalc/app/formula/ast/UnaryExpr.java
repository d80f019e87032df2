package com.gridcalc.app.formula.ast;

public final class UnaryExpr extends Expr {

    private final UnaryOperator operator;
    private final Expr operand;

    public UnaryExpr(UnaryOperator operator, Expr operand, int position) {
        super(position);
        this.operator = operator;
        this.operand = operand;
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public Expr getOperand() {
        return operand;
    }

    @Override
    public Kind getKind() {
        return Kind.UNARY;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public String toString() {
        return operator + "(" + operand + ")";
    }
}
