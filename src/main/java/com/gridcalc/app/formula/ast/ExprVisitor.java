package com.gridcalc.app.formula.ast;

public interface ExprVisitor<R> {

    R visitLiteral(LiteralExpr expr);

    R visitCellRef(CellRefExpr expr);

    R visitRangeRef(RangeRefExpr expr);

    R visitName(NameExpr expr);

    R visitFunctionCall(FunctionCallExpr expr);

    R visitUnary(UnaryExpr expr);

    R visitBinary(BinaryExpr expr);
}
