package com.gridcalc.app.formula.ast;

import com.gridcalc.app.formula.functions.FunctionDefinition;

import java.util.Collections;
import java.util.List;

/**
 * Call of a named function. The definition is resolved when the formula is parsed
 * and is null for names the registry does not know.
 */
public final class FunctionCallExpr extends Expr {

    private final String name;
    private final FunctionDefinition definition;
    private final List<Expr> arguments;

    public FunctionCallExpr(String name, FunctionDefinition definition, List<Expr> arguments, int position) {
        super(position);
        this.name = name;
        this.definition = definition;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    public String getName() {
        return name;
    }

    public FunctionDefinition getDefinition() {
        return definition;
    }

    public List<Expr> getArguments() {
        return arguments;
    }

    @Override
    public Kind getKind() {
        return Kind.FUNCTION_CALL;
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public String toString() {
        return name + arguments;
    }
}
