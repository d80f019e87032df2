package com.gridcalc.app.formula.functions;

/**
 * A registered function: its name, accepted argument count and implementation.
 */
public final class FunctionDefinition {

    public static final int VARIADIC = -1;

    private final String name;
    private final int minArgs;
    private final int maxArgs;
    private final FormulaFunction function;

    public FunctionDefinition(String name, int minArgs, int maxArgs, FormulaFunction function) {
        this.name = name;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.function = function;
    }

    public String getName() {
        return name;
    }

    public int getMinArgs() {
        return minArgs;
    }

    public int getMaxArgs() {
        return maxArgs;
    }

    public FormulaFunction getFunction() {
        return function;
    }

    public boolean accepts(int argumentCount) {
        return argumentCount >= minArgs && (maxArgs == VARIADIC || argumentCount <= maxArgs);
    }
}
