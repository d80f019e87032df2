package com.gridcalc.app.formula.functions;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Name -> function table consulted by the parser. Names are case-insensitive.
 * Populated once at startup and read-only afterwards.
 */
public class FunctionRegistry {

    private final Map<String, FunctionDefinition> definitions = new TreeMap<>();

    public static FunctionRegistry withBuiltins() {
        FunctionRegistry registry = new FunctionRegistry();
        MathFunctions.register(registry);
        StatisticalFunctions.register(registry);
        LogicalFunctions.register(registry);
        LookupFunctions.register(registry);
        TextFunctions.register(registry);
        DateFunctions.register(registry);
        return registry;
    }

    public void register(String name, int minArgs, int maxArgs, FormulaFunction function) {
        String key = name.toUpperCase(Locale.ROOT);
        if (definitions.containsKey(key)) {
            throw new IllegalStateException("Function already registered: " + key);
        }
        definitions.put(key, new FunctionDefinition(key, minArgs, maxArgs, function));
    }

    /**
     * Returns the definition, or null when the name is unknown.
     */
    public FunctionDefinition lookup(String name) {
        return definitions.get(name.toUpperCase(Locale.ROOT));
    }

    public boolean contains(String name) {
        return lookup(name) != null;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(definitions.keySet());
    }
}
