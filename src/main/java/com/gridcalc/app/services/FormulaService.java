package com.gridcalc.app.services;

import com.gridcalc.app.dto.ValidationResponse;
import com.gridcalc.app.exceptions.FormulaParseException;
import com.gridcalc.app.formula.FormulaParser;
import com.gridcalc.app.formula.FormulaReference;
import com.gridcalc.app.formula.ReferenceCollector;
import com.gridcalc.app.formula.ast.Expr;
import com.gridcalc.app.formula.functions.FunctionRegistry;
import com.gridcalc.app.models.CellContent;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Syntax checks for formulas that are not bound to any spreadsheet.
 */
@Service
public class FormulaService {

    private final FormulaParser parser;
    private final FunctionRegistry functionRegistry;

    public FormulaService(FormulaParser parser, FunctionRegistry functionRegistry) {
        this.parser = parser;
        this.functionRegistry = functionRegistry;
    }

    /**
     * Parses the formula and reports what it reads and calls. Unknown functions
     * still parse; they evaluate to #NAME? and are listed separately.
     */
    public ValidationResponse validateFormula(String formula) {
        String source = formula.trim();
        if (!source.startsWith(CellContent.FORMULA_MARKER)) {
            source = CellContent.FORMULA_MARKER + source;
        }
        Expr expr;
        try {
            expr = parser.parse(source);
        } catch (FormulaParseException e) {
            return ValidationResponse.invalid(e.getMessage(), e.getPosition());
        }
        List<String> references = new ArrayList<>();
        for (FormulaReference reference : ReferenceCollector.references(expr)) {
            references.add(reference.toA1());
        }
        List<String> functions = ReferenceCollector.functionNames(expr);
        List<String> unknown = new ArrayList<>();
        for (String name : functions) {
            if (!functionRegistry.contains(name)) {
                unknown.add(name);
            }
        }
        return ValidationResponse.valid(references, functions, unknown);
    }
}
