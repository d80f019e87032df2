package com.gridcalc.app.formula;

import com.gridcalc.app.formula.functions.FunctionRegistry;
import com.gridcalc.app.models.CellValue;
import com.gridcalc.app.models.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Operator semantics and error propagation, evaluated against an in-memory sheet.
 */
class FormulaEvaluatorTest {

    private final FormulaParser parser = new FormulaParser(FunctionRegistry.withBuiltins());
    private final FormulaEvaluator evaluator = new FormulaEvaluator();
    private MapEvaluationContext context;

    @BeforeEach
    void setUp() {
        context = new MapEvaluationContext()
                .set("A1", 5)
                .set("A2", 10)
                .set("A3", "hello")
                .set("B1", CellValue.bool(true))
                .set("B2", "42");
    }

    private CellValue eval(String formula) {
        return evaluator.evaluate(parser.parse(formula), context);
    }

    @Test
    void testArithmetic() {
        assertEquals(CellValue.number(15), eval("=A1+A2"));
        assertEquals(CellValue.number(7), eval("=1+2*3"));
        assertEquals(CellValue.number(9), eval("=(1+2)*3"));
        assertEquals(CellValue.number(-4), eval("=-2^2"));
        assertEquals(CellValue.number(512), eval("=2^3^2"));
        assertEquals(CellValue.number(0.5), eval("=50%"));
        assertEquals(CellValue.number(0.5), eval("=2^-1"));
    }

    @Test
    void testCoercions() {
        // numeric text and booleans take part in arithmetic
        assertEquals(CellValue.number(43), eval("=B2+1"));
        assertEquals(CellValue.number(2), eval("=B1+1"));
        assertEquals(CellValue.error(ErrorCode.VALUE), eval("=A3+1"));
        assertEquals(CellValue.string("5hello"), eval("=A1&A3"));
        assertEquals(CellValue.string("TRUE!"), eval("=B1&\"!\""));
    }

    @Test
    void testEmptyCells() {
        assertEquals(CellValue.number(0), eval("=Z99"));
        assertEquals(CellValue.number(1), eval("=Z99+1"));
        assertEquals(CellValue.string("x"), eval("=Z99&\"x\""));
        assertEquals(CellValue.bool(true), eval("=Z99=0"));
        assertEquals(CellValue.bool(true), eval("=Z99=\"\""));
    }

    @Test
    void testComparisons() {
        assertEquals(CellValue.bool(true), eval("=A1<A2"));
        assertEquals(CellValue.bool(true), eval("=\"abc\"=\"ABC\""));
        assertEquals(CellValue.bool(true), eval("=\"b\">\"a\""));
        // text sorts after numbers
        assertEquals(CellValue.bool(true), eval("=\"1\">1000"));
        assertEquals(CellValue.bool(false), eval("=A1<>5"));
        assertEquals(CellValue.bool(true), eval("=A2>=10"));
    }

    @Test
    void testDivisionByZeroPropagates() {
        assertEquals(CellValue.error(ErrorCode.DIV_ZERO), eval("=1/0"));
        assertEquals(CellValue.error(ErrorCode.DIV_ZERO), eval("=(1/0)+1"));
        assertEquals(CellValue.error(ErrorCode.DIV_ZERO), eval("=1/Z99"));
        assertEquals(CellValue.error(ErrorCode.DIV_ZERO), eval("=0^-1"));

        context.set("C1", CellValue.error(ErrorCode.NA));
        assertEquals(CellValue.error(ErrorCode.NA), eval("=C1*2"));
        assertEquals(CellValue.error(ErrorCode.NA), eval("=-C1"));
    }

    @Test
    void testLeftmostErrorWins() {
        context.set("C1", CellValue.error(ErrorCode.NA));
        assertEquals(CellValue.error(ErrorCode.NA), eval("=C1+1/0"));
        assertEquals(CellValue.error(ErrorCode.DIV_ZERO), eval("=1/0+C1"));
    }

    @Test
    void testNamesAndFunctions() {
        context.variable("rate", CellValue.number(0.25));
        assertEquals(CellValue.number(2.5), eval("=A2*Rate"));
        assertEquals(CellValue.error(ErrorCode.NAME), eval("=Undefined+1"));
        assertEquals(CellValue.error(ErrorCode.NAME), eval("=NOSUCHFUNCTION(1)"));
        assertEquals(CellValue.error(ErrorCode.VALUE), eval("=ABS(1,2)"));
    }

    @Test
    void testRangeInScalarPosition() {
        assertEquals(CellValue.error(ErrorCode.VALUE), eval("=A1:A2+1"));
        assertEquals(CellValue.number(6), eval("=A1:A1+1"));
    }

    @Test
    void testUnknownSheetIsRefError() {
        assertEquals(CellValue.error(ErrorCode.REF), eval("=Missing!A1"));
        assertEquals(CellValue.error(ErrorCode.REF), eval("=SUM(Missing!A1:B2)"));
    }

    @Test
    void testOverflowIsValueError() {
        assertEquals(CellValue.error(ErrorCode.VALUE), eval("=10^400"));
    }
}
