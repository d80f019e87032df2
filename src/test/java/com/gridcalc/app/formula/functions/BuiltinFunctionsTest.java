package com.gridcalc.app.formula.functions;

import com.gridcalc.app.formula.FormulaEvaluator;
import com.gridcalc.app.formula.FormulaParser;
import com.gridcalc.app.formula.MapEvaluationContext;
import com.gridcalc.app.models.CellValue;
import com.gridcalc.app.models.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Built-in function catalog. The sheet holds a small price list:
 *
 *   A        B      C
 * 1 apple    1.5    TRUE
 * 2 banana   0.25
 * 3 cherry   4      (text "n/a")
 * 4 date     2
 */
class BuiltinFunctionsTest {

    private final FunctionRegistry registry = FunctionRegistry.withBuiltins();
    private final FormulaParser parser = new FormulaParser(registry);
    private final FormulaEvaluator evaluator = new FormulaEvaluator();
    private MapEvaluationContext context;

    @BeforeEach
    void setUp() {
        context = new MapEvaluationContext()
                .set("A1", "apple").set("B1", 1.5).set("C1", CellValue.bool(true))
                .set("A2", "banana").set("B2", 0.25)
                .set("A3", "cherry").set("B3", 4).set("C3", "n/a")
                .set("A4", "date").set("B4", 2);
    }

    private CellValue eval(String formula) {
        return evaluator.evaluate(parser.parse(formula), context);
    }

    private double number(String formula) {
        CellValue value = eval(formula);
        assertTrue(value.isNumber(), formula + " gave " + value);
        return value.getNumber();
    }

    private String text(String formula) {
        CellValue value = eval(formula);
        assertTrue(value.isString(), formula + " gave " + value);
        return value.getText();
    }

    @Test
    void testRegistryRejectsDuplicates() {
        assertTrue(registry.contains("sum"));
        assertThrows(IllegalStateException.class, () -> registry.register("SUM", 0, 0, args -> CellValue.empty()));
    }

    @Test
    void testMath() {
        assertEquals(7.75, number("=SUM(B1:B4)"));
        assertEquals(10.75, number("=SUM(B1:C4, 3)"));
        assertEquals(3, number("=PRODUCT(B1, B4)"));
        assertEquals(2.5, number("=ABS(-2.5)"));
        assertEquals(3, number("=SQRT(9)"));
        assertEquals(ErrorCode.VALUE, eval("=SQRT(-1)").getError());
        assertEquals(8, number("=POWER(2, 3)"));
        assertEquals(2, number("=LOG(100)"), 1e-12);
        assertEquals(3, number("=LOG(8, 2)"), 1e-12);
        assertEquals(1, number("=LN(EXP(1))"), 1e-12);
        assertEquals(2.35, number("=ROUND(2.345, 2)"));
        assertEquals(-3, number("=ROUND(-2.5)"));
        assertEquals(2.5, number("=FLOOR(2.5, 0.1)"));
        assertEquals(6, number("=CEILING(5.1, 2)"));
        assertEquals(ErrorCode.DIV_ZERO, eval("=FLOOR(5, 0)").getError());
        assertEquals(2, number("=MOD(-7, 3)"));
        assertEquals(-1, number("=MOD(7, -2)"));
        assertEquals(ErrorCode.DIV_ZERO, eval("=MOD(1, 0)").getError());
        assertEquals(Math.PI, number("=PI()"));
        assertEquals(-3, number("=INT(-2.5)"));
    }

    @Test
    void testSumSkipsReferencedTextButRejectsDirectText() {
        assertEquals(1.5, number("=SUM(A1:B1)"));
        assertEquals(ErrorCode.VALUE, eval("=SUM(\"abc\")").getError());
        assertEquals(5, number("=SUM(\"2\", 3)"));
        context.set("D1", CellValue.error(ErrorCode.NA));
        assertEquals(ErrorCode.NA, eval("=SUM(B1:B4, D1)").getError());
    }

    @Test
    void testStatistics() {
        assertEquals(1.9375, number("=AVERAGE(B1:B4)"));
        assertEquals(ErrorCode.DIV_ZERO, eval("=AVERAGE(A1:A4)").getError());
        assertEquals(4, number("=COUNT(B1:C4)"));
        assertEquals(2, number("=COUNT(1, \"2\")"));
        assertEquals(10, number("=COUNTA(A1:C4)"));
        assertEquals(2, number("=COUNTBLANK(C1:C4)"));
        assertEquals(4, number("=MAX(B1:B4)"));
        assertEquals(0.25, number("=MIN(B1:B4)"));
        assertEquals(0, number("=MAX(A1:A4)"));
        assertEquals(1.75, number("=MEDIAN(B1:B4)"));
        assertEquals(2, number("=MEDIAN(1, 2, 3)"));
        assertEquals(3, number("=MODE(1, 3, 3, 2, 2)"));
        assertEquals(ErrorCode.NA, eval("=MODE(1, 2, 3)").getError());
        assertEquals(2.5, number("=VAR(1, 2, 3, 4, 5)"), 1e-12);
        assertEquals(Math.sqrt(2.5), number("=STDEV(1, 2, 3, 4, 5)"), 1e-12);
        assertEquals(ErrorCode.DIV_ZERO, eval("=STDEV(1)").getError());
    }

    @Test
    void testConditionalAggregates() {
        assertEquals(7.5, number("=SUMIF(B1:B4, \">=1.5\")"));
        assertEquals(2, number("=COUNTIF(B1:B4, \"<2\")"));
        assertEquals(1, number("=COUNTIF(A1:A4, \"B*\")"));
        assertEquals(3, number("=COUNTIF(A1:A4, \"<>cherry\")"));
        assertEquals(4, number("=SUMIF(A1:A4, \"cherry\", B1:B4)"));
        assertEquals(2.125, number("=AVERAGEIF(A1:A4, \"??????*\", B1:B4)"));
        assertEquals(2, number("=COUNTIF(C1:C4, \"\")"));
        assertEquals(ErrorCode.DIV_ZERO, eval("=AVERAGEIF(A1:A4, \"kiwi\", B1:B4)").getError());
    }

    @Test
    void testLogical() {
        assertEquals("big", text("=IF(B3>3, \"big\", \"small\")"));
        assertEquals(CellValue.bool(false), eval("=IF(B3>5, \"big\")"));
        assertEquals(CellValue.bool(true), eval("=AND(B1>1, C1)"));
        assertEquals(CellValue.bool(false), eval("=AND(TRUE, FALSE)"));
        assertEquals(CellValue.bool(true), eval("=OR(FALSE, B4=2)"));
        assertEquals(ErrorCode.VALUE, eval("=AND(A1:A4)").getError());
        assertEquals(CellValue.bool(true), eval("=NOT(FALSE)"));
        assertEquals("fallback", text("=IFERROR(1/0, \"fallback\")"));
        assertEquals(3, number("=IFERROR(3, 0)"));
        assertEquals(CellValue.bool(true), eval("=ISBLANK(C2)"));
        assertEquals(CellValue.bool(true), eval("=ISNUMBER(B1)"));
        assertEquals(CellValue.bool(true), eval("=ISTEXT(A1)"));
        assertEquals(CellValue.bool(true), eval("=ISERROR(1/0)"));
        assertEquals(CellValue.bool(false), eval("=ISNA(1/0)"));
        assertEquals(CellValue.bool(true), eval("=ISNA(#N/A)"));
    }

    /**
     * IF only evaluates the branch it returns.
     */
    @Test
    void testIfIsLazy() {
        assertEquals(1, number("=IF(TRUE, 1, 1/0)"));
    }

    @Test
    void testLookups() {
        assertEquals(4, number("=VLOOKUP(\"cherry\", A1:B4, 2, FALSE)"));
        assertEquals(0.25, number("=VLOOKUP(\"bz\", A1:B4, 2)"));
        assertEquals(ErrorCode.NA, eval("=VLOOKUP(\"kiwi\", A1:B4, 2, FALSE)").getError());
        assertEquals(ErrorCode.REF, eval("=VLOOKUP(\"apple\", A1:B4, 3, FALSE)").getError());
        assertEquals(ErrorCode.VALUE, eval("=VLOOKUP(\"apple\", A1:B4, 0, FALSE)").getError());
        assertEquals("banana", text("=HLOOKUP(\"apple\", A1:B2, 2, FALSE)"));
        assertEquals("cherry", text("=INDEX(A1:B4, 3, 1)"));
        assertEquals(0.25, number("=INDEX(B1:B4, 2)"));
        assertEquals("banana", text("=INDEX(A2:C2, 1)"));
        assertEquals(ErrorCode.REF, eval("=INDEX(A1:B4, 5, 1)").getError());
        assertEquals(3, number("=MATCH(\"cherry\", A1:A4, 0)"));
        assertEquals(1, number("=MATCH(1, B2:B4)"));
        assertEquals(ErrorCode.NA, eval("=MATCH(\"kiwi\", A1:A4, 0)").getError());
    }

    @Test
    void testText() {
        assertEquals("apple-1.5", text("=CONCATENATE(A1, \"-\", B1)"));
        assertEquals("applebananacherrydate", text("=CONCAT(A1:A4)"));
        assertEquals("app", text("=LEFT(A1, 3)"));
        assertEquals("e", text("=RIGHT(A1)"));
        assertEquals("nan", text("=MID(A2, 3, 3)"));
        assertEquals(6, number("=LEN(A2)"));
        assertEquals("APPLE", text("=UPPER(A1)"));
        assertEquals("apple", text("=LOWER(\"APPLE\")"));
        assertEquals("Hello World", text("=PROPER(\"hELLO wORLD\")"));
        assertEquals("a b", text("=TRIM(\"  a   b \")"));
        assertEquals("ban-na", text("=SUBSTITUTE(\"banana\", \"a\", \"-\", 2)"));
        assertEquals("b_n_n_", text("=SUBSTITUTE(\"banana\", \"a\", \"_\")"));
        assertEquals(ErrorCode.VALUE, eval("=FIND(\"N\", \"banana\")").getError());
        assertEquals(3, number("=SEARCH(\"N\", \"banana\")"));
        assertEquals(5, number("=FIND(\"n\", \"banana\", 4)"));
        assertEquals("1,234.50", text("=TEXT(1234.5, \"#,##0.00\")"));
        assertEquals(12.5, number("=VALUE(\"12.5\")"));
        assertEquals(ErrorCode.VALUE, eval("=VALUE(\"twelve\")").getError());
    }

    @Test
    void testDates() {
        // 2024-03-15 is serial 45366
        assertEquals(45366, number("=TODAY()"));
        assertEquals(45366.5, number("=NOW()"));
        assertEquals(45366, number("=DATE(2024, 3, 15)"));
        assertEquals(45352, number("=DATE(2024, 2, 30)"));
        assertEquals(2024, number("=YEAR(45366)"));
        assertEquals(3, number("=MONTH(\"2024-03-15\")"));
        assertEquals(15, number("=DAY(TODAY())"));
        assertEquals(12, number("=HOUR(NOW())"));
        assertEquals(30, number("=MINUTE(\"2024-03-15T08:30:45\")"));
        assertEquals(45, number("=SECOND(\"2024-03-15T08:30:45\")"));
        // a Friday
        assertEquals(6, number("=WEEKDAY(TODAY())"));
        assertEquals(5, number("=WEEKDAY(TODAY(), 2)"));
        assertEquals(4, number("=WEEKDAY(TODAY(), 3)"));
        assertEquals(1, number("=DATEDIF(\"2023-01-31\", \"2024-03-15\", \"Y\")"));
        assertEquals(13, number("=DATEDIF(\"2023-01-31\", \"2024-03-15\", \"M\")"));
        assertEquals(ErrorCode.VALUE, eval("=DATEDIF(TODAY(), DATE(2000, 1, 1), \"D\")").getError());
    }
}
