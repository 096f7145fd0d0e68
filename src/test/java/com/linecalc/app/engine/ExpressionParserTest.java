package com.linecalc.app.engine;

import com.linecalc.app.exceptions.CalculationException;
import com.linecalc.app.exceptions.ParseException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for precedence, percent semantics, functions and parse errors.
 */
class ExpressionParserTest {

    private static final double EPS = 1e-9;

    private static double eval(String expr) {
        return ExpressionParser.evaluate(expr, null);
    }

    @Test
    void testPrecedence() {
        assertEquals(14, eval("2 + 3 * 4"), EPS);
        assertEquals(20, eval("(2 + 3) * 4"), EPS);
        assertEquals(3, eval("10 - 4 - 3"), EPS);
        assertEquals(5, eval("100 / 4 / 5"), EPS);
    }

    /**
     * Power is right-associative: 2^3^2 = 2^9.
     */
    @Test
    void testPowerIsRightAssociative() {
        assertEquals(512, eval("2 ^ 3 ^ 2"), EPS);
    }

    @Test
    void testPercentLaws() {
        double[] as = {200, 80, 1234.5, -40};
        double[] ps = {10, 25, 7.5, 100};
        for (double a : as) {
            for (double p : ps) {
                assertEquals(a * (1 + p / 100), eval(a + " + " + p + "%"), EPS);
                assertEquals(a * (1 - p / 100), eval(a + " - " + p + "%"), EPS);
                assertEquals(a * (p / 100), eval(a + " * " + p + "%"), EPS);
            }
        }
    }

    @Test
    void testBarePercentIsFraction() {
        assertEquals(0.5, eval("50%"), EPS);
    }

    /**
     * Parenthesised or negated percent literals still apply to the left operand.
     */
    @Test
    void testPercentSurvivesParensAndNegation() {
        assertEquals(220, eval("200 + (10%)"), EPS);
        assertEquals(180, eval("200 + -10%"), EPS);
    }

    /**
     * Once combined with another operand a percent is a plain number.
     */
    @Test
    void testPercentLosesStickinessInProduct() {
        assertEquals(200.2, eval("200 + 10% * 2"), EPS);
    }

    @Test
    void testComparisons() {
        assertEquals(1, eval("5 > 3"), EPS);
        assertEquals(0, eval("3 <= 2"), EPS);
        assertEquals(1, eval("2 + 2 == 4"), EPS);
        assertEquals(1, eval("1 != 2"), EPS);
    }

    @Test
    void testFunctions() {
        assertEquals(4, eval("sqrt(16)"), EPS);
        assertEquals(3, eval("abs(-3)"), EPS);
        assertEquals(3, eval("log(1000)"), EPS);
        assertEquals(0, eval("ln(1)"), EPS);
        assertEquals(1, eval("sin(0) + cos(0)"), EPS);
    }

    @Test
    void testDivisionByZeroIsInfinite() {
        assertTrue(Double.isInfinite(eval("1 / 0")));
    }

    @Test
    void testReferencesUseResolver() {
        assertEquals(42, ExpressionParser.evaluate("\\1 * 2", line -> 21), EPS);
        assertEquals(7, ExpressionParser.evaluate("\\1 + \\2", line -> line == 1 ? 3 : 4), EPS);
    }

    @Test
    void testResolverFailurePropagates() {
        ReferenceResolver failing = line -> {
            throw new CalculationException("unresolved reference \\" + line);
        };
        assertThrows(CalculationException.class, () -> ExpressionParser.evaluate("\\1 + 1", failing));
    }

    @Test
    void testParseErrors() {
        assertThrows(ParseException.class, () -> eval("2 +"));
        assertThrows(ParseException.class, () -> eval("(2 + 3"));
        assertThrows(ParseException.class, () -> eval("foo(2)"));
        assertThrows(ParseException.class, () -> eval("2 3"));
        assertThrows(ParseException.class, () -> eval("\\1"));
        assertThrows(ParseException.class, () -> eval(""));
    }

    /**
     * Nesting past the depth limit is a parse error, not a stack overflow.
     */
    @Test
    void testDeepNesting() {
        assertEquals(1, eval("(".repeat(100) + "1" + ")".repeat(100)), EPS);
        assertThrows(ParseException.class, () -> eval("(".repeat(50_000) + "1" + ")".repeat(50_000)));
        assertThrows(ParseException.class, () -> eval("-".repeat(50_000) + "1"));
        assertThrows(ParseException.class, () -> eval("2" + " ^ 2".repeat(50_000)));
    }
}
