package com.linecalc.app.evaluators;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BaseConversionEvaluatorTest {

    private final BaseConversionEvaluator evaluator = new BaseConversionEvaluator();

    private DomainResult eval(String expr) {
        assertTrue(evaluator.accepts(expr), "should accept: " + expr);
        return evaluator.evaluate(expr, new StubLineContext(1)).orElseThrow();
    }

    @Test
    void testToHexOctBin() {
        assertEquals("0xFF", eval("255 in hex").getText());
        assertEquals("0b1010", eval("10 in bin").getText());
        assertEquals("0o12", eval("0b1010 in oct").getText());
        assertEquals("0x2A", eval("42 in hexadecimal").getText());
    }

    /**
     * Decimal results carry their value; the other bases are text.
     */
    @Test
    void testToDecimalIsNumeric() {
        DomainResult result = eval("0xff in dec");
        assertEquals("255", result.getText());
        assertTrue(result.hasValue());
        assertEquals(255, result.getValue(), 0);
        assertEquals("15", eval("0o17 in decimal").getText());
        assertFalse(eval("255 in hex").hasValue());
    }

    @Test
    void testRejectsOtherExpressions() {
        assertFalse(evaluator.accepts("2 + 3"));
        assertFalse(evaluator.accepts("255 in furlongs"));
        assertFalse(evaluator.accepts("0x in hex"));
    }
}
