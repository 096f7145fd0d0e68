package com.linecalc.app.services;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionFormatterTest {

    @Test
    void testSpacesOperators() {
        assertEquals("2 + 3", ExpressionFormatter.format("2+3"));
        assertEquals("$100 - 20%", ExpressionFormatter.format("$100-20%"));
        assertEquals("2 * 3 ^ 2", ExpressionFormatter.format("2*3^2"));
        assertEquals("4 x 5", ExpressionFormatter.format("4x5"));
        assertEquals("(1 + 2) - 3", ExpressionFormatter.format("(1+2)-3"));
        assertEquals("1000 / 250", ExpressionFormatter.format("1000/250"));
    }

    @Test
    void testCollapsesWhitespace() {
        assertEquals("2 + 3", ExpressionFormatter.format("  2   +    3 "));
    }

    /**
     * CIDR prefixes, times, hex literals and dates keep their shape.
     */
    @Test
    void testLeavesSpecialNotationAlone() {
        assertEquals("10.0.0.0/24", ExpressionFormatter.format("10.0.0.0/24"));
        assertEquals("6:00 am seattle in kiev", ExpressionFormatter.format("6:00 am seattle in kiev"));
        assertEquals("0x1f in dec", ExpressionFormatter.format("0x1f in dec"));
        assertEquals("2025-01-01+3 days", ExpressionFormatter.format("2025-01-01+3 days"));
    }

    @Test
    void testIdempotent() {
        String[] inputs = {"2+3*4", "$1,200-10%", "\\1*2+\\2", "5-  -3", "2x3x4", "100/1000"};
        for (String input : inputs) {
            String once = ExpressionFormatter.format(input);
            assertEquals(once, ExpressionFormatter.format(once), input);
        }
    }
}
