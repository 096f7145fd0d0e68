package com.linecalc.app.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResultFormatterTest {

    private final ResultFormatter formatter = new ResultFormatter();

    @Test
    void testPlainNumbers() {
        assertEquals("5", formatter.format(5, false));
        assertEquals("1,234,567", formatter.format(1234567, false));
        assertEquals("-1,234.5", formatter.format(-1234.5, false));
        assertEquals("0.3", formatter.format(0.1 + 0.2, false));
        assertEquals("0.3333333333", formatter.format(1.0 / 3, false));
        assertEquals("0", formatter.format(0, false));
    }

    @Test
    void testCurrency() {
        assertEquals("$80.00", formatter.format(80, true));
        assertEquals("$1,234.57", formatter.format(1234.567, true));
        assertEquals("$0.05", formatter.format(0.05, true));
    }

    /**
     * Cents that round to 100 carry into the whole part.
     */
    @Test
    void testCurrencyCentsCarry() {
        assertEquals("$1.00", formatter.format(0.999, true));
        assertEquals("$1,000.00", formatter.format(999.996, true));
    }

    /**
     * Amounts past the long range still render with exactly two decimals.
     */
    @Test
    void testHugeCurrency() {
        assertEquals("$10,000,000,000,000,000,000.00", formatter.format(1e19, true));
        assertEquals("$-10,000,000,000,000,000,000.00", formatter.format(-1e19, true));
        assertEquals("$1,000,000,000,000,000,000,000,000,000,000.00", formatter.format(1e30, true));
    }

    @Test
    void testNegativeCurrencyKeepsSignAfterDollar() {
        assertEquals("$-80.00", formatter.format(-80, true));
    }

    @Test
    void testNonFiniteIsNaN() {
        assertEquals("NaN", formatter.format(Double.NaN, false));
        assertEquals("NaN", formatter.format(Double.POSITIVE_INFINITY, true));
        assertEquals("NaN", formatter.format(Double.NEGATIVE_INFINITY, false));
    }

    @Test
    void testBoolean() {
        assertEquals("true", formatter.formatBoolean(1));
        assertEquals("false", formatter.formatBoolean(0));
    }

    @Test
    void testConfiguredFractionDigits() {
        assertEquals("0.33", new ResultFormatter(2).format(1.0 / 3, false));
        assertThrows(IllegalArgumentException.class, () -> new ResultFormatter(-1));
    }

    @Test
    void testGroupThousands() {
        assertEquals("999", ResultFormatter.groupThousands("999"));
        assertEquals("1,000", ResultFormatter.groupThousands("1000"));
        assertEquals("-12,345,678", ResultFormatter.groupThousands("-12345678"));
    }
}
