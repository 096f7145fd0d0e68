package com.linecalc.app.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Renders evaluated numbers for display. Never fails: NaN and infinities
 * come out as "NaN".
 */
public class ResultFormatter {

    public static final int DEFAULT_FRACTION_DIGITS = 10;

    private final int fractionDigits;

    public ResultFormatter() {
        this(DEFAULT_FRACTION_DIGITS);
    }

    public ResultFormatter(int fractionDigits) {
        if (fractionDigits < 0) {
            throw new IllegalArgumentException("fractionDigits must be >= 0: " + fractionDigits);
        }
        this.fractionDigits = fractionDigits;
    }

    public String format(double value, boolean currency) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return "NaN";
        }
        return currency ? formatCurrency(value) : formatPlain(value);
    }

    /**
     * Comparison results: 1 is "true", anything else "false".
     */
    public String formatBoolean(double value) {
        return value == 1 ? "true" : "false";
    }

    private String formatPlain(double value) {
        String s = new BigDecimal(value).setScale(fractionDigits, RoundingMode.HALF_EVEN).toPlainString();
        if (s.indexOf('.') >= 0) {
            s = trimRight(trimRight(s, '0'), '.');
        }
        String intPart = s;
        String fracPart = "";
        int dot = s.indexOf('.');
        if (dot >= 0) {
            intPart = s.substring(0, dot);
            fracPart = s.substring(dot);
        }
        return groupThousands(intPart) + fracPart;
    }

    private static String formatCurrency(double value) {
        String s = BigDecimal.valueOf(Math.abs(value)).setScale(2, RoundingMode.HALF_UP).toPlainString();
        int dot = s.indexOf('.');
        String out = groupThousands(s.substring(0, dot)) + s.substring(dot);
        if (value < 0) {
            out = "-" + out;
        }
        return "$" + out;
    }

    static String groupThousands(String digits) {
        if (digits.isEmpty()) {
            return digits;
        }
        String sign = "";
        if (digits.startsWith("-")) {
            sign = "-";
            digits = digits.substring(1);
        }
        int n = digits.length();
        if (n <= 3) {
            return sign + digits;
        }
        int rem = n % 3;
        if (rem == 0) {
            rem = 3;
        }
        StringBuilder b = new StringBuilder(n + n / 3 + 1);
        b.append(sign).append(digits, 0, rem);
        for (int i = rem; i < n; i += 3) {
            b.append(',').append(digits, i, i + 3);
        }
        return b.toString();
    }

    private static String trimRight(String s, char c) {
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == c) {
            end--;
        }
        return s.substring(0, end);
    }
}
