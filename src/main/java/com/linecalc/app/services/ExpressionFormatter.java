package com.linecalc.app.services;

import java.util.regex.Pattern;

/**
 * Cosmetic operator spacing for display: "2+3" becomes "2 + 3".
 * Leaves CIDR prefixes ("/24"), times ("6:00"), hex literals ("0x1f")
 * and anything containing a date untouched. Applying it twice gives the
 * same text as applying it once.
 */
public final class ExpressionFormatter {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}|\\d{1,2}/\\d{1,2}/\\d{4}");

    private static final Pattern[] PATTERNS = {
            Pattern.compile("(\\S)\\s*×\\s*(?=\\S)"),
            Pattern.compile("([1-9])\\s*x\\s*(?=\\d)"),
            Pattern.compile("(\\d)\\s*\\*\\s*(?=\\d)"),
            Pattern.compile("(\\d)\\s*\\^\\s*(?=\\d)"),
            Pattern.compile("([\\d)%])\\s*\\+\\s*(?=\\S)"),
            Pattern.compile("([\\d)%])\\s*-\\s*(?=\\S)"),
            // a 1-2 digit divisor is most likely a CIDR prefix
            Pattern.compile("(\\d)\\s*/\\s*(?=\\d{3,})"),
    };
    private static final String[] REPLACEMENTS = {"$1 × ", "$1 x ", "$1 * ", "$1 ^ ", "$1 + ", "$1 - ", "$1 / "};

    private ExpressionFormatter() {
    }

    public static String format(String expr) {
        if (DATE.matcher(expr).find()) {
            return expr;
        }
        String result = WHITESPACE.matcher(expr.trim()).replaceAll(" ");
        for (int i = 0; i < PATTERNS.length; i++) {
            result = PATTERNS[i].matcher(result).replaceAll(REPLACEMENTS[i]);
        }
        return result;
    }
}
