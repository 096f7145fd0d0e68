package com.linecalc.app.engine;

import com.linecalc.app.exceptions.ParseException;

/**
 * Fixed table of single-argument functions. Trigonometry works in radians.
 */
public final class MathFunctions {

    private MathFunctions() {
    }

    public static double call(String name, double x) {
        switch (name) {
            case "sin":
                return Math.sin(x);
            case "cos":
                return Math.cos(x);
            case "tan":
                return Math.tan(x);
            case "asin":
                return Math.asin(x);
            case "acos":
                return Math.acos(x);
            case "atan":
                return Math.atan(x);
            case "sqrt":
                return Math.sqrt(x);
            case "abs":
                return Math.abs(x);
            case "ln":
                return Math.log(x);
            case "log":
                return Math.log10(x);
            default:
                throw new ParseException("unknown function: " + name);
        }
    }
}
