package com.linecalc.app.exceptions;

/**
 * Base class for everything that can go wrong while evaluating one line.
 * The line orchestrator catches these and renders the line as "ERR";
 * they never cross the evaluation boundary.
 */
public class CalculationException extends RuntimeException {
    public CalculationException(String message) {
        super(message);
    }

    public CalculationException(String message, Throwable cause) {
        super(message, cause);
    }
}
