package com.linecalc.app.exceptions;

/**
 * Thrown when a token stream is not a valid expression:
 * missing operand, unmatched parenthesis, unknown function,
 * or a reference that cannot be resolved (self, forward, failed line).
 */
public class ParseException extends CalculationException {
    public ParseException(String message) {
        super(message);
    }
}
