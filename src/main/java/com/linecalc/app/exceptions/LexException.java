package com.linecalc.app.exceptions;

/**
 * Thrown by the tokenizer for input it cannot split into tokens,
 * e.g. a dangling '\' or '$', or an unknown character.
 */
public class LexException extends CalculationException {
    public LexException(String message) {
        super(message);
    }

    public LexException(String message, Throwable cause) {
        super(message, cause);
    }
}
