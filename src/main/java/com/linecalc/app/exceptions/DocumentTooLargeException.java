package com.linecalc.app.exceptions;

/**
 * Thrown when a submitted document has more lines than
 * the configured limit (linecalc.max-lines).
 */
public class DocumentTooLargeException extends RuntimeException {
    public DocumentTooLargeException(String message) {
        super(message);
    }
}
