package com.linecalc.app.exceptions;

/**
 * Thrown when attempting to access a document ID
 * that doesn't exist in the in-memory store.
 */
public class DocumentNotFoundException extends RuntimeException {
    public DocumentNotFoundException(String message) {
        super(message);
    }
}
