package com.linecalc.app.exceptions;

/**
 * Thrown when a domain evaluator recognised an expression as its own
 * but could not compute it (malformed CIDR, infeasible subnet split, ...).
 */
public class DomainException extends CalculationException {
    public DomainException(String message) {
        super(message);
    }
}
