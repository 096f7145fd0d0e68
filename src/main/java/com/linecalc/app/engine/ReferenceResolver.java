package com.linecalc.app.engine;

/**
 * Resolves a "\N" reference to the numeric value of line N (1-based).
 * Implementations throw {@link com.linecalc.app.exceptions.ParseException}
 * when the line cannot be referenced.
 */
@FunctionalInterface
public interface ReferenceResolver {
    double resolve(int line);
}
