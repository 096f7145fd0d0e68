package com.linecalc.app.evaluators;

import java.util.Optional;

/**
 * A grammar that can evaluate some kinds of expression lines.
 * Dispatch first asks {@link #accepts(String)}, a cheap pre-filter, and only
 * then calls {@link #evaluate(String, LineContext)}, which may still decline.
 */
public interface DomainEvaluator {

    /**
     * Short name used in logs.
     */
    String getName();

    boolean accepts(String expr);

    /**
     * @return the result, or empty when the expression is not this grammar's
     * @throws com.linecalc.app.exceptions.CalculationException when the expression
     *         is recognised but cannot be evaluated
     */
    Optional<DomainResult> evaluate(String expr, LineContext context);
}
