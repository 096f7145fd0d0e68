package com.linecalc.app.evaluators;

/**
 * One phrasing recognised by a domain evaluator. Receives the expression
 * as typed and lower-cased. Returns {@link HandlerResult#notMine()} when the
 * phrasing does not match; throws {@link com.linecalc.app.exceptions.DomainException}
 * when it matches but cannot be computed.
 */
@FunctionalInterface
public interface Handler {
    HandlerResult handle(String expr, String exprLower);
}
