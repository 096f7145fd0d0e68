package com.linecalc.app.evaluators;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Domain evaluator built from an ordered list of handlers. Handlers are tried
 * strictly in order and the first claim wins, so a more specific phrasing must
 * come before a more general one that would also match it.
 */
public abstract class HandlerChainEvaluator implements DomainEvaluator {

    private final String name;

    protected HandlerChainEvaluator(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * The chain, in priority order.
     */
    protected abstract List<Handler> handlers();

    /**
     * Hook to rewrite the expression before the chain runs.
     */
    protected String prepare(String expr, LineContext context) {
        return expr;
    }

    protected DomainResult toResult(HandlerResult claim) {
        if (claim.getValue() != null) {
            return DomainResult.numeric(claim.getText(), claim.getValue(), false);
        }
        return DomainResult.text(claim.getText());
    }

    @Override
    public Optional<DomainResult> evaluate(String expr, LineContext context) {
        String prepared = prepare(expr.trim(), context);
        String lower = prepared.toLowerCase(Locale.ROOT);
        for (Handler handler : handlers()) {
            HandlerResult result = handler.handle(prepared, lower);
            if (result.isClaimed()) {
                return Optional.of(toResult(result));
            }
        }
        return Optional.empty();
    }
}
