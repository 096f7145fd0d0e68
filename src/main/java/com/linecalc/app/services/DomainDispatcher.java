package com.linecalc.app.services;

import com.linecalc.app.evaluators.DomainEvaluator;
import com.linecalc.app.evaluators.DomainResult;
import com.linecalc.app.evaluators.LineContext;
import com.linecalc.app.exceptions.CalculationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.util.List;
import java.util.Optional;

/**
 * Tries each domain evaluator in priority order. An evaluator whose
 * pre-filter rejects the line is skipped; one that declines or fails hands
 * the line to the next. The first result wins.
 */
public class DomainDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DomainDispatcher.class);

    private final List<DomainEvaluator> evaluators;

    public DomainDispatcher(List<DomainEvaluator> evaluators) {
        this.evaluators = List.copyOf(evaluators);
    }

    public List<DomainEvaluator> getEvaluators() {
        return evaluators;
    }

    /**
     * @return the winning result, or empty when every evaluator declined or failed
     */
    public Optional<DomainResult> dispatch(String expr, LineContext context) {
        for (DomainEvaluator evaluator : evaluators) {
            if (!evaluator.accepts(expr)) {
                continue;
            }
            try {
                Optional<DomainResult> result = evaluator.evaluate(expr, context);
                if (result.isPresent()) {
                    log.debug("Line {} evaluated by {}", context.currentLine(), evaluator.getName());
                    return result;
                }
            } catch (CalculationException | DateTimeException | ArithmeticException e) {
                log.debug("Line {}: {} failed: {}", context.currentLine(), evaluator.getName(), e.getMessage());
            }
        }
        return Optional.empty();
    }
}
