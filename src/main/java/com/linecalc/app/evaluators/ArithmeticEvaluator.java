package com.linecalc.app.evaluators;

import com.linecalc.app.engine.ExpressionParser;
import com.linecalc.app.engine.ResultFormatter;
import com.linecalc.app.engine.Tokenizer;
import com.linecalc.app.exceptions.ParseException;
import com.linecalc.app.models.EvaluatedLine;
import com.linecalc.app.models.Token;
import com.linecalc.app.models.TokenKind;

import java.util.List;
import java.util.Optional;

/**
 * The fallback grammar: plain arithmetic with percent, currency, functions,
 * comparisons and "\N" references to earlier lines. Accepts everything, so it
 * must be last in the dispatch order.
 *
 * A result is currency when the expression contains '$' or references a line
 * whose result is currency. Comparisons render as "true" / "false".
 */
public class ArithmeticEvaluator implements DomainEvaluator {

    private final ResultFormatter formatter;

    public ArithmeticEvaluator(ResultFormatter formatter) {
        this.formatter = formatter;
    }

    @Override
    public String getName() {
        return "arithmetic";
    }

    @Override
    public boolean accepts(String expr) {
        return true;
    }

    @Override
    public Optional<DomainResult> evaluate(String expr, LineContext context) {
        List<Token> tokens = Tokenizer.tokenize(expr);

        boolean comparison = false;
        boolean currency = expr.indexOf('$') >= 0;
        for (Token token : tokens) {
            if (token.getKind().isComparison()) {
                comparison = true;
            } else if (token.getKind() == TokenKind.REF) {
                EvaluatedLine ref = context.priorLine(token.getRef());
                if (ref != null && ref.isCurrency()) {
                    currency = true;
                }
            }
        }

        double value = new ExpressionParser(tokens, line -> resolve(context, line)).parse().getNumber();

        if (comparison) {
            return Optional.of(DomainResult.numeric(formatter.formatBoolean(value), value, false));
        }
        return Optional.of(DomainResult.numeric(formatter.format(value, currency), value, currency));
    }

    private static double resolve(LineContext context, int line) {
        EvaluatedLine ref = context.priorLine(line);
        if (ref == null) {
            throw new ParseException("bad reference \\" + line + " from line " + context.currentLine());
        }
        if (!ref.hasResult() || !ref.hasValue()) {
            throw new ParseException("unresolved reference \\" + line);
        }
        return ref.getValue();
    }
}
