package com.linecalc.app.services;

import com.linecalc.app.evaluators.DomainEvaluator;
import com.linecalc.app.evaluators.DomainResult;
import com.linecalc.app.evaluators.LineContext;
import com.linecalc.app.exceptions.DomainException;
import com.linecalc.app.models.EvaluatedLine;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Dispatch order, fall-through on decline and on failure.
 */
class DomainDispatcherTest {

    private static final LineContext NO_LINES = new LineContext() {
        @Override
        public int currentLine() {
            return 1;
        }

        @Override
        public EvaluatedLine priorLine(int lineNumber) {
            return null;
        }
    };

    private final List<String> calls = new ArrayList<>();

    private DomainEvaluator evaluator(String name, boolean accepts, Optional<DomainResult> result, boolean fails) {
        return new DomainEvaluator() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public boolean accepts(String expr) {
                return accepts;
            }

            @Override
            public Optional<DomainResult> evaluate(String expr, LineContext context) {
                calls.add(name);
                if (fails) {
                    throw new DomainException(name + " failed");
                }
                return result;
            }
        };
    }

    @Test
    void testFirstClaimWins() {
        DomainDispatcher dispatcher = new DomainDispatcher(List.of(
                evaluator("a", true, Optional.of(DomainResult.text("from a")), false),
                evaluator("b", true, Optional.of(DomainResult.text("from b")), false)));
        assertEquals("from a", dispatcher.dispatch("x", NO_LINES).orElseThrow().getText());
        assertEquals(List.of("a"), calls);
    }

    @Test
    void testRejectedPreFilterIsNotEvaluated() {
        DomainDispatcher dispatcher = new DomainDispatcher(List.of(
                evaluator("a", false, Optional.of(DomainResult.text("from a")), false),
                evaluator("b", true, Optional.of(DomainResult.text("from b")), false)));
        assertEquals("from b", dispatcher.dispatch("x", NO_LINES).orElseThrow().getText());
        assertEquals(List.of("b"), calls);
    }

    @Test
    void testDeclineAndFailureFallThrough() {
        DomainDispatcher dispatcher = new DomainDispatcher(List.of(
                evaluator("declines", true, Optional.empty(), false),
                evaluator("fails", true, Optional.empty(), true),
                evaluator("last", true, Optional.of(DomainResult.numeric("7", 7, false)), false)));
        DomainResult result = dispatcher.dispatch("x", NO_LINES).orElseThrow();
        assertEquals("7", result.getText());
        assertEquals(List.of("declines", "fails", "last"), calls);
    }

    @Test
    void testAllFailIsEmpty() {
        DomainDispatcher dispatcher = new DomainDispatcher(List.of(
                evaluator("fails", true, Optional.empty(), true)));
        assertTrue(dispatcher.dispatch("x", NO_LINES).isEmpty());
    }
}
