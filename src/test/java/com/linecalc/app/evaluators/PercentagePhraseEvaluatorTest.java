package com.linecalc.app.evaluators;

import com.linecalc.app.engine.ResultFormatter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PercentagePhraseEvaluatorTest {

    private PercentagePhraseEvaluator evaluator;

    @BeforeEach
    void setUp() {
        evaluator = new PercentagePhraseEvaluator(new ResultFormatter());
    }

    private DomainResult eval(String expr) {
        assertTrue(evaluator.accepts(expr), "should accept: " + expr);
        return evaluator.evaluate(expr, new StubLineContext(1)).orElseThrow();
    }

    @Test
    void testPercentOf() {
        DomainResult result = eval("what is 15% of 200");
        assertEquals("30", result.getText());
        assertTrue(result.hasValue());
        assertEquals(30, result.getValue(), 1e-9);
        assertEquals("30", eval("15% of 200").getText());
    }

    @Test
    void testWhatPercent() {
        assertEquals("25.00%", eval("50 is what % of 200").getText());
        assertEquals("undefined (division by zero)", eval("50 is what percent of 0").getText());
    }

    /**
     * "decreased by" must not be read as an increase.
     */
    @Test
    void testIncreaseAndDecrease() {
        assertEquals("120", eval("increase 100 by 20%").getText());
        assertEquals("120", eval("100 increased by 20%").getText());
        assertEquals("425", eval("decrease 500 by 15%").getText());
        assertEquals("425", eval("500 decreased by 15%").getText());
    }

    @Test
    void testPercentChange() {
        assertEquals("+50.00%", eval("percent change from 50 to 75").getText());
        assertEquals("-20.00%", eval("percentage change 100 to 80").getText());
    }

    @Test
    void testTip() {
        assertEquals("Tip: $17.10, Total: $102.60", eval("tip 20% on $85.50").getText());
        assertEquals("Tip: $3.00, Total: $23.00", eval("15% tip on 20").getText());
    }

    @Test
    void testSplitBill() {
        assertEquals("Per person: $37.50", eval("$150 split 4 ways").getText());
        assertEquals("Per person: $30.00", eval("split $90 3 ways").getText());
        assertEquals("Total: $240.00 (incl. $40.00 tip), Per person: $60.00",
                eval("$200 split 4 ways with 20% tip").getText());
    }

    @Test
    void testAcceptsPreFilter() {
        assertFalse(evaluator.accepts("2 + 3"));
        assertFalse(evaluator.accepts("$100 - 20%"));
    }
}
