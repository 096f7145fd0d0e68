package com.linecalc.app.evaluators;

import com.linecalc.app.exceptions.DomainException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the CIDR handler chain, including handler ordering.
 */
class NetworkEvaluatorTest {

    private NetworkEvaluator evaluator;
    private LineContext context;

    @BeforeEach
    void setUp() {
        evaluator = new NetworkEvaluator();
        context = new StubLineContext(1);
    }

    private String eval(String expr) {
        assertTrue(evaluator.accepts(expr), "should accept: " + expr);
        Optional<DomainResult> result = evaluator.evaluate(expr, context);
        assertTrue(result.isPresent(), "should claim: " + expr);
        return result.get().getText();
    }

    @Test
    void testBareCidrInfo() {
        String text = eval("10.100.0.0/24");
        assertTrue(text.contains("Network: 10.100.0.0/24"));
        assertTrue(text.contains("Hosts: 254"));
        assertTrue(text.contains("Mask: 255.255.255.0"));
        assertTrue(text.contains("Broadcast: 10.100.0.255"));
    }

    /**
     * Host counts are numeric so later lines can use them.
     */
    @Test
    void testHostCount() {
        DomainResult result = evaluator.evaluate("hosts in 10.0.0.0/24", context).orElseThrow();
        assertEquals("254 hosts", result.getText());
        assertTrue(result.hasValue());
        assertEquals(254, result.getValue());
        assertEquals("14 hosts", eval("how many hosts in /28"));
    }

    /**
     * "wildcard mask for /24" also matches the general mask handler; the wildcard one must win.
     */
    @Test
    void testWildcardBeforeMask() {
        assertEquals("0.0.0.255", eval("wildcard mask for /24"));
        assertEquals("255.255.255.0", eval("mask for /24"));
        assertEquals("255.255.255.192", eval("netmask /26"));
    }

    @Test
    void testPrefixFromMask() {
        assertEquals("/20", eval("prefix for 255.255.240.0"));
    }

    @Test
    void testSplits() {
        assertEquals("1: 10.0.0.0/25 [126h]\n2: 10.0.0.128/25 [126h]", eval("split 10.0.0.0/24 to 2 subnets"));
        String byHosts = eval("split 10.0.0.0/24 into subnets with 60 hosts");
        assertTrue(byHosts.startsWith("1: 10.0.0.0/26 [62h]"));
        assertEquals(4, byHosts.split("\n").length);
    }

    @Test
    void testMembershipAndNeighbours() {
        assertEquals("yes", eval("is 192.168.1.77 in 192.168.1.0/24"));
        assertEquals("no", eval("is 192.168.2.1 in 192.168.1.0/24"));
        assertEquals("10.0.1.0/24", eval("next subnet after 10.0.0.0/24"));
        assertEquals("10.0.0.255", eval("broadcast for 10.0.0.17/24"));
        assertEquals("10.0.0.0/24", eval("network for 10.0.0.17/24"));
    }

    @Test
    void testMalformedCidrFails() {
        assertThrows(DomainException.class, () -> evaluator.evaluate("10.0.0.0/40", context));
        assertThrows(DomainException.class, () -> evaluator.evaluate("split 10.0.0.0/31 to 8 subnets", context));
    }

    @Test
    void testAcceptsPreFilter() {
        assertFalse(evaluator.accepts("2 + 3"));
        assertFalse(evaluator.accepts("what is 15% of 200"));
        assertTrue(evaluator.accepts("subnet info for 10.0.0.0/8"));
    }

    /**
     * Accepted by the pre-filter but not claimed by any handler.
     */
    @Test
    void testDeclinesUnknownPhrasing() {
        assertTrue(evaluator.evaluate("split the bill", context).isEmpty());
    }
}
