package com.linecalc.app.services;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LineSyntaxTest {

    /**
     * The separator is the last spaced '=', never part of a comparison.
     */
    @Test
    void testFindResultEquals() {
        assertEquals(6, LineSyntax.findResultEquals("2 + 3 ="));
        assertEquals(6, LineSyntax.findResultEquals("2 + 3 = 5"));
        assertEquals(7, LineSyntax.findResultEquals("5 >= 3 ="));
        assertEquals(-1, LineSyntax.findResultEquals("5 == 5"));
        assertEquals(-1, LineSyntax.findResultEquals("5 >= 3"));
        assertEquals(-1, LineSyntax.findResultEquals("abc=="));
        assertEquals(-1, LineSyntax.findResultEquals("no separator"));
    }

    @Test
    void testLineKinds() {
        assertTrue(LineSyntax.isComment("  # heading"));
        assertFalse(LineSyntax.isComment("2 + 3 = 5 # note"));
        assertTrue(LineSyntax.isContinuation("> Mask: 255.255.255.0"));
        assertTrue(LineSyntax.isContinuation("  > indented"));
        assertTrue(LineSyntax.isContinuation(">"));
        assertFalse(LineSyntax.isContinuation("5 > 3 ="));
        assertTrue(LineSyntax.isBlank("   "));
    }

    @Test
    void testStripResult() {
        assertEquals("2 + 3 =", LineSyntax.stripResult("2 + 3 = 5"));
        assertEquals("2 + 3 = # my note", LineSyntax.stripResult("2 + 3 = 5 # my note"));
        assertEquals("no result", LineSyntax.stripResult("no result"));
    }

    @Test
    void testHasResult() {
        assertTrue(LineSyntax.hasResult("2 + 3 = 5"));
        assertFalse(LineSyntax.hasResult("2 + 3 ="));
        assertFalse(LineSyntax.hasResult("2 + 3 = # note"));
        assertFalse(LineSyntax.hasResult("plain text"));
    }
}
