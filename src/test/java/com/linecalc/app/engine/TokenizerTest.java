package com.linecalc.app.engine;

import com.linecalc.app.exceptions.LexException;
import com.linecalc.app.models.Token;
import com.linecalc.app.models.TokenKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the Tokenizer: operators, literals, references and lexical errors.
 */
class TokenizerTest {

    private static List<TokenKind> kinds(String expr) {
        List<TokenKind> kinds = new ArrayList<>();
        for (Token t : Tokenizer.tokenize(expr)) {
            kinds.add(t.getKind());
        }
        return kinds;
    }

    @Test
    void testSimpleExpression() {
        assertEquals(List.of(TokenKind.NUMBER, TokenKind.PLUS, TokenKind.NUMBER, TokenKind.EOF), kinds("2 + 3"));
    }

    /**
     * A lone '=' is the result separator and produces no token.
     */
    @Test
    void testLoneEqualsIsSkipped() {
        assertEquals(List.of(TokenKind.NUMBER, TokenKind.PLUS, TokenKind.NUMBER, TokenKind.EOF), kinds("2 + 3 ="));
    }

    @Test
    void testComparisonOperators() {
        assertEquals(TokenKind.GTE, Tokenizer.tokenize("5 >= 3").get(1).getKind());
        assertEquals(TokenKind.LTE, Tokenizer.tokenize("5 <= 3").get(1).getKind());
        assertEquals(TokenKind.EQ, Tokenizer.tokenize("5 == 3").get(1).getKind());
        assertEquals(TokenKind.NE, Tokenizer.tokenize("5 != 3").get(1).getKind());
        assertEquals(TokenKind.GT, Tokenizer.tokenize("5 > 3").get(1).getKind());
        assertTrue(TokenKind.LT.isComparison());
        assertFalse(TokenKind.PLUS.isComparison());
    }

    @Test
    void testPercentLiteral() {
        Token t = Tokenizer.tokenize("20%").get(0);
        assertEquals(TokenKind.NUMBER, t.getKind());
        assertEquals(0.2, t.getNumber(), 1e-12);
        assertTrue(t.isPercent());
    }

    @Test
    void testCurrencyWithGrouping() {
        Token t = Tokenizer.tokenize("$1,234.50").get(0);
        assertEquals(1234.5, t.getNumber(), 1e-12);
        assertFalse(t.isPercent());
        assertEquals("$1,234.50", t.getText());
    }

    @Test
    void testReference() {
        Token t = Tokenizer.tokenize("\\12 * 2").get(0);
        assertEquals(TokenKind.REF, t.getKind());
        assertEquals(12, t.getRef());
    }

    /**
     * 'x' between operands is multiplication; inside a word it is a letter.
     */
    @Test
    void testMultiplicationX() {
        assertEquals(List.of(TokenKind.NUMBER, TokenKind.MUL, TokenKind.NUMBER, TokenKind.EOF), kinds("2x3"));
        assertEquals(List.of(TokenKind.NUMBER, TokenKind.MUL, TokenKind.NUMBER, TokenKind.EOF), kinds("4 X 5"));
        assertEquals(List.of(TokenKind.NUMBER, TokenKind.MUL, TokenKind.NUMBER, TokenKind.EOF), kinds("6 × 7"));
        Token ident = Tokenizer.tokenize("max").get(0);
        assertEquals(TokenKind.IDENT, ident.getKind());
        assertEquals("max", ident.getText());
    }

    @Test
    void testUnicodeMinus() {
        assertEquals(List.of(TokenKind.NUMBER, TokenKind.MINUS, TokenKind.NUMBER, TokenKind.EOF), kinds("5 − 2"));
    }

    @Test
    void testIdentifiersAreLowerCased() {
        assertEquals("sqrt", Tokenizer.tokenize("SQRT(4)").get(0).getText());
    }

    @Test
    void testLexErrors() {
        assertThrows(LexException.class, () -> Tokenizer.tokenize("\\"));
        assertThrows(LexException.class, () -> Tokenizer.tokenize("2 + \\x"));
        assertThrows(LexException.class, () -> Tokenizer.tokenize("$"));
        assertThrows(LexException.class, () -> Tokenizer.tokenize("!5"));
        assertThrows(LexException.class, () -> Tokenizer.tokenize("2 # 3"));
        assertThrows(LexException.class, () -> Tokenizer.tokenize("\\12345678901"));
    }
}
