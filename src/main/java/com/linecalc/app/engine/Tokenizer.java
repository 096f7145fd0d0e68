package com.linecalc.app.engine;

import com.linecalc.app.exceptions.LexException;
import com.linecalc.app.models.Token;
import com.linecalc.app.models.TokenKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an arithmetic expression into tokens.
 * The returned list always ends with an EOF token.
 */
public class Tokenizer {

    private final String s;
    private int i;

    private Tokenizer(String s) {
        this.s = s;
    }

    public static List<Token> tokenize(String expr) {
        Tokenizer lexer = new Tokenizer(normalize(expr));
        List<Token> tokens = new ArrayList<>();
        while (true) {
            Token token = lexer.next();
            tokens.add(token);
            if (token.getKind() == TokenKind.EOF) {
                return tokens;
            }
        }
    }

    /**
     * Trims, folds unicode multiply/minus signs and rewrites 'x' used as a
     * multiplication operator to '*'.
     */
    static String normalize(String expr) {
        String s = expr.trim()
                .replace("×", "*")
                .replace("−", "-")
                .replace("–", "-")
                .replace("—", "-");
        return normalizeMulX(s);
    }

    private static String normalizeMulX(String s) {
        StringBuilder b = new StringBuilder(s.length());
        for (int idx = 0; idx < s.length(); idx++) {
            char c = s.charAt(idx);
            if ((c == 'x' || c == 'X') && isMulContext(s, idx)) {
                b.append('*');
            } else {
                b.append(c);
            }
        }
        return b.toString();
    }

    // "2 x 3" is multiplication, "max" is not
    private static boolean isMulContext(String s, int idx) {
        char left = prevNonSpace(s, idx);
        char right = nextNonSpace(s, idx + 1);
        if (left == 0 || right == 0) {
            return false;
        }
        boolean leftOk = Character.isDigit(left) || left == ')' || left == '%' || left == '$' || left == '.';
        boolean rightOk = Character.isDigit(right) || right == '(' || right == '$' || right == '.'
                || right == '\\' || Character.isLetter(right);
        return leftOk && rightOk;
    }

    private static char prevNonSpace(String s, int idx) {
        for (int j = idx - 1; j >= 0; j--) {
            if (!Character.isWhitespace(s.charAt(j))) {
                return s.charAt(j);
            }
        }
        return 0;
    }

    private static char nextNonSpace(String s, int idx) {
        for (int j = idx; j < s.length(); j++) {
            if (!Character.isWhitespace(s.charAt(j))) {
                return s.charAt(j);
            }
        }
        return 0;
    }

    private void skipSpaces() {
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
            i++;
        }
    }

    private boolean peek(char c) {
        return i < s.length() && s.charAt(i) == c;
    }

    private Token next() {
        skipSpaces();
        if (i >= s.length()) {
            return Token.eof();
        }

        char c = s.charAt(i);
        switch (c) {
            case '+':
                i++;
                return Token.of(TokenKind.PLUS, "+");
            case '-':
                i++;
                return Token.of(TokenKind.MINUS, "-");
            case '*':
                i++;
                return Token.of(TokenKind.MUL, "*");
            case '/':
                i++;
                return Token.of(TokenKind.DIV, "/");
            case '^':
                i++;
                return Token.of(TokenKind.POW, "^");
            case '(':
                i++;
                return Token.of(TokenKind.LPAREN, "(");
            case ')':
                i++;
                return Token.of(TokenKind.RPAREN, ")");
            case '>':
                i++;
                if (peek('=')) {
                    i++;
                    return Token.of(TokenKind.GTE, ">=");
                }
                return Token.of(TokenKind.GT, ">");
            case '<':
                i++;
                if (peek('=')) {
                    i++;
                    return Token.of(TokenKind.LTE, "<=");
                }
                return Token.of(TokenKind.LT, "<");
            case '=':
                i++;
                if (peek('=')) {
                    i++;
                    return Token.of(TokenKind.EQ, "==");
                }
                // a lone '=' is the result separator, not an operator
                return next();
            case '!':
                i++;
                if (peek('=')) {
                    i++;
                    return Token.of(TokenKind.NE, "!=");
                }
                throw new LexException("unexpected '!'");
            case '\\':
                return reference();
            case '$':
                return currency();
            default:
                break;
        }

        if (Character.isDigit(c) || c == '.') {
            return number();
        }
        if (Character.isLetter(c)) {
            int start = i++;
            while (i < s.length() && (Character.isLetterOrDigit(s.charAt(i)) || s.charAt(i) == '_')) {
                i++;
            }
            return Token.of(TokenKind.IDENT, s.substring(start, i).toLowerCase());
        }

        throw new LexException("unexpected character: '" + c + "'");
    }

    private Token reference() {
        i++;
        int start = i;
        while (i < s.length() && Character.isDigit(s.charAt(i))) {
            i++;
        }
        if (start == i) {
            throw new LexException("unexpected '\\'");
        }
        String digits = s.substring(start, i);
        if (digits.length() > 9) {
            throw new LexException("reference out of range: \\" + digits);
        }
        return Token.reference("\\" + digits, Integer.parseInt(digits));
    }

    private Token currency() {
        i++;
        if (i >= s.length() || !(Character.isDigit(s.charAt(i)) || s.charAt(i) == '.')) {
            throw new LexException("unexpected '$'");
        }
        int start = i;
        scanDigits();
        String literal = s.substring(start, i);
        return Token.number("$" + literal, parseNumber(literal), false);
    }

    private Token number() {
        int start = i;
        scanDigits();
        String literal = s.substring(start, i);
        double value = parseNumber(literal);
        if (peek('%')) {
            i++;
            return Token.number(literal + "%", value / 100.0, true);
        }
        return Token.number(literal, value, false);
    }

    // digits, ',' group separators and at most one '.'
    private void scanDigits() {
        boolean dotSeen = false;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (Character.isDigit(c) || c == ',') {
                i++;
            } else if (c == '.' && !dotSeen) {
                dotSeen = true;
                i++;
            } else {
                break;
            }
        }
    }

    private static double parseNumber(String literal) {
        String digits = literal.replace(",", "");
        try {
            return Double.parseDouble(digits);
        } catch (NumberFormatException e) {
            throw new LexException("malformed number: " + literal, e);
        }
    }
}
