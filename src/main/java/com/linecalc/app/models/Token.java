package com.linecalc.app.models;

/**
 * A single lexical token.
 * NUMBER tokens carry their value (already divided by 100 for percent literals),
 * REF tokens carry the referenced 1-based line number.
 */
public class Token {
    private final TokenKind kind;
    private final String text;
    private final double number;
    private final int ref;
    private final boolean percent;

    private Token(TokenKind kind, String text, double number, int ref, boolean percent) {
        this.kind = kind;
        this.text = text;
        this.number = number;
        this.ref = ref;
        this.percent = percent;
    }

    public static Token of(TokenKind kind, String text) {
        return new Token(kind, text, 0, 0, false);
    }

    public static Token number(String text, double value, boolean percent) {
        return new Token(TokenKind.NUMBER, text, value, 0, percent);
    }

    public static Token reference(String text, int line) {
        return new Token(TokenKind.REF, text, 0, line, false);
    }

    public static Token eof() {
        return new Token(TokenKind.EOF, "", 0, 0, false);
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public double getNumber() {
        return number;
    }

    public int getRef() {
        return ref;
    }

    public boolean isPercent() {
        return percent;
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")";
    }
}
