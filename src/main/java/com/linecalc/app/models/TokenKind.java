package com.linecalc.app.models;

/**
 * Kinds of tokens produced by the tokenizer.
 */
public enum TokenKind {
    EOF,
    NUMBER,
    IDENT,
    REF,
    PLUS,
    MINUS,
    MUL,
    DIV,
    POW,
    LPAREN,
    RPAREN,
    GT,
    LT,
    GTE,
    LTE,
    EQ,
    NE;

    public boolean isComparison() {
        return this == GT || this == LT || this == GTE || this == LTE || this == EQ || this == NE;
    }
}
